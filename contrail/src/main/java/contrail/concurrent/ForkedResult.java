/*
 * Copyright 2024 The Contrail Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License"); you may not use this file except
 * in compliance with the License. You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software distributed under the License
 * is distributed on an "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied. See the License for the specific language governing permissions and limitations under
 * the License.
 */
package contrail.concurrent;

import contrail.internal.Nullable;
import java.io.Serializable;

/** What a child process sends back: the task's return value or what it threw. */
final class ForkedResult implements Serializable {
  static ForkedResult success(@Nullable Object value) {
    return new ForkedResult(value, null);
  }

  static ForkedResult failure(Throwable error) {
    return new ForkedResult(null, error);
  }

  @Nullable final Object value;
  @Nullable final Throwable error;

  ForkedResult(@Nullable Object value, @Nullable Throwable error) {
    this.value = value;
    this.error = error;
  }

  /** Returns the value or throws the child's exception as-is. */
  @Nullable Object get() throws Exception {
    if (error == null) return value;
    if (error instanceof Exception) throw (Exception) error;
    if (error instanceof Error) throw (Error) error;
    throw new IllegalStateException("child process failed", error);
  }

  @Override public String toString() {
    if (error != null) return "ForkedResult{error=" + error + "}";
    return "ForkedResult{value=" + value + "}";
  }

  private static final long serialVersionUID = 1L;
}
