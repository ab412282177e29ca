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
package contrail;

import java.util.Map;

final class NoopScopedSpan extends ScopedSpan {
  static final NoopScopedSpan INSTANCE = new NoopScopedSpan();

  @Override public boolean isNoop() {
    return true;
  }

  @Override public Span span() {
    return null;
  }

  @Override public ScopedSpan updateData(Map<String, ?> patch) {
    return this;
  }

  @Override public ScopedSpan error(Throwable throwable) {
    return this;
  }

  @Override public void finish() {
  }

  @Override public String toString() {
    return "NoopScopedSpan";
  }
}
