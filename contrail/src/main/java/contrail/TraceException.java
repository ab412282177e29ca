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

/**
 * Thrown when tracing is used incorrectly, such as asking for the current span outside a trace, or
 * for a current span of the wrong type.
 */
public class TraceException extends RuntimeException {
  public TraceException(String message) {
    super(message);
  }

  private static final long serialVersionUID = 1L;
}
