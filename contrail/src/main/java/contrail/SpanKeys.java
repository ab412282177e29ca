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

/** Keys written into span data by {@link Tracer} and {@link Tracing}. */
public final class SpanKeys {
  /** When the span was placed in scope, as an ISO-8601 offset date-time. */
  public static final String START_TIME = "start_time";
  /** When the span left scope. Absent if the work never finished, for example a killed process. */
  public static final String END_TIME = "end_time";

  /** Object describing a traced call: {@link #NAME}, {@link #ARGUMENTS} and {@link #RETURNED}. */
  public static final String TRACE_FUNCTION = "trace_function";
  public static final String NAME = "name";
  public static final String ARGUMENTS = "arguments";
  public static final String RETURNED = "returned";

  /** Object describing a failure: {@link #TYPE}, {@link #VALUE} and {@link #TRACEBACK}. */
  public static final String EXCEPTION = "exception";
  public static final String TYPE = "type";
  public static final String VALUE = "value";
  public static final String TRACEBACK = "traceback";

  SpanKeys() {
  }
}
