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
package contrail.internal;

import java.io.PrintWriter;
import java.io.StringWriter;

public final class Throwables {
  // Taken from RxJava throwIfFatal, which was taken from scala
  public static void propagateIfFatal(Throwable t) {
    if (t instanceof VirtualMachineError) {
      throw (VirtualMachineError) t;
    } else if (t instanceof LinkageError) {
      throw (LinkageError) t;
    }
  }

  /** Returns the stack trace as {@link Throwable#printStackTrace()} would print it. */
  public static String stackTrace(Throwable t) {
    StringWriter result = new StringWriter();
    try (PrintWriter writer = new PrintWriter(result)) {
      t.printStackTrace(writer);
    }
    return result.toString();
  }

  Throwables() {
  }
}
