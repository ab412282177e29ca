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

import contrail.propagation.CurrentSpanContext.Scope;
import java.io.IOException;
import java.io.NotSerializableException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

/**
 * Entry point of child processes started by {@link TracingProcess} and {@link
 * TracingProcessPool}. Joins the parent's span, runs the task and writes back its result.
 *
 * <p>Usage: {@code ForkedTaskMain <task file> <result file>}. Exits with 0 when the task
 * succeeded, 1 when it threw, and 2 on bad usage.
 */
public final class ForkedTaskMain {

  public static void main(String[] args) throws IOException {
    if (args.length != 2) {
      System.err.println("Usage: ForkedTaskMain <task file> <result file>");
      System.exit(2);
      return;
    }
    Path taskFile = Paths.get(args[0]), resultFile = Paths.get(args[1]);

    ForkedResult result;
    try {
      result = run(ForkedProcess.read(taskFile));
    } catch (ClassNotFoundException e) {
      result = ForkedResult.failure(e);
    }

    try {
      ForkedProcess.write(resultFile, result);
    } catch (NotSerializableException e) {
      result = ForkedResult.failure(e);
      ForkedProcess.write(resultFile, result);
    }
    // exit even if the task left non-daemon threads running
    System.exit(result.error == null ? 0 : 1);
  }

  static ForkedResult run(Object task) {
    try (Scope scope = ProcessPropagation.joinParent()) {
      if (task instanceof Callable) return ForkedResult.success(((Callable<?>) task).call());
      ((Runnable) task).run();
      return ForkedResult.success(null);
    } catch (Exception | Error e) {
      return ForkedResult.failure(e);
    }
  }

  ForkedTaskMain() {
  }
}
