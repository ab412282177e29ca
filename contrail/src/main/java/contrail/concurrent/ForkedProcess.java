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

import contrail.SpanReference;
import contrail.internal.JvmLauncher;
import contrail.internal.Nullable;
import contrail.internal.Platform;
import java.io.IOException;
import java.io.InputStream;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.io.OutputStream;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A task running in a child JVM started by {@link ForkedTaskMain}. The task and its result travel
 * through temporary files using Java serialization.
 */
final class ForkedProcess {

  static ForkedProcess start(Serializable task, @Nullable SpanReference parent) throws IOException {
    Path taskFile = Files.createTempFile("contrail-task", ".ser");
    Path resultFile = Files.createTempFile("contrail-result", ".ser");
    try {
      write(taskFile, task);
      ProcessBuilder builder = JvmLauncher.newProcess(ForkedTaskMain.class,
        taskFile.toString(), resultFile.toString()).inheritIO();
      ProcessPropagation.inject(builder, parent);
      return new ForkedProcess(builder.start(), taskFile, resultFile);
    } catch (IOException | RuntimeException e) {
      deleteQuietly(taskFile);
      deleteQuietly(resultFile);
      throw e;
    }
  }

  final Process process;
  final Path taskFile, resultFile;
  @Nullable ForkedResult result;

  ForkedProcess(Process process, Path taskFile, Path resultFile) {
    this.process = process;
    this.taskFile = taskFile;
    this.resultFile = resultFile;
  }

  int waitFor() throws InterruptedException {
    return process.waitFor();
  }

  boolean isAlive() {
    return process.isAlive();
  }

  void destroy() {
    process.destroyForcibly();
  }

  /** Reads what the exited child sent back, then deletes the temporary files. */
  synchronized ForkedResult result() {
    if (result != null) return result;
    int exitCode = process.exitValue();
    try {
      if (Files.size(resultFile) == 0L) {
        result = ForkedResult.failure(new IllegalStateException(
          "child process exited with " + exitCode + " without a result"));
      } else {
        Object read = read(resultFile);
        result = read instanceof ForkedResult
          ? (ForkedResult) read
          : ForkedResult.failure(new IllegalStateException("unexpected result " + read));
      }
    } catch (IOException | ClassNotFoundException e) {
      result = ForkedResult.failure(
        new IllegalStateException("could not read the result of the child process", e));
    } finally {
      deleteQuietly(taskFile);
      deleteQuietly(resultFile);
    }
    return result;
  }

  static void write(Path path, Object value) throws IOException {
    try (OutputStream out = Files.newOutputStream(path);
         ObjectOutputStream objects = new ObjectOutputStream(out)) {
      objects.writeObject(value);
    }
  }

  static Object read(Path path) throws IOException, ClassNotFoundException {
    try (InputStream in = Files.newInputStream(path);
         ObjectInputStream objects = new ObjectInputStream(in)) {
      return objects.readObject();
    }
  }

  static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      Platform.get().log("could not delete {0}", path, e);
    }
  }

  @Override public String toString() {
    return "ForkedProcess{pid=" + process.pid() + "}";
  }
}
