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
package contrail.remote;

import contrail.SpanStoreException;
import contrail.internal.JvmLauncher;
import contrail.internal.Platform;
import java.io.BufferedReader;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * A {@link SpanServerMain} running in a child JVM. The child stops when this is closed, or when
 * this JVM exits and its standard input closes.
 */
public final class SpanServerProcess implements Closeable {
  static final long STOP_TIMEOUT_SECONDS = 5;
  static final String HOST = "127.0.0.1";

  /**
   * Starts a server for the database on a free port of the loopback interface, and waits until
   * it reports the port.
   *
   * @throws IOException if the JVM could not be launched
   * @throws SpanStoreException if the server exited before listening or didn't report its port
   *   within the timeout
   */
  public static SpanServerProcess start(Path database, Duration timeout) throws IOException {
    if (database == null) throw new NullPointerException("database == null");
    if (timeout == null) throw new NullPointerException("timeout == null");
    Process process = JvmLauncher.newProcess(SpanServerMain.class,
        "--db", database.toAbsolutePath().toString(), "--host", HOST, "--port", "0")
      .redirectError(ProcessBuilder.Redirect.INHERIT)
      .start();
    return awaitListening(process, timeout);
  }

  /** Reads the port the child reports, killing it if it doesn't within the timeout. */
  static SpanServerProcess awaitListening(Process process, Duration timeout) {
    CompletableFuture<Integer> port = new CompletableFuture<>();
    Thread reader = new Thread(() -> readOutput(process, port), "span-server-stdout");
    reader.setDaemon(true);
    reader.start();
    try {
      SpanServerProcess result = new SpanServerProcess(process,
        "http://" + HOST + ":" + port.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
      Platform.get().log("started {0}", result, null);
      return result;
    } catch (TimeoutException e) {
      process.destroyForcibly();
      throw new SpanStoreException("span server didn't listen within " + timeout, e);
    } catch (ExecutionException e) {
      process.destroyForcibly();
      throw new SpanStoreException("span server exited before listening", e.getCause());
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new SpanStoreException("interrupted starting the span server", e);
    }
  }

  /**
   * Completes the future with the port the child reports, and copies its other output to ours so
   * it never blocks writing.
   */
  static void readOutput(Process process, CompletableFuture<Integer> port) {
    BufferedReader stdout = new BufferedReader(
      new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
    try {
      String line;
      while ((line = stdout.readLine()) != null) {
        if (!port.isDone() && line.startsWith(SpanServerMain.LISTENING)) {
          port.complete(Integer.parseInt(line.substring(SpanServerMain.LISTENING.length()).trim()));
        } else {
          System.out.println(line);
        }
      }
      port.completeExceptionally(new EOFException("span server closed its output"));
    } catch (IOException | RuntimeException e) {
      if (!port.completeExceptionally(e)) {
        Platform.get().log("stopped reading span server output", e);
      }
    }
  }

  final Process process;
  final String url;

  SpanServerProcess(Process process, String url) {
    this.process = process;
    this.url = url;
  }

  /** The base URL of the server, such as {@code http://127.0.0.1:9411}. */
  public String url() {
    return url;
  }

  public boolean isAlive() {
    return process.isAlive();
  }

  /**
   * Asks the server to stop by closing its input, then terminates it, then kills it, waiting a
   * bounded time after each step.
   */
  @Override public void close() {
    try {
      process.getOutputStream().close();
    } catch (IOException e) {
      Platform.get().log("could not close span server input", e);
    }
    try {
      if (process.waitFor(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) return;
      process.destroy();
      if (process.waitFor(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) return;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    Platform.get().warn("span server " + url + " didn't stop, killing it", null);
    process.destroyForcibly();
  }

  @Override public String toString() {
    return "SpanServerProcess{url=" + url + ", pid=" + process.pid() + "}";
  }
}
