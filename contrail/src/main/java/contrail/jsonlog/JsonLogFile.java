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
package contrail.jsonlog;

import contrail.SpanStoreException;
import contrail.internal.Json;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Appends and reads JSON lines. Appends hold an exclusive file lock and reads a shared one, so
 * processes sharing a log never see half a line.
 */
final class JsonLogFile {
  // file locks are held by the JVM, so threads in one JVM must also take turns
  static final Object LOCK = new Object();

  final Path path;

  JsonLogFile(Path path) {
    this.path = path.toAbsolutePath();
  }

  void append(Map<String, Object> line) {
    byte[] bytes = (Json.write(line) + "\n").getBytes(StandardCharsets.UTF_8);
    synchronized (LOCK) {
      try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
        StandardOpenOption.WRITE, StandardOpenOption.APPEND);
           FileLock lock = channel.lock()) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) channel.write(buffer);
      } catch (IOException e) {
        throw new SpanStoreException("could not append to " + path, e);
      }
    }
  }

  List<Map<String, Object>> readLines() {
    List<Map<String, Object>> result = new ArrayList<>();
    synchronized (LOCK) {
      try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
           FileLock lock = channel.lock(0L, Long.MAX_VALUE, true)) {
        BufferedReader reader =
          new BufferedReader(Channels.newReader(channel, StandardCharsets.UTF_8.newDecoder(), -1));
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
          lineNumber++;
          if (line.trim().isEmpty()) continue;
          try {
            result.add(Json.readObject(line));
          } catch (IllegalArgumentException e) {
            throw new SpanStoreException(path + ":" + lineNumber + " is not a JSON object", e);
          }
        }
      } catch (IOException e) {
        throw new SpanStoreException("could not read " + path, e);
      }
    }
    return result;
  }

  @Override public String toString() {
    return path.toString();
  }
}
