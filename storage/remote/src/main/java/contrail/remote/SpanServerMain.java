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

import contrail.sqlite.SpanDatabase;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Runs a {@link SpanServer} as its own process. Once bound, it prints {@code LISTENING <port>} on
 * a line of standard output. It stops when standard input closes or the process is terminated.
 *
 * <pre>{@code
 * java -cp ... contrail.remote.SpanServerMain --db trace.db --port 9411
 * }</pre>
 */
@Command(name = "span-server", mixinStandardHelpOptions = true, showDefaultValues = true,
  description = "Serves a span database over HTTP.")
public final class SpanServerMain implements Callable<Integer> {
  static final String LISTENING = "LISTENING ";

  @Option(names = "--db", required = true, description = "SQLite database file")
  Path database;

  @Option(names = "--host", defaultValue = "127.0.0.1", description = "Address to bind")
  String host;

  @Option(names = "--port", defaultValue = "0", description = "Port to bind, or 0 for any")
  int port;

  InputStream stdin = System.in;

  public static void main(String... args) {
    System.exit(new CommandLine(new SpanServerMain()).execute(args));
  }

  @Override public Integer call() throws IOException {
    SpanServer server = SpanServer.create(SpanDatabase.open(database), host, port).start();
    Thread shutdown = new Thread(server::close, "span-server-shutdown");
    Runtime.getRuntime().addShutdownHook(shutdown);

    System.out.println(LISTENING + server.port());
    System.out.flush();

    try {
      while (stdin.read() != -1) {
        // discard until the parent closes our input
      }
    } finally {
      Runtime.getRuntime().removeShutdownHook(shutdown);
      server.close();
    }
    return 0;
  }
}
