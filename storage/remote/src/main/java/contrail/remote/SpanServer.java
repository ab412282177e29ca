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

import contrail.SpanId;
import contrail.SpanStoreException;
import contrail.internal.Platform;
import contrail.sqlite.SpanDatabase;
import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

/**
 * Embedded HTTP server exposing a {@link SpanDatabase} to processes that can't open the file,
 * such as those on another host. {@link SpanClient} is the matching client.
 *
 * <p>Routes:
 * <ul>
 *   <li>{@code GET /api/status/ready}: {@code ok} once serving</li>
 *   <li>{@code PUT /api/span/{id}}: creates a span from a {@link SpanPayload}</li>
 *   <li>{@code PATCH /api/span/{id}}: merges {@code data_json} into the span's data</li>
 *   <li>{@code GET /api/span/{id}}: the span as a {@link SpanPayload}</li>
 *   <li>{@code GET /api/span/{id}/children}: IDs of the span's children</li>
 *   <li>{@code GET /api/tracing/root}: IDs of spans without a parent</li>
 * </ul>
 */
public final class SpanServer implements Closeable {
  static final String READY_PATH = "/api/status/ready";
  static final String SPAN_PATH = "/api/span";
  static final String ROOT_PATH = "/api/tracing/root";

  /**
   * Creates a server bound to the host and port once started.
   *
   * @param port the port to listen on, or zero for any free port
   */
  public static SpanServer create(SpanDatabase database, String host, int port) {
    if (database == null) throw new NullPointerException("database == null");
    if (host == null) throw new NullPointerException("host == null");
    if (port < 0 || port > 0xffff) throw new IllegalArgumentException("invalid port " + port);
    return new SpanServer(database, host, port);
  }

  final SpanDatabase database;
  final String host;
  final Server server;
  final ServerConnector connector;

  SpanServer(SpanDatabase database, String host, int port) {
    this.database = database;
    this.host = host;
    server = new Server();
    connector = new ServerConnector(server);
    connector.setHost(host);
    connector.setPort(port);
    server.addConnector(connector);

    ServletContextHandler context = new ServletContextHandler();
    context.setContextPath("/");
    context.addServlet(new ServletHolder(new ReadyServlet()), READY_PATH);
    context.addServlet(new ServletHolder(new SpanServlet(database)), SPAN_PATH + "/*");
    context.addServlet(new ServletHolder(new RootIdsServlet(database)), ROOT_PATH);
    server.setHandler(context);
  }

  /** @throws SpanStoreException if the server could not bind or start */
  public SpanServer start() {
    try {
      server.start();
    } catch (Exception e) {
      throw new SpanStoreException("could not start the span server on " + host, e);
    }
    Platform.get().log("span server listening on {0}", url(), null);
    return this;
  }

  /** The port bound, valid after {@link #start()}. */
  public int port() {
    return connector.getLocalPort();
  }

  /** The base URL of the API, such as {@code http://127.0.0.1:9411}. */
  public String url() {
    String urlHost = "0.0.0.0".equals(host) ? "127.0.0.1" : host;
    return "http://" + urlHost + ":" + port();
  }

  public SpanDatabase database() {
    return database;
  }

  /** Stops serving. Requests in flight are aborted. */
  @Override public void close() {
    try {
      server.stop();
    } catch (Exception e) {
      throw new SpanStoreException("could not stop the span server on " + host, e);
    }
  }

  static final class ReadyServlet extends HttpServlet {
    @Override protected void doGet(HttpServletRequest req, HttpServletResponse resp)
      throws IOException {
      resp.setStatus(HttpServletResponse.SC_OK);
      resp.setContentType("text/plain");
      resp.getWriter().write("ok");
    }
  }

  static final class RootIdsServlet extends HttpServlet {
    final SpanDatabase database;

    RootIdsServlet(SpanDatabase database) {
      this.database = database;
    }

    @Override protected void doGet(HttpServletRequest req, HttpServletResponse resp)
      throws IOException {
      List<String> result = new ArrayList<>();
      try {
        for (SpanId id : database.getRootIds()) result.add(id.toString());
      } catch (SpanStoreException e) {
        Platform.get().warn("could not list root spans", e);
        SpanServlet.sendError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
        return;
      }
      SpanServlet.sendJson(resp, result);
    }
  }

  @Override public String toString() {
    return "SpanServer{database=" + database.path() + ", host=" + host + "}";
  }
}
