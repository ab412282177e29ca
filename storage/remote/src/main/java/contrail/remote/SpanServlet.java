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

import com.fasterxml.jackson.core.JsonProcessingException;
import contrail.SpanId;
import contrail.SpanStoreException;
import contrail.internal.Json;
import contrail.internal.Nullable;
import contrail.internal.Platform;
import contrail.sqlite.SpanDatabase;
import contrail.sqlite.SpanRow;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;

/**
 * Serves the span API over a {@link SpanDatabase}.
 *
 * <p>Statuses: 400 for a malformed ID or body, 404 for an unknown span, 409 when creating a span
 * that exists and 500 when the database fails.
 */
final class SpanServlet extends HttpServlet {
  static final String CHILDREN = "/children";

  final SpanDatabase database;

  SpanServlet(SpanDatabase database) {
    this.database = database;
  }

  /** Dispatches PATCH, which {@link HttpServlet} doesn't know. */
  @Override protected void service(HttpServletRequest req, HttpServletResponse resp)
    throws IOException {
    String method = req.getMethod();
    String path = req.getPathInfo() != null ? req.getPathInfo() : "";
    boolean children = path.endsWith(CHILDREN);
    if (children) path = path.substring(0, path.length() - CHILDREN.length());

    SpanId id;
    try {
      id = SpanId.fromString(path.startsWith("/") ? path.substring(1) : path);
    } catch (IllegalArgumentException e) {
      sendError(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
      return;
    }

    try {
      if (children && "GET".equals(method)) {
        List<String> result = new ArrayList<>();
        for (SpanId childId : database.getChildrenIds(id)) result.add(childId.toString());
        sendJson(resp, result);
      } else if (!children && "GET".equals(method)) {
        SpanRow row = database.getSpan(id);
        SpanId parentId = row.parentId();
        sendJson(resp, new SpanPayload(row.name(), row.dataJson(),
          parentId != null ? parentId.toString() : null));
      } else if (!children && "PUT".equals(method)) {
        SpanPayload payload = readBody(req, SpanPayload.class);
        if (payload.name() == null) throw new MalformedRequestException("name is missing");
        checkData(payload.dataJson());
        database.insert(id, parentId(payload), payload.name(), payload.dataJson());
        resp.setStatus(HttpServletResponse.SC_OK);
      } else if (!children && "PATCH".equals(method)) {
        SpanDataPayload payload = readBody(req, SpanDataPayload.class);
        checkData(payload.dataJson());
        database.updateDataJson(id, payload.dataJson());
        resp.setStatus(HttpServletResponse.SC_OK);
      } else {
        sendError(resp, HttpServletResponse.SC_METHOD_NOT_ALLOWED,
          method + " " + req.getRequestURI());
      }
    } catch (MalformedRequestException e) {
      sendError(resp, HttpServletResponse.SC_BAD_REQUEST, e.getMessage());
    } catch (IllegalArgumentException e) {
      sendError(resp, HttpServletResponse.SC_NOT_FOUND, e.getMessage());
    } catch (IllegalStateException e) {
      sendError(resp, HttpServletResponse.SC_CONFLICT, e.getMessage());
    } catch (SpanStoreException e) {
      Platform.get().warn("could not serve " + method + " " + req.getRequestURI(), e);
      sendError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, e.getMessage());
    }
  }

  static <T> T readBody(HttpServletRequest req, Class<T> type) throws IOException {
    T result;
    try {
      result = Json.mapper().readValue(req.getInputStream(), type);
    } catch (JsonProcessingException e) {
      throw new MalformedRequestException("malformed body: " + e.getOriginalMessage());
    }
    if (result == null) throw new MalformedRequestException("body is empty");
    return result;
  }

  static void checkData(@Nullable String dataJson) {
    if (dataJson == null) throw new MalformedRequestException("data_json is missing");
    try {
      Json.readObject(dataJson);
    } catch (IllegalArgumentException e) {
      throw new MalformedRequestException(e.getMessage());
    }
  }

  static SpanId parentId(SpanPayload payload) {
    try {
      return payload.parentId();
    } catch (IllegalArgumentException e) {
      throw new MalformedRequestException("parent_id: " + e.getMessage());
    }
  }

  static void sendJson(HttpServletResponse resp, Object value) throws IOException {
    resp.setStatus(HttpServletResponse.SC_OK);
    resp.setContentType("application/json");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(Json.write(value));
  }

  static void sendError(HttpServletResponse resp, int status, String message) throws IOException {
    resp.setStatus(status);
    resp.setContentType("text/plain");
    resp.setCharacterEncoding("UTF-8");
    resp.getWriter().write(message != null ? message : "");
  }

  static final class MalformedRequestException extends RuntimeException {
    MalformedRequestException(String message) {
      super(message);
    }

    private static final long serialVersionUID = 1L;
  }
}
