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

import com.fasterxml.jackson.core.type.TypeReference;
import contrail.SpanId;
import contrail.SpanStoreException;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Synchronous client of a {@link SpanServer}. Calls that fail to connect or get a status other
 * than 2xx throw {@link SpanStoreException}. Instances are thread safe.
 */
public final class SpanClient {
  static final MediaType JSON = MediaType.parse("application/json; charset=utf-8");
  static final TypeReference<List<String>> ID_LIST = new TypeReference<List<String>>() {
  };

  public static SpanClient create(String url) {
    return create(url, new OkHttpClient());
  }

  public static SpanClient create(String url, OkHttpClient client) {
    if (url == null) throw new NullPointerException("url == null");
    if (client == null) throw new NullPointerException("client == null");
    HttpUrl baseUrl = HttpUrl.parse(url);
    if (baseUrl == null) throw new IllegalArgumentException("invalid url " + url);
    return new SpanClient(baseUrl, client);
  }

  final HttpUrl baseUrl;
  final OkHttpClient client;

  SpanClient(HttpUrl baseUrl, OkHttpClient client) {
    this.baseUrl = baseUrl;
    this.client = client;
  }

  /** The base URL without a trailing slash, such as {@code http://127.0.0.1:9411}. */
  public String url() {
    String result = baseUrl.toString();
    return result.endsWith("/") ? result.substring(0, result.length() - 1) : result;
  }

  /** Creates a span. A 409 response means the ID is taken. */
  public void putSpan(SpanId id, String name, Map<String, ?> data, @Nullable SpanId parentId) {
    call(putRequest(id, name, data, parentId)).close();
  }

  /**
   * Creates a span unless the server already has one with this ID, in which case the existing
   * span is left as is. Processes that agree on an ID can call this concurrently.
   *
   * @return false if the span already existed
   */
  public boolean ensureSpan(SpanId id, String name, Map<String, ?> data,
    @Nullable SpanId parentId) {
    Request request = putRequest(id, name, data, parentId);
    Response response = execute(request);
    if (response.code() == 409) {
      response.close();
      return false;
    }
    checkSuccessful(request, response).close();
    return true;
  }

  Request putRequest(SpanId id, String name, Map<String, ?> data, @Nullable SpanId parentId) {
    if (name == null) throw new NullPointerException("name == null");
    if (data == null) throw new NullPointerException("data == null");
    SpanPayload payload = SpanPayload.create(name, data, parentId);
    return new Request.Builder().url(spanUrl(id))
      .put(RequestBody.create(JSON, Json.write(payload))).build();
  }

  /** Merges the patch into the span's data on the server. */
  public void patchSpan(SpanId id, Map<String, ?> patch) {
    if (patch == null) throw new NullPointerException("patch == null");
    call(new Request.Builder().url(spanUrl(id))
      .patch(RequestBody.create(JSON, Json.write(SpanDataPayload.create(patch)))).build())
      .close();
  }

  public SpanPayload getSpan(SpanId id) {
    return read(new Request.Builder().url(spanUrl(id)).build(), SpanPayload.class);
  }

  /** Returns false if the server has no span with this ID. */
  public boolean hasSpan(SpanId id) {
    Request request = new Request.Builder().url(spanUrl(id)).build();
    Response response = execute(request);
    if (response.code() == 404) {
      response.close();
      return false;
    }
    checkSuccessful(request, response).close();
    return true;
  }

  public List<SpanId> getChildrenIds(SpanId id) {
    HttpUrl url = spanUrl(id).newBuilder().addPathSegment("children").build();
    return toIds(readIds(new Request.Builder().url(url).build()));
  }

  public List<SpanId> getRootIds() {
    HttpUrl url = baseUrl.newBuilder().addPathSegments("api/tracing/root").build();
    return toIds(readIds(new Request.Builder().url(url).build()));
  }

  /** Returns true if the server answers the readiness probe, false if it doesn't, yet. */
  public boolean isReady() {
    HttpUrl url = baseUrl.newBuilder().addPathSegments("api/status/ready").build();
    try (Response response = client.newCall(new Request.Builder().url(url).build()).execute()) {
      return response.isSuccessful();
    } catch (IOException e) {
      return false; // not listening yet
    }
  }

  /**
   * Polls the readiness probe until it succeeds.
   *
   * @throws TimeoutException if the server isn't ready within the timeout
   */
  public void awaitReady(Duration timeout, Duration pollInterval)
    throws TimeoutException, InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    while (!isReady()) {
      if (System.nanoTime() - deadline >= 0) {
        throw new TimeoutException(url() + " wasn't ready after " + timeout);
      }
      Thread.sleep(pollInterval.toMillis());
    }
  }

  HttpUrl spanUrl(SpanId id) {
    if (id == null) throw new NullPointerException("id == null");
    return baseUrl.newBuilder().addPathSegments("api/span").addPathSegment(id.toString()).build();
  }

  List<String> readIds(Request request) {
    try (Response response = call(request)) {
      return Json.mapper().readValue(body(response).string(), ID_LIST);
    } catch (IOException e) {
      throw new SpanStoreException("could not read the response of " + request.url(), e);
    }
  }

  <T> T read(Request request, Class<T> type) {
    try (Response response = call(request)) {
      return Json.mapper().readValue(body(response).string(), type);
    } catch (IOException e) {
      throw new SpanStoreException("could not read the response of " + request.url(), e);
    }
  }

  /** Executes the request, returning the open response only if successful. */
  Response call(Request request) {
    return checkSuccessful(request, execute(request));
  }

  Response execute(Request request) {
    try {
      return client.newCall(request).execute();
    } catch (IOException e) {
      throw new SpanStoreException(request.method() + " " + request.url() + " failed", e);
    }
  }

  /** Returns the response if successful, otherwise closes it and throws. */
  static Response checkSuccessful(Request request, Response response) {
    if (response.isSuccessful()) return response;
    String message;
    try {
      message = body(response).string();
    } catch (IOException e) {
      message = e.toString();
    } finally {
      response.close();
    }
    throw new SpanStoreException(request.method() + " " + request.url() + " returned "
      + response.code() + ": " + message);
  }

  static ResponseBody body(Response response) throws IOException {
    ResponseBody body = response.body();
    if (body == null) throw new IOException("response has no body");
    return body;
  }

  static List<SpanId> toIds(List<String> ids) {
    List<SpanId> result = new ArrayList<>(ids.size());
    for (String id : ids) result.add(SpanId.fromString(id));
    return result;
  }

  @Override public String toString() {
    return "SpanClient{url=" + url() + "}";
  }
}
