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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Holds the shared {@link ObjectMapper} and converts span data to values any store can persist:
 * null, strings, numbers, booleans, lists and string-keyed maps of those.
 */
public final class Json {
  static final ObjectMapper MAPPER = new ObjectMapper();
  static final TypeReference<LinkedHashMap<String, Object>> OBJECT =
    new TypeReference<LinkedHashMap<String, Object>>() {
    };

  public static ObjectMapper mapper() {
    return MAPPER;
  }

  /** Encodes a JSON-compatible value, as returned by {@link #toJsonValue(Object)}. */
  public static String write(@Nullable Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("could not encode " + value.getClass().getName(), e);
    }
  }

  /** Decodes a JSON object, throwing {@link IllegalArgumentException} on anything else. */
  public static Map<String, Object> readObject(String json) {
    if (json == null) throw new NullPointerException("json == null");
    try {
      Map<String, Object> result = MAPPER.readValue(json, OBJECT);
      if (result == null) throw new IllegalArgumentException("expected a JSON object: " + json);
      return result;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("malformed JSON object: " + e.getOriginalMessage(), e);
    }
  }

  /** Converts each value of the map with {@link #toJsonValue(Object)}, keeping null values. */
  public static Map<String, Object> toJsonObject(@Nullable Map<String, ?> map) {
    if (map == null || map.isEmpty()) return new LinkedHashMap<>();
    Map<String, Object> result = new LinkedHashMap<>();
    for (Map.Entry<String, ?> entry : map.entrySet()) {
      result.put(entry.getKey(), toJsonValue(entry.getValue()));
    }
    return result;
  }

  /**
   * Best-effort conversion of an arbitrary object to a JSON-compatible value. Objects Jackson can't
   * convert are recorded as their {@link String#valueOf(Object) string form}.
   */
  public static @Nullable Object toJsonValue(@Nullable Object value) {
    if (value == null || value instanceof String || value instanceof Boolean) return value;
    if (value instanceof Number) return value;
    if (value instanceof CharSequence || value instanceof Character || value instanceof Enum) {
      return value.toString();
    }
    if (value instanceof Map) {
      Map<String, Object> result = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        result.put(String.valueOf(entry.getKey()), toJsonValue(entry.getValue()));
      }
      return result;
    }
    if (value instanceof Iterable) {
      List<Object> result = new ArrayList<>();
      for (Object element : (Iterable<?>) value) result.add(toJsonValue(element));
      return result;
    }
    if (value instanceof Object[]) {
      List<Object> result = new ArrayList<>();
      Collections.addAll(result, (Object[]) value);
      return toJsonValue(result);
    }
    if (value instanceof Throwable) return value.toString();
    try {
      return MAPPER.convertValue(value, Object.class);
    } catch (IllegalArgumentException e) {
      Platform.get().log("falling back to toString for {0}", value.getClass().getName(), e);
      return String.valueOf(value);
    }
  }

  Json() {
  }
}
