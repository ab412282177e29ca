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

import contrail.SpanId;
import contrail.internal.MergePatch;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the span tree from a JSON log.
 *
 * <p>Each line is a JSON object. A line with a {@code name} creates a span:
 * <pre>{@code
 * {"id":"F5E4pfb6Ll9T4Kx9rCTW6g","parent_id":null,"name":"root","data":{}}
 * }</pre>
 * Any other line is a merge patch for the data of an existing span:
 * <pre>{@code
 * {"id":"F5E4pfb6Ll9T4Kx9rCTW6g","data":{"end_time":"2024-05-01T10:00:00.000Z"}}
 * }</pre>
 */
public final class JsonLogParser {
  static final String ID = "id", PARENT_ID = "parent_id", NAME = "name", DATA = "data";

  /**
   * Returns the root of the log.
   *
   * @throws IllegalStateException if the log has no root or more than one
   */
  public static JsonLogTree parse(Path path) {
    List<JsonLogTree> roots = new ArrayList<>();
    for (JsonLogTree node : read(new JsonLogFile(path)).values()) {
      if (node.parent == null) roots.add(node);
    }
    if (roots.size() != 1) {
      throw new IllegalStateException("expected one root span in " + path + ", found "
        + roots.size());
    }
    return roots.get(0);
  }

  /** Returns every span in the log by id, in creation order, with parents and children linked. */
  static Map<SpanId, JsonLogTree> read(JsonLogFile file) {
    Map<SpanId, JsonLogTree> result = new LinkedHashMap<>();
    for (Map<String, Object> line : file.readLines()) {
      SpanId id = SpanId.fromString(requireString(line, ID, file));
      Map<String, Object> data = requireObject(line, file);
      if (line.containsKey(NAME)) {
        Object parentId = line.get(PARENT_ID);
        result.put(id, new JsonLogTree(id, requireString(line, NAME, file),
          parentId != null ? SpanId.fromString(parentId.toString()) : null,
          MergePatch.applyToObject(null, data)));
      } else {
        JsonLogTree node = result.get(id);
        if (node == null) {
          throw new IllegalStateException(file + " updates span " + id + " before creating it");
        }
        node.data = MergePatch.applyToObject(node.data, data);
      }
    }
    for (JsonLogTree node : result.values()) {
      if (node.parentId == null) continue;
      JsonLogTree parent = result.get(node.parentId);
      if (parent == null) {
        throw new IllegalStateException(file + " has span " + node.id
          + " whose parent " + node.parentId + " is missing");
      }
      node.parent = parent;
      parent.children.add(node);
    }
    return result;
  }

  static String requireString(Map<String, Object> line, String key, JsonLogFile file) {
    Object value = line.get(key);
    if (!(value instanceof String)) {
      throw new IllegalStateException(file + " has a line without " + key + ": " + line);
    }
    return (String) value;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> requireObject(Map<String, Object> line, JsonLogFile file) {
    Object value = line.get(DATA);
    if (value == null) return new LinkedHashMap<>();
    if (!(value instanceof Map)) {
      throw new IllegalStateException(file + " has a line whose data isn't an object: " + line);
    }
    return (Map<String, Object>) value;
  }

  JsonLogParser() {
  }
}
