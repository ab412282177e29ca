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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON merge patch as defined by <a href="https://tools.ietf.org/html/rfc7396">RFC 7396</a>,
 * applied to the maps, lists and scalars Jackson reads JSON into.
 *
 * <p>Inputs are never mutated: maps touched by the patch are copied and the result shares any
 * untouched values with the target.
 */
public final class MergePatch {

  /**
   * Applies the patch to the target and returns the result.
   *
   * <ul>
   *   <li>A patch that isn't a map replaces the target, so a null patch yields null.</li>
   *   <li>A target that isn't a map is treated as an empty map.</li>
   *   <li>A null value in a patch map removes the key; other values are merged recursively.</li>
   * </ul>
   */
  public static @Nullable Object apply(@Nullable Object target, @Nullable Object patch) {
    if (!(patch instanceof Map)) return patch;
    Map<String, Object> result = new LinkedHashMap<>();
    if (target instanceof Map) {
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) target).entrySet()) {
        result.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    }
    for (Map.Entry<?, ?> entry : ((Map<?, ?>) patch).entrySet()) {
      String key = String.valueOf(entry.getKey());
      Object value = entry.getValue();
      if (value == null) {
        result.remove(key);
      } else {
        result.put(key, apply(result.get(key), value));
      }
    }
    return result;
  }

  /** Like {@link #apply(Object, Object)} for the common case of patching a JSON object. */
  @SuppressWarnings("unchecked")
  public static Map<String, Object> applyToObject(@Nullable Map<String, ?> target,
    Map<String, ?> patch) {
    if (patch == null) throw new NullPointerException("patch == null");
    return (Map<String, Object>) apply(target, patch);
  }

  MergePatch() {
  }
}
