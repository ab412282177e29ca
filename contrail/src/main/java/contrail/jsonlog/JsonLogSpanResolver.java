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

import contrail.SpanReference;
import contrail.concurrent.SpanResolver;
import java.nio.file.Paths;

/** Resolves {@code jsonlog:<path>} references. */
public final class JsonLogSpanResolver implements SpanResolver {
  @Override public JsonLogSpan resolve(SpanReference reference) {
    String locator = reference.locator();
    if (!locator.startsWith(JsonLogSpan.LOCATOR_PREFIX)) return null;
    JsonLogFile file =
      new JsonLogFile(Paths.get(locator.substring(JsonLogSpan.LOCATOR_PREFIX.length())));
    JsonLogTree node = JsonLogParser.read(file).get(reference.id());
    if (node == null) throw new IllegalArgumentException(reference + " is not in " + file);
    return new JsonLogSpan(file, node.id, node.name);
  }

  @Override public String toString() {
    return "JsonLogSpanResolver{}";
  }
}
