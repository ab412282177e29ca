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
package contrail.sqlite;

import contrail.SpanReference;
import contrail.concurrent.SpanResolver;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/** Resolves {@code sqlite:<path>} references. */
public final class SqliteSpanResolver implements SpanResolver {
  @Override public SqliteSpan resolve(SpanReference reference) {
    String locator = reference.locator();
    if (!locator.startsWith(SqliteSpan.LOCATOR_PREFIX)) return null;
    Path path = Paths.get(locator.substring(SqliteSpan.LOCATOR_PREFIX.length()));
    if (!Files.isRegularFile(path)) {
      throw new IllegalArgumentException(reference + ": no database at " + path);
    }
    SpanDatabase database = SpanDatabase.open(path);
    return new SqliteSpan(database, reference.id(), database.getName(reference.id()));
  }

  @Override public String toString() {
    return "SqliteSpanResolver{}";
  }
}
