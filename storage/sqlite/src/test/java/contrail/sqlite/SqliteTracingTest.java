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

import contrail.SpanId;
import contrail.SpanReference;
import contrail.Tracing;
import contrail.concurrent.SpanResolvers;
import contrail.test.ITTracing;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqliteTracingTest extends ITTracing {
  @TempDir Path tempDir;

  @Override protected Tracing.Builder newBuilder() {
    return SqliteTracing.newBuilder().path(tempDir.resolve("trace.db"));
  }

  @Test void eachTracingAddsRoot() throws Exception {
    SqliteTracing first = (SqliteTracing) newTracing();
    SqliteTracing second = (SqliteTracing) newTracing();

    assertThat(first.database().getRootIds())
      .containsExactly(first.rootSpan().id(), second.rootSpan().id());
  }

  @Test void rootId_continuesExistingTrace() throws Exception {
    SqliteTracing first = (SqliteTracing) build(newBuilder().rootName("import"));
    first.rootSpan().newChild("step", Map.of());

    SqliteTracing second = (SqliteTracing) build(SqliteTracing.newBuilder()
      .path(tempDir.resolve("trace.db"))
      .rootId(first.rootSpan().id())
      .rootName("ignored"));

    assertThat(second.rootSpan()).isEqualTo(first.rootSpan());
    assertThat(second.rootSpan().name()).isEqualTo("import");
    assertThat(names(second.tree().children())).containsExactly("step");
    assertThat(second.database().getRootIds()).hasSize(1);
  }

  @Test void rootId_createsMissingRoot() {
    SpanId rootId = SpanId.next();

    SqliteTracing tracing = (SqliteTracing) build(SqliteTracing.newBuilder()
      .path(tempDir.resolve("trace.db"))
      .rootId(rootId)
      .rootName("ensured"));

    assertThat(tracing.rootSpan().id()).isEqualTo(rootId);
    assertThat(tracing.database().getName(rootId)).isEqualTo("ensured");
  }

  @Test void rootId_keepsDataOfStartedRoot() throws Exception {
    SpanId rootId = SpanId.next();
    SqliteTracing first = (SqliteTracing) build(rootIdBuilder(rootId));
    first.start();

    SqliteTracing second = (SqliteTracing) build(rootIdBuilder(rootId));

    assertThat(second.rootSpan()).isEqualTo(first.rootSpan());
    assertThat(second.rootSpan().data()).containsKey("start_time");
  }

  SqliteTracing.Builder rootIdBuilder(SpanId rootId) {
    return SqliteTracing.newBuilder().path(tempDir.resolve("trace.db")).rootId(rootId)
      .rootName("import");
  }

  @Test void reference_resolvesToEqualSpan() throws Exception {
    SqliteTracing tracing = (SqliteTracing) newTracing();
    SqliteSpan child = tracing.rootSpan().newChild("child", Map.of("k", "v"));

    SpanReference reference = SpanReference.parse(child.reference().toString());

    assertThat(reference.locator()).isEqualTo("sqlite:" + tracing.database().path());
    assertThat(SpanResolvers.resolve(reference)).isEqualTo(child);
    assertThat(SpanResolvers.resolve(reference).data()).containsEntry("k", "v");
  }

  @Test void resolve_missingDatabase() {
    SpanReference reference =
      SpanReference.create("sqlite:" + tempDir.resolve("missing.db"), SpanId.next());

    assertThatThrownBy(() -> SpanResolvers.resolve(reference))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessageContaining("no database at");
  }

  @Test void tree_parentLinks() throws Exception {
    SqliteTracing tracing = (SqliteTracing) newTracing();
    tracing.rootSpan().newChild("child", Map.of());

    SqliteTree tree = tracing.tree();

    assertThat(tree.parent()).isNull();
    assertThat(tree.children().get(0).parent()).isSameAs(tree);
  }
}
