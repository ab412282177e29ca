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
import contrail.SpanStoreException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonLogParserTest {
  @TempDir Path tempDir;
  SpanId root = SpanId.next(), child = SpanId.next(), grandchild = SpanId.next();

  @Test void parse_rebuildsTreeAndMergesPatches() throws Exception {
    Path log = write(
      "{\"id\":\"" + root + "\",\"parent_id\":null,\"name\":\"root\",\"data\":{}}",
      "{\"id\":\"" + child + "\",\"parent_id\":\"" + root + "\",\"name\":\"child\","
        + "\"data\":{\"a\":{\"x\":1,\"y\":2}}}",
      "",
      "{\"id\":\"" + grandchild + "\",\"parent_id\":\"" + child + "\",\"name\":\"grandchild\"}",
      "{\"id\":\"" + child + "\",\"data\":{\"a\":{\"y\":null},\"b\":true}}"
    );

    JsonLogTree tree = JsonLogParser.parse(log);

    assertThat(tree.id()).isEqualTo(root);
    assertThat(tree.parent()).isNull();
    assertThat(tree.children()).extracting(JsonLogTree::name).containsExactly("child");
    JsonLogTree childTree = tree.children().get(0);
    assertThat(childTree.data()).isEqualTo(Map.of("a", Map.of("x", 1), "b", true));
    assertThat(childTree.parent()).isSameAs(tree);
    assertThat(childTree.children()).extracting(JsonLogTree::id).containsExactly(grandchild);
    assertThat(childTree.children().get(0).data()).isEmpty();
  }

  @Test void parse_noRoot() throws Exception {
    Path log = write();

    assertThatThrownBy(() -> JsonLogParser.parse(log))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageEndingWith("found 0");
  }

  @Test void parse_twoRoots() throws Exception {
    Path log = write(
      "{\"id\":\"" + root + "\",\"parent_id\":null,\"name\":\"one\",\"data\":{}}",
      "{\"id\":\"" + child + "\",\"parent_id\":null,\"name\":\"two\",\"data\":{}}"
    );

    assertThatThrownBy(() -> JsonLogParser.parse(log))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageEndingWith("found 2");
  }

  @Test void parse_patchBeforeCreation() throws Exception {
    Path log = write("{\"id\":\"" + root + "\",\"data\":{\"a\":1}}");

    assertThatThrownBy(() -> JsonLogParser.parse(log))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("before creating it");
  }

  @Test void parse_missingParent() throws Exception {
    Path log = write(
      "{\"id\":\"" + root + "\",\"parent_id\":null,\"name\":\"root\",\"data\":{}}",
      "{\"id\":\"" + grandchild + "\",\"parent_id\":\"" + child + "\",\"name\":\"orphan\"}"
    );

    assertThatThrownBy(() -> JsonLogParser.parse(log))
      .isInstanceOf(IllegalStateException.class)
      .hasMessageContaining("is missing");
  }

  @Test void parse_malformedLine() throws Exception {
    Path log = write("{\"id\":");

    assertThatThrownBy(() -> JsonLogParser.parse(log))
      .isInstanceOf(SpanStoreException.class)
      .hasMessageEndingWith(":1 is not a JSON object");
  }

  Path write(String... lines) throws Exception {
    Path result = tempDir.resolve("trace.log");
    Files.write(result, Arrays.asList(lines));
    return result;
  }
}
