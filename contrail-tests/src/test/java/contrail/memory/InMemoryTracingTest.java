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
package contrail.memory;

import contrail.Tracing;
import contrail.test.ITTracing;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTracingTest extends ITTracing {
  @Override protected Tracing.Builder newBuilder() {
    return InMemoryTracing.newBuilder();
  }

  @Test void tree_isRootSpan() {
    InMemoryTracing tracing = InMemoryTracing.create();

    assertThat(tracing.tree()).isSameAs(tracing.rootSpan());
  }

  @Test void newChild_addsToChildren() {
    InMemorySpan root = InMemoryTracing.create().rootSpan();

    InMemorySpan child = root.newChild("child", Map.of("k", "v"));

    assertThat(root.children()).containsExactly(child);
    assertThat(child.parent()).isSameAs(root);
    assertThat(child.data()).containsEntry("k", "v");
  }

  @Test void data_keepsValuesAsGiven() {
    Object value = new Object();
    InMemorySpan root = InMemoryTracing.create().rootSpan();

    root.updateData(Map.of("value", value));

    assertThat(root.data().get("value")).isSameAs(value);
  }

  @Test void data_isUnmodifiable() {
    InMemorySpan root = InMemoryTracing.create().rootSpan();

    assertThatThrownBy(() -> root.data().put("k", "v"))
      .isInstanceOf(UnsupportedOperationException.class);
  }

  @Test void reference_unsupported() {
    InMemorySpan root = InMemoryTracing.create().rootSpan();

    assertThatThrownBy(root::reference)
      .isInstanceOf(UnsupportedOperationException.class)
      .hasMessageContaining("can't be resolved by another process");
  }
}
