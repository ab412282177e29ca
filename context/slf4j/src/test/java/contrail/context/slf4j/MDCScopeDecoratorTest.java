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
package contrail.context.slf4j;

import contrail.Span;
import contrail.internal.Nullable;
import contrail.propagation.CurrentSpanContext;
import contrail.propagation.CurrentSpanContext.Scope;
import contrail.propagation.ThreadLocalCurrentSpanContext;
import contrail.test.propagation.CurrentSpanContextTest;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

class MDCScopeDecoratorTest extends CurrentSpanContextTest {
  @Override protected CurrentSpanContext.Builder newBuilder() {
    return ThreadLocalCurrentSpanContext.newBuilder()
      .addScopeDecorator(MDCScopeDecorator.get());
  }

  @Override protected void verifyImplicitContext(@Nullable Span span) {
    if (span != null) {
      assertThat(MDC.get("spanId")).isEqualTo(span.id().toString());
      assertThat(MDC.get("spanName")).isEqualTo(span.name());
    } else {
      assertThat(MDC.get("spanId")).isNull();
      assertThat(MDC.get("spanName")).isNull();
    }
  }

  @Test void restoresValuesSetOutsideTracing() {
    MDC.put("spanId", "outer");
    try {
      try (Scope scope = currentSpanContext.newScope(span)) {
        assertThat(MDC.get("spanId")).isEqualTo(span.id().toString());
      }
      assertThat(MDC.get("spanId")).isEqualTo("outer");
    } finally {
      MDC.remove("spanId");
    }
  }
}
