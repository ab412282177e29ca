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
package contrail;

import java.io.Serializable;

/**
 * A span's identifier plus the locator of the store that holds it. This is what crosses a process
 * boundary in place of a live span handle.
 *
 * <p>Locators name the store, such as {@code "sqlite:/tmp/trace.db"},
 * {@code "jsonlog:/tmp/trace.log"} or {@code "http://127.0.0.1:8080"}. The text form is
 * {@code <locator>#<id>}.
 *
 * @see contrail.concurrent.SpanResolvers
 */
public final class SpanReference implements Serializable {
  public static SpanReference create(String locator, SpanId id) {
    if (locator == null) throw new NullPointerException("locator == null");
    if (locator.isEmpty()) throw new IllegalArgumentException("locator is empty");
    if (id == null) throw new NullPointerException("id == null");
    return new SpanReference(locator, id);
  }

  /** Parses the {@link #toString() text form}. */
  public static SpanReference parse(String value) {
    if (value == null) throw new NullPointerException("value == null");
    int hash = value.lastIndexOf('#');
    if (hash <= 0 || hash == value.length() - 1) {
      throw new IllegalArgumentException("expected <locator>#<id>: " + value);
    }
    return create(value.substring(0, hash), SpanId.fromString(value.substring(hash + 1)));
  }

  final String locator;
  final SpanId id;

  SpanReference(String locator, SpanId id) {
    this.locator = locator;
    this.id = id;
  }

  public String locator() {
    return locator;
  }

  public SpanId id() {
    return id;
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof SpanReference)) return false;
    SpanReference that = (SpanReference) o;
    return locator.equals(that.locator) && id.equals(that.id);
  }

  @Override public int hashCode() {
    int h = 1;
    h *= 1000003;
    h ^= locator.hashCode();
    h *= 1000003;
    h ^= id.hashCode();
    return h;
  }

  @Override public String toString() {
    return locator + "#" + id;
  }

  private static final long serialVersionUID = 1L;
}
