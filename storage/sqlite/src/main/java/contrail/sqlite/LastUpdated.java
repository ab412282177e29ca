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

/** The span written most recently and when, in seconds since the epoch. */
public final class LastUpdated {
  final SpanId id;
  final double epochSeconds;

  LastUpdated(SpanId id, double epochSeconds) {
    this.id = id;
    this.epochSeconds = epochSeconds;
  }

  public SpanId id() {
    return id;
  }

  /** Fractional seconds since 1970-01-01T00:00:00Z, as recorded by the database clock. */
  public double epochSeconds() {
    return epochSeconds;
  }

  @Override public String toString() {
    return "LastUpdated{id=" + id + ", epochSeconds=" + epochSeconds + "}";
  }
}
