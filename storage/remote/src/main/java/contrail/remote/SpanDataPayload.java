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
package contrail.remote;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.util.Map;

/** Body of a data update: a JSON object, encoded in a string, to merge into the span's data. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SpanDataPayload {
  static SpanDataPayload create(Map<String, ?> patch) {
    return new SpanDataPayload(Json.write(Json.toJsonObject(patch)));
  }

  @JsonProperty("data_json") @Nullable final String dataJson;

  @JsonCreator SpanDataPayload(@JsonProperty("data_json") @Nullable String dataJson) {
    this.dataJson = dataJson;
  }

  @Nullable public String dataJson() {
    return dataJson;
  }

  /** @throws IllegalArgumentException if the data is missing or not a JSON object */
  public Map<String, Object> data() {
    if (dataJson == null) throw new IllegalArgumentException("data_json is missing");
    return Json.readObject(dataJson);
  }

  @Override public String toString() {
    return "SpanDataPayload{dataJson=" + dataJson + "}";
  }
}
