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
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import contrail.SpanId;
import contrail.internal.Json;
import contrail.internal.Nullable;
import java.util.Map;

/**
 * Body of span requests and responses. IDs travel in their {@link SpanId#toString() text form}
 * and data as a JSON object encoded in a string:
 * <pre>{@code
 * {"name":"load","data_json":"{\"rows\":3}","parent_id":"AX7fQ3yJcQAA8c9Hx2hCsw"}
 * }</pre>
 *
 * <p>{@code parent_id} is always present, and null for a root. A data update is a {@link
 * SpanDataPayload}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SpanPayload {
  static SpanPayload create(String name, Map<String, ?> data, @Nullable SpanId parentId) {
    return new SpanPayload(name, Json.write(Json.toJsonObject(data)),
      parentId != null ? parentId.toString() : null);
  }

  @JsonProperty("name") @Nullable final String name;
  @JsonProperty("data_json") @Nullable final String dataJson;
  @JsonProperty("parent_id") @JsonInclude(JsonInclude.Include.ALWAYS)
  @Nullable final String parentId;

  @JsonCreator SpanPayload(
    @JsonProperty("name") @Nullable String name,
    @JsonProperty("data_json") @Nullable String dataJson,
    @JsonProperty("parent_id") @Nullable String parentId) {
    this.name = name;
    this.dataJson = dataJson;
    this.parentId = parentId;
  }

  @Nullable public String name() {
    return name;
  }

  @Nullable public String dataJson() {
    return dataJson;
  }

  /** @throws IllegalArgumentException if the data is missing or not a JSON object */
  public Map<String, Object> data() {
    if (dataJson == null) throw new IllegalArgumentException("data_json is missing");
    return Json.readObject(dataJson);
  }

  /** @throws IllegalArgumentException if the parent ID is malformed */
  @Nullable public SpanId parentId() {
    return parentId != null ? SpanId.fromString(parentId) : null;
  }

  @Override public String toString() {
    return "SpanPayload{name=" + name + ", dataJson=" + dataJson + ", parentId=" + parentId + "}";
  }
}
