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

import contrail.internal.Nullable;
import java.util.List;
import java.util.Map;

/** Read view of a span and its descendants, used to inspect or export a finished trace. */
public interface Tree {
  SpanId id();

  String name();

  Map<String, Object> data();

  /** Children in creation order. Reading them may do I/O. */
  List<? extends Tree> children();

  /** Returns null for the root. */
  @Nullable Tree parent();
}
