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
package contrail.concurrent;

import java.io.Serializable;
import java.util.concurrent.Callable;

/** A task that can be sent to a child process. Lambdas assigned to this type are serializable. */
@FunctionalInterface
public interface SerializableCallable<V> extends Callable<V>, Serializable {
}
