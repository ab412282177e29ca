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
package contrail.internal;

import java.util.ArrayList;
import java.util.List;

/** Builds commands that run a main class in a fresh JVM with the class path of this one. */
public final class JvmLauncher {

  public static ProcessBuilder newProcess(Class<?> mainClass, String... args) {
    Platform platform = Platform.get();
    List<String> command = new ArrayList<>();
    command.add(platform.javaExecutable().toString());
    command.add("-cp");
    command.add(platform.classPath());
    command.add(mainClass.getName());
    for (String arg : args) command.add(arg);
    return new ProcessBuilder(command);
  }

  JvmLauncher() {
  }
}
