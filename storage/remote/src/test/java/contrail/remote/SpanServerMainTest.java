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

import java.io.ByteArrayInputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

class SpanServerMainTest {
  @TempDir Path tempDir;
  SpanServerMain main = new SpanServerMain();
  StringWriter err = new StringWriter();
  CommandLine commandLine = new CommandLine(main).setErr(new PrintWriter(err));

  @Test void missingDatabase_isUsageError() {
    assertThat(commandLine.execute()).isEqualTo(CommandLine.ExitCode.USAGE);
    assertThat(err.toString()).contains("Missing required option").contains("--db");
  }

  @Test void defaults() {
    commandLine.parseArgs("--db", "spans.db");

    assertThat(main.host).isEqualTo("127.0.0.1");
    assertThat(main.port).isZero();
    assertThat(main.database).isEqualTo(Path.of("spans.db"));
  }

  @Test void stopsWhenInputCloses() {
    main.stdin = new ByteArrayInputStream(new byte[0]);

    int exitCode = commandLine.execute("--db", tempDir.resolve("spans.db").toString());

    assertThat(exitCode).isZero();
    assertThat(tempDir.resolve("spans.db")).exists();
  }
}
