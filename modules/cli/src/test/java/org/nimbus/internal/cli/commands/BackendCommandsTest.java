/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.nimbus.internal.cli.commands;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.nullValue;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.typesafe.config.ConfigFactory;
import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.ConnectionException;
import org.nimbus.internal.backend.CursorCallback;
import org.nimbus.internal.backend.StatementCursor;
import org.nimbus.internal.backend.athena.AthenaConnectionParameters;
import org.nimbus.internal.backend.redshift.RedshiftConnectionParameters;
import org.nimbus.internal.cli.config.CliConfig;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;
import picocli.CommandLine;

/**
 * Tests for {@link AthenaCommand} and {@link RedshiftCommand}.
 */
@ExtendWith(MockitoExtension.class)
public class BackendCommandsTest extends BaseNimbusAbstractTest {
    @TempDir
    Path workDir;

    @Mock
    private Backend backend;

    @Mock
    private StatementCursor cursor;

    private final StringWriter out = new StringWriter();

    private final StringWriter err = new StringWriter();

    @Test
    public void redshiftOptionsOverrideConfigAndEnvironment() {
        RedshiftCommand cmd = new RedshiftCommand();

        new CommandLine(cmd).parseArgs("-h", "cli-host", "-U", "IAM:admin", "analytics");

        CliConfig config = CliConfig.of(
                ConfigFactory.parseString("nimbus.redshift { host = cfg-host, port = 5440, sslmode = require }"),
                new File("nimbus.conf")
        );

        Map<String, String> env = Map.of(
                "PGPORT", "6000",
                "PGPASSWORD", "secret",
                "AWS_PROFILE", "analyst",
                "USER", "os-user"
        );

        RedshiftConnectionParameters params = (RedshiftConnectionParameters) cmd.connectionParameters(config, env::get);

        assertThat(params.host(), equalTo("cli-host"));
        assertThat(params.port(), equalTo(5440));
        assertThat(params.database(), equalTo("analytics"));
        assertThat(params.user(), equalTo("IAM:admin"));
        assertThat(params.password(), equalTo("secret"));
        assertThat(params.sslMode(), equalTo("require"));
        assertThat(params.awsProfile(), equalTo("analyst"));
        assertThat(params.region(), equalTo(RedshiftConnectionParameters.DEFAULT_REGION));
    }

    @Test
    public void redshiftDefaults() {
        RedshiftCommand cmd = new RedshiftCommand();

        new CommandLine(cmd).parseArgs();

        RedshiftConnectionParameters params = (RedshiftConnectionParameters) cmd.connectionParameters(
                CliConfig.of(ConfigFactory.empty(), new File("nimbus.conf")),
                name -> null
        );

        assertThat(params.host(), is(nullValue()));
        assertThat(params.port(), equalTo(RedshiftConnectionParameters.DEFAULT_PORT));
        assertThat(params.database(), equalTo(RedshiftConnectionParameters.DEFAULT_DATABASE));
        assertThat(params.sslMode(), equalTo(RedshiftConnectionParameters.DEFAULT_SSL_MODE));
        assertThat(params.awsProfile(), equalTo(RedshiftConnectionParameters.DEFAULT_AWS_PROFILE));
    }

    @Test
    public void athenaProfileIsResolved() {
        AthenaCommand cmd = new AthenaCommand();

        new CommandLine(cmd).parseArgs("--profile", "bi", "-r", "eu-central-1", "awsdatacatalog.sales");

        CliConfig config = CliConfig.of(ConfigFactory.parseString("nimbus.athena.profiles.bi {\n"
                + "  region = eu-west-1\n"
                + "  s3-staging-dir = \"s3://bucket/staging/\"\n"
                + "  role-arn = \"arn:aws:iam::123456789012:role/analyst\"\n"
                + "  result-reuse-enable = on\n"
                + "  result-reuse-minutes = later\n"
                + "}"), new File("nimbus.conf"));

        AthenaConnectionParameters params = (AthenaConnectionParameters) cmd.connectionParameters(
                config,
                Map.of("AWS_ATHENA_WORK_GROUP", "primary")::get
        );

        assertThat(params.region(), equalTo("eu-central-1"));
        assertThat(params.s3StagingDir(), equalTo("s3://bucket/staging/"));
        assertThat(params.workGroup(), equalTo("primary"));
        assertThat(params.roleArn(), equalTo("arn:aws:iam::123456789012:role/analyst"));
        assertThat(params.database(), equalTo("awsdatacatalog.sales"));
        assertTrue(params.resultReuseEnable());
        assertThat(params.resultReuseMinutes(), equalTo(AthenaConnectionParameters.DEFAULT_RESULT_REUSE_MINUTES));
    }

    @Test
    public void unknownAthenaProfileLeavesSettingsEmpty() {
        AthenaCommand cmd = new AthenaCommand();

        new CommandLine(cmd).parseArgs("--profile", "nobody");

        AthenaConnectionParameters params = (AthenaConnectionParameters) cmd.connectionParameters(
                CliConfig.of(ConfigFactory.empty(), new File("nimbus.conf")),
                name -> null
        );

        assertThat(params.region(), is(nullValue()));
        assertThat(params.database(), is(nullValue()));
        assertFalse(params.resultReuseEnable());
    }

    @Test
    public void queryFromTextFileOrStdin() throws IOException {
        RedshiftCommand cmd = new RedshiftCommand();

        Path file = workDir.resolve("report.sql");
        Files.writeString(file, "select 42;");

        cmd.stdin(new ByteArrayInputStream("select 7;".getBytes(StandardCharsets.UTF_8)));

        assertThat(cmd.readQuery("select 1"), equalTo("select 1"));
        assertThat(cmd.readQuery(file.toString()), equalTo("select 42;"));
        assertThat(cmd.readQuery("-"), equalTo("select 7;"));
    }

    @Test
    public void emptyStdinIsRejected() {
        RedshiftCommand cmd = new RedshiftCommand();

        cmd.stdin(new ByteArrayInputStream(new byte[0]));

        assertThrows(IllegalArgumentException.class, () -> cmd.readQuery("-"));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void executesAndPrintsCsv() throws IOException {
        when(backend.withCursor(any())).thenAnswer(inv -> ((CursorCallback<Object>) inv.getArgument(0)).apply(cursor));
        when(backend.formatStatistics(cursor)).thenReturn("");
        when(cursor.columnNames()).thenReturn(List.of("id", "name"));
        when(cursor.fetchAll()).thenReturn(List.of(Arrays.<Object>asList(1L, "a,b"), Arrays.<Object>asList(2L, null)));

        RedshiftCommand cmd = new RedshiftCommand();
        cmd.env(name -> null);
        cmd.backendFactory(params -> backend);

        int code = commandLine(cmd).execute("--config", emptyConfig(), "--table-format", "csv", "-e", "select * from t");

        assertThat(code, equalTo(0));
        assertThat(out.toString(), equalTo("id,name\n1,\"a,b\"\n2,\n".replace("\n", System.lineSeparator())));
        verify(backend).close();
    }

    @Test
    public void statementErrorExitsWithOne() throws IOException {
        when(backend.withCursor(any())).thenThrow(new ConnectionException("connection reset", null));

        RedshiftCommand cmd = new RedshiftCommand();
        cmd.env(name -> null);
        cmd.backendFactory(params -> backend);

        int code = commandLine(cmd).execute("--config", emptyConfig(), "-e", "select 1");

        assertThat(code, equalTo(1));
        assertThat(err.toString(), containsString("connection reset"));
        verify(backend).close();
    }

    @Test
    public void connectionFailurePointsAtConfiguration() throws IOException {
        AthenaCommand cmd = new AthenaCommand();
        cmd.env(name -> null);
        cmd.backendFactory(params -> {
            throw new ConnectionException("Unable to reach the service", null);
        });

        String config = emptyConfig();

        int code = commandLine(cmd).execute("--config", config, "-e", "select 1");

        assertThat(code, equalTo(1));
        assertThat(err.toString(), containsString("Unable to reach the service"));
        assertThat(err.toString(), containsString("Please verify the configuration in " + config));
    }

    private CommandLine commandLine(Object cmd) {
        return new CommandLine(cmd)
                .setOut(new PrintWriter(out, true))
                .setErr(new PrintWriter(err, true));
    }

    private String emptyConfig() throws IOException {
        Path file = workDir.resolve("nimbus.conf");

        Files.writeString(file, "");

        return file.toString();
    }
}
