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

import java.util.function.Function;
import org.nimbus.internal.backend.BackendParameters;
import org.nimbus.internal.backend.BackendType;
import org.nimbus.internal.backend.redshift.RedshiftConnectionParameters;
import org.nimbus.internal.cli.config.CliConfig;
import org.nimbus.internal.cli.config.ValueResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Redshift session.
 */
@Command(name = "redshift", description = "Query Amazon Redshift.")
public class RedshiftCommand extends AbstractBackendCommand {
    @Option(names = {"-h", "--host"}, description = "Cluster endpoint.")
    private String host;

    @Option(names = {"-p", "--port"}, description = "Port (default: 5439).")
    private Integer port;

    @Option(names = {"-U", "--user"}, description = "Database user, prefix with IAM: to force IAM authentication.")
    private String user;

    @Option(names = {"-W", "--password"}, description = "Password, omit for IAM authentication.")
    private String password;

    @Option(names = "--sslmode", description = "SSL mode: prefer, require, disable.")
    private String sslMode;

    @Option(names = "--aws-profile", description = "AWS profile for IAM authentication.")
    private String awsProfile;

    @Option(names = "--region", description = "AWS region (default: us-east-1).")
    private String region;

    @Option(names = "--connect-timeout", description = "Connection timeout in seconds.")
    private Integer connectTimeout;

    @Override
    protected BackendType backendType() {
        return BackendType.REDSHIFT;
    }

    @Override
    protected BackendParameters connectionParameters(CliConfig config, Function<String, String> env) {
        ValueResolver res = new ValueResolver(config.redshift(), env);

        Integer timeout = connectTimeout;

        if (timeout == null) {
            timeout = ValueResolver.parseInt(res.string(null, "connect-timeout"));
        }

        return RedshiftConnectionParameters.builder()
                .host(res.string(host, "host", "REDSHIFT_HOST", "PGHOST"))
                .port(res.integer(port, "port", RedshiftConnectionParameters.DEFAULT_PORT, "REDSHIFT_PORT", "PGPORT"))
                .database(res.stringOrDefault(database(), "database", RedshiftConnectionParameters.DEFAULT_DATABASE,
                        "REDSHIFT_DATABASE", "PGDATABASE"))
                .user(res.string(user, "user", "REDSHIFT_USER", "PGUSER", "USER"))
                .password(res.string(password, "password", "REDSHIFT_PASSWORD", "PGPASSWORD"))
                .sslMode(res.stringOrDefault(sslMode, "sslmode", RedshiftConnectionParameters.DEFAULT_SSL_MODE, "PGSSLMODE"))
                .awsProfile(res.stringOrDefault(awsProfile, "aws-profile", RedshiftConnectionParameters.DEFAULT_AWS_PROFILE,
                        "AWS_PROFILE"))
                .region(res.stringOrDefault(region, "region", RedshiftConnectionParameters.DEFAULT_REGION, "AWS_DEFAULT_REGION"))
                .connectTimeout(timeout)
                .build();
    }
}
