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
import org.nimbus.internal.backend.athena.AthenaConnectionParameters;
import org.nimbus.internal.cli.config.CliConfig;
import org.nimbus.internal.cli.config.ValueResolver;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Athena session.
 */
@Command(name = "athena", description = "Query Amazon Athena.")
public class AthenaCommand extends AbstractBackendCommand {
    @Option(names = "--aws-access-key-id", description = "AWS access key id.")
    private String accessKeyId;

    @Option(names = "--aws-secret-access-key", description = "AWS secret access key.")
    private String secretAccessKey;

    @Option(names = {"-r", "--region"}, description = "AWS region.")
    private String region;

    @Option(names = "--s3-staging-dir", description = "S3 location of query results.")
    private String s3StagingDir;

    @Option(names = "--work-group", description = "Athena work group.")
    private String workGroup;

    @Option(names = "--profile", defaultValue = "default", description = "Configuration profile (default: ${DEFAULT-VALUE}).")
    private String profile;

    @Option(names = "--result-reuse-enable", arity = "0..1", description = "Reuse results of identical recent queries.")
    private Boolean resultReuseEnable;

    @Option(names = "--result-reuse-minutes", description = "Maximum age of reused results in minutes.")
    private Integer resultReuseMinutes;

    @Override
    protected BackendType backendType() {
        return BackendType.ATHENA;
    }

    @Override
    protected BackendParameters connectionParameters(CliConfig config, Function<String, String> env) {
        ValueResolver res = new ValueResolver(config.athena(profile), env);

        return AthenaConnectionParameters.builder()
                .accessKeyId(res.string(accessKeyId, "aws-access-key-id", "AWS_ACCESS_KEY_ID"))
                .secretAccessKey(res.string(secretAccessKey, "aws-secret-access-key", "AWS_SECRET_ACCESS_KEY"))
                .region(res.string(region, "region", "AWS_REGION", "AWS_DEFAULT_REGION"))
                .s3StagingDir(res.string(s3StagingDir, "s3-staging-dir", "AWS_ATHENA_S3_STAGING_DIR"))
                .workGroup(res.string(workGroup, "work-group", "AWS_ATHENA_WORK_GROUP"))
                .roleArn(res.string(null, "role-arn"))
                .database(res.string(database(), "database"))
                .catalogName(res.string(null, "catalog"))
                .resultReuseEnable(res.bool(resultReuseEnable, "result-reuse-enable", false))
                .resultReuseMinutes(res.integer(resultReuseMinutes, "result-reuse-minutes",
                        AthenaConnectionParameters.DEFAULT_RESULT_REUSE_MINUTES))
                .build();
    }
}
