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

package org.nimbus.internal.backend.athena;

import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.AthenaClientBuilder;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.StsClientBuilder;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

/**
 * Builds clients from static keys when given, otherwise from the default provider chain. A role ARN, when given, is
 * assumed through STS on top of those credentials.
 */
public class DefaultAthenaClientFactory implements AthenaClientFactory {
    private static final NimbusLogger LOG = Loggers.forClass(DefaultAthenaClientFactory.class);

    private static final String ROLE_SESSION_NAME = "nimbus-cli";

    @Override
    public AthenaClientHandle create(AthenaConnectionParameters params) {
        AwsCredentialsProvider credentials = baseCredentials(params);

        if (params.roleArn() == null) {
            return new AthenaClientHandle(athenaClient(params, credentials));
        }

        LOG.debug("Assuming role [roleArn={}]", params.roleArn());

        StsClientBuilder stsBuilder = StsClient.builder().credentialsProvider(credentials);

        if (params.region() != null) {
            stsBuilder.region(Region.of(params.region()));
        }

        StsClient sts = stsBuilder.build();

        StsAssumeRoleCredentialsProvider roleCredentials;
        AthenaClient client;

        try {
            roleCredentials = StsAssumeRoleCredentialsProvider.builder()
                    .stsClient(sts)
                    .refreshRequest(req -> req.roleArn(params.roleArn()).roleSessionName(ROLE_SESSION_NAME))
                    .build();
        } catch (RuntimeException e) {
            sts.close();

            throw e;
        }

        try {
            client = athenaClient(params, roleCredentials);
        } catch (RuntimeException e) {
            roleCredentials.close();
            sts.close();

            throw e;
        }

        return new AthenaClientHandle(client, roleCredentials, sts);
    }

    private static AthenaClient athenaClient(AthenaConnectionParameters params, AwsCredentialsProvider credentials) {
        AthenaClientBuilder builder = AthenaClient.builder().credentialsProvider(credentials);

        if (params.region() != null) {
            builder.region(Region.of(params.region()));
        }

        return builder.build();
    }

    private static AwsCredentialsProvider baseCredentials(AthenaConnectionParameters params) {
        if (params.accessKeyId() != null && params.secretAccessKey() != null) {
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(params.accessKeyId(), params.secretAccessKey()));
        }

        return DefaultCredentialsProvider.create();
    }
}
