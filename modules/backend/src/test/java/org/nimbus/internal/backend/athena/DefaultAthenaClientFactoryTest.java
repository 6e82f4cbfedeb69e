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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.notNullValue;

import org.junit.jupiter.api.Test;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;
import software.amazon.awssdk.services.sts.StsClient;
import software.amazon.awssdk.services.sts.auth.StsAssumeRoleCredentialsProvider;

/**
 * Tests for {@link DefaultAthenaClientFactory}. Clients are only built and closed, no request is sent.
 */
public class DefaultAthenaClientFactoryTest extends BaseNimbusAbstractTest {
    private final DefaultAthenaClientFactory factory = new DefaultAthenaClientFactory();

    @Test
    public void staticKeysNeedNoExtraResources() {
        try (AthenaClientHandle handle = factory.create(params(null))) {
            assertThat(handle.client(), notNullValue());
            assertThat(handle.resources(), empty());
        }
    }

    @Test
    public void roleAssumptionResourcesAreOwnedByHandle() {
        try (AthenaClientHandle handle = factory.create(params("arn:aws:iam::123456789012:role/analyst"))) {
            assertThat(handle.resources(), contains(
                    instanceOf(StsAssumeRoleCredentialsProvider.class),
                    instanceOf(StsClient.class)
            ));
        }
    }

    private static AthenaConnectionParameters params(String roleArn) {
        return AthenaConnectionParameters.builder()
                .accessKeyId("AKIDEXAMPLE")
                .secretAccessKey("secret")
                .region("us-east-1")
                .s3StagingDir("s3://results/")
                .roleArn(roleArn)
                .build();
    }
}
