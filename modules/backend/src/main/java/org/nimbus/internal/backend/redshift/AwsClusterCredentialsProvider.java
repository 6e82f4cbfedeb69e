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

package org.nimbus.internal.backend.redshift;

import org.nimbus.internal.backend.AuthenticationException;
import org.nimbus.internal.logger.Loggers;
import org.nimbus.internal.logger.NimbusLogger;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.redshift.RedshiftClient;
import software.amazon.awssdk.services.redshift.model.GetClusterCredentialsRequest;
import software.amazon.awssdk.services.redshift.model.GetClusterCredentialsResponse;

/**
 * Calls {@code GetClusterCredentials} with the credentials of a named AWS profile.
 */
public class AwsClusterCredentialsProvider implements ClusterCredentialsProvider {
    private static final NimbusLogger LOG = Loggers.forClass(AwsClusterCredentialsProvider.class);

    /** Lifetime of derived credentials, seconds. */
    static final int DURATION_SECONDS = 3600;

    private final String profile;

    private final String region;

    /**
     * Constructor.
     *
     * @param profile AWS profile name.
     * @param region AWS region of the cluster.
     */
    public AwsClusterCredentialsProvider(String profile, String region) {
        this.profile = profile;
        this.region = region;
    }

    @Override
    public ClusterCredentials credentials(String clusterId, String dbUser, String dbName) {
        LOG.info("Getting IAM credentials for Redshift cluster [clusterId={}, profile={}]", clusterId, profile);

        try (RedshiftClient client = RedshiftClient.builder()
                .credentialsProvider(ProfileCredentialsProvider.builder().profileName(profile).build())
                .region(Region.of(region))
                .build()) {
            GetClusterCredentialsResponse res = client.getClusterCredentials(GetClusterCredentialsRequest.builder()
                    .clusterIdentifier(clusterId)
                    .dbUser(dbUser)
                    .dbName(dbName)
                    .durationSeconds(DURATION_SECONDS)
                    .autoCreate(false)
                    .build());

            LOG.info("Obtained IAM credentials [dbUser={}, expiration={}]", res.dbUser(), res.expiration());

            return new ClusterCredentials(res.dbUser(), res.dbPassword());
        } catch (SdkException e) {
            LOG.error("Failed to get IAM credentials [clusterId={}]", e, clusterId);

            throw new AuthenticationException("Failed to get IAM credentials: " + e.getMessage(), e);
        }
    }
}
