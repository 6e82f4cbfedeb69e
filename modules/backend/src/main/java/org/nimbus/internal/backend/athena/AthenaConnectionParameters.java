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

import java.time.Duration;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.BackendParameters;
import org.nimbus.internal.backend.BackendType;

/**
 * Parameters of an Athena connection. Unset credentials and region are resolved by the AWS default provider chains.
 */
public class AthenaConnectionParameters implements BackendParameters {
    /** Catalog used when none is configured. */
    public static final String DEFAULT_CATALOG = "AwsDataCatalog";

    /** Default maximum age of reused results. */
    public static final int DEFAULT_RESULT_REUSE_MINUTES = 60;

    /** Default interval between query state polls. */
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(200);

    private final @Nullable String accessKeyId;

    private final @Nullable String secretAccessKey;

    private final @Nullable String region;

    private final @Nullable String s3StagingDir;

    private final @Nullable String workGroup;

    private final @Nullable String roleArn;

    private final @Nullable String database;

    private final String catalogName;

    private final boolean resultReuseEnable;

    private final int resultReuseMinutes;

    private final Duration pollInterval;

    private AthenaConnectionParameters(Builder builder) {
        this.accessKeyId = builder.accessKeyId;
        this.secretAccessKey = builder.secretAccessKey;
        this.region = builder.region;
        this.s3StagingDir = builder.s3StagingDir;
        this.workGroup = builder.workGroup;
        this.roleArn = builder.roleArn;
        this.database = builder.database;
        this.catalogName = builder.catalogName == null ? DEFAULT_CATALOG : builder.catalogName;
        this.resultReuseEnable = builder.resultReuseEnable;
        this.resultReuseMinutes = builder.resultReuseMinutes;
        this.pollInterval = builder.pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public BackendType type() {
        return BackendType.ATHENA;
    }

    public @Nullable String accessKeyId() {
        return accessKeyId;
    }

    public @Nullable String secretAccessKey() {
        return secretAccessKey;
    }

    public @Nullable String region() {
        return region;
    }

    public @Nullable String s3StagingDir() {
        return s3StagingDir;
    }

    public @Nullable String workGroup() {
        return workGroup;
    }

    public @Nullable String roleArn() {
        return roleArn;
    }

    /** Initial database, possibly in the {@code catalog.database} form. */
    public @Nullable String database() {
        return database;
    }

    public String catalogName() {
        return catalogName;
    }

    public boolean resultReuseEnable() {
        return resultReuseEnable;
    }

    public int resultReuseMinutes() {
        return resultReuseMinutes;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    @Override
    public String toString() {
        return "AthenaConnectionParameters [region=" + region + ", s3StagingDir=" + s3StagingDir + ", workGroup=" + workGroup
                + ", roleArn=" + roleArn + ", database=" + database + ", catalogName=" + catalogName
                + ", resultReuseEnable=" + resultReuseEnable + ", resultReuseMinutes=" + resultReuseMinutes
                + ", pollInterval=" + pollInterval + ']';
    }

    /** Builder. */
    public static class Builder {
        private @Nullable String accessKeyId;

        private @Nullable String secretAccessKey;

        private @Nullable String region;

        private @Nullable String s3StagingDir;

        private @Nullable String workGroup;

        private @Nullable String roleArn;

        private @Nullable String database;

        private @Nullable String catalogName;

        private boolean resultReuseEnable;

        private int resultReuseMinutes = DEFAULT_RESULT_REUSE_MINUTES;

        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        public Builder accessKeyId(@Nullable String accessKeyId) {
            this.accessKeyId = accessKeyId;
            return this;
        }

        public Builder secretAccessKey(@Nullable String secretAccessKey) {
            this.secretAccessKey = secretAccessKey;
            return this;
        }

        public Builder region(@Nullable String region) {
            this.region = region;
            return this;
        }

        public Builder s3StagingDir(@Nullable String s3StagingDir) {
            this.s3StagingDir = s3StagingDir;
            return this;
        }

        public Builder workGroup(@Nullable String workGroup) {
            this.workGroup = workGroup;
            return this;
        }

        public Builder roleArn(@Nullable String roleArn) {
            this.roleArn = roleArn;
            return this;
        }

        public Builder database(@Nullable String database) {
            this.database = database;
            return this;
        }

        public Builder catalogName(@Nullable String catalogName) {
            this.catalogName = catalogName;
            return this;
        }

        public Builder resultReuseEnable(boolean resultReuseEnable) {
            this.resultReuseEnable = resultReuseEnable;
            return this;
        }

        public Builder resultReuseMinutes(int resultReuseMinutes) {
            this.resultReuseMinutes = resultReuseMinutes;
            return this;
        }

        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }

        public AthenaConnectionParameters build() {
            return new AthenaConnectionParameters(this);
        }
    }
}
