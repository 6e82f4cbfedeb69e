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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.backend.BackendParameters;
import org.nimbus.internal.backend.BackendType;

/**
 * Parameters of a Redshift connection.
 */
public class RedshiftConnectionParameters implements BackendParameters {
    /** Default cluster port. */
    public static final int DEFAULT_PORT = 5439;

    /** Database used when none is configured. */
    public static final String DEFAULT_DATABASE = "dev";

    /** Default SSL mode. */
    public static final String DEFAULT_SSL_MODE = "prefer";

    /** Default AWS profile for IAM authentication. */
    public static final String DEFAULT_AWS_PROFILE = "default";

    /** Default AWS region for IAM authentication. */
    public static final String DEFAULT_REGION = "us-east-1";

    /** User prefix that forces IAM authentication. */
    public static final String IAM_USER_PREFIX = "IAM:";

    private final @Nullable String host;

    private final int port;

    private final @Nullable String database;

    private final @Nullable String user;

    private final @Nullable String password;

    private final String sslMode;

    private final @Nullable Integer connectTimeout;

    private final String awsProfile;

    private final String region;

    private final Map<String, String> extraProperties;

    private RedshiftConnectionParameters(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.user = builder.user;
        this.password = builder.password;
        this.sslMode = builder.sslMode;
        this.connectTimeout = builder.connectTimeout;
        this.awsProfile = builder.awsProfile;
        this.region = builder.region;
        this.extraProperties = Collections.unmodifiableMap(new LinkedHashMap<>(builder.extraProperties));
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public BackendType type() {
        return BackendType.REDSHIFT;
    }

    public @Nullable String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public @Nullable String database() {
        return database;
    }

    /** Database user as configured, possibly with the {@link #IAM_USER_PREFIX}. */
    public @Nullable String user() {
        return user;
    }

    public @Nullable String password() {
        return password;
    }

    public String sslMode() {
        return sslMode;
    }

    /** Connect timeout in seconds, {@code null} for the driver default. */
    public @Nullable Integer connectTimeout() {
        return connectTimeout;
    }

    public String awsProfile() {
        return awsProfile;
    }

    public String region() {
        return region;
    }

    /** Additional driver properties. */
    public Map<String, String> extraProperties() {
        return extraProperties;
    }

    @Override
    public String toString() {
        return "RedshiftConnectionParameters [host=" + host + ", port=" + port + ", database=" + database + ", user=" + user
                + ", sslMode=" + sslMode + ", connectTimeout=" + connectTimeout + ", awsProfile=" + awsProfile
                + ", region=" + region + ']';
    }

    /** Builder. */
    public static class Builder {
        private @Nullable String host;

        private int port = DEFAULT_PORT;

        private @Nullable String database;

        private @Nullable String user;

        private @Nullable String password;

        private String sslMode = DEFAULT_SSL_MODE;

        private @Nullable Integer connectTimeout;

        private String awsProfile = DEFAULT_AWS_PROFILE;

        private String region = DEFAULT_REGION;

        private final Map<String, String> extraProperties = new LinkedHashMap<>();

        public Builder host(@Nullable String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder database(@Nullable String database) {
            this.database = database;
            return this;
        }

        public Builder user(@Nullable String user) {
            this.user = user;
            return this;
        }

        public Builder password(@Nullable String password) {
            this.password = password;
            return this;
        }

        public Builder sslMode(@Nullable String sslMode) {
            this.sslMode = sslMode == null ? DEFAULT_SSL_MODE : sslMode;
            return this;
        }

        public Builder connectTimeout(@Nullable Integer connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder awsProfile(@Nullable String awsProfile) {
            this.awsProfile = awsProfile == null ? DEFAULT_AWS_PROFILE : awsProfile;
            return this;
        }

        public Builder region(@Nullable String region) {
            this.region = region == null ? DEFAULT_REGION : region;
            return this;
        }

        public Builder extraProperty(String name, String value) {
            extraProperties.put(name, value);
            return this;
        }

        public RedshiftConnectionParameters build() {
            return new RedshiftConnectionParameters(this);
        }
    }
}
