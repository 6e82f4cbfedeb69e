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

package org.nimbus.internal.backend;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Supported query engines.
 */
public enum BackendType {
    ATHENA("athena"),

    REDSHIFT("redshift");

    private final String typeName;

    BackendType(String typeName) {
        this.typeName = typeName;
    }

    public String typeName() {
        return typeName;
    }

    /**
     * Resolves a backend type by its name, ignoring case.
     *
     * @param name Type name.
     * @return Backend type.
     * @throws IllegalArgumentException If the name is unknown.
     */
    public static BackendType fromString(String name) {
        String lower = name == null ? "" : name.toLowerCase(Locale.ROOT);

        for (BackendType type : values()) {
            if (type.typeName.equals(lower)) {
                return type;
            }
        }

        throw new IllegalArgumentException("Unsupported backend type: " + name + ". Supported types: "
                + Arrays.stream(values()).map(BackendType::typeName).collect(Collectors.joining(", ")));
    }
}
