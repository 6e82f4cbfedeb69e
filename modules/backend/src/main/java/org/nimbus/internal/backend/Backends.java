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

import org.nimbus.internal.backend.athena.AthenaBackend;
import org.nimbus.internal.backend.athena.AthenaConnectionParameters;
import org.nimbus.internal.backend.redshift.RedshiftBackend;
import org.nimbus.internal.backend.redshift.RedshiftConnectionParameters;

/**
 * Backend factory.
 */
public final class Backends {
    private Backends() {
        // No-op.
    }

    /**
     * Creates a backend of the named type and connects it.
     *
     * @param backendType Type name, {@code athena} or {@code redshift}.
     * @param params Connection parameters of that type.
     * @return Connected backend.
     * @throws IllegalArgumentException If the type is unknown or does not match the parameters.
     * @throws ConnectionException If the connection can't be established.
     */
    public static Backend create(String backendType, BackendParameters params) {
        BackendType type = BackendType.fromString(backendType);

        if (params.type() != type) {
            throw new IllegalArgumentException("Parameters of type " + params.type().typeName()
                    + " can't be used for a backend of type " + type.typeName());
        }

        Backend backend = instantiate(type, params);

        backend.connect(null);

        return backend;
    }

    private static Backend instantiate(BackendType type, BackendParameters params) {
        switch (type) {
            case ATHENA:
                return new AthenaBackend((AthenaConnectionParameters) params);

            case REDSHIFT:
                return new RedshiftBackend((RedshiftConnectionParameters) params);

            default:
                throw new IllegalArgumentException("Unsupported backend type: " + type);
        }
    }
}
