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

import org.nimbus.internal.backend.BackendConnection;
import org.nimbus.internal.backend.ConnectionException;
import org.nimbus.internal.backend.StatementCursor;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.athena.AthenaClient;

/**
 * Athena has no session: a connection is a service client plus the execution context of the queries it starts.
 */
class AthenaConnection implements BackendConnection {
    private final AthenaClientHandle handle;

    private final String catalogName;

    private final String database;

    private final AthenaConnectionParameters params;

    AthenaConnection(
            AthenaClientHandle handle,
            String catalogName,
            String database,
            AthenaConnectionParameters params
    ) {
        this.handle = handle;
        this.catalogName = catalogName;
        this.database = database;
        this.params = params;
    }

    AthenaClient client() {
        return handle.client();
    }

    String catalogName() {
        return catalogName;
    }

    AthenaConnectionParameters parameters() {
        return params;
    }

    @Override
    public String database() {
        return database;
    }

    @Override
    public StatementCursor cursor() {
        return new AthenaCursor(this);
    }

    @Override
    public void close() {
        try {
            handle.close();
        } catch (SdkException e) {
            throw new ConnectionException("Failed to close Athena client", e);
        }
    }
}
