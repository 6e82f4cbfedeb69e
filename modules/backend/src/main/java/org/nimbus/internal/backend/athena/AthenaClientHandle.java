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

import java.util.Arrays;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * Athena client together with the resources it was built on, such as an STS client and the credentials provider
 * assuming a role through it. The SDK does not close a credentials provider supplied by the caller, so they are closed
 * here, after the client.
 */
public class AthenaClientHandle implements SdkAutoCloseable {
    private final AthenaClient client;

    private final List<SdkAutoCloseable> resources;

    /**
     * Constructor.
     *
     * @param client Athena client.
     * @param resources Resources closed after the client, in the given order.
     */
    public AthenaClientHandle(AthenaClient client, SdkAutoCloseable... resources) {
        this.client = client;
        this.resources = Arrays.asList(resources);
    }

    /** Athena client. */
    public AthenaClient client() {
        return client;
    }

    List<SdkAutoCloseable> resources() {
        return resources;
    }

    /**
     * Closes the client and then every resource. All of them are closed even when one fails; the first failure is
     * rethrown with the later ones suppressed.
     */
    @Override
    public void close() {
        RuntimeException err = closeQuietly(client, null);

        for (SdkAutoCloseable resource : resources) {
            err = closeQuietly(resource, err);
        }

        if (err != null) {
            throw err;
        }
    }

    private static @Nullable RuntimeException closeQuietly(SdkAutoCloseable resource, @Nullable RuntimeException err) {
        try {
            resource.close();
        } catch (RuntimeException e) {
            if (err == null) {
                return e;
            }

            err.addSuppressed(e);
        }

        return err;
    }
}
