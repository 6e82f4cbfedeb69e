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
import static org.hamcrest.Matchers.arrayContaining;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

/**
 * Tests for {@link AthenaClientHandle}.
 */
@ExtendWith(MockitoExtension.class)
public class AthenaClientHandleTest extends BaseNimbusAbstractTest {
    @Mock
    private AthenaClient client;

    @Mock
    private SdkAutoCloseable credentials;

    @Mock
    private SdkAutoCloseable sts;

    @Test
    public void closesClientThenResources() {
        new AthenaClientHandle(client, credentials, sts).close();

        InOrder order = inOrder(client, credentials, sts);

        order.verify(client).close();
        order.verify(credentials).close();
        order.verify(sts).close();
    }

    @Test
    public void failureDoesNotStopClosingTheRest() {
        IllegalStateException first = new IllegalStateException("client");
        IllegalStateException second = new IllegalStateException("credentials");

        doThrow(first).when(client).close();
        doThrow(second).when(credentials).close();

        AthenaClientHandle handle = new AthenaClientHandle(client, credentials, sts);

        IllegalStateException ex = assertThrows(IllegalStateException.class, handle::close);

        assertThat(ex, sameInstance(first));
        assertThat(ex.getSuppressed(), arrayContaining(second));

        verify(sts).close();
    }
}
