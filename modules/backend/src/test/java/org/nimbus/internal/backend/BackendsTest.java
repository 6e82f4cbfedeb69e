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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.nimbus.internal.backend.athena.AthenaConnectionParameters;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;

/**
 * Tests for {@link Backends} and {@link BackendType}.
 */
public class BackendsTest extends BaseNimbusAbstractTest {
    @Test
    public void unknownTypeListsSupportedTypes() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Backends.create("bigquery", AthenaConnectionParameters.builder().build()));

        assertThat(ex.getMessage(), containsString("bigquery"));
        assertThat(ex.getMessage(), containsString("athena, redshift"));
    }

    @Test
    public void parametersMustMatchType() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> Backends.create("redshift", AthenaConnectionParameters.builder().build()));

        assertThat(ex.getMessage(), containsString("athena"));
    }

    @Test
    public void typeNameIsCaseInsensitive() {
        assertThat(BackendType.fromString("Redshift"), equalTo(BackendType.REDSHIFT));
        assertThat(BackendType.fromString("ATHENA"), equalTo(BackendType.ATHENA));
    }
}
