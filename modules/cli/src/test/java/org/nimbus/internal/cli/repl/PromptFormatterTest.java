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

package org.nimbus.internal.cli.repl;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.LocalTime;
import org.junit.jupiter.api.Test;
import org.nimbus.internal.backend.Backend;
import org.nimbus.internal.backend.redshift.RedshiftBackend;
import org.nimbus.internal.backend.redshift.RedshiftConnectionParameters;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;

/**
 * Tests for {@link PromptFormatter}.
 */
public class PromptFormatterTest extends BaseNimbusAbstractTest {
    private static final LocalTime NOW = LocalTime.of(9, 5, 7);

    @Test
    public void expandsRedshiftPlaceholders() {
        RedshiftConnectionParameters params = RedshiftConnectionParameters.builder()
                .host("cluster.example.com")
                .port(5440)
                .user("IAM:admin")
                .build();

        RedshiftBackend backend = mock(RedshiftBackend.class);

        when(backend.parameters()).thenReturn(params);
        when(backend.user()).thenReturn("admin");
        when(backend.database()).thenReturn("dev");

        assertThat(PromptFormatter.format("\\u@\\h:\\p/\\d \\t> ", backend, NOW),
                equalTo("admin@cluster.example.com:5440/dev 09:05:07> "));
    }

    @Test
    public void missingValuesRenderAsNone() {
        Backend backend = mock(Backend.class);

        assertThat(PromptFormatter.format("\\d@\\h> ", backend, NOW), equalTo("(none)@(none)> "));
    }
}
