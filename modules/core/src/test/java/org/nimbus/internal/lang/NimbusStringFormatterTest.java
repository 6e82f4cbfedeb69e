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

package org.nimbus.internal.lang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link NimbusStringFormatter}.
 */
public class NimbusStringFormatterTest {
    @Test
    public void substitutesAnchorsInOrder() {
        assertThat(NimbusStringFormatter.format("a={}, b={}", 1, "two"), equalTo("a=1, b=two"));
    }

    @Test
    public void missingParametersLeaveAnchors() {
        assertThat(NimbusStringFormatter.format("a={}, b={}", 1), equalTo("a=1, b={}"));
    }

    @Test
    public void extraParametersAreIgnored() {
        assertThat(NimbusStringFormatter.format("a={}", 1, 2), equalTo("a=1"));
    }

    @Test
    public void escapedAnchorIsLiteral() {
        assertThat(NimbusStringFormatter.format("\\{} and {}", "x"), equalTo("{} and x"));
    }

    @Test
    public void arraysAndNulls() {
        assertThat(NimbusStringFormatter.format("{} {} {}", new int[] {1, 2}, new Object[] {"a", null}, null),
                equalTo("[1, 2] [a, null] null"));
    }

    @Test
    public void nullPattern() {
        assertThat(NimbusStringFormatter.format(null, 1), equalTo("null"));
    }
}
