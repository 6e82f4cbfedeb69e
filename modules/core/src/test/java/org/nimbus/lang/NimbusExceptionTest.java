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

package org.nimbus.lang;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.matchesPattern;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link NimbusException} and the error code registry.
 */
public class NimbusExceptionTest {
    @Test
    public void messageCarriesCodeAndTraceId() {
        NimbusException ex = new NimbusException(ErrorGroups.Sql.STATEMENT_EXECUTION_ERR, "Table not found");

        assertThat(ex.codeAsString(), equalTo("NIM-SQL-1"));
        assertThat(ex.groupName(), equalTo("SQL"));
        assertThat(ex.errorCode(), equalTo(1));
        assertThat(ex.rawMessage(), equalTo("Table not found"));
        assertThat(ex.getMessage(), matchesPattern("NIM-SQL-1 Table not found TraceId:[0-9a-f]{8}"));
    }

    @Test
    public void traceIdIsInheritedFromCause() {
        NimbusException cause = new NimbusException(ErrorGroups.Connection.CONNECTION_ERR, "refused");
        NimbusException ex = new NimbusException(ErrorGroups.Metadata.DISCOVERY_ERR, "listing failed", cause);

        assertThat(ex.traceId(), equalTo(cause.traceId()));
    }

    @Test
    public void fullCodePacksGroupAndErrorCodes() {
        int code = ErrorGroups.Connection.AUTHENTICATION_ERR;

        assertThat(ErrorGroups.extractGroupCode(code), equalTo((short) 2));
        assertThat(ErrorGroup.extractErrorCode(code), equalTo((short) 3));
        assertThat(ErrorGroups.errorGroupByCode(code).name(), equalTo("CONN"));
    }

    @Test
    public void duplicateRegistrationIsRejected() {
        assertThat(ErrorGroups.Sql.SQL_ERR_GROUP.name(), equalTo("SQL"));

        assertThrows(IllegalArgumentException.class,
                () -> ErrorGroups.Common.COMMON_ERR_GROUP.registerErrorCode((short) 1));
        assertThrows(IllegalArgumentException.class, () -> ErrorGroups.registerGroup("sql", (short) 42));
    }
}
