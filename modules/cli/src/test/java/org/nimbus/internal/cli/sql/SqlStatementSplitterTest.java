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

package org.nimbus.internal.cli.sql;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;

import org.junit.jupiter.api.Test;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;

/**
 * Tests for {@link SqlStatementSplitter}.
 */
public class SqlStatementSplitterTest extends BaseNimbusAbstractTest {
    private final SqlStatementSplitter splitter = new SqlStatementSplitter();

    @Test
    public void splitsAtSemicolons() {
        assertThat(splitter.split("select 1; select 2;\n select 3"), contains("select 1;", "select 2;", "select 3"));
    }

    @Test
    public void ignoresSemicolonsInQuotes() {
        assertThat(
                splitter.split("select 'a;b', \"c;d\", `e;f` from t; select 'it''s;'"),
                contains("select 'a;b', \"c;d\", `e;f` from t;", "select 'it''s;'")
        );
    }

    @Test
    public void ignoresSemicolonsInComments() {
        assertThat(
                splitter.split("select 1 -- one; two\n; select /* ; */ 2"),
                contains("select 1 -- one; two\n;", "select /* ; */ 2")
        );
    }

    @Test
    public void ignoresSemicolonsInDollarQuotes() {
        assertThat(
                splitter.split("create function f() returns int as $body$ select 1; $body$ language sql; select 2"),
                contains("create function f() returns int as $body$ select 1; $body$ language sql;", "select 2")
        );
    }

    @Test
    public void dollarInsideIdentifierDoesNotOpenQuote() {
        assertThat(splitter.split("select a$x$b from t; select 2"), contains("select a$x$b from t;", "select 2"));
        assertThat(
                splitter.split("select price$usd$ from t; select 2; select 3"),
                contains("select price$usd$ from t;", "select 2;", "select 3")
        );
    }

    @Test
    public void positionalParameterIsNotDollarQuote() {
        assertThat(splitter.split("select $1, $2$ from t; select 2"), contains("select $1, $2$ from t;", "select 2"));
    }

    @Test
    public void dropsCommentOnlySegments() {
        assertThat(splitter.split("-- nothing here\n;;  ; /* still nothing */"), empty());
    }

    @Test
    public void keepsExpandedTerminator() {
        assertThat(splitter.split("select 1\\G; select 2"), contains("select 1\\G;", "select 2"));
    }
}
