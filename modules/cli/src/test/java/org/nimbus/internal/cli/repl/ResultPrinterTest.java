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
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nimbus.internal.cli.sql.QueryResult;
import org.nimbus.internal.testframework.BaseNimbusAbstractTest;

/**
 * Tests for {@link ResultPrinter}.
 */
public class ResultPrinterTest extends BaseNimbusAbstractTest {
    private final StringWriter sw = new StringWriter();

    private final QueryResult result = new QueryResult(
            null,
            List.of(Arrays.<Object>asList(1L, "alice"), Arrays.<Object>asList(22L, null)),
            List.of("id", "name"),
            "2 rows in set"
    );

    @Test
    public void printsAlignedTable() {
        new ResultPrinter(new PrintWriter(sw), TableFormat.ASCII).print(result, false);

        assertThat(output(), equalTo(""
                + "+----+--------+\n"
                + "| id | name   |\n"
                + "+----+--------+\n"
                + "| 1  | alice  |\n"
                + "| 22 | <null> |\n"
                + "+----+--------+\n"
                + "2 rows in set\n"));
    }

    @Test
    public void printsExpandedRows() {
        new ResultPrinter(new PrintWriter(sw), TableFormat.ASCII).print(result, true);

        assertThat(output(), equalTo(""
                + "***************************[ 1. row ]***************************\n"
                + "id   | 1\n"
                + "name | alice\n"
                + "***************************[ 2. row ]***************************\n"
                + "id   | 22\n"
                + "name | <null>\n"
                + "2 rows in set\n"));
    }

    @Test
    public void printsCsvWithoutStatus() {
        new ResultPrinter(new PrintWriter(sw), TableFormat.CSV).print(result, true);

        assertThat(output(), equalTo("id,name\n1,alice\n22,\n"));
    }

    @Test
    public void printsTitleAndStatusOnly() {
        new ResultPrinter(new PrintWriter(sw), TableFormat.ASCII).print(new QueryResult("Databases", null, null, "Query OK"), false);

        assertThat(output(), equalTo("Databases\nQuery OK\n"));
    }

    @Test
    public void emptyResultPrintsNothing() {
        new ResultPrinter(new PrintWriter(sw), TableFormat.ASCII).print(QueryResult.EMPTY, false);

        assertThat(output(), equalTo(""));
    }

    @Test
    public void unknownFormatIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> TableFormat.fromString("xml"));

        assertThat(TableFormat.fromString(" Csv "), equalTo(TableFormat.CSV));
    }

    private String output() {
        return sw.toString().replace(System.lineSeparator(), "\n");
    }
}
