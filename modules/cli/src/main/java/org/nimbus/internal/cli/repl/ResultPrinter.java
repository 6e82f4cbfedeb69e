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

import java.io.PrintWriter;
import java.util.List;
import org.jetbrains.annotations.Nullable;
import org.nimbus.internal.cli.sql.QueryResult;

/**
 * Prints query results.
 */
public class ResultPrinter {
    /** Rendering of SQL {@code NULL}. */
    static final String NULL = "<null>";

    private final PrintWriter out;

    private final TableFormat format;

    /**
     * Constructor.
     *
     * @param out Output.
     * @param format Layout of rows.
     */
    public ResultPrinter(PrintWriter out, TableFormat format) {
        this.out = out;
        this.format = format;
    }

    /**
     * Prints a result.
     *
     * @param result Result.
     * @param expanded Whether rows are printed vertically, one column per line. Ignored for CSV.
     */
    public void print(QueryResult result, boolean expanded) {
        if (result.title() != null) {
            out.println(result.title());
        }

        List<List<Object>> rows = result.rows();
        List<String> headers = result.headers();

        if (rows != null && headers != null) {
            if (format == TableFormat.CSV) {
                printCsv(headers, rows);
            } else if (expanded) {
                printVertical(headers, rows);
            } else {
                printTable(headers, rows);
            }
        }

        String status = result.status();

        if (status != null && !status.isEmpty() && format != TableFormat.CSV) {
            out.println(status);
        }

        out.flush();
    }

    private void printTable(List<String> headers, List<List<Object>> rows) {
        if (headers.isEmpty()) {
            return;
        }

        int[] widths = new int[headers.size()];

        for (int i = 0; i < widths.length; i++) {
            widths[i] = headers.get(i).length();
        }

        for (List<Object> row : rows) {
            for (int i = 0; i < widths.length; i++) {
                widths[i] = Math.max(widths[i], cell(row, i).length());
            }
        }

        String border = border(widths);

        out.println(border);
        out.println(line(widths, headers));
        out.println(border);

        for (List<Object> row : rows) {
            String[] cells = new String[widths.length];

            for (int i = 0; i < cells.length; i++) {
                cells[i] = cell(row, i);
            }

            out.println(line(widths, List.of(cells)));
        }

        out.println(border);
    }

    private void printVertical(List<String> headers, List<List<Object>> rows) {
        int width = 0;

        for (String header : headers) {
            width = Math.max(width, header.length());
        }

        int num = 1;

        for (List<Object> row : rows) {
            out.println("***************************[ " + num++ + ". row ]***************************");

            for (int i = 0; i < headers.size(); i++) {
                out.println(pad(headers.get(i), width) + " | " + cell(row, i));
            }
        }
    }

    private void printCsv(List<String> headers, List<List<Object>> rows) {
        out.println(csvLine(headers));

        for (List<Object> row : rows) {
            out.println(csvLine(row));
        }
    }

    private static String csvLine(List<?> values) {
        StringBuilder sb = new StringBuilder();

        for (int i = 0; i < values.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }

            Object val = values.get(i);

            if (val == null) {
                continue;
            }

            String str = val.toString();

            if (str.indexOf(',') >= 0 || str.indexOf('"') >= 0 || str.indexOf('\n') >= 0 || str.indexOf('\r') >= 0) {
                sb.append('"').append(str.replace("\"", "\"\"")).append('"');
            } else {
                sb.append(str);
            }
        }

        return sb.toString();
    }

    private static String cell(List<Object> row, int idx) {
        @Nullable Object val = idx < row.size() ? row.get(idx) : null;

        return val == null ? NULL : val.toString();
    }

    private static String border(int[] widths) {
        StringBuilder sb = new StringBuilder("+");

        for (int width : widths) {
            sb.append("-".repeat(width + 2)).append('+');
        }

        return sb.toString();
    }

    private static String line(int[] widths, List<String> cells) {
        StringBuilder sb = new StringBuilder("|");

        for (int i = 0; i < widths.length; i++) {
            sb.append(' ').append(pad(cells.get(i), widths[i])).append(" |");
        }

        return sb.toString();
    }

    private static String pad(String str, int width) {
        return str + " ".repeat(width - str.length());
    }
}
