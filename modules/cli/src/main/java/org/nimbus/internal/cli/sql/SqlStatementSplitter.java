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

import java.util.ArrayList;
import java.util.List;
import org.jetbrains.annotations.Nullable;

/**
 * Splits SQL at semicolons that are outside of quotes and comments.
 *
 * <p>Recognizes single and double quoted strings (doubled quote escapes), backtick quoted identifiers, {@code --} line
 * comments, block comments and {@code $tag$} dollar quotes. Segments made of comments only are
 * dropped.
 */
public class SqlStatementSplitter implements StatementSplitter {
    @Override
    public List<String> split(String text) {
        List<String> statements = new ArrayList<>();

        if (text == null || text.isBlank()) {
            return statements;
        }

        char quote = 0;
        boolean inLineComment = false;
        boolean inBlockComment = false;
        boolean hasCode = false;
        String dollarTag = null;
        int start = 0;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';

            if (inLineComment) {
                if (c == '\n' || c == '\r') {
                    inLineComment = false;
                }

                continue;
            }

            if (inBlockComment) {
                if (c == '*' && next == '/') {
                    inBlockComment = false;
                    i++;
                }

                continue;
            }

            if (dollarTag != null) {
                if (text.startsWith(dollarTag, i)) {
                    i += dollarTag.length() - 1;
                    dollarTag = null;
                }

                continue;
            }

            if (quote != 0) {
                if (c == quote && next == quote) {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }

                continue;
            }

            if (c == '-' && next == '-') {
                inLineComment = true;
                i++;

                continue;
            }

            if (c == '/' && next == '*') {
                inBlockComment = true;
                i++;

                continue;
            }

            if (c == '$' && (i == 0 || !isIdentifierPart(text.charAt(i - 1)))) {
                String tag = dollarTag(text, i);

                if (tag != null) {
                    dollarTag = tag;
                    hasCode = true;
                    i += tag.length() - 1;

                    continue;
                }
            }

            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                hasCode = true;

                continue;
            }

            if (c == ';') {
                if (hasCode) {
                    statements.add(text.substring(start, i + 1).trim());
                }

                start = i + 1;
                hasCode = false;

                continue;
            }

            if (!Character.isWhitespace(c)) {
                hasCode = true;
            }
        }

        if (hasCode) {
            statements.add(text.substring(start).trim());
        }

        return statements;
    }

    /** Returns the {@code $tag$} opening at {@code idx}, or {@code null}. Tags never start with a digit. */
    private static @Nullable String dollarTag(String text, int idx) {
        for (int end = idx + 1; end < text.length(); end++) {
            char ch = text.charAt(end);

            if (ch == '$') {
                return text.substring(idx, end + 1);
            }

            if (end == idx + 1 && Character.isDigit(ch)) {
                return null;
            }

            if (!Character.isLetterOrDigit(ch) && ch != '_') {
                return null;
            }
        }

        return null;
    }

    private static boolean isIdentifierPart(char ch) {
        return Character.isLetterOrDigit(ch) || ch == '_' || ch == '$';
    }
}
