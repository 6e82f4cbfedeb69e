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

import java.util.Arrays;
import org.jetbrains.annotations.Nullable;

/**
 * Formats messages with {@code {}} anchors: {@code format("a={}, b={}", 1, 2)} gives {@code "a=1, b=2"}.
 *
 * <p>An anchor preceded by a backslash is emitted literally. Missing parameters leave the anchor in place, extra
 * parameters are ignored. Array parameters are rendered with {@link Arrays#toString}.
 */
public final class NimbusStringFormatter {
    private static final String ANCHOR = "{}";

    private NimbusStringFormatter() {
    }

    /**
     * Substitutes parameters into the message pattern.
     *
     * @param pattern Message pattern, can be {@code null}.
     * @param params Parameters.
     * @return Formatted message.
     */
    public static String format(@Nullable String pattern, Object @Nullable ... params) {
        if (pattern == null) {
            return "null";
        }

        if (params == null || params.length == 0 || !pattern.contains(ANCHOR)) {
            return pattern;
        }

        StringBuilder sb = new StringBuilder(pattern.length() + 16 * params.length);

        int from = 0;
        int paramIdx = 0;

        while (paramIdx < params.length) {
            int anchor = pattern.indexOf(ANCHOR, from);

            if (anchor < 0) {
                break;
            }

            if (anchor > 0 && pattern.charAt(anchor - 1) == '\\') {
                sb.append(pattern, from, anchor - 1).append(ANCHOR);
            } else {
                sb.append(pattern, from, anchor).append(render(params[paramIdx++]));
            }

            from = anchor + ANCHOR.length();
        }

        sb.append(pattern, from, pattern.length());

        return sb.toString();
    }

    private static String render(@Nullable Object param) {
        if (param == null) {
            return "null";
        }

        if (param instanceof Object[]) {
            return Arrays.deepToString((Object[]) param);
        }

        if (param instanceof long[]) {
            return Arrays.toString((long[]) param);
        }

        if (param instanceof int[]) {
            return Arrays.toString((int[]) param);
        }

        if (param instanceof byte[]) {
            return Arrays.toString((byte[]) param);
        }

        return String.valueOf(param);
    }
}
