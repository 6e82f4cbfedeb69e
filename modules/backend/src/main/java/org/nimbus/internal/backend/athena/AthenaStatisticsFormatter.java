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

import java.util.Locale;
import org.nimbus.internal.backend.QueryStatistics;

/**
 * Renders Athena execution statistics.
 */
public final class AthenaStatisticsFormatter {
    private static final String[] SIZE_SUFFIXES = {"B", "KB", "MB", "GB", "TB"};

    /** Price of one scanned terabyte in most regions, USD. */
    private static final double PRICE_PER_TB = 5.0;

    private static final double BYTES_IN_TB = Math.pow(1024, 4);

    private AthenaStatisticsFormatter() {
        // No-op.
    }

    /**
     * Formats statistics as a status suffix.
     *
     * @param stats Statistics.
     * @return Suffix starting with a line break.
     */
    public static String format(QueryStatistics stats) {
        return String.format(Locale.ROOT, "\nExecution time: %d ms, Data scanned: %s, Approximate cost: $%.2f",
                stats.engineExecutionTimeInMillis(),
                humanizeSize(stats.dataScannedInBytes()),
                approximateCost(stats.dataScannedInBytes()));
    }

    /**
     * Approximate cost of scanning {@code bytes}, USD.
     *
     * @param bytes Scanned bytes.
     * @return Cost.
     */
    public static double approximateCost(long bytes) {
        return bytes / BYTES_IN_TB * PRICE_PER_TB;
    }

    /**
     * Renders a byte count with a binary suffix, e.g. {@code 1.5 KB}. Trailing zeros are trimmed.
     *
     * @param bytes Byte count.
     * @return Human readable size.
     */
    public static String humanizeSize(long bytes) {
        double num = bytes;
        int idx = 0;

        while (num >= 1024 && idx < SIZE_SUFFIXES.length - 1) {
            num /= 1024.0;
            idx++;
        }

        String str = String.format(Locale.ROOT, "%.2f", num);

        int end = str.length();

        while (end > 0 && str.charAt(end - 1) == '0') {
            end--;
        }

        if (end > 0 && str.charAt(end - 1) == '.') {
            end--;
        }

        return str.substring(0, end) + ' ' + SIZE_SUFFIXES[idx];
    }
}
