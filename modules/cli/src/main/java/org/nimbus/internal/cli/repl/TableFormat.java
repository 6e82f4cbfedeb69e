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

import java.util.Locale;

/**
 * Layout of printed rows.
 */
public enum TableFormat {
    /** Aligned table with borders. */
    ASCII,

    /** Comma separated values with a header line. */
    CSV;

    /**
     * Parses a format name.
     *
     * @param name Name in any case.
     * @return Format.
     * @throws IllegalArgumentException If the name is unknown.
     */
    public static TableFormat fromString(String name) {
        try {
            return valueOf(name.strip().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported table format: " + name + ". Supported formats: ascii, csv", e);
        }
    }
}
