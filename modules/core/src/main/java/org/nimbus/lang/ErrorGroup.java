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

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import it.unimi.dsi.fastutil.ints.IntSet;
import java.util.UUID;

/**
 * Named collection of error codes belonging to one semantic area (connections, SQL execution, ...). A full error code
 * packs the group code into the upper 16 bits and the error code into the lower 16 bits.
 */
public class ErrorGroup {
    /** Prefix of every human-readable error code. */
    public static final String ERR_PREFIX = "NIM-";

    private final String groupName;

    private final short groupCode;

    private final IntSet codes = new IntOpenHashSet();

    ErrorGroup(String groupName, short groupCode) {
        this.groupName = groupName;
        this.groupCode = groupCode;
    }

    /** Returns the group name. */
    public String name() {
        return groupName;
    }

    /** Returns the group code. */
    public short groupCode() {
        return groupCode;
    }

    /**
     * Registers a new error code within this group.
     *
     * @param errorCode Error code unique within the group.
     * @return Full error code.
     * @throws IllegalArgumentException If the code is already registered.
     */
    public synchronized int registerErrorCode(short errorCode) {
        if (!codes.add(errorCode)) {
            throw new IllegalArgumentException("Error code already registered [errorCode=" + errorCode + ", group=" + name() + ']');
        }

        return (groupCode << 16) | (errorCode & 0xFFFF);
    }

    /**
     * Extracts the group-local part of a full error code.
     *
     * @param code Full error code.
     * @return Error code.
     */
    public static short extractErrorCode(int code) {
        return (short) (code & 0xFFFF);
    }

    /**
     * Renders a message as {@code NIM-<GROUP>-<code> <message> TraceId:<id>}.
     *
     * @param traceId Trace id of the exception.
     * @param code Full error code.
     * @param message Original message, can be {@code null}.
     * @return Rendered message.
     */
    public static String errorMessage(UUID traceId, int code, String message) {
        ErrorGroup group = ErrorGroups.errorGroupByCode(code);

        return ERR_PREFIX + group.name() + '-' + Short.toUnsignedInt(extractErrorCode(code))
                + ((message != null && !message.isEmpty()) ? ' ' + message : "")
                + " TraceId:" + traceId.toString().substring(0, 8);
    }

    @Override
    public String toString() {
        return "ErrorGroup [name=" + groupName + ", groupCode=" + groupCode + ']';
    }
}
