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

import it.unimi.dsi.fastutil.ints.Int2ObjectMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectOpenHashMap;
import java.util.Locale;

/**
 * Defines error groups and their errors.
 */
@SuppressWarnings("PublicInnerClass")
public class ErrorGroups {
    private static final Int2ObjectMap<ErrorGroup> registeredGroups = new Int2ObjectOpenHashMap<>();

    /**
     * Creates and registers a new error group.
     *
     * @param groupName Group name.
     * @param groupCode Group code.
     * @return New error group.
     * @throws IllegalArgumentException If the name or the code is already taken, or the name is empty.
     */
    public static synchronized ErrorGroup registerGroup(String groupName, short groupCode) {
        if (groupName == null || groupName.isEmpty()) {
            throw new IllegalArgumentException("Group name is null or empty");
        }

        String grpName = groupName.toUpperCase(Locale.ENGLISH);

        if (registeredGroups.containsKey(groupCode)) {
            throw new IllegalArgumentException("Error group already registered [groupName=" + groupName + ", groupCode=" + groupCode
                    + ", registeredGroup=" + registeredGroups.get(groupCode) + ']');
        }

        for (ErrorGroup group : registeredGroups.values()) {
            if (group.name().equals(grpName)) {
                throw new IllegalArgumentException("Error group already registered [groupName=" + groupName + ", groupCode=" + groupCode
                        + ", registeredGroup=" + group + ']');
            }
        }

        ErrorGroup group = new ErrorGroup(grpName, groupCode);

        registeredGroups.put(groupCode, group);

        return group;
    }

    /**
     * Extracts the group code from a full error code.
     *
     * @param code Full error code.
     * @return Group code.
     */
    public static short extractGroupCode(int code) {
        return (short) (code >>> 16);
    }

    /**
     * Returns the error group of a full error code.
     *
     * @param code Full error code.
     * @return Error group.
     */
    public static synchronized ErrorGroup errorGroupByCode(int code) {
        ErrorGroup grp = registeredGroups.get(extractGroupCode(code));

        assert grp != null : "group not found, code=" + code;

        return grp;
    }

    /** Errors that do not belong to any specific area. */
    public static class Common {
        /** Common error group. */
        public static final ErrorGroup COMMON_ERR_GROUP = registerGroup("CMN", (short) 1);

        /** Illegal argument or argument in a wrong format. */
        public static final int ILLEGAL_ARGUMENT_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 1);

        /** Unexpected internal error. */
        public static final int INTERNAL_ERR = COMMON_ERR_GROUP.registerErrorCode((short) 0xFFFF);
    }

    /** Backend connection errors. */
    public static class Connection {
        /** Connection error group. */
        public static final ErrorGroup CONNECTION_ERR_GROUP = registerGroup("CONN", (short) 2);

        /** Engine-level network or authentication setup failed. */
        public static final int CONNECTION_ERR = CONNECTION_ERR_GROUP.registerErrorCode((short) 1);

        /** A cursor was requested from a backend without a live connection. */
        public static final int NOT_CONNECTED_ERR = CONNECTION_ERR_GROUP.registerErrorCode((short) 2);

        /** Temporary credentials could not be derived. */
        public static final int AUTHENTICATION_ERR = CONNECTION_ERR_GROUP.registerErrorCode((short) 3);
    }

    /** SQL execution errors. */
    public static class Sql {
        /** SQL error group. */
        public static final ErrorGroup SQL_ERR_GROUP = registerGroup("SQL", (short) 3);

        /** A statement failed on the engine. */
        public static final int STATEMENT_EXECUTION_ERR = SQL_ERR_GROUP.registerErrorCode((short) 1);
    }

    /** Metadata discovery errors. */
    public static class Metadata {
        /** Metadata error group. */
        public static final ErrorGroup METADATA_ERR_GROUP = registerGroup("META", (short) 4);

        /** Databases, tables or columns could not be listed. */
        public static final int DISCOVERY_ERR = METADATA_ERR_GROUP.registerErrorCode((short) 1);
    }

    /** Configuration errors. */
    public static class Config {
        /** Configuration error group. */
        public static final ErrorGroup CONFIG_ERR_GROUP = registerGroup("CFG", (short) 5);

        /** Configuration file is malformed or a required value is missing. */
        public static final int CONFIG_ERR = CONFIG_ERR_GROUP.registerErrorCode((short) 1);
    }
}
