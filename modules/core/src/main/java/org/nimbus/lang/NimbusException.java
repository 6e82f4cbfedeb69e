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

import static org.nimbus.lang.ErrorGroup.errorMessage;
import static org.nimbus.lang.ErrorGroup.extractErrorCode;
import static org.nimbus.lang.ErrorGroups.errorGroupByCode;

import java.util.UUID;
import org.jetbrains.annotations.Nullable;

/**
 * Base unchecked exception carrying a full error code and a trace id.
 */
public class NimbusException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    /** Name of the error group. */
    private final String groupName;

    /** Full error code: group code in the upper 16 bits, error code in the lower 16 bits. */
    private final int code;

    /** Unique identifier of this exception, printed in the message so it can be found in the log file. */
    private final UUID traceId;

    /**
     * Creates a new exception with the given error code and detail message.
     *
     * @param code Full error code.
     * @param message Detail message.
     */
    public NimbusException(int code, String message) {
        this(code, message, null);
    }

    /**
     * Creates a new exception with the given error code, detail message and cause.
     *
     * @param code Full error code.
     * @param message Detail message.
     * @param cause Optional nested exception (can be {@code null}).
     */
    public NimbusException(int code, String message, @Nullable Throwable cause) {
        super(message, cause);

        this.traceId = cause instanceof NimbusException ? ((NimbusException) cause).traceId() : UUID.randomUUID();
        this.groupName = errorGroupByCode(code).name();
        this.code = code;
    }

    /** Returns the full error code. */
    public int code() {
        return code;
    }

    /** Returns the human-readable code, e.g. {@code NIM-CONN-1}. */
    public String codeAsString() {
        return ErrorGroup.ERR_PREFIX + groupName + '-' + errorCode();
    }

    /** Returns the error group name. */
    public String groupName() {
        return groupName;
    }

    /** Returns the group-local error code. */
    public int errorCode() {
        return Short.toUnsignedInt(extractErrorCode(code));
    }

    /** Returns the trace id. */
    public UUID traceId() {
        return traceId;
    }

    /**
     * Returns the bare detail message, without the code prefix and the trace id.
     *
     * @return Detail message.
     */
    public String rawMessage() {
        return super.getMessage();
    }

    @Override
    public String getMessage() {
        return errorMessage(traceId, code, super.getMessage());
    }

    @Override
    public String toString() {
        return getClass().getName() + ": " + getMessage();
    }
}
