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

package org.nimbus.internal.backend;

import static org.nimbus.lang.ErrorGroups.Connection.CONNECTION_ERR;

import org.jetbrains.annotations.Nullable;
import org.nimbus.lang.NimbusException;

/**
 * Engine-level network or authentication setup failed. The session may retry by calling {@link Backend#connect}.
 */
public class ConnectionException extends NimbusException {
    private static final long serialVersionUID = 0L;

    public ConnectionException(String message, @Nullable Throwable cause) {
        this(CONNECTION_ERR, message, cause);
    }

    protected ConnectionException(int code, String message, @Nullable Throwable cause) {
        super(code, message, cause);
    }
}
