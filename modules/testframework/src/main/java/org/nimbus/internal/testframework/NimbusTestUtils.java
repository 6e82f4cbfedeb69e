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

package org.nimbus.internal.testframework;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.function.Executable;
import org.nimbus.lang.NimbusException;

/**
 * Utility methods for tests.
 */
public final class NimbusTestUtils {
    private NimbusTestUtils() {
    }

    /**
     * Checks that the code throws a {@link NimbusException} of the given type, with the given error code and a message
     * containing the given fragment.
     *
     * @param cls Expected exception class.
     * @param code Expected full error code.
     * @param executable Code under test.
     * @param msgPart Fragment of the expected message, or {@code null} to skip the check.
     * @param <T> Exception type.
     * @return Thrown exception.
     */
    public static <T extends NimbusException> T assertThrowsWithCode(
            Class<T> cls,
            int code,
            Executable executable,
            String msgPart
    ) {
        T ex = assertThrows(cls, executable);

        assertEquals(code, ex.code(), "Unexpected error code: " + ex.codeAsString());

        if (msgPart != null) {
            assertTrue(ex.getMessage().contains(msgPart), "Unexpected message: " + ex.getMessage());
        }

        return ex;
    }
}
