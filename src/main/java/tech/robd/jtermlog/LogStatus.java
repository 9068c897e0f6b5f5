/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/LogStatus.java
 description: Outcome of a logger operation.
 license: Apache-2.0
 author: Rob Deas
 editable: yes
 structured: no
 [/File Info]
*/
/*
 * Copyright (c) 2025 Rob Deas Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package tech.robd.jtermlog;

/**
 * Result of {@link TermLogger} and {@link GlobalLogger} operations.
 * <p>
 * I/O failures are reported here and on the error stream; they are never thrown.
 */
public enum LogStatus {
    /**
     * The operation completed.
     */
    OK,
    /**
     * No log file is configured. Console output (if any) still happened.
     */
    NO_LOG_FILE,
    /**
     * The log file could not be created or opened.
     */
    FILE_OPEN_ERROR,
    /**
     * Writing to the log file failed.
     */
    WRITE_ERROR,
    /**
     * Unknown stream selector, or a registry operation without an instance.
     */
    INVALID_USE;

    /**
     * @return true for {@link #FILE_OPEN_ERROR}, {@link #WRITE_ERROR} and {@link #INVALID_USE}
     */
    public boolean isFailure() {
        return this == FILE_OPEN_ERROR || this == WRITE_ERROR || this == INVALID_USE;
    }
}
