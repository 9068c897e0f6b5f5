/*
 [File Info]
 path: src/main/java/tech/robd/jtermlog/sink/MessageQueue.java
 description: FIFO write-ahead buffer of rendered messages waiting for the next flush.
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

package tech.robd.jtermlog.sink;

import org.jspecify.annotations.NonNull;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered buffer of rendered messages.
 * <p>
 * There is no capacity and no eviction: the owner compares {@link #size()} against its
 * own threshold after each {@link #push(String)}. Not thread-safe; the owning logger
 * guards every call with its lock.
 */
public final class MessageQueue {

    private final ArrayDeque<String> messages = new ArrayDeque<>();

    /**
     * Append a message.
     *
     * @param message rendered text, never {@code null}
     * @return queue length after the insertion
     */
    public int push(@NonNull String message) {
        messages.addLast(Objects.requireNonNull(message, "message"));
        return messages.size();
    }

    /**
     * Remove every message.
     *
     * @return the messages in insertion order; the queue is empty afterwards
     */
    public @NonNull List<String> drainAll() {
        List<String> out = new ArrayList<>(messages);
        messages.clear();
        return out;
    }

    public int size() {
        return messages.size();
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }
}
