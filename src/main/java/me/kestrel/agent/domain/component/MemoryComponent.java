package me.kestrel.agent.domain.component;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

/**
 * Component providing access to durable memory: the long-term memory document
 * (MEMORY.md) that is rewritten by consolidation, and the append-only history
 * log (HISTORY.md) that receives one entry per consolidated slice.
 */
public interface MemoryComponent extends Component {

    @Override
    default String getComponentType() {
        return "memory";
    }

    /**
     * Reads the long-term memory file (MEMORY.md).
     *
     * @return the long-term memory content, or empty string if not found
     */
    String readLongTerm();

    /**
     * Replaces the long-term memory file content.
     *
     * @param content
     *            the content to write
     */
    void writeLongTerm(String content);

    /**
     * Appends an entry to the history log (HISTORY.md).
     *
     * @param entry
     *            the entry to append
     */
    void appendHistory(String entry);

    /**
     * Returns formatted memory content for injection into the system prompt.
     *
     * @return the memory section, or empty string when there is no memory yet
     */
    String getMemoryContext();
}
