package me.kestrel.agent.domain.service;

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

import me.kestrel.agent.domain.component.MemoryComponent;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.StoragePort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletionException;

/**
 * Two-layer persistent memory in the workspace memory directory.
 *
 * <p>
 * {@code MEMORY.md} holds long-term facts and is injected into every system
 * prompt. {@code HISTORY.md} is an append-only log of consolidated
 * conversation summaries, one paragraph per entry separated by a blank line so
 * it stays easy to grep. Writes propagate failures to the caller; reads treat
 * a missing or unreadable file as empty.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryService implements MemoryComponent {

    static final String LONG_TERM_FILE = "MEMORY.md";
    static final String HISTORY_FILE = "HISTORY.md";

    private final StoragePort storagePort;
    private final BotProperties properties;

    @Override
    public String readLongTerm() {
        try {
            String content = storagePort.getText(memoryDirectory(), LONG_TERM_FILE).join();
            return content != null ? content : "";
        } catch (CompletionException e) {
            log.warn("Failed to read long-term memory: {}", e.getMessage());
            return "";
        }
    }

    @Override
    public void writeLongTerm(String content) {
        storagePort.putTextAtomic(memoryDirectory(), LONG_TERM_FILE, content).join();
        log.debug("Updated long-term memory ({} chars)", content.length());
    }

    @Override
    public void appendHistory(String entry) {
        storagePort.appendText(memoryDirectory(), HISTORY_FILE, entry.stripTrailing() + "\n\n").join();
    }

    @Override
    public String getMemoryContext() {
        String longTerm = readLongTerm();
        return longTerm.isBlank() ? "" : "## Long-term Memory\n" + longTerm;
    }

    private String memoryDirectory() {
        return properties.getStorage().getDirectories().getMemory();
    }
}
