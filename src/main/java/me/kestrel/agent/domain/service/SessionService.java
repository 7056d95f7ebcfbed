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

import me.kestrel.agent.domain.model.AgentSession;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.outbound.SessionPort;
import me.kestrel.agent.port.outbound.StoragePort;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session store: one JSON file per conversation under the sessions directory,
 * fronted by an in-memory cache so every caller shares the same live
 * {@link AgentSession} instance for a key.
 *
 * <p>
 * Serialization happens while holding the session monitor, the same lock
 * {@link AgentSession} uses for its mutators, so a background cursor commit
 * never observes a half-appended history.
 */
@Service
@Slf4j
public class SessionService implements SessionPort {

    private static final String JSON_EXTENSION = ".json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String sessionsDir;

    private final Map<String, AgentSession> sessionCache = new ConcurrentHashMap<>();

    public SessionService(StoragePort storagePort, ObjectMapper objectMapper, Clock clock,
            BotProperties properties) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sessionsDir = properties.getStorage().getDirectories().getSessions();
    }

    @Override
    public AgentSession getOrCreate(String sessionKey) {
        return sessionCache.computeIfAbsent(sessionKey, key -> {
            Optional<AgentSession> existing = load(key);
            if (existing.isPresent()) {
                log.debug("Loaded existing session: {}", key);
                return existing.get();
            }

            AgentSession session = AgentSession.builder()
                    .id(key)
                    .createdAt(clock.instant())
                    .updatedAt(clock.instant())
                    .build();
            log.info("Created new session: {}", key);
            return session;
        });
    }

    @Override
    public boolean save(AgentSession session) {
        sessionCache.putIfAbsent(session.getId(), session);
        synchronized (session) {
            session.setUpdatedAt(clock.instant());
            try {
                String json = objectMapper.writeValueAsString(session);
                storagePort.putTextAtomic(sessionsDir, fileName(session.getId()), json).join();
                log.debug("Saved session: {} ({} messages)", session.getId(), session.getMessages().size());
                return true;
            } catch (JsonProcessingException | CompletionException e) {
                log.error("Failed to save session: {}", session.getId(), e);
                return false;
            }
        }
    }

    @Override
    public void invalidate(String sessionKey) {
        if (sessionCache.remove(sessionKey) != null) {
            log.debug("Invalidated cached session: {}", sessionKey);
        }
    }

    @Override
    public boolean commitConsolidation(String sessionKey, long epoch, int lastConsolidated) {
        AgentSession session = getOrCreate(sessionKey);
        boolean moved = session.advanceConsolidation(epoch, lastConsolidated);
        if (moved) {
            save(session);
            log.debug("Consolidation cursor for {} moved to {}", sessionKey, lastConsolidated);
        } else {
            log.info("Discarded stale consolidation cursor {} for {} (epoch {} vs {})",
                    lastConsolidated, sessionKey, epoch, session.getEpoch());
        }
        return moved;
    }

    private Optional<AgentSession> load(String sessionKey) {
        String json;
        try {
            json = storagePort.getText(sessionsDir, fileName(sessionKey)).join();
        } catch (CompletionException e) {
            log.warn("Failed to read session {}: {}", sessionKey, e.getMessage());
            return Optional.empty();
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }

        try {
            AgentSession session = objectMapper.readValue(json, AgentSession.class);
            if (session.getId() == null || session.getId().isBlank()) {
                session.setId(sessionKey);
            }
            if (session.getMessages() == null) {
                session.setMessages(new ArrayList<>());
            }
            int size = session.getMessages().size();
            session.setLastConsolidated(Math.max(0, Math.min(session.getLastConsolidated(), size)));
            return Optional.of(session);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse session file for {}: {}", sessionKey, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static String fileName(String sessionKey) {
        return sessionKey.replace(':', '_') + JSON_EXTENSION;
    }
}
