package me.kestrel.agent.port.outbound;

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

/**
 * Port for conversation session persistence.
 */
public interface SessionPort {

    /**
     * Returns the cached or stored session for the key, creating an empty one
     * if none exists.
     */
    AgentSession getOrCreate(String sessionKey);

    /**
     * Persists the session synchronously.
     *
     * @return false if the session could not be written to storage
     */
    boolean save(AgentSession session);

    /**
     * Drops the cached instance so the next lookup reloads from storage.
     */
    void invalidate(String sessionKey);

    /**
     * Moves the consolidation cursor of the live session and persists it. The
     * commit is discarded if the session was cleared after the snapshot epoch or
     * if the cursor would move backwards or past the end of the history.
     *
     * @return true if the cursor moved
     */
    boolean commitConsolidation(String sessionKey, long epoch, int lastConsolidated);
}
