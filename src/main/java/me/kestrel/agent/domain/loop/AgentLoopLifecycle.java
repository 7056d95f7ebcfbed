package me.kestrel.agent.domain.loop;

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

import me.kestrel.agent.adapter.outbound.bus.OutboundDispatcher;
import me.kestrel.agent.port.inbound.ChannelPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Starts the agent loop on its own thread once the context is up and shuts the
 * runtime down in order: stop taking messages, let the current turn finish,
 * stop delivery and channels, then drain background jobs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentLoopLifecycle implements SmartLifecycle {

    private static final long LOOP_JOIN_TIMEOUT_MS = 10_000;

    private final AgentLoop agentLoop;
    private final OutboundDispatcher outboundDispatcher;
    private final BackgroundTaskSupervisor supervisor;
    private final List<ChannelPort> channelPorts;

    private volatile boolean running;
    private Thread loopThread;

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        outboundDispatcher.start();
        loopThread = new Thread(agentLoop::run, "agent-loop");
        loopThread.setDaemon(true);
        loopThread.start();
        running = true;
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        log.info("[AgentLoop] Shutting down");
        agentLoop.stop();
        if (loopThread != null) {
            try {
                loopThread.join(LOOP_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            loopThread = null;
        }
        outboundDispatcher.stop();
        for (ChannelPort channel : channelPorts) {
            if (channel.isRunning()) {
                channel.stop();
            }
        }
        supervisor.shutdown();
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
