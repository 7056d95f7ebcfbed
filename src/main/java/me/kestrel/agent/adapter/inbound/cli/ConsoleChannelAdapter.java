package me.kestrel.agent.adapter.inbound.cli;

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

import me.kestrel.agent.domain.model.InboundMessage;
import me.kestrel.agent.domain.model.OutboundMessage;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.port.inbound.ChannelPort;
import me.kestrel.agent.port.outbound.MessageBusPort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Interactive console channel. Each line read from standard input becomes an
 * inbound message for chat {@code cli:direct}; replies are printed to standard
 * output.
 *
 * <p>
 * Enabled with {@code bot.channels.cli.enabled=true}. Typing {@code exit} or
 * {@code quit} stops reading input.
 */
@Component
@Slf4j
public class ConsoleChannelAdapter implements ChannelPort {

    static final String CHANNEL_TYPE = "cli";
    static final String CHAT_ID = "direct";
    static final String SENDER_ID = "user";
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit");

    private final MessageBusPort messageBus;
    private final Clock clock;
    private final String botName;
    private final InputStream input;
    private final PrintStream output;
    private final Object lifecycleLock = new Object();

    private volatile boolean running;
    private Thread reader;

    @Autowired
    public ConsoleChannelAdapter(MessageBusPort messageBus, Clock clock, BotProperties properties) {
        this(messageBus, clock, properties, System.in, System.out);
    }

    ConsoleChannelAdapter(MessageBusPort messageBus, Clock clock, BotProperties properties, InputStream input,
            PrintStream output) {
        this.messageBus = messageBus;
        this.clock = clock;
        this.botName = properties.getPrompts().getBotName();
        this.input = input;
        this.output = output;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.debug("Console channel already running");
                return;
            }
            running = true;
            reader = new Thread(this::readLoop, "cli-reader");
            reader.setDaemon(true);
            reader.start();
            log.info("Console channel started");
        }
    }

    @Override
    public void stop() {
        synchronized (lifecycleLock) {
            running = false;
            reader = null;
            log.info("Console channel stopped");
        }
    }

    @PreDestroy
    public void destroy() {
        stop();
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public CompletableFuture<Void> sendMessage(OutboundMessage message) {
        synchronized (output) {
            output.println();
            output.println(botName + ": " + message.getContent());
            output.flush();
        }
        return CompletableFuture.completedFuture(null);
    }

    void readLoop() {
        try (BufferedReader in = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = in.readLine()) != null) {
                String content = line.trim();
                if (content.isEmpty()) {
                    continue;
                }
                if (EXIT_COMMANDS.contains(content.toLowerCase(Locale.ROOT))) {
                    log.info("Console channel closed by user");
                    break;
                }
                messageBus.publishInbound(InboundMessage.builder()
                        .channel(CHANNEL_TYPE)
                        .chatId(CHAT_ID)
                        .senderId(SENDER_ID)
                        .content(content)
                        .timestamp(clock.instant())
                        .build());
            }
        } catch (IOException e) {
            log.error("Console input failed", e);
        }
        running = false;
    }
}
