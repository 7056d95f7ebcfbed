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

import me.kestrel.agent.domain.component.ToolComponent;
import me.kestrel.agent.domain.model.ToolDefinition;
import me.kestrel.agent.domain.model.ToolFailureKind;
import me.kestrel.agent.domain.model.ToolResult;
import me.kestrel.agent.infrastructure.config.BotProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Name-keyed registry of the tools advertised to the LLM, and the single entry
 * point through which the agent loop runs them.
 *
 * <p>
 * {@link #execute(String, Map)} never throws: an unknown tool, invalid
 * arguments, a failing or slow tool all come back as error text for the LLM,
 * so one misbehaving tool cannot abort the iteration or corrupt the running
 * message list.
 *
 * <p>
 * Definitions are returned in registration order to keep provider prompts
 * reproducible. Registering a name twice replaces the earlier tool in place.
 */
@Service
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();
    private final Duration executionTimeout;

    public ToolRegistry(BotProperties properties, List<ToolComponent> toolComponents) {
        this.executionTimeout = properties.getTools().getExecutionTimeout();
        for (ToolComponent tool : toolComponents) {
            if (tool.isEnabled()) {
                register(tool);
            } else {
                log.info("[Tools] Skipping disabled tool: {}", tool.getToolName());
            }
        }
    }

    public synchronized void register(ToolComponent tool) {
        ToolComponent previous = tools.put(tool.getToolName(), tool);
        if (previous != null) {
            log.info("[Tools] Replaced {} '{}'", tool.getComponentType(), tool.getToolName());
        } else {
            log.info("[Tools] Registered {} '{}'", tool.getComponentType(), tool.getToolName());
        }
    }

    public synchronized void unregister(String name) {
        if (tools.remove(name) != null) {
            log.info("[Tools] Unregistered '{}'", name);
        }
    }

    public synchronized Optional<ToolComponent> get(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public synchronized boolean has(String name) {
        return tools.containsKey(name);
    }

    public synchronized List<ToolDefinition> getDefinitions() {
        List<ToolDefinition> definitions = new ArrayList<>(tools.size());
        for (ToolComponent tool : tools.values()) {
            definitions.add(tool.getDefinition());
        }
        return definitions;
    }

    public synchronized List<String> getToolNames() {
        return List.copyOf(tools.keySet());
    }

    public synchronized List<ToolComponent> getTools() {
        return List.copyOf(tools.values());
    }

    public synchronized int size() {
        return tools.size();
    }

    /**
     * Runs a tool and returns the text handed back to the LLM.
     */
    public String execute(String name, Map<String, Object> arguments) {
        return invoke(name, arguments).toModelText();
    }

    /**
     * Runs a tool and returns its tagged result. Never throws.
     */
    public ToolResult invoke(String name, Map<String, Object> arguments) {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = get(toolName).orElse(null);
        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {}", name);
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, "Tool '" + name + "' not found");
        }

        Map<String, Object> args = arguments != null ? arguments : Map.of();
        CompletableFuture<ToolResult> future = null;
        try {
            List<String> violations = tool.validate(args);
            if (!violations.isEmpty()) {
                log.debug("[Tools] Invalid arguments for {}: {}", toolName, violations);
                return ToolResult.failure(ToolFailureKind.VALIDATION_FAILED,
                        "Invalid parameters for tool '" + toolName + "': " + String.join("; ", violations));
            }

            long start = System.nanoTime();
            future = tool.execute(args);
            ToolResult result = future.get(executionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            log.debug("[Tools] {} finished in {}ms", toolName,
                    TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            if (result == null) {
                return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                        "Error executing " + toolName + ": tool returned no result");
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Tools] {} timed out after {}s", toolName, executionTimeout.toSeconds());
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Error executing " + toolName + ": timed out after " + executionTimeout.toSeconds() + "s");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Error executing " + toolName + ": interrupted");
        } catch (ExecutionException | RuntimeException e) {
            log.error("[Tools] Tool execution failed: {}", toolName, e);
            return ToolResult.failure(ToolFailureKind.EXECUTION_FAILED,
                    "Error executing " + toolName + ": " + safeCauseMessage(e));
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return "";
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
