package me.kestrel.agent.adapter.outbound.llm;

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
 * Helpers for {@code provider/model} identifiers such as
 * {@code anthropic/claude-sonnet-4} or {@code openai/gpt-4o-mini}.
 */
public final class ModelNames {

    public static final String UNKNOWN_PROVIDER = "unknown";

    private ModelNames() {
    }

    /**
     * Provider prefix before the first {@code /}, or {@code "unknown"} when the
     * name carries none.
     */
    public static String providerOf(String model) {
        if (model == null) {
            return UNKNOWN_PROVIDER;
        }
        int slash = model.indexOf('/');
        return slash > 0 ? model.substring(0, slash) : UNKNOWN_PROVIDER;
    }

    /**
     * Model id as the provider API expects it: everything after the provider
     * prefix. Routers like OpenRouter keep their nested vendor prefix.
     */
    public static String apiModelName(String model) {
        if (model == null) {
            return null;
        }
        int slash = model.indexOf('/');
        return slash > 0 ? model.substring(slash + 1) : model;
    }

    /**
     * Display name: the segment after the last {@code /}.
     */
    public static String shortName(String model) {
        if (model == null) {
            return null;
        }
        return model.substring(model.lastIndexOf('/') + 1);
    }
}
