package me.kestrel.agent.tools.web;

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

import java.util.Locale;

/**
 * How HTML pages are rendered for the LLM.
 */
public enum ExtractMode {
    MARKDOWN, TEXT;

    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExtractMode fromValue(String value) {
        if (value == null || value.isBlank()) {
            return MARKDOWN;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
