package me.kestrel.agent.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Result of a web fetch as reported to the LLM. Either the success fields or
 * {@code error} are set, never both.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({ "url", "finalUrl", "status", "extractor", "truncated", "length", "text", "error" })
public class FetchOutcome {

    public static final String EXTRACTOR_JSON = "json";
    public static final String EXTRACTOR_READABILITY = "readability";
    public static final String EXTRACTOR_RAW = "raw";

    String url;
    String finalUrl;
    Integer status;
    String extractor;
    Boolean truncated;
    Integer length;
    String text;
    String error;

    public static FetchOutcome success(String url, String finalUrl, int status, String extractor,
            boolean truncated, String text) {
        return FetchOutcome.builder()
                .url(url)
                .finalUrl(finalUrl)
                .status(status)
                .extractor(extractor)
                .truncated(truncated)
                .length(text.length())
                .text(text)
                .build();
    }

    public static FetchOutcome failure(String url, String error) {
        return FetchOutcome.builder()
                .url(url)
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isSuccess() {
        return error == null;
    }
}
