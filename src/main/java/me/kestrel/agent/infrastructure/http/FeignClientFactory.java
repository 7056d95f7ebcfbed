package me.kestrel.agent.infrastructure.http;

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

import me.kestrel.agent.infrastructure.config.BotProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Request;
import feign.RequestInterceptor;
import feign.Retryer;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Creates Feign clients for third-party JSON APIs.
 *
 * <p>
 * Clients run on the shared OkHttp transport, (de)serialize with the
 * application {@link ObjectMapper} and never retry on their own: a tool that
 * wants to retry a 429 does it with its own backoff.
 */
@Component
@Slf4j
public class FeignClientFactory {

    private final feign.okhttp.OkHttpClient transport;
    private final ObjectMapper objectMapper;
    private final Request.Options options;

    public FeignClientFactory(OkHttpClient okHttpClient, ObjectMapper objectMapper, BotProperties properties) {
        this.transport = new feign.okhttp.OkHttpClient(okHttpClient);
        this.objectMapper = objectMapper;
        BotProperties.HttpProperties http = properties.getHttp();
        this.options = new Request.Options(
                http.getConnectTimeout().toMillis(), TimeUnit.MILLISECONDS,
                http.getReadTimeout().toMillis(), TimeUnit.MILLISECONDS,
                true);
    }

    public <T> T create(Class<T> apiType, String baseUrl) {
        return create(apiType, baseUrl, List.of());
    }

    /**
     * @param interceptors
     *            applied to every request, for example to add an auth header
     */
    public <T> T create(Class<T> apiType, String baseUrl, List<RequestInterceptor> interceptors) {
        log.debug("Creating Feign client {} -> {}", apiType.getSimpleName(), baseUrl);
        return Feign.builder()
                .client(transport)
                .options(options)
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .requestInterceptors(interceptors)
                .retryer(Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }
}
