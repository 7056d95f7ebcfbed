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
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.Dispatcher;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

/**
 * The one {@link OkHttpClient} of the application.
 *
 * <p>
 * Feign clients wrap it directly. {@code SafeHttpFetcher} derives a client
 * from it with redirect following switched off; derived clients share this
 * pool and dispatcher, so the per-host request cap applies to both.
 */
@Configuration
@Slf4j
public class OkHttpConfig {

    @Bean
    public OkHttpClient okHttpClient(BotProperties properties) {
        BotProperties.HttpProperties http = properties.getHttp();

        Dispatcher dispatcher = new Dispatcher();
        dispatcher.setMaxRequestsPerHost(http.getMaxRequestsPerHost());

        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(),
                http.getKeepAlive().toMillis(), TimeUnit.MILLISECONDS);

        log.debug("HTTP client: connect {}, read {}, write {}, {} idle connections",
                http.getConnectTimeout(), http.getReadTimeout(), http.getWriteTimeout(),
                http.getMaxIdleConnections());
        return new OkHttpClient.Builder()
                .dispatcher(dispatcher)
                .connectionPool(pool)
                .connectTimeout(http.getConnectTimeout())
                .readTimeout(http.getReadTimeout())
                .writeTimeout(http.getWriteTimeout())
                .build();
    }
}
