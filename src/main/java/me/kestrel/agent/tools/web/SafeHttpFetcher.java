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

import me.kestrel.agent.domain.model.UrlValidationResult;
import me.kestrel.agent.infrastructure.config.BotProperties;
import me.kestrel.agent.security.UrlValidator;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * HTTP GET with SSRF protection on every hop.
 *
 * <p>
 * Redirects are never followed by OkHttp itself. Each 3xx response is resolved
 * against the current URL and the target is validated again before it is
 * requested, so a public server cannot bounce the request into the internal
 * network. The chain is bounded both by a hop count and by a wall-clock budget
 * for the whole chain.
 *
 * <p>
 * Connections resolve hostnames through the validator as well, so a name that
 * answers with a public address during validation and an internal one at
 * connect time is refused.
 */
@Component
@Slf4j
public class SafeHttpFetcher {

    private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024;

    private final OkHttpClient httpClient;
    private final UrlValidator urlValidator;
    private final Clock clock;
    private final int maxRedirects;
    private final String userAgent;
    private final Duration totalTimeout;

    public SafeHttpFetcher(OkHttpClient okHttpClient, UrlValidator urlValidator, BotProperties properties,
            Clock clock) {
        this.httpClient = okHttpClient.newBuilder()
                .followRedirects(false)
                .followSslRedirects(false)
                .dns(urlValidator::resolvePublic)
                .build();
        this.urlValidator = urlValidator;
        this.clock = clock;
        BotProperties.WebFetchToolProperties config = properties.getTools().getWebFetch();
        this.maxRedirects = config.getMaxRedirects();
        this.userAgent = config.getUserAgent();
        this.totalTimeout = config.getTotalTimeout();
    }

    /**
     * Fetches the URL, following at most {@code maxRedirects} validated
     * redirects.
     *
     * @throws FetchException
     *             if any hop fails validation, the chain is too long or too slow,
     *             or the final response is an HTTP error
     */
    public FetchedPage fetch(String url) throws FetchException {
        UrlValidationResult validation = urlValidator.validate(url);
        if (!validation.valid()) {
            throw new FetchException("URL validation failed: " + validation.reason());
        }
        HttpUrl current = HttpUrl.parse(url.trim());
        if (current == null) {
            throw new FetchException("URL validation failed: unparseable URL");
        }

        Instant deadline = clock.instant().plus(totalTimeout);
        int redirects = 0;
        while (true) {
            long remainingMs = Duration.between(clock.instant(), deadline).toMillis();
            if (remainingMs <= 0) {
                throw totalTimeoutExceeded();
            }

            Request request = new Request.Builder()
                    .url(current)
                    .header("User-Agent", userAgent)
                    .get()
                    .build();
            Call call = httpClient.newCall(request);
            call.timeout().timeout(remainingMs, TimeUnit.MILLISECONDS);

            try (Response response = call.execute()) {
                int code = response.code();
                if (REDIRECT_CODES.contains(code)) {
                    redirects++;
                    if (redirects > maxRedirects) {
                        throw new FetchException("Too many redirects (max " + maxRedirects + ")");
                    }
                    current = nextHop(current, response.header("Location"));
                    log.debug("[WebFetch] Redirect {} -> {}", code, current);
                    continue;
                }
                if (code >= 400) {
                    throw new FetchException("HTTP " + code + " for " + current);
                }

                String contentType = response.header("Content-Type", "");
                return new FetchedPage(url, current.toString(), code, contentType, readBody(response.body()));
            } catch (InterruptedIOException e) {
                if (!clock.instant().isBefore(deadline)) {
                    throw totalTimeoutExceeded();
                }
                throw new FetchException("Request timed out: " + current, e);
            } catch (IOException e) {
                throw new FetchException("Request failed: " + e.getMessage(), e);
            }
        }
    }

    private HttpUrl nextHop(HttpUrl current, String location) throws FetchException {
        if (location == null || location.isBlank()) {
            throw new FetchException("Redirect response missing Location header");
        }
        HttpUrl next = current.resolve(location.trim());
        UrlValidationResult validation = urlValidator.validate(next != null ? next.toString() : location);
        if (!validation.valid()) {
            throw new FetchException("Redirect target validation failed: " + validation.reason());
        }
        if (next == null) {
            throw new FetchException("Redirect target validation failed: unparseable URL");
        }
        return next;
    }

    private FetchException totalTimeoutExceeded() {
        return new FetchException("Fetch exceeded total timeout of " + totalTimeout.toSeconds() + "s");
    }

    private static String readBody(ResponseBody body) throws IOException {
        if (body == null) {
            return "";
        }
        MediaType mediaType = body.contentType();
        Charset charset = mediaType != null ? mediaType.charset(StandardCharsets.UTF_8) : StandardCharsets.UTF_8;
        try (InputStream in = body.byteStream()) {
            return new String(in.readNBytes(MAX_BODY_BYTES), charset);
        }
    }
}
