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

package me.golemcore.warden.infrastructure.http;

import me.golemcore.warden.infrastructure.config.BotProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for outgoing Bot API calls.
 *
 * <p>
 * Every request is bounded by {@code bot.http.call-timeout} on top of the
 * per-phase connect/read/write timeouts, so one stuck call never blocks the
 * update loop or a broadcast tick for longer than that.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    private final BotProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        return buildClient(properties.getHttp());
    }

    static OkHttpClient buildClient(BotProperties.HttpProperties http) {
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(),
                http.getKeepAliveDuration(), TimeUnit.MILLISECONDS);
        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeout()))
                .readTimeout(Duration.ofMillis(http.getReadTimeout()))
                .writeTimeout(Duration.ofMillis(http.getWriteTimeout()))
                .callTimeout(Duration.ofMillis(http.getCallTimeout()))
                .connectionPool(pool)
                .retryOnConnectionFailure(true)
                .build();
        log.info("[Http] Bot API client: connect={}ms, read={}ms, call={}ms",
                http.getConnectTimeout(), http.getReadTimeout(), http.getCallTimeout());
        return client;
    }
}
