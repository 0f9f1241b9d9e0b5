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

package me.golemcore.warden.infrastructure.config;

import me.golemcore.warden.port.inbound.ChannelPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;

/**
 * Spring auto-configuration that initializes and starts the bot on application
 * startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link Clock} and {@link ObjectMapper}</li>
 * <li>Logs startup information (storage location, scheduler cadence)</li>
 * <li>Auto-starts all input channels via {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final List<ChannelPort> channelPorts;
    private final ObjectProvider<BuildProperties> buildPropertiesProvider;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        BuildProperties buildProps = buildPropertiesProvider.getIfAvailable();
        String version = buildProps != null ? buildProps.getVersion() : "dev";
        log.info("GolemCore Warden v{} starting...", version);
        log.info("Storage Path: {}/{}/{}", properties.getStorage().getLocal().getBasePath(),
                properties.getStorage().getDirectory(), properties.getStorage().getSnapshotFile());
        log.info("Broadcast tick: {}s", properties.getBroadcast().getTickIntervalSeconds());

        for (ChannelPort channel : channelPorts) {
            log.info("Starting channel: {}", channel.getChannelType());
            channel.start();
        }

        log.info("GolemCore Warden started successfully");
    }
}
