package me.golemcore.warden.infrastructure.config;

import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.port.inbound.ChannelPort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.info.BuildProperties;

import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AutoConfigurationTest {

    @Test
    void shouldProvideUtcClock() {
        assertEquals(ZoneOffset.UTC, AutoConfiguration.clock().getZone());
    }

    @Test
    void shouldIgnoreUnknownSnapshotFields() throws Exception {
        ObjectMapper mapper = AutoConfiguration.objectMapper();

        RecurringItem item = mapper.readValue("{\"text\":\"Hi\",\"intervalMinutes\":5,\"legacyField\":1}",
                RecurringItem.class);

        assertEquals("Hi", item.getText());
        assertEquals(5, item.getIntervalMinutes());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldStartAllChannels() {
        ChannelPort channel = mock(ChannelPort.class);
        when(channel.getChannelType()).thenReturn("telegram");
        ObjectProvider<BuildProperties> buildProperties = mock(ObjectProvider.class);

        new AutoConfiguration(new BotProperties(), List.of(channel), buildProperties).init();

        verify(channel).start();
    }
}
