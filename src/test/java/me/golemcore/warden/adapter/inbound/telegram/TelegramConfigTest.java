package me.golemcore.warden.adapter.inbound.telegram;

import me.golemcore.warden.infrastructure.config.BotProperties;
import okhttp3.OkHttpClient;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TelegramConfigTest {

    @Test
    void shouldFailFastWithoutToken() {
        TelegramConfig config = new TelegramConfig(new BotProperties());

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> config.telegramClient(new OkHttpClient()));

        assertTrue(error.getMessage().contains("BOT_TOKEN"));
    }

    @Test
    void shouldCreateClientWithToken() {
        BotProperties properties = new BotProperties();
        properties.getTelegram().setToken("123:abc");

        assertNotNull(new TelegramConfig(properties).telegramClient(new OkHttpClient()));
    }
}
