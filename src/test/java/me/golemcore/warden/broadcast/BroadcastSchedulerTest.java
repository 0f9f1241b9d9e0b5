package me.golemcore.warden.broadcast;

import me.golemcore.warden.domain.exception.ChatTransportException;
import me.golemcore.warden.domain.model.ButtonLink;
import me.golemcore.warden.domain.model.MediaType;
import me.golemcore.warden.domain.model.OutboundPost;
import me.golemcore.warden.domain.model.RecurringItem;
import me.golemcore.warden.domain.service.ConfigStore;
import me.golemcore.warden.infrastructure.config.BotProperties;
import me.golemcore.warden.port.outbound.ChatTransportPort;
import me.golemcore.warden.port.outbound.StoragePort;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BroadcastSchedulerTest {

    private static final String GROUP = "-100123";
    private static final String OTHER_GROUP = "-100999";
    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private Map<String, String> files;
    private ConfigStore configStore;
    private ChatTransportPort transport;
    private MutableClock clock;
    private BroadcastScheduler scheduler;

    @BeforeEach
    void setUp() {
        files = new HashMap<>();
        StoragePort storagePort = mock(StoragePort.class);
        when(storagePort.getText(anyString(), anyString()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(
                        files.get(inv.getArgument(0) + "/" + inv.getArgument(1))));
        when(storagePort.putTextAtomic(anyString(), anyString(), anyString(), anyBoolean()))
                .thenAnswer(inv -> {
                    files.put(inv.getArgument(0) + "/" + inv.getArgument(1), inv.getArgument(2));
                    return CompletableFuture.completedFuture(null);
                });

        BotProperties properties = new BotProperties();
        configStore = new ConfigStore(storagePort, new ObjectMapper(), properties);
        configStore.load();

        transport = mock(ChatTransportPort.class);
        clock = new MutableClock(START);
        scheduler = new BroadcastScheduler(configStore, transport, properties, clock);
    }

    private RecurringItem add(String chatId, RecurringItem item) {
        return configStore.addRecurringItem(chatId, item);
    }

    private static RecurringItem textItem(String text, int interval) {
        return RecurringItem.builder()
                .text(text)
                .intervalMinutes(interval)
                .build();
    }

    private RecurringItem stored(String chatId) {
        return configStore.getRecurringItems(chatId).get(0);
    }

    @Test
    void shouldSendNeverSentItemOnFirstTick() throws Exception {
        add(GROUP, textItem("Hello", 10));
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class))).thenReturn(101);

        scheduler.tick();

        ArgumentCaptor<OutboundPost> post = ArgumentCaptor.forClass(OutboundPost.class);
        verify(transport).sendPost(eq(GROUP), post.capture());
        assertEquals("Hello", post.getValue().text());
        assertEquals(START.getEpochSecond(), stored(GROUP).getLastSentAt());
        assertEquals(101, stored(GROUP).getLastMessageId());
    }

    @Test
    void shouldNotResendWithinInterval() throws Exception {
        add(GROUP, textItem("Hello", 10));
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class))).thenReturn(101);

        scheduler.tick();
        scheduler.tick();
        clock.advance(Duration.ofMinutes(9).plusSeconds(59));
        scheduler.tick();

        verify(transport, times(1)).sendPost(eq(GROUP), any(OutboundPost.class));
    }

    @Test
    void shouldResendAfterIntervalReplacingAndPinning() throws Exception {
        add(GROUP, textItem("Hello", 10).toBuilder().deletePrevious(true).pinMessage(true).build());
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class))).thenReturn(101, 202);

        scheduler.tick();
        verify(transport, never()).deleteMessage(anyString(), anyInt());
        verify(transport).pinMessage(GROUP, 101);

        clock.advance(Duration.ofMinutes(10));
        scheduler.tick();

        verify(transport).deleteMessage(GROUP, 101);
        verify(transport).pinMessage(GROUP, 202);
        assertEquals(202, stored(GROUP).getLastMessageId());
        assertEquals(clock.instant().getEpochSecond(), stored(GROUP).getLastSentAt());
    }

    @Test
    void shouldSendOnceAfterDowntime() throws Exception {
        RecurringItem item = add(GROUP, textItem("Hello", 5));
        configStore.markSent(GROUP, item.getId(), START.minus(Duration.ofDays(3)).getEpochSecond(), 7);
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class))).thenReturn(8);

        scheduler.tick();
        scheduler.tick();

        verify(transport, times(1)).sendPost(eq(GROUP), any(OutboundPost.class));
        assertEquals(START.getEpochSecond(), stored(GROUP).getLastSentAt());
    }

    @Test
    void shouldRetryAfterFailedSend() throws Exception {
        add(GROUP, textItem("Hello", 10));
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class)))
                .thenThrow(new ChatTransportException("bot was kicked"))
                .thenReturn(55);

        scheduler.tick();
        assertEquals(0L, stored(GROUP).getLastSentAt());
        assertNull(stored(GROUP).getLastMessageId());

        scheduler.tick();
        assertEquals(START.getEpochSecond(), stored(GROUP).getLastSentAt());
        assertEquals(55, stored(GROUP).getLastMessageId());
    }

    @Test
    void shouldMarkSentWhenDeleteAndPinFail() throws Exception {
        RecurringItem item = add(GROUP, textItem("Hello", 1).toBuilder().deletePrevious(true).pinMessage(true).build());
        configStore.markSent(GROUP, item.getId(), START.minusSeconds(120).getEpochSecond(), 7);
        doThrow(new ChatTransportException("message to delete not found")).when(transport).deleteMessage(GROUP, 7);
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class))).thenReturn(8);
        doThrow(new ChatTransportException("not enough rights")).when(transport).pinMessage(GROUP, 8);

        assertDoesNotThrow(() -> scheduler.tick());

        assertEquals(8, stored(GROUP).getLastMessageId());
        assertEquals(START.getEpochSecond(), stored(GROUP).getLastSentAt());
    }

    @Test
    void shouldSendMediaWithCaptionAndButtons() throws Exception {
        add(GROUP, RecurringItem.builder()
                .text("Caption")
                .media("file-1")
                .mediaType(MediaType.VIDEO)
                .buttons(new ArrayList<>(List.of(new ButtonLink("Go", "https://x.com"))))
                .intervalMinutes(60)
                .build());

        scheduler.tick();

        ArgumentCaptor<OutboundPost> post = ArgumentCaptor.forClass(OutboundPost.class);
        verify(transport).sendPost(eq(GROUP), post.capture());
        assertEquals("file-1", post.getValue().media());
        assertEquals(MediaType.VIDEO, post.getValue().mediaType());
        assertEquals("Caption", post.getValue().text());
        assertEquals(1, post.getValue().buttons().size());
    }

    @Test
    void shouldSkipItemWithoutContent() throws Exception {
        add(GROUP, RecurringItem.builder().intervalMinutes(1).build());

        scheduler.tick();

        verify(transport, never()).sendPost(anyString(), any(OutboundPost.class));
        assertEquals(0L, stored(GROUP).getLastSentAt());
    }

    @Test
    void shouldContinueWithOtherGroupsAfterFailure() throws Exception {
        add(GROUP, textItem("First", 10));
        add(OTHER_GROUP, textItem("Second", 10));
        when(transport.sendPost(eq(GROUP), any(OutboundPost.class)))
                .thenThrow(new ChatTransportException("chat not found"));
        when(transport.sendPost(eq(OTHER_GROUP), any(OutboundPost.class))).thenReturn(9);

        scheduler.tick();

        assertEquals(9, stored(OTHER_GROUP).getLastMessageId());
        assertEquals(0L, stored(GROUP).getLastSentAt());
    }

    @Test
    void shouldDoNothingWhenNothingConfigured() throws Exception {
        scheduler.tick();

        verify(transport, never()).sendPost(anyString(), any(OutboundPost.class));
    }

    @Test
    void shouldNotStartWhenDisabled() {
        BotProperties properties = new BotProperties();
        properties.getBroadcast().setEnabled(false);
        BroadcastScheduler disabled = new BroadcastScheduler(configStore, transport, properties, clock);

        assertDoesNotThrow(disabled::init);
        assertDoesNotThrow(disabled::shutdown);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
