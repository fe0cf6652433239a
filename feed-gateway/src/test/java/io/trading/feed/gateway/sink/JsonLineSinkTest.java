package io.trading.feed.gateway.sink;

import io.prometheus.client.CollectorRegistry;
import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.canonical.model.SpreadEvent;
import io.trading.feed.canonical.model.Symbol;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.metrics.FeedMetrics;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonLineSinkTest {

    private static final Symbol BTC_USDT = Symbol.parse("BTC-USDT");

    private static CanonicalEvent trade() {
        return new CanonicalEvent(Venue.BINANCE, EventKind.TRADE, BTC_USDT, 1704067200000L, 1704067200005L,
            Map.of("p", new BigDecimal("42000.10"), "q", new BigDecimal("0.500")));
    }

    @Test
    void testWritesOneLinePerEvent() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        JsonLineSink sink = new JsonLineSink("memory", out, true);

        sink.write(trade());
        sink.write(new SpreadEvent(BTC_USDT, Venue.BINANCE, Venue.COINBASE, List.of(Venue.BINANCE, Venue.COINBASE),
            new BigDecimal("100"), new BigDecimal("107"), new BigDecimal("0.07"), 1704067200000L));

        String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("{\"agent\":\"binance\",\"type\":\"trade\",\"s\":\"BTC-USDT\""), lines[0]);
        assertTrue(lines[0].contains("\"p\":\"42000.10\""), lines[0]);
        assertTrue(lines[0].contains("\"q\":\"0.500\""), lines[0]);
        assertTrue(lines[1].startsWith("{\"type\":\"spread\""), lines[1]);
        assertTrue(lines[1].contains("\"spread\":\"0.07\""), lines[1]);
    }

    @Test
    void testFileSinkAppends(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("nested/events.jsonl");

        JsonLineSink first = JsonLineSink.toFile(file);
        first.write(trade());
        first.close();
        JsonLineSink second = JsonLineSink.toFile(file);
        second.write(trade());
        second.close();

        assertEquals(2, Files.readAllLines(file).size());
    }

    @Test
    void testWriteFailureIsSinkException() {
        OutputStream broken = new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                throw new IOException("disk full");
            }
        };
        JsonLineSink sink = new JsonLineSink("broken", broken, true);

        assertThrows(SinkException.class, () -> sink.write(trade()));
    }

    @Test
    void testConsumerCountsSinkErrors() {
        FeedMetrics metrics = new FeedMetrics(new CollectorRegistry());
        Sink failing = new Sink() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public void write(FeedEvent event) throws SinkException {
                throw new SinkException("unavailable");
            }

            @Override
            public void close() {
            }
        };
        SinkConsumer consumer = new SinkConsumer(failing, metrics);

        consumer.onEvent(trade());
        consumer.onEvent(trade());

        assertEquals(2.0, metrics.getSinkErrors("failing"));
    }
}
