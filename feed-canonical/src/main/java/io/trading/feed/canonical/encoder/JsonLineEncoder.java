package io.trading.feed.canonical.encoder;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import io.trading.feed.canonical.model.CanonicalEvent;
import io.trading.feed.canonical.model.FeedEvent;
import io.trading.feed.canonical.model.PriceLevel;
import io.trading.feed.canonical.model.SpreadEvent;
import io.trading.feed.canonical.model.Venue;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Encodes feed events as single-line JSON objects.
 *
 * <p>Canonical events: {@code agent}, {@code type}, {@code s}, kind fields in schema order,
 * {@code ts}. Decimals are written as strings in plain notation so their scale survives.
 * Thread-safe and reusable.
 */
public final class JsonLineEncoder {

    private static final JsonFactory JSON_FACTORY = new JsonFactory();

    private static final JsonLineEncoder INSTANCE = new JsonLineEncoder();

    private JsonLineEncoder() {
    }

    public static JsonLineEncoder getInstance() {
        return INSTANCE;
    }

    /**
     * Encodes one event without a trailing newline.
     */
    public String encode(FeedEvent event) {
        StringWriter writer = new StringWriter(256);
        try (JsonGenerator gen = JSON_FACTORY.createGenerator(writer)) {
            if (event instanceof CanonicalEvent canonical) {
                writeCanonical(gen, canonical);
            } else if (event instanceof SpreadEvent spread) {
                writeSpread(gen, spread);
            } else {
                throw new IllegalArgumentException("Unsupported event type: " + event.getClass().getName());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to encode " + event.typeName() + " event", e);
        }
        return writer.toString();
    }

    private static void writeCanonical(JsonGenerator gen, CanonicalEvent event) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("agent", event.venue().id());
        gen.writeStringField("type", event.kind().wireName());
        gen.writeStringField("s", event.symbol().toString());
        for (Map.Entry<String, Object> field : event.fields().entrySet()) {
            gen.writeFieldName(field.getKey());
            writeValue(gen, field.getValue());
        }
        gen.writeNumberField("ts", event.timestamp());
        gen.writeEndObject();
    }

    private static void writeSpread(JsonGenerator gen, SpreadEvent event) throws IOException {
        gen.writeStartObject();
        gen.writeStringField("type", SpreadEvent.TYPE);
        gen.writeStringField("s", event.symbol().toString());
        gen.writeStringField("buy", event.buyVenue().id());
        gen.writeStringField("sell", event.sellVenue().id());
        gen.writeArrayFieldStart("venues");
        for (Venue venue : event.venues()) {
            gen.writeString(venue.id());
        }
        gen.writeEndArray();
        gen.writeStringField("buy_p", event.buyPrice().toPlainString());
        gen.writeStringField("sell_p", event.sellPrice().toPlainString());
        gen.writeStringField("spread", event.spread().toPlainString());
        gen.writeNumberField("ts", event.timestamp());
        gen.writeEndObject();
    }

    private static void writeValue(JsonGenerator gen, Object value) throws IOException {
        if (value instanceof BigDecimal decimal) {
            gen.writeString(decimal.toPlainString());
        } else if (value instanceof Long number) {
            gen.writeNumber(number);
        } else if (value instanceof Boolean flag) {
            gen.writeBoolean(flag);
        } else if (value instanceof List<?> levels) {
            gen.writeStartArray();
            for (Object item : levels) {
                PriceLevel level = (PriceLevel) item;
                gen.writeStartArray();
                gen.writeString(level.price().toPlainString());
                gen.writeString(level.quantity().toPlainString());
                gen.writeEndArray();
            }
            gen.writeEndArray();
        } else {
            gen.writeString(String.valueOf(value));
        }
    }
}
