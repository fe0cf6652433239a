package io.trading.feed.gateway.sink;

import io.trading.feed.canonical.encoder.JsonLineEncoder;
import io.trading.feed.canonical.model.FeedEvent;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Writes one JSON object per line, flushing after every event.
 */
public class JsonLineSink implements Sink {

    private final String name;
    private final Writer writer;
    private final boolean ownsStream;
    private final JsonLineEncoder encoder = JsonLineEncoder.getInstance();

    public JsonLineSink(String name, OutputStream out, boolean ownsStream) {
        this.name = name;
        this.writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
        this.ownsStream = ownsStream;
    }

    /**
     * Sink on the process standard output. Closing it only flushes.
     */
    public static JsonLineSink stdout() {
        return new JsonLineSink("stdout", System.out, false);
    }

    /**
     * Sink appending to a file, created if missing.
     */
    public static JsonLineSink toFile(Path path) throws SinkException {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            OutputStream out = Files.newOutputStream(path, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
            return new JsonLineSink("file:" + path.getFileName(), out, true);
        } catch (IOException e) {
            throw new SinkException("Cannot open " + path, e);
        }
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void write(FeedEvent event) throws SinkException {
        try {
            writer.write(encoder.encode(event));
            writer.write('\n');
            writer.flush();
        } catch (IOException e) {
            throw new SinkException(name + " write failed", e);
        }
    }

    @Override
    public void close() throws SinkException {
        try {
            if (ownsStream) {
                writer.close();
            } else {
                writer.flush();
            }
        } catch (IOException e) {
            throw new SinkException(name + " close failed", e);
        }
    }
}
