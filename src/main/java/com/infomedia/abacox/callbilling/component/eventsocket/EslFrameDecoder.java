package com.infomedia.abacox.callbilling.component.eventsocket;

import lombok.extern.log4j.Log4j2;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.SocketTimeoutException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Reads event socket frames from a byte stream.
 * <p>
 * A frame is a block of {@code Key: Value} header lines closed by an empty line. When a
 * {@code Content-Length} header is present exactly that many bytes follow as the body.
 * Not thread safe: one decoder per connection, used only by the reading thread.
 */
@Log4j2
public class EslFrameDecoder {

    private static final int MAX_LINE_LENGTH = 64 * 1024;
    private static final int MAX_BODY_LENGTH = 8 * 1024 * 1024;

    private final InputStream in;

    public EslFrameDecoder(InputStream in) {
        this.in = in;
    }

    /**
     * Blocks until a full frame is available.
     *
     * @throws ConnectionException when the stream ends between frames or the transport fails
     * @throws ProtocolException   on a truncated frame, a malformed length or a read timeout
     */
    public EslFrame readFrame() throws ConnectionException, ProtocolException {
        Map<String, String> headers = new LinkedHashMap<>();
        boolean started = false;
        while (true) {
            String line = readLine(started);
            if (line == null) {
                throw new ConnectionException("Event socket closed by peer");
            }
            if (line.isEmpty()) {
                if (!started) {
                    // stray separator between frames
                    continue;
                }
                break;
            }
            started = true;
            int colon = line.indexOf(':');
            if (colon < 0) {
                log.debug("Ignoring header line without separator: {}", line);
                continue;
            }
            headers.put(line.substring(0, colon).trim(), line.substring(colon + 1).trim());
        }

        String lengthHeader = headers.get(EslFrame.CONTENT_LENGTH);
        if (lengthHeader == null) {
            return EslFrame.headersOnly(headers);
        }

        int length;
        try {
            length = Integer.parseInt(lengthHeader);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Invalid Content-Length: " + lengthHeader, e);
        }
        if (length < 0 || length > MAX_BODY_LENGTH) {
            throw new ProtocolException("Content-Length out of range: " + length);
        }

        String rawBody = new String(readExactly(length), StandardCharsets.UTF_8);
        Map<String, String> body = looksLikeKeyValueBlock(rawBody) ? parseBody(rawBody) : null;
        return new EslFrame(headers, body, rawBody);
    }

    /**
     * Lazy view over the remaining frames. Iteration stops quietly when the peer closes the
     * stream; protocol failures surface as {@link UncheckedIOException} wrapping a
     * {@link ProtocolException} cause.
     */
    public Iterator<EslFrame> frames() {
        return new Iterator<>() {
            private EslFrame next;
            private boolean finished;

            @Override
            public boolean hasNext() {
                if (next != null) {
                    return true;
                }
                if (finished) {
                    return false;
                }
                try {
                    next = readFrame();
                    return true;
                } catch (ConnectionException e) {
                    finished = true;
                    return false;
                } catch (ProtocolException e) {
                    finished = true;
                    throw new UncheckedIOException(new IOException(e.getMessage(), e));
                }
            }

            @Override
            public EslFrame next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                EslFrame frame = next;
                next = null;
                return frame;
            }
        };
    }

    public Stream<EslFrame> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(frames(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    /**
     * Parses a flat {@code key: value} block, percent-decoding values that contain {@code %}.
     */
    public static Map<String, String> parseBody(String rawBody) {
        Map<String, String> values = new LinkedHashMap<>();
        for (String line : rawBody.split("\n")) {
            String trimmed = line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
            int colon = trimmed.indexOf(':');
            if (colon <= 0) {
                continue;
            }
            String key = trimmed.substring(0, colon).trim();
            String value = trimmed.substring(colon + 1).trim();
            values.put(key, value.indexOf('%') >= 0 ? percentDecode(value) : value);
        }
        return values;
    }

    static String percentDecode(String value) {
        try {
            // '+' is a literal in event bodies, only %XX sequences are encoded
            return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.debug("Keeping malformed percent-encoded value as is: {}", value);
            return value;
        }
    }

    private static boolean looksLikeKeyValueBlock(String rawBody) {
        int newline = rawBody.indexOf('\n');
        String firstLine = newline < 0 ? rawBody : rawBody.substring(0, newline);
        int colon = firstLine.indexOf(':');
        return colon > 0 && firstLine.substring(0, colon).indexOf(' ') < 0;
    }

    /**
     * Reads one {@code \n} terminated line, dropping a trailing {@code \r}.
     * Returns null only when the stream ends before any byte of a new frame was seen.
     */
    private String readLine(boolean insideFrame) throws ConnectionException, ProtocolException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(128);
        while (true) {
            int b = read();
            if (b == -1) {
                if (!insideFrame && buffer.size() == 0) {
                    return null;
                }
                throw new ProtocolException("Stream ended inside an unterminated header block");
            }
            if (b == '\n') {
                break;
            }
            if (buffer.size() >= MAX_LINE_LENGTH) {
                throw new ProtocolException("Header line exceeds " + MAX_LINE_LENGTH + " bytes");
            }
            buffer.write(b);
        }
        String line = buffer.toString(StandardCharsets.UTF_8);
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private byte[] readExactly(int length) throws ConnectionException, ProtocolException {
        byte[] data = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read;
            try {
                read = in.read(data, offset, length - offset);
            } catch (SocketTimeoutException e) {
                throw new ProtocolException("Timed out reading frame body", e);
            } catch (IOException e) {
                throw new ConnectionException("I/O error reading frame body", e);
            }
            if (read == -1) {
                throw new ProtocolException("Body shorter than declared Content-Length: got " + offset + " of " + length + " bytes");
            }
            offset += read;
        }
        return data;
    }

    private int read() throws ConnectionException, ProtocolException {
        try {
            return in.read();
        } catch (SocketTimeoutException e) {
            throw new ProtocolException("Timed out waiting for event socket data", e);
        } catch (IOException e) {
            throw new ConnectionException("I/O error reading event socket", e);
        }
    }
}
