package com.infomedia.abacox.callbilling.component.eventsocket;

import java.io.ByteArrayOutputStream;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Serializes outbound commands and, for simulators and tests, whole frames.
 */
public final class EslFrameEncoder {

    private EslFrameEncoder() {
    }

    public static byte[] authCommand(String password) {
        return command("auth " + password);
    }

    public static byte[] eventSubscriptionCommand(Collection<String> eventNames) {
        return command("event plain " + String.join(" ", eventNames));
    }

    public static byte[] apiCommand(String api) {
        return command("api " + api);
    }

    /**
     * A command is a single line followed by an empty line.
     */
    public static byte[] command(String line) {
        if (line.indexOf('\n') >= 0) {
            throw new IllegalArgumentException("Command must be a single line");
        }
        return (line + "\n\n").getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Encodes headers and an optional flat key/value body. Body values are percent-encoded
     * when they contain characters that would break the line format, and {@code Content-Length}
     * is computed from the encoded body.
     */
    public static byte[] frame(Map<String, String> headers, Map<String, String> body) {
        Map<String, String> allHeaders = new LinkedHashMap<>(headers);
        byte[] bodyBytes = null;
        if (body != null) {
            bodyBytes = encodeBody(body).getBytes(StandardCharsets.UTF_8);
            allHeaders.put(EslFrame.CONTENT_LENGTH, Integer.toString(bodyBytes.length));
        } else {
            allHeaders.remove(EslFrame.CONTENT_LENGTH);
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        StringBuilder head = new StringBuilder();
        allHeaders.forEach((key, value) -> head.append(key).append(": ").append(value).append('\n'));
        head.append('\n');
        out.writeBytes(head.toString().getBytes(StandardCharsets.UTF_8));
        if (bodyBytes != null) {
            out.writeBytes(bodyBytes);
        }
        return out.toByteArray();
    }

    public static String encodeBody(Map<String, String> body) {
        StringBuilder sb = new StringBuilder();
        body.forEach((key, value) -> sb.append(key).append(": ").append(encodeValue(value)).append('\n'));
        sb.append('\n');
        return sb.toString();
    }

    static String encodeValue(String value) {
        if (value == null) {
            return "";
        }
        boolean needsEncoding = value.indexOf('%') >= 0 || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0
                || !value.equals(value.trim()) || !StandardCharsets.US_ASCII.newEncoder().canEncode(value);
        if (!needsEncoding) {
            return value;
        }
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
