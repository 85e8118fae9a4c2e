package com.infomedia.abacox.callbilling.component.eventsocket;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One frame read from the event socket: the header block plus an optional body.
 * <p>
 * For event frames ({@code text/event-plain}) the body is itself a flat {@code key: value}
 * block and is exposed through {@link #getBody()}. Bodies that are not key/value text
 * (for example {@code api/response} output) are only available through {@link #getRawBody()}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class EslFrame {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String CONTENT_LENGTH = "Content-Length";
    public static final String REPLY_TEXT = "Reply-Text";
    public static final String EVENT_NAME = "Event-Name";

    public static final String TYPE_AUTH_REQUEST = "auth/request";
    public static final String TYPE_COMMAND_REPLY = "command/reply";
    public static final String TYPE_API_RESPONSE = "api/response";
    public static final String TYPE_EVENT_PLAIN = "text/event-plain";
    public static final String TYPE_DISCONNECT_NOTICE = "text/disconnect-notice";

    private final Map<String, String> headers;
    private final Map<String, String> body;
    private final String rawBody;

    public EslFrame(Map<String, String> headers, Map<String, String> body, String rawBody) {
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.body = body == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(body));
        this.rawBody = rawBody;
    }

    public static EslFrame headersOnly(Map<String, String> headers) {
        return new EslFrame(headers, null, null);
    }

    public boolean hasBody() {
        return body != null;
    }

    public String contentType() {
        return headers.get(CONTENT_TYPE);
    }

    public boolean isContentType(String type) {
        return type.equalsIgnoreCase(contentType());
    }

    public String replyText() {
        return headers.get(REPLY_TEXT);
    }

    /**
     * Command replies report success as a {@code Reply-Text} starting with {@code +OK}.
     */
    public boolean isOk() {
        String reply = replyText();
        return reply != null && reply.startsWith("+OK");
    }

    public String eventName() {
        return get(EVENT_NAME);
    }

    /**
     * Looks a field up in the body first and falls back to the headers, since the switch puts
     * event fields in the body for plain events but some frames carry them as headers.
     */
    public String get(String name) {
        if (body != null && body.containsKey(name)) {
            return body.get(name);
        }
        return headers.get(name);
    }
}
