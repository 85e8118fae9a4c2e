package com.infomedia.abacox.callbilling.component.eventsocket;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.time.Duration;

/**
 * The byte pipe a session runs over. Production code uses {@link SocketTransport}.
 */
public interface EventSocketTransport extends Closeable {

    InputStream getInputStream();

    OutputStream getOutputStream();

    /**
     * Bounds every subsequent blocking read; a read that exceeds it fails with
     * {@link java.net.SocketTimeoutException}.
     */
    void setReadTimeout(Duration timeout) throws IOException;

    String describe();
}
