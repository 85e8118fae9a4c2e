package com.infomedia.abacox.callbilling.component.eventsocket;

import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.OutputStream;
import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

/**
 * Drives one connection through the inbound handshake and then pumps events to the listener.
 * <pre>
 * AWAITING_CHALLENGE --auth/request--> AUTHENTICATING --+OK--> SUBSCRIBING --+OK--> LISTENING
 * </pre>
 * {@link #run()} only returns by throwing: the session is over when the connection is.
 * The caller owns the transport and closes it afterwards.
 * <p>
 * Once listening, other threads may send commands through {@link #sendApi(String)}; their
 * replies arrive as {@code api/response} frames and are skipped by the reader.
 */
@Log4j2
public class EventSocketSession {

    private final EventSocketTransport transport;
    private final String password;
    private final List<String> eventNames;
    private final Duration handshakeTimeout;
    private final Duration listenTimeout;
    private final EventSocketListener listener;
    private final Consumer<SessionState> stateObserver;

    private final Object writeLock = new Object();

    private volatile SessionState state = SessionState.CONNECTING;
    private long framesDispatched;

    public EventSocketSession(EventSocketTransport transport, String password, List<String> eventNames,
                              Duration handshakeTimeout, Duration listenTimeout,
                              EventSocketListener listener, Consumer<SessionState> stateObserver) {
        this.transport = transport;
        this.password = password;
        this.eventNames = List.copyOf(eventNames);
        this.handshakeTimeout = handshakeTimeout;
        this.listenTimeout = listenTimeout;
        this.listener = listener;
        this.stateObserver = stateObserver != null ? stateObserver : s -> { };
    }

    public SessionState getState() {
        return state;
    }

    public long getFramesDispatched() {
        return framesDispatched;
    }

    public void run() throws EventSocketException {
        EslFrameDecoder decoder = new EslFrameDecoder(transport.getInputStream());
        setReadTimeout(handshakeTimeout);

        transition(SessionState.AWAITING_CHALLENGE);
        EslFrame challenge = decoder.readFrame();
        if (!challenge.isContentType(EslFrame.TYPE_AUTH_REQUEST)) {
            throw new ProtocolException("Expected auth/request, got " + challenge.contentType());
        }

        transition(SessionState.AUTHENTICATING);
        send(EslFrameEncoder.authCommand(password));
        EslFrame authReply = awaitCommandReply(decoder);
        if (!authReply.isOk()) {
            throw new AuthenticationException(authReply.replyText());
        }

        transition(SessionState.SUBSCRIBING);
        send(EslFrameEncoder.eventSubscriptionCommand(eventNames));
        EslFrame subscribeReply = awaitCommandReply(decoder);
        if (!subscribeReply.isOk()) {
            throw new ProtocolException("Event subscription refused: " + subscribeReply.replyText());
        }

        setReadTimeout(listenTimeout);
        transition(SessionState.LISTENING);
        log.info("Listening for {} on {}", eventNames, transport.describe());

        while (true) {
            EslFrame frame = decoder.readFrame();
            if (frame.isContentType(EslFrame.TYPE_EVENT_PLAIN)) {
                dispatch(frame);
            } else if (frame.isContentType(EslFrame.TYPE_DISCONNECT_NOTICE)) {
                throw new ConnectionException("Switch sent disconnect notice");
            } else {
                log.debug("Ignoring frame of type {} while listening", frame.contentType());
            }
        }
    }

    /**
     * Writes {@code api <command>} to the switch without waiting for the reply.
     *
     * @throws IllegalStateException the session is not listening
     * @throws ConnectionException   the write failed
     */
    public void sendApi(String command) throws ConnectionException {
        if (state != SessionState.LISTENING) {
            throw new IllegalStateException("Cannot send commands while " + state);
        }
        send(EslFrameEncoder.apiCommand(command));
    }

    private void dispatch(EslFrame frame) {
        try {
            listener.onEvent(frame);
            framesDispatched++;
        } catch (RuntimeException e) {
            // per-call failures never take the connection down
            log.error("Listener failed for event {} ({})", frame.eventName(), frame.get("Unique-ID"), e);
        }
    }

    private EslFrame awaitCommandReply(EslFrameDecoder decoder) throws EventSocketException {
        while (true) {
            EslFrame frame = decoder.readFrame();
            if (frame.isContentType(EslFrame.TYPE_COMMAND_REPLY)) {
                return frame;
            }
            if (frame.isContentType(EslFrame.TYPE_DISCONNECT_NOTICE)) {
                throw new ConnectionException("Switch disconnected during " + state);
            }
            log.debug("Skipping {} frame while waiting for command reply in {}", frame.contentType(), state);
        }
    }

    private void send(byte[] command) throws ConnectionException {
        synchronized (writeLock) {
            try {
                OutputStream out = transport.getOutputStream();
                out.write(command);
                out.flush();
            } catch (IOException e) {
                throw new ConnectionException("Failed to write command in state " + state, e);
            }
        }
    }

    private void setReadTimeout(Duration timeout) throws ConnectionException {
        try {
            transport.setReadTimeout(timeout);
        } catch (IOException e) {
            throw new ConnectionException("Unable to set read timeout", e);
        }
    }

    private void transition(SessionState next) {
        log.debug("Event socket session {} -> {}", state, next);
        state = next;
        stateObserver.accept(next);
    }
}
