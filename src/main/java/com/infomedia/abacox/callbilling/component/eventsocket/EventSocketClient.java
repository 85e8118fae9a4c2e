package com.infomedia.abacox.callbilling.component.eventsocket;

import com.infomedia.abacox.callbilling.config.CallBillingProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps an inbound event socket connection to the switch alive for the lifetime of the
 * application. Runs the connect, authenticate, subscribe, listen cycle on a dedicated thread
 * and reconnects with bounded backoff; gives up only after repeated authentication rejections.
 * <p>
 * The active call registry is not touched on reconnect: calls live across short outages.
 */
@Component
@Log4j2
public class EventSocketClient {

    private final CallBillingProperties.EventSocket settings;
    private final EventSocketListener listener;
    private final EventSocketCommandChannel commandChannel;
    private final ReconnectPolicy reconnectPolicy;

    private final ReentrantLock sleepLock = new ReentrantLock();
    private final Condition wakeUp = sleepLock.newCondition();

    private volatile boolean running;
    private volatile SessionState state = SessionState.DISCONNECTED;
    private volatile EventSocketTransport currentTransport;
    private Thread worker;

    public EventSocketClient(CallBillingProperties properties, EventSocketListener listener,
                             EventSocketCommandChannel commandChannel) {
        this.settings = properties.getEventSocket();
        this.listener = listener;
        this.commandChannel = commandChannel;
        CallBillingProperties.Reconnect reconnect = properties.getReconnect();
        this.reconnectPolicy = new ReconnectPolicy(reconnect.getInitialDelay(), reconnect.getMaxDelay(),
                reconnect.getJitter(), reconnect.getMaxAuthFailures());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!settings.isEnabled()) {
            log.info("Event socket client disabled by configuration");
            return;
        }
        start();
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        worker = new Thread(this::runLoop, "event-socket-client");
        worker.setDaemon(true);
        worker.start();
    }

    @PreDestroy
    public void stop() {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return;
            }
            running = false;
            thread = worker;
        }
        closeQuietly(currentTransport);
        signalWakeUp();
        if (thread != null) {
            try {
                thread.join(TimeUnit.SECONDS.toMillis(5));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Event socket client stopped");
    }

    public SessionState getState() {
        return state;
    }

    public boolean isRunning() {
        return running;
    }

    void runLoop() {
        while (running) {
            try {
                runSingleSession();
            } catch (AuthenticationException e) {
                reconnectPolicy.recordAuthFailure();
                if (!reconnectPolicy.shouldRetryAfterAuthFailure()) {
                    log.error("Event socket authentication rejected {} times in a row ({}). Giving up until restarted.",
                            reconnectPolicy.getConsecutiveAuthFailures(), e.getReplyText());
                    running = false;
                } else {
                    log.warn("Event socket authentication rejected: {}", e.getReplyText());
                }
            } catch (ProtocolException e) {
                log.warn("Event socket protocol error, dropping connection: {}", e.getMessage());
            } catch (ConnectionException e) {
                if (running) {
                    log.warn("Event socket connection lost: {}", describe(e));
                }
            } catch (EventSocketException e) {
                log.error("Unexpected event socket failure", e);
            }
            state = SessionState.DISCONNECTED;

            if (running) {
                Duration delay = reconnectPolicy.nextDelay();
                log.info("Reconnecting to event socket in {} ms (attempt {})", delay.toMillis(),
                        reconnectPolicy.getConsecutiveFailures());
                sleep(delay);
            }
        }
        state = SessionState.DISCONNECTED;
    }

    private void runSingleSession() throws EventSocketException {
        state = SessionState.CONNECTING;
        EventSocketTransport transport = SocketTransport.connect(settings.getHost(), settings.getPort(), settings.getConnectTimeout());
        currentTransport = transport;
        log.info("Connected to event socket at {}", transport.describe());
        EventSocketSession session = new EventSocketSession(transport, settings.getPassword(),
                listener.subscribedEvents(), settings.getReadTimeout(), settings.getListenTimeout(),
                listener, this::onStateChange);
        commandChannel.attach(session);
        try {
            session.run();
        } finally {
            commandChannel.detach(session);
            currentTransport = null;
            closeQuietly(transport);
        }
    }

    private void onStateChange(SessionState next) {
        state = next;
        if (next == SessionState.LISTENING) {
            reconnectPolicy.reset();
        }
    }

    private void sleep(Duration delay) {
        sleepLock.lock();
        try {
            long remaining = delay.toNanos();
            while (running && remaining > 0) {
                remaining = wakeUp.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            running = false;
        } finally {
            sleepLock.unlock();
        }
    }

    private void signalWakeUp() {
        sleepLock.lock();
        try {
            wakeUp.signalAll();
        } finally {
            sleepLock.unlock();
        }
    }

    private static String describe(Exception e) {
        return e.getCause() != null ? e.getMessage() + " (" + e.getCause().getMessage() + ")" : e.getMessage();
    }

    private static void closeQuietly(EventSocketTransport transport) {
        if (transport == null) {
            return;
        }
        try {
            transport.close();
        } catch (IOException e) {
            log.debug("Error closing event socket transport: {}", e.getMessage());
        }
    }
}
