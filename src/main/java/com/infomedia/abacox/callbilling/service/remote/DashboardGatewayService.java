package com.infomedia.abacox.callbilling.service.remote;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.infomedia.abacox.callbilling.component.easyhttp.EasyHttp;
import com.infomedia.abacox.callbilling.component.easyhttp.EasyHttpClient;
import com.infomedia.abacox.callbilling.component.easyhttp.EasyHttpException;
import com.infomedia.abacox.callbilling.config.CallBillingProperties;
import com.infomedia.abacox.callbilling.dto.activecall.ActiveCallSnapshot;
import com.infomedia.abacox.callbilling.dto.cdr.CdrDto;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Mirrors active calls and finished CDRs to the dashboard API. The local ledger is the source
 * of truth: every failure here is retried briefly, logged, and otherwise ignored.
 * <p>
 * Call processing uses the {@code publish*} methods, which only enqueue. A single sender thread
 * drains a bounded queue in order; when the queue is full new work is dropped with a warning.
 * Snapshots of one call that are still waiting to be sent are merged, so only the latest goes out.
 */
@Service
@Log4j2
public class DashboardGatewayService {

    private static final int HTTP_NOT_FOUND = 404;

    private final CallBillingProperties.Gateway settings;
    private final EasyHttpClient httpClient;
    private final ThreadPoolExecutor sender;
    private final Map<String, ActiveCallSnapshot> pendingSnapshots = new ConcurrentHashMap<>();

    public DashboardGatewayService(CallBillingProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getGateway();
        this.httpClient = EasyHttpClient.builder()
                .connectTimeout(settings.getConnectTimeout())
                .readTimeout(settings.getReadTimeout())
                .loggingLevel(EasyHttpClient.LoggingLevel.NONE)
                .objectMapper(objectMapper)
                .build();
        this.sender = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(Math.max(1, settings.getQueueCapacity())),
                runnable -> {
                    Thread thread = new Thread(runnable, "dashboard-gateway");
                    thread.setDaemon(true);
                    return thread;
                });
    }

    /**
     * Queues the snapshot, or replaces the one already waiting for the same call.
     *
     * @return false when the gateway is disabled or the queue is full
     */
    public boolean publishActiveCall(ActiveCallSnapshot snapshot) {
        if (!settings.isEnabled()) {
            return false;
        }
        String callId = snapshot.getCallId();
        if (pendingSnapshots.put(callId, snapshot) != null) {
            return true;
        }
        boolean queued = enqueue("upsert active call " + callId, () -> {
            ActiveCallSnapshot latest = pendingSnapshots.remove(callId);
            if (latest != null) {
                upsertActiveCall(latest);
            }
        });
        if (!queued) {
            pendingSnapshots.remove(callId);
        }
        return queued;
    }

    public boolean publishRemoval(String callId) {
        return settings.isEnabled() && enqueue("remove active call " + callId, () -> removeActiveCall(callId));
    }

    public boolean publishCdr(CdrDto cdr) {
        return settings.isEnabled() && enqueue("create CDR " + cdr.getUuid(), () -> createCdr(cdr));
    }

    /**
     * Work accepted but not yet started.
     */
    public int getQueuedTasks() {
        return sender.getQueue().size();
    }

    public boolean upsertActiveCall(ActiveCallSnapshot snapshot) {
        return send("upsert active call " + snapshot.getCallId(),
                () -> request("active-calls").json(snapshot).post());
    }

    /**
     * Idempotent: a 404 from the dashboard counts as success.
     */
    public boolean removeActiveCall(String callId) {
        return send("remove active call " + callId,
                () -> request("active-calls").pathSegment(callId).delete(), HTTP_NOT_FOUND);
    }

    public boolean createCdr(CdrDto cdr) {
        return send("create CDR " + cdr.getUuid(),
                () -> request("cdr").json(cdr).post());
    }

    @PreDestroy
    public void shutdown() {
        sender.shutdown();
        try {
            if (!sender.awaitTermination(5, TimeUnit.SECONDS)) {
                int dropped = sender.shutdownNow().size();
                log.warn("Dashboard sender did not drain in time. {} updates were dropped.", dropped);
            }
        } catch (InterruptedException e) {
            sender.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private boolean enqueue(String description, Runnable task) {
        try {
            sender.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    log.error("Dashboard {} failed unexpectedly", description, e);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Dashboard queue full ({} waiting), dropping {}", sender.getQueue().size(), description);
            return false;
        }
    }

    private EasyHttp request(String path) {
        return httpClient.url(settings.getBaseUrl()).pathSegment(path);
    }

    private boolean send(String description, Supplier<EasyHttp.ResponseExecutor> call, int... acceptableStatuses) {
        if (!settings.isEnabled()) {
            return false;
        }
        int attempts = Math.max(1, settings.getMaxAttempts());
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                int status = call.get().expectSuccess(acceptableStatuses);
                log.debug("Dashboard {}: HTTP {}", description, status);
                return true;
            } catch (EasyHttpException e) {
                boolean retryable = e.isNetworkError() || e.isServerError();
                if (!retryable || attempt == attempts) {
                    log.warn("Dashboard {} failed after {} attempt(s): {}", description, attempt, e.getMessage());
                    return false;
                }
                log.debug("Dashboard {} failed (attempt {}/{}), retrying: {}", description, attempt, attempts, e.getMessage());
            }
        }
        return false;
    }
}
