package com.infomedia.abacox.callbilling.component.callevents;

import com.infomedia.abacox.callbilling.config.CallBillingProperties;
import jakarta.annotation.PreDestroy;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed set of single-threaded lanes. A call id always hashes to the same lane, so work for one
 * call runs in submission order and never overlaps; different calls spread across lanes.
 */
@Component
@Log4j2
public class CallWorkerPool {

    private final List<ThreadPoolExecutor> lanes;

    @Autowired
    public CallWorkerPool(CallBillingProperties properties) {
        this(properties.getWorkers().getLanes());
    }

    CallWorkerPool(int laneCount) {
        if (laneCount < 1) {
            throw new IllegalArgumentException("At least one worker lane is required");
        }
        List<ThreadPoolExecutor> created = new ArrayList<>(laneCount);
        for (int i = 0; i < laneCount; i++) {
            created.add(new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                    new LinkedBlockingQueue<>(), laneThreadFactory(i)));
        }
        this.lanes = List.copyOf(created);
    }

    public int getLaneCount() {
        return lanes.size();
    }

    public int laneFor(String callId) {
        return Math.floorMod(callId.hashCode(), lanes.size());
    }

    public Future<?> submit(String callId, Runnable task) {
        int lane = laneFor(callId);
        return lanes.get(lane).submit(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("Uncaught exception while processing call {} on lane {}", callId, lane, e);
            }
        });
    }

    /**
     * Total tasks waiting across all lanes.
     */
    public int getQueuedTasks() {
        return lanes.stream().mapToInt(lane -> lane.getQueue().size()).sum();
    }

    @PreDestroy
    public void shutdown() {
        log.debug("Shutting down call worker lanes...");
        lanes.forEach(ThreadPoolExecutor::shutdown);
        try {
            for (ThreadPoolExecutor lane : lanes) {
                if (!lane.awaitTermination(5, TimeUnit.SECONDS)) {
                    List<Runnable> dropped = lane.shutdownNow();
                    log.warn("Call worker lane did not drain in time. {} tasks were dropped.", dropped.size());
                }
            }
        } catch (InterruptedException e) {
            log.debug("Call worker shutdown interrupted.", e);
            lanes.forEach(ThreadPoolExecutor::shutdownNow);
            Thread.currentThread().interrupt();
        }
        log.debug("Call worker lanes shut down.");
    }

    private static ThreadFactory laneThreadFactory(int index) {
        AtomicInteger generation = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "call-lane-" + index + "-" + generation.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
