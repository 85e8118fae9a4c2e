package com.infomedia.abacox.callbilling.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Static settings bound from {@code callbilling.*}. Billing policy that operators tune at
 * runtime lives in the config manager instead.
 */
@Data
@ConfigurationProperties(prefix = "callbilling")
public class CallBillingProperties {

    private EventSocket eventSocket = new EventSocket();
    private Reconnect reconnect = new Reconnect();
    private Workers workers = new Workers();
    private Tracker tracker = new Tracker();
    private Rating rating = new Rating();
    private Ledger ledger = new Ledger();
    private Gateway gateway = new Gateway();

    @Data
    public static class EventSocket {
        private boolean enabled = true;
        private String host = "127.0.0.1";
        private int port = 8021;
        private String password = "ClueCon";
        private Duration connectTimeout = Duration.ofSeconds(5);
        /** Bound on every read during the handshake. */
        private Duration readTimeout = Duration.ofSeconds(10);
        /** Bound on reads while listening; must exceed the switch heartbeat interval. */
        private Duration listenTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Reconnect {
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(60);
        private double jitter = 0.2;
        private int maxAuthFailures = 3;
    }

    @Data
    public static class Workers {
        private int lanes = 8;
    }

    @Data
    public static class Tracker {
        /** How often running duration and cost of answered calls are republished. */
        private Duration snapshotInterval = Duration.ofSeconds(5);
        /** Ended call ids remembered to recognise a second END. */
        private int recentlyEndedCapacity = 10_000;
    }

    @Data
    public static class Rating {
        private Duration cacheTtl = Duration.ofMinutes(5);
    }

    @Data
    public static class Ledger {
        private int maxWriteAttempts = 5;
        private Duration retryBackoff = Duration.ofMillis(20);
        private Duration expiryInterval = Duration.ofMinutes(1);
    }

    @Data
    public static class Gateway {
        private boolean enabled = true;
        private String baseUrl = "http://localhost:8000/api";
        private int maxAttempts = 2;
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration readTimeout = Duration.ofSeconds(5);
        /** Updates waiting for the sender thread; beyond this new ones are dropped. */
        private int queueCapacity = 1000;
    }
}
