package ippnotify.server.subscription;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import ippnotify.common.configuration.SubscriptionProperties;

/**
 * Periodically cancels subscriptions whose lease has run out. Candidates are collected under the registry read lock and then removed
 * one by one through the registry's cancel path.
 */
public class SubscriptionLeaseManager {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionLeaseManager.class);

    private final SubscriptionRegistry registry;
    private final long scanIntervalSeconds;
    private ScheduledExecutorService executor = null;

    public SubscriptionLeaseManager(SubscriptionRegistry registry, SubscriptionProperties subscriptionProperties) {
        this.registry = registry;
        this.scanIntervalSeconds = subscriptionProperties.getLeaseScanIntervalSeconds();
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder().setNameFormat("lease-manager-%d").setDaemon(true).build());
        executor.scheduleAtFixedRate(() -> {
            try {
                expire();
            } catch (Exception e) {
                log.error("Error expiring subscriptions: " + e.getMessage(), e);
            }
        }, scanIntervalSeconds, scanIntervalSeconds, TimeUnit.SECONDS);
        log.info("Checking subscription leases every {} seconds", scanIntervalSeconds);
    }

    /**
     * Cancels every subscription expired as of now.
     *
     * @return the number of subscriptions cancelled
     */
    public int expire() {
        Instant now = registry.getClock().instant();
        List<Integer> expired = registry.findExpired(now);
        int cancelled = 0;
        for (Integer id : expired) {
            if (registry.cancelIfExpired(id, now)) {
                log.info("[{}] Lease expired", id);
                cancelled++;
            }
        }
        return cancelled;
    }

    public synchronized void shutdown() {
        if (executor != null) {
            executor.shutdownNow();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Lease manager did not stop in time");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }
    }
}
