package ippnotify.server.subscription;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ippnotify.api.model.IppStatus;
import ippnotify.api.response.IppException;
import ippnotify.common.configuration.SubscriptionProperties;

/**
 * All live subscriptions, in creation order. The registry lock guards membership and id assignment; each subscription's own lock
 * guards its state. Whenever both are needed the registry lock is taken first.
 */
public class SubscriptionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<Integer,Subscription> subscriptions = new LinkedHashMap<>();
    private final Clock clock;
    private final int maxSubscriptions;
    private final int maxEvents;
    private int nextId = 1;

    public SubscriptionRegistry(SubscriptionProperties subscriptionProperties, Clock clock) {
        this.clock = clock;
        this.maxSubscriptions = subscriptionProperties.getMaxSubscriptions();
        this.maxEvents = subscriptionProperties.getMaxEvents();
    }

    public Clock getClock() {
        return clock;
    }

    /**
     * Registers a new subscription with the next id.
     *
     * @throws IppException
     *             with server-error-internal-error when the registry is full
     */
    public Subscription create(SubscriptionScope scope, SubscriptionTemplate template, String username) throws IppException {
        Subscription s;
        lock.writeLock().lock();
        try {
            if (subscriptions.size() >= maxSubscriptions) {
                log.warn("Refusing subscription for {}: {} subscriptions already exist", username, subscriptions.size());
                throw new IppException(IppStatus.SERVER_ERROR_INTERNAL_ERROR, "Too many subscriptions");
            }
            s = new Subscription(nextId++, scope, template, username, clock.instant(), maxEvents);
            subscriptions.put(s.getId(), s);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("[{}] Created subscription for {} on {}", s.getId(), username, scope);
        return s;
    }

    /**
     * @return the subscription, or null when no live subscription has the id
     */
    public Subscription findById(int id) {
        lock.readLock().lock();
        try {
            return subscriptions.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return the subscriptions accepted by the filter, in creation order, at most the filter's limit
     */
    public List<Subscription> list(SubscriptionFilter filter) {
        List<Subscription> result = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Subscription s : subscriptions.values()) {
                if (filter.getLimit() > 0 && result.size() >= filter.getLimit()) {
                    break;
                }
                if (filter.accepts(s)) {
                    result.add(s);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        log.trace("Listed {} subscriptions for {}", result.size(), filter);
        return result;
    }

    /**
     * Restarts the subscription's lease from now.
     */
    public void renew(Subscription s, int leaseSeconds) {
        s.renew(leaseSeconds, clock.instant());
    }

    /**
     * Removes the subscription and closes it. Returns once no reader holds the subscription any more.
     *
     * @return false when no live subscription had the id
     */
    public boolean cancel(int id) {
        return remove(id, null);
    }

    /**
     * Cancels the subscription if its lease has still run out at the given time, so that a renewal racing with the lease scan wins.
     */
    public boolean cancelIfExpired(int id, Instant now) {
        return remove(id, now);
    }

    private boolean remove(int id, Instant expiredAt) {
        Subscription s;
        lock.writeLock().lock();
        try {
            s = subscriptions.get(id);
            if (s == null || (expiredAt != null && !s.isExpired(expiredAt))) {
                return false;
            }
            subscriptions.remove(id);
        } finally {
            lock.writeLock().unlock();
        }
        s.close();
        log.info("[{}] Cancelled subscription", id);
        return true;
    }

    /**
     * Queues the event on every subscription that wants it.
     *
     * @return the number of subscriptions the event was queued on
     */
    public int publish(NotificationEvent event) {
        int delivered = 0;
        lock.readLock().lock();
        try {
            for (Subscription s : subscriptions.values()) {
                if (s.wants(event) && s.append(event) > 0) {
                    delivered++;
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        log.debug("Published {} to {} subscriptions", event, delivered);
        return delivered;
    }

    /**
     * @return ids of the subscriptions whose lease has run out at the given time
     */
    public List<Integer> findExpired(Instant now) {
        List<Integer> expired = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Subscription s : subscriptions.values()) {
                if (s.isExpired(now)) {
                    expired.add(s.getId());
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        return expired;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return subscriptions.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Cancels every subscription.
     */
    public void shutdown() {
        List<Subscription> all;
        lock.writeLock().lock();
        try {
            all = new ArrayList<>(subscriptions.values());
            subscriptions.clear();
        } finally {
            lock.writeLock().unlock();
        }
        all.forEach(Subscription::close);
        log.info("Closed {} subscriptions", all.size());
    }
}
