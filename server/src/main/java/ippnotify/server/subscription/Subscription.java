package ippnotify.server.subscription;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ippnotify.api.model.EventKind;
import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.IppResponse;
import ippnotify.api.model.ScopeType;

/**
 * A live pull subscription. Identity, scope and event set never change; lease state and the notification queue are guarded by the
 * subscription's own read/write lock, which is always taken after the registry lock.
 */
public class Subscription {

    private static final Logger log = LoggerFactory.getLogger(Subscription.class);

    private final int id;
    private final SubscriptionScope scope;
    private final Set<EventKind> events;
    private final String username;
    private final String language;
    private final byte[] userData;
    private final int timeInterval;
    private final NotificationQueue queue;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private int leaseSeconds;
    private Instant expiresAt;
    private boolean closed = false;

    public Subscription(int id, SubscriptionScope scope, SubscriptionTemplate template, String username, Instant now, int maxEvents) {
        this.id = id;
        this.scope = scope;
        this.events = template.getEvents();
        this.username = username;
        this.language = template.getLanguage();
        this.userData = template.getUserData();
        this.timeInterval = template.getTimeInterval();
        this.queue = new NotificationQueue(maxEvents);
        setLease(template.getLeaseSeconds(), now);
    }

    public int getId() {
        return id;
    }

    public SubscriptionScope getScope() {
        return scope;
    }

    public Set<EventKind> getEvents() {
        return events;
    }

    public String getUsername() {
        return username;
    }

    public String getLanguage() {
        return language;
    }

    /**
     * @return a copy of notify-user-data, null when the client gave none
     */
    public byte[] getUserData() {
        return (userData == null) ? null : userData.clone();
    }

    public ReentrantReadWriteLock getLock() {
        return lock;
    }

    public int getLeaseSeconds() {
        lock.readLock().lock();
        try {
            return leaseSeconds;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * @return when the lease runs out, null for a subscription that never expires
     */
    public Instant getExpiresAt() {
        lock.readLock().lock();
        try {
            return expiresAt;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isExpired(Instant now) {
        lock.readLock().lock();
        try {
            return !closed && expiresAt != null && !now.isBefore(expiresAt);
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean isClosed() {
        lock.readLock().lock();
        try {
            return closed;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Restarts the lease from now. A lease of 0 means the subscription never expires.
     */
    public void renew(int leaseSeconds, Instant now) {
        lock.writeLock().lock();
        try {
            setLease(leaseSeconds, now);
            log.debug("[{}] Renewed for {} seconds", id, leaseSeconds);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void setLease(int leaseSeconds, Instant now) {
        this.leaseSeconds = leaseSeconds;
        this.expiresAt = (leaseSeconds == 0) ? null : now.plusSeconds(leaseSeconds);
    }

    public boolean wants(NotificationEvent event) {
        return events.contains(event.getKind()) && scope.matches(event);
    }

    /**
     * Adds the event to the queue if the subscription is still open.
     *
     * @return the sequence number given to the event, 0 when the subscription is closed
     */
    public int append(NotificationEvent event) {
        lock.writeLock().lock();
        try {
            if (closed) {
                return 0;
            }
            int seq = queue.append(event);
            log.trace("[{}] Queued {} as #{}", id, event, seq);
            return seq;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Acknowledges up to lastSeen and returns the following records, see {@link NotificationQueue#retrieve(int, int)}.
     */
    public List<NotificationRecord> retrieve(int lastSeen, int limit) {
        lock.writeLock().lock();
        try {
            return queue.retrieve(lastSeen, limit);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int getLastSequence() {
        lock.readLock().lock();
        try {
            return queue.getLastSequence();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Builds the subscription's attributes, restricted to those requested.
     */
    public List<IppAttribute> getAttributes(RequestedAttributes requested) {
        List<IppAttribute> attrs = new ArrayList<>();
        lock.readLock().lock();
        try {
            add(attrs, requested, IppAttribute.integer("notify-subscription-id", id));
            add(attrs, requested, IppAttribute.keywords("notify-events", EventKind.toKeywords(events)));
            add(attrs, requested, IppAttribute.keyword("notify-pull-method", SubscriptionAttributeValidator.PULL_METHOD));
            add(attrs, requested, IppAttribute.charset("notify-charset", IppResponse.CHARSET));
            add(attrs, requested, IppAttribute.naturalLanguage("notify-natural-language", language));
            if (userData != null) {
                add(attrs, requested, IppAttribute.octetString("notify-user-data", userData));
            }
            add(attrs, requested, IppAttribute.integer("notify-lease-duration", leaseSeconds));
            add(attrs, requested, IppAttribute.integer("notify-time-interval", timeInterval));
            add(attrs, requested, IppAttribute.integer("notify-lease-expiration-time", (expiresAt == null) ? 0 : (int) expiresAt.getEpochSecond()));
            add(attrs, requested, IppAttribute.integer("notify-sequence-number", queue.getLastSequence()));
            add(attrs, requested, IppAttribute.name("notify-subscriber-user-name", username));
            if (scope.getType() != ScopeType.SYSTEM) {
                add(attrs, requested, IppAttribute.integer("notify-printer-id", scope.getPrinterId()));
                add(attrs, requested, IppAttribute.name("notify-printer-name", scope.getPrinterName()));
            }
            if (scope.getType() == ScopeType.JOB) {
                add(attrs, requested, IppAttribute.integer("notify-job-id", scope.getJobId()));
            }
        } finally {
            lock.readLock().unlock();
        }
        return attrs;
    }

    private static void add(List<IppAttribute> attrs, RequestedAttributes requested, IppAttribute attr) {
        if (requested.includes(attr.getName())) {
            attrs.add(attr);
        }
    }

    /**
     * Marks the subscription closed and releases its queue. Waits for readers holding the subscription lock.
     */
    public void close() {
        lock.writeLock().lock();
        try {
            if (!closed) {
                closed = true;
                queue.clear();
                log.debug("[{}] Closed", id);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public String toString() {
        return "Subscription{id=" + id + ", scope=" + scope + ", user=" + username + ", events=" + EventKind.toKeywords(events) + "}";
    }
}
