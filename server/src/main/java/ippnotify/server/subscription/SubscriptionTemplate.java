package ippnotify.server.subscription;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

import ippnotify.api.model.EventKind;

/**
 * The validated contents of one subscription group, ready to be turned into a {@link Subscription}.
 */
public class SubscriptionTemplate {

    private final Set<EventKind> events;
    private final String language;
    private final byte[] userData;
    private final int leaseSeconds;
    private final int timeInterval;

    public SubscriptionTemplate(Set<EventKind> events, String language, byte[] userData, int leaseSeconds, int timeInterval) {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("A subscription needs at least one event");
        }
        this.events = Collections.unmodifiableSet(EnumSet.copyOf(events));
        this.language = language;
        this.userData = (userData == null) ? null : userData.clone();
        this.leaseSeconds = leaseSeconds;
        this.timeInterval = timeInterval;
    }

    public Set<EventKind> getEvents() {
        return events;
    }

    public String getLanguage() {
        return language;
    }

    public byte[] getUserData() {
        return (userData == null) ? null : userData.clone();
    }

    public int getLeaseSeconds() {
        return leaseSeconds;
    }

    public int getTimeInterval() {
        return timeInterval;
    }
}
