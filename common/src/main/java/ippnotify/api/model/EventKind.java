package ippnotify.api.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The closed set of notification events, with the keyword used on the wire and the bit used in event masks. New kinds are added here and
 * nowhere else.
 */
public enum EventKind {

    DOCUMENT_ATTRIBUTE_CHANGED("document-attribute-changed", 0x00000001),
    DOCUMENT_CREATED("document-created", 0x00000002),
    DOCUMENT_COMPLETED("document-completed", 0x00000004),
    DOCUMENT_CONFIG_CHANGED("document-config-changed", 0x00000008),
    DOCUMENT_FETCHABLE("document-fetchable", 0x00000010),
    DOCUMENT_STATE_CHANGED("document-state-changed", 0x00000020),
    DOCUMENT_STOPPED("document-stopped", 0x00000040),
    JOB_COMPLETED("job-completed", 0x00000080),
    JOB_CONFIG_CHANGED("job-config-changed", 0x00000100),
    JOB_CREATED("job-created", 0x00000200),
    JOB_FETCHABLE("job-fetchable", 0x00000400),
    JOB_PROGRESS("job-progress", 0x00000800),
    JOB_STATE_CHANGED("job-state-changed", 0x00001000),
    JOB_STOPPED("job-stopped", 0x00002000),
    PRINTER_CONFIG_CHANGED("printer-config-changed", 0x00004000),
    PRINTER_FINISHINGS_CHANGED("printer-finishings-changed", 0x00008000),
    PRINTER_MEDIA_CHANGED("printer-media-changed", 0x00010000),
    PRINTER_QUEUE_ORDER_CHANGED("printer-queue-order-changed", 0x00020000),
    PRINTER_RESTARTED("printer-restarted", 0x00040000),
    PRINTER_SHUTDOWN("printer-shutdown", 0x00080000),
    PRINTER_STATE_CHANGED("printer-state-changed", 0x00100000),
    PRINTER_STOPPED("printer-stopped", 0x00200000),
    RESOURCE_CANCELED("resource-canceled", 0x00400000),
    RESOURCE_CONFIG_CHANGED("resource-config-changed", 0x00800000),
    RESOURCE_CREATED("resource-created", 0x01000000),
    RESOURCE_INSTALLED("resource-installed", 0x02000000),
    RESOURCE_STATE_CHANGED("resource-state-changed", 0x04000000),
    PRINTER_CREATED("printer-created", 0x08000000),
    PRINTER_DELETED("printer-deleted", 0x10000000),
    SYSTEM_CONFIG_CHANGED("system-config-changed", 0x20000000),
    SYSTEM_STATE_CHANGED("system-state-changed", 0x40000000),
    SYSTEM_STOPPED("system-stopped", 0x80000000);

    private static final Map<String,EventKind> BY_KEYWORD = new HashMap<>();

    static {
        for (EventKind kind : values()) {
            BY_KEYWORD.put(kind.keyword, kind);
        }
    }

    private final String keyword;
    private final int bit;

    EventKind(String keyword, int bit) {
        this.keyword = keyword;
        this.bit = bit;
    }

    public String getKeyword() {
        return keyword;
    }

    public int getBit() {
        return bit;
    }

    /**
     * @return the kind for the keyword, or null when the keyword is not a known event
     */
    public static EventKind fromKeyword(String keyword) {
        return BY_KEYWORD.get(keyword);
    }

    /**
     * Decodes a list of event keywords. Unknown keywords are skipped.
     */
    public static Set<EventKind> fromKeywords(Collection<String> keywords) {
        Set<EventKind> events = EnumSet.noneOf(EventKind.class);
        for (String keyword : keywords) {
            EventKind kind = fromKeyword(keyword);
            if (kind != null) {
                events.add(kind);
            }
        }
        return events;
    }

    public static List<String> toKeywords(Set<EventKind> events) {
        List<String> keywords = new ArrayList<>(events.size());
        for (EventKind kind : values()) {
            if (events.contains(kind)) {
                keywords.add(kind.keyword);
            }
        }
        return keywords;
    }

    public static int toMask(Set<EventKind> events) {
        int mask = 0;
        for (EventKind kind : events) {
            mask |= kind.bit;
        }
        return mask;
    }

    public static Set<EventKind> fromMask(int mask) {
        Set<EventKind> events = EnumSet.noneOf(EventKind.class);
        for (EventKind kind : values()) {
            if ((mask & kind.bit) != 0) {
                events.add(kind);
            }
        }
        return Collections.unmodifiableSet(events);
    }
}
