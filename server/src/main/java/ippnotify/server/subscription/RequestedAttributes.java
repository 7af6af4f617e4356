package ippnotify.server.subscription;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * The subscription attributes a client asked for with requested-attributes.
 */
public class RequestedAttributes {

    public static final String ALL = "all";
    public static final String TEMPLATE_GROUP = "subscription-template";
    public static final String DESCRIPTION_GROUP = "subscription-description";

    static final Set<String> TEMPLATE = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("notify-events", "notify-pull-method",
                    "notify-charset", "notify-natural-language", "notify-user-data", "notify-lease-duration", "notify-time-interval")));

    static final Set<String> DESCRIPTION = Collections.unmodifiableSet(new HashSet<>(Arrays.asList("notify-subscription-id",
                    "notify-sequence-number", "notify-lease-expiration-time", "notify-subscriber-user-name", "notify-job-id",
                    "notify-printer-id", "notify-printer-name")));

    private static final RequestedAttributes EVERYTHING = new RequestedAttributes(Collections.emptySet());

    private final Set<String> names;

    private RequestedAttributes(Set<String> names) {
        this.names = names;
    }

    /**
     * @param names
     *            requested-attributes values, empty when the client did not send the attribute
     */
    public static RequestedAttributes of(Set<String> names) {
        if (names == null || names.isEmpty() || names.contains(ALL)) {
            return EVERYTHING;
        }
        return new RequestedAttributes(new HashSet<>(names));
    }

    public static RequestedAttributes all() {
        return EVERYTHING;
    }

    public boolean includes(String name) {
        if (names.isEmpty()) {
            return true;
        }
        if (names.contains(name)) {
            return true;
        }
        return (names.contains(TEMPLATE_GROUP) && TEMPLATE.contains(name)) || (names.contains(DESCRIPTION_GROUP) && DESCRIPTION.contains(name));
    }
}
