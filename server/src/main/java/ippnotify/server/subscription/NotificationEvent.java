package ippnotify.server.subscription;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ippnotify.api.model.EventKind;
import ippnotify.api.model.IppAttribute;

/**
 * Something that happened to the system, a printer or a job. Printer and job are opaque identities; a null printer means the event
 * originates at the system.
 */
public class NotificationEvent {

    private final EventKind kind;
    private final Instant time;
    private final Integer printerId;
    private final Integer jobId;
    private final String text;
    private final List<IppAttribute> snapshot;

    public NotificationEvent(EventKind kind, Instant time, Integer printerId, Integer jobId, String text, List<IppAttribute> snapshot) {
        this.kind = kind;
        this.time = time;
        this.printerId = printerId;
        this.jobId = jobId;
        this.text = text;
        this.snapshot = (snapshot == null) ? Collections.emptyList() : Collections.unmodifiableList(new ArrayList<>(snapshot));
    }

    public EventKind getKind() {
        return kind;
    }

    public Instant getTime() {
        return time;
    }

    public Integer getPrinterId() {
        return printerId;
    }

    public Integer getJobId() {
        return jobId;
    }

    public String getText() {
        return text;
    }

    /**
     * Descriptive attributes of the originating object, captured when the event was produced.
     */
    public List<IppAttribute> getSnapshot() {
        return snapshot;
    }

    @Override
    public String toString() {
        return kind.getKeyword() + "{printer=" + printerId + ", job=" + jobId + ", text=" + text + "}";
    }
}
