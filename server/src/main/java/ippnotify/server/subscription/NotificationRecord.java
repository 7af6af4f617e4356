package ippnotify.server.subscription;

/**
 * One entry returned by {@link NotificationQueue#retrieve(int, int)}: either a numbered event or the marker reporting that older events
 * were dropped on overflow.
 */
public class NotificationRecord {

    public static final String EVENTS_DROPPED = "events-dropped";

    private final int sequenceNumber;
    private final NotificationEvent event;
    private final int droppedCount;

    private NotificationRecord(int sequenceNumber, NotificationEvent event, int droppedCount) {
        this.sequenceNumber = sequenceNumber;
        this.event = event;
        this.droppedCount = droppedCount;
    }

    public static NotificationRecord event(int sequenceNumber, NotificationEvent event) {
        return new NotificationRecord(sequenceNumber, event, 0);
    }

    /**
     * @param lastDroppedSequence
     *            the highest sequence number lost, used as the marker's own sequence number
     */
    public static NotificationRecord dropped(int lastDroppedSequence, int droppedCount) {
        return new NotificationRecord(lastDroppedSequence, null, droppedCount);
    }

    public int getSequenceNumber() {
        return sequenceNumber;
    }

    /**
     * @return the event, null for a drop marker
     */
    public NotificationEvent getEvent() {
        return event;
    }

    public boolean isDropMarker() {
        return event == null;
    }

    public int getDroppedCount() {
        return droppedCount;
    }

    @Override
    public String toString() {
        if (isDropMarker()) {
            return "#" + sequenceNumber + " " + EVENTS_DROPPED + "(" + droppedCount + ")";
        }
        return "#" + sequenceNumber + " " + event;
    }
}
