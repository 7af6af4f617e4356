package ippnotify.server.subscription;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded, ordered buffer of the events delivered to one subscription. Sequence numbers start at 1 and increase by one per appended
 * event. When full, the oldest record is discarded and remembered in a drop marker until the client acknowledges past it.
 * <p>
 * Not thread safe; the owning {@link Subscription} guards it with its lock.
 */
public class NotificationQueue {

    private final int capacity;
    private final ArrayDeque<NotificationRecord> records;
    private int nextSequence = 1;
    private int watermark = 0;
    private int droppedCount = 0;
    private int lastDroppedSequence = 0;

    public NotificationQueue(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.records = new ArrayDeque<>(capacity);
    }

    /**
     * @return the sequence number given to the event
     */
    public int append(NotificationEvent event) {
        if (records.size() == capacity) {
            NotificationRecord oldest = records.pollFirst();
            droppedCount++;
            lastDroppedSequence = oldest.getSequenceNumber();
        }
        int sequence = nextSequence++;
        records.addLast(NotificationRecord.event(sequence, event));
        return sequence;
    }

    /**
     * Acknowledges every record up to lastSeen and returns what follows it. Never blocks.
     *
     * @param lastSeen
     *            highest sequence number the client has processed, 0 for none
     * @param limit
     *            maximum number of records returned, 0 for no limit
     */
    public List<NotificationRecord> retrieve(int lastSeen, int limit) {
        acknowledge(lastSeen);
        List<NotificationRecord> result = new ArrayList<>();
        if (droppedCount > 0 && lastDroppedSequence > watermark) {
            result.add(NotificationRecord.dropped(lastDroppedSequence, droppedCount));
        }
        Iterator<NotificationRecord> iter = records.iterator();
        while (iter.hasNext() && (limit <= 0 || result.size() < limit)) {
            NotificationRecord r = iter.next();
            if (r.getSequenceNumber() > watermark) {
                result.add(r);
            }
        }
        return result;
    }

    private void acknowledge(int lastSeen) {
        int ack = Math.min(lastSeen, nextSequence - 1);
        if (ack <= watermark) {
            return;
        }
        watermark = ack;
        while (!records.isEmpty() && records.peekFirst().getSequenceNumber() <= watermark) {
            records.pollFirst();
        }
        if (lastDroppedSequence <= watermark) {
            droppedCount = 0;
        }
    }

    /**
     * @return the sequence number of the newest event, 0 when nothing was ever appended
     */
    public int getLastSequence() {
        return nextSequence - 1;
    }

    public int getWatermark() {
        return watermark;
    }

    public int size() {
        return records.size();
    }

    public void clear() {
        records.clear();
    }
}
