package ippnotify.server.printer;

/**
 * job-state values (RFC 8011).
 */
public enum JobState {

    PENDING(3, "pending"),
    PENDING_HELD(4, "pending-held"),
    PROCESSING(5, "processing"),
    PROCESSING_STOPPED(6, "processing-stopped"),
    CANCELED(7, "canceled"),
    ABORTED(8, "aborted"),
    COMPLETED(9, "completed");

    private final int value;
    private final String keyword;

    JobState(int value, String keyword) {
        this.value = value;
        this.keyword = keyword;
    }

    public int getValue() {
        return value;
    }

    public String getKeyword() {
        return keyword;
    }

    public boolean isTerminal() {
        return this == CANCELED || this == ABORTED || this == COMPLETED;
    }
}
