package ippnotify.server.printer;

/**
 * printer-state values (RFC 8011).
 */
public enum PrinterState {

    IDLE(3, "idle"),
    PROCESSING(4, "processing"),
    STOPPED(5, "stopped");

    private final int value;
    private final String keyword;

    PrinterState(int value, String keyword) {
        this.value = value;
        this.keyword = keyword;
    }

    public int getValue() {
        return value;
    }

    public String getKeyword() {
        return keyword;
    }
}
