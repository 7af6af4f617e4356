package ippnotify.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum GroupTag {

    OPERATION("operation"),
    JOB("job"),
    PRINTER("printer"),
    UNSUPPORTED("unsupported"),
    SUBSCRIPTION("subscription"),
    EVENT_NOTIFICATION("event-notification");

    private final String keyword;

    GroupTag(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    @JsonCreator
    public static GroupTag fromKeyword(String keyword) {
        for (GroupTag t : values()) {
            if (t.keyword.equals(keyword)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown group tag " + keyword);
    }
}
