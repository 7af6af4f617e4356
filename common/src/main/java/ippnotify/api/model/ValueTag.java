package ippnotify.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ValueTag {

    INTEGER("integer"),
    BOOLEAN("boolean"),
    ENUM("enum"),
    OCTET_STRING("octetString"),
    DATE_TIME("dateTime"),
    TEXT("text"),
    NAME("name"),
    KEYWORD("keyword"),
    URI("uri"),
    CHARSET("charset"),
    NATURAL_LANGUAGE("naturalLanguage"),
    NO_VALUE("no-value");

    private final String keyword;

    ValueTag(String keyword) {
        this.keyword = keyword;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    @JsonCreator
    public static ValueTag fromKeyword(String keyword) {
        for (ValueTag t : values()) {
            if (t.keyword.equals(keyword)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown value tag " + keyword);
    }
}
