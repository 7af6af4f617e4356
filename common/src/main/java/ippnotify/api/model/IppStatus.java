package ippnotify.api.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * IPP status codes used by the subscription operations (RFC 8011, RFC 3995).
 */
public enum IppStatus {

    SUCCESSFUL_OK(0x0000, "successful-ok"),
    SUCCESSFUL_OK_IGNORED_OR_SUBSTITUTED_ATTRIBUTES(0x0001, "successful-ok-ignored-or-substituted-attributes"),
    SUCCESSFUL_OK_IGNORED_SUBSCRIPTIONS(0x0003, "successful-ok-ignored-subscriptions"),
    CLIENT_ERROR_BAD_REQUEST(0x0400, "client-error-bad-request"),
    CLIENT_ERROR_FORBIDDEN(0x0401, "client-error-forbidden"),
    CLIENT_ERROR_NOT_AUTHENTICATED(0x0402, "client-error-not-authenticated"),
    CLIENT_ERROR_NOT_AUTHORIZED(0x0403, "client-error-not-authorized"),
    CLIENT_ERROR_NOT_POSSIBLE(0x0404, "client-error-not-possible"),
    CLIENT_ERROR_NOT_FOUND(0x0406, "client-error-not-found"),
    CLIENT_ERROR_ATTRIBUTES_OR_VALUES_NOT_SUPPORTED(0x040B, "client-error-attributes-or-values-not-supported"),
    CLIENT_ERROR_IGNORED_ALL_SUBSCRIPTIONS(0x0414, "client-error-ignored-all-subscriptions"),
    SERVER_ERROR_INTERNAL_ERROR(0x0500, "server-error-internal-error"),
    SERVER_ERROR_OPERATION_NOT_SUPPORTED(0x0501, "server-error-operation-not-supported");

    private final int code;
    private final String keyword;

    IppStatus(int code, String keyword) {
        this.code = code;
        this.keyword = keyword;
    }

    public int getCode() {
        return code;
    }

    @JsonValue
    public String getKeyword() {
        return keyword;
    }

    @JsonCreator
    public static IppStatus fromKeyword(String keyword) {
        for (IppStatus s : values()) {
            if (s.keyword.equals(keyword)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown status code " + keyword);
    }

    @Override
    public String toString() {
        return keyword;
    }
}
