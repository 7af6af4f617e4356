package ippnotify.api.response;

import ippnotify.api.model.IppStatus;

/**
 * A failure that aborts an IPP operation. The status travels back to the client inside an IPP response; the HTTP code is only used
 * when the failure happens before an IPP request could be read.
 */
public class IppException extends Exception {

    private static final long serialVersionUID = 1L;
    private final IppStatus status;
    private int httpCode = 200;
    private String details = null;
    private int requestId = 0;

    public IppException(IppStatus status, String message) {
        this(status, message, null, null);
    }

    public IppException(IppStatus status, String message, String details) {
        this(status, message, details, null);
    }

    public IppException(IppStatus status, String message, String details, Throwable error) {
        super(message, error);
        this.status = status;
        this.details = details;
    }

    public static IppException transport(int httpCode, String message) {
        IppException e = new IppException(IppStatus.CLIENT_ERROR_BAD_REQUEST, message);
        e.httpCode = httpCode;
        return e;
    }

    public IppStatus getStatus() {
        return status;
    }

    public int getHttpCode() {
        return httpCode;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    public int getRequestId() {
        return requestId;
    }

    public IppException setRequestId(int requestId) {
        this.requestId = requestId;
        return this;
    }
}
