package ippnotify.api.response;

/**
 * Body of a transport-level error, sent when no IPP request could be read.
 */
public class IppErrorResponse {

    private int code;
    private String message;
    private String details;

    public IppErrorResponse() {}

    public IppErrorResponse(IppException e) {
        this.code = e.getHttpCode();
        this.message = e.getMessage();
        this.details = e.getDetails();
    }

    public int getCode() {
        return code;
    }

    public void setCode(int code) {
        this.code = code;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }
}
