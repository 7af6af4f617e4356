package ippnotify.api.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * An IPP response message. The first group is always the operation group carrying charset and language.
 */
@JsonPropertyOrder({"status-code", "request-id", "groups"})
public class IppResponse {

    public static final String CHARSET = "utf-8";
    public static final String LANGUAGE = "en";

    @JsonProperty("status-code")
    private IppStatus statusCode = IppStatus.SUCCESSFUL_OK;

    @JsonProperty("request-id")
    private int requestId;

    private final List<AttributeGroup> groups = new ArrayList<>();

    public IppResponse() {
        AttributeGroup operation = new AttributeGroup(GroupTag.OPERATION);
        operation.add(IppAttribute.charset("attributes-charset", CHARSET));
        operation.add(IppAttribute.naturalLanguage("attributes-natural-language", LANGUAGE));
        groups.add(operation);
    }

    public IppResponse(int requestId) {
        this();
        this.requestId = requestId;
    }

    public IppStatus getStatusCode() {
        return statusCode;
    }

    public void setStatusCode(IppStatus statusCode) {
        this.statusCode = statusCode;
    }

    public int getRequestId() {
        return requestId;
    }

    public void setRequestId(int requestId) {
        this.requestId = requestId;
    }

    public List<AttributeGroup> getGroups() {
        return groups;
    }

    @JsonIgnore
    public AttributeGroup getOperationGroup() {
        return groups.get(0);
    }

    /**
     * Sets the status code and, when message is not null, the status-message operation attribute.
     */
    public void setStatus(IppStatus status, String message) {
        this.statusCode = status;
        if (message != null) {
            AttributeGroup operation = getOperationGroup();
            operation.getAttributes().removeIf(a -> a.getName().equals("status-message"));
            operation.add(IppAttribute.text("status-message", message));
        }
    }

    public AttributeGroup addGroup(GroupTag tag) {
        AttributeGroup group = new AttributeGroup(tag);
        groups.add(group);
        return group;
    }

    @JsonIgnore
    public List<AttributeGroup> getGroups(GroupTag tag) {
        List<AttributeGroup> result = new ArrayList<>();
        for (AttributeGroup g : groups) {
            if (g.getTag() == tag) {
                result.add(g);
            }
        }
        return result;
    }
}
