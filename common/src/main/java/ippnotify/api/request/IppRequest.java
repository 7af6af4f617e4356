package ippnotify.api.request;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.google.common.collect.HashMultimap;
import com.google.common.collect.Multimap;

import ippnotify.api.model.AttributeGroup;
import ippnotify.api.model.GroupTag;
import ippnotify.api.model.IppAttribute;
import ippnotify.api.model.ValueTag;
import ippnotify.auth.util.HttpHeaderUtils;

/**
 * Base class of every IPP operation request. The concrete class is chosen by the {@code operation} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "operation", visible = true)
public abstract class IppRequest implements Request {

    public static final String ANONYMOUS = "anonymous";

    private String operation;

    @JsonProperty("request-id")
    private int requestId;

    private List<AttributeGroup> groups = new ArrayList<>();

    @JsonIgnore
    private String printerName = null;

    @JsonIgnore
    private String authenticatedUser = null;

    @JsonIgnore
    private Multimap<String,String> requestHeaders = HashMultimap.create();

    public String getOperation() {
        return operation;
    }

    public void setOperation(String operation) {
        this.operation = operation;
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

    public void setGroups(List<AttributeGroup> groups) {
        this.groups = (groups == null) ? new ArrayList<>() : groups;
    }

    public IppRequest addGroup(AttributeGroup group) {
        groups.add(group);
        return this;
    }

    /**
     * @return the name of the printer the request was posted to, or null when it targets the system
     */
    @JsonIgnore
    public String getPrinterName() {
        return printerName;
    }

    public void setPrinterName(String printerName) {
        this.printerName = printerName;
    }

    @JsonIgnore
    public String getAuthenticatedUser() {
        return authenticatedUser;
    }

    public void setAuthenticatedUser(String authenticatedUser) {
        this.authenticatedUser = authenticatedUser;
    }

    public void addHeaders(Multimap<String,String> headers) {
        requestHeaders.putAll(headers);
    }

    @JsonIgnore
    public Multimap<String,String> getRequestHeaders() {
        return requestHeaders;
    }

    @JsonIgnore
    public String getRequestHeader(String name) {
        return HttpHeaderUtils.getSingleHeader(requestHeaders, name, false);
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

    /**
     * Finds the first attribute with the given name in any group.
     */
    public IppAttribute findAttribute(String name) {
        for (AttributeGroup g : groups) {
            IppAttribute a = g.find(name);
            if (a != null) {
                return a;
            }
        }
        return null;
    }

    /**
     * Finds an attribute that must be a single integer in the operation group.
     *
     * @return the value, or null when the attribute is absent
     * @throws IllegalArgumentException
     *             if the attribute is present in another group, has another type, has several values or is below min
     */
    protected Integer getOperationInteger(String name, int min) {
        IppAttribute a = findAttribute(name);
        if (a == null) {
            return null;
        }
        if (a.getGroupTag() != GroupTag.OPERATION || a.getValueTag() != ValueTag.INTEGER || a.getCount() != 1) {
            throw new IllegalArgumentException("Bad " + name + " attribute in request.");
        }
        Integer value = a.getInteger(0);
        if (value == null || value < min) {
            throw new IllegalArgumentException("Bad " + name + " value " + a.getString(0) + ".");
        }
        return value;
    }

    /**
     * Finds an attribute that must hold one or more integers in the operation group.
     *
     * @return the values, or null when the attribute is absent
     * @throws IllegalArgumentException
     *             if the attribute is present in another group, has another type, has no values or any value is out of range
     */
    protected List<Integer> getOperationIntegers(String name, int min) {
        IppAttribute a = findAttribute(name);
        if (a == null) {
            return null;
        }
        if (a.getGroupTag() != GroupTag.OPERATION || a.getValueTag() != ValueTag.INTEGER || a.getCount() == 0) {
            throw new IllegalArgumentException("Bad " + name + " attribute in request.");
        }
        List<Integer> values = new ArrayList<>();
        for (int i = 0; i < a.getCount(); i++) {
            Integer value = a.getInteger(i);
            if (value == null || value < min) {
                throw new IllegalArgumentException("Bad " + name + " value " + a.getString(i) + ".");
            }
            values.add(value);
        }
        return values;
    }

    /**
     * Finds an attribute that must be a single boolean in the operation group.
     *
     * @return the value, false when the attribute is absent
     */
    protected boolean getOperationBoolean(String name) {
        IppAttribute a = findAttribute(name);
        if (a == null) {
            return false;
        }
        if (a.getGroupTag() != GroupTag.OPERATION || a.getValueTag() != ValueTag.BOOLEAN || a.getCount() != 1 || a.getBoolean(0) == null) {
            throw new IllegalArgumentException("Bad " + name + " attribute in request.");
        }
        return a.getBoolean(0);
    }

    /**
     * The user the server acts for: the authenticated user, else requesting-user-name, else anonymous.
     */
    @JsonIgnore
    public String getUsername() {
        if (authenticatedUser != null) {
            return authenticatedUser;
        }
        IppAttribute a = findAttribute("requesting-user-name");
        if (a != null && a.getGroupTag() == GroupTag.OPERATION && a.getCount() > 0 && a.getString(0) != null) {
            return a.getString(0);
        }
        return ANONYMOUS;
    }

    /**
     * @return the requested-attributes values, or an empty set when the client did not restrict the response
     */
    @JsonIgnore
    public Set<String> getRequestedAttributes() {
        IppAttribute a = findAttribute("requested-attributes");
        if (a == null) {
            return new LinkedHashSet<>();
        }
        return new LinkedHashSet<>(a.getStrings());
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append("{");
        buf.append("Operation: ").append(operation);
        buf.append(", Request ID: ").append(requestId);
        buf.append(", Printer: ").append(printerName);
        buf.append(", Groups: ").append(groups);
        buf.append("}");
        return buf.toString();
    }
}
