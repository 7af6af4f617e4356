package ippnotify.api.model;

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An ordered list of attributes under one group tag.
 */
public class AttributeGroup {

    private final GroupTag tag;
    private final List<IppAttribute> attributes = new ArrayList<>();

    @JsonCreator
    public AttributeGroup(@JsonProperty("tag") GroupTag tag, @JsonProperty("attributes") List<IppAttribute> attributes) {
        this.tag = tag;
        if (attributes != null) {
            attributes.forEach(this::add);
        }
    }

    public AttributeGroup(GroupTag tag) {
        this(tag, null);
    }

    public GroupTag getTag() {
        return tag;
    }

    public List<IppAttribute> getAttributes() {
        return attributes;
    }

    public AttributeGroup add(IppAttribute attribute) {
        attribute.setGroupTag(tag);
        attributes.add(attribute);
        return this;
    }

    public IppAttribute find(String name) {
        for (IppAttribute a : attributes) {
            if (a.getName().equals(name)) {
                return a;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return tag + attributes.toString();
    }
}
