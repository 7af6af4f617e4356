package ippnotify.api.model;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A named, typed, possibly multi-valued IPP attribute. Values are held as the JSON scalar types: {@link Integer} for integer and enum,
 * {@link Boolean} for boolean, {@link String} for everything else. octetString values are base64 encoded strings.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class IppAttribute {

    private String name;

    @JsonProperty("value-tag")
    private ValueTag valueTag;

    private List<Object> values = new ArrayList<>();

    @JsonIgnore
    private GroupTag groupTag;

    public IppAttribute() {}

    public IppAttribute(String name, ValueTag valueTag, Collection<?> values) {
        this.name = name;
        this.valueTag = valueTag;
        this.values = new ArrayList<>(values);
    }

    public static IppAttribute integer(String name, int... values) {
        List<Object> v = new ArrayList<>();
        for (int i : values) {
            v.add(i);
        }
        return new IppAttribute(name, ValueTag.INTEGER, v);
    }

    public static IppAttribute enumValue(String name, int value) {
        return new IppAttribute(name, ValueTag.ENUM, Collections.singletonList(value));
    }

    public static IppAttribute bool(String name, boolean value) {
        return new IppAttribute(name, ValueTag.BOOLEAN, Collections.singletonList(value));
    }

    public static IppAttribute keyword(String name, String... values) {
        return new IppAttribute(name, ValueTag.KEYWORD, Arrays.asList(values));
    }

    public static IppAttribute keywords(String name, Collection<String> values) {
        return new IppAttribute(name, ValueTag.KEYWORD, values);
    }

    public static IppAttribute name(String name, String value) {
        return new IppAttribute(name, ValueTag.NAME, Collections.singletonList(value));
    }

    public static IppAttribute text(String name, String value) {
        return new IppAttribute(name, ValueTag.TEXT, Collections.singletonList(value));
    }

    public static IppAttribute uri(String name, String value) {
        return new IppAttribute(name, ValueTag.URI, Collections.singletonList(value));
    }

    public static IppAttribute charset(String name, String value) {
        return new IppAttribute(name, ValueTag.CHARSET, Collections.singletonList(value));
    }

    public static IppAttribute naturalLanguage(String name, String value) {
        return new IppAttribute(name, ValueTag.NATURAL_LANGUAGE, Collections.singletonList(value));
    }

    public static IppAttribute octetString(String name, byte[] value) {
        return new IppAttribute(name, ValueTag.OCTET_STRING, Collections.singletonList(Base64.getEncoder().encodeToString(value)));
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ValueTag getValueTag() {
        return valueTag;
    }

    public void setValueTag(ValueTag valueTag) {
        this.valueTag = valueTag;
    }

    public List<Object> getValues() {
        return values;
    }

    public void setValues(List<Object> values) {
        this.values = (values == null) ? new ArrayList<>() : values;
    }

    public GroupTag getGroupTag() {
        return groupTag;
    }

    public void setGroupTag(GroupTag groupTag) {
        this.groupTag = groupTag;
    }

    @JsonIgnore
    public int getCount() {
        return values.size();
    }

    /**
     * @return the value at index as a string, or null when absent
     */
    public String getString(int index) {
        if (index >= values.size() || values.get(index) == null) {
            return null;
        }
        return values.get(index).toString();
    }

    /**
     * @return the value at index as an int, or null when absent, fractional or outside the int range
     */
    public Integer getInteger(int index) {
        if (index >= values.size()) {
            return null;
        }
        Object v = values.get(index);
        if (v instanceof Integer) {
            return (Integer) v;
        }
        if (v instanceof Long || v instanceof BigInteger) {
            BigInteger big = (v instanceof Long) ? BigInteger.valueOf((Long) v) : (BigInteger) v;
            if (big.bitLength() < Integer.SIZE) {
                return big.intValue();
            }
        }
        return null;
    }

    public Boolean getBoolean(int index) {
        if (index >= values.size()) {
            return null;
        }
        Object v = values.get(index);
        if (v instanceof Boolean) {
            return (Boolean) v;
        }
        return null;
    }

    /**
     * Decodes an octetString value.
     *
     * @throws IllegalArgumentException
     *             if the value is not valid base64
     */
    public byte[] getOctetString(int index) {
        if (index >= values.size()) {
            return null;
        }
        Object v = values.get(index);
        if (v instanceof byte[]) {
            return (byte[]) v;
        }
        if (v == null) {
            return null;
        }
        return Base64.getDecoder().decode(v.toString().getBytes(StandardCharsets.US_ASCII));
    }

    @JsonIgnore
    public List<String> getStrings() {
        List<String> result = new ArrayList<>(values.size());
        for (Object v : values) {
            result.add(String.valueOf(v));
        }
        return result;
    }

    public IppAttribute copy() {
        IppAttribute copy = new IppAttribute(name, valueTag, values);
        copy.setGroupTag(groupTag);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof IppAttribute)) {
            return false;
        }
        IppAttribute that = (IppAttribute) o;
        return Objects.equals(name, that.name) && valueTag == that.valueTag && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, valueTag, values);
    }

    @Override
    public String toString() {
        return name + "(" + valueTag + ")=" + values;
    }
}
