package com.example.bookingcom.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One entity returned by an endpoint, e.g. a country or a hotel.
 *
 * <p>Fields keep the order in which the provider sent them. A value is either
 * a {@link String}, a nested {@link Map} for elements with children, or a
 * {@link List} when the same child element repeats. The field set depends on
 * the endpoint; no schema is enforced.
 *
 * <p>Example:
 * <pre>{@code
 * for (ApiRecord country : client.getCountries()) {
 *     String code = country.getString("countrycode");
 *     String name = country.getString("name");
 * }
 * }</pre>
 */
public final class ApiRecord {

    private static final ApiRecord EMPTY = new ApiRecord(Map.of());

    private final Map<String, Object> fields;

    /**
     * Creates a record from the given fields, preserving their iteration order.
     *
     * @param fields field name to value mapping
     */
    public ApiRecord(Map<String, ?> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    }

    /**
     * Returns a record without fields.
     */
    public static ApiRecord empty() {
        return EMPTY;
    }

    /**
     * Returns the raw value of a field, or {@code null} if absent.
     */
    public Object get(String field) {
        return fields.get(field);
    }

    /**
     * Returns the value of a field as text.
     *
     * @param field the field name
     * @return the text value, or {@code null} if the field is absent
     * @throws IllegalStateException if the field holds nested data
     */
    public String getString(String field) {
        Object value = fields.get(field);
        if (value == null || value instanceof String) {
            return (String) value;
        }
        throw new IllegalStateException("Field '" + field + "' is not a text value: " + value.getClass().getSimpleName());
    }

    /**
     * Returns a nested field as a record.
     *
     * @param field the field name
     * @return the nested record, or {@code null} if the field is absent
     * @throws IllegalStateException if the field does not hold a nested mapping
     */
    @SuppressWarnings("unchecked")
    public ApiRecord getRecord(String field) {
        Object value = fields.get(field);
        if (value == null) {
            return null;
        }
        if (value instanceof Map) {
            return new ApiRecord((Map<String, ?>) value);
        }
        throw new IllegalStateException("Field '" + field + "' is not a nested value: " + value.getClass().getSimpleName());
    }

    public boolean containsField(String field) {
        return fields.containsKey(field);
    }

    /**
     * Returns an unmodifiable view of all fields in provider order.
     */
    public Map<String, Object> fields() {
        return fields;
    }

    public int size() {
        return fields.size();
    }

    public boolean isEmpty() {
        return fields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof ApiRecord other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return "ApiRecord" + fields;
    }
}
