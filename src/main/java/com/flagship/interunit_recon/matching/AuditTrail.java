package com.flagship.interunit_recon.matching;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Evidence behind a match, in insertion order.
 *
 * Values are restricted to strings, numbers and booleans so the trail can be stored
 * as JSON without custom serializers. Null values are skipped.
 */
public final class AuditTrail {

    private final Map<String, Object> entries;

    private AuditTrail(Map<String, Object> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Map<String, Object> asMap() {
        return entries;
    }

    public Object get(String key) {
        return entries.get(key);
    }

    public boolean containsKey(String key) {
        return entries.containsKey(key);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof AuditTrail trail && entries.equals(trail.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return entries.toString();
    }

    public static final class Builder {
        private final Map<String, Object> entries = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * @throws IllegalArgumentException if the value is not a string, number or boolean
         */
        public Builder put(String key, Object value) {
            if (value == null) {
                return this;
            }
            if (value instanceof BigDecimal decimal) {
                entries.put(key, decimal.toPlainString());
                return this;
            }
            if (!(value instanceof String || value instanceof Number || value instanceof Boolean)) {
                throw new IllegalArgumentException(
                    String.format("Audit value for %s must be a string, number or boolean: %s",
                        key, value.getClass().getSimpleName()));
            }
            entries.put(key, value);
            return this;
        }

        public AuditTrail build() {
            return new AuditTrail(new LinkedHashMap<>(entries));
        }
    }
}
