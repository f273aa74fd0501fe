package uk.gegc.courseblocks.features.olx.domain.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;

/**
 * Value type of a block field.
 * <p>
 * {@link #fromJson(Object)} converts a JSON-compatible value (as decoded from an attribute, embedded metadata
 * or a policy file) into the stored representation and throws {@link IllegalArgumentException} when the
 * value does not fit the type. {@code null} is accepted by every type.
 */
public enum FieldType {

    STRING {
        @Override
        public Object fromJson(Object value) {
            if (value == null || value instanceof String) {
                return value;
            }
            throw mismatch(value);
        }
    },

    INTEGER {
        @Override
        public Object fromJson(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof Integer || value instanceof Long) {
                return value;
            }
            if (value instanceof BigInteger big) {
                return big.longValueExact();
            }
            if (value instanceof Number number) {
                double d = number.doubleValue();
                if (d == Math.rint(d) && !Double.isInfinite(d)) {
                    return number.longValue();
                }
                throw mismatch(value);
            }
            if (value instanceof String text) {
                try {
                    return Long.parseLong(text.trim());
                } catch (NumberFormatException ex) {
                    throw mismatch(value);
                }
            }
            throw mismatch(value);
        }
    },

    FLOAT {
        @Override
        public Object fromJson(Object value) {
            if (value == null) {
                return null;
            }
            if (value instanceof BigDecimal decimal) {
                return decimal.doubleValue();
            }
            if (value instanceof Number number) {
                return number.doubleValue();
            }
            if (value instanceof String text) {
                try {
                    return Double.parseDouble(text.trim());
                } catch (NumberFormatException ex) {
                    throw mismatch(value);
                }
            }
            throw mismatch(value);
        }
    },

    BOOLEAN {
        @Override
        public Object fromJson(Object value) {
            if (value == null || value instanceof Boolean) {
                return value;
            }
            if (value instanceof String text) {
                return "true".equalsIgnoreCase(text);
            }
            if (value instanceof Number number) {
                return number.doubleValue() != 0;
            }
            throw mismatch(value);
        }
    },

    LIST {
        @Override
        public Object fromJson(Object value) {
            if (value == null || value instanceof List<?>) {
                return FieldValues.copyOf(value);
            }
            throw mismatch(value);
        }
    },

    DICT {
        @Override
        public Object fromJson(Object value) {
            if (value == null || value instanceof Map<?, ?>) {
                return FieldValues.copyOf(value);
            }
            throw mismatch(value);
        }
    },

    DATETIME {
        @Override
        public Object fromJson(Object value) {
            if (value == null
                    || value instanceof OffsetDateTime
                    || value instanceof LocalDateTime) {
                return value;
            }
            if (value instanceof ZonedDateTime zoned) {
                return zoned.toOffsetDateTime();
            }
            if (value instanceof String text) {
                String trimmed = text.trim();
                try {
                    return OffsetDateTime.parse(trimmed);
                } catch (DateTimeParseException ignored) {
                    // naive timestamps carry no offset
                }
                try {
                    return LocalDateTime.parse(trimmed);
                } catch (DateTimeParseException ex) {
                    throw mismatch(value);
                }
            }
            throw mismatch(value);
        }
    };

    /**
     * Converts a JSON-compatible value into the stored representation.
     *
     * @throws IllegalArgumentException if the value cannot be represented by this type
     */
    public abstract Object fromJson(Object value);

    /**
     * Converts a stored value back into its JSON-compatible form. Timestamps are returned as-is so that
     * the codec can apply its own ISO-8601 rules.
     */
    public Object toJson(Object value) {
        return FieldValues.copyOf(value);
    }

    /**
     * Whether {@code value} can be converted by {@link #fromJson(Object)}.
     */
    public boolean accepts(Object value) {
        try {
            fromJson(value);
            return true;
        } catch (IllegalArgumentException | ArithmeticException ex) {
            return false;
        }
    }

    IllegalArgumentException mismatch(Object value) {
        return new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " is not valid for a " + name() + " field");
    }
}
