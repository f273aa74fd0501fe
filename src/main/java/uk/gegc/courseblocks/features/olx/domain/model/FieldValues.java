package uk.gegc.courseblocks.features.olx.domain.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Copy helpers for JSON-like field values (maps, lists and immutable scalars).
 */
public final class FieldValues {

    private FieldValues() {
    }

    /**
     * Returns a deep copy of {@code value}; maps keep their iteration order.
     */
    @SuppressWarnings("unchecked")
    public static <T> T copyOf(T value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k, copyOf(v)));
            return (T) copy;
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyOf(item)));
            return (T) copy;
        }
        return value;
    }
}
