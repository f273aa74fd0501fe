package uk.gegc.courseblocks.features.olx.application;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.stereotype.Component;
import uk.gegc.courseblocks.features.olx.domain.model.FieldType;
import uk.gegc.courseblocks.features.olx.domain.model.OpaqueKey;
import uk.gegc.courseblocks.shared.exception.FieldSerializationException;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Converts field values to and from the string form used in XML attributes.
 */
@Component
public class FieldCodec {

    private final ObjectMapper objectMapper;

    public FieldCodec(ObjectMapper objectMapper) {
        SimpleModule keys = new SimpleModule("opaque-keys");
        keys.addSerializer(OpaqueKey.class, ToStringSerializer.instance);
        this.objectMapper = objectMapper.copy()
                .registerModule(new JavaTimeModule())
                .registerModule(keys)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Strings pass through, timestamps become ISO-8601 and everything else is JSON-encoded.
     *
     * @throws FieldSerializationException if the value cannot be JSON-encoded
     */
    public String serialize(Object value) {
        if (value instanceof String text) {
            return text;
        }
        if (value instanceof ZonedDateTime zoned) {
            return formatTimestamp(zoned.toOffsetDateTime());
        }
        if (value instanceof OffsetDateTime offset) {
            return formatTimestamp(offset);
        }
        if (value instanceof LocalDateTime local) {
            return local.format(DateTimeFormatter.ISO_LOCAL_DATE_TIME);
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new FieldSerializationException("Failed to serialize value of type "
                    + value.getClass().getName(), ex);
        }
    }

    /**
     * Decodes an attribute value for a field of the given type.
     * <p>
     * Values that are not valid JSON, and JSON values the type rejects, are returned unchanged as the raw
     * string. Older exports wrote plain strings, so {@code "3.4"} stays a string for a string field.
     */
    public Object deserialize(FieldType type, String raw) {
        if (raw == null) {
            return null;
        }
        Object decoded;
        try {
            decoded = objectMapper.readValue(raw, Object.class);
        } catch (JsonProcessingException ex) {
            return raw;
        }
        if (decoded == null) {
            return null;
        }
        return type.accepts(decoded) ? decoded : raw;
    }

    /**
     * Parses a JSON document into plain maps, lists and scalars.
     */
    public Object readJson(String json) throws JsonProcessingException {
        return objectMapper.readValue(json, Object.class);
    }

    private static String formatTimestamp(OffsetDateTime value) {
        if (ZoneOffset.UTC.equals(value.getOffset())) {
            return value.toLocalDateTime().format(DateTimeFormatter.ISO_LOCAL_DATE_TIME) + "Z";
        }
        return value.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }
}
