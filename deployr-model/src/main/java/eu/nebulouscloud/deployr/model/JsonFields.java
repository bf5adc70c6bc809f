package eu.nebulouscloud.deployr.model;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Accessors for mandatory JSON fields.  Each method throws {@link
 * RequestParseException} naming the field and its context when the field is
 * absent or has the wrong type.
 */
final class JsonFields {

    private JsonFields() { }

    static JsonNode getObject(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || !value.isObject()) {
            throw new RequestParseException(context + ": missing or non-object field '" + field + "'");
        }
        return value;
    }

    static String getString(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual()) {
            throw new RequestParseException(context + ": missing or non-string field '" + field + "'");
        }
        return value.textValue();
    }

    static long getLong(JsonNode node, String field, String context) {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new RequestParseException(context + ": missing or non-numeric field '" + field + "'");
        }
        long result = value.longValue();
        if (result < 0) {
            throw new RequestParseException(context + ": field '" + field + "' must not be negative, got " + result);
        }
        return result;
    }

    /**
     * Return the elements of an array field.
     *
     * @param optional if true, an absent field yields an empty list.
     */
    static List<JsonNode> getArray(JsonNode node, String field, String context, boolean optional) {
        JsonNode value = node.get(field);
        if (value == null && optional) return List.of();
        if (value == null || !value.isArray()) {
            throw new RequestParseException(context + ": missing or non-array field '" + field + "'");
        }
        return StreamSupport.stream(value.spliterator(), false).collect(Collectors.toList());
    }

    static List<String> getStringArray(JsonNode node, String field, String context) {
        return getArray(node, field, context, false).stream()
            .map(element -> {
                if (!element.isTextual()) {
                    throw new RequestParseException(context + ": non-string element in '" + field + "'");
                }
                return element.textValue();
            })
            .collect(Collectors.toList());
    }
}
