package io.liquidenergy.infrastructure.hummingbot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decoded response frame: {@code {id, status, message?, data?}}.
 *
 * A non-success status is a normal value here; callers decide whether it
 * becomes an exception.
 */
public record EngineResponse(
    String id,
    String status,
    String message,          // null when the engine sent none
    Object data,             // object, array or null
    Map<String, Object> raw
) {
    public static final String STATUS_SUCCESS = "success";

    public static EngineResponse from(Map<String, Object> message) {
        Object id = message.get("id");
        Object status = message.get("status");
        Object text = message.get("message");
        return new EngineResponse(
            id != null ? String.valueOf(id) : null,
            status != null ? String.valueOf(status) : null,
            text != null ? String.valueOf(text) : null,
            message.get("data"),
            Collections.unmodifiableMap(message)
        );
    }

    public boolean isSuccess() {
        return STATUS_SUCCESS.equals(status);
    }

    public String messageOr(String fallback) {
        return message != null ? message : fallback;
    }

    /**
     * The {@code data} object, or an empty map when absent or not an object.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> dataAsMap() {
        if (data instanceof Map) {
            return (Map<String, Object>) data;
        }
        return Collections.emptyMap();
    }

    /**
     * The object elements of the {@code data} array, or an empty list.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> dataAsList() {
        if (!(data instanceof List)) {
            return Collections.emptyList();
        }
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object item : (List<Object>) data) {
            if (item instanceof Map) {
                out.add((Map<String, Object>) item);
            }
        }
        return out;
    }
}
