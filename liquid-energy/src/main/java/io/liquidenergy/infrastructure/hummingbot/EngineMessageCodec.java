package io.liquidenergy.infrastructure.hummingbot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * JSON text codec for gateway frames.
 */
public final class EngineMessageCodec {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    public String encode(Map<String, Object> message) {
        try {
            return MAPPER.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Failed to serialize frame: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Decode one text frame. Anything other than a JSON object is rejected.
     */
    public Map<String, Object> decode(String frame) {
        if (frame == null || frame.isBlank()) {
            throw new ProtocolException("Empty frame");
        }
        Map<String, Object> message;
        try {
            message = MAPPER.readValue(frame, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ProtocolException("Invalid JSON frame: " + e.getOriginalMessage(), e);
        }
        if (message == null) {
            throw new ProtocolException("Frame is JSON null");
        }
        return message;
    }
}
