package com.koni.eventcache.application.decoder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.eventcache.domain.exception.EventDecodingException;
import com.koni.eventcache.domain.model.Event;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Map;

/**
 * Decodes raw broker message bodies into Events.
 *
 * The body must be a JSON object with a string {@code deviceId}, an integral
 * {@code creationTime} in seconds and an optional {@code data} object. Unknown
 * top-level fields are ignored. Decoding has no side effects; every failure is
 * reported as an {@link EventDecodingException}.
 */
@Component
@RequiredArgsConstructor
public class EventDecoder {

    private static final TypeReference<Map<String, Object>> DATA_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Decodes a message body.
     *
     * @param body the raw message body
     * @return the decoded event
     * @throws EventDecodingException if the body is empty, not JSON, or violates the envelope
     */
    public Event decode(byte[] body) {
        if (body == null || body.length == 0) {
            throw new EventDecodingException("message body is empty");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new EventDecodingException("message body is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new EventDecodingException("message body is not a JSON object");
        }

        JsonNode deviceId = root.get("deviceId");
        if (deviceId == null || !deviceId.isTextual()) {
            throw new EventDecodingException("deviceId is required and must be a string");
        }

        JsonNode creationTime = root.get("creationTime");
        if (creationTime == null || !creationTime.isIntegralNumber() || !creationTime.canConvertToLong()) {
            throw new EventDecodingException("creationTime is required and must be an integer");
        }

        JsonNode data = root.get("data");
        Map<String, Object> payload = null;
        if (data != null && !data.isNull()) {
            if (!data.isObject()) {
                throw new EventDecodingException("data must be a JSON object");
            }
            payload = objectMapper.convertValue(data, DATA_TYPE);
        }

        return new Event(deviceId.textValue(), creationTime.longValue(), payload);
    }
}
