package com.coursemapper.context;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.springframework.stereotype.Component;

import java.util.Map;

/** Writes the context column: one object per frame, then the requirement detail. */
@Component
public class ContextSerializer {
    private final ObjectMapper objectMapper;

    public ContextSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String serialize(ContextStack stack, Map<String, Object> requirementDetail) {
        ArrayNode out = objectMapper.createArrayNode();
        stack.frames().forEach(frame -> out.add(objectMapper.valueToTree(frame.describe())));
        out.add(objectMapper.valueToTree(Map.of("requirement", requirementDetail)));
        return write(out);
    }

    public String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize " + value.getClass().getSimpleName(), e);
        }
    }
}
