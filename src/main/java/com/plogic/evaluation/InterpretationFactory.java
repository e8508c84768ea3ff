package com.plogic.evaluation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.plogic.exception.InvalidPredicateNameException;
import com.plogic.exception.TypeMismatchException;
import com.plogic.proposition.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Factory for creating an Interpretation from a JSON object of predicate names to booleans.
 * Values are not coerced: {@code "true"} or {@code 1} is rejected.
 */
public final class InterpretationFactory {

    private static final Logger log = LoggerFactory.getLogger(InterpretationFactory.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private InterpretationFactory() {
    }

    /**
     * Create an Interpretation from JSON.
     *
     * @param json JSON object, e.g. {@code {"P": true, "Q": false}}
     * @return Interpretation over a snapshot of the parsed values
     */
    public static Interpretation fromJson(String json) {
        return Interpretation.of(readAssignment(json));
    }

    /**
     * Read a JSON assignment into an ordered map.
     *
     * @param json JSON object of predicate names to booleans
     * @return Predicate name to truth value, in document order
     */
    public static Map<String, Boolean> readAssignment(String json) {
        Map<String, Object> parsed = parseJson(json);
        Map<String, Boolean> assignment = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : parsed.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();

            if (!Predicate.isValidName(name)) {
                throw new InvalidPredicateNameException(name);
            }
            if (!(value instanceof Boolean truthValue)) {
                throw new TypeMismatchException("Predicate '" + name + "' must be assigned a boolean, got "
                        + (value == null ? "null" : value.getClass().getSimpleName()));
            }
            assignment.put(name, truthValue);
        }

        log.debug("Read assignment of {} predicates", assignment.size());
        return assignment;
    }

    private static Map<String, Object> parseJson(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Invalid JSON assignment: input is empty");
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {});
            if (parsed == null) {
                throw new IllegalArgumentException("Invalid JSON assignment: expected an object, got null");
            }
            return parsed;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid JSON assignment: " + e.getOriginalMessage(), e);
        }
    }
}
