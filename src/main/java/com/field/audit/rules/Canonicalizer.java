package com.field.audit.rules;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Rewrites JSON-like trees (maps, lists, scalars) into a deterministic form so that
 * equivalent data always serializes to the same bytes.
 *
 * <p>Maps are re-keyed in ascending key order, every value is canonicalized recursively,
 * and entries whose value ends up null, empty string, or an empty collection are dropped.
 * Lists keep their order but lose empty elements. Scalars pass through unchanged.</p>
 *
 * <p>Canonicalization is idempotent: {@code canonicalize(canonicalize(x)).equals(canonicalize(x))}.</p>
 */
public class Canonicalizer {
    private static final Logger log = LoggerFactory.getLogger(Canonicalizer.class);

    private final ObjectMapper objectMapper;

    public Canonicalizer() {
        this(defaultObjectMapper());
    }

    public Canonicalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Mapper used for comparison encoding. Trailing content after a JSON document is rejected
     * so that {@code {"a":1} {"b":2}} is not mistaken for a single object.
     */
    public static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Returns the canonical form of the given value.
     */
    public Object canonicalize(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> sorted = new TreeMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                Object canonical = canonicalize(entry.getValue());
                if (!isEmpty(canonical)) {
                    sorted.put(String.valueOf(entry.getKey()), canonical);
                }
            }
            return sorted;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> items = new ArrayList<>(collection.size());
            for (Object item : collection) {
                Object canonical = canonicalize(item);
                if (!isEmpty(canonical)) {
                    items.add(canonical);
                }
            }
            return items;
        }
        return value;
    }

    /**
     * Canonicalizes the value and encodes it as compact JSON.
     * Values Jackson cannot serialize fall back to their string form.
     */
    public String toJson(Object value) {
        Object canonical = canonicalize(value);
        try {
            return objectMapper.writeValueAsString(canonical);
        } catch (JsonProcessingException e) {
            log.warn("canonical.encode.failed type={} error={}",
                    canonical != null ? canonical.getClass().getName() : "null", e.getOriginalMessage());
            return String.valueOf(canonical);
        }
    }

    /**
     * Parses a JSON document into plain maps, lists and scalars.
     * Returns empty when the text is not valid JSON.
     */
    public Optional<Object> parseJson(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(text, Object.class));
        } catch (JsonProcessingException e) {
            log.debug("canonical.parse.skipped error={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (value instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        return false;
    }
}
