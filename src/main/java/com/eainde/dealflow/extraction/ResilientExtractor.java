package com.eainde.dealflow.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Turns a raw reasoning response into a typed record.
 * <p>
 * The strategies of {@link ParseStrategies#defaultChain} are tried in order. An
 * object that lacks the shape's marker field or cannot be bound to the target
 * record does not end the search. When nothing binds, the shape's fallback
 * value is returned together with a note saying manual review is required.
 * This method never throws.
 * </p>
 * Numeric domains (scores, percentages) are enforced by the record constructors,
 * so clamping applies to parsed and fallback values alike.
 */
@Slf4j
@Component
public class ResilientExtractor {

    private final ObjectMapper objectMapper;
    private final List<ParseStrategy> strategies;

    @Autowired
    public ResilientExtractor(ObjectMapper objectMapper) {
        this(objectMapper, ParseStrategies.defaultChain(objectMapper));
    }

    public ResilientExtractor(ObjectMapper objectMapper, List<ParseStrategy> strategies) {
        this.objectMapper = objectMapper;
        this.strategies = List.copyOf(strategies);
    }

    public <T> Extraction<T> extract(String raw, ExtractionShape<T> shape) {
        if (raw == null || raw.isBlank()) {
            return fallback(shape, "Empty " + shape.name() + " response; manual review required");
        }
        for (ParseStrategy strategy : strategies) {
            Optional<JsonNode> node;
            try {
                node = strategy.parse(raw, shape.marker());
            } catch (RuntimeException e) {
                log.debug("Strategy {} failed on {} output: {}", strategy.name(), shape.name(), e.getMessage());
                continue;
            }
            if (node.isEmpty() || !node.get().isObject() || !node.get().has(shape.marker())) {
                continue;
            }
            try {
                T value = objectMapper.treeToValue(node.get(), shape.type());
                if (value != null) {
                    log.debug("Parsed {} output with strategy {}", shape.name(), strategy.name());
                    return Extraction.parsed(value, strategy.name());
                }
            } catch (Exception e) {
                log.debug("Strategy {} found JSON that does not bind to {}: {}",
                        strategy.name(), shape.type().getSimpleName(), e.getMessage());
            }
        }
        log.warn("Could not parse {} output ({} chars), using default", shape.name(), raw.length());
        return fallback(shape, "Could not parse " + shape.name() + " output; manual review required");
    }

    /** Fallback for stages whose reasoning call itself failed. */
    public <T> Extraction<T> unavailable(ExtractionShape<T> shape, String reason) {
        return fallback(shape, reason);
    }

    private <T> Extraction<T> fallback(ExtractionShape<T> shape, String note) {
        return Extraction.fallback(shape.fallbackValue(note), note);
    }
}
