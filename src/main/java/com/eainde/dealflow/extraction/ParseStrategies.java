package com.eainde.dealflow.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The ordered parse chain used by {@link ResilientExtractor}: a fence labelled
 * {@code json}, any fence, the first balanced object holding the marker field,
 * and finally the whole text.
 */
public final class ParseStrategies {

    public static final String LABELLED_FENCE = "labelled-fence";
    public static final String ANY_FENCE = "any-fence";
    public static final String MARKER_OBJECT = "marker-object";
    public static final String WHOLE_TEXT = "whole-text";

    private static final Pattern JSON_FENCE = Pattern.compile("```\\s*json[ \\t]*\\r?\\n?(.*?)(?:```|\\z)",
            Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_FENCE_BLOCK = Pattern.compile("```[A-Za-z0-9_-]*[ \\t]*\\r?\\n?(.*?)(?:```|\\z)",
            Pattern.DOTALL);

    private ParseStrategies() {
    }

    public static List<ParseStrategy> defaultChain(ObjectMapper mapper) {
        return List.of(
                labelledFence(mapper),
                anyFence(mapper),
                markerObject(mapper),
                wholeText(mapper));
    }

    public static ParseStrategy labelledFence(ObjectMapper mapper) {
        return named(LABELLED_FENCE, (text, marker) -> firstFence(mapper, JSON_FENCE, text));
    }

    public static ParseStrategy anyFence(ObjectMapper mapper) {
        return named(ANY_FENCE, (text, marker) -> firstFence(mapper, ANY_FENCE_BLOCK, text));
    }

    public static ParseStrategy markerObject(ObjectMapper mapper) {
        return named(MARKER_OBJECT, (text, marker) -> {
            String quoted = "\"" + marker + "\"";
            for (int start = text.indexOf('{'); start >= 0; start = text.indexOf('{', start + 1)) {
                int end = balancedEnd(text, start);
                if (end < 0) {
                    continue;
                }
                String candidate = text.substring(start, end + 1);
                if (candidate.contains(quoted)) {
                    Optional<JsonNode> node = read(mapper, candidate);
                    if (node.isPresent()) {
                        return node;
                    }
                }
            }
            return Optional.empty();
        });
    }

    public static ParseStrategy wholeText(ObjectMapper mapper) {
        return named(WHOLE_TEXT, (text, marker) -> read(mapper, text.strip()));
    }

    private static Optional<JsonNode> firstFence(ObjectMapper mapper, Pattern fence, String text) {
        Matcher matcher = fence.matcher(text);
        while (matcher.find()) {
            String body = matcher.group(1).strip();
            if (body.isEmpty()) {
                continue;
            }
            Optional<JsonNode> node = read(mapper, body);
            if (node.isEmpty()) {
                node = JsonRepair.closeTruncated(body).flatMap(repaired -> read(mapper, repaired));
            }
            if (node.isPresent()) {
                return node;
            }
        }
        return Optional.empty();
    }

    /**
     * Index of the brace closing the object opened at {@code start}, skipping
     * braces inside string literals; -1 when the object never closes.
     */
    static int balancedEnd(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static Optional<JsonNode> read(ObjectMapper mapper, String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = mapper.readTree(candidate);
            return node != null && node.isContainerNode() ? Optional.of(node) : Optional.empty();
        } catch (Exception e) {
            return Optional.empty();
        }
    }

    private static ParseStrategy named(String name, Parser parser) {
        return new ParseStrategy() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public Optional<JsonNode> parse(String text, String marker) {
                return parser.parse(text, marker);
            }

            @Override
            public String toString() {
                return name;
            }
        };
    }

    @FunctionalInterface
    private interface Parser {
        Optional<JsonNode> parse(String text, String marker);
    }
}
