package com.eainde.dealflow.extraction;

import java.util.Optional;

/**
 * Closes JSON that was cut off mid-stream, typically because the reasoning
 * service ran into its output token limit.
 */
final class JsonRepair {

    private JsonRepair() {
    }

    /**
     * Cuts the text back to the last fully closed object or array and appends
     * the closers still missing at that point.
     *
     * @return the repaired text, empty when nothing was ever closed
     */
    static Optional<String> closeTruncated(String text) {
        StringBuilder open = new StringBuilder();
        boolean inString = false;
        boolean escaped = false;
        int cut = -1;
        String openAtCut = "";

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            switch (c) {
                case '"' -> inString = true;
                case '{', '[' -> open.append(c);
                case '}', ']' -> {
                    if (open.length() == 0) {
                        return Optional.empty();
                    }
                    open.setLength(open.length() - 1);
                    cut = i + 1;
                    openAtCut = open.toString();
                }
                default -> {
                }
            }
        }

        if (open.length() == 0 && !inString) {
            return Optional.of(text);
        }
        if (cut < 0) {
            return Optional.empty();
        }
        StringBuilder repaired = new StringBuilder(text.substring(0, cut));
        for (int i = openAtCut.length() - 1; i >= 0; i--) {
            repaired.append(openAtCut.charAt(i) == '{' ? '}' : ']');
        }
        return Optional.of(repaired.toString());
    }
}
