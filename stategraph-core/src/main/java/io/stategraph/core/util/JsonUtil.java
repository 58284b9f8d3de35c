package io.stategraph.core.util;

/// Locates JSON objects inside free text such as model responses.
///
/// Note: This is intentionally minimal to keep stategraph-core dependency-free. Parsing the
/// located text is left to the serialization module.
public final class JsonUtil {

    private JsonUtil() {}

    /// Returns the body of the first fenced code block (```json or plain ```).
    ///
    /// @param output text that may contain a fenced block, not null
    /// @return the trimmed block body, or null if there is no closed fence
    public static String extractFencedBlock(String output) {
        int start = output.indexOf("```json");
        if (start < 0) {
            start = output.indexOf("```");
        }
        if (start < 0) {
            return null;
        }
        int bodyStart = output.indexOf('\n', start);
        if (bodyStart < 0) {
            return null;
        }
        int end = output.indexOf("```", bodyStart + 1);
        if (end <= bodyStart) {
            return null;
        }
        return output.substring(bodyStart + 1, end).trim();
    }

    /// Extract JSON object from output that may contain surrounding text. Handles nested braces
    /// and braces inside string literals.
    ///
    /// @param output text to search, not null
    /// @return the first balanced `{...}` span, or null if none
    public static String extractJsonFromOutput(String output) {
        int start = output.indexOf('{');
        if (start == -1) {
            return null;
        }

        int depth = 0;
        boolean inString = false;
        boolean escaped = false;

        for (int i = start; i < output.length(); i++) {
            char c = output.charAt(i);

            if (escaped) {
                escaped = false;
                continue;
            }

            if (c == '\\') {
                escaped = true;
                continue;
            }

            if (c == '"') {
                inString = !inString;
                continue;
            }

            if (!inString) {
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                    if (depth == 0) {
                        return output.substring(start, i + 1);
                    }
                }
            }
        }

        return null;
    }
}
