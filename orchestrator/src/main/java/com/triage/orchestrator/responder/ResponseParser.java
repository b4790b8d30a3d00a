package com.triage.orchestrator.responder;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured fields from language-model replies.
 *
 * The prompts ask for a JSON object, which {@link #parseJson} pulls out of any
 * surrounding reasoning or markdown fences. Replies in the older
 * {@code FIELD: value} layout are handled by {@link #parseFields}.
 */
public final class ResponseParser {

    private static final ObjectMapper JSON = new ObjectMapper();

    // <thinking>...</thinking> scratchpad some models emit before the answer
    private static final Pattern THINKING = Pattern.compile("<thinking>.*?</thinking>", Pattern.DOTALL);

    private static final Pattern FENCE_OPEN = Pattern.compile("```json\\s*");
    private static final Pattern FENCE      = Pattern.compile("```\\s*");

    private ResponseParser() {}

    // ------------------------------------------------------------------
    // JSON replies
    // ------------------------------------------------------------------

    /**
     * Parse the outermost JSON object in a reply.
     *
     * @return the parsed object, or an empty map if the reply holds no valid JSON object
     */
    public static Map<String, Object> parseJson(String response) {
        if (response == null) return Map.of();
        String cleaned = THINKING.matcher(response).replaceAll("");
        cleaned = FENCE_OPEN.matcher(cleaned).replaceAll("");
        cleaned = FENCE.matcher(cleaned).replaceAll("");

        int start = cleaned.indexOf('{');
        int end   = cleaned.lastIndexOf('}');
        if (start < 0 || end <= start) return Map.of();
        try {
            Map<String, Object> parsed = JSON.readValue(cleaned.substring(start, end + 1), new TypeReference<>() {});
            return parsed == null ? Map.of() : parsed;
        } catch (Exception e) {
            return Map.of();
        }
    }

    // ------------------------------------------------------------------
    // FIELD: value replies
    // ------------------------------------------------------------------

    /**
     * Extract {@code FIELD: value} sections. A value runs until the next line that
     * starts with an upper-case field label. Keys are returned lower-cased; missing
     * fields map to the empty string and surrounding brackets are stripped.
     */
    public static Map<String, String> parseFields(String response, List<String> fields) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String field : fields) {
            Pattern p = Pattern.compile(Pattern.quote(field) + ":\\s*(.+?)(?=\\n[A-Z_]+:|$)",
                    Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
            Matcher m = p.matcher(response == null ? "" : response);
            String value = "";
            if (m.find()) {
                value = m.group(1).strip();
                if (value.startsWith("[") && value.endsWith("]")) {
                    value = value.substring(1, value.length() - 1);
                }
            }
            result.put(field.toLowerCase(Locale.ROOT), value);
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Value helpers
    // ------------------------------------------------------------------

    /** String value of a JSON field, or {@code fallback} when absent, null or blank. */
    public static String text(Map<String, ?> parsed, String key, String fallback) {
        Object v = parsed.get(key);
        if (v == null) return fallback;
        String s = String.valueOf(v).strip();
        return s.isEmpty() ? fallback : s;
    }

    /** A JSON array as strings; a lone string becomes a one-element list. */
    public static List<String> textList(Object value) {
        List<String> out = new ArrayList<>();
        if (value instanceof List) {
            for (Object item : (List<?>) value) {
                if (item != null && !String.valueOf(item).isBlank()) out.add(String.valueOf(item).strip());
            }
        } else if (value instanceof String && !((String) value).isBlank()) {
            out.add(((String) value).strip());
        }
        return out;
    }

    /** Split a comma-separated value, dropping blanks and surrounding quotes. */
    public static List<String> splitCsv(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::strip)
                .map(s -> s.replaceAll("^[\"']+|[\"']+$", ""))
                .filter(s -> !s.isEmpty())
                .toList();
    }

    /** A finite number from JSON or text, or {@code fallback} if it cannot be read. */
    public static double number(Object value, double fallback) {
        double d;
        if (value instanceof Number) {
            d = ((Number) value).doubleValue();
        } else if (value instanceof String) {
            try {
                d = Double.parseDouble(((String) value).strip());
            } catch (NumberFormatException e) {
                return fallback;
            }
        } else {
            return fallback;
        }
        return Double.isFinite(d) ? d : fallback;
    }

    /** A yes/no flag from JSON ({@code true}) or text ({@code "yes"}, {@code "true"}). */
    public static boolean flag(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        if (value instanceof String) {
            String s = ((String) value).strip().toLowerCase(Locale.ROOT);
            return s.equals("yes") || s.equals("true");
        }
        return false;
    }
}
