package com.forecastplatform.common.prompt;

import com.forecastplatform.common.exception.ConfigurationException;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Named prompt text with {@code {placeholder}} slots.
 *
 * <p>Doubled braces render as single literal braces. A brace that does not open a
 * well-formed placeholder is copied through unchanged. Rendering fails with a
 * {@link ConfigurationException} when the template references a slot that has no value.
 */
public record PromptTemplate(String id, String text) {

    public static final String QUESTION = "question";
    public static final String BACKGROUND = "background";
    public static final String RESOLUTION_CRITERIA = "resolution_criteria";
    public static final String DATE_BEGIN = "date_begin";
    public static final String DATE_END = "date_end";
    public static final String RETRIEVED_INFO = "retrieved_info";
    public static final String BASE_REASONINGS = "base_reasonings";
    public static final String REASONING = "reasoning";
    public static final String ARTICLE = "article";
    public static final String MAX_WORDS = "max_words";
    public static final String NUM_KEYWORDS = "num_keywords";

    public PromptTemplate {
        if (id == null || id.isBlank()) throw new ConfigurationException("Prompt template id must not be blank");
        if (text == null) throw new ConfigurationException("Prompt template '" + id + "' has no text");
    }

    public String render(Map<String, ?> values) {
        StringBuilder out = new StringBuilder(text.length() + 256);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '{' && i + 1 < text.length() && text.charAt(i + 1) == '{') {
                out.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < text.length() && text.charAt(i + 1) == '}') {
                out.append('}');
                i += 2;
            } else if (c == '{') {
                int close = placeholderEnd(i);
                if (close < 0) {
                    out.append(c);
                    i++;
                    continue;
                }
                String name = text.substring(i + 1, close);
                if (!values.containsKey(name) || values.get(name) == null) {
                    throw new ConfigurationException(
                        "Prompt template '" + id + "' needs a value for {" + name + "}");
                }
                out.append(values.get(name));
                i = close + 1;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Names of every placeholder the template references, in order of first use. */
    public Set<String> placeholders() {
        Set<String> names = new LinkedHashSet<>();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if ((c == '{' || c == '}') && i + 1 < text.length() && text.charAt(i + 1) == c) {
                i += 2;
                continue;
            }
            if (c == '{') {
                int close = placeholderEnd(i);
                if (close > 0) {
                    names.add(text.substring(i + 1, close));
                    i = close + 1;
                    continue;
                }
            }
            i++;
        }
        return names;
    }

    private int placeholderEnd(int open) {
        int j = open + 1;
        while (j < text.length()) {
            char ch = text.charAt(j);
            if (ch == '}') return j > open + 1 ? j : -1;
            if (!(Character.isLetterOrDigit(ch) || ch == '_')) return -1;
            j++;
        }
        return -1;
    }
}
