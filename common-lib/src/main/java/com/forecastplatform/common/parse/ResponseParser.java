package com.forecastplatform.common.parse;

import com.forecastplatform.common.model.AnswerType;
import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.model.TokenVocabulary;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pure text extraction from free-form model responses.
 *
 * <p>Every method is total: a response that cannot be read yields the documented default
 * rather than an exception. No logging, no state.
 */
public final class ResponseParser {

    public static final double DEFAULT_PROBABILITY = 0.5;
    public static final double DEFAULT_RATING = 1.0;
    public static final double MIN_RATING = 1.0;
    public static final double MAX_RATING = 6.0;
    public static final int END_TOKEN_WINDOW_WORDS = 50;
    public static final String SEARCH_QUERIES_MARKER = "Search Queries:";
    public static final String RATING_MARKER = "Rating:";

    private static final Pattern STARRED = Pattern.compile("\\*(.*?[\\d.]+.*?)\\*");
    private static final Pattern TRAILING_STAR = Pattern.compile("([\\d.]+.*?)\\*");
    private static final Pattern NUMBER = Pattern.compile("[\\d.]+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String QUERY_STRIP_CHARS = ".-; ";

    private ResponseParser() {}

    /**
     * Reads a probability written between asterisks, e.g. {@code *0.73*} or {@code *70%*}.
     *
     * <p>The last starred number is used when it is at most 1 (percentages are divided by
     * 100 first). Failing that, the last number followed by an asterisk is tried. Otherwise
     * {@value #DEFAULT_PROBABILITY}.
     */
    public static double extractProbability(String response) {
        if (response == null || response.isBlank()) return DEFAULT_PROBABILITY;

        List<Double> starred = new ArrayList<>();
        Matcher m = STARRED.matcher(response);
        while (m.find()) {
            String match = m.group(1);
            Matcher n = NUMBER.matcher(match);
            if (!n.find()) continue;
            Double value = parseNumber(n.group());
            if (value == null) continue;
            starred.add(match.contains("%") ? value / 100.0 : value);
        }
        if (!starred.isEmpty()) {
            double last = starred.get(starred.size() - 1);
            if (last >= 0.0 && last <= 1.0) return last;
        }

        List<Double> trailing = new ArrayList<>();
        Matcher t = TRAILING_STAR.matcher(response);
        while (t.find()) {
            Matcher n = NUMBER.matcher(t.group(1));
            while (n.find()) {
                Double value = parseNumber(n.group());
                if (value != null) trailing.add(value);
            }
        }
        if (!trailing.isEmpty()) {
            double last = trailing.get(trailing.size() - 1);
            if (last >= 0.0 && last <= 1.0) return last;
        }
        return DEFAULT_PROBABILITY;
    }

    /**
     * Finds the vocabulary phrase that ends the response. Only whole words count, so "No"
     * never matches inside "November". Longer phrases (by word count) win over shorter ones
     * so "Very Unlikely" beats "Unlikely"; among phrases of equal length the one occurring
     * last wins. Only the last {@value #END_TOKEN_WINDOW_WORDS} words are searched.
     */
    public static Optional<String> findEndToken(String response, List<String> vocabulary) {
        if (response == null || response.isBlank() || vocabulary == null) return Optional.empty();
        String[] words = WHITESPACE.split(response.trim());
        int from = Math.max(0, words.length - END_TOKEN_WINDOW_WORDS);
        String window = String.join(" ", Arrays.copyOfRange(words, from, words.length));

        String best = null;
        int bestWords = 0;
        int bestEnd = -1;
        for (String token : vocabulary) {
            if (token == null || token.isBlank()) continue;
            int end = lastWholeMatchEnd(window, token.trim());
            if (end < 0) continue;
            int tokenWords = WHITESPACE.split(token.trim()).length;
            if (tokenWords > bestWords || (tokenWords == bestWords && end > bestEnd)) {
                best = token;
                bestWords = tokenWords;
                bestEnd = end;
            }
        }
        return Optional.ofNullable(best);
    }

    private static int lastWholeMatchEnd(String text, String phrase) {
        Pattern pattern = Pattern.compile(
            "(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}])");
        Matcher m = pattern.matcher(text);
        int end = -1;
        while (m.find()) {
            end = m.end();
        }
        return end;
    }

    /** Token answer, or the vocabulary's default when no phrase is present. */
    public static String extractToken(String response, TokenVocabulary vocabulary) {
        return findEndToken(response, vocabulary.tokens()).orElse(vocabulary.defaultToken());
    }

    public static Prediction extractPrediction(String response, AnswerType answerType, TokenVocabulary vocabulary) {
        if (answerType == AnswerType.TOKENS) {
            return Prediction.ofToken(extractToken(response, vocabulary));
        }
        return Prediction.ofProbability(extractProbability(response));
    }

    /**
     * Reads a 1-6 relevance rating: the first word when it is an integer, else the first
     * word after {@value #RATING_MARKER}. Anything unreadable or out of range rates
     * {@value #DEFAULT_RATING}.
     */
    public static double extractRating(String response) {
        if (response == null || response.isBlank()) return DEFAULT_RATING;
        String trimmed = response.trim();

        Double first = integerWord(firstWord(trimmed));
        if (first != null) return inRatingScale(first);

        int marker = trimmed.indexOf(RATING_MARKER);
        if (marker < 0) return DEFAULT_RATING;
        String afterMarker = trimmed.substring(marker + RATING_MARKER.length()).trim();
        Double rated = integerWord(firstWord(afterMarker));
        return rated == null ? DEFAULT_RATING : inRatingScale(rated);
    }

    /**
     * Splits the text following {@value #SEARCH_QUERIES_MARKER} on semicolons. Surrounding
     * punctuation and quotes are stripped and empty entries dropped. Returns an empty list
     * when the marker is absent.
     */
    public static List<String> extractSearchQueries(String response) {
        if (response == null) return List.of();
        int marker = response.indexOf(SEARCH_QUERIES_MARKER);
        if (marker < 0) return List.of();

        String tail = response.substring(marker + SEARCH_QUERIES_MARKER.length())
            .replace('\n', ' ')
            .replace("\"", "");
        List<String> queries = new ArrayList<>();
        for (String part : tail.split(";")) {
            String cleaned = strip(part, QUERY_STRIP_CHARS);
            if (!cleaned.isEmpty()) queries.add(cleaned);
        }
        return queries;
    }

    private static String firstWord(String text) {
        if (text.isEmpty()) return "";
        return WHITESPACE.split(text, 2)[0];
    }

    private static Double integerWord(String word) {
        if (word == null || !DIGITS.matcher(word).matches()) return null;
        return Double.parseDouble(word);
    }

    private static double inRatingScale(double rating) {
        return rating >= MIN_RATING && rating <= MAX_RATING ? rating : DEFAULT_RATING;
    }

    private static Double parseNumber(String text) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static String strip(String text, String chars) {
        int start = 0;
        int end = text.length();
        while (start < end && chars.indexOf(text.charAt(start)) >= 0) start++;
        while (end > start && chars.indexOf(text.charAt(end - 1)) >= 0) end--;
        return text.substring(start, end).trim();
    }
}
