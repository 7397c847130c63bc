package com.forecastplatform.common.parse;

import com.forecastplatform.common.model.AnswerType;
import com.forecastplatform.common.model.Prediction;
import com.forecastplatform.common.model.TokenVocabulary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseParserTest {

    // ── extractProbability() ──────────────────────────────────────────────

    @Nested
    @DisplayName("extractProbability()")
    class ProbabilityTests {

        @Test
        @DisplayName("starred decimal is read as-is")
        void starredDecimal() {
            assertEquals(0.73, ResponseParser.extractProbability("My final answer is *0.73*"), 1e-9);
        }

        @Test
        @DisplayName("starred percentage is divided by 100")
        void starredPercentage() {
            assertEquals(0.70, ResponseParser.extractProbability("Final: *70%*"), 1e-9);
        }

        @Test
        @DisplayName("last starred value wins")
        void lastStarredWins() {
            String response = "Initial guess *0.2*. After review the answer is *0.35*.";
            assertEquals(0.35, ResponseParser.extractProbability(response), 1e-9);
        }

        @Test
        @DisplayName("number followed by an asterisk is the fallback")
        void trailingAsteriskFallback() {
            assertEquals(0.4, ResponseParser.extractProbability("Probability: 0.4*"), 1e-9);
        }

        @Test
        @DisplayName("no number → 0.5")
        void noNumber_returnsDefault() {
            assertEquals(0.5, ResponseParser.extractProbability("I cannot tell."), 1e-9);
        }

        @Test
        @DisplayName("starred value above 1 without percent → 0.5")
        void outOfRange_returnsDefault() {
            assertEquals(0.5, ResponseParser.extractProbability("*75*"), 1e-9);
        }

        @Test
        @DisplayName("null or blank → 0.5")
        void blank_returnsDefault() {
            assertEquals(0.5, ResponseParser.extractProbability(null), 1e-9);
            assertEquals(0.5, ResponseParser.extractProbability("   "), 1e-9);
        }
    }

    // ── findEndToken() / extractToken() ───────────────────────────────────

    @Nested
    @DisplayName("findEndToken()")
    class EndTokenTests {

        private final List<String> six = TokenVocabulary.SIX_OPTIONS.tokens();

        @Test
        @DisplayName("longest phrase wins over its suffix")
        void longestMatchWins() {
            assertEquals(Optional.of("Very Unlikely"),
                ResponseParser.findEndToken("Weighing everything, my answer is Very Unlikely", six));
        }

        @Test
        @DisplayName("a token inside a longer word does not match")
        void wholeWordsOnly() {
            String response = "The vote is scheduled for November and None of the members "
                + "has Noted any dissent. Answer: Likely";
            assertEquals(Optional.of("Likely"), ResponseParser.findEndToken(response, six));
        }

        @Test
        @DisplayName("among equally long phrases the last one in the response wins")
        void lastOccurrenceWins() {
            String response = "Earlier I leaned Unlikely, but Unlikely is now wrong given the data. Answer: Likely";
            assertEquals(Optional.of("Likely"), ResponseParser.findEndToken(response, six));
        }

        @Test
        @DisplayName("punctuation around the final answer still matches")
        void punctuationBoundary() {
            assertEquals(Optional.of("No"), ResponseParser.findEndToken("Final answer: (No).", six));
        }

        @Test
        @DisplayName("phrase outside the trailing window is ignored")
        void phraseOutsideWindow() {
            StringBuilder response = new StringBuilder("Likely at first glance.");
            for (int i = 0; i < 60; i++) response.append(" filler");
            assertEquals(Optional.empty(), ResponseParser.findEndToken(response.toString(), six));
        }

        @Test
        @DisplayName("no phrase → vocabulary default token")
        void noPhrase_returnsDefault() {
            assertEquals("Slightly Unlikely",
                ResponseParser.extractToken("no idea", TokenVocabulary.TEN_OPTIONS));
        }

        @Test
        @DisplayName("extractPrediction() dispatches on answer type")
        void extractPredictionDispatch() {
            Prediction token = ResponseParser.extractPrediction(
                "Answer: Extremely Likely", AnswerType.TOKENS, TokenVocabulary.TEN_OPTIONS);
            assertEquals("Extremely Likely", token.token());

            Prediction probability = ResponseParser.extractPrediction(
                "*0.9*", AnswerType.PROBABILITY, TokenVocabulary.TEN_OPTIONS);
            assertEquals(0.9, probability.probability(), 1e-9);
        }
    }

    // ── extractRating() ───────────────────────────────────────────────────

    @Nested
    @DisplayName("extractRating()")
    class RatingTests {

        @Test
        @DisplayName("leading integer is the rating")
        void leadingInteger() {
            assertEquals(5.0, ResponseParser.extractRating("5\nThe article is directly relevant."), 1e-9);
        }

        @Test
        @DisplayName("integer after Rating: marker")
        void afterMarker() {
            assertEquals(4.0, ResponseParser.extractRating("Thoughts: mostly relevant.\nRating: 4"), 1e-9);
        }

        @Test
        @DisplayName("unparsable → 1")
        void unparsable_returnsOne() {
            assertEquals(1.0, ResponseParser.extractRating("Thoughts: unclear.\nRating: high"), 1e-9);
            assertEquals(1.0, ResponseParser.extractRating("No rating given"), 1e-9);
        }

        @Test
        @DisplayName("outside 1-6 → 1")
        void outOfScale_returnsOne() {
            assertEquals(1.0, ResponseParser.extractRating("Rating: 9"), 1e-9);
        }
    }

    // ── extractSearchQueries() ────────────────────────────────────────────

    @Nested
    @DisplayName("extractSearchQueries()")
    class SearchQueryTests {

        @Test
        @DisplayName("splits on semicolons and strips punctuation")
        void splitsAndStrips() {
            String response = "Thoughts: the election matters.\nSearch Queries:\n"
                + "\"election polls\"; - candidate debate; turnout forecast.";
            assertEquals(List.of("election polls", "candidate debate", "turnout forecast"),
                ResponseParser.extractSearchQueries(response));
        }

        @Test
        @DisplayName("queries on the marker line are read")
        void sameLine() {
            assertEquals(List.of("fed rate", "inflation"),
                ResponseParser.extractSearchQueries("Search Queries: fed rate; inflation;"));
        }

        @Test
        @DisplayName("missing marker → empty list")
        void missingMarker() {
            assertTrue(ResponseParser.extractSearchQueries("fed rate; inflation").isEmpty());
        }
    }
}
