package com.forecastplatform.retrieval.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.exception.ConfigurationException;
import com.forecastplatform.common.exception.ForecastException;
import com.forecastplatform.common.model.DateRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Newscatcher v2 search adapter. The API's {@code summary} field carries the full article
 * text, so no separate page extraction is needed.
 */
public class NewscatcherDocumentSource implements DocumentSource {

    private static final Logger log = LoggerFactory.getLogger(NewscatcherDocumentSource.class);

    public static final String SOURCE_ID = "newscatcher";

    private static final DateTimeFormatter PUBLISHED_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern ISO_DATE_PREFIX = Pattern.compile("\\d{4}-\\d{2}-\\d{2}");

    private final WebClient client;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public NewscatcherDocumentSource(WebClient client, ObjectMapper objectMapper, String apiKey) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.apiKey = apiKey;
    }

    @Override
    public String id() {
        return SOURCE_ID;
    }

    @Override
    public Mono<List<RawDocument>> search(String query, DateRange range, int maxResults) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ConfigurationException("No Newscatcher API key configured"));
        }
        log.debug("[Newscatcher] Searching. query={} range={}", query, range);
        return client.get()
            .uri(uri -> uri.path("/v2/search")
                .queryParam("q", query)
                .queryParam("lang", "en")
                .queryParam("sort_by", "relevancy")
                .queryParam("page_size", maxResults)
                .queryParam("from", range.startText())
                .queryParam("to", range.endText())
                .build())
            .header("x-api-key", apiKey)
            .retrieve()
            .bodyToMono(String.class)
            .map(this::parse);
    }

    List<RawDocument> parse(String response) {
        JsonNode root;
        try {
            root = objectMapper.readTree(response);
        } catch (Exception e) {
            throw new ForecastException(SOURCE_ID, "Failed to parse search response", e);
        }
        JsonNode articles = root.path("articles");
        if (!articles.isArray()) {
            log.debug("[Newscatcher] No articles in response. status={}", root.path("status").asText());
            return List.of();
        }
        List<RawDocument> docs = new ArrayList<>();
        for (JsonNode a : articles) {
            docs.add(new RawDocument(
                textOrNull(a, "title"),
                textOrNull(a, "link"),
                textOrNull(a, "clean_url"),
                parseDate(textOrNull(a, "published_date")),
                textOrNull(a, "summary")));
        }
        return docs;
    }

    static LocalDate parseDate(String value) {
        if (value == null || !ISO_DATE_PREFIX.matcher(value).lookingAt()) return null;
        try {
            if (value.length() == 19 && value.charAt(10) == ' ') {
                return LocalDateTime.parse(value, PUBLISHED_FMT).toLocalDate();
            }
            return LocalDate.parse(value.substring(0, 10));
        } catch (DateTimeParseException e) {
            log.debug("[Newscatcher] Unparsable publish date. value={}", value);
            return null;
        }
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? null : v.asText();
    }
}
