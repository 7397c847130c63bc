package com.forecastplatform.retrieval.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forecastplatform.common.model.DateRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.LocalDate;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class NewscatcherDocumentSourceTest {

    private static final String RESPONSE = "{\"status\":\"ok\",\"articles\":["
        + "{\"title\":\"Rates hold\",\"link\":\"https://news.test/a\",\"clean_url\":\"news.test\","
        + "\"published_date\":\"2024-02-01 09:30:00\",\"summary\":\"Full article text.\"},"
        + "{\"title\":\"Undated\",\"link\":\"https://news.test/b\",\"clean_url\":\"news.test\","
        + "\"published_date\":null,\"summary\":\"Other text.\"}]}";

    @Test
    @DisplayName("search sends the query window and API key, and maps articles")
    void search() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        WebClient client = WebClient.builder()
            .baseUrl("http://newscatcher.test")
            .exchangeFunction(request -> {
                captured.set(request);
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .body(RESPONSE)
                    .build());
            })
            .build();
        NewscatcherDocumentSource source = new NewscatcherDocumentSource(client, new ObjectMapper(), "nc-key");

        StepVerifier.create(source.search("rate cut", DateRange.of("2024-01-01", "2024-03-01"), 10))
            .assertNext(docs -> {
                assertEquals(2, docs.size());
                assertEquals("Rates hold", docs.get(0).title());
                assertEquals(LocalDate.of(2024, 2, 1), docs.get(0).publishDate());
                assertEquals("Full article text.", docs.get(0).text());
                assertNull(docs.get(1).publishDate());
            })
            .verifyComplete();

        String query = captured.get().url().getQuery();
        assertTrue(query.contains("from=2024-01-01"));
        assertTrue(query.contains("to=2024-03-01"));
        assertTrue(query.contains("page_size=10"));
        assertEquals("nc-key", captured.get().headers().getFirst("x-api-key"));
    }

    @Test
    @DisplayName("no-match status → empty list")
    void noMatches() {
        NewscatcherDocumentSource source = new NewscatcherDocumentSource(null, new ObjectMapper(), "k");
        assertTrue(source.parse("{\"status\":\"No matches for your search.\"}").isEmpty());
    }

    @Test
    @DisplayName("publish dates parse from both API formats")
    void dates() {
        assertEquals(LocalDate.of(2024, 2, 1), NewscatcherDocumentSource.parseDate("2024-02-01 09:30:00"));
        assertEquals(LocalDate.of(2024, 2, 1), NewscatcherDocumentSource.parseDate("2024-02-01T09:30:00Z"));
        assertNull(NewscatcherDocumentSource.parseDate("yesterday"));
    }
}
