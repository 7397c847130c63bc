package com.forecastplatform.retrieval.source;

import java.time.LocalDate;

/**
 * A search hit exactly as a document source returned it, before length and site filtering.
 * {@code publishDate} is {@code null} when the source gave none or it could not be parsed.
 */
public record RawDocument(String title, String link, String site, LocalDate publishDate, String text) {}
