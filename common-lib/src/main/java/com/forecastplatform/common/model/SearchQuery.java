package com.forecastplatform.common.model;

/**
 * One search string destined for a single document source.
 *
 * @param text       cleaned query text
 * @param sourceId   identifier of the document source the query was planned for
 * @param templateId prompt template that produced it, or {@code null} for the question itself
 */
public record SearchQuery(String text, String sourceId, String templateId) {}
