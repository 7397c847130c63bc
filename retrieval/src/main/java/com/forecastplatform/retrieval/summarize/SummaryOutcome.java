package com.forecastplatform.retrieval.summarize;

/**
 * @param text   final summary
 * @param passes split-and-summarize rounds performed; 0 when the text fit in one call
 */
public record SummaryOutcome(String text, int passes) {}
