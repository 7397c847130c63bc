package com.forecastplatform.retrieval.summarize;

import com.forecastplatform.gateway.token.TokenCounter;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text on whitespace into chunks whose summed per-word token counts stay within a
 * limit. A single word longer than the limit becomes a chunk of its own.
 */
public final class TextChunker {

    private TextChunker() {}

    public static List<String> split(String text, int chunkTokenLimit, String model, TokenCounter counter) {
        List<String> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int currentTokens = 0;
        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) continue;
            int wordTokens = counter.count(word, model);
            if (currentTokens + wordTokens > chunkTokenLimit && current.length() > 0) {
                chunks.add(current.toString());
                current.setLength(0);
                currentTokens = 0;
            }
            if (current.length() > 0) current.append(' ');
            current.append(word);
            currentTokens += wordTokens;
        }
        if (current.length() > 0) chunks.add(current.toString());
        return chunks;
    }
}
