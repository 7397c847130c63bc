package com.forecastplatform.gateway.token;

import com.forecastplatform.gateway.ModelCatalog;
import com.forecastplatform.gateway.ModelSource;
import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.EncodingType;

/**
 * Exact cl100k counts for OpenAI models, a characters-per-token estimate for everything else.
 */
public class ModelTokenCounter implements TokenCounter {

    static final int CHARS_PER_TOKEN_ESTIMATE = 3;

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final ModelCatalog catalog;
    private final Encoding encoding;

    public ModelTokenCounter(ModelCatalog catalog) {
        this.catalog = catalog;
        this.encoding = REGISTRY.getEncoding(EncodingType.CL100K_BASE);
    }

    @Override
    public int count(String text, String model) {
        if (text == null || text.isEmpty()) return 0;
        if (catalog.sourceOf(model) == ModelSource.OPENAI) {
            return encoding.countTokens(text);
        }
        return (text.length() + CHARS_PER_TOKEN_ESTIMATE - 1) / CHARS_PER_TOKEN_ESTIMATE;
    }
}
