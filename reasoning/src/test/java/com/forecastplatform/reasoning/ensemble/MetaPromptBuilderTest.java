package com.forecastplatform.reasoning.ensemble;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetaPromptBuilderTest {

    @Test
    @DisplayName("reasonings are numbered and separated")
    void concatenate() {
        assertEquals("---\nResponse from forecaster 1:\nA\n\n-\nResponse from forecaster 2:\nB\n---",
            MetaPromptBuilder.concatenate(List.of("A", "B")));
    }
}
