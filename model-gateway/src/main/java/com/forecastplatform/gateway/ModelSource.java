package com.forecastplatform.gateway;

/** Provider family a model is served by. */
public enum ModelSource {
    OPENAI,
    ANTHROPIC,
    GOOGLE,
    TOGETHER
}
