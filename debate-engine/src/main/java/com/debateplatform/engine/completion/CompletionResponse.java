package com.debateplatform.engine.completion;

/** Raw provider payload plus token accounting. */
public record CompletionResponse(String text, int inputTokens, int outputTokens) {}
