package com.debateplatform.engine.completion;

import com.debateplatform.common.model.AgentRole;

import java.time.Duration;

/**
 * One structured-output request to the completion provider.
 *
 * @param role      the agent the call is made for, carried into failures
 * @param model     provider model identifier
 * @param prompt    fully rendered prompt, including the expected output schema
 * @param maxTokens output token budget
 * @param timeout   per-call timeout; expiry is a transient failure
 */
public record CompletionRequest(
    AgentRole role,
    String model,
    String prompt,
    int maxTokens,
    Duration timeout
) {}
