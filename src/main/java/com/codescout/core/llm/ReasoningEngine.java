package com.codescout.core.llm;

/**
 * Port to the external reasoning engine. Implementations are stateless: every
 * request carries the complete conversation.
 */
public interface ReasoningEngine {

    /**
     * @throws EngineUnreachableException if the engine cannot be reached after its own retries
     * @throws EngineProtocolException    if the engine answers with something unusable
     */
    EngineResponse respond(EngineRequest request);
}
