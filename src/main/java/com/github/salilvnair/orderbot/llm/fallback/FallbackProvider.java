package com.github.salilvnair.orderbot.llm.fallback;

import java.util.Optional;

/**
 * Generative text-understanding capability consulted when deterministic handling has nothing
 * to offer. Callers treat an empty result as "no usable output".
 */
public interface FallbackProvider {

    Optional<FallbackIntent> extractIntent(String text, String language);

    Optional<String> generateReply(String text, String contextBlob, String language);
}
