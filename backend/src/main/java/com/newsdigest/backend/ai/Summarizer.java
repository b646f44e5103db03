package com.newsdigest.backend.ai;

/**
 * Text generation backend used for cluster summaries and the daily digest
 */
public interface Summarizer {

    /**
     * Whether a model is configured. Callers skip summarization when this is false.
     */
    boolean isAvailable();

    /**
     * @throws SummarizationException when the model is unavailable, fails, or returns nothing
     */
    String summarize(String prompt);
}
