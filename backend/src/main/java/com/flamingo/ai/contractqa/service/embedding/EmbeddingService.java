package com.flamingo.ai.contractqa.service.embedding;

import com.flamingo.ai.contractqa.exception.EmbeddingServiceException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service for generating text embeddings. Failures are reported as {@link
 * EmbeddingServiceException}; retrying is left to the orchestrator.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // OpenAI text-embedding-3-small has 8192 token limit, keep a safe margin
  private static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  /**
   * Embeds a question.
   *
   * @param query the query text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedQuery", description = "Time to embed query")
  public float[] embedQuery(String query) {
    return embed(query, "query");
  }

  /**
   * Embeds a clause.
   *
   * @param passage the clause text
   * @return embedding vector
   */
  @Timed(value = "embedding.embedPassage", description = "Time to embed passage")
  public float[] embedPassage(String passage) {
    return embed(passage, "passage");
  }

  private float[] embed(String text, String type) {
    String input = text;
    if (input.length() > MAX_CHARS_PER_EMBEDDING) {
      log.warn(
          "{} too long for embedding, truncating from {} chars to {} chars",
          type,
          input.length(),
          MAX_CHARS_PER_EMBEDDING);
      input = input.substring(0, MAX_CHARS_PER_EMBEDDING);
    }

    Response<Embedding> response;
    try {
      response = embeddingModel.embed(input);
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure", "type", type).increment();
      throw new EmbeddingServiceException("Embedding request failed: " + e.getMessage(), e);
    }

    if (response == null || response.content() == null) {
      meterRegistry.counter("embedding.requests.failure", "type", type).increment();
      throw new EmbeddingServiceException("Embedding service returned no vector", true);
    }
    meterRegistry.counter("embedding.requests.success", "type", type).increment();
    return response.content().vector();
  }
}
