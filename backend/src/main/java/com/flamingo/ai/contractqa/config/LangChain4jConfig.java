package com.flamingo.ai.contractqa.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Configuration for LangChain4j models. Timeouts here are transport limits; the pipeline applies
 * its own per-call limits on top.
 */
@Configuration
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${langchain4j.openai.chat-model.model-name:gpt-4o}")
  private String chatModelName;

  @Value("${langchain4j.openai.chat-model.temperature:0.0}")
  private double temperature;

  @Value("${langchain4j.openai.chat-model.max-completion-tokens:2048}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String embeddingModelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int embeddingDimensions;

  /** JSON-mode chat model used for structured answers. */
  @Bean
  @Primary
  public ChatModel chatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(temperature)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(90))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  /** Plain-text chat model for short label outputs such as clause classification. */
  @Bean
  public ChatModel textChatModel() {
    validateApiKey();

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .temperature(temperature)
        .maxCompletionTokens(32)
        .timeout(Duration.ofSeconds(30))
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  @Bean
  public EmbeddingModel embeddingModel() {
    validateApiKey();

    return OpenAiEmbeddingModel.builder()
        .apiKey(openAiApiKey)
        .modelName(embeddingModelName)
        .dimensions(embeddingDimensions)
        .timeout(Duration.ofSeconds(30))
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
