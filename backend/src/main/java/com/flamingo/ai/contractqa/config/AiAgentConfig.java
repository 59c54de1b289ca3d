package com.flamingo.ai.contractqa.config;

import com.flamingo.ai.contractqa.agent.ClauseClassificationAgent;
import com.flamingo.ai.contractqa.agent.ContractAnswerAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for AI agents built with LangChain4j AI Services.
 *
 * <p>Pattern: define agent interfaces with @SystemMessage/@UserMessage, build concrete
 * implementations using AiServices.builder().
 */
@Configuration
public class AiAgentConfig {

  /** Answer agent. Uses the JSON-mode chat model; its output is validated before use. */
  @Bean
  public ContractAnswerAgent contractAnswerAgent(@Qualifier("chatModel") ChatModel chatModel) {
    return AiServices.builder(ContractAnswerAgent.class).chatModel(chatModel).build();
  }

  /** Clause classification agent. Uses textChatModel for a bare label output. */
  @Bean
  public ClauseClassificationAgent clauseClassificationAgent(
      @Qualifier("textChatModel") ChatModel textChatModel) {
    return AiServices.builder(ClauseClassificationAgent.class).chatModel(textChatModel).build();
  }
}
