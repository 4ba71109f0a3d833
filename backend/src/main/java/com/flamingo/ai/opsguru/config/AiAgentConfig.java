package com.flamingo.ai.opsguru.config;

import com.flamingo.ai.opsguru.agent.ContentSafetyAgent;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.service.AiServices;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Configuration for LangChain4j AI Services agents. */
@Configuration
public class AiAgentConfig {

  /** Safety classifier used when the guardrail provider is "llm". */
  @Bean
  @ConditionalOnProperty(name = "opsguru.guardrail.provider", havingValue = "llm")
  public ContentSafetyAgent contentSafetyAgent(ChatModel chatModel) {
    return AiServices.builder(ContentSafetyAgent.class).chatModel(chatModel).build();
  }
}
