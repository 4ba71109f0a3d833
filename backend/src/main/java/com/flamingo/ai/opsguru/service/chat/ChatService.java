package com.flamingo.ai.opsguru.service.chat;

import com.flamingo.ai.opsguru.api.dto.request.ChatRequest;
import com.flamingo.ai.opsguru.api.dto.response.ChatResponse;

/** Service interface for answering operator questions. */
public interface ChatService {

  /**
   * Answers a question within a session and records the exchange.
   *
   * @param request the question, optional session id and prior turns
   * @return the answer with citations, diagnostics and the updated history
   */
  ChatResponse answer(ChatRequest request);
}
