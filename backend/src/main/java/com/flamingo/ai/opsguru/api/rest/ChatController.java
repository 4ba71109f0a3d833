package com.flamingo.ai.opsguru.api.rest;

import com.flamingo.ai.opsguru.api.dto.request.ChatRequest;
import com.flamingo.ai.opsguru.api.dto.response.ChatResponse;
import com.flamingo.ai.opsguru.api.dto.response.ConversationResponse;
import com.flamingo.ai.opsguru.service.chat.ChatService;
import com.flamingo.ai.opsguru.service.session.SessionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for operator questions and their conversation history. */
@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

  private final ChatService chatService;
  private final SessionService sessionService;

  /**
   * Answers an operator question.
   *
   * @param request the question with optional session id and prior turns
   * @return the answer; pipeline degradation is reported in {@code errors}, never as a failure
   */
  @PostMapping
  public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
    return ResponseEntity.ok(chatService.answer(request));
  }

  /** Gets the stored conversation of a session. */
  @GetMapping("/{sessionId}")
  public ResponseEntity<ConversationResponse> getConversation(@PathVariable String sessionId) {
    return ResponseEntity.ok(ConversationResponse.fromEntity(sessionService.getSession(sessionId)));
  }

  /** Deletes the stored conversation of a session. */
  @DeleteMapping("/{sessionId}")
  public ResponseEntity<Void> deleteConversation(@PathVariable String sessionId) {
    log.info("Deleting conversation {}", sessionId);
    sessionService.deleteSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
