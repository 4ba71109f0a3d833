package com.flamingo.ai.opsguru.domain.converter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flamingo.ai.opsguru.domain.model.ConversationTurn;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import java.util.Collections;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/** JPA converter for persisting conversation turns as a JSON array in a TEXT column. */
@Converter
@Slf4j
public class ConversationTurnListConverter
    implements AttributeConverter<List<ConversationTurn>, String> {

  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .findAndRegisterModules()
          .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  private static final TypeReference<List<ConversationTurn>> LIST_TYPE = new TypeReference<>() {};

  @Override
  public String convertToDatabaseColumn(List<ConversationTurn> attribute) {
    if (attribute == null || attribute.isEmpty()) {
      return "[]";
    }
    try {
      return MAPPER.writeValueAsString(attribute);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize conversation turns", e);
    }
  }

  @Override
  public List<ConversationTurn> convertToEntityAttribute(String dbData) {
    if (dbData == null || dbData.isBlank()) {
      return Collections.emptyList();
    }
    try {
      return MAPPER.readValue(dbData, LIST_TYPE);
    } catch (JsonProcessingException e) {
      log.error("Failed to deserialize conversation turns: {}", e.getMessage());
      return Collections.emptyList();
    }
  }
}
