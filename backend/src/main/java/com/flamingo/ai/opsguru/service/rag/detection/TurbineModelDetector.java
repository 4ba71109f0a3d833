package com.flamingo.ai.opsguru.service.rag.detection;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.config.OpsGuruProperties.Detection.AliasStrategy;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Maps free-text equipment mentions to canonical {@link TurbineModel} identifiers.
 *
 * <p>Aliases are matched as case-insensitive substrings. With the default strategy the first alias
 * in declaration order that occurs in the text wins; with {@link AliasStrategy#LONGEST_MATCH} the
 * longest occurring alias wins and declaration order only breaks ties.
 */
@Component
@Slf4j
public class TurbineModelDetector {

  private final List<Alias> aliases;
  private final AliasStrategy strategy;

  public TurbineModelDetector(OpsGuruProperties properties) {
    OpsGuruProperties.Detection detection = properties.getDetection();
    this.strategy = detection.getStrategy();
    this.aliases = buildAliasTable(detection.getAliases());
    log.info(
        "Turbine model detector initialized: {} aliases, strategy={}", aliases.size(), strategy);
  }

  /**
   * Detects the turbine model mentioned in the given text.
   *
   * @param text free text, may be null
   * @return the canonical model, or empty if no alias occurs in the text
   */
  public Optional<TurbineModel> detect(String text) {
    if (text == null || text.isBlank()) {
      return Optional.empty();
    }
    String haystack = text.toLowerCase(Locale.ROOT);

    Alias best = null;
    for (Alias alias : aliases) {
      if (!haystack.contains(alias.text())) {
        continue;
      }
      if (strategy == AliasStrategy.DECLARATION_ORDER) {
        return Optional.of(alias.model());
      }
      if (best == null || alias.text().length() > best.text().length()) {
        best = alias;
      }
    }
    return Optional.ofNullable(best).map(Alias::model);
  }

  private static List<Alias> buildAliasTable(Map<TurbineModel, List<String>> configured) {
    List<Alias> table = new ArrayList<>();
    if (configured == null || configured.isEmpty()) {
      for (TurbineModel model : TurbineModel.values()) {
        model.getDefaultAliases().forEach(a -> table.add(new Alias(a, model)));
      }
      return List.copyOf(table);
    }
    configured.forEach(
        (model, names) ->
            names.stream()
                .filter(name -> name != null && !name.isBlank())
                .map(name -> name.trim().toLowerCase(Locale.ROOT))
                .forEach(name -> table.add(new Alias(name, model))));
    return List.copyOf(table);
  }

  private record Alias(String text, TurbineModel model) {}
}
