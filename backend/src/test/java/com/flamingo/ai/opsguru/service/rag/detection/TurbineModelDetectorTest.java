package com.flamingo.ai.opsguru.service.rag.detection;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import com.flamingo.ai.opsguru.config.OpsGuruProperties.Detection.AliasStrategy;
import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("TurbineModelDetector Tests")
class TurbineModelDetectorTest {

  private static TurbineModelDetector detector(
      AliasStrategy strategy, Map<TurbineModel, List<String>> aliases) {
    OpsGuruProperties properties = new OpsGuruProperties();
    properties.getDetection().setStrategy(strategy);
    properties.getDetection().setAliases(aliases);
    return new TurbineModelDetector(properties);
  }

  @Nested
  @DisplayName("Built-in aliases")
  class BuiltInAliases {

    private final TurbineModelDetector detector = new TurbineModelDetector(new OpsGuruProperties());

    @ParameterizedTest
    @ValueSource(
        strings = {
          "How do I troubleshoot low oil pressure on the SMT60?",
          "taurus-60 vibration alarm",
          "Our Taurus 60 trips on start",
          "smt 60 lube oil filter"
        })
    @DisplayName("Should map every SMT60 alias to the canonical id")
    void shouldDetectSmt60Aliases(String text) {
      assertThat(detector.detect(text)).contains(TurbineModel.SMT60);
    }

    @Test
    @DisplayName("Should detect Titan 130 and TM2500")
    void shouldDetectOtherModels() {
      assertThat(detector.detect("Titan130 bearing temperature")).contains(TurbineModel.SMT130);
      assertThat(detector.detect("TM-2500 mobile unit")).contains(TurbineModel.TM2500);
    }

    @Test
    @DisplayName("Should return empty for unknown text")
    void shouldReturnEmptyForUnknownText() {
      assertThat(detector.detect("How do I reset the fire alarm panel?")).isEmpty();
      assertThat(detector.detect("")).isEmpty();
      assertThat(detector.detect(null)).isEmpty();
    }
  }

  @Nested
  @DisplayName("Alias strategy")
  class Strategy {

    private final Map<TurbineModel, List<String>> overlapping = overlappingAliases();

    private Map<TurbineModel, List<String>> overlappingAliases() {
      Map<TurbineModel, List<String>> aliases = new LinkedHashMap<>();
      aliases.put(TurbineModel.SMT60, List.of("smt"));
      aliases.put(TurbineModel.SMT130, List.of("smt130"));
      return aliases;
    }

    @Test
    @DisplayName("Declaration order should let the first declared alias win")
    void shouldPreferDeclarationOrder() {
      TurbineModelDetector detector = detector(AliasStrategy.DECLARATION_ORDER, overlapping);

      assertThat(detector.detect("SMT130 compressor wash")).contains(TurbineModel.SMT60);
    }

    @Test
    @DisplayName("Longest match should let the most specific alias win")
    void shouldPreferLongestMatch() {
      TurbineModelDetector detector = detector(AliasStrategy.LONGEST_MATCH, overlapping);

      assertThat(detector.detect("SMT130 compressor wash")).contains(TurbineModel.SMT130);
      assertThat(detector.detect("SMT fleet overview")).contains(TurbineModel.SMT60);
    }

    @Test
    @DisplayName("Configured aliases should be trimmed and matched case-insensitively")
    void shouldNormalizeConfiguredAliases() {
      Map<TurbineModel, List<String>> aliases = new LinkedHashMap<>();
      aliases.put(TurbineModel.TM2500, List.of("  Mobile-Gen  ", ""));
      TurbineModelDetector detector = detector(AliasStrategy.DECLARATION_ORDER, aliases);

      assertThat(detector.detect("the MOBILE-GEN unit")).contains(TurbineModel.TM2500);
      assertThat(detector.detect("the SMT60")).isEmpty();
    }
  }
}
