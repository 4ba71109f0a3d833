package com.flamingo.ai.opsguru.config;

import com.flamingo.ai.opsguru.domain.enums.TurbineModel;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the OpsGuru answering pipeline. */
@Configuration
@ConfigurationProperties(prefix = "opsguru")
@Getter
@Setter
public class OpsGuruProperties {

  private Detection detection = new Detection();
  private Retrieval retrieval = new Retrieval();
  private Telemetry telemetry = new Telemetry();
  private Reasoning reasoning = new Reasoning();
  private Guardrail guardrail = new Guardrail();
  private Validation validation = new Validation();
  private Session session = new Session();
  private Documents documents = new Documents();

  @Getter
  @Setter
  public static class Detection {
    /** How to choose between several aliases found in the same text. */
    private AliasStrategy strategy = AliasStrategy.DECLARATION_ORDER;

    /** Ordered alias table. Empty means the built-in aliases of {@link TurbineModel}. */
    private Map<TurbineModel, List<String>> aliases = new LinkedHashMap<>();

    public enum AliasStrategy {
      DECLARATION_ORDER,
      LONGEST_MATCH
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    private String indexName = "turbine-documents";
    private int topK = 5;
    private int maxTopK = 20;
    private int candidatesMultiplier = 4;

    /** Restrict the search to chunks tagged with the detected turbine model. */
    private boolean filterByTurbineModel = true;

    /** Number of chunks fetched on each side of a hit. */
    private int neighborWindow = 1;

    private int excerptMaxChars = 500;
    private int neighborExcerptMaxChars = 300;
    private int searchTimeoutSeconds = 25;
  }

  @Getter
  @Setter
  public static class Telemetry {
    private boolean enabled = false;
    private String endpoint;
    private List<String> variables = new ArrayList<>(List.of("oil_pressure", "exhaust_temp"));
    private int lookbackMinutes = 60;
    private int timeoutMs = 5000;
  }

  @Getter
  @Setter
  public static class Reasoning {
    /** Model key that wins over {@code defaultModel}, usually bound from OPSGURU_MODEL. */
    private String modelOverride;

    private String defaultModel = "nova-pro";
    private String fallbackModel;
    private int historyTurns = 5;
    private Map<String, Model> models = new LinkedHashMap<>();

    @Getter
    @Setter
    public static class Model {
      private String displayName;
      private BackendType backend = BackendType.MANAGED;
      private String modelId;
      private int maxTokens = 2048;
      private double temperature = 0.7;

      // external backends only
      private String endpoint;
      private String apiKeyEnv;
      private List<String> requiredEnv = new ArrayList<>();
      private int timeoutMs = 30000;
    }

    public enum BackendType {
      MANAGED,
      EXTERNAL
    }
  }

  @Getter
  @Setter
  public static class Guardrail {
    /** Guardrail provider: "none" (default), "http" or "llm". */
    private String provider = "none";

    private String endpoint;
    private String apiKeyEnv;
    private int timeoutMs = 5000;
  }

  @Getter
  @Setter
  public static class Validation {
    private double noCitationConfidence = 0.4;
    private double citationBaseConfidence = 0.55;
    private double relevanceWeight = 0.35;
    private double telemetryBonus = 0.05;
    private double maxConfidence = 0.98;
    private double minConfidence = 0.6;
  }

  @Getter
  @Setter
  public static class Session {
    private int ttlDays = 30;
    private String purgeCron = "0 0 * * * *";
  }

  @Getter
  @Setter
  public static class Documents {
    /** Bucket holding the source manuals. Blank disables citation links. */
    private String bucket;

    private String region = "us-east-1";

    /** Custom S3 endpoint, e.g. a MinIO or LocalStack URL. */
    private String endpoint;

    private int linkTtlMinutes = 60;
  }
}
