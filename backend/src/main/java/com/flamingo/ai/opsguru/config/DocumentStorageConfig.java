package com.flamingo.ai.opsguru.config;

import java.net.URI;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/** S3 presigner for links to the source manuals. Only created when a bucket is configured. */
@Configuration
@ConditionalOnExpression("!'${opsguru.documents.bucket:}'.isBlank()")
public class DocumentStorageConfig {

  @Bean(destroyMethod = "close")
  public S3Presigner s3Presigner(OpsGuruProperties properties) {
    OpsGuruProperties.Documents documents = properties.getDocuments();
    S3Presigner.Builder builder = S3Presigner.builder().region(Region.of(documents.getRegion()));
    if (documents.getEndpoint() != null && !documents.getEndpoint().isBlank()) {
      builder.endpointOverride(URI.create(documents.getEndpoint()));
    }
    return builder.build();
  }
}
