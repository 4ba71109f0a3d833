package com.flamingo.ai.opsguru.service.rag.retrieval;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import java.time.Duration;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/**
 * Pre-signed S3 GET links to the source manuals, anchored to the cited page. Returns null when no
 * bucket is configured or signing fails.
 */
@Component
@Slf4j
public class S3DocumentLinkResolver implements DocumentLinkResolver {

  private final Optional<S3Presigner> presigner;
  private final OpsGuruProperties.Documents config;

  public S3DocumentLinkResolver(Optional<S3Presigner> presigner, OpsGuruProperties properties) {
    this.presigner = presigner;
    this.config = properties.getDocuments();
  }

  @Override
  public String resolve(String source, Integer page) {
    if (presigner.isEmpty() || isBlank(config.getBucket()) || isBlank(source)) {
      return null;
    }
    try {
      GetObjectPresignRequest request =
          GetObjectPresignRequest.builder()
              .signatureDuration(Duration.ofMinutes(config.getLinkTtlMinutes()))
              .getObjectRequest(
                  GetObjectRequest.builder().bucket(config.getBucket()).key(source).build())
              .build();
      String url = presigner.get().presignGetObject(request).url().toString();
      return page != null && page > 0 ? url + "#page=" + page : url;
    } catch (RuntimeException e) {
      log.warn("Failed to sign document link for {}: {}", source, e.getMessage());
      return null;
    }
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
