package com.flamingo.ai.opsguru.service.rag.retrieval;

import com.flamingo.ai.opsguru.config.OpsGuruProperties;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Builds the context block handed to the reasoning model. Each hit becomes a header line naming
 * source, page and section, followed by the hit text and indented excerpts of its neighbouring
 * chunks. Blocks are separated by a blank line.
 */
@Component
public class HierarchicalContextAssembler {

  public static final String NO_RESULTS_CONTEXT =
      "No relevant documentation found in the knowledge base.";

  private final int neighborExcerptMaxChars;

  public HierarchicalContextAssembler(OpsGuruProperties properties) {
    this.neighborExcerptMaxChars = properties.getRetrieval().getNeighborExcerptMaxChars();
  }

  public String assemble(List<RetrievalHit> hits) {
    if (hits == null || hits.isEmpty()) {
      return NO_RESULTS_CONTEXT;
    }

    List<String> blocks = new ArrayList<>(hits.size());
    for (int i = 0; i < hits.size(); i++) {
      RetrievalHit hit = hits.get(i);
      StringBuilder block = new StringBuilder();
      block.append(header(i + 1, hit)).append('\n');
      block.append(hit.content() == null ? "" : hit.content().strip());
      for (RetrievalHit neighbor : hit.neighbors()) {
        block.append('\n').append("    ");
        if (neighbor.chunkIndex() != null) {
          block.append("[chunk ").append(neighbor.chunkIndex()).append("] ");
        }
        block.append(
            CitationFormatter.truncate(
                flatten(neighbor.content()), neighborExcerptMaxChars));
      }
      blocks.add(block.toString());
    }
    return String.join("\n\n", blocks);
  }

  private static String header(int rank, RetrievalHit hit) {
    StringBuilder header = new StringBuilder("[Source ").append(rank).append(": ");
    header.append(hit.source() == null ? "unknown" : hit.source());
    if (hit.page() != null) {
      header.append(" | Page ").append(hit.page());
    }
    if (hit.sectionPath() != null && !hit.sectionPath().isBlank()) {
      header.append(" | Section: ").append(hit.sectionPath());
    }
    return header.append(']').toString();
  }

  private static String flatten(String text) {
    return text == null ? "" : text.strip().replaceAll("\\s+", " ");
  }
}
