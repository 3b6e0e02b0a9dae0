package com.flamingo.ai.researchtwin.config;

import com.flamingo.ai.researchtwin.domain.enums.SourceRole;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the retrieval, deduplication and evidence pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Storage storage = new Storage();
  private Chunking chunking = new Chunking();
  private Dedup dedup = new Dedup();
  private Retrieval retrieval = new Retrieval();
  private Diversity diversity = new Diversity();
  private Agent agent = new Agent();

  @Getter
  @Setter
  public static class Storage {
    /** Directory holding one JSON snapshot per namespace. */
    private String basePath = "data/rag";

    private int writeRetries = 3;
  }

  @Getter
  @Setter
  public static class Chunking {
    private Window publication = new Window(900, 140);
    private Window thesis = new Window(1200, 180);
    private Window fallback = new Window(900, 150);

    /**
     * Resolves the chunk window for a source role. Invalid sizes (non-positive) or overlaps
     * (negative) fall back to the role defaults.
     */
    public Window forRole(SourceRole role) {
      return switch (role) {
        case PUBLICATION -> publication.orDefault(900, 140);
        case THESIS -> thesis.orDefault(1200, 180);
        default -> fallback.orDefault(900, 150);
      };
    }
  }

  @Getter
  @Setter
  public static class Window {
    private int size;
    private int overlap;

    public Window() {}

    public Window(int size, int overlap) {
      this.size = size;
      this.overlap = overlap;
    }

    Window orDefault(int defaultSize, int defaultOverlap) {
      return new Window(size > 0 ? size : defaultSize, overlap >= 0 ? overlap : defaultOverlap);
    }
  }

  /** Thesis-vs-publication duplicate detection thresholds. All values are read clamped to [0,1]. */
  @Setter
  public static class Dedup {
    private double cosineThreshold = 0.96;
    private double lexicalThreshold = 0.85;
    private double novelSentenceThreshold = 0.2;

    /** Score penalty applied at ranking time to redundant thesis chunks. */
    private double redundantThesisPenalty = 0.08;

    public double getCosineThreshold() {
      return clamp01(cosineThreshold);
    }

    public double getLexicalThreshold() {
      return clamp01(lexicalThreshold);
    }

    public double getNovelSentenceThreshold() {
      return clamp01(novelSentenceThreshold);
    }

    public double getRedundantThesisPenalty() {
      return clamp01(redundantThesisPenalty);
    }

    static double clamp01(double value) {
      if (!Double.isFinite(value) || value < 0) {
        return 0;
      }
      return Math.min(1, value);
    }
  }

  @Getter
  @Setter
  public static class Retrieval {
    private int defaultTopK = 5;

    /** Per-document bounds for the paper-specific hard filter. */
    private int paperSpecificMinPerDocument = 2;

    private int paperSpecificMaxPerDocument = 4;

    /** Maximum number of mentioned publications a comparison retrieves from. */
    private int maxCompareTargets = 4;
  }

  @Getter
  @Setter
  public static class Diversity {
    private int maxChunksPerDocument = 2;
  }

  @Getter
  @Setter
  public static class Agent {
    /** Namespace used when a request names none. */
    private String defaultNamespace = "default";

    private String persona = "the researcher";
    private int maxCitationHints = 8;
    private int maxFollowups = 5;
  }
}
