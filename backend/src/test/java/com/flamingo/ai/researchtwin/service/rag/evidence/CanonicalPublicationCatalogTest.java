package com.flamingo.ai.researchtwin.service.rag.evidence;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.researchtwin.domain.model.DocumentMetadata;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("CanonicalPublicationCatalog Tests")
class CanonicalPublicationCatalogTest {

  private final CanonicalPublicationCatalog catalog =
      new CanonicalPublicationCatalog(new ObjectMapper());

  @Test
  @DisplayName("Should load the bundled catalog")
  void shouldLoadBundledCatalog() {
    assertThat(catalog.getPublications()).hasSize(9);
    assertThat(catalog.getPublications())
        .extracting(CanonicalPublication::venue)
        .contains("WACV", "TMLR", "BMVC");
  }

  @Nested
  @DisplayName("File name resolution")
  class FileNameResolution {

    @Test
    @DisplayName("Should resolve by exact file name alias")
    void shouldResolveByFileNameAlias() {
      assertThat(catalog.resolveByFileName("PhishNet_WACV_2024.pdf"))
          .get()
          .extracting(CanonicalPublication::year)
          .isEqualTo("2024");
    }

    @Test
    @DisplayName("Should resolve by short alias equal to the stem")
    void shouldResolveByStem() {
      assertThat(catalog.resolveByFileName("dss.pdf"))
          .get()
          .extracting(CanonicalPublication::title)
          .isEqualTo("A Simple Signal for Domain Shift");
    }

    @Test
    @DisplayName("Should resolve by long alias contained in the file name")
    void shouldResolveByContainedAlias() {
      assertThat(catalog.resolveByFileName("my_rosita_camera_ready.pdf"))
          .get()
          .extracting(CanonicalPublication::venue)
          .isEqualTo("TMLR");
    }

    @Test
    @DisplayName("Should not resolve unknown or blank names")
    void shouldNotResolveUnknownNames() {
      assertThat(catalog.resolveByFileName("lab_notes.txt")).isEmpty();
      assertThat(catalog.resolveByFileName(" ")).isEmpty();
      assertThat(catalog.resolveByFileName(null)).isEmpty();
    }
  }

  @Test
  @DisplayName("Should resolve from the first matching candidate, skipping nulls")
  void shouldResolveFromCandidates() {
    assertThat(
            catalog.resolveFromCandidates(
                Arrays.asList(
                    null,
                    "unrelated",
                    "SANTA: Source Anchoring Network and Target Alignment for Continual Test Time"
                        + " Adaptation")))
        .get()
        .extracting(CanonicalPublication::year)
        .isEqualTo("2023");
    assertThat(catalog.resolveFromCandidates(List.of())).isEmpty();
  }

  @Nested
  @DisplayName("Metadata enrichment")
  class MetadataEnrichment {

    @Test
    @DisplayName("Should fill missing fields and keep provided ones")
    void shouldFillMissingFields() {
      DocumentMetadata metadata =
          catalog.withCanonicalMetadata(
              "pSTarC_WACV_2024.pdf",
              DocumentMetadata.builder().title("My preferred title").section("Intro").build());

      assertThat(metadata.getTitle()).isEqualTo("My preferred title");
      assertThat(metadata.getVenue()).isEqualTo("WACV");
      assertThat(metadata.getYear()).isEqualTo("2024");
      assertThat(metadata.getSection()).isEqualTo("Intro");
      assertThat(metadata.getCanonicalCitation())
          .isEqualTo(
              "pSTarC: Pseudo Source Guided Target Clustering for Fully Test-Time Adaptation"
                  + " (WACV 2024)");
    }

    @Test
    @DisplayName("Should create metadata for known papers uploaded without any")
    void shouldCreateMetadataWhenAbsent() {
      DocumentMetadata metadata = catalog.withCanonicalMetadata("jumpstyle.pdf", null);

      assertThat(metadata.getTitle())
          .isEqualTo("JumpStyle: A Framework for Data-Efficient Online Adaptation");
      assertThat(metadata.getVenue()).isEqualTo("ICLRW");
    }

    @Test
    @DisplayName("Should leave metadata of unknown files unchanged")
    void shouldLeaveUnknownFilesUnchanged() {
      DocumentMetadata original = DocumentMetadata.builder().title("Notes").build();

      assertThat(catalog.withCanonicalMetadata("notes.txt", original)).isSameAs(original);
      assertThat(catalog.withCanonicalMetadata("notes.txt", null)).isNull();
    }
  }
}
