package com.flamingo.ai.researchtwin.store;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("NamespaceFileNames Tests")
class NamespaceFileNamesTest {

  @Test
  @DisplayName("Should use safe namespace ids unchanged")
  void shouldKeepSafeIds() {
    assertThat(NamespaceFileNames.stem("lab_alice-2")).isEqualTo("lab_alice-2");
  }

  @Test
  @DisplayName("Should give ids that sanitize alike distinct stems")
  void shouldSeparateSanitizedIds() {
    String slash = NamespaceFileNames.stem("lab/alice");
    String space = NamespaceFileNames.stem("lab alice");

    assertThat(slash).startsWith("lab_alice.").isNotEqualTo("lab_alice");
    assertThat(space).startsWith("lab_alice.").isNotEqualTo(slash);
    assertThat(NamespaceFileNames.stem("a.b")).isNotEqualTo("a.b");
  }

  @Test
  @DisplayName("Should give the empty id a hashed stem")
  void shouldHandleEmptyId() {
    assertThat(NamespaceFileNames.stem("")).matches("\\.[0-9a-f]{12}");
  }
}
