package dev.archivist.store;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentHasherTest {

  @Test
  void hashOfKnownInputMatchesExpected() {
    assertThat(ContentHasher.sha256("hello".getBytes(StandardCharsets.UTF_8)))
        .isEqualTo("2cf24dba5fb0a30e26e83b2ac5b9e29e1b161e5c1fa7425e73043362938b9824");
  }

  @Test
  void hashIsLongEnoughForTheFilenamePrefix() {
    String hash = ContentHasher.sha256("Zürich résumé".getBytes(StandardCharsets.UTF_8));

    assertThat(hash).hasSize(64).matches("[0-9a-f]+");
    assertThat(hash.length()).isGreaterThan(ContentHasher.FILENAME_HASH_LENGTH);
  }

  @Test
  void emptyInputProducesValidHash() {
    assertThat(ContentHasher.sha256(new byte[0]))
        .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
  }
}
