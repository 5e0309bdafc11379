package dev.archivist.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.archivist.metadata.SourceType;
import org.junit.jupiter.api.Test;

class BatchHandleTest {

  @Test
  void parsesSourceTypeAndBatchId() {
    BatchHandle handle = BatchHandle.parse("wiki/20260115_100000_123_space_ENG");

    assertThat(handle.sourceType()).isEqualTo(SourceType.WIKI);
    assertThat(handle.batchId()).isEqualTo("20260115_100000_123_space_ENG");
    assertThat(handle).hasToString("wiki/20260115_100000_123_space_ENG");
  }

  @Test
  void serializesAsPlainString() throws Exception {
    ObjectMapper mapper = ArchiveJson.newMapper();
    BatchHandle handle = new BatchHandle(SourceType.PDF, "20260115_100000_123");

    String json = mapper.writeValueAsString(handle);

    assertThat(json).isEqualTo("\"pdf/20260115_100000_123\"");
    assertThat(mapper.readValue(json, BatchHandle.class)).isEqualTo(handle);
  }

  @Test
  void rejectsPathTraversal() {
    assertThatThrownBy(() -> BatchHandle.parse("text/../secrets"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BatchHandle(SourceType.TEXT, ".."))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void rejectsUnknownPartitionAndMissingSlash() {
    assertThatThrownBy(() -> BatchHandle.parse("unknown/20260115"))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> BatchHandle.parse("20260115"))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void sanitizeReplacesEverythingButWordCharacters() {
    assertThat(ArchiveJson.sanitize("Q3 Report/final.v2")).isEqualTo("Q3_Report_final_v2");
  }
}
