package dev.archivist.ingestion.chat;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;

class ChatThreadsTest {

    @Test
    void repliesJoinTheirRootInChronologicalOrder() {
        List<List<ChatMessage>> threads = ChatThreads.group(List.of(
                new ChatMessage("300.0", "U1", "late reply", "100.0", 0),
                new ChatMessage("200.0", "U2", "standalone", null, 0),
                new ChatMessage("100.0", "U1", "root", null, 1),
                new ChatMessage("150.0", "U2", "early reply", "100.0", 0)));

        assertThat(threads).hasSize(2);
        assertThat(threads.get(0)).extracting(ChatMessage::text)
                .containsExactly("root", "early reply", "late reply");
        assertThat(threads.get(1)).extracting(ChatMessage::text).containsExactly("standalone");
    }

    @Test
    void duplicateTimestampsWithinAThreadAreDropped() {
        List<List<ChatMessage>> threads = ChatThreads.group(List.of(
                new ChatMessage("100.0", "U1", "root", null, 1),
                new ChatMessage("100.0", "U1", "root", "100.0", 1),
                new ChatMessage("110.0", "U2", "reply", "100.0", 0)));

        assertThat(threads).singleElement().satisfies(thread ->
                assertThat(thread).extracting(ChatMessage::ts).containsExactly("100.0", "110.0"));
    }

    @Test
    void timestampsCompareNumericallyNotLexically() {
        List<List<ChatMessage>> threads = ChatThreads.group(List.of(
                new ChatMessage("1000.0", "U1", "later", null, 0),
                new ChatMessage("999.5", "U1", "earlier", null, 0)));

        assertThat(threads).extracting(t -> t.get(0).text()).containsExactly("earlier", "later");
    }
}
