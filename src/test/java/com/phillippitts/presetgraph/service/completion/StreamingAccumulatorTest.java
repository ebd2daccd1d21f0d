package com.phillippitts.presetgraph.service.completion;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StreamingAccumulatorTest {

    @Test
    void wipeMarkerRestartsAccumulation() {
        String state = "";
        for (String raw : List.of("A", "B", StreamChunk.WIPE_SIGNAL + "C", "D")) {
            state = StreamingAccumulator.applyChunk(state, raw);
        }

        assertThat(state).isEqualTo("CD");
    }

    @Test
    void typedChunksAccumulateInOrder() {
        StreamingAccumulator acc = new StreamingAccumulator();

        acc.apply(StreamChunk.append("Hel"));
        String text = acc.apply(StreamChunk.append("lo"));

        assertThat(text).isEqualTo("Hello");
        assertThat(acc.current()).isEqualTo("Hello");
    }

    @Test
    void resetChunkReplacesText() {
        StreamingAccumulator acc = new StreamingAccumulator();
        acc.apply(StreamChunk.append("draft"));

        assertThat(acc.apply(StreamChunk.reset("final"))).isEqualTo("final");
    }

    @Test
    void clearDiscardsEverything() {
        StreamingAccumulator acc = new StreamingAccumulator();
        acc.apply(StreamChunk.append("partial"));

        acc.clear();

        assertThat(acc.current()).isEmpty();
    }

    @Test
    void decodesRawChunks() {
        assertThat(StreamChunk.fromRaw(StreamChunk.WIPE_SIGNAL + "x")).isEqualTo(StreamChunk.reset("x"));
        assertThat(StreamChunk.fromRaw("x")).isEqualTo(StreamChunk.append("x"));
        assertThat(StreamChunk.fromRaw(null)).isEqualTo(StreamChunk.append(""));
    }

    @Test
    void rawChunkAdapterDecodesWipe() {
        StreamingAccumulator acc = new StreamingAccumulator();

        var consumer = CompletionProvider.rawChunks(acc::apply);
        consumer.accept("old");
        consumer.accept(StreamChunk.WIPE_SIGNAL + "new");

        assertThat(acc.current()).isEqualTo("new");
    }
}
