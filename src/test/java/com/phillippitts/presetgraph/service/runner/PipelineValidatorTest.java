package com.phillippitts.presetgraph.service.runner;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.domain.BlockKind;
import com.phillippitts.presetgraph.domain.Edge;
import com.phillippitts.presetgraph.domain.Pipeline;
import com.phillippitts.presetgraph.exception.InvalidPipelineException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineValidatorTest {

    private final PipelineValidator validator = new PipelineValidator();

    @Test
    void acceptsLegacyChainAndDag() {
        Pipeline chain = Pipeline.builder("chain").block(Block.text("a")).block(Block.text("b")).build();
        Pipeline dag = Pipeline.builder("dag")
                .block(Block.inputAdapter())
                .block(Block.text("a"))
                .block(Block.text("b"))
                .block(Block.text("c"))
                .connect(0, 1).connect(0, 2).connect(1, 3).connect(2, 3)
                .build();

        assertThatCode(() -> validator.validate(chain)).doesNotThrowAnyException();
        assertThatCode(() -> validator.validate(dag)).doesNotThrowAnyException();
    }

    @Test
    void acceptsEdgePastLastBlock() {
        Pipeline pipeline = Pipeline.builder("dangling").block(Block.text("a")).connect(0, 3).build();

        assertThatCode(() -> validator.validate(pipeline)).doesNotThrowAnyException();
    }

    @Test
    void rejectsEmptyPipeline() {
        assertThatThrownBy(() -> validator.validate(new Pipeline(List.of(), List.of(), "empty")))
                .isInstanceOf(InvalidPipelineException.class)
                .hasMessageContaining("no blocks");
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(InvalidPipelineException.class);
    }

    @Test
    void rejectsIndexMismatch() {
        Block misplaced = Block.builder(BlockKind.TEXT).id("b").index(5).build();
        Pipeline pipeline = new Pipeline(List.of(Block.text("a").id("a").index(0).build(), misplaced), List.of(), "p");

        assertThatThrownBy(() -> validator.validate(pipeline))
                .isInstanceOf(InvalidPipelineException.class)
                .hasMessageContaining("position 1");
    }

    @Test
    void rejectsDuplicateIds() {
        Pipeline pipeline = Pipeline.builder("dup")
                .block(Block.text("a").id("same"))
                .block(Block.text("b").id("same"))
                .build();

        assertThatThrownBy(() -> validator.validate(pipeline))
                .isInstanceOf(InvalidPipelineException.class)
                .hasMessageContaining("duplicate block id same");
    }

    @Test
    void rejectsSelfLoopAndNegativeEndpoints() {
        Pipeline selfLoop = Pipeline.builder("loop").block(Block.text("a")).connect(0, 0).build();
        Pipeline negative = new Pipeline(List.of(Block.text("a").build()), List.of(new Edge(0, -1)), "neg");

        assertThatThrownBy(() -> validator.validate(selfLoop)).hasMessageContaining("self-loop");
        assertThatThrownBy(() -> validator.validate(negative)).hasMessageContaining("negative");
    }

    @Test
    void rejectsCycleAndReportsIt() {
        Pipeline pipeline = Pipeline.builder("cycle")
                .block(Block.text("a"))
                .block(Block.text("b"))
                .block(Block.text("c"))
                .connect(0, 1).connect(1, 2).connect(2, 1)
                .build();

        assertThat(validator.findCycle(pipeline)).containsExactly(1, 2, 1);
        assertThatThrownBy(() -> validator.validate(pipeline))
                .isInstanceOf(InvalidPipelineException.class)
                .hasMessageEndingWith("cycle [1, 2, 1]");
    }
}
