package com.phillippitts.presetgraph.domain;

import com.phillippitts.presetgraph.service.template.TemplateResolver;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PipelineTest {

    @Test
    void legacyChainFlowsToNextBlockOnly() {
        Pipeline pipeline = Pipeline.builder("p")
                .block(Block.text("a"))
                .block(Block.text("b"))
                .block(Block.text("c"))
                .build();

        assertThat(pipeline.isLegacyLinear()).isTrue();
        assertThat(pipeline.downstreamOf(0)).containsExactly(1);
        assertThat(pipeline.downstreamOf(1)).containsExactly(2);
        assertThat(pipeline.downstreamOf(2)).isEmpty();
    }

    @Test
    void explicitEdgesAreFollowedInDeclarationOrder() {
        Pipeline pipeline = Pipeline.builder("p")
                .block(Block.inputAdapter())
                .block(Block.text("a"))
                .block(Block.text("b"))
                .block(Block.text("c"))
                .connect(0, 3)
                .connect(0, 1)
                .build();

        assertThat(pipeline.downstreamOf(0)).containsExactly(3, 1);
        // no implicit i+1 once edges exist
        assertThat(pipeline.downstreamOf(1)).isEmpty();
        assertThat(pipeline.downstreamOf(2)).isEmpty();
    }

    @Test
    void builderAssignsIndicesInOrder() {
        Pipeline pipeline = Pipeline.builder("p")
                .block(Block.text("a").id("first"))
                .block(Block.text("b"))
                .build();

        assertThat(pipeline.block(0).index()).isZero();
        assertThat(pipeline.block(0).id()).isEqualTo("first");
        assertThat(pipeline.block(1).index()).isEqualTo(1);
        assertThat(pipeline.block(1).id()).isNotBlank();
    }

    @Test
    void countsVisibleBlocksBeforeIndex() {
        Pipeline pipeline = Pipeline.builder("p")
                .block(Block.text("a"))
                .block(Block.text("b").showOverlay(false))
                .block(Block.text("c"))
                .block(Block.text("d"))
                .build();

        assertThat(pipeline.visibleCountBefore(0)).isZero();
        assertThat(pipeline.visibleCountBefore(2)).isEqualTo(1);
        assertThat(pipeline.visibleCountBefore(3)).isEqualTo(2);
    }

    @Test
    void onlyLoneImageBlockIsSingleImagePreset() {
        Pipeline single = Pipeline.builder("p").block(Block.image("v")).build();
        Pipeline chained = Pipeline.builder("p").block(Block.inputAdapter()).block(Block.image("v")).build();

        assertThat(single.isSingleImageBlock()).isTrue();
        assertThat(chained.isSingleImageBlock()).isFalse();
    }

    @Test
    void markdownBlocksNeverStream() {
        Block markdown = Block.text("m").renderMode(RenderMode.MARKDOWN).streamingEnabled(true).build();
        Block plain = Block.text("m").build();

        assertThat(markdown.effectiveStreaming()).isFalse();
        assertThat(plain.effectiveStreaming()).isTrue();
        assertThat(Block.image("v").build().effectiveStreaming()).isFalse();
    }

    @Test
    void blockIsImmutable() {
        Block block = Block.text("m").languageVars(Map.of("language1", "Korean")).build();

        assertThatThrownBy(() -> block.languageVars().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void languageVarsKeepBuilderOrderAndBlankOutNullValues() {
        Block block = Block.text("m")
                .languageVar("language2", "German")
                .languageVar("language1", null)
                .languageVar("tone", "formal")
                .build();

        assertThat(block.languageVars()).containsExactly(
                Map.entry("language2", "German"),
                Map.entry("language1", ""),
                Map.entry("tone", "formal"));
    }

    @Test
    void substitutionFollowsLanguageVarOrder() {
        Block nested = Block.text("m")
                .prompt("Use {style}.")
                .languageVar("style", "{tone} prose")
                .languageVar("tone", "formal")
                .build();

        assertThat(TemplateResolver.resolve(nested.promptTemplate(), nested.languageVars(), nested.selectedLanguage()))
                .isEqualTo("Use formal prose.");
    }

    @Test
    void initialContextCopiesBytes() {
        byte[] bytes = {1, 2};
        InitialContext ctx = InitialContext.image(bytes);
        bytes[0] = 9;

        assertThat(ctx.bytes()).containsExactly(1, 2);
        assertThat(ctx.isImage()).isTrue();
        assertThat(InitialContext.none().isNone()).isTrue();
        assertThat(InitialContext.audio(new byte[4]).kind()).isEqualTo(InitialContext.Kind.AUDIO);
    }
}
