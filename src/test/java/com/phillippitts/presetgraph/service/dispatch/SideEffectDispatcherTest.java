package com.phillippitts.presetgraph.service.dispatch;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.domain.InitialContext;
import com.phillippitts.presetgraph.service.events.SideEffectFailedEvent;
import com.phillippitts.presetgraph.service.sink.EditingSurface;
import com.phillippitts.presetgraph.service.sink.RefineSurface;
import com.phillippitts.presetgraph.testutil.EventCapturingPublisher;
import com.phillippitts.presetgraph.testutil.RecordingSideEffects;
import com.phillippitts.presetgraph.testutil.SyncExecutor;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SideEffectDispatcherTest {

    private static final byte[] IMAGE = {9, 8, 7, 6};

    static class FakeEditor implements EditingSurface {
        final List<String> events = new ArrayList<>();

        @Override
        public boolean isActive() {
            return true;
        }

        @Override
        public void insertText(String text) {
            events.add("insert:" + text);
        }

        @Override
        public void refocus() {
            events.add("refocus");
        }
    }

    static class FakeRefine implements RefineSurface {
        final List<String> texts = new ArrayList<>();

        @Override
        public boolean isActive() {
            return true;
        }

        @Override
        public void setText(String text) {
            texts.add(text);
        }
    }

    private final RecordingSideEffects effects = new RecordingSideEffects();
    private final EventCapturingPublisher events = new EventCapturingPublisher();

    @Test
    void processedTextIsCopiedBadgedAndPasted() {
        Block block = Block.text("m").autoCopy(true).autoPaste(true).build();

        dispatcher().dispatch(request(block, "result", InitialContext.none(), false));

        assertThat(effects.log()).containsExactly("copy-text:result", "badge:TEXT_COPIED", "paste:result");
    }

    @Test
    void adapterCopiesImageAndPastesItWhenTextIsEmpty() {
        Block block = Block.inputAdapter().autoCopy(true).autoPaste(true).build();

        dispatcher().dispatch(request(block, "", InitialContext.image(IMAGE), false));

        assertThat(effects.log()).containsExactly("copy-image:4", "badge:IMAGE_COPIED", "paste:<image>");
    }

    @Test
    void adapterTextCopyShowsNoBadgeAndIsNotPasted() {
        Block block = Block.inputAdapter().autoCopy(true).autoPaste(true).build();

        dispatcher().dispatch(request(block, "captured", InitialContext.none(), false));

        assertThat(effects.log()).containsExactly("copy-text:captured");
    }

    @Test
    void adapterWithTextAndImageCopiesBothAndPastesText() {
        Block block = Block.inputAdapter().autoCopy(true).autoPaste(true).build();

        dispatcher().dispatch(request(block, "caption", InitialContext.image(IMAGE), false));

        assertThat(effects.log()).containsExactly("copy-image:4", "copy-text:caption", "paste:caption");
    }

    @Test
    void adapterWithTextAndImageInjectsTextIntoActiveEditor() {
        Block block = Block.inputAdapter().autoCopy(true).autoPaste(true).autoPasteNewline(true).build();
        FakeEditor editor = new FakeEditor();

        dispatcher(editor, RefineSurface.INACTIVE)
                .dispatch(request(block, "caption", InitialContext.image(IMAGE), false));

        assertThat(editor.events).containsExactly("insert:caption\n", "refocus");
        assertThat(effects.entries("paste:")).isEmpty();
    }

    @Test
    void pasteWithoutCopyIsIgnored() {
        Block block = Block.text("m").autoPaste(true).build();

        dispatcher().dispatch(request(block, "result", InitialContext.none(), false));

        assertThat(effects.log()).isEmpty();
    }

    @Test
    void runLevelSwitchSuppressesPaste() {
        Block block = Block.text("m").autoCopy(true).autoPaste(true).build();

        dispatcher().dispatch(request(block, "result", InitialContext.none(), true));

        assertThat(effects.log()).containsExactly("copy-text:result", "badge:TEXT_COPIED");
    }

    @Test
    void activeEditorReceivesTextWithOptionalNewline() {
        Block block = Block.text("m").autoCopy(true).autoPaste(true).autoPasteNewline(true).build();
        FakeEditor editor = new FakeEditor();

        dispatcher(editor, RefineSurface.INACTIVE).dispatch(request(block, "line", InitialContext.none(), false));

        assertThat(editor.events).containsExactly("insert:line\n", "refocus");
        assertThat(effects.entries("paste:")).isEmpty();
    }

    @Test
    void activeRefineSurfaceReceivesTextWhenNoEditor() {
        Block block = Block.text("m").autoCopy(true).autoPaste(true).autoPasteNewline(true).build();
        FakeRefine refine = new FakeRefine();

        dispatcher(EditingSurface.INACTIVE, refine).dispatch(request(block, "refined", InitialContext.none(), false));

        assertThat(refine.texts).containsExactly("refined\n");
        assertThat(effects.entries("paste:")).isEmpty();
    }

    @Test
    void speaksNonBlankText() {
        Block block = Block.text("m").autoSpeak(true).build();

        dispatcher().dispatch(request(block, "hello", InitialContext.none(), false));
        dispatcher().dispatch(request(block, "   ", InitialContext.none(), false));

        assertThat(effects.log()).containsExactly("speak:hello");
    }

    @Test
    void failingCopyIsReportedAndLaterActionsStillRun() {
        Block block = Block.text("m").autoCopy(true).autoPaste(true).autoSpeak(true).build();
        effects.failTextCopyWith(new IllegalStateException("clipboard busy"));

        dispatcher().dispatch(request(block, "result", InitialContext.none(), false));

        assertThat(effects.log()).containsExactly("paste:result", "speak:result");
        List<SideEffectFailedEvent> failures = events.eventsOf(SideEffectFailedEvent.class);
        assertThat(failures).hasSize(1);
        assertThat(failures.get(0).action()).isEqualTo(SideEffectDispatcher.ACTION_COPY_TEXT);
        assertThat(failures.get(0).reason()).isEqualTo("IllegalStateException");
        assertThat(failures.get(0).runId()).isEqualTo("run-1");
    }

    @Test
    void historyStoresTextBlocksWithTheirInput() {
        Block block = Block.text("m").build();

        dispatcher().saveHistory(request(block, "answer", InitialContext.none(), false), "question");

        assertThat(effects.log()).containsExactly("history-text:answer|question");
    }

    @Test
    void historyStoresImageBlocksWithTheImage() {
        Block block = Block.image("v").build();

        dispatcher().saveHistory(request(block, "caption", InitialContext.image(IMAGE), false), "");

        assertThat(effects.log()).containsExactly("history-image:4|caption");
    }

    @Test
    void historySkipsHiddenBlankAndAdapterResults() {
        SideEffectDispatcher dispatcher = dispatcher();

        dispatcher.saveHistory(request(Block.text("m").showOverlay(false).build(), "x", InitialContext.none(), false), "in");
        dispatcher.saveHistory(request(Block.text("m").build(), " \n", InitialContext.none(), false), "in");
        dispatcher.saveHistory(request(Block.inputAdapter().build(), "in", InitialContext.none(), false), "in");

        assertThat(effects.log()).isEmpty();
    }

    private SideEffectDispatcher dispatcher() {
        return dispatcher(EditingSurface.INACTIVE, RefineSurface.INACTIVE);
    }

    private SideEffectDispatcher dispatcher(EditingSurface editor, RefineSurface refine) {
        return new SideEffectDispatcher(new SyncExecutor(), effects, effects, editor, refine,
                effects, effects, effects, events, 0, 0);
    }

    private static SideEffectRequest request(Block block, String text, InitialContext context, boolean disablePaste) {
        return new SideEffectRequest("run-1", block, text, context, disablePaste);
    }
}
