package com.phillippitts.presetgraph.service.dispatch;

import com.phillippitts.presetgraph.domain.Block;
import com.phillippitts.presetgraph.domain.BlockKind;
import com.phillippitts.presetgraph.service.events.SideEffectFailedEvent;
import com.phillippitts.presetgraph.service.sink.ClipboardSink;
import com.phillippitts.presetgraph.service.sink.EditingSurface;
import com.phillippitts.presetgraph.service.sink.HistorySink;
import com.phillippitts.presetgraph.service.sink.NotificationSink;
import com.phillippitts.presetgraph.service.sink.PasteSink;
import com.phillippitts.presetgraph.service.sink.RefineSurface;
import com.phillippitts.presetgraph.service.sink.SpeechSink;
import com.phillippitts.presetgraph.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Fires copy, paste, speech and history actions after a node has produced its result.
 *
 * <p>Everything runs on the side-effect executor so the graph walk never waits. Copy and the
 * paste that depends on it run in the same task, copy first. A failing sink is logged and
 * reported as a {@link SideEffectFailedEvent}; later actions of the same task still run.
 *
 * <p>Rules, driven by the block flags:
 * <ul>
 *   <li>auto-copy: an input adapter copies the captured image; non-empty text is copied
 *       as well. One badge is shown: the text badge for processed text (never for adapters),
 *       else the image badge for an adapter image copy.</li>
 *   <li>auto-paste: only for processed text or an adapter image copy, after a settle delay.
 *       Whenever there is text (an adapter with a copied image included) it goes to an
 *       active editing surface, else the active refine surface, else a generic paste. A
 *       paste with no text always uses the generic paste.</li>
 *   <li>auto-speak: non-empty text is spoken after a short delay.</li>
 * </ul>
 */
public class SideEffectDispatcher {

    private static final Logger LOG = LogManager.getLogger(SideEffectDispatcher.class);

    static final String ACTION_COPY_TEXT = "copy-text";
    static final String ACTION_COPY_IMAGE = "copy-image";
    static final String ACTION_BADGE = "badge";
    static final String ACTION_PASTE = "paste";
    static final String ACTION_SPEAK = "speak";
    static final String ACTION_HISTORY = "history";

    private final Executor executor;
    private final ClipboardSink clipboard;
    private final PasteSink paste;
    private final EditingSurface editingSurface;
    private final RefineSurface refineSurface;
    private final SpeechSink speech;
    private final NotificationSink notifications;
    private final HistorySink history;
    private final ApplicationEventPublisher publisher;
    private final long pasteSettleDelayMs;
    private final long speakDelayMs;

    public SideEffectDispatcher(Executor executor,
                                ClipboardSink clipboard,
                                PasteSink paste,
                                EditingSurface editingSurface,
                                RefineSurface refineSurface,
                                SpeechSink speech,
                                NotificationSink notifications,
                                HistorySink history,
                                ApplicationEventPublisher publisher,
                                long pasteSettleDelayMs,
                                long speakDelayMs) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.clipboard = Objects.requireNonNull(clipboard, "clipboard must not be null");
        this.paste = Objects.requireNonNull(paste, "paste must not be null");
        this.editingSurface = Objects.requireNonNull(editingSurface, "editingSurface must not be null");
        this.refineSurface = Objects.requireNonNull(refineSurface, "refineSurface must not be null");
        this.speech = Objects.requireNonNull(speech, "speech must not be null");
        this.notifications = Objects.requireNonNull(notifications, "notifications must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.pasteSettleDelayMs = Math.max(0, pasteSettleDelayMs);
        this.speakDelayMs = Math.max(0, speakDelayMs);
    }

    /**
     * Schedules the side effects of one node. Returns immediately.
     */
    public void dispatch(SideEffectRequest request) {
        Objects.requireNonNull(request, "request must not be null");
        Block block = request.block();
        if (block.autoCopy()) {
            executor.execute(() -> copyThenPaste(request));
        }
        if (block.autoSpeak() && request.hasText()) {
            executor.execute(() -> speak(request));
        }
    }

    /**
     * Schedules a history entry for a visible node with a non-empty result: image blocks
     * store the captured image with the result, every other block stores the result with the
     * node's input text.
     *
     * @param request   dispatched node output
     * @param inputText text the node was given
     */
    public void saveHistory(SideEffectRequest request, String inputText) {
        Objects.requireNonNull(request, "request must not be null");
        Block block = request.block();
        if (!block.showOverlay() || !request.hasText()) {
            return;
        }
        if (block.kind() == BlockKind.IMAGE) {
            if (request.context().isImage()) {
                executor.execute(() -> run(request, ACTION_HISTORY,
                        () -> history.saveImage(request.context().bytes(), request.resultText())));
            }
        } else if (block.kind() == BlockKind.TEXT) {
            executor.execute(() -> run(request, ACTION_HISTORY,
                    () -> history.saveText(request.resultText(), inputText)));
        }
    }

    private void copyThenPaste(SideEffectRequest request) {
        Block block = request.block();
        boolean adapter = block.isInputAdapter();
        boolean imageCopied = false;

        if (adapter && request.context().isImage()) {
            imageCopied = run(request, ACTION_COPY_IMAGE, () -> clipboard.copyImage(request.context().bytes()));
        }

        if (request.hasText()) {
            boolean textCopied = run(request, ACTION_COPY_TEXT, () -> clipboard.copyText(request.resultText()));
            if (textCopied && !adapter) {
                run(request, ACTION_BADGE,
                        () -> notifications.copied(NotificationSink.Badge.TEXT_COPIED, request.resultText()));
            }
        } else if (imageCopied) {
            run(request, ACTION_BADGE, () -> notifications.copied(NotificationSink.Badge.IMAGE_COPIED, ""));
        }

        boolean shouldPaste = (request.hasText() && !adapter) || imageCopied;
        if (!shouldPaste || !block.autoPaste() || request.disableAutoPaste()) {
            return;
        }
        if (!TimeUtils.sleepQuietly(pasteSettleDelayMs)) {
            LOG.debug("Paste for block {} abandoned: interrupted during settle delay", block.id());
            return;
        }
        if (request.hasText()) {
            run(request, ACTION_PASTE, () -> pasteText(block, request.resultText()));
        } else {
            run(request, ACTION_PASTE, () -> paste.pasteIntoLastTarget(null));
        }
    }

    private void pasteText(Block block, String text) {
        String finalText = block.autoPasteNewline() ? text + "\n" : text;
        if (editingSurface.isActive()) {
            editingSurface.insertText(finalText);
            editingSurface.refocus();
        } else if (refineSurface.isActive()) {
            refineSurface.setText(finalText);
        } else {
            paste.pasteIntoLastTarget(text);
        }
    }

    private void speak(SideEffectRequest request) {
        if (!TimeUtils.sleepQuietly(speakDelayMs)) {
            return;
        }
        run(request, ACTION_SPEAK, () -> speech.speak(request.resultText()));
    }

    private boolean run(SideEffectRequest request, String action, Runnable sinkCall) {
        try {
            sinkCall.run();
            return true;
        } catch (RuntimeException e) {
            LOG.warn("Side effect {} failed for block {}: {}", action, request.block().id(), e.toString());
            publisher.publishEvent(new SideEffectFailedEvent(request.runId(), request.block().id(), action,
                    e.getClass().getSimpleName(), Instant.now()));
            return false;
        }
    }
}
