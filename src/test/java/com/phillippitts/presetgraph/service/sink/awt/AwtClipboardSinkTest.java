package com.phillippitts.presetgraph.service.sink.awt;

import com.phillippitts.presetgraph.exception.PresetGraphException;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.Image;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.ClipboardOwner;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.Transferable;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AwtClipboardSinkTest {

    static class FakeClipboard extends Clipboard {
        Transferable contents;
        boolean locked;

        FakeClipboard() {
            super("fake");
        }

        @Override
        public synchronized void setContents(Transferable contents, ClipboardOwner owner) {
            if (locked) {
                throw new IllegalStateException("cannot open system clipboard");
            }
            this.contents = contents;
        }
    }

    private final FakeClipboard clipboard = new FakeClipboard();
    private final AwtClipboardSink sink = new AwtClipboardSink(() -> clipboard);

    @Test
    void copiesText() throws Exception {
        sink.copyText("hello");

        assertThat(clipboard.contents.getTransferData(DataFlavor.stringFlavor)).isEqualTo("hello");
    }

    @Test
    void copiesDecodedImage() throws Exception {
        sink.copyImage(png(3, 2));

        assertThat(clipboard.contents.isDataFlavorSupported(DataFlavor.imageFlavor)).isTrue();
        Image image = (Image) clipboard.contents.getTransferData(DataFlavor.imageFlavor);
        assertThat(image.getWidth(null)).isEqualTo(3);
        assertThat(image.getHeight(null)).isEqualTo(2);
    }

    @Test
    void rejectsUndecodableImage() {
        assertThatThrownBy(() -> sink.copyImage(new byte[] {1, 2, 3}))
                .isInstanceOf(PresetGraphException.class)
                .hasMessageContaining("Unsupported image format");
        assertThat(clipboard.contents).isNull();
    }

    @Test
    void wrapsClipboardFailure() {
        clipboard.locked = true;

        assertThatThrownBy(() -> sink.copyText("x"))
                .isInstanceOf(PresetGraphException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    private static byte[] png(int width, int height) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ImageIO.write(new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB), "png", out);
        return out.toByteArray();
    }
}
