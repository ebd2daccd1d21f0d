package com.phillippitts.presetgraph.service.sink.awt;

import com.phillippitts.presetgraph.exception.PresetGraphException;
import com.phillippitts.presetgraph.service.sink.ClipboardSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.Image;
import java.awt.Toolkit;
import java.awt.datatransfer.Clipboard;
import java.awt.datatransfer.DataFlavor;
import java.awt.datatransfer.StringSelection;
import java.awt.datatransfer.Transferable;
import java.awt.datatransfer.UnsupportedFlavorException;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Objects;

/**
 * System clipboard via AWT. In a headless JVM every call fails with a
 * {@link PresetGraphException}; the bean itself can always be created.
 */
public class AwtClipboardSink implements ClipboardSink {

    private static final Logger LOG = LogManager.getLogger(AwtClipboardSink.class);

    interface ClipboardFacade {
        Clipboard getSystemClipboard();
    }

    static final class AwtClipboardFacade implements ClipboardFacade {
        @Override
        public Clipboard getSystemClipboard() {
            return Toolkit.getDefaultToolkit().getSystemClipboard();
        }
    }

    private final ClipboardFacade clipboard;

    public AwtClipboardSink() {
        this(new AwtClipboardFacade());
    }

    // package-private for tests
    AwtClipboardSink(ClipboardFacade facade) {
        this.clipboard = Objects.requireNonNull(facade, "facade must not be null");
    }

    @Override
    public void copyText(String text) {
        String value = text == null ? "" : text;
        try {
            clipboard.getSystemClipboard().setContents(new StringSelection(value), null);
            LOG.debug("Copied {} chars to clipboard", value.length());
        } catch (RuntimeException e) {
            throw new PresetGraphException("Clipboard text copy failed: " + e, e);
        }
    }

    @Override
    public void copyImage(byte[] imageBytes) {
        Objects.requireNonNull(imageBytes, "imageBytes must not be null");
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new PresetGraphException("Unable to decode image for clipboard", e);
        }
        if (image == null) {
            throw new PresetGraphException("Unsupported image format (" + imageBytes.length + " bytes)");
        }
        try {
            clipboard.getSystemClipboard().setContents(new ImageSelection(image), null);
            LOG.debug("Copied {}x{} image to clipboard", image.getWidth(), image.getHeight());
        } catch (RuntimeException e) {
            throw new PresetGraphException("Clipboard image copy failed: " + e, e);
        }
    }

    static final class ImageSelection implements Transferable {
        private final Image image;

        ImageSelection(Image image) {
            this.image = image;
        }

        @Override
        public DataFlavor[] getTransferDataFlavors() {
            return new DataFlavor[] {DataFlavor.imageFlavor};
        }

        @Override
        public boolean isDataFlavorSupported(DataFlavor flavor) {
            return DataFlavor.imageFlavor.equals(flavor);
        }

        @Override
        public Object getTransferData(DataFlavor flavor) throws UnsupportedFlavorException {
            if (!isDataFlavorSupported(flavor)) {
                throw new UnsupportedFlavorException(flavor);
            }
            return image;
        }
    }
}
