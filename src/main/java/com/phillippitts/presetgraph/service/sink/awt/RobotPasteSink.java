package com.phillippitts.presetgraph.service.sink.awt;

import com.phillippitts.presetgraph.exception.PresetGraphException;
import com.phillippitts.presetgraph.service.sink.PasteSink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.AWTException;
import java.awt.Robot;
import java.awt.event.KeyEvent;
import java.util.Locale;

/**
 * Generic paste via java.awt.Robot: presses the platform paste shortcut
 * (Command+V on macOS, Control+V elsewhere) so the focused window receives the clipboard.
 * Requires Accessibility permission on macOS.
 *
 * <p>For hermetic tests, RobotFacade can be replaced.
 */
public class RobotPasteSink implements PasteSink {

    private static final Logger LOG = LogManager.getLogger(RobotPasteSink.class);

    interface RobotFacade {
        void keyPress(int keyCode);
        void keyRelease(int keyCode);
    }

    static final class AwtRobotFacade implements RobotFacade {
        private final Robot robot;

        AwtRobotFacade() throws AWTException {
            this.robot = new Robot();
        }

        @Override
        public void keyPress(int keyCode) {
            robot.keyPress(keyCode);
        }

        @Override
        public void keyRelease(int keyCode) {
            robot.keyRelease(keyCode);
        }
    }

    private final RobotFacade robot;
    private final boolean mac;

    public RobotPasteSink() {
        this(createRobotFacade(), isMac());
    }

    // Package-private for tests
    RobotPasteSink(RobotFacade facade, boolean mac) {
        this.robot = facade; // null when no display is available
        this.mac = mac;
    }

    private static RobotFacade createRobotFacade() {
        try {
            return new AwtRobotFacade();
        } catch (AWTException | RuntimeException e) {
            LOG.info("Robot unavailable, generic paste disabled: {}", e.toString());
            return null;
        }
    }

    private static boolean isMac() {
        return System.getProperty("os.name", "").toLowerCase(Locale.ROOT).contains("mac");
    }

    public boolean isAvailable() {
        return robot != null;
    }

    @Override
    public void pasteIntoLastTarget(String text) {
        if (robot == null) {
            throw new PresetGraphException("Paste unavailable: no robot (headless or permission denied)");
        }
        int modKey = mac ? KeyEvent.VK_META : KeyEvent.VK_CONTROL;
        robot.keyPress(modKey);
        robot.keyPress(KeyEvent.VK_V);
        robot.keyRelease(KeyEvent.VK_V);
        robot.keyRelease(modKey);
        LOG.debug("Paste shortcut sent ({})", text == null ? "image" : text.length() + " chars");
    }
}
