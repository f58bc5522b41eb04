package com.osman.exrtool;

import com.osman.exrtool.cli.ExrMergeTool;
import com.osman.exrtool.core.run.ExrMergeService;
import com.osman.exrtool.logging.AppLogger;
import com.osman.exrtool.ui.ExrToolFrame;

import javax.swing.SwingUtilities;
import javax.swing.UIManager;
import java.awt.GraphicsEnvironment;
import java.util.logging.Level;

/**
 * Launches the desktop window, or the command-line tool when arguments are given or no display exists.
 */
public final class ExrToolApp {

    private ExrToolApp() {
    }

    public static void main(String[] args) {
        if (args.length > 0 || GraphicsEnvironment.isHeadless()) {
            ExrMergeTool.main(args);
            return;
        }
        SwingUtilities.invokeLater(() -> {
            try {
                UIManager.setLookAndFeel(UIManager.getSystemLookAndFeelClassName());
            } catch (Exception ex) {
                AppLogger.get().log(Level.FINE, "System look and feel unavailable", ex);
            }
            new ExrToolFrame(new ExrMergeService()).setVisible(true);
        });
    }
}
