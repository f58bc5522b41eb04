package com.osman.exrtool.ui;

import com.osman.exrtool.config.ConfigService;
import com.osman.exrtool.core.channel.ChannelCategory;
import com.osman.exrtool.core.channel.ChannelInspector;
import com.osman.exrtool.core.channel.CommonPrefix;
import com.osman.exrtool.core.channel.SequenceSelection;
import com.osman.exrtool.core.codec.ExrCodecException;
import com.osman.exrtool.core.run.ExrMergeService;
import com.osman.exrtool.core.run.MergeErrorLog;
import com.osman.exrtool.core.run.MergeRequest;
import com.osman.exrtool.core.run.RunHandle;
import com.osman.exrtool.core.run.RunProgress;
import com.osman.exrtool.logging.AppLogger;

import javax.swing.*;
import javax.swing.border.EmptyBorder;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.*;
import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Desktop front-end: add EXR sequences, pick channels per category, and save merged frames.
 */
public class ExrToolFrame extends JFrame {

    private static final Logger LOGGER = AppLogger.get();

    private final ExrMergeService service;
    private final ChannelInspector inspector;
    private final ConfigService config = ConfigService.getInstance();

    private final DefaultListModel<SequenceEntry> sequenceModel = new DefaultListModel<>();
    private final JList<SequenceEntry> sequenceList = new JList<>(sequenceModel);
    private final JPanel channelPanel = new JPanel();
    private final JProgressBar progressBar = new JProgressBar();
    private final JButton addButton = new JButton("Add sequence");
    private final JButton saveButton = new JButton("Save");
    private final JButton resetButton = new JButton("Reset");

    private String commonPrefix = "";
    private RunHandle activeRun;

    public ExrToolFrame(ExrMergeService service) {
        super("EXR Tool");
        this.service = service;
        this.inspector = new ChannelInspector(service.codec());

        setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        setSize(600, 400);
        setLocationByPlatform(true);

        JPanel root = new JPanel(new BorderLayout(8, 8));
        root.setBorder(new EmptyBorder(8, 8, 8, 8));
        setContentPane(root);

        JPanel toolbar = new JPanel(new FlowLayout(FlowLayout.LEFT, 8, 0));
        toolbar.add(addButton);
        toolbar.add(saveButton);
        toolbar.add(resetButton);
        root.add(toolbar, BorderLayout.NORTH);

        sequenceList.setSelectionMode(ListSelectionModel.SINGLE_SELECTION);
        sequenceList.setCellRenderer(new DefaultListCellRenderer() {
            @Override
            public Component getListCellRendererComponent(JList<?> list, Object value, int index,
                                                          boolean isSelected, boolean cellHasFocus) {
                String label = value instanceof SequenceEntry entry
                    ? CommonPrefix.strip(entry.name(), commonPrefix) + "  (" + entry.files().size() + ")"
                    : String.valueOf(value);
                return super.getListCellRendererComponent(list, label, index, isSelected, cellHasFocus);
            }
        });
        sequenceList.addListSelectionListener(e -> {
            if (!e.getValueIsAdjusting()) {
                rebuildChannelPanel();
            }
        });

        channelPanel.setLayout(new BoxLayout(channelPanel, BoxLayout.Y_AXIS));
        JSplitPane split = new JSplitPane(JSplitPane.HORIZONTAL_SPLIT,
            new JScrollPane(sequenceList), new JScrollPane(channelPanel));
        split.setResizeWeight(0.5);
        root.add(split, BorderLayout.CENTER);

        progressBar.setStringPainted(true);
        progressBar.setVisible(false);
        root.add(progressBar, BorderLayout.SOUTH);

        addButton.addActionListener(e -> onAddSequence());
        saveButton.addActionListener(e -> onSave());
        resetButton.addActionListener(e -> onReset());
    }

    private void onAddSequence() {
        JFileChooser fc = new JFileChooser();
        config.getLastInputDirectory().ifPresent(dir -> fc.setCurrentDirectory(dir.toFile()));
        fc.setFileFilter(new FileNameExtensionFilter(".exr files", "exr"));
        fc.setMultiSelectionEnabled(true);
        fc.setDialogTitle("Add source files");
        if (fc.showOpenDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        File[] selected = fc.getSelectedFiles();
        if (selected.length == 0) {
            return;
        }
        List<Path> files = new ArrayList<>(selected.length);
        for (File file : selected) {
            files.add(file.toPath());
        }
        files.sort(null);
        Path parent = files.get(0).toAbsolutePath().getParent();
        if (parent != null) {
            config.setLastInputDirectory(parent);
        }

        try {
            addSequence(files, inspector.channelNames(files.get(0)));
        } catch (ExrCodecException ex) {
            showError("Could not read channels\n" + files.get(0) + "\n" + ex.getMessage());
        }
    }

    private void addSequence(List<Path> files, List<String> channelNames) {
        SequenceEntry entry = new SequenceEntry(files, channelNames);
        sequenceModel.addElement(entry);
        List<String> names = new ArrayList<>();
        for (int i = 0; i < sequenceModel.size(); i++) {
            names.add(sequenceModel.get(i).name());
        }
        commonPrefix = CommonPrefix.of(names);
        sequenceList.setSelectedIndex(sequenceModel.size() - 1);
        sequenceList.repaint();
    }

    private void onSave() {
        if (sequenceModel.isEmpty()) {
            JOptionPane.showMessageDialog(this, "Add at least one sequence first.", "Nothing to save",
                JOptionPane.WARNING_MESSAGE);
            return;
        }
        JFileChooser fc = new JFileChooser();
        config.getLastOutputDirectory().ifPresent(dir -> fc.setCurrentDirectory(dir.toFile()));
        fc.setFileFilter(new FileNameExtensionFilter(".exr files", "exr"));
        fc.setDialogTitle("Save modified files (use #### for the frame number)");
        if (fc.showSaveDialog(this) != JFileChooser.APPROVE_OPTION) {
            return;
        }
        Path output = fc.getSelectedFile().toPath();
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            config.setLastOutputDirectory(parent);
        }
        startRun(output.toString());
    }

    private void startRun(String outputTemplate) {
        List<SequenceSelection> selections = new ArrayList<>();
        for (int i = 0; i < sequenceModel.size(); i++) {
            selections.add(sequenceModel.get(i).toSelection());
        }
        MergeRequest request = new MergeRequest(
            SequenceSelection.flatten(selections),
            outputTemplate,
            config.getThreadCount(),
            run -> SwingUtilities.invokeLater(() -> refreshProgress(run)));

        setControlsEnabled(false);
        progressBar.setValue(0);
        progressBar.setString("Processing");
        progressBar.setVisible(true);
        activeRun = service.submit(request);
        refreshProgress(activeRun);
    }

    private void refreshProgress(RunHandle run) {
        if (run != activeRun) {
            return;
        }
        RunProgress progress = run.poll();
        progressBar.setMaximum((int) Math.min(progress.max(), Integer.MAX_VALUE));
        progressBar.setValue((int) Math.min(progress.done(), Integer.MAX_VALUE));
        progressBar.setString("Processing " + progress.done() + "/" + progress.max());
        if (!progress.complete()) {
            return;
        }

        activeRun = null;
        int errorCount = run.errorCount();
        if (errorCount > 0) {
            MergeErrorLog.logFailures(run.errors());
            String first = run.error(0).orElse("");
            String more = errorCount > 1 ? "\n\n(" + (errorCount - 1) + " more error(s))" : "";
            showError("Processing error\n" + first + more);
        }
        Thread release = new Thread(() -> {
            try {
                run.close();
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Failed to release merge run", ex);
            }
        }, "MergeRun-Release");
        release.setDaemon(true);
        release.start();

        progressBar.setVisible(false);
        setControlsEnabled(true);
    }

    private void onReset() {
        sequenceModel.clear();
        commonPrefix = "";
        rebuildChannelPanel();
    }

    private void rebuildChannelPanel() {
        channelPanel.removeAll();
        SequenceEntry entry = sequenceList.getSelectedValue();
        if (entry != null) {
            for (ChannelCategory category : entry.categories()) {
                JPanel row = new JPanel(new FlowLayout(FlowLayout.LEFT, 4, 0));
                JButton expand = new JButton(entry.isExpanded(category) ? "-" : "+");
                expand.setMargin(new Insets(0, 4, 0, 4));
                expand.addActionListener(e -> {
                    entry.toggleExpanded(category);
                    rebuildChannelPanel();
                });
                JCheckBox all = new JCheckBox(entry.categoryLabel(category), entry.isFullySelected(category));
                all.addActionListener(e -> {
                    entry.setCategorySelected(category, all.isSelected());
                    rebuildChannelPanel();
                });
                row.add(expand);
                row.add(all);
                row.setAlignmentX(Component.LEFT_ALIGNMENT);
                channelPanel.add(row);

                if (entry.isExpanded(category)) {
                    for (String channel : entry.channels(category)) {
                        JCheckBox box = new JCheckBox(channel, entry.isSelected(channel));
                        box.setBorder(new EmptyBorder(0, 36, 0, 0));
                        box.setAlignmentX(Component.LEFT_ALIGNMENT);
                        box.addActionListener(e -> {
                            entry.setSelected(channel, box.isSelected());
                            rebuildChannelPanel();
                        });
                        channelPanel.add(box);
                    }
                }
            }
        }
        channelPanel.revalidate();
        channelPanel.repaint();
    }

    private void setControlsEnabled(boolean enabled) {
        addButton.setEnabled(enabled);
        saveButton.setEnabled(enabled);
        resetButton.setEnabled(enabled);
        sequenceList.setEnabled(enabled);
        channelPanel.setEnabled(enabled);
    }

    private void showError(String message) {
        LOGGER.warning(message.replace('\n', ' '));
        JOptionPane.showMessageDialog(this, message, "Error", JOptionPane.ERROR_MESSAGE);
    }
}
