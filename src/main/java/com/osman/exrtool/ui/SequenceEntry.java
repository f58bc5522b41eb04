package com.osman.exrtool.ui;

import com.osman.exrtool.core.channel.ChannelCategorizer;
import com.osman.exrtool.core.channel.ChannelCategorizer.CategoryGroup;
import com.osman.exrtool.core.channel.ChannelCategory;
import com.osman.exrtool.core.channel.SequenceSelection;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One added sequence in the window: its files and the on/off state of every channel, grouped by category.
 * Channels start switched off.
 */
final class SequenceEntry {

    private final List<Path> files;
    private final Map<ChannelCategory, Map<String, Boolean>> toggles = new LinkedHashMap<>();
    private final Set<ChannelCategory> expanded = EnumSet.noneOf(ChannelCategory.class);

    SequenceEntry(List<Path> files, Collection<String> channelNames) {
        if (files.isEmpty()) {
            throw new IllegalArgumentException("A sequence needs at least one file");
        }
        this.files = List.copyOf(files);
        for (CategoryGroup group : ChannelCategorizer.categorize(channelNames)) {
            Map<String, Boolean> channels = new LinkedHashMap<>();
            group.channels().forEach(name -> channels.put(name, false));
            toggles.put(group.category(), channels);
        }
    }

    List<Path> files() {
        return files;
    }

    String name() {
        return files.get(0).toString();
    }

    List<ChannelCategory> categories() {
        return new ArrayList<>(toggles.keySet());
    }

    List<String> channels(ChannelCategory category) {
        Map<String, Boolean> channels = toggles.get(category);
        return channels == null ? List.of() : new ArrayList<>(channels.keySet());
    }

    boolean isSelected(String channel) {
        for (Map<String, Boolean> channels : toggles.values()) {
            Boolean selected = channels.get(channel);
            if (selected != null) {
                return selected;
            }
        }
        return false;
    }

    void setSelected(String channel, boolean selected) {
        for (Map<String, Boolean> channels : toggles.values()) {
            if (channels.containsKey(channel)) {
                channels.put(channel, selected);
                return;
            }
        }
    }

    int selectedCount(ChannelCategory category) {
        Map<String, Boolean> channels = toggles.get(category);
        if (channels == null) {
            return 0;
        }
        return (int) channels.values().stream().filter(Boolean::booleanValue).count();
    }

    boolean isFullySelected(ChannelCategory category) {
        Map<String, Boolean> channels = toggles.get(category);
        return channels != null && selectedCount(category) == channels.size();
    }

    void setCategorySelected(ChannelCategory category, boolean selected) {
        Map<String, Boolean> channels = toggles.get(category);
        if (channels != null) {
            channels.replaceAll((name, old) -> selected);
        }
    }

    String categoryLabel(ChannelCategory category) {
        return category.label() + " " + selectedCount(category) + "/" + channels(category).size();
    }

    boolean isExpanded(ChannelCategory category) {
        return expanded.contains(category);
    }

    void toggleExpanded(ChannelCategory category) {
        if (!expanded.remove(category)) {
            expanded.add(category);
        }
    }

    SequenceSelection toSelection() {
        Set<String> selected = new LinkedHashSet<>();
        toggles.values().forEach(channels -> channels.forEach((name, on) -> {
            if (on) {
                selected.add(name);
            }
        }));
        return new SequenceSelection(files, selected);
    }
}
