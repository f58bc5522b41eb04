package com.osman.exrtool.core.channel;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Sorts a file's channel names into {@link ChannelCategory} groups.
 */
public final class ChannelCategorizer {

    private ChannelCategorizer() {
    }

    /**
     * Non-empty categories in declaration order, each with its channel names sorted.
     */
    public static List<CategoryGroup> categorize(Collection<String> channelNames) {
        Map<ChannelCategory, Set<String>> byCategory = new EnumMap<>(ChannelCategory.class);
        for (String name : channelNames) {
            byCategory.computeIfAbsent(ChannelCategory.classify(name), key -> new TreeSet<>()).add(name);
        }
        List<CategoryGroup> groups = new ArrayList<>(byCategory.size());
        byCategory.forEach((category, names) -> groups.add(new CategoryGroup(category, List.copyOf(names))));
        return groups;
    }

    /**
     * Channel names out of {@code channelNames} that fall into any of the given categories,
     * in the order they were supplied.
     */
    public static Set<String> select(Collection<String> channelNames, Collection<ChannelCategory> categories) {
        EnumSet<ChannelCategory> wanted = categories.isEmpty()
            ? EnumSet.noneOf(ChannelCategory.class)
            : EnumSet.copyOf(categories);
        Set<String> selected = new LinkedHashSet<>();
        for (String name : channelNames) {
            if (wanted.contains(ChannelCategory.classify(name))) {
                selected.add(name);
            }
        }
        return selected;
    }

    /**
     * @param category category of the channels.
     * @param channels channel names, sorted.
     */
    public record CategoryGroup(ChannelCategory category, List<String> channels) {
    }
}
