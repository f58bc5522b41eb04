package com.osman.exrtool.core.channel;

import java.util.List;

/**
 * Longest shared directory prefix of a set of paths, used to shorten display names.
 */
public final class CommonPrefix {

    private CommonPrefix() {
    }

    /**
     * Prefix ending in a path separator ({@code /} or {@code \}) that every name starts with,
     * or an empty string.
     */
    public static String of(List<String> names) {
        if (names == null || names.isEmpty()) {
            return "";
        }
        String prefix = directoryPart(names.get(0));
        for (String name : names.subList(1, names.size())) {
            prefix = shared(prefix, name);
            if (prefix.isEmpty()) {
                break;
            }
        }
        return prefix;
    }

    public static String strip(String name, String prefix) {
        if (prefix != null && !prefix.isEmpty() && name.startsWith(prefix)) {
            return name.substring(prefix.length());
        }
        return name;
    }

    private static String shared(String prefix, String name) {
        int best = 0;
        int limit = Math.min(prefix.length(), name.length());
        for (int i = 0; i < limit; i++) {
            char c = name.charAt(i);
            if (c != prefix.charAt(i)) {
                break;
            }
            if (c == '/' || c == '\\') {
                best = i + 1;
            }
        }
        return prefix.substring(0, best);
    }

    private static String directoryPart(String name) {
        int slash = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return slash < 0 ? "" : name.substring(0, slash + 1);
    }
}
