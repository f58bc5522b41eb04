package com.osman.exrtool.core.channel;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Toggle groups for channel selection. Order matters: a channel belongs to the first category whose
 * pattern matches its whole name, so {@link #OTHERS} catches whatever is left.
 */
public enum ChannelCategory {
    COLOR("color", "Color (Beauty)", "[RGBA]"),
    NORMAL("normal", "Normal (N)", "N\\.[XYZ]"),
    DEPTH("depth", "Depth (Z)", "Z"),
    AMBIENT_OCCLUSION("ao", "Ambient Occlusion (AO)", "AO\\.[RGBA]"),
    CRYPTO_OBJECT("crypto-object", "Crypto Object", "crypto_object.*"),
    CRYPTO_MATERIAL("crypto-material", "Crypto Material", "crypto_material.*"),
    SAMPLE_DENSITY("density", "Sample density", "AA_inv_density.*"),
    VARIANCE("variance", "Variance", "variance.*"),
    NOICE("noice", "Noice", ".*noice.*"),
    OTHERS("others", "Others", ".*");

    private final String key;
    private final String label;
    private final Pattern pattern;

    ChannelCategory(String key, String label, String regex) {
        this.key = key;
        this.label = label;
        this.pattern = Pattern.compile(regex);
    }

    public String key() {
        return key;
    }

    public String label() {
        return label;
    }

    public boolean matches(String channelName) {
        return channelName != null && pattern.matcher(channelName).matches();
    }

    public static ChannelCategory classify(String channelName) {
        for (ChannelCategory category : values()) {
            if (category.matches(channelName)) {
                return category;
            }
        }
        return OTHERS;
    }

    public static Optional<ChannelCategory> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase(Locale.ROOT);
        for (ChannelCategory category : values()) {
            if (category.key.equals(normalized) || category.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
