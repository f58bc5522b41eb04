package com.osman.exrtool.core.merge;

import com.osman.exrtool.core.frame.FrameNumber;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Output file name pattern. The rightmost run of {@code #} characters is replaced by the frame
 * number, zero padded to the run's length ({@code out.####.exr} becomes {@code out.0007.exr}).
 * <p>
 * Templates without {@code #}, and frames without a number, resolve to the template verbatim, so every
 * such frame writes the same file. Avoiding that is up to the caller.
 */
public final class OutputPathTemplate {

    private final String template;

    public OutputPathTemplate(String template) {
        Objects.requireNonNull(template, "template");
        if (template.isBlank()) {
            throw new IllegalArgumentException("Output template must not be blank");
        }
        this.template = template;
    }

    public boolean hasFramePlaceholder() {
        return template.indexOf('#') >= 0;
    }

    public String resolve(FrameNumber frame) {
        int end = template.lastIndexOf('#');
        if (!frame.isPresent() || end < 0) {
            return template;
        }
        int begin = end;
        while (begin > 0 && template.charAt(begin - 1) == '#') {
            begin--;
        }
        int width = end - begin + 1;
        String number = String.format(Locale.ROOT, "%0" + width + "d", frame.getAsLong());
        return template.substring(0, begin) + number + template.substring(end + 1);
    }

    public Path resolvePath(FrameNumber frame) {
        return Path.of(resolve(frame));
    }

    @Override
    public String toString() {
        return template;
    }
}
