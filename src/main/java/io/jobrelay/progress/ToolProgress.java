package io.jobrelay.progress;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The tool's own aggregate line, e.g. {@code [ 40% ] 2 of 5 processes}.
 */
public record ToolProgress(int percent, int completed, int submitted) {
    private static final Pattern LINE = Pattern.compile("\\[\\s*(\\d+)%\\s*]\\s*(\\d+)\\s+of\\s+(\\d+)\\s+processes");

    public static Optional<ToolProgress> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = LINE.matcher(line);
        if (!m.find()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new ToolProgress(
                    Integer.parseInt(m.group(1)),
                    Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3))
            ));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
