package github.sarthakdev143.render_farm.service.impl;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Frame placeholder substitution and resolution of Blender-style output paths.
 */
final class FramePathTemplates {

    private static final Pattern PLACEHOLDER_RUN = Pattern.compile("#+");
    private static final String BLEND_RELATIVE_PREFIX = "//";

    private FramePathTemplates() {
    }

    /**
     * Replaces every run of {@code #} with the frame number zero padded to four digits.
     */
    static String substitute(String template, int frame) {
        if (template == null || template.isEmpty()) {
            return template;
        }
        Matcher matcher = PLACEHOLDER_RUN.matcher(template);
        String padded = String.format(Locale.ROOT, "%04d", frame);
        return matcher.replaceAll(Matcher.quoteReplacement(padded));
    }

    /**
     * Resolves a base path against the job root. Paths starting with {@code //} and plain
     * relative paths are taken relative to the job root; absolute paths are kept.
     */
    static Path resolveBasePath(String basePath, int frame, Path jobRoot) {
        if (basePath == null || basePath.isBlank()) {
            return jobRoot;
        }
        String substituted = substitute(basePath, frame);
        if (substituted.startsWith(BLEND_RELATIVE_PREFIX)) {
            String relative = substituted.substring(BLEND_RELATIVE_PREFIX.length());
            return relative.isEmpty() ? jobRoot : jobRoot.resolve(relative).normalize();
        }
        Path candidate = Path.of(substituted);
        return candidate.isAbsolute() ? candidate.normalize() : jobRoot.resolve(candidate).normalize();
    }

    static String basename(String path) {
        if (path == null) {
            return "";
        }
        String trimmed = path;
        while (trimmed.endsWith("/") || trimmed.endsWith("\\")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf('\\'));
        return separator < 0 ? trimmed : trimmed.substring(separator + 1);
    }
}
