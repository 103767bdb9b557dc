package io.swarmhive.reservation;

import java.nio.file.FileSystems;
import java.nio.file.InvalidPathException;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.util.regex.PatternSyntaxException;

/**
 * Overlap test between reservation patterns. Plain paths overlap only when equal; a glob overlaps a
 * plain path it matches; two globs overlap when one literal prefix starts with the other.
 */
public final class PathPatterns {
    private static final String GLOB_CHARS = "*?[{";

    private PathPatterns() {
    }

    public static String normalize(String raw) {
        if (raw == null) {
            return "";
        }
        String value = raw.trim().replace('\\', '/');
        while (value.startsWith("./")) {
            value = value.substring(2);
        }
        return value;
    }

    public static boolean isGlob(String pattern) {
        for (int i = 0; i < pattern.length(); i++) {
            if (GLOB_CHARS.indexOf(pattern.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }

    public static boolean overlaps(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.equals(right)) {
            return true;
        }
        boolean leftGlob = isGlob(left);
        boolean rightGlob = isGlob(right);
        if (!leftGlob && !rightGlob) {
            return false;
        }
        if (leftGlob && !rightGlob) {
            return matches(left, right);
        }
        if (!leftGlob) {
            return matches(right, left);
        }
        String leftPrefix = literalPrefix(left);
        String rightPrefix = literalPrefix(right);
        return leftPrefix.startsWith(rightPrefix) || rightPrefix.startsWith(leftPrefix);
    }

    public static boolean matches(String glob, String path) {
        try {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + glob);
            return matcher.matches(Paths.get(path));
        } catch (PatternSyntaxException | InvalidPathException e) {
            return glob.equals(path);
        }
    }

    static String literalPrefix(String glob) {
        for (int i = 0; i < glob.length(); i++) {
            if (GLOB_CHARS.indexOf(glob.charAt(i)) >= 0) {
                return glob.substring(0, i);
            }
        }
        return glob;
    }
}
