package com.veriheal.core.patch;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.PatchFailedException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Line-level patch for a single file, backed by java-diff-utils.
 *
 * Deltas are checked against the current file at their stated positions. If
 * they do not match there, the whole patch may shift by up to {@code maxOffset}
 * lines in either direction; anything else rejects the diff and nothing is
 * applied. Line endings are normalised on the way in and the file's own
 * separator is written back on the way out.
 */
public final class UnifiedDiff {

    // pads the file when a patch is tried above its first line; no split line can equal it
    private static final String PADDING = "\n";

    private final com.github.difflib.patch.Patch<String> patch;

    private UnifiedDiff(com.github.difflib.patch.Patch<String> patch) {
        this.patch = patch;
    }

    public int hunkCount() {
        return patch.getDeltas().size();
    }

    // ================================================================
    // Construction
    // ================================================================

    /**
     * Parses a unified diff body. File headers are optional.
     *
     * @throws IllegalArgumentException if the body holds no hunk or its hunks overlap
     */
    public static UnifiedDiff parse(String body) {
        if (body == null || body.isBlank()) {
            throw new IllegalArgumentException("Diff body is empty");
        }
        List<String> raw = TextLines.of(body).lines;

        int first = 0;
        while (first < raw.size() && !raw.get(first).startsWith("@@")) first++;
        if (first == raw.size()) {
            throw new IllegalArgumentException("Diff body contains no hunk");
        }

        // the parser skips everything up to a "+++" header
        List<String> normalized = new ArrayList<>(raw.size() - first + 2);
        normalized.add("--- a");
        normalized.add("+++ b");
        normalized.addAll(raw.subList(first, raw.size()));

        com.github.difflib.patch.Patch<String> parsed = UnifiedDiffUtils.parseUnifiedDiff(normalized);
        if (parsed.getDeltas().isEmpty()) {
            throw new IllegalArgumentException("Diff body contains no hunk");
        }

        int previousEnd = 0;
        int index = 1;
        for (AbstractDelta<String> delta : parsed.getDeltas()) {
            int position = delta.getSource().getPosition();
            if (position < previousEnd) {
                throw new IllegalArgumentException("Hunk " + index + " overlaps the hunk before it");
            }
            previousEnd = position + delta.getSource().size();
            index++;
        }
        return new UnifiedDiff(parsed);
    }

    /** Patch that turns {@code before} into {@code after}, without context lines. */
    public static UnifiedDiff between(String before, String after) {
        return new UnifiedDiff(DiffUtils.diff(TextLines.of(before).lines, TextLines.of(after).lines));
    }

    // ================================================================
    // Apply
    // ================================================================

    /**
     * Content after applying this patch to {@code content}.
     *
     * @throws IllegalArgumentException if no offset within {@code maxOffset}
     *         lets every delta match
     */
    public String applyTo(String content, int maxOffset) {
        TextLines file = TextLines.of(content == null ? "" : content);

        Exception last = null;
        for (int step = 0; step <= 2 * Math.max(0, maxOffset); step++) {
            // 0, +1, -1, +2, -2 ...
            int offset = (step + 1) / 2 * (step % 2 == 1 ? 1 : -1);
            try {
                return file.withLines(applyAt(file.lines, offset)).render();
            } catch (PatchFailedException | IndexOutOfBoundsException e) {
                // the library reports a hunk one line past the end as an index error
                last = e;
            }
        }
        throw new IllegalArgumentException("Diff does not apply within " + maxOffset
                + " lines of its stated position: " + last.getMessage(), last);
    }

    /** Applies with every delta moved down by {@code offset} lines (up when negative). */
    private List<String> applyAt(List<String> lines, int offset) throws PatchFailedException {
        if (offset == 0) {
            return patch.applyTo(lines);
        }
        if (offset > 0) {
            if (offset > lines.size()) {
                throw new PatchFailedException("offset " + offset + " is past the end of the file");
            }
            List<String> result = new ArrayList<>(lines.subList(0, offset));
            result.addAll(patch.applyTo(lines.subList(offset, lines.size())));
            return result;
        }
        List<String> padded = new ArrayList<>(lines.size() - offset);
        for (int i = 0; i < -offset; i++) padded.add(PADDING);
        padded.addAll(lines);
        List<String> result = new ArrayList<>(patch.applyTo(padded));
        result.removeIf(PADDING::equals);
        return result;
    }

    // ================================================================
    // Line handling
    // ================================================================

    /**
     * File content split into lines, remembering its separator and whether it
     * ended with one.
     */
    static final class TextLines {

        final List<String> lines;
        final String       separator;
        final boolean      trailingSeparator;

        private TextLines(List<String> lines, String separator, boolean trailingSeparator) {
            this.lines             = lines;
            this.separator         = separator;
            this.trailingSeparator = trailingSeparator;
        }

        static TextLines of(String content) {
            String separator = content.contains("\r\n") ? "\r\n" : "\n";
            if (content.isEmpty()) {
                // files created by a diff end with a newline
                return new TextLines(new ArrayList<>(), separator, true);
            }
            List<String> lines = new ArrayList<>(Arrays.asList(content.split("\\R", -1)));
            boolean trailing = lines.get(lines.size() - 1).isEmpty();
            if (trailing) lines.remove(lines.size() - 1);
            return new TextLines(lines, separator, trailing);
        }

        TextLines withLines(List<String> replacement) {
            return new TextLines(replacement, separator, trailingSeparator);
        }

        String render() {
            if (lines.isEmpty()) return "";
            String joined = String.join(separator, lines);
            return trailingSeparator ? joined + separator : joined;
        }
    }
}
