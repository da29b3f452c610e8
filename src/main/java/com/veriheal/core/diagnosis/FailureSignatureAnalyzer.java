package com.veriheal.core.diagnosis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a {@link FailureSignature} from test runner output.
 *
 * Frame extraction, in order of precedence:
 *
 * 1. Python tracebacks, both formats:
 *    a) File "/abs/path/src/foo.py", line N
 *    b) pytest short: src/foo.py:301:
 * 2. JVM stack frames: at com.acme.Foo.bar(Foo.java:42)
 * 3. Node stack frames: at fn (/abs/src/foo.js:10:5)
 *
 * Within each language the last project frame wins, source frames over test
 * frames. Paths are single-line; the character classes exclude \n and \r so
 * a capture never runs across output lines.
 */
@Component
public class FailureSignatureAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(FailureSignatureAnalyzer.class);

    private static final Pattern PY_FRAME_STANDARD =
        Pattern.compile("File \"([^\"\n\r]+\\.py)\",\\s*line (\\d+)");

    private static final Pattern PY_FRAME_SHORT =
        Pattern.compile("^[ \t]*((?:src|testing|tests|test|lib)/[^\\s:]+\\.py):(\\d+):", Pattern.MULTILINE);

    private static final Pattern JVM_FRAME =
        Pattern.compile("^\\s*at\\s+[\\w$.<>]+\\(([\\w$]+\\.(?:java|kt|scala|groovy)):(\\d+)\\)", Pattern.MULTILINE);

    private static final Pattern JS_FRAME =
        Pattern.compile("^\\s*at\\s+(?:[^\\n\\r(]*\\()?([^()\\s\\n\\r]+\\.(?:js|mjs|cjs|ts|tsx|jsx)):(\\d+):\\d+\\)?",
                Pattern.MULTILINE);

    // "E   ModuleNotFoundError: No module named 'foo'" / "java.lang.IllegalStateException: boom"
    private static final Pattern ERROR_LINE =
        Pattern.compile("^(?:E\\s+)?(?:Caused by:\\s+)?([A-Za-z_][\\w.$]*(?:Error|Exception|Failure))(?::\\s*(.*))?$",
                Pattern.MULTILINE);

    // ---- failing token extractors
    private static final List<Pattern> TOKEN_PATTERNS = List.of(
        Pattern.compile("No module named '([\\w.]+)'"),
        Pattern.compile("cannot import name '(\\w+)'"),
        Pattern.compile("name '(\\w+)' is not defined"),
        Pattern.compile("symbol:\\s+(?:variable|method|class|field)\\s+(\\w+)"),
        Pattern.compile("Cannot find module '([^'\\n\\r]+)'"),
        Pattern.compile("ReferenceError: (\\w+) is not defined"),
        Pattern.compile("has no attribute '(\\w+)'"),
        Pattern.compile("fixture '(\\w+)' not found")
    );

    private static final Pattern NUMBERS = Pattern.compile("\\b\\d+\\b");
    private static final Pattern HEX     = Pattern.compile("0x[0-9a-fA-F]+");
    private static final Pattern SPACES  = Pattern.compile("\\s+");

    public FailureSignature analyze(String failureText) {
        if (failureText == null || failureText.isBlank()) {
            log.warn("[Analyzer] Empty failure text");
            return FailureSignature.empty();
        }

        log.debug("[Analyzer] Analyzing {} chars of failure output", failureText.length());

        String errorType = null;
        String message   = null;
        Matcher err = ERROR_LINE.matcher(failureText);
        while (err.find()) {
            // keep the last one: chained causes and pytest "E" lines end with the root error
            errorType = err.group(1);
            message   = err.group(2) != null ? err.group(2).trim() : "";
        }

        String token = extractToken(failureText);
        Frame frame  = extractBestFrame(failureText);

        String signatureKey = signatureKey(errorType, message, failureText);
        FailureSignature signature = new FailureSignature(errorType, message,
                frame != null ? frame.path : null,
                frame != null ? frame.line : -1,
                token, signatureKey);

        log.info("[Analyzer] {}", signature);
        return signature;
    }

    // ================================================================
    // Frames
    // ================================================================

    private Frame extractBestFrame(String output) {
        Frame best = bestOf(PY_FRAME_STANDARD, output, true);
        if (best == null) best = bestOf(PY_FRAME_SHORT, output, false);
        if (best == null) best = bestOf(JVM_FRAME, output, false);
        if (best == null) best = bestOf(JS_FRAME, output, true);
        return best;
    }

    private Frame bestOf(Pattern pattern, String output, boolean absolutePaths) {
        Frame lastSource = null;
        Frame lastTest   = null;

        Matcher m = pattern.matcher(output);
        while (m.find()) {
            String path = m.group(1).replace('\\', '/').trim();
            if (isNonProjectFrame(path)) continue;
            if (absolutePaths) path = extractRelativePath(path);
            if (path == null || path.contains(">")) continue;

            Frame frame = new Frame(path, parseLine(m.group(2)));
            if (isTestPath(path)) lastTest = frame;
            else                  lastSource = frame;
        }
        return lastSource != null ? lastSource : lastTest;
    }

    private static int parseLine(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    private boolean isNonProjectFrame(String path) {
        return path.contains("/venv/")         ||
               path.contains("site-packages")  ||
               path.contains("<frozen")        ||
               path.contains("/importlib/")    ||
               path.contains("node_modules")   ||
               path.startsWith("node:")        ||
               path.startsWith("internal/");
    }

    private boolean isTestPath(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        String name  = lower.substring(lower.lastIndexOf('/') + 1);
        return lower.startsWith("tests/") || lower.startsWith("test/") || lower.startsWith("testing/")
                || lower.contains("/tests/") || lower.contains("/test/")
                || name.startsWith("test_") || name.endsWith("test.java") || name.endsWith("tests.java")
                || name.contains(".test.") || name.contains(".spec.");
    }

    /**
     * Convert an absolute path to a workspace-relative one using directory
     * anchors. Falls back to the last two path segments.
     */
    private String extractRelativePath(String path) {
        for (String anchor : List.of("/src/", "/lib/", "/testing/", "/tests/", "/test/")) {
            int idx = path.indexOf(anchor);
            if (idx != -1) return path.substring(idx + 1);
        }
        if (!path.startsWith("/")) return path;

        String[] parts = path.split("/");
        if (parts.length >= 2) return parts[parts.length - 2] + "/" + parts[parts.length - 1];
        return parts.length > 0 ? parts[parts.length - 1] : null;
    }

    // ================================================================
    // Token and signature
    // ================================================================

    private String extractToken(String output) {
        for (Pattern p : TOKEN_PATTERNS) {
            Matcher m = p.matcher(output);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    /**
     * Stable key for "the same failure": error type plus message with numbers
     * and addresses blanked out.
     */
    static String signatureKey(String errorType, String message, String fallbackText) {
        String basis;
        if (errorType != null) {
            basis = errorType + ": " + (message != null ? message : "");
        } else {
            String firstLine = fallbackText.strip().split("\\R", 2)[0];
            basis = "UNTYPED: " + firstLine;
        }
        basis = HEX.matcher(basis).replaceAll("0x?");
        basis = NUMBERS.matcher(basis).replaceAll("N");
        basis = SPACES.matcher(basis).replaceAll(" ").trim();
        return basis.length() > 160 ? basis.substring(0, 160) : basis;
    }

    private static final class Frame {
        final String path;
        final int    line;

        Frame(String path, int line) {
            this.path = path;
            this.line = line;
        }
    }
}
