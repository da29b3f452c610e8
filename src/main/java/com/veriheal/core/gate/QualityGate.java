package com.veriheal.core.gate;

import com.veriheal.core.checklist.TestCase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Static checks on candidate test code before it is run.
 *
 * Rejects code longer than the configured line limit, and generated code whose
 * confidence is below the target for the case's priority tier. Cases without
 * candidate code (an existing test file) always pass.
 */
@Component
public class QualityGate {

    private static final Logger log = LoggerFactory.getLogger(QualityGate.class);

    public static final String FAILURE_PREFIX = "Quality Gate Failed: ";

    static final double HIGH_TARGET   = 0.95;
    static final double MEDIUM_TARGET = 0.85;
    static final double LOW_TARGET    = 0.75;

    private final int maxTestLines;
    private final int highPriority;
    private final int mediumPriority;

    public QualityGate(
            @Value("${veriheal.gate.max-test-lines:50}") int maxTestLines,
            @Value("${veriheal.gate.high-priority:8}") int highPriority,
            @Value("${veriheal.gate.medium-priority:4}") int mediumPriority
    ) {
        this.maxTestLines   = maxTestLines;
        this.highPriority   = highPriority;
        this.mediumPriority = mediumPriority;
    }

    public GateResult check(TestCase testCase) {
        String code = testCase.getTestCode();
        if (code == null) {
            return GateResult.passed();
        }

        int lines = code.isEmpty() ? 0 : code.split("\\R", -1).length;
        if (lines > maxTestLines) {
            log.info("[QualityGate] {} rejected: {} lines (max {})", testCase.getId(), lines, maxTestLines);
            return GateResult.failed("Code complexity too high: " + lines + " lines (max " + maxTestLines + ")");
        }

        Double confidence = testCase.getGenerationConfidence();
        double target = confidenceTarget(testCase.getPriority());
        if (confidence != null && confidence < target) {
            log.info("[QualityGate] {} rejected: confidence {} below target {}",
                    testCase.getId(), confidence, target);
            return GateResult.failed(String.format(Locale.ROOT,
                    "Generation confidence too low: %.2f < target %.2f", confidence, target));
        }

        return GateResult.passed();
    }

    public double confidenceTarget(int priority) {
        if (priority >= highPriority)   return HIGH_TARGET;
        if (priority >= mediumPriority) return MEDIUM_TARGET;
        return LOW_TARGET;
    }
}
