package com.veriheal.core.diagnosis;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Signature extraction across the runner output formats we support.
 */
class FailureSignatureAnalyzerTest {

    private final FailureSignatureAnalyzer analyzer = new FailureSignatureAnalyzer();

    @Test
    void testPythonTracebackPrefersSourceFrame() {
        String output = """
            Traceback (most recent call last):
              File "/home/dev/proj/tests/test_calc.py", line 5, in test_divide
                assert divide(4, 0) == 0
              File "/home/dev/proj/src/calc.py", line 12, in divide
                return a / b
              File "/home/dev/proj/venv/lib/python3.11/site-packages/x.py", line 3, in y
            ZeroDivisionError: division by zero
            """;

        FailureSignature signature = analyzer.analyze(output);

        assertEquals("src/calc.py", signature.getFailingFile());
        assertEquals(12, signature.getFailingLine());
        assertEquals("ZeroDivisionError", signature.getErrorType());
        assertEquals("division by zero", signature.getMessage());
    }

    @Test
    void testPytestShortFormatFallsBackToTestFrame() {
        String output = """
            tests/test_calc.py:14: in test_subtract
                assert subtract(5, 3) == 2
            E   AssertionError: assert 8 == 2
            """;

        FailureSignature signature = analyzer.analyze(output);

        assertEquals("tests/test_calc.py", signature.getFailingFile());
        assertEquals(14, signature.getFailingLine());
        assertEquals("AssertionError", signature.getErrorType());
    }

    @Test
    void testJvmStackFrame() {
        String output = """
            java.lang.IllegalStateException: boom
                at com.acme.Calc.add(Calc.java:42)
                at com.acme.CalcTest.testAdd(CalcTest.java:10)
            """;

        FailureSignature signature = analyzer.analyze(output);

        assertEquals("Calc.java", signature.getFailingFile());
        assertEquals(42, signature.getFailingLine());
        assertEquals("java.lang.IllegalStateException", signature.getErrorType());
    }

    @Test
    void testNodeStackFrame() {
        String output = """
            ReferenceError: total is not defined
                at Object.<anonymous> (/app/src/sum.js:3:11)
                at Module._compile (node:internal/modules/cjs/loader:1256:14)
            """;

        FailureSignature signature = analyzer.analyze(output);

        assertEquals("src/sum.js", signature.getFailingFile());
        assertEquals(3, signature.getFailingLine());
        assertEquals("total", signature.getFailingToken());
    }

    @Test
    void testImportTokenExtraction() {
        String output = """
            E   ModuleNotFoundError: No module named 'requests_cache'
            """;

        assertEquals("requests_cache", analyzer.analyze(output).getFailingToken());
    }

    @Test
    void testNameTokenExtraction() {
        assertEquals("helper", analyzer.analyze("E   NameError: name 'helper' is not defined").getFailingToken());
    }

    @Test
    void testSignatureKeyIgnoresNumbers() {
        FailureSignature first  = analyzer.analyze("E   AssertionError: assert 8 == 2");
        FailureSignature second = analyzer.analyze("E   AssertionError: assert 9 == 3");

        assertEquals(first.getSignatureKey(), second.getSignatureKey());
        assertEquals("AssertionError: assert N == N", first.getSignatureKey());
    }

    @Test
    void testUntypedOutputUsesFirstLine() {
        FailureSignature signature = analyzer.analyze("something odd happened at 0x7f3a\nmore");

        assertNull(signature.getErrorType());
        assertEquals("UNTYPED: something odd happened at 0x?", signature.getSignatureKey());
    }

    @Test
    void testEmptyOutput() {
        FailureSignature signature = analyzer.analyze("   ");

        assertEquals("EMPTY", signature.getSignatureKey());
        assertNull(signature.getFailingFile());
    }
}
