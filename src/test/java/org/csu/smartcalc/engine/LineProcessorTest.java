package org.csu.smartcalc.engine;

import org.csu.smartcalc.cli.Session;
import org.csu.smartcalc.config.CalculatorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 逐行处理的集成测试：命令、赋值、表达式和错误提示。
 */
public class LineProcessorTest {

    private CalculatorProperties properties;
    private LineProcessor processor;
    private Session session;

    @BeforeEach
    void setUp() {
        properties = new CalculatorProperties();
        processor = new LineProcessor(properties);
        session = new Session();
    }

    private String run(String line) {
        LineResult result = processor.process(line, session);
        System.out.println("> " + line + (result.hasOutput() ? System.lineSeparator() + result.output() : ""));
        return result.output();
    }

    @Test
    void testCommands() {
        System.out.println("--- Test: Commands ---");
        assertEquals(properties.getHelpMessage(), run("/help"));
        assertEquals("Unknown command", run("/go"));
        assertEquals("Unknown command", run("/exit now"));

        LineResult exit = processor.process("  /exit  ", session);
        assertTrue(exit.exit());
        assertEquals("Bye!", exit.output());
    }

    @Test
    void testBlankLinesAreIgnored() {
        assertNull(run(""));
        assertNull(run("    "));
        assertFalse(processor.process("\t", session).exit());
    }

    @Test
    void testExpressions() {
        System.out.println("--- Test: Expressions ---");
        assertEquals("7", run("3 + 4"));
        assertEquals("3", run("8 - 3 - 2"));
        assertEquals("20", run("(2 + 3) * 4"));
        assertEquals("8", run("5 - - 3"));
        assertEquals("2", run("5 - - - 3"));
        assertEquals("64", run("2 ^ 3 ^ 2"));
    }

    @Test
    void testSingleNumbers() {
        assertEquals("42", run("  42  "));
        assertEquals("17", run("+17"));
        assertEquals("-17", run("-17"));
    }

    @Test
    void testAssignmentRoundTrip() {
        System.out.println("--- Test: Assignment Round Trip ---");
        assertNull(run("x = 5"));
        assertEquals("6", run("x + 1"));
        assertEquals("5", run("x"));
        assertEquals(BigInteger.valueOf(5), session.getEnvironment().get("x"));
        assertEquals(Map.of("x", BigInteger.valueOf(5)), session.getVariables());
        assertThrows(UnsupportedOperationException.class,
                () -> session.getVariables().put("y", BigInteger.ONE));
    }

    @Test
    void testFailedAssignmentKeepsOldValue() {
        System.out.println("--- Test: Failed Assignment ---");
        assertNull(run("y = 2"));
        assertEquals("Unknown variable", run("y = z"));
        assertEquals("2", run("y"));
        assertEquals("Invalid identifier", run("a1 = 3"));
        assertEquals("Invalid identifier", run("y = 4b"));
        assertEquals("2", run("y"));
    }

    @Test
    void testErrorsAreLocalToTheLine() {
        System.out.println("--- Test: Errors Are Local ---");
        assertEquals("Unknown variable", run("undefinedVar + 1"));
        assertEquals("2", run("1 + 1"));
        assertEquals("Invalid expression", run("(1 + 2"));
        assertEquals("Invalid expression", run("1 + 2)"));
        assertEquals("Invalid expression", run("2 # 3"));
        assertEquals("Invalid expression", run("2 3"));
        assertEquals("Division by zero", run("10 / 0"));
        assertNull(run("n = -1"));
        assertEquals("Invalid exponent", run("2 ^ n"));
        assertEquals("Invalid exponent", run("2 ^ 2147483647"));
        assertEquals("4", run("2 * 2"));
    }

    @Test
    void testSameLineTwice() {
        run("a = 3");
        assertEquals(run("a ^ a - (a * 2)"), run("a ^ a - (a * 2)"));
        assertEquals("21", run("a ^ a - (a * 2)"));
    }

    @Test
    void testConfiguredMessages() {
        properties.setFarewellMessage("See you");
        properties.setHelpMessage("usage");
        assertEquals("usage", run("/help"));
        assertEquals("See you", run("/exit"));
    }
}
