package com.formula.adapter.cli;

import com.formula.adapter.spring.FormulaProperties;
import com.formula.config.TemplateRegistry;
import com.formula.format.FormulaProcessor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FormulaRunner output and exit codes.
 */
class FormulaRunnerTest {

    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private FormulaRunner runner;

    @BeforeEach
    void setUp() {
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        runner = new FormulaRunner(new FormulaProcessor(TemplateRegistry.defaults(4)), new FormulaProperties(),
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("Successful run prints the result and exits with zero")
    void success() {
        runner.run(new DefaultApplicationArguments("--mode=minify", "= SUM( A1 , B1 )"));

        assertEquals("=SUM(A1,B1)", out.toString(StandardCharsets.UTF_8).strip());
        assertEquals("", err.toString(StandardCharsets.UTF_8));
        assertEquals(FormulaRunner.EXIT_OK, runner.getExitCode());
    }

    @Test
    @DisplayName("Formula error is reported and exits with a failure code")
    void formulaError() {
        runner.run(new DefaultApplicationArguments("--mode=minify", "=SUM(A1))"));

        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: Invalid formula at position 7"));
        assertEquals("", out.toString(StandardCharsets.UTF_8));
        assertEquals(FormulaRunner.EXIT_FORMULA_ERROR, runner.getExitCode());
    }

    @Test
    @DisplayName("Invalid arguments are reported with the usage exit code")
    void usageError() {
        runner.run(new DefaultApplicationArguments("--indent=wide", "=A1"));

        assertTrue(err.toString(StandardCharsets.UTF_8).startsWith("Error: --indent must be an integer"));
        assertEquals(FormulaRunner.EXIT_USAGE_ERROR, runner.getExitCode());
    }
}
