package com.formula.adapter.cli;

import com.formula.adapter.spring.FormulaProperties;
import com.formula.exception.FormulaException;
import com.formula.format.FormulaProcessor;
import com.formula.format.FormulaRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.io.PrintStream;

/**
 * Runs one formula request from the command line and records the process exit code.
 * <p>
 * Exit codes: 0 on success, 1 when the formula cannot be processed, 2 for invalid arguments.
 */
public class FormulaRunner implements ApplicationRunner, ExitCodeGenerator {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FORMULA_ERROR = 1;
    public static final int EXIT_USAGE_ERROR = 2;

    private static final Logger log = LoggerFactory.getLogger(FormulaRunner.class);

    private final FormulaProcessor formulaProcessor;
    private final FormulaProperties properties;
    private final PrintStream out;
    private final PrintStream err;
    private int exitCode = EXIT_OK;

    public FormulaRunner(FormulaProcessor formulaProcessor, FormulaProperties properties) {
        this(formulaProcessor, properties, System.out, System.err);
    }

    FormulaRunner(FormulaProcessor formulaProcessor, FormulaProperties properties, PrintStream out, PrintStream err) {
        this.formulaProcessor = formulaProcessor;
        this.properties = properties;
        this.out = out;
        this.err = err;
    }

    @Override
    public void run(ApplicationArguments args) {
        try {
            FormulaRequest request = FormulaCommandLine.parse(args, properties);
            out.println(formulaProcessor.process(request));
            exitCode = EXIT_OK;
        } catch (FormulaException e) {
            fail(EXIT_FORMULA_ERROR, e);
        } catch (IllegalArgumentException e) {
            fail(EXIT_USAGE_ERROR, e);
        }
    }

    private void fail(int code, RuntimeException e) {
        log.error("Formula processing failed: {}", e.getMessage());
        err.println("Error: " + e.getMessage());
        exitCode = code;
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
