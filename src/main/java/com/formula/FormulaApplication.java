package com.formula;

import com.formula.adapter.cli.FormulaRunner;
import com.formula.adapter.spring.FormulaProperties;
import com.formula.format.FormulaProcessor;
import com.formula.spring.EnableFormula;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * Command line formula beautifier.
 * <p>
 * Example: {@code java -jar formula-beautifier.jar --mode=beautify --indent=2 "=IF(A1>5,SUM(B1:B5),0)"}
 * <p>
 * The process exits with the code reported by {@link FormulaRunner}.
 */
@SpringBootApplication
@EnableFormula
public class FormulaApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(FormulaApplication.class, args)));
    }

    @Bean
    public FormulaRunner formulaRunner(FormulaProcessor formulaProcessor, FormulaProperties properties) {
        return new FormulaRunner(formulaProcessor, properties);
    }
}
