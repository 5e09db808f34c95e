package com.calc;

import com.calc.evaluator.EvaluationResult;
import com.calc.spring.EnableCalc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;

/**
 * Example Spring Boot application demonstrating Calc usage.
 * Each command-line argument is normalized and evaluated; without arguments a
 * fixed set of samples is used.
 */
@SpringBootApplication
@EnableCalc
public class CalcApplication {

    private static final Logger log = LoggerFactory.getLogger(CalcApplication.class);

    private static final List<String> SAMPLES = List.of(
            "2(3+4)^2",
            "(5+3)*2-4",
            "2**3**2",
            "3^40",
            "10 % 3",
            "5/0",
            "2x^2 + 3x + 4",
            "sin x + 1"
    );

    public static void main(String[] args) {
        SpringApplication.run(CalcApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(ExpressionCalculator calculator) {
        return args -> {
            log.info("=== Calc Demo Started ===");

            List<String> inputs = args.length > 0 ? List.of(args) : SAMPLES;
            for (String input : inputs) {
                EvaluationResult result = calculator.calculate(input);
                if (result.isSuccess()) {
                    log.info("{} -> {} = {}", input, result.getExpression(), result.getValue());
                } else {
                    log.info("{} -> {} : {}", input, result.getExpression(), result.getError());
                }
            }

            log.info("=== Calc Demo Finished ===");
        };
    }
}
