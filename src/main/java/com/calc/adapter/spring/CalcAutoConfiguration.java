package com.calc.adapter.spring;

import com.calc.ExpressionCalculator;
import com.calc.config.CalcConfig;
import com.calc.config.ConfigLoader;
import com.calc.config.expression.FunctionNameTable;
import com.calc.evaluator.SafeEvaluator;
import com.calc.normalizer.ExpressionNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring Boot auto-configuration for Calc.
 */
@Configuration
@ConditionalOnProperty(prefix = "calc", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(CalcProperties.class)
public class CalcAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(CalcAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public CalcConfig calcConfig(CalcProperties properties) {
        String path = properties.getConfigPath();
        if (path == null || path.isBlank()) {
            log.info("No Calc configuration path set, using built-in defaults");
            return CalcConfig.defaults();
        }
        return ConfigLoader.load(path);
    }

    @Bean
    @ConditionalOnMissingBean
    public FunctionNameTable functionNameTable(CalcConfig config) {
        return config.functions();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionNormalizer expressionNormalizer(FunctionNameTable functions) {
        log.info("Creating ExpressionNormalizer with {} known functions", functions.size());
        return new ExpressionNormalizer(functions);
    }

    @Bean
    @ConditionalOnMissingBean
    public SafeEvaluator safeEvaluator() {
        return new SafeEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpressionCalculator expressionCalculator(ExpressionNormalizer normalizer, SafeEvaluator evaluator) {
        log.info("Creating ExpressionCalculator");
        return new ExpressionCalculator(normalizer, evaluator);
    }
}
