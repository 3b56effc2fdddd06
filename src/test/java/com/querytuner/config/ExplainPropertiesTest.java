package com.querytuner.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Explain properties validation")
class ExplainPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void createValidator() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void closeValidator() {
        factory.close();
    }

    @Test
    @DisplayName("Defaults are valid")
    void defaultsValid() {
        assertThat(validator.validate(new ExplainProperties())).isEmpty();
    }

    @Test
    @DisplayName("Product name with a single quote is rejected")
    void productWithQuote() {
        ExplainProperties properties = new ExplainProperties();
        properties.setProduct("tuner'); DROP TABLE t; --");

        Set<ConstraintViolation<ExplainProperties>> violations = validator.validate(properties);

        assertThat(violations).hasSize(1);
        ConstraintViolation<ExplainProperties> violation = violations.iterator().next();
        assertThat(violation.getPropertyPath().toString()).isEqualTo("product");
        assertThat(violation.getMessage()).isEqualTo("must not contain a single quote");
    }

    @Test
    @DisplayName("Other punctuation in the product name is allowed")
    void productWithPunctuation() {
        ExplainProperties properties = new ExplainProperties();
        properties.setProduct("query-tuner \"beta\" v2");

        assertThat(validator.validate(properties)).isEmpty();
    }
}
