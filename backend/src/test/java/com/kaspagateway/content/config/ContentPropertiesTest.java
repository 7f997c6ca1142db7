package com.kaspagateway.content.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ContentPropertiesTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void defaults_areValid() {
        assertThat(validator.validate(new ContentProperties())).isEmpty();
    }

    @Test
    void allowedRepo_blankFieldsAreRejected() {
        ContentProperties properties = new ContentProperties();
        ContentProperties.AllowedRepo entry = new ContentProperties.AllowedRepo();
        entry.setSource("");
        entry.setRepo("Kaspa-Exchange-Data");
        properties.setAllowedRepos(List.of(entry));

        Set<ConstraintViolation<ContentProperties>> violations = validator.validate(properties);

        assertThat(violations).extracting(v -> v.getPropertyPath().toString())
                .containsExactlyInAnyOrder("allowedRepos[0].source", "allowedRepos[0].owner");
    }

    @Test
    void requestsPerHour_mustBePositive() {
        ContentProperties properties = new ContentProperties();
        properties.setRequestsPerHour(0);

        assertThat(validator.validate(properties)).extracting(v -> v.getPropertyPath().toString())
                .containsExactly("requestsPerHour");
    }
}
