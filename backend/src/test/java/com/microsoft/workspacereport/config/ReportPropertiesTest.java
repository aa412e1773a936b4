package com.microsoft.workspacereport.config;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.ConfigurationPropertySources;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for ReportProperties and the shipped application.yml.
 *
 * Test strategy:
 * 1. Every remote call is bounded below the per-workspace lookup timeout
 * 2. Directory searches tolerate the referrals returned at a domain root
 * 3. Timeout validation rejects call timeouts that outlive the lookup timeout
 */
class ReportPropertiesTest {

    @Nested
    @DisplayName("Shipped Configuration Tests")
    class ShippedConfigurationTests {

        private Binder binder;

        @BeforeEach
        void loadApplicationYaml() throws IOException {
            var sources = new YamlPropertySourceLoader()
                    .load("application", new ClassPathResource("application.yml"));
            binder = new Binder(ConfigurationPropertySources.from(sources));
        }

        @Test
        @DisplayName("AWS and LDAP reads end before the lookup timeout")
        void remoteCallsBoundedByLookupTimeout() {
            // When
            Duration lookupTimeout = binder.bind("report.lookup-timeout", Duration.class).get();
            Duration awsCallTimeout = binder.bind("report.aws-call-timeout", Duration.class).get();
            Map<String, String> jndi = binder.bind("spring.ldap.base-environment",
                    Bindable.mapOf(String.class, String.class)).get();

            // Then
            assertThat(awsCallTimeout).isLessThan(lookupTimeout);
            assertThat(jndi).containsKeys("com.sun.jndi.ldap.connect.timeout", "com.sun.jndi.ldap.read.timeout");
            assertThat(Duration.ofMillis(Long.parseLong(jndi.get("com.sun.jndi.ldap.read.timeout"))))
                    .isLessThan(lookupTimeout);
        }

        @Test
        @DisplayName("Partial results from directory referrals are ignored")
        void referralsIgnored() {
            // When
            boolean ignored = binder.bind("spring.ldap.template.ignore-partial-result-exception", Boolean.class)
                    .orElse(false);

            // Then
            assertThat(ignored).isTrue();
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        private ValidatorFactory factory;
        private Validator validator;

        @BeforeEach
        void createValidator() {
            factory = Validation.buildDefaultValidatorFactory();
            validator = factory.getValidator();
        }

        @AfterEach
        void closeValidator() {
            factory.close();
        }

        @Test
        @DisplayName("Defaults are valid")
        void defaultsAreValid() {
            assertThat(validator.validate(new ReportProperties())).isEmpty();
        }

        @Test
        @DisplayName("AWS call timeout at or above the lookup timeout is rejected")
        void awsCallTimeoutMustBeShorter() {
            // Given
            ReportProperties properties = new ReportProperties();
            properties.setLookupTimeout(Duration.ofSeconds(20));
            properties.setAwsCallTimeout(Duration.ofSeconds(20));

            // When
            Set<ConstraintViolation<ReportProperties>> violations = validator.validate(properties);

            // Then
            assertThat(violations).extracting(ConstraintViolation::getMessage)
                    .containsExactly("aws-call-timeout must be shorter than lookup-timeout");
        }
    }
}
