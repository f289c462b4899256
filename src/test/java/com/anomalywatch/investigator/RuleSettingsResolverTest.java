package com.anomalywatch.investigator;

import com.anomalywatch.exception.InvestigationValidationException;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RuleSettingsResolver}.
 */
class RuleSettingsResolverTest {

    private static ValidatorFactory validatorFactory;
    private static RuleSettingsResolver resolver;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        resolver = new RuleSettingsResolver(validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    @Test
    @DisplayName("Should return a copy of the defaults when there are no overlays")
    void shouldCopyDefaults() {
        InvoiceRuleSettings defaults = new InvoiceRuleSettings();

        InvoiceRuleSettings resolved = resolver.resolve(defaults, InvoiceRuleSettings.class, List.of());

        assertThat(resolved).isEqualTo(defaults).isNotSameAs(defaults);
    }

    @Test
    @DisplayName("Should override only the fields an overlay names")
    void shouldOverrideNamedFields() {
        InvoiceRuleSettings defaults = new InvoiceRuleSettings();

        InvoiceRuleSettings resolved = resolver.resolve(defaults, InvoiceRuleSettings.class,
                List.of("{\"maxTaxRatio\": 0.3}"));

        assertThat(resolved.getMaxTaxRatio()).isEqualByComparingTo("0.3");
        assertThat(resolved.isCheckNegativeAmounts()).isTrue();
        assertThat(resolved.getMaxFutureDays()).isZero();
        assertThat(defaults.getMaxTaxRatio()).isEqualByComparingTo(new BigDecimal("0.5"));
    }

    @Test
    @DisplayName("Should match field names case-insensitively and ignore unknown fields")
    void shouldBeLenientAboutFieldNames() {
        WaybillRuleSettings resolved = resolver.resolve(new WaybillRuleSettings(), WaybillRuleSettings.class,
                List.of("{\"ExpiringSoonHours\": 48, \"Colour\": \"blue\"}"));

        assertThat(resolved.getExpiringSoonHours()).isEqualTo(48);
    }

    @Test
    @DisplayName("Should apply overlays in order")
    void shouldApplyLaterOverlaysLast() {
        WaybillRuleSettings resolved = resolver.resolve(new WaybillRuleSettings(), WaybillRuleSettings.class,
                List.of("{\"legacyCutoffDays\": 14, \"checkExpiringSoon\": false}", "{\"legacyCutoffDays\": 30}"));

        assertThat(resolved.getLegacyCutoffDays()).isEqualTo(30);
        assertThat(resolved.isCheckExpiringSoon()).isFalse();
    }

    @Test
    @DisplayName("Should skip overlays that are not valid JSON or out of range")
    void shouldSkipInvalidOverlays() {
        WaybillRuleSettings resolved = resolver.resolve(new WaybillRuleSettings(), WaybillRuleSettings.class,
                Arrays.asList("{not json", "{\"expiringSoonHours\": 500}", null, " ", "{\"legacyCutoffDays\": 3}"));

        assertThat(resolved.getExpiringSoonHours()).isEqualTo(24);
        assertThat(resolved.getLegacyCutoffDays()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should accept JSON objects and empty configurations")
    void shouldAcceptJsonObjects() {
        assertThatCode(() -> resolver.requireJsonObject("{\"maxTaxRatio\": 0.2}")).doesNotThrowAnyException();
        assertThatCode(() -> resolver.requireJsonObject(null)).doesNotThrowAnyException();
        assertThatCode(() -> resolver.requireJsonObject("")).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("Should reject configurations that are not JSON objects")
    void shouldRejectNonObjects() {
        assertThatThrownBy(() -> resolver.requireJsonObject("[1, 2]"))
                .isInstanceOf(InvestigationValidationException.class)
                .hasMessageContaining("JSON object");
        assertThatThrownBy(() -> resolver.requireJsonObject("{broken"))
                .isInstanceOf(InvestigationValidationException.class)
                .hasMessageContaining("not valid JSON");
    }
}
