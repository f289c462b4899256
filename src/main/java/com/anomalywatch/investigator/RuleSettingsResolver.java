package com.anomalywatch.investigator;

import com.anomalywatch.exception.InvestigationValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds the effective rule settings for one execution.
 *
 * LAYERS:
 * =======
 * 1. investigation.invoice / investigation.waybill from application.yml
 * 2. InvestigatorType.defaultConfiguration (JSON object)
 * 3. InvestigatorInstance.customConfiguration (JSON object)
 *
 * Each layer only overrides the fields it names. Field names are matched case
 * insensitively, unknown fields are ignored. A layer that is not valid JSON, or
 * that produces out-of-range values, is skipped with a warning so a bad stored
 * configuration never prevents an investigation from running.
 */
@Component
@Slf4j
public class RuleSettingsResolver {

    private final ObjectMapper mapper = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private final Validator validator;

    public RuleSettingsResolver(Validator validator) {
        this.validator = validator;
    }

    /**
     * Apply overlays in order on a copy of the defaults. The defaults are not modified.
     */
    public <T> T resolve(T defaults, Class<T> type, List<String> overlays) {
        T effective = mapper.convertValue(defaults, type);
        if (overlays == null) {
            return effective;
        }
        for (String overlay : overlays) {
            if (overlay == null || overlay.isBlank()) {
                continue;
            }
            try {
                T candidate = mapper.readerForUpdating(mapper.convertValue(effective, type)).readValue(overlay);
                Set<ConstraintViolation<T>> violations = validator.validate(candidate);
                if (!violations.isEmpty()) {
                    log.warn("Ignoring {} configuration with invalid values: {}", type.getSimpleName(), describe(violations));
                    continue;
                }
                effective = candidate;
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unreadable {} configuration: {}", type.getSimpleName(), e.getOriginalMessage());
            }
        }
        return effective;
    }

    /**
     * Check that a configuration supplied by an administrator is a JSON object.
     *
     * @throws InvestigationValidationException if it is not
     */
    public void requireJsonObject(String configuration) {
        if (configuration == null || configuration.isBlank()) {
            return;
        }
        try {
            JsonNode node = mapper.readTree(configuration);
            if (node == null || !node.isObject()) {
                throw new InvestigationValidationException("Configuration must be a JSON object");
            }
        } catch (JsonProcessingException e) {
            throw new InvestigationValidationException("Configuration is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> String describe(Set<ConstraintViolation<T>> violations) {
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
