package com.anomalywatch.config;

import com.anomalywatch.investigator.InvestigatorRegistry;
import com.anomalywatch.investigator.InvoiceInvestigator;
import com.anomalywatch.investigator.InvoiceRuleSettings;
import com.anomalywatch.investigator.RuleSettingsResolver;
import com.anomalywatch.investigator.WaybillInvestigator;
import com.anomalywatch.investigator.WaybillRuleSettings;
import com.anomalywatch.repository.InvoiceRepository;
import com.anomalywatch.repository.WaybillRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the investigator registry with the standard investigator kinds.
 *
 * Adding a kind means registering one more constructor here (or from any other
 * configuration class that receives the registry).
 */
@Configuration
@EnableConfigurationProperties(InvestigationProperties.class)
@Slf4j
public class InvestigatorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public InvestigatorRegistry investigatorRegistry(InvestigationProperties properties,
                                                     RuleSettingsResolver settingsResolver,
                                                     InvoiceRepository invoiceRepository,
                                                     WaybillRepository waybillRepository,
                                                     ObjectMapper objectMapper) {
        InvestigatorRegistry registry = new InvestigatorRegistry();

        registry.register(InvoiceInvestigator.TYPE_CODE, context -> new InvoiceInvestigator(
                context,
                settingsResolver.resolve(properties.getInvoice(), InvoiceRuleSettings.class,
                        context.configurationOverlays()),
                invoiceRepository,
                objectMapper));

        registry.register(WaybillInvestigator.TYPE_CODE, context -> new WaybillInvestigator(
                context,
                settingsResolver.resolve(properties.getWaybill(), WaybillRuleSettings.class,
                        context.configurationOverlays()),
                waybillRepository,
                objectMapper));

        log.info("Investigator registry ready with types: {}", registry.registeredTypes());
        return registry;
    }
}
