package com.anomalywatch.service;

import com.anomalywatch.investigator.InvoiceInvestigator;
import com.anomalywatch.investigator.WaybillInvestigator;
import com.anomalywatch.model.InvestigatorType;
import com.anomalywatch.repository.InvestigatorTypeRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Makes sure the standard investigator types exist in the catalog.
 * Existing rows are left untouched, including their active flag.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvestigatorCatalogSeeder implements ApplicationRunner {

    private final InvestigatorTypeRepository typeRepository;
    private final InvestigatorCatalogService catalogService;

    @Override
    public void run(ApplicationArguments args) {
        seed(InvoiceInvestigator.TYPE_CODE, "Invoice Investigator",
                "Detects negative amounts, excessive tax ratios and future issue dates");
        seed(WaybillInvestigator.TYPE_CODE, "Waybill Investigator",
                "Detects overdue, expiring soon and legacy overdue deliveries");
    }

    private void seed(String code, String displayName, String description) {
        if (typeRepository.existsByCode(code)) {
            return;
        }
        InvestigatorType type = new InvestigatorType();
        type.setCode(code);
        type.setDisplayName(displayName);
        type.setDescription(description);
        type.setActive(true);
        catalogService.save(type);
        log.info("Seeded investigator type {}", code);
    }
}
