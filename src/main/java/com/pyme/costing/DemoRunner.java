package com.pyme.costing;

import com.pyme.costing.domain.AnalysisReport;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.DebtCapacityAssessment;
import com.pyme.costing.domain.DebtCapacityRequest;
import com.pyme.costing.service.CostAnalysisService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Prints one sample analysis per business type on startup.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "costing.demo.enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    private final CostAnalysisService service;

    @Override
    public void run(String... args) {
        System.out.println("=== STARTING SME COSTING DEMO (COP) ===");

        Map<BusinessArchetype, Map<String, Object>> samples = new LinkedHashMap<>();
        // Handmade soap: per-unit costs plus monthly overhead
        samples.put(BusinessArchetype.MANUFACTURING,
                Map.of("materials", 3000, "labor", 2000, "packaging", 300, "overhead", 9000));
        samples.put(BusinessArchetype.RESALE,
                Map.of("purchaseCost", 10000, "logisticsPct", 5, "storage", 3000, "desiredMarginPct", 30));
        samples.put(BusinessArchetype.SERVICE,
                Map.of("hourlyRate", 50000, "projectHours", 20, "operationalCost", 200000, "experienceLevel", "senior"));
        samples.put(BusinessArchetype.HYBRID,
                Map.of("professionalRate", 60000, "clientHours", 2, "productsCost", 40000, "additionalCost", 10000));
        samples.put(BusinessArchetype.PACKAGE,
                Map.of("componentsCost", 80000, "itemsCount", 5, "presentation", 15000, "discountPct", 10));

        samples.forEach((archetype, inputs) -> {
            try {
                print(service.analyze(archetype, inputs, "demo-" + archetype.getCode()));
            } catch (RuntimeException e) {
                log.error("Demo analysis failed for {}", archetype, e);
            }
        });

        DebtCapacityAssessment debt = service.estimateDebtCapacity(DebtCapacityRequest.builder()
                .archetype(BusinessArchetype.MANUFACTURING.getCode())
                .monthlyIncome(5_000_000.0)
                .fixedExpenses(2_000_000.0)
                .existingDebts(500_000.0)
                .businessTenure("1-2")
                .loanPurpose("capital-trabajo")
                .build());
        System.out.println("\n--- DEBT CAPACITY ---");
        System.out.printf("Max new monthly payment: %,.0f  Risk: %s%n", debt.getMaxNewDebt(), debt.getRiskLevel().getLabel());
        debt.getLoanAmounts().forEach((term, amount) -> System.out.printf("  %d months: %,.0f%n", term, amount));
    }

    private void print(AnalysisReport report) {
        System.out.println("\n--- " + report.getArchetype().getDisplayName().toUpperCase() + " ---");
        if (!report.isValid()) {
            System.out.println("Invalid input: " + report.getErrors());
            return;
        }
        System.out.printf("Total cost: %,.0f%n", report.getAnalysis().getTotalCost());
        System.out.printf("Price:      %,.0f%n", report.getAnalysis().canonicalPrice());
        System.out.printf("Profit:     %,.0f%n", report.getAnalysis().getProfit());
        System.out.printf("Score:      %.2f (%s)%n", report.getMetrics().getOverallScore(),
                report.getMetrics().getOverallAssessment());
        report.getAlerts().forEach(alert -> System.out.println("  [" + alert.getType() + "] " + alert.getTitle()));
    }
}
