package com.pyme.costing.engine;

import com.pyme.costing.domain.ArchetypeProfile;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.BusinessTenure;
import com.pyme.costing.domain.DebtCapacityAssessment;
import com.pyme.costing.domain.DebtCapacityRequest;
import com.pyme.costing.domain.RiskLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * How much new monthly debt a business can carry, with indicative loan sizes and a
 * coarse risk level. Tenure scales capacity: young businesses get less headroom.
 */
@Slf4j
@Component
public class DebtCapacityEstimator {

    static final double UNKNOWN_TENURE_MULTIPLIER = 0.7;
    static final double DEFAULT_SAFE_DEBT_RATIO = 0.30;

    /** Loan term in months to multiple of the monthly payment. */
    static final Map<Integer, Double> TERM_MULTIPLES = Map.of(12, 10.0, 24, 18.0, 36, 24.0);

    public DebtCapacityAssessment estimate(BusinessArchetype archetype, DebtCapacityRequest request) {
        List<String> errors = new ArrayList<>();
        if (request == null || request.getMonthlyIncome() == null || request.getMonthlyIncome() <= 0) {
            errors.add("Ingresos mensuales debe ser mayor a 0");
        }
        if (request == null || request.getFixedExpenses() == null || request.getFixedExpenses() <= 0) {
            errors.add("Gastos fijos debe ser mayor a 0");
        }
        if (request != null && request.getExistingDebts() != null && request.getExistingDebts() < 0) {
            errors.add("Deudas existentes no puede ser negativo");
        }
        if (!errors.isEmpty()) {
            log.debug("Debt capacity request rejected: {}", errors);
            return DebtCapacityAssessment.builder().errors(List.copyOf(errors)).build();
        }

        double income = request.getMonthlyIncome();
        double fixed = request.getFixedExpenses();
        double existing = request.getExistingDebts() != null ? request.getExistingDebts() : 0.0;
        BusinessTenure tenure = BusinessTenure.fromCode(request.getBusinessTenure()).orElse(null);

        double available = income - fixed - existing;
        double debtToIncome = existing / income * 100;
        double safeRatio = archetype != null ? ArchetypeProfile.of(archetype).getSafeDebtRatio() : DEFAULT_SAFE_DEBT_RATIO;
        double multiplier = tenure != null ? tenure.getCapacityMultiplier() : UNKNOWN_TENURE_MULTIPLIER;
        double maxNewDebt = Math.max(0, income * safeRatio * multiplier - existing);

        Map<Integer, Double> loans = new LinkedHashMap<>();
        TERM_MULTIPLES.keySet().stream().sorted()
                .forEach(term -> loans.put(term, maxNewDebt * TERM_MULTIPLES.get(term)));

        return DebtCapacityAssessment.builder()
                .errors(List.of())
                .archetype(archetype)
                .businessTenure(tenure != null ? tenure.getCode() : request.getBusinessTenure())
                .loanPurpose(request.getLoanPurpose())
                .monthlyIncome(income)
                .existingDebts(existing)
                .fixedExpenses(fixed)
                .availableIncome(available)
                .debtToIncomeRatio(debtToIncome)
                .safeDebtRatio(safeRatio)
                .maxNewDebt(maxNewDebt)
                .loanAmounts(loans)
                .riskLevel(riskLevel(debtToIncome, available, tenure))
                .build();
    }

    RiskLevel riskLevel(double debtToIncomeRatio, double availableIncome, BusinessTenure tenure) {
        int score = 0;

        if (debtToIncomeRatio > 40) {
            score += 3;
        } else if (debtToIncomeRatio > 25) {
            score += 2;
        } else if (debtToIncomeRatio > 15) {
            score += 1;
        }

        if (availableIncome < 500_000) {
            score += 3;
        } else if (availableIncome < 1_000_000) {
            score += 2;
        } else if (availableIncome < 2_000_000) {
            score += 1;
        }

        if (tenure != null) {
            score += tenure.getRiskPoints();
        }

        if (score >= 6) {
            return RiskLevel.HIGH;
        }
        return score >= 3 ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }
}
