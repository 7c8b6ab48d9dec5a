package com.pyme.costing.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DebtCapacityAssessment {
    List<String> errors;

    BusinessArchetype archetype;
    String businessTenure;
    String loanPurpose;

    Double monthlyIncome;
    Double existingDebts;
    Double fixedExpenses;
    Double availableIncome;
    Double debtToIncomeRatio;  // %
    Double safeDebtRatio;
    Double maxNewDebt;         // monthly payment

    /** Term in months to indicative loan amount. */
    Map<Integer, Double> loanAmounts;

    RiskLevel riskLevel;

    public boolean isValid() {
        return errors == null || errors.isEmpty();
    }
}
