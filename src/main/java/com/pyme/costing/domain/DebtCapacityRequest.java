package com.pyme.costing.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DebtCapacityRequest {
    private String archetype;
    private Double monthlyIncome;
    private Double fixedExpenses;
    private Double existingDebts;
    private String businessTenure; // "menos-6", "6-12", "1-2", "2-5", "mas-5"
    private String loanPurpose;
}
