package com.pyme.costing.web;

import com.pyme.costing.domain.AnalysisReport;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.DebtCapacityAssessment;
import com.pyme.costing.domain.DebtCapacityRequest;
import com.pyme.costing.domain.FieldSpec;
import com.pyme.costing.service.CostAnalysisService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Arrays;
import java.util.List;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CostAnalysisController {

    private final CostAnalysisService costAnalysisService;

    @GetMapping("/archetypes")
    public List<ArchetypeView> archetypes() {
        return Arrays.stream(BusinessArchetype.values()).map(ArchetypeView::of).toList();
    }

    @GetMapping("/archetypes/{code}/schema")
    public ResponseEntity<List<FieldSpec>> schema(@PathVariable String code) {
        return costAnalysisService.schemaFor(code)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    /**
     * Validation failures come back as a 200 report with {@code valid=false}.
     */
    @PostMapping("/analysis")
    public ResponseEntity<AnalysisReport> analyze(@RequestBody AnalysisRequest request) {
        AnalysisReport report = costAnalysisService.analyze(
                request.getArchetype(),
                request.getInputs(),
                request.getSessionId()
        );
        return ResponseEntity.ok(report);
    }

    @PostMapping("/debt-capacity")
    public ResponseEntity<DebtCapacityAssessment> debtCapacity(@RequestBody DebtCapacityRequest request) {
        return ResponseEntity.ok(costAnalysisService.estimateDebtCapacity(request));
    }
}
