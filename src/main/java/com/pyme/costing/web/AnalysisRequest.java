package com.pyme.costing.web;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {
    private String archetype; // "manufactura", "reventa", "servicio", "hibrido" or "paquete"
    private String sessionId;
    private Map<String, Object> inputs;
}
