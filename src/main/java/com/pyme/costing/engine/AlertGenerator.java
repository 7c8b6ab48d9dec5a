package com.pyme.costing.engine;

import com.pyme.costing.domain.Alert;
import com.pyme.costing.domain.AlertType;
import com.pyme.costing.domain.BusinessArchetype;
import com.pyme.costing.domain.CostField;
import com.pyme.costing.domain.CostInput;
import com.pyme.costing.domain.Metrics;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.pyme.costing.engine.ProportionExtractor.*;

/**
 * Threshold rules over cost proportions. Rules on the same component are mutually
 * exclusive, so each component yields at most one alert.
 */
@Component
public class AlertGenerator {

    static final double PROJECT_HOURS_EXTENSIVE = 80;

    public List<Alert> generateAlerts(BusinessArchetype archetype, CostInput costs, Metrics metrics) {
        List<Alert> alerts = new ArrayList<>();
        switch (archetype) {
            case MANUFACTURING -> manufacturing(metrics, alerts);
            case RESALE -> resale(metrics, alerts);
            case SERVICE -> service(costs, metrics, alerts);
            case HYBRID -> hybrid(metrics, alerts);
            case PACKAGE -> {
                // no proportion rules for bundles
            }
        }
        return List.copyOf(alerts);
    }

    private void manufacturing(Metrics metrics, List<Alert> alerts) {
        double materials = metrics.proportion(MATERIALS_SHARE);
        if (materials > 0.7) {
            alerts.add(alert(AlertType.WARNING, "Materias Primas Muy Altas",
                    Formats.percent(materials) + " del costo son materias primas (óptimo: 40-60%)",
                    "Considera negociar precios con proveedores o buscar alternativas"));
        } else if (materials < 0.3) {
            alerts.add(alert(AlertType.INFO, "Materias Primas Bajas",
                    "Solo " + Formats.percent(materials) + " son materias primas. Verifica si incluiste todos los componentes",
                    "Revisa si faltan materiales en el cálculo"));
        }

        double labor = metrics.proportion(LABOR_SHARE);
        if (labor > 0.5) {
            alerts.add(alert(AlertType.DANGER, "Mano de Obra Excesiva",
                    Formats.percent(labor) + " del costo es mano de obra (recomendado: 15-35%)",
                    "Evalúa automatización o optimización de procesos"));
        }
    }

    private void resale(Metrics metrics, List<Alert> alerts) {
        double purchase = metrics.proportion(PURCHASE_SHARE);
        if (purchase > 0.8) {
            alerts.add(alert(AlertType.WARNING, "Costo de Compra Alto",
                    Formats.percent(purchase) + " del total es costo de compra (óptimo: 50-70%)",
                    "Busca mejores precios de proveedores o aumenta el margen"));
        } else if (purchase < 0.4) {
            alerts.add(alert(AlertType.INFO, "Margen Muy Alto",
                    "El costo de compra es solo " + Formats.percent(purchase) + " del total",
                    "Verifica si el precio de venta es competitivo en el mercado"));
        }
    }

    private void service(CostInput costs, Metrics metrics, List<Alert> alerts) {
        double hourlyValue = metrics.proportion(HOURLY_VALUE_SHARE);
        if (hourlyValue < 0.4) {
            alerts.add(alert(AlertType.WARNING, "Valor Hora Bajo",
                    "El valor por hora representa solo " + Formats.percent(hourlyValue) + " del precio total",
                    "Considera aumentar tu tarifa horaria o reducir gastos operativos"));
        }

        double hours = costs.amount(CostField.PROJECT_HOURS);
        if (hours > PROJECT_HOURS_EXTENSIVE) {
            alerts.add(alert(AlertType.INFO, "Proyecto Extenso",
                    Formats.plain(hours) + " horas por proyecto es considerable",
                    "Evalúa dividir en fases o cobrar por hitos"));
        }
    }

    private void hybrid(Metrics metrics, List<Alert> alerts) {
        double service = metrics.proportion(SERVICE_SHARE);
        if (service < 0.2) {
            alerts.add(alert(AlertType.WARNING, "Componente Servicio Bajo",
                    "Los servicios son solo " + Formats.percent(service) + " del precio",
                    "Aumenta el valor del componente profesional"));
        }

        double products = metrics.proportion(PRODUCTS_SHARE);
        if (products > 0.7) {
            alerts.add(alert(AlertType.INFO, "Orientado a Productos",
                    "Los productos representan " + Formats.percent(products) + " del total",
                    "Considera si realmente necesitas el modelo híbrido"));
        }
    }

    private static Alert alert(AlertType type, String title, String message, String suggestion) {
        return Alert.builder()
                .type(type)
                .title(title)
                .message(message)
                .suggestion(suggestion)
                .build();
    }
}
