package com.pyme.costing.web;

import com.pyme.costing.CostingApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = CostingApplication.class)
class CostAnalysisControllerTest {

    private MockMvc mockMvc;

    @Autowired
    private WebApplicationContext context;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void listsArchetypes() throws Exception {
        mockMvc.perform(get("/api/v1/archetypes"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(5)))
                .andExpect(jsonPath("$[0].code").value("manufactura"))
                .andExpect(jsonPath("$[0].displayName").value("Manufactura"));
    }

    @Test
    void returnsSchemaForKnownArchetype() throws Exception {
        mockMvc.perform(get("/api/v1/archetypes/reventa/schema"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[3].name").value("desiredMarginPct"))
                .andExpect(jsonPath("$[3].type").value("percent"))
                .andExpect(jsonPath("$[3].defaultValue").value(30.0));
    }

    @Test
    void unknownArchetypeSchemaIsNotFound() throws Exception {
        mockMvc.perform(get("/api/v1/archetypes/restaurante/schema"))
                .andExpect(status().isNotFound());
    }

    @Test
    void analysesValidInput() throws Exception {
        String body = """
                {"archetype": "reventa", "sessionId": "abc",
                 "inputs": {"purchaseCost": 10000, "logisticsPct": 5, "storage": 3000, "desiredMarginPct": 30}}
                """;

        mockMvc.perform(post("/api/v1/analysis").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.archetype").value("reventa"))
                .andExpect(jsonPath("$.sessionId").value("abc"))
                .andExpect(jsonPath("$.analysis.sellingPrice").value(13780.0))
                .andExpect(jsonPath("$.analysis.roi").value(30.0))
                .andExpect(jsonPath("$.metrics.overallBand").value("excellent"))
                .andExpect(jsonPath("$.benchmarks", hasSize(3)))
                .andExpect(jsonPath("$.recommendations.priority", hasSize(2)));
    }

    @Test
    void validationErrorsAreReturnedAsData() throws Exception {
        String body = """
                {"archetype": "manufactura", "inputs": {"materials": "mucho", "labor": 2000}}
                """;

        mockMvc.perform(post("/api/v1/analysis").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.errors[0]").value("Materias primas debe ser un número válido"))
                .andExpect(jsonPath("$.analysis").doesNotExist());
    }

    @Test
    void estimatesDebtCapacity() throws Exception {
        String body = """
                {"archetype": "manufactura", "monthlyIncome": 5000000, "fixedExpenses": 2000000,
                 "existingDebts": 500000, "businessTenure": "1-2", "loanPurpose": "maquinaria"}
                """;

        mockMvc.perform(post("/api/v1/debt-capacity").contentType(MediaType.APPLICATION_JSON).content(body))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.riskLevel").value("BAJO"))
                .andExpect(jsonPath("$.loanAmounts['12']").exists())
                .andExpect(jsonPath("$.loanPurpose").value("maquinaria"));
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/analysis").contentType(MediaType.APPLICATION_JSON).content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Bad Request"))
                .andExpect(jsonPath("$.path").value("/api/v1/analysis"));
    }
}
