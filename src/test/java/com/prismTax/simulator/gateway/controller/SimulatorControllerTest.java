package com.prismTax.simulator.gateway.controller;

import com.prismTax.simulator.classifier.service.NluApiClient;
import com.prismTax.simulator.collaborator.client.DocumentOcrApiClient;
import com.prismTax.simulator.collaborator.client.ProjectFundsApiClient;
import com.prismTax.simulator.collaborator.client.TaxCalculationApiClient;
import com.prismTax.simulator.collaborator.dto.VatCalculationResponse;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.startsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = {
        "simulator.classifier.enabled=false",
        "simulator.seed-test-data=true"
})
@AutoConfigureMockMvc
@DisplayName("SimulatorController")
class SimulatorControllerTest {

    private static final String PHONE_HEADER = "X-Simulator-Phone";

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TaxCalculationApiClient taxCalculationApiClient;
    @MockBean
    private ProjectFundsApiClient projectFundsApiClient;
    @MockBean
    private DocumentOcrApiClient documentOcrApiClient;
    @MockBean
    private NluApiClient nluApiClient;

    @Test
    void missingPhoneHeaderIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/simulator/messages")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"hi\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_PHONE_NUMBER"));
    }

    @Test
    void blankMessageIsRejected() throws Exception {
        mockMvc.perform(post("/api/v1/simulator/messages")
                        .header(PHONE_HEADER, "+2348000000001")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownEntityTypeIsMalformed() throws Exception {
        mockMvc.perform(post("/api/v1/simulator/messages")
                        .header(PHONE_HEADER, "+2348000000002")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"hi\",\"entityType\":\"PARTNERSHIP\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_REQUEST"));
    }

    @Test
    @DisplayName("seeded greeting registers, then a VAT command relays the calculator result")
    void greetingThenVat() throws Exception {
        String phone = "+2348000000003";
        when(taxCalculationApiClient.calculateVat(any(), anyString())).thenReturn(VatCalculationResponse.builder()
                .classification("standard")
                .subtotal(new BigDecimal("50000"))
                .vatRate(new BigDecimal("0.075"))
                .vatAmount(new BigDecimal("3750"))
                .total(new BigDecimal("53750"))
                .build());

        mockMvc.perform(post("/api/v1/simulator/messages")
                        .header(PHONE_HEADER, phone)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"hi\",\"entityType\":\"BUSINESS\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("REGISTERED"))
                .andExpect(jsonPath("$.entityType").value("BUSINESS"))
                .andExpect(jsonPath("$.messages", hasSize(1)));

        mockMvc.perform(post("/api/v1/simulator/messages")
                        .header(PHONE_HEADER, phone)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"vat 50000\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messages", hasSize(2)))
                .andExpect(jsonPath("$.messages[0].placeholder").value(true))
                .andExpect(jsonPath("$.messages[1].text", startsWith("📊 *VAT Calculation*")));

        mockMvc.perform(get("/api/v1/simulator/transcript").header(PHONE_HEADER, phone))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("REGISTERED"))
                .andExpect(jsonPath("$.profile.businessName").value("Adaeze Ventures Ltd"))
                .andExpect(jsonPath("$.messages", hasSize(5)))
                .andExpect(jsonPath("$.messages[0].sender").value("USER"))
                .andExpect(jsonPath("$.messages[1].sender").value("BOT"));
    }

    @Test
    void resetStartsOver() throws Exception {
        String phone = "+2348000000004";
        mockMvc.perform(post("/api/v1/simulator/messages")
                        .header(PHONE_HEADER, phone)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"messageText\":\"hi\",\"entityType\":\"INDIVIDUAL\"}"))
                .andExpect(jsonPath("$.state").value("REGISTERED"));

        mockMvc.perform(post("/api/v1/simulator/reset").header(PHONE_HEADER, phone))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("NEW"))
                .andExpect(jsonPath("$.entityType").value("INDIVIDUAL"))
                .andExpect(jsonPath("$.messages", hasSize(0)));
    }

    @Test
    void staleButtonIsUnavailable() throws Exception {
        mockMvc.perform(post("/api/v1/simulator/buttons")
                        .header(PHONE_HEADER, "+2348000000005")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"buttonId\":\"pay_now\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("NEW"))
                .andExpect(jsonPath("$.messages[0].text", startsWith("That option is no longer available.")));
    }
}
