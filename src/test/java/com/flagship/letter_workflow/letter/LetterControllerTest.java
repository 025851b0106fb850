package com.flagship.letter_workflow.letter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of the owner's side of the workflow.
 *
 * These tests verify:
 * - Drafts are created and submitted through the API
 * - An owner with nothing to spend gets 402 and the upgrade message
 * - Missing identity and malformed input answer 400
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class LetterControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("letter_workflow_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // Disable Kafka and outbox publisher for these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private UUID createLetter(UUID ownerId, String title) throws Exception {
        String body = """
            {"letter_type": "demand_letter", "title": "%s", "intake_data": {"amount": 1200}}
            """.formatted(title);

        MvcResult result = mockMvc.perform(post("/api/letters")
                        .header(LetterController.USER_ID_HEADER, ownerId.toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(body))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.status").value("DRAFT"))
                .andExpect(jsonPath("$.owner_id").value(ownerId.toString()))
                .andReturn();

        JsonNode json = objectMapper.readTree(result.getResponse().getContentAsString());
        return UUID.fromString(json.get("id").asText());
    }

    @Test
    @DisplayName("Create then submit: the first letter uses the free trial")
    void testCreateAndSubmitWithFreeTrial() throws Exception {
        printTestHeader("Create And Submit With Free Trial");

        UUID ownerId = UUID.randomUUID();
        UUID letterId = createLetter(ownerId, "Unpaid invoice");

        MvcResult result = mockMvc.perform(post("/api/letters/{id}/submit", letterId)
                        .header(LetterController.USER_ID_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.free_trial").value(true))
                .andExpect(jsonPath("$.letter.status").value("GENERATING"))
                .andExpect(jsonPath("$.letter.free_trial").value(true))
                .andReturn();
        printOutput("Response", result.getResponse().getContentAsString());

        mockMvc.perform(get("/api/letters/{id}/audit", letterId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(3));

        mockMvc.perform(get("/api/letters")
                        .header(LetterController.USER_ID_HEADER, ownerId.toString()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(1));

        printSuccess("Letter submitted on the free trial");
    }

    @Test
    @DisplayName("Second submission without a subscription answers 402 with the upgrade message")
    void testSubmitWithoutAllowance() throws Exception {
        printTestHeader("Submit Without Allowance");

        UUID ownerId = UUID.randomUUID();
        UUID first = createLetter(ownerId, "First letter");
        UUID second = createLetter(ownerId, "Second letter");

        mockMvc.perform(post("/api/letters/{id}/submit", first)
                        .header(LetterController.USER_ID_HEADER, ownerId.toString()))
                .andExpect(status().isOk());

        MvcResult result = mockMvc.perform(post("/api/letters/{id}/submit", second)
                        .header(LetterController.USER_ID_HEADER, ownerId.toString()))
                .andExpect(status().isPaymentRequired())
                .andExpect(jsonPath("$.code").value("NO_ACTIVE_ALLOWANCE"))
                .andExpect(jsonPath("$.message").value(
                        "You have no letter credits available. Upgrade your plan or wait for your next billing period."))
                .andReturn();
        printOutput("Response", result.getResponse().getContentAsString());

        mockMvc.perform(get("/api/letters/{id}", second))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DRAFT"));

        printSuccess("Refused submission left the draft untouched");
    }

    @Test
    @DisplayName("Submitting someone else's letter answers 403")
    void testSubmitOthersLetter() throws Exception {
        printTestHeader("Submit Others Letter");

        UUID letterId = createLetter(UUID.randomUUID(), "Not yours");

        mockMvc.perform(post("/api/letters/{id}/submit", letterId)
                        .header(LetterController.USER_ID_HEADER, UUID.randomUUID().toString()))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("NOT_LETTER_OWNER"));

        printSuccess("Only the owner submits");
    }

    @Test
    @DisplayName("Missing user header, invalid body and unknown letter")
    void testBadRequests() throws Exception {
        printTestHeader("Bad Requests");

        mockMvc.perform(post("/api/letters")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"letter_type\": \"demand_letter\", \"title\": \"No header\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION"));

        mockMvc.perform(post("/api/letters")
                        .header(LetterController.USER_ID_HEADER, UUID.randomUUID().toString())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"letter_type\": \"demand_letter\", \"title\": \"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.title").exists());

        mockMvc.perform(post("/api/letters/{id}/submit", UUID.randomUUID())
                        .header(LetterController.USER_ID_HEADER, "not-a-uuid"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(get("/api/letters/{id}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        printSuccess("Bad requests answered with stable error bodies");
    }

    @Test
    @DisplayName("Generation callback moves the letter to review")
    void testGenerationCallback() throws Exception {
        printTestHeader("Generation Callback");

        UUID ownerId = UUID.randomUUID();
        UUID letterId = createLetter(ownerId, "Callback");
        mockMvc.perform(post("/api/letters/{id}/submit", letterId)
                        .header(LetterController.USER_ID_HEADER, ownerId.toString()))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/letters/{id}/generation", letterId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"draft_content\": \"Dear Sir or Madam, ...\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("PENDING_REVIEW"));

        printSuccess("Draft ready for review");
    }
}
