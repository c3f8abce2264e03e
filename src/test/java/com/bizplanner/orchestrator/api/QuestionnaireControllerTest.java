package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.Map;

import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasItem;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * Questionnaire endpoints over the shipped definitions, with the model mocked.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Questionnaire Controller Tests")
class QuestionnaireControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockBean
    private CompletionService completionService;

    @Test
    @DisplayName("LTV answer returns the reply, the ratio and the next question")
    void answerLtv() throws Exception {
        // Given
        when(completionService.complete(any()))
                .thenReturn(CompletionResponse.text("Solid LTV. How long is your sales cycle?"));
        AnswerRequest request = AnswerRequest.builder()
                .questionId("ltv")
                .answer(150000)
                .answers(Map.of("revenue_model", "recurring", "target_cac", 50000))
                .currentIndex(0)
                .language("en-US")
                .build();

        // When / Then
        mockMvc.perform(post("/api/v1/questionnaire/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.reply").value("Solid LTV. How long is your sales cycle?"))
                .andExpect(jsonPath("$.autoPopulated.ltv_cac_ratio").value(3.0))
                .andExpect(jsonPath("$.nextQuestion.question").value("How long is your sales cycle?"))
                .andExpect(jsonPath("$.questionConfig.configuredSkills[0]").value("financial_modeling"))
                .andExpect(jsonPath("$.agentsUsed").isNotEmpty());
    }

    @Test
    @DisplayName("Missing and unknown question ids are rejected with 400")
    void badQuestionIds() throws Exception {
        mockMvc.perform(post("/api/v1/questionnaire/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answer\":\"x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("questionId is required"));

        mockMvc.perform(post("/api/v1/questionnaire/answer")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionId\":\"favourite_colour\",\"answer\":\"blue\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Unknown question: favourite_colour"));
    }

    @Test
    @DisplayName("Questions are listed by phase")
    void listQuestions() throws Exception {
        mockMvc.perform(get("/api/v1/questionnaire/questions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.phases[0].id").value("auth"))
                .andExpect(jsonPath("$.totalQuestions", greaterThan(50)));
    }

    @Test
    @DisplayName("Progress reports skipped questions for one-time revenue")
    void progress() throws Exception {
        mockMvc.perform(post("/api/v1/questionnaire/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"answers\":{\"revenue_model\":\"one_time\"},\"currentIndex\":3}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.skippedQuestions", hasItem("churn_rate")))
                .andExpect(jsonPath("$.progress.total", greaterThan(0)));

        mockMvc.perform(post("/api/v1/questionnaire/progress")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"currentIndex\":-1}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }
}
