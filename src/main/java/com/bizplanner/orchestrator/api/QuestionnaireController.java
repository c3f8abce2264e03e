package com.bizplanner.orchestrator.api;

import com.bizplanner.orchestrator.engine.QuestionnaireOrchestrator;
import com.bizplanner.orchestrator.exception.OrchestratorException;
import com.bizplanner.orchestrator.flow.FlowGraph;
import com.bizplanner.orchestrator.model.flow.Question;
import com.bizplanner.orchestrator.model.orchestration.AnswerTurnResult;
import com.bizplanner.orchestrator.model.orchestration.NextQuestion;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for the business-model questionnaire.
 *
 * <p>Stateless: every request carries the answers collected so far.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/questionnaire")
@RequiredArgsConstructor
public class QuestionnaireController {

    private final QuestionnaireOrchestrator questionnaireOrchestrator;
    private final FlowGraph flowGraph;

    /**
     * Record an answer and get the orchestrated reply plus the next question.
     */
    @PostMapping("/answer")
    public ResponseEntity<AnswerResponse> answer(@RequestBody AnswerRequest request) {
        log.info("📥 Answer received: question={}, index={}", request.getQuestionId(), request.getCurrentIndex());

        if (request.getQuestionId() == null || request.getQuestionId().isBlank()) {
            return ResponseEntity.badRequest()
                .body(AnswerResponse.error("questionId is required"));
        }

        try {
            Map<String, Object> answers = request.getAnswers() == null ? Map.of() : request.getAnswers();
            AnswerTurnResult result = questionnaireOrchestrator.processUserAnswer(
                request.getQuestionId(),
                request.getAnswer(),
                answers,
                request.getCurrentIndex(),
                request.getLanguage()
            );

            List<Question> questions = flowGraph.getOrderedQuestions();
            int next = result.getOutcome().getNextQuestionIndex();
            NextQuestion nextQuestion = next < questions.size() ? NextQuestion.of(questions.get(next)) : null;

            log.info("✅ Answer processed: next index={}, remaining={}", next, result.getOutcome().getRemainingCount());
            return ResponseEntity.ok(AnswerResponse.success(result, nextQuestion));

        } catch (IllegalArgumentException e) {
            log.warn("Rejected answer for {}: {}", request.getQuestionId(), e.getMessage());
            return ResponseEntity.badRequest()
                .body(AnswerResponse.error(e.getMessage()));

        } catch (OrchestratorException e) {
            log.error("Orchestration failed for question {}", request.getQuestionId(), e);
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(AnswerResponse.error(e.getMessage()));

        } catch (Exception e) {
            log.error("Failed to process answer", e);
            return ResponseEntity.internalServerError()
                .body(AnswerResponse.error("Internal error: " + e.getMessage()));
        }
    }

    /**
     * The configured questionnaire, phase by phase.
     */
    @GetMapping("/questions")
    public ResponseEntity<QuestionsResponse> questions() {
        return ResponseEntity.ok(QuestionsResponse.builder()
            .success(true)
            .phases(flowGraph.getPhases())
            .totalQuestions(flowGraph.getOrderedQuestions().size())
            .build());
    }

    /**
     * Progress over the unskipped questions, plus skip and branch state.
     */
    @PostMapping("/progress")
    public ResponseEntity<ProgressResponse> progress(@RequestBody ProgressRequest request) {
        Map<String, Object> answers = request.getAnswers() == null ? Map.of() : request.getAnswers();
        if (request.getCurrentIndex() < 0) {
            return ResponseEntity.badRequest()
                .body(ProgressResponse.error("currentIndex must not be negative"));
        }

        return ResponseEntity.ok(ProgressResponse.builder()
            .success(true)
            .progress(questionnaireOrchestrator.getProgress(
                flowGraph.getOrderedQuestions(), request.getCurrentIndex(), answers))
            .skippedQuestions(flowGraph.getSkippedQuestions(answers))
            .activeBranches(flowGraph.getActiveBranches(answers))
            .build());
    }
}
