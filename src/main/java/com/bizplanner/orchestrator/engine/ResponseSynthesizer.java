package com.bizplanner.orchestrator.engine;

import com.bizplanner.orchestrator.client.CompletionRequest;
import com.bizplanner.orchestrator.client.CompletionResponse;
import com.bizplanner.orchestrator.client.CompletionService;
import com.bizplanner.orchestrator.client.ConversationTurn;
import com.bizplanner.orchestrator.client.LanguageCatalog;
import com.bizplanner.orchestrator.client.TranslationResult;
import com.bizplanner.orchestrator.client.TranslationService;
import com.bizplanner.orchestrator.config.OrchestratorConfig;
import com.bizplanner.orchestrator.model.orchestration.AgentOutput;
import com.bizplanner.orchestrator.model.orchestration.NextQuestion;
import com.bizplanner.orchestrator.service.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Condenses agent outputs and the user's message into one short reply.
 *
 * <p>With a known next question the reply acknowledges the answer and asks
 * it; otherwise it is a one or two sentence acknowledgment. Non-English
 * replies go through the translation service, keeping the draft when
 * translation fails. Never throws: any failure yields the fallback reply.
 *
 * @since 2.0.0
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseSynthesizer {

    static final String PROMPT = "response-synthesis";
    static final int INSIGHT_LIMIT = 500;

    private final CompletionService completionService;
    private final TranslationService translationService;
    private final PromptLibraryService promptLibrary;
    private final CallDeadlines deadlines;
    private final OrchestratorConfig config;

    public String synthesize(List<AgentOutput> agentOutputs,
                             String originalMessage,
                             NextQuestion nextQuestion,
                             String language) {
        try {
            boolean nonEnglish = LanguageCatalog.isNonEnglish(language);
            String languageName = nonEnglish ? LanguageCatalog.nameOf(language).orElse(language) : LanguageCatalog.ENGLISH;
            log.info("Synthesizing {} agent outputs, language={}", agentOutputs.size(), language == null ? "default" : language);

            Map<String, Object> variables = new HashMap<>();
            variables.put("message", originalMessage == null ? "" : originalMessage);
            variables.put("nonEnglish", nonEnglish);
            variables.put("languageUpper", languageName.toUpperCase(Locale.ROOT));
            variables.put("insights", insights(agentOutputs));
            if (nextQuestion != null) {
                variables.put("nextQuestion", nextQuestion.question());
                variables.put("answeredAbout", "text".equals(nextQuestion.type()) ? "providing information" : nextQuestion.type());
            }

            CompletionRequest request = CompletionRequest.builder()
                    .systemPrompt(promptLibrary.renderSystem(PROMPT, variables))
                    .message(ConversationTurn.user(promptLibrary.renderUser(PROMPT, variables)))
                    .temperature(config.getSynthesis().getTemperature())
                    .maxTokens(config.getSynthesis().getMaxTokens())
                    .caller("synthesizer")
                    .build();

            CompletionResponse response = deadlines.call("synthesis",
                    Duration.ofSeconds(config.getDeadlines().getCompletionSeconds()),
                    () -> completionService.complete(request));

            String reply = response.getText() == null || response.getText().isBlank()
                    ? config.getFallbackReply()
                    : response.getText().trim();

            return nonEnglish ? translate(reply, language) : reply;
        } catch (RuntimeException e) {
            log.error("Synthesis failed", e);
            return config.getFallbackReply();
        }
    }

    private String translate(String reply, String language) {
        try {
            TranslationResult result = deadlines.call("translation",
                    Duration.ofSeconds(config.getDeadlines().getCompletionSeconds()),
                    () -> translationService.translate(reply, language, config.getDefaultLanguage()));
            if (result.success()) {
                log.info("Response translated to {}", language);
                return result.translatedText();
            }
            log.warn("Translation to {} unsuccessful, keeping draft: {}", language, result.error());
        } catch (RuntimeException e) {
            log.warn("Translation to {} threw, keeping draft: {}", language, e.getMessage());
        }
        return reply;
    }

    private static List<Map<String, String>> insights(List<AgentOutput> outputs) {
        return outputs.stream()
                .filter(AgentOutput::isSuccess)
                .filter(output -> output.getOutput() != null && !output.getOutput().isBlank())
                .map(output -> Map.of(
                        "agentName", output.getAgentName() == null ? output.getAgentId() : output.getAgentName(),
                        "output", truncate(output.getOutput().trim())))
                .collect(Collectors.toList());
    }

    private static String truncate(String text) {
        return text.length() <= INSIGHT_LIMIT ? text : text.substring(0, INSIGHT_LIMIT) + "...";
    }
}
