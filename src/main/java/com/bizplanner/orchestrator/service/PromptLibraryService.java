package com.bizplanner.orchestrator.service;

import com.bizplanner.orchestrator.configuration.AppProperties;
import com.bizplanner.orchestrator.exception.DefinitionLoadException;
import com.bizplanner.orchestrator.model.prompt.PromptTemplate;
import com.bizplanner.orchestrator.util.YamlDefinitionReader;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prompt Library Service
 *
 * Loads prompts from YAML files and renders them with variables.
 *
 * Usage:
 * String prompt = promptLibrary.renderUser("translation", Map.of(
 *     "language", "Hindi",
 *     "text", reply
 * ));
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptLibraryService {

    private final AppProperties appProperties;
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        String location = appProperties.getDefinitions().getPrompts();
        for (PromptTemplate template : YamlDefinitionReader.readAll(location, PromptTemplate.class)) {
            if (template.getName() == null || template.getName().isBlank()) {
                throw new DefinitionLoadException("Prompt template without a name under " + location);
            }
            templates.put(template.getName(), template);
            log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
        }
        log.info("Loaded {} prompt templates", templates.size());
    }

    /**
     * Render system and user prompt together, separated by a blank line.
     */
    public String render(String templateName, Map<String, ?> variables) {
        PromptTemplate template = getTemplate(templateName);
        return execute(templateName, template.getSystemPrompt() + "\n\n" + template.getUserPrompt(), variables);
    }

    public String renderSystem(String templateName, Map<String, ?> variables) {
        return execute(templateName + "#system", getTemplate(templateName).getSystemPrompt(), variables);
    }

    public String renderUser(String templateName, Map<String, ?> variables) {
        return execute(templateName + "#user", getTemplate(templateName).getUserPrompt(), variables);
    }

    /**
     * Template metadata (temperature, token limit).
     *
     * @throws IllegalArgumentException when no template has that name
     */
    public PromptTemplate getTemplate(String name) {
        PromptTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + name);
        }
        return template;
    }

    public boolean hasTemplate(String name) {
        return templates.containsKey(name);
    }

    private String execute(String name, String text, Map<String, ?> variables) {
        Mustache mustache = mustacheFactory.compile(new StringReader(text == null ? "" : text), name);
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString().trim();
    }
}
