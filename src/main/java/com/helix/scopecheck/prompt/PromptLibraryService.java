package com.helix.scopecheck.prompt;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.helix.scopecheck.model.prompt.PromptTemplate;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads prompt templates from YAML and renders their parts with Mustache.
 *
 * <pre>
 * String instructions = promptLibrary.renderSystem("scope-check", Map.of("approvalThreshold", "0.60"));
 * </pre>
 */
@Slf4j
@Service
public class PromptLibraryService {

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources("classpath:prompts/*.yaml");
            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(resource.getInputStream(), PromptTemplate.class);
                if (template.getName() == null || template.getName().isBlank()) {
                    throw new IllegalStateException("Prompt template without a name: " + resource.getFilename());
                }
                templates.put(template.getName(), template);
                log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
            }
            log.info("Loaded {} prompt templates", templates.size());
        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new IllegalStateException("Prompt library initialization failed", e);
        }
    }

    public String renderSystem(String templateName, Map<String, Object> variables) {
        return render(templateName, "system", getTemplate(templateName).getSystemPrompt(), variables);
    }

    public String renderUser(String templateName, Map<String, Object> variables) {
        return render(templateName, "user", getTemplate(templateName).getUserPrompt(), variables);
    }

    public String renderFewShot(String templateName, Map<String, Object> variables) {
        return render(templateName, "fewshot", getTemplate(templateName).getFewShotExamples(), variables);
    }

    public PromptTemplate getTemplate(String name) {
        PromptTemplate template = templates.get(name);
        if (template == null) {
            throw new IllegalArgumentException("Prompt template not found: " + name);
        }
        return template;
    }

    private String render(String templateName, String part, String text, Map<String, Object> variables) {
        if (text == null || text.isBlank()) {
            return "";
        }
        Mustache mustache = compiled.computeIfAbsent(templateName + "#" + part,
                key -> mustacheFactory.compile(new StringReader(text), key));
        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString().strip();
    }
}
