package com.prowl.kgindex.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;
import com.prowl.kgindex.exception.ConfigurationException;
import com.prowl.kgindex.model.prompt.PromptTemplate;
import com.prowl.kgindex.model.prompt.RenderedPrompt;
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
 * Prompt Library Service
 *
 * Loads prompts from {@code classpath:prompts/*.yaml} and renders them with Mustache.
 *
 * Usage:
 * RenderedPrompt prompt = promptLibrary.render("entity-extraction", Map.of(
 *     "text", chunkText,
 *     "maxEntities", 10
 * ));
 */
@Slf4j
@Service
public class PromptLibraryService {

    private static final String PROMPT_LOCATION = "classpath:prompts/*.yaml";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final MustacheFactory mustacheFactory = new DefaultMustacheFactory();
    private final Map<String, PromptTemplate> templates = new ConcurrentHashMap<>();
    private final Map<String, Mustache> compiled = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadPrompts() {
        try {
            PathMatchingResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
            Resource[] resources = resolver.getResources(PROMPT_LOCATION);

            for (Resource resource : resources) {
                PromptTemplate template = yamlMapper.readValue(
                        resource.getInputStream(),
                        PromptTemplate.class
                );
                register(template);
            }

            log.info("Loaded {} prompt templates", templates.size());

        } catch (IOException e) {
            log.error("Failed to load prompt templates", e);
            throw new ConfigurationException("Prompt library initialization failed: " + e.getMessage());
        }
    }

    /**
     * Add a template programmatically. Replaces any template with the same name.
     */
    public void register(PromptTemplate template) {
        if (template.getName() == null || template.getName().isBlank()) {
            throw new ConfigurationException("Prompt template without a name");
        }
        templates.put(template.getName(), template);
        compiled.keySet().removeIf(key -> key.startsWith(template.getName() + "#"));
        log.info("Loaded prompt template: {} (version: {})", template.getName(), template.getVersion());
    }

    /**
     * Render the system and user parts of a template with the given variables.
     */
    public RenderedPrompt render(String templateName, Map<String, Object> variables) {
        PromptTemplate template = templates.get(templateName);

        if (template == null) {
            throw new ConfigurationException("Prompt template not found: " + templateName);
        }

        return new RenderedPrompt(
                templateName,
                renderPart(templateName + "#system", template.getSystemPrompt(), variables),
                renderPart(templateName + "#user", template.getUserPrompt(), variables),
                template.getTemperature()
        );
    }

    private String renderPart(String cacheKey, String source, Map<String, Object> variables) {
        if (source == null) {
            return "";
        }
        Mustache mustache = compiled.computeIfAbsent(cacheKey,
                key -> mustacheFactory.compile(new StringReader(source), key));

        StringWriter writer = new StringWriter();
        mustache.execute(writer, variables);
        return writer.toString();
    }
}
