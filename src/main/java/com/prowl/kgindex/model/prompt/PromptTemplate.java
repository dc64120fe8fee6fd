package com.prowl.kgindex.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML configuration.
 *
 * YAML structure:
 * <pre>
 * name: entity-extraction
 * version: 1.0
 * temperature: 0.1
 * systemPrompt: |
 *   You extract entities...
 * userPrompt: |
 *   Text: {{text}}
 * </pre>
 *
 * @see com.prowl.kgindex.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private Double temperature;
    private String systemPrompt;
    private String userPrompt;
}
