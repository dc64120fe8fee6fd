package com.prowl.kgindex.model.prompt;

import lombok.Value;

/**
 * System and user messages of a template after variable substitution.
 */
@Value
public class RenderedPrompt {
    String name;
    String systemPrompt;
    String userPrompt;
    Double temperature;
}
