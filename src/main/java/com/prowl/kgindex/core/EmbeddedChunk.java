package com.prowl.kgindex.core;

import lombok.Value;

@Value
public class EmbeddedChunk {
    TextChunk chunk;
    EmbeddingResult embedding;
}
