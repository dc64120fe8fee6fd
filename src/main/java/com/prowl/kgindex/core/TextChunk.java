package com.prowl.kgindex.core;

import lombok.Value;

/**
 * A window of document text, addressed by its ordinal and character offsets.
 */
@Value
public class TextChunk {
    int ordinal;
    int start;
    int end;
    String text;
}
