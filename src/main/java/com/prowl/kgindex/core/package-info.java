/**
 * Domain values passed between the pipeline stages: chunks, embeddings, extracted entities and relations.
 *
 * @since 1.0.0
 */
package com.prowl.kgindex.core;
