package com.prowl.kgindex.api;

import com.prowl.kgindex.knowledge.DocumentGraph;
import com.prowl.kgindex.knowledge.GraphStore;
import com.prowl.kgindex.knowledge.IngestionResult;
import com.prowl.kgindex.knowledge.IngestionService;
import com.prowl.kgindex.search.QueryResult;
import com.prowl.kgindex.search.QueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST controller for knowledge graph ingestion and retrieval.
 *
 * Failures are translated to status codes by {@link com.prowl.kgindex.exception.GlobalExceptionHandler}.
 *
 * @since 1.0.0
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/kg-index")
@RequiredArgsConstructor
public class KnowledgeGraphController {

    private final IngestionService ingestionService;
    private final QueryService queryService;
    private final GraphStore graphStore;

    /**
     * Ingest or replace a document.
     *
     * POST /api/v1/kg-index/ingest
     */
    @PostMapping("/ingest")
    public ResponseEntity<IngestResponse> ingest(@RequestBody IngestRequest request) {
        log.info("Ingest request: {}", request.getDocumentId());

        IngestionResult result = ingestionService.ingest(
            request.getDocumentId(),
            request.getContent(),
            request.getTitle(),
            request.getMetadata()
        );

        return ResponseEntity.status(HttpStatus.CREATED).body(IngestResponse.from(result));
    }

    /**
     * Hybrid retrieval query.
     *
     * POST /api/v1/kg-index/query
     */
    @PostMapping("/query")
    public ResponseEntity<QueryResponse> query(@RequestBody QueryRequest request) {
        QueryResult result = queryService.query(
            request.getQuery(),
            request.resolvedTopK(),
            request.resolvedIncludeRelations()
        );
        return ResponseEntity.ok(QueryResponse.from(result));
    }

    /**
     * Graph of one document.
     *
     * GET /api/v1/kg-index/document/{documentId}
     */
    @GetMapping("/document/{documentId}")
    public ResponseEntity<DocumentGraphResponse> getDocumentGraph(@PathVariable String documentId) {
        DocumentGraph graph = graphStore.getDocumentGraph(documentId);
        return ResponseEntity.ok(DocumentGraphResponse.from(graph));
    }
}
