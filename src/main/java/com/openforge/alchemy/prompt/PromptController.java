package com.openforge.alchemy.prompt;

import com.openforge.alchemy.relationship.RelationshipRecord;
import com.openforge.alchemy.relationship.RelationshipService;
import com.openforge.alchemy.search.SearchFilter;
import com.openforge.alchemy.search.SemanticQuery;
import com.openforge.alchemy.search.SemanticSearchResult;
import com.openforge.alchemy.search.SemanticSearchService;
import com.openforge.alchemy.search.TextSearchService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API over candidate records.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  Endpoint                                 Description                │
 * ├──────────────────────────────────────────────────────────────────────┤
 * │  POST   /api/prompts                      create a record            │
 * │  GET    /api/prompts/{id}                 fetch one record           │
 * │  PATCH  /api/prompts/{id}                 partial update             │
 * │  DELETE /api/prompts/{id}                 delete record + its edges  │
 * │  POST   /api/prompts/{id}/usage           count one use              │
 * │  GET    /api/prompts/unembedded           re-embedding queue         │
 * │  POST   /api/prompts/search               metadata / text search     │
 * │  POST   /api/prompts/search/semantic      vector similarity search   │
 * │  POST   /api/prompts/relationships        relate two records         │
 * │  GET    /api/prompts/{id}/relationships   edges touching a record    │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/prompts")
@RequiredArgsConstructor
public class PromptController {

    private final PromptRecordService   records;
    private final TextSearchService     textSearch;
    private final SemanticSearchService semanticSearch;
    private final RelationshipService   relationships;

    // ── Records ──────────────────────────────────────────────────────────────

    @PostMapping
    public ResponseEntity<PromptRecord> create(@Valid @RequestBody NewPrompt req) {
        return ResponseEntity.status(HttpStatus.CREATED).body(records.create(req));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PromptRecord> get(@PathVariable("id") String id) {
        return ResponseEntity.ok(records.get(id));
    }

    @PatchMapping("/{id}")
    public ResponseEntity<PromptRecord> update(@PathVariable("id") String id, @RequestBody PromptUpdate req) {
        return ResponseEntity.ok(records.update(id, req));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable("id") String id) {
        records.delete(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/usage")
    public ResponseEntity<PromptRecord> recordUsage(@PathVariable("id") String id) {
        return ResponseEntity.ok(records.recordUsage(id));
    }

    /** Records without a vector, id order; page with {@code after}. */
    @GetMapping("/unembedded")
    public ResponseEntity<List<PromptRecord>> unembedded(@RequestParam(value = "after", required = false) String after,
                                                         @RequestParam(value = "limit", defaultValue = "0") int limit) {
        return ResponseEntity.ok(records.findWithoutEmbedding(after, limit));
    }

    // ── Search ───────────────────────────────────────────────────────────────

    /** An empty body means "no filter": the 20 newest records. */
    @PostMapping("/search")
    public ResponseEntity<List<PromptRecord>> search(@RequestBody(required = false) SearchFilter filter) {
        return ResponseEntity.ok(textSearch.search(filter == null ? SearchFilter.none() : filter));
    }

    @PostMapping("/search/semantic")
    public ResponseEntity<SemanticSearchResult> searchSemantic(@Valid @RequestBody SemanticSearchRequest req) {
        double min = req.minSimilarity() == null ? 0.0 : req.minSimilarity();
        return ResponseEntity.ok(semanticSearch.search(new SemanticQuery(req.vector(), min, req.filter())));
    }

    // ── Relationships ────────────────────────────────────────────────────────

    @PostMapping("/relationships")
    public ResponseEntity<RelationshipRecord> relate(@Valid @RequestBody RelateRequest req) {
        RelationshipRecord edge = relationships.addRelationship(
                req.sourceId(), req.targetId(), req.relationshipType(), req.strength(), req.context());
        return ResponseEntity.status(HttpStatus.CREATED).body(edge);
    }

    @GetMapping("/{id}/relationships")
    public ResponseEntity<List<RelationshipRecord>> relationshipsOf(@PathVariable("id") String id) {
        return ResponseEntity.ok(relationships.relationshipsOf(id));
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record SemanticSearchRequest(
            @NotNull float[] vector,
            Double           minSimilarity,
            SearchFilter     filter
    ) {}

    public record RelateRequest(
            @NotBlank String sourceId,
            @NotBlank String targetId,
            @NotBlank String relationshipType,
            Double           strength,
            String           context
    ) {}
}
