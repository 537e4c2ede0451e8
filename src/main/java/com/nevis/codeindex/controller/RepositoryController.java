package com.nevis.codeindex.controller;

import com.nevis.codeindex.model.DataModelSummary;
import com.nevis.codeindex.model.DependencyGraph;
import com.nevis.codeindex.model.FileSummary;
import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.service.CheckpointRepairService;
import com.nevis.codeindex.service.IndexingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@RestController
@RequestMapping("/repositories")
@RequiredArgsConstructor
public class RepositoryController {

    private static final int DEFAULT_TOP_K = 10;

    private final IndexingService indexingService;

    @PostMapping
    public ResponseEntity<TaskSubmissionResponse> submit(@Valid @RequestBody RepositoryRequest request) {
        TaskSubmissionResponse response = indexingService.submit(
            request.url(),
            request.forceFull(),
            request.accessToken(),
            request.branch()
        );
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping
    public ResponseEntity<List<RepositoryResponse>> list() {
        return ResponseEntity.ok(indexingService.listRepositories());
    }

    @GetMapping("/{id}")
    public ResponseEntity<RepositoryResponse> get(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.getRepository(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable UUID id) {
        indexingService.deleteRepository(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/reindex")
    public ResponseEntity<TaskSubmissionResponse> reindex(
        @PathVariable UUID id,
        @RequestBody(required = false) ReindexRequest request) {

        boolean forceFull = request != null && request.forceFull();
        String accessToken = request != null ? request.accessToken() : null;
        return ResponseEntity.status(HttpStatus.CREATED).body(indexingService.reindex(id, forceFull, accessToken));
    }

    @PostMapping("/{id}/artifacts")
    public ResponseEntity<TaskSubmissionResponse> generateArtifacts(@PathVariable UUID id) {
        return ResponseEntity.status(HttpStatus.CREATED).body(indexingService.generateArtifacts(id));
    }

    @GetMapping("/{id}/tasks")
    public ResponseEntity<List<TaskStatusView>> tasks(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.getTasks(id));
    }

    @GetMapping("/{id}/graph")
    public ResponseEntity<DependencyGraph> graph(
        @PathVariable UUID id,
        @RequestParam(name = "file", required = false) String file) {
        return ResponseEntity.ok(indexingService.getDependencyGraph(id, file));
    }

    @GetMapping("/{id}/search")
    public ResponseEntity<SearchResponse> search(
        @PathVariable UUID id,
        @RequestParam(name = "q") String query,
        @RequestParam(name = "top_k", required = false) Integer topK) {
        int limit = topK != null ? topK : DEFAULT_TOP_K;
        return ResponseEntity.ok(new SearchResponse(query, indexingService.search(id, query, limit)));
    }

    @PostMapping("/{id}/search/vector")
    public ResponseEntity<SearchResponse> searchByVector(
        @PathVariable UUID id,
        @Valid @RequestBody VectorSearchRequest request) {
        int limit = request.topK() != null ? request.topK() : DEFAULT_TOP_K;
        return ResponseEntity.ok(new SearchResponse(null, indexingService.search(id, request.queryVector(), limit)));
    }

    @PostMapping("/{id}/chunks")
    public ResponseEntity<List<ChunkResponse>> chunks(
        @PathVariable UUID id,
        @Valid @RequestBody ChunkRequest request) {
        return ResponseEntity.ok(indexingService.getChunks(id, request.chunkIds()));
    }

    @GetMapping("/{id}/structure")
    public ResponseEntity<StructureResponse> structure(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.getStructuralIndex(id));
    }

    @GetMapping("/{id}/data-models")
    public ResponseEntity<List<DataModelSummary>> dataModels(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.getDataModels(id));
    }

    @GetMapping("/{id}/files")
    public ResponseEntity<Map<String, FileSummary>> files(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.getFileSummaries(id));
    }

    @PostMapping("/{id}/consistency/verify")
    public ResponseEntity<CheckpointRepairService.ConsistencyReport> verify(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.verify(id));
    }

    @PostMapping("/{id}/consistency/repair")
    public ResponseEntity<CheckpointRepairService.RepairResult> repair(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.repair(id));
    }

    @PostMapping("/{id}/consistency/rebuild")
    public ResponseEntity<CheckpointRepairService.RebuildResult> rebuild(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.rebuildCheckpoints(id));
    }
}
