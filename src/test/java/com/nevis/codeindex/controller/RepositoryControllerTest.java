package com.nevis.codeindex.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.nevis.codeindex.exception.EntityNotFoundException;
import com.nevis.codeindex.exception.InvalidRepositoryReferenceException;
import com.nevis.codeindex.exception.TaskConflictException;
import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.DependencyGraph;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskType;
import com.nevis.codeindex.service.CheckpointRepairService;
import com.nevis.codeindex.service.IndexingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(RepositoryController.class)
class RepositoryControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @MockitoBean
    private IndexingService indexingService;

    @Nested
    @DisplayName("Submission")
    class Submission {

        @Test
        @DisplayName("POST /repositories should start indexing and return 201")
        void submit_ShouldReturn201() throws Exception {
            UUID taskId = UUID.randomUUID();
            UUID repoId = UUID.randomUUID();
            when(indexingService.submit("https://github.com/acme/app", true, "ghp_secret", "main"))
                .thenReturn(new TaskSubmissionResponse(taskId, repoId, TaskType.FULL_REINDEX, TaskStatus.PENDING));

            RepositoryRequest request = new RepositoryRequest("https://github.com/acme/app", true, "ghp_secret", "main");

            mockMvc.perform(post("/repositories")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.task_id").value(taskId.toString()))
                .andExpect(jsonPath("$.repository_id").value(repoId.toString()))
                .andExpect(jsonPath("$.type").value("FULL_REINDEX"))
                .andExpect(jsonPath("$.status").value("PENDING"));
        }

        @Test
        @DisplayName("POST /repositories should return 409 with the active task id")
        void submit_ShouldReturn409_WhenTaskActive() throws Exception {
            UUID repoId = UUID.randomUUID();
            UUID existing = UUID.randomUUID();
            when(indexingService.submit(anyString(), anyBoolean(), any(), any()))
                .thenThrow(new TaskConflictException(repoId, existing));

            mockMvc.perform(post("/repositories")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"url\":\"https://github.com/acme/app\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error_code").value("TASK_CONFLICT"))
                .andExpect(jsonPath("$.existing_task_id").value(existing.toString()));
        }

        @Test
        @DisplayName("POST /repositories should return 400 when url is blank")
        void submit_ShouldReturn400_WhenUrlBlank() throws Exception {
            mockMvc.perform(post("/repositories")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"url\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));

            verifyNoInteractions(indexingService);
        }

        @Test
        @DisplayName("Rejected references never echo credentials back")
        void submit_ShouldScrubInvalidReference() throws Exception {
            when(indexingService.submit(anyString(), anyBoolean(), any(), any()))
                .thenThrow(new InvalidRepositoryReferenceException("Malformed repository URL: https://bob:pw@host/x"));

            mockMvc.perform(post("/repositories")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"url\":\"https://host/x\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_REPOSITORY_REFERENCE"))
                .andExpect(jsonPath("$.message").value("Malformed repository URL: https://[REDACTED]@host/x"));
        }

        @Test
        @DisplayName("POST /repositories/{id}/reindex without a body runs an incremental sync")
        void reindex_WithoutBody() throws Exception {
            UUID repoId = UUID.randomUUID();
            when(indexingService.reindex(repoId, false, null)).thenReturn(
                new TaskSubmissionResponse(UUID.randomUUID(), repoId, TaskType.INCREMENTAL_SYNC, TaskStatus.PENDING));

            mockMvc.perform(post("/repositories/{id}/reindex", repoId))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.type").value("INCREMENTAL_SYNC"));
        }

        @Test
        @DisplayName("POST /repositories/{id}/artifacts should return 404 for unknown repositories")
        void artifacts_ShouldReturn404() throws Exception {
            UUID repoId = UUID.randomUUID();
            when(indexingService.generateArtifacts(repoId)).thenThrow(new EntityNotFoundException(repoId));

            mockMvc.perform(post("/repositories/{id}/artifacts", repoId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("Entity not found: " + repoId))
                .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
        }
    }

    @Nested
    @DisplayName("Queries")
    class Queries {

        @Test
        @DisplayName("GET /repositories/{id}/search should default top_k to 10")
        void search_ShouldUseDefaultTopK() throws Exception {
            UUID repoId = UUID.randomUUID();
            ChunkSummary hit = new ChunkSummary(UUID.randomUUID(), "app/models.py", 3, 12, "User", ChunkKind.CLASS, 0.91);
            when(indexingService.search(repoId, "user model", 10)).thenReturn(List.of(hit));

            mockMvc.perform(get("/repositories/{id}/search", repoId).param("q", "user model"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.query").value("user model"))
                .andExpect(jsonPath("$.results[0].file_path").value("app/models.py"))
                .andExpect(jsonPath("$.results[0].symbol_name").value("User"))
                .andExpect(jsonPath("$.results[0].score").value(0.91));
        }

        @Test
        @DisplayName("GET /repositories/{id}/search should return 400 when q is missing")
        void search_ShouldReturn400_WhenQueryMissing() throws Exception {
            mockMvc.perform(get("/repositories/{id}/search", UUID.randomUUID()))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("MISSING_PARAMETER"))
                .andExpect(jsonPath("$.message").value("Parameter 'q' is missing"));
        }

        @Test
        @DisplayName("Malformed repository ids are rejected")
        void get_ShouldReturn400_WhenIdMalformed() throws Exception {
            mockMvc.perform(get("/repositories/{id}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("INVALID_PARAMETER"));
        }

        @Test
        @DisplayName("POST /repositories/{id}/search/vector should validate top_k")
        void vectorSearch_ShouldValidateTopK() throws Exception {
            mockMvc.perform(post("/repositories/{id}/search/vector", UUID.randomUUID())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"query_vector\":[0.1,0.2],\"top_k\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error_code").value("VALIDATION_FAILED"));
        }

        @Test
        @DisplayName("GET /repositories/{id}/graph should pass the file filter through")
        void graph_ShouldFilterByFile() throws Exception {
            UUID repoId = UUID.randomUUID();
            UUID caller = UUID.randomUUID();
            UUID callee = UUID.randomUUID();
            DependencyGraph graph = new DependencyGraph(
                List.of(
                    new DependencyGraph.Node(caller, "foo", "src/a.py", ChunkKind.FUNCTION, 1, 3, "python", false, null),
                    new DependencyGraph.Node(callee, "bar", "src/b.py", ChunkKind.FUNCTION, 1, 2, "python", false, null)),
                List.of(new DependencyGraph.Edge(caller, callee, "bar")));
            when(indexingService.getDependencyGraph(repoId, "src/")).thenReturn(graph);

            mockMvc.perform(get("/repositories/{id}/graph", repoId).param("file", "src/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_nodes").value(2))
                .andExpect(jsonPath("$.total_edges").value(1))
                .andExpect(jsonPath("$.edges[0].call_name").value("bar"));
        }

        @Test
        @DisplayName("POST /repositories/{id}/chunks should reject an empty id list")
        void chunks_ShouldRejectEmptyList() throws Exception {
            mockMvc.perform(post("/repositories/{id}/chunks", UUID.randomUUID())
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"chunk_ids\":[]}"))
                .andExpect(status().isBadRequest());
        }

        @Test
        @DisplayName("GET /repositories/{id}/files returns summaries keyed by path")
        void files_ShouldReturnMap() throws Exception {
            UUID repoId = UUID.randomUUID();
            when(indexingService.getFileSummaries(repoId)).thenReturn(Map.of());

            mockMvc.perform(get("/repositories/{id}/files", repoId))
                .andExpect(status().isOk())
                .andExpect(content().json("{}"));
        }
    }

    @Nested
    @DisplayName("Maintenance")
    class Maintenance {

        @Test
        @DisplayName("DELETE /repositories/{id} should return 204")
        void delete_ShouldReturn204() throws Exception {
            UUID repoId = UUID.randomUUID();

            mockMvc.perform(delete("/repositories/{id}", repoId))
                .andExpect(status().isNoContent());

            verify(indexingService).deleteRepository(repoId);
        }

        @Test
        @DisplayName("DELETE /repositories/{id} while a task is active should return 409")
        void delete_ShouldReturn409_WhenTaskActive() throws Exception {
            UUID repoId = UUID.randomUUID();
            UUID existing = UUID.randomUUID();
            doThrow(new TaskConflictException(repoId, existing)).when(indexingService).deleteRepository(repoId);

            mockMvc.perform(delete("/repositories/{id}", repoId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.existing_task_id").value(existing.toString()));
        }

        @Test
        @DisplayName("POST /repositories/{id}/consistency/verify should report findings")
        void verify_ShouldReturnReport() throws Exception {
            UUID repoId = UUID.randomUUID();
            UUID missing = UUID.randomUUID();
            when(indexingService.verify(repoId)).thenReturn(new CheckpointRepairService.ConsistencyReport(
                repoId, 3, List.of(new CheckpointRepairService.FileInconsistency("a.py", List.of(missing))), List.of()));

            mockMvc.perform(post("/repositories/{id}/consistency/verify", repoId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.checkpoints_checked").value(3))
                .andExpect(jsonPath("$.inconsistent_files[0].file_path").value("a.py"))
                .andExpect(jsonPath("$.inconsistent_files[0].missing_chunk_ids[0]").value(missing.toString()));
        }

        @Test
        @DisplayName("Repair while a task is active should return 409")
        void repair_ShouldReturn409_WhenTaskActive() throws Exception {
            UUID repoId = UUID.randomUUID();
            when(indexingService.repair(repoId)).thenThrow(new TaskConflictException(repoId, UUID.randomUUID()));

            mockMvc.perform(post("/repositories/{id}/consistency/repair", repoId))
                .andExpect(status().isConflict());
        }
    }
}
