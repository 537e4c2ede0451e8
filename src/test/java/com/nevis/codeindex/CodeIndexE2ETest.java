package com.nevis.codeindex;

import com.fasterxml.jackson.databind.JsonNode;
import com.nevis.codeindex.controller.SearchResponse;
import com.nevis.codeindex.controller.TaskSubmissionResponse;
import com.nevis.codeindex.model.ChunkNode;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.repository.BaseIntegrationTest;
import com.nevis.codeindex.service.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@SpringBootTest(
    webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
    properties = {
        "app.gemini.api-key=fake-key-value-for-testing",
        "app.indexing.embedding.batch-size=4"
    }
)
public class CodeIndexE2ETest extends BaseIntegrationTest {

    private static final int DIMENSION = 768;

    @Autowired
    private TestRestTemplate restTemplate;

    @MockitoBean
    private EmbeddingService embeddingService;

    @TempDir
    Path workspace;

    @BeforeEach
    void setUp() {
        when(embeddingService.embedBatch(anyList())).thenAnswer(invocation -> {
            List<ChunkNode> chunks = invocation.getArgument(0);
            return chunks.stream().map(chunk -> vectorFor(chunk.symbolName())).toList();
        });
        when(embeddingService.embedQuery(anyString())).thenAnswer(invocation -> vectorFor(invocation.getArgument(0)));
    }

    @Test
    @DisplayName("Local repository is indexed, queried, synced incrementally and verified")
    void indexQuerySyncAndVerify() throws IOException {
        Path repo = Files.createDirectories(workspace.resolve("shop"));
        write(repo, "app/models.py", """
            class Order(Base):
                __tablename__ = "orders"
                id = Column(Integer, primary_key=True)
            """);
        write(repo, "app/service.py", """
            def place_order(items):
                total = compute_total(items)
                return total

            def compute_total(items):
                return sum(items)
            """);

        ResponseEntity<TaskSubmissionResponse> submitted = restTemplate.postForEntity(
            "/repositories", Map.of("url", repo.toString()), TaskSubmissionResponse.class);
        assertThat(submitted.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        UUID repositoryId = submitted.getBody().repositoryId();
        waitForStatus(submitted.getBody().taskId(), TaskStatus.COMPLETED);

        // a second submission of the same directory is an incremental sync with nothing to do
        ResponseEntity<TaskSubmissionResponse> again = restTemplate.postForEntity(
            "/repositories", Map.of("url", repo.toString()), TaskSubmissionResponse.class);
        assertThat(again.getBody().repositoryId()).isEqualTo(repositoryId);
        waitForStatus(again.getBody().taskId(), TaskStatus.COMPLETED);

        JsonNode graph = restTemplate.getForObject("/repositories/{id}/graph", JsonNode.class, repositoryId);
        assertThat(graph.get("edges").findValuesAsText("call_name")).contains("compute_total");

        SearchResponse search = restTemplate.getForObject(
            "/repositories/{id}/search?q={q}", SearchResponse.class, repositoryId, "place_order");
        assertThat(search.results())
            .extracting(ChunkSummary::symbolName)
            .first()
            .isEqualTo("place_order");

        JsonNode structure = restTemplate.getForObject("/repositories/{id}/structure", JsonNode.class, repositoryId);
        assertThat(structure.get("rendered").asText()).contains("app/service.py", "place_order");

        JsonNode models = restTemplate.getForObject("/repositories/{id}/data-models", JsonNode.class, repositoryId);
        assertThat(models.findValuesAsText("name")).contains("Order");

        Files.delete(repo.resolve("app/models.py"));
        write(repo, "app/service.py", """
            def place_order(items):
                return ship(items)
            """);
        TaskSubmissionResponse sync = restTemplate.postForEntity(
            "/repositories/{id}/reindex", null, TaskSubmissionResponse.class, repositoryId).getBody();
        waitForStatus(sync.taskId(), TaskStatus.COMPLETED);

        JsonNode files = restTemplate.getForObject("/repositories/{id}/files", JsonNode.class, repositoryId);
        assertThat(files.has("app/models.py")).isFalse();
        assertThat(files.has("app/service.py")).isTrue();

        JsonNode report = restTemplate.postForObject(
            "/repositories/{id}/consistency/verify", null, JsonNode.class, repositoryId);
        assertThat(report.get("inconsistent_files")).isEmpty();
        assertThat(report.get("orphan_chunk_ids")).isEmpty();
    }

    @Test
    @DisplayName("Unknown tasks and repositories return 404")
    void unknownIds() {
        assertThat(restTemplate.getForEntity("/tasks/{id}", String.class, UUID.randomUUID()).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(restTemplate.getForEntity("/repositories/{id}", String.class, UUID.randomUUID()).getStatusCode())
            .isEqualTo(HttpStatus.NOT_FOUND);
    }

    private void waitForStatus(UUID taskId, TaskStatus status) {
        await().atMost(60, TimeUnit.SECONDS).pollInterval(200, TimeUnit.MILLISECONDS).untilAsserted(() -> {
            TaskStatusView task = restTemplate.getForEntity("/tasks/" + taskId, TaskStatusView.class).getBody();
            assertThat(task.status()).isEqualTo(status);
        });
    }

    private static void write(Path root, String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    private static float[] vectorFor(String text) {
        float[] vector = new float[DIMENSION];
        vector[Math.floorMod(String.valueOf(text).hashCode(), DIMENSION)] = 1f;
        vector[DIMENSION - 1] += 0.01f;
        return vector;
    }
}
