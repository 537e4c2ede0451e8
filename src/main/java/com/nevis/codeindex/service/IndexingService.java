package com.nevis.codeindex.service;

import com.nevis.codeindex.controller.ChunkResponse;
import com.nevis.codeindex.controller.RepositoryResponse;
import com.nevis.codeindex.controller.StructureResponse;
import com.nevis.codeindex.controller.TaskSubmissionResponse;
import com.nevis.codeindex.model.ChunkSummary;
import com.nevis.codeindex.model.DataModelSummary;
import com.nevis.codeindex.model.DependencyGraph;
import com.nevis.codeindex.model.FileSummary;
import com.nevis.codeindex.model.TaskStatusView;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

public interface IndexingService {
    TaskSubmissionResponse submit(String repositoryRef, boolean forceFull, String accessToken, String branch);
    TaskSubmissionResponse reindex(UUID repositoryId, boolean forceFull, String accessToken);
    TaskSubmissionResponse generateArtifacts(UUID repositoryId);
    TaskStatusView getStatus(UUID taskId);
    SseEmitter streamProgress(UUID taskId);
    TaskStatusView cancel(UUID taskId);
    List<TaskStatusView> getTasks(UUID repositoryId);
    DependencyGraph getDependencyGraph(UUID repositoryId, String fileFilter);
    List<ChunkSummary> search(UUID repositoryId, float[] queryVector, int topK);
    List<ChunkSummary> search(UUID repositoryId, String query, int topK);
    List<ChunkResponse> getChunks(UUID repositoryId, List<UUID> chunkIds);
    List<RepositoryResponse> listRepositories();
    RepositoryResponse getRepository(UUID repositoryId);
    void deleteRepository(UUID repositoryId);
    StructureResponse getStructuralIndex(UUID repositoryId);
    List<DataModelSummary> getDataModels(UUID repositoryId);
    Map<String, FileSummary> getFileSummaries(UUID repositoryId);
    CheckpointRepairService.ConsistencyReport verify(UUID repositoryId);
    CheckpointRepairService.RepairResult repair(UUID repositoryId);
    CheckpointRepairService.RebuildResult rebuildCheckpoints(UUID repositoryId);
}
