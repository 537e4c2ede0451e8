package com.nevis.codeindex.controller;

import com.nevis.codeindex.exception.EntityNotFoundException;
import com.nevis.codeindex.model.TaskStatus;
import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.model.TaskType;
import com.nevis.codeindex.service.IndexingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.UUID;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(TaskController.class)
class TaskControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private IndexingService indexingService;

    @Test
    @DisplayName("GET /tasks/{id} should return progress")
    void status_ShouldReturnProgress() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(indexingService.getStatus(taskId)).thenReturn(new TaskStatusView(
            taskId, UUID.randomUUID(), TaskType.INCREMENTAL_SYNC, TaskStatus.EMBEDDING, 55.0,
            "Embedding chunks", 20, 11, null, null));

        mockMvc.perform(get("/tasks/{id}", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("EMBEDDING"))
            .andExpect(jsonPath("$.progress_pct").value(55.0))
            .andExpect(jsonPath("$.files_total").value(20))
            .andExpect(jsonPath("$.files_processed").value(11))
            .andExpect(jsonPath("$.error_message").doesNotExist());
    }

    @Test
    @DisplayName("GET /tasks/{id} should return failure details")
    void status_ShouldExposeFailure() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(indexingService.getStatus(taskId)).thenReturn(new TaskStatusView(
            taskId, UUID.randomUUID(), TaskType.FULL_REINDEX, TaskStatus.FAILED, 40.0,
            "Failed", 10, 4, "embedding", "Embedding provider unavailable after 3 attempts"));

        mockMvc.perform(get("/tasks/{id}", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.failed_at_stage").value("embedding"))
            .andExpect(jsonPath("$.error_message").value("Embedding provider unavailable after 3 attempts"));
    }

    @Test
    @DisplayName("GET /tasks/{id} should return 404 for unknown tasks")
    void status_ShouldReturn404() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(indexingService.getStatus(taskId)).thenThrow(new EntityNotFoundException(taskId));

        mockMvc.perform(get("/tasks/{id}", taskId))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error_code").value("NOT_FOUND"));
    }

    @Test
    @DisplayName("POST /tasks/{id}/cancel should return the cancelled task")
    void cancel_ShouldReturnCancelledTask() throws Exception {
        UUID taskId = UUID.randomUUID();
        when(indexingService.cancel(taskId)).thenReturn(new TaskStatusView(
            taskId, UUID.randomUUID(), TaskType.FULL_REINDEX, TaskStatus.CANCELLED, 30.0,
            "Cancelled", 10, 3, null, null));

        mockMvc.perform(post("/tasks/{id}/cancel", taskId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("CANCELLED"));
    }
}
