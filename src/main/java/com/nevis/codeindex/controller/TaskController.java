package com.nevis.codeindex.controller;

import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.service.IndexingService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.UUID;

@RestController
@RequestMapping("/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final IndexingService indexingService;

    @GetMapping("/{id}")
    public ResponseEntity<TaskStatusView> status(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.getStatus(id));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<TaskStatusView> cancel(@PathVariable UUID id) {
        return ResponseEntity.ok(indexingService.cancel(id));
    }

    @GetMapping(path = "/{id}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable UUID id) {
        return indexingService.streamProgress(id);
    }
}
