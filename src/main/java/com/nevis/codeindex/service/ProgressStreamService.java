package com.nevis.codeindex.service;

import com.nevis.codeindex.event.TaskProgressEvent;
import com.nevis.codeindex.model.TaskStatusView;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

@Slf4j
@Service
public class ProgressStreamService {

    static final String EVENT_NAME = "progress";

    private final Map<UUID, List<SseEmitter>> emitters = new ConcurrentHashMap<>();
    private final long timeoutMs;

    public ProgressStreamService(@Value("${app.stream.timeout-ms:1800000}") long timeoutMs) {
        this.timeoutMs = timeoutMs;
    }

    public SseEmitter subscribe(TaskStatusView current) {
        UUID taskId = current.taskId();
        SseEmitter emitter = new SseEmitter(timeoutMs);
        if (current.isTerminal()) {
            send(taskId, emitter, current);
            emitter.complete();
            return emitter;
        }

        emitter.onCompletion(() -> remove(taskId, emitter));
        emitter.onTimeout(() -> {
            log.debug("Progress stream of task {} timed out", taskId);
            remove(taskId, emitter);
        });
        emitter.onError(error -> remove(taskId, emitter));
        emitters.computeIfAbsent(taskId, id -> new CopyOnWriteArrayList<>()).add(emitter);

        send(taskId, emitter, current);
        return emitter;
    }

    @EventListener
    public void onProgress(TaskProgressEvent event) {
        TaskStatusView status = event.status();
        List<SseEmitter> subscribers = emitters.get(status.taskId());
        if (subscribers == null) {
            return;
        }
        for (SseEmitter emitter : subscribers) {
            if (send(status.taskId(), emitter, status) && status.isTerminal()) {
                emitter.complete();
            }
        }
        if (status.isTerminal()) {
            emitters.remove(status.taskId());
        }
    }

    @Scheduled(fixedDelayString = "${app.stream.keep-alive-ms:15000}")
    public void keepAlive() {
        emitters.forEach((taskId, subscribers) -> subscribers.forEach(emitter -> {
            try {
                emitter.send(SseEmitter.event().comment("keep-alive"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping progress subscriber of task {}: {}", taskId, e.getMessage());
                remove(taskId, emitter);
            }
        }));
    }

    int subscriberCount(UUID taskId) {
        List<SseEmitter> subscribers = emitters.get(taskId);
        return subscribers == null ? 0 : subscribers.size();
    }

    private boolean send(UUID taskId, SseEmitter emitter, TaskStatusView status) {
        try {
            emitter.send(SseEmitter.event().name(EVENT_NAME).data(status));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping progress subscriber of task {}: {}", taskId, e.getMessage());
            remove(taskId, emitter);
            return false;
        }
    }

    private void remove(UUID taskId, SseEmitter emitter) {
        emitters.computeIfPresent(taskId, (id, subscribers) -> {
            subscribers.remove(emitter);
            return subscribers.isEmpty() ? null : subscribers;
        });
    }
}
