package com.nevis.codeindex.worker;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.event.TaskProgressEvent;
import com.nevis.codeindex.model.TaskStatusView;
import com.nevis.codeindex.repository.IndexingTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

@Component
@Slf4j
@RequiredArgsConstructor
public class StaleTaskWorker {

    private final IndexingTaskRepository taskRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final IndexingProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void interruptOrphanedTasks() {
        List<UUID> interrupted = taskRepository.interruptActive();
        if (!interrupted.isEmpty()) {
            log.warn("Marked {} tasks left over from a previous run as interrupted", interrupted.size());
            publish(interrupted);
        }
    }

    @Scheduled(fixedDelayString = "${app.worker.stale-check-interval-ms:60000}")
    public void interruptStaleTasks() {
        log.debug("Checking for stale indexing tasks...");

        List<UUID> interrupted = taskRepository.interruptStale(properties.task().staleAfter());
        if (interrupted.isEmpty()) {
            return;
        }
        log.warn("Marked {} stale tasks as interrupted", interrupted.size());
        publish(interrupted);
    }

    private void publish(List<UUID> taskIds) {
        taskIds.forEach(id -> taskRepository.findById(id)
            .map(TaskStatusView::from)
            .ifPresent(view -> eventPublisher.publishEvent(new TaskProgressEvent(view))));
    }
}
