package com.nevis.codeindex.listener;

import com.nevis.codeindex.event.IndexingTaskSubmittedEvent;
import com.nevis.codeindex.service.PipelineOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class IndexingTaskEventListener {

    private final PipelineOrchestrator pipelineOrchestrator;

    @Async("indexingTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleSubmitted(IndexingTaskSubmittedEvent event) {
        log.info("Starting indexing task {} for repository {}", event.taskId(), event.repositoryId());
        pipelineOrchestrator.run(event.taskId());
    }
}
