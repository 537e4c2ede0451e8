package com.nevis.codeindex.event;

import java.util.UUID;

public record IndexingTaskSubmittedEvent(UUID taskId, UUID repositoryId) {}
