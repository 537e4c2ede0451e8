package com.nevis.codeindex.model;

import lombok.Getter;

@Getter
public enum PipelineStage {
    ACQUIRE(TaskStatus.ACQUIRING, "acquiring", 5, "Acquiring repository"),
    PARSE(TaskStatus.PARSING, "parsing", 20, "Parsing source files"),
    EMBED(TaskStatus.EMBEDDING, "embedding", 50, "Embedding chunks"),
    GENERATE_ARTIFACTS(TaskStatus.GENERATING_ARTIFACTS, "generating-artifacts", 75, "Generating derived artifacts");

    private final TaskStatus status;
    private final String stageName;
    private final double startProgress;
    private final String label;

    PipelineStage(TaskStatus status, String stageName, double startProgress, String label) {
        this.status = status;
        this.stageName = stageName;
        this.startProgress = startProgress;
        this.label = label;
    }

    public double endProgress() {
        PipelineStage[] stages = values();
        return ordinal() + 1 < stages.length ? stages[ordinal() + 1].startProgress : 95;
    }
}
