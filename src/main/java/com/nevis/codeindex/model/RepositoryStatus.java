package com.nevis.codeindex.model;

public enum RepositoryStatus {
    PENDING,
    ACQUIRING,
    READY,
    SYNCING,
    ERROR
}
