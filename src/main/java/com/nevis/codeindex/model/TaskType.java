package com.nevis.codeindex.model;

public enum TaskType {
    FULL_REINDEX,
    INCREMENTAL_SYNC,
    DERIVED_ONLY
}
