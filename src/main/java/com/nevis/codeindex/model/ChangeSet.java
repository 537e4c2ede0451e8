package com.nevis.codeindex.model;

import java.util.ArrayList;
import java.util.List;

public record ChangeSet(
    List<SourceFile> added,
    List<SourceFile> modified,
    List<SourceFile> unchanged,
    List<FileCheckpoint> deleted
) {
    public ChangeSet {
        added = List.copyOf(added);
        modified = List.copyOf(modified);
        unchanged = List.copyOf(unchanged);
        deleted = List.copyOf(deleted);
    }

    public List<SourceFile> toProcess() {
        List<SourceFile> files = new ArrayList<>(added.size() + modified.size());
        files.addAll(added);
        files.addAll(modified);
        return files;
    }

    public boolean isEmpty() {
        return added.isEmpty() && modified.isEmpty() && deleted.isEmpty();
    }
}
