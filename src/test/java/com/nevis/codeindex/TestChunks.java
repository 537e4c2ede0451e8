package com.nevis.codeindex;

import com.nevis.codeindex.model.ChunkKind;
import com.nevis.codeindex.model.ChunkNode;

import java.util.List;
import java.util.UUID;

public final class TestChunks {

    private TestChunks() {
    }

    public static ChunkNode function(UUID repoId, String file, String name, int line, String... calls) {
        return chunk(repoId, file, "hash-" + file, ChunkKind.FUNCTION, name, line, List.of(calls), null);
    }

    public static ChunkNode chunk(UUID repoId, String file, String hash, ChunkKind kind, String name, int line,
                                  List<String> calls, Integer partIndex) {
        String nodeType = kind.isType() ? "class_definition" : kind == ChunkKind.CONSTANT ? "assignment" : "function_definition";
        UUID unitId = ChunkNode.deriveId(repoId, file, hash, nodeType, name, line, 0);
        return new ChunkNode(
            partIndex == null ? unitId : ChunkNode.fragmentId(unitId, partIndex),
            repoId, file, hash, kind, nodeType, name, null, "python",
            line, line + 2, "def " + name + "():\n    pass\n",
            calls, List.of(), null, false, List.of(), partIndex);
    }
}
