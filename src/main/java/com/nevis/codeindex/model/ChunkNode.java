package com.nevis.codeindex.model;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;

public record ChunkNode(
    UUID id,
    UUID repositoryId,
    String filePath,
    String fileHash,
    ChunkKind kind,
    String nodeType,
    String symbolName,
    String parentName,
    String language,
    int startLine,
    int endLine,
    String content,
    List<String> calls,
    List<String> decorators,
    String docstring,
    boolean dataModel,
    List<DataModelField> dataModelFields,
    Integer partIndex
) {
    public static final String ANONYMOUS = "<anonymous>";

    public ChunkNode {
        calls = calls == null ? List.of() : List.copyOf(calls);
        decorators = decorators == null ? List.of() : List.copyOf(decorators);
        dataModelFields = dataModelFields == null ? List.of() : List.copyOf(dataModelFields);
    }

    public static UUID deriveId(UUID repositoryId, String filePath, String fileHash, String nodeType,
                                String symbolName, int startLine, int startOffset) {
        String key = String.join("|",
            String.valueOf(repositoryId), filePath, fileHash, nodeType, symbolName,
            Integer.toString(startLine), Integer.toString(startOffset));
        return UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8));
    }

    public static UUID fragmentId(UUID unitId, int part) {
        return UUID.nameUUIDFromBytes((unitId + "#" + part).getBytes(StandardCharsets.UTF_8));
    }

    public boolean isFragment() {
        return partIndex != null;
    }

    public boolean isHead() {
        return partIndex == null || partIndex == 0;
    }

    public boolean isNamed() {
        return symbolName != null && !symbolName.isBlank() && !ANONYMOUS.equals(symbolName);
    }

    public ChunkNode asFragment(int part, int fragmentStartLine, int fragmentEndLine, String fragmentContent) {
        boolean head = part == 0;
        return new ChunkNode(
            fragmentId(id, part),
            repositoryId,
            filePath,
            fileHash,
            kind,
            nodeType,
            symbolName,
            parentName,
            language,
            fragmentStartLine,
            fragmentEndLine,
            fragmentContent,
            head ? calls : List.of(),
            head ? decorators : List.of(),
            head ? docstring : null,
            dataModel,
            head ? dataModelFields : List.of(),
            part
        );
    }

    public String embeddingText() {
        StringBuilder text = new StringBuilder()
            .append("Language: ").append(language).append('\n')
            .append("Type: ").append(nodeType).append('\n')
            .append("Name: ").append(symbolName).append('\n')
            .append("File: ").append(filePath).append('\n');
        if (parentName != null) {
            text.append("Parent: ").append(parentName).append('\n');
        }
        if (docstring != null && !docstring.isBlank()) {
            text.append("Documentation: ").append(docstring).append('\n');
        }
        return text.append("Code:\n").append(content).toString();
    }
}
