package com.nevis.codeindex.parsing;

import com.nevis.codeindex.config.IndexingProperties;
import com.nevis.codeindex.model.ChunkNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Cuts chunks whose estimated size exceeds the token budget into line windows that overlap
 * by a fixed number of lines. A single line larger than the budget is cut by characters.
 */
@Slf4j
@Component
public class ChunkSplitter {

    private final int maxTokens;
    private final int overlapLines;

    public ChunkSplitter(IndexingProperties properties) {
        this.maxTokens = properties.chunking().maxTokens();
        this.overlapLines = properties.chunking().overlapLines();
    }

    public List<ChunkNode> splitAll(List<ChunkNode> chunks) {
        List<ChunkNode> result = new ArrayList<>(chunks.size());
        chunks.forEach(chunk -> result.addAll(split(chunk)));
        return result;
    }

    public List<ChunkNode> split(ChunkNode chunk) {
        if (TokenEstimator.estimate(chunk.content()) <= maxTokens) {
            return List.of(chunk);
        }
        List<Window> windows = windows(Arrays.asList(chunk.content().split("\n", -1)));
        if (windows.size() <= 1) {
            return List.of(chunk);
        }
        List<ChunkNode> fragments = new ArrayList<>(windows.size());
        for (int part = 0; part < windows.size(); part++) {
            Window window = windows.get(part);
            fragments.add(chunk.asFragment(part,
                chunk.startLine() + window.firstLine(),
                chunk.startLine() + window.lastLine(),
                window.text()));
        }
        log.debug("Split {} in {} into {} fragments", chunk.symbolName(), chunk.filePath(), fragments.size());
        return fragments;
    }

    private record Window(int firstLine, int lastLine, String text) {}

    private List<Window> windows(List<String> lines) {
        List<Window> windows = new ArrayList<>();
        int lineCount = lines.size();
        int start = 0;
        int covered = 0;
        while (covered < lineCount) {
            int end = fill(lines, start);
            if (end <= covered) {
                if (start < covered) {
                    // the overlap leaves no room for a new line
                    start = covered;
                    continue;
                }
                for (String piece : cutLine(lines.get(covered))) {
                    windows.add(new Window(covered, covered, piece));
                }
                covered++;
                start = covered;
                continue;
            }
            windows.add(new Window(start, end - 1, String.join("\n", lines.subList(start, end))));
            covered = end;
            start = Math.max(start + 1, end - overlapLines);
        }
        return windows;
    }

    private int fill(List<String> lines, int start) {
        long ascii = 0;
        long other = 0;
        int end = start;
        while (end < lines.size()) {
            String line = lines.get(end);
            long lineAscii = line.chars().filter(c -> c < 128).count();
            long nextAscii = ascii + lineAscii + (end > start ? 1 : 0);
            long nextOther = other + line.length() - lineAscii;
            if (TokenEstimator.tokens(nextAscii, nextOther) > maxTokens) {
                break;
            }
            ascii = nextAscii;
            other = nextOther;
            end++;
        }
        return end;
    }

    private List<String> cutLine(String line) {
        List<String> pieces = new ArrayList<>();
        long ascii = 0;
        long other = 0;
        int pieceStart = 0;
        for (int i = 0; i < line.length(); i++) {
            boolean isAscii = line.charAt(i) < 128;
            long nextAscii = ascii + (isAscii ? 1 : 0);
            long nextOther = other + (isAscii ? 0 : 1);
            if (i > pieceStart && TokenEstimator.tokens(nextAscii, nextOther) > maxTokens) {
                pieces.add(line.substring(pieceStart, i));
                pieceStart = i;
                nextAscii = isAscii ? 1 : 0;
                nextOther = isAscii ? 0 : 1;
            }
            ascii = nextAscii;
            other = nextOther;
        }
        pieces.add(line.substring(pieceStart));
        return pieces;
    }
}
