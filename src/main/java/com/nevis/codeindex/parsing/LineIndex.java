package com.nevis.codeindex.parsing;

import java.util.Arrays;

public final class LineIndex {

    private final int[] lineStarts;
    private final int length;

    public LineIndex(String source) {
        int count = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                count++;
            }
        }
        lineStarts = new int[count];
        int line = 1;
        for (int i = 0; i < source.length(); i++) {
            if (source.charAt(i) == '\n') {
                lineStarts[line++] = i + 1;
            }
        }
        length = source.length();
    }

    public int lineOf(int offset) {
        if (offset <= 0) {
            return 1;
        }
        if (offset >= length) {
            return lineStarts.length;
        }
        int position = Arrays.binarySearch(lineStarts, offset);
        return position >= 0 ? position + 1 : -position - 1;
    }

    public int offsetOf(int line, int column) {
        int index = Math.max(0, Math.min(line, lineStarts.length) - 1);
        return Math.min(length, lineStarts[index] + Math.max(0, column - 1));
    }

    public int lineStart(int line) {
        return offsetOf(line, 1);
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
