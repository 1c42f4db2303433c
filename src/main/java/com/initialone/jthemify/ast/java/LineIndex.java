package com.initialone.jthemify.ast.java;

import java.util.Arrays;

/**
 * Maps JavaParser positions (1-based line and column, one column per char) to char offsets.
 * Recognizes the same terminators as the parser: \n, \r\n and a lone \r.
 */
final class LineIndex {
    private final int[] lineStarts;
    private final int length;

    LineIndex(String text) {
        int[] starts = new int[16];
        int n = 0;
        starts[n++] = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean breakHere = false;
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') i++;
                breakHere = true;
            } else if (c == '\n') {
                breakHere = true;
            }
            if (breakHere) {
                if (n == starts.length) starts = Arrays.copyOf(starts, n * 2);
                starts[n++] = i + 1;
            }
        }
        this.lineStarts = Arrays.copyOf(starts, n);
        this.length = text.length();
    }

    int offsetOf(int line, int column) {
        if (line < 1 || line > lineStarts.length) {
            throw new IndexOutOfBoundsException("line " + line + " of " + lineStarts.length);
        }
        int off = lineStarts[line - 1] + column - 1;
        if (off < 0 || off > length) {
            throw new IndexOutOfBoundsException("position " + line + ":" + column + " outside text");
        }
        return off;
    }

    int lineOf(int offset) {
        int i = Arrays.binarySearch(lineStarts, offset);
        return i >= 0 ? i + 1 : -i - 1;
    }

    int lineCount() {
        return lineStarts.length;
    }
}
