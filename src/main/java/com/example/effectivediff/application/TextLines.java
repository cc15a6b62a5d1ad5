package com.example.effectivediff.application;

import java.util.Arrays;
import java.util.List;

/**
 * Line splitting shared by the re-differs and the residual builder. Lines end at {@code \n} only,
 * as git splits them; a {@code \r} before it stays part of the line. A trailing line terminator
 * does not produce an extra empty line, so {@code "a\nb\n"} and {@code "a\nb"} both have two lines.
 */
public final class TextLines {

    private TextLines() {}

    public static List<String> split(String text) {
        if (text.isEmpty()) {
            return List.of();
        }
        String[] parts = text.split("\n", -1);
        int length = parts.length;
        if (parts[length - 1].isEmpty()) {
            length--;
        }
        return List.copyOf(Arrays.asList(parts).subList(0, length));
    }

    public static String join(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return String.join("\n", lines) + "\n";
    }
}
