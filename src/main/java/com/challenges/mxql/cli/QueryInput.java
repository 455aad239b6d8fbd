package com.challenges.mxql.cli;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

/**
 * Reads query text from a file, or from standard input when no file is given.
 */
final class QueryInput {
    private QueryInput() {
    }

    static String read(File file) throws IOException {
        if (file != null) {
            return Files.readString(file.toPath(), StandardCharsets.UTF_8);
        }
        InputStream input = System.in;
        return new String(input.readAllBytes(), StandardCharsets.UTF_8);
    }

    static String label(File file) {
        return file == null ? "<stdin>" : file.getPath();
    }
}
