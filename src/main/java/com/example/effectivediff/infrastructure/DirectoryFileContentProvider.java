package com.example.effectivediff.infrastructure;

import com.example.effectivediff.application.FileContentProvider;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads file contents from two checked-out trees, one per revision. Paths that would resolve
 * outside their tree are rejected.
 */
public class DirectoryFileContentProvider implements FileContentProvider {
    private final Path oldRoot;
    private final Path newRoot;

    public DirectoryFileContentProvider(Path oldRoot, Path newRoot) {
        this.oldRoot = oldRoot.toAbsolutePath().normalize();
        this.newRoot = newRoot.toAbsolutePath().normalize();
    }

    @Override
    public String read(String path, Revision revision) throws IOException {
        Path root = revision == Revision.OLD ? oldRoot : newRoot;
        Path file = root.resolve(path).normalize();
        if (!file.startsWith(root)) {
            throw new IOException("Path " + path + " escapes " + root);
        }
        return Files.readString(file, StandardCharsets.UTF_8);
    }
}
