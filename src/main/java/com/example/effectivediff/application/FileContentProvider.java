package com.example.effectivediff.application;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Map;

/**
 * Supplies full file contents for either side of a diff. A missing file is reported with
 * {@link NoSuchFileException}.
 */
@FunctionalInterface
public interface FileContentProvider {
    String read(String path, Revision revision) throws IOException;

    /** Serves contents from two path-keyed maps, one per revision. */
    static FileContentProvider fromMaps(
            Map<String, String> oldFileContents, Map<String, String> newFileContents) {
        Map<String, String> oldContents = Map.copyOf(oldFileContents);
        Map<String, String> newContents = Map.copyOf(newFileContents);
        return (path, revision) -> {
            String content =
                    revision == Revision.OLD ? oldContents.get(path) : newContents.get(path);
            if (content == null) {
                throw new NoSuchFileException(path, null, revision.name().toLowerCase() + " revision");
            }
            return content;
        };
    }

    enum Revision {
        OLD,
        NEW
    }
}
