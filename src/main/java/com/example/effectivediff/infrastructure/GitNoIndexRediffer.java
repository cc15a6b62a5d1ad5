package com.example.effectivediff.infrastructure;

import com.example.effectivediff.application.EffectiveDiffProperties;
import com.example.effectivediff.application.MalformedDiffException;
import com.example.effectivediff.application.RediffException;
import com.example.effectivediff.application.Rediffer;
import com.example.effectivediff.domain.Hunk;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Re-differ backed by {@code git diff --no-index}. Both texts are written to a scratch directory
 * that is removed after every call. Exit code 0 means no differences and 1 means differences;
 * anything else is a failure.
 */
@Component
public class GitNoIndexRediffer implements Rediffer {
    private static final Logger log = LogManager.getLogger(GitNoIndexRediffer.class);

    private final String gitExecutable;
    private final int contextLines;
    private final UnifiedDiffParser parser;
    private final ProcessLauncher launcher;

    @Autowired
    public GitNoIndexRediffer(EffectiveDiffProperties properties, UnifiedDiffParser parser) {
        this(properties, parser, command -> new ProcessBuilder(command).redirectErrorStream(true).start());
    }

    GitNoIndexRediffer(
            EffectiveDiffProperties properties, UnifiedDiffParser parser, ProcessLauncher launcher) {
        properties.validate();
        this.gitExecutable = properties.getGitExecutable();
        this.contextLines = properties.getRediffContextLines();
        this.parser = parser;
        this.launcher = launcher;
    }

    @Override
    public List<Hunk> rediff(String oldText, String newText) throws RediffException {
        Path workDir = null;
        try {
            workDir = Files.createTempDirectory("effective-diff-rediff");
            Path oldFile = workDir.resolve("old");
            Path newFile = workDir.resolve("new");
            Files.writeString(oldFile, oldText, StandardCharsets.UTF_8);
            Files.writeString(newFile, newText, StandardCharsets.UTF_8);
            return runGit(command(oldFile, newFile));
        } catch (IOException e) {
            throw new RediffException("Could not run " + gitExecutable + " diff --no-index", e);
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> command(Path oldFile, Path newFile) {
        return List.of(
                gitExecutable,
                "diff",
                "--no-index",
                "--no-color",
                "--no-ext-diff",
                "-U" + contextLines,
                "--",
                oldFile.toString(),
                newFile.toString());
    }

    private List<Hunk> runGit(List<String> command) throws IOException, RediffException {
        Process process = launcher.start(command);
        String output;
        try (InputStream stdout = process.getInputStream()) {
            output = new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        }
        int exitCode;
        try {
            exitCode = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new RediffException("Interrupted while waiting for git", e);
        }
        if (exitCode == 0) {
            return List.of();
        }
        if (exitCode != 1) {
            throw new RediffException("git diff --no-index exited with " + exitCode + ": " + output.strip());
        }
        try {
            return parser.parseHunks(Arrays.asList(output.split("\n")));
        } catch (MalformedDiffException e) {
            throw new RediffException("Unreadable git diff output", e);
        }
    }

    private void deleteRecursively(Path directory) {
        if (directory == null) {
            return;
        }
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
        } catch (IOException e) {
            log.debug("Could not remove scratch directory {}", directory, e);
        }
    }

    /** Starts a process for a command line; replaced in tests. */
    @FunctionalInterface
    interface ProcessLauncher {
        Process start(List<String> command) throws IOException;
    }
}
