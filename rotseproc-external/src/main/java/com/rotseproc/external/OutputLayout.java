package com.rotseproc.external;

import com.rotseproc.core.Artifact;
import com.rotseproc.core.exception.ExternalToolException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * The directory convention external tools and stages agree on: every stage directory holds an
 * {@code image/} and a {@code prod/} subdirectory. Tools signal completion by leaving files
 * there; nothing here parses what they wrote.
 */
public final class OutputLayout {
    public static final String IMAGE = "image";
    public static final String PROD = "prod";

    private OutputLayout() {}

    /** Creates {@code dir/image} and {@code dir/prod}; returns {@code dir}. */
    public static Path create(Path dir) throws IOException {
        Files.createDirectories(dir.resolve(IMAGE));
        Files.createDirectories(dir.resolve(PROD));
        return dir;
    }

    public static Path images(Path dir) {
        return dir.resolve(IMAGE);
    }

    public static Path prods(Path dir) {
        return dir.resolve(PROD);
    }

    /** Moves files in {@code from} matching {@code glob} into {@code to}, replacing same-named files. */
    public static List<Path> moveMatching(Path from, String glob, Path to) throws IOException {
        Files.createDirectories(to);
        List<Path> moved = new ArrayList<>();
        for (Path p : Artifact.list(from, glob)) {
            moved.add(Files.move(p, to.resolve(p.getFileName()), StandardCopyOption.REPLACE_EXISTING));
        }
        return moved;
    }

    public static List<Path> copyAll(List<Path> files, Path to) throws IOException {
        Files.createDirectories(to);
        List<Path> copied = new ArrayList<>(files.size());
        for (Path p : files) {
            copied.add(Files.copy(p, to.resolve(p.getFileName()), StandardCopyOption.REPLACE_EXISTING));
        }
        return copied;
    }

    /**
     * Post-condition check after a tool run.
     *
     * @return matching files, sorted
     * @throws ExternalToolException naming the expected pattern and what was found when nothing matches
     */
    public static List<Path> requireOutputs(String stageName, Path dir, String glob) throws IOException {
        List<Path> found = Artifact.list(dir, glob);
        if (found.isEmpty()) {
            throw ExternalToolException.missingOutputs(stageName, dir.resolve(glob).toString(), Artifact.list(dir, "*"));
        }
        return found;
    }
}
