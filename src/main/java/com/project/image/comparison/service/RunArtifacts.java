package com.project.image.comparison.service;

import com.project.image.comparison.exceptions.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Collects the artifacts of one run. A failed write is recorded and logged
 * and does not stop the remaining artifacts.
 */
public class RunArtifacts {
    private static final Logger log = LoggerFactory.getLogger(RunArtifacts.class);

    private final List<Path> written = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();

    public void write(String name, Supplier<Path> writer) {
        try {
            written.add(writer.get());
        } catch (StorageException e) {
            log.warn("Artifact {} not written: {}", name, e.getMessage());
            failed.add(name);
        }
    }

    public List<Path> written() {
        return List.copyOf(written);
    }

    public List<String> failed() {
        return List.copyOf(failed);
    }
}
