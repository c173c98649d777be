package org.vectorfill.pipeline.checkpoint;

import java.nio.file.Path;

import lombok.Getter;

public class CheckpointCorruptedException extends RuntimeException {
    @Getter
    private final transient Path file;

    public CheckpointCorruptedException(Path file, Throwable cause) {
        super("Checkpoint " + file + " exists but cannot be read", cause);
        this.file = file;
    }
}
