package org.vectorfill.pipeline.checkpoint;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectWriter;

import org.vectorfill.pipeline.ir.PipelineState;
import org.vectorfill.pipeline.json.PipelineJson;

import lombok.extern.slf4j.Slf4j;

/**
 * Keeps each session's state in {@code <dir>/<sessionId>.state.json}. A save writes a temp file
 * next to the target, forces it to disk and moves it over the target, so a crash leaves either the
 * previous or the new state and never a torn file.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    static final String SUFFIX = ".state.json";

    private final Path directory;
    private final ObjectWriter writer = PipelineJson.mapper().writerWithDefaultPrettyPrinter();
    private final ReentrantLock lock = new ReentrantLock();

    public FileCheckpointStore(Path directory) {
        this.directory = directory;
    }

    public Path fileFor(String sessionId) {
        return directory.resolve(sessionId + SUFFIX);
    }

    @Override
    public void save(PipelineState state) throws IOException {
        byte[] bytes = writer.writeValueAsBytes(state);
        lock.lock();
        try {
            Files.createDirectories(directory);
            var target = fileFor(state.sessionId());
            var temp = Files.createTempFile(directory, state.sessionId() + ".", ".tmp");
            try {
                try (var channel = FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                    var buffer = ByteBuffer.wrap(bytes);
                    while (buffer.hasRemaining()) {
                        channel.write(buffer);
                    }
                    channel.force(true);
                }
                moveIntoPlace(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.atDebug().setMessage("Saved checkpoint {} at cursor {} ({} processed)")
                .addArgument(target)
                .addArgument(state::cursor)
                .addArgument(state::processedCount)
                .log();
        } finally {
            lock.unlock();
        }
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.atWarn().setMessage("Filesystem does not support atomic moves, replacing {} non-atomically")
                .addArgument(target)
                .log();
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public Optional<PipelineState> load(String sessionId) throws IOException {
        var file = fileFor(sessionId);
        lock.lock();
        try {
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(file);
            } catch (NoSuchFileException e) {
                return Optional.empty();
            }
            PipelineState state;
            try {
                state = PipelineJson.mapper().readValue(bytes, PipelineState.class);
            } catch (JsonProcessingException | RuntimeException e) {
                throw new CheckpointCorruptedException(file, e);
            }
            if (state == null || !sessionId.equals(state.sessionId())) {
                throw new CheckpointCorruptedException(file,
                    new IllegalStateException("File does not hold session " + sessionId));
            }
            return Optional.of(state);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> latestSessionId() throws IOException {
        return stateFiles().stream()
            .max(Comparator.comparing(FileCheckpointStore::lastModified)
                .thenComparing(p -> p.getFileName().toString()))
            .map(FileCheckpointStore::sessionIdOf);
    }

    @Override
    public List<String> list() throws IOException {
        return stateFiles().stream().map(FileCheckpointStore::sessionIdOf).sorted().toList();
    }

    private List<Path> stateFiles() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.filter(p -> p.getFileName().toString().endsWith(SUFFIX))
                .collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
        }
    }

    private static String sessionIdOf(Path file) {
        var name = file.getFileName().toString();
        return name.substring(0, name.length() - SUFFIX.length());
    }

    private static long lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file).toMillis();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
