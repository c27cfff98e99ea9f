package com.ordinalcomparator.reconcile.checkpoint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ordinalcomparator.domain.Checkpoint;
import com.ordinalcomparator.domain.CheckpointKey;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Optional;

/**
 * One JSON file per checkpoint key, named by the key fingerprint. Writes go to a temp file in the
 * same directory, are forced to disk, then atomically moved over the target.
 */
@Slf4j
public class FileCheckpointStore implements CheckpointStore {

    private final Path directory;
    private final ObjectMapper objectMapper;

    public FileCheckpointStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<Checkpoint> load(CheckpointKey key) {
        Path file = fileFor(key.fingerprint());
        Checkpoint checkpoint;
        try {
            checkpoint = objectMapper.readValue(Files.readAllBytes(file), Checkpoint.class);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CheckpointIOException("Cannot read checkpoint " + file, e);
        }
        if (!checkpoint.belongsTo(key)) {
            throw new ForeignCheckpointException("Checkpoint " + file + " belongs to " + checkpoint.getChain() + "/"
                    + checkpoint.getProtocol() + " " + checkpoint.getPrimaryEndpoint() + " vs "
                    + checkpoint.getSecondaryEndpoint() + ", not to " + key);
        }
        return Optional.of(checkpoint);
    }

    @Override
    public void save(Checkpoint checkpoint) {
        Path target = fileFor(checkpoint.getId());
        Path tmp = null;
        try {
            Files.createDirectories(directory);
            tmp = Files.createTempFile(directory, checkpoint.getId(), ".tmp");
            byte[] json = objectMapper.writeValueAsBytes(checkpoint);
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
                ByteBuffer buf = ByteBuffer.wrap(json);
                while (buf.hasRemaining()) {
                    channel.write(buf);
                }
                channel.force(true);
            }
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Checkpoint {} saved at height {}", target.getFileName(), checkpoint.getLastReconciledHeight());
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new CheckpointIOException("Cannot write checkpoint " + target, e);
        }
    }

    Path fileFor(String fingerprint) {
        return directory.resolve(fingerprint + ".json");
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temp checkpoint {}: {}", tmp, e.getMessage());
        }
    }
}
