package com.beacon.statusservice.infrastructure.store;

import com.beacon.statusmodel.StatusFileNames;
import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusmodel.StatusRecordSerializer;
import com.beacon.statusmodel.StatusRecordSerializer.StatusSerializationException;
import com.beacon.statusservice.domain.LatestRecordIndex;
import com.beacon.statusservice.domain.RecordId;
import com.beacon.statusservice.domain.StatusRepository;
import com.beacon.statusservice.domain.StoreUnavailableException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Status store backed by a directory of JSON files, one file per record, named after {@link
 * StatusFileNames}.
 *
 * <p>Each append writes a temporary file and moves it into place, so a record file is either
 * complete or absent. Same-second records of one service get increasing collision counters, which
 * preserves their insertion order on disk. At startup the directory is replayed ordered by record
 * timestamp, then collision counter; files that cannot be parsed are logged and skipped.
 */
public class FileStatusRepository implements StatusRepository {

    private static final Logger log = LoggerFactory.getLogger(FileStatusRepository.class);

    private record LoadedFile(StatusRecord record, int collision, String fileName) {}

    private final Path directory;
    private final LatestRecordIndex index = new LatestRecordIndex();

    /**
     * Opens the store, creating the directory if needed and replaying existing status files.
     *
     * @throws StoreUnavailableException if the directory cannot be created or listed
     */
    public FileStatusRepository(Path directory) {
        this.directory = directory;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot create status directory " + directory, e);
        }
        List<LoadedFile> loaded = loadExisting();
        for (LoadedFile file : loaded) {
            index.offer(file.record());
        }
        log.info("Status directory {} opened with {} existing records", directory, loaded.size());
    }

    @Override
    public synchronized RecordId append(StatusRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record must not be null");
        }
        ensureReachable();
        Path target = freeTarget(record);
        Path temp = directory.resolve(target.getFileName() + ".tmp");
        try {
            Files.writeString(temp, StatusRecordSerializer.serialize(record), StandardCharsets.UTF_8);
            moveIntoPlace(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StoreUnavailableException("Cannot write status file " + target, e);
        }
        index.offer(record);
        log.debug("Wrote status file {}", target);
        return new RecordId(target.getFileName().toString());
    }

    @Override
    public synchronized Optional<StatusRecord> latestByName(String serviceName) {
        ensureReachable();
        return index.latest(serviceName);
    }

    @Override
    public synchronized Map<String, StatusRecord> latestAll() {
        ensureReachable();
        return index.snapshot();
    }

    public Path directory() {
        return directory;
    }

    private void ensureReachable() {
        if (!Files.isDirectory(directory) || !Files.isReadable(directory)) {
            throw new StoreUnavailableException("Status directory " + directory + " is not accessible");
        }
    }

    private Path freeTarget(StatusRecord record) {
        int collision = 0;
        Path target = directory.resolve(StatusFileNames.fileName(record, collision));
        while (Files.exists(target)) {
            collision++;
            target = directory.resolve(StatusFileNames.fileName(record, collision));
        }
        return target;
    }

    private static void moveIntoPlace(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target);
        }
    }

    private static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Could not remove temporary file {}: {}", path, e.getMessage());
        }
    }

    private List<LoadedFile> loadExisting() {
        List<LoadedFile> loaded = new ArrayList<>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(path -> StatusFileNames.isStatusFile(path.getFileName().toString()))
                    .forEach(path -> read(path).ifPresent(loaded::add));
        } catch (IOException e) {
            throw new StoreUnavailableException("Cannot list status directory " + directory, e);
        }
        loaded.sort(
                Comparator.comparing((LoadedFile file) -> file.record().timestamp())
                        .thenComparingInt(LoadedFile::collision)
                        .thenComparing(LoadedFile::fileName));
        return loaded;
    }

    private Optional<LoadedFile> read(Path path) {
        String fileName = path.getFileName().toString();
        try {
            StatusRecord record = StatusRecordSerializer.deserialize(Files.readString(path));
            int collision = StatusFileNames.collisionOf(fileName).orElse(0);
            return Optional.of(new LoadedFile(record, collision, fileName));
        } catch (IOException | StatusSerializationException e) {
            log.warn("Skipping unreadable status file {}: {}", fileName, e.getMessage());
            return Optional.empty();
        }
    }
}
