package com.beacon.statusservice.infrastructure.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.beacon.statusmodel.ServiceStatus;
import com.beacon.statusmodel.StatusRecord;
import com.beacon.statusservice.domain.RecordId;
import com.beacon.statusservice.domain.StoreUnavailableException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("FileStatusRepository")
class FileStatusRepositoryTest {

    private static final Instant T10 = Instant.parse("2024-05-01T10:00:10Z");
    private static final Instant T20 = Instant.parse("2024-05-01T10:00:20Z");

    @TempDir Path dir;

    private static long fileCount(Path dir) throws IOException {
        try (Stream<Path> files = Files.list(dir)) {
            return files.count();
        }
    }

    @Nested
    @DisplayName("writing")
    class Writing {

        @Test
        @DisplayName("writes one named JSON file per record")
        void writesNamedFile() throws IOException {
            var repository = new FileStatusRepository(dir);

            RecordId id = repository.append(new StatusRecord("httpd", ServiceStatus.UP, "web-01", T10));

            assertThat(id.value()).isEqualTo("httpd-status-20240501T100010Z.json");
            String json = Files.readString(dir.resolve(id.value()));
            assertThat(json).contains("\"service_name\"").contains("\"httpd\"").contains("\"UP\"");
            assertThat(fileCount(dir)).isEqualTo(1);
        }

        @Test
        @DisplayName("same-second records get increasing collision suffixes")
        void collisionSuffix() {
            var repository = new FileStatusRepository(dir);

            RecordId first = repository.append(StatusRecord.of("httpd", ServiceStatus.UP, T10));
            RecordId second = repository.append(StatusRecord.of("httpd", ServiceStatus.DOWN, T10));
            RecordId third = repository.append(StatusRecord.of("httpd", ServiceStatus.UP, T10));

            assertThat(first.value()).isEqualTo("httpd-status-20240501T100010Z.json");
            assertThat(second.value()).isEqualTo("httpd-status-20240501T100010Z-1.json");
            assertThat(third.value()).isEqualTo("httpd-status-20240501T100010Z-2.json");
        }

        @Test
        @DisplayName("creates a missing directory")
        void createsDirectory() {
            Path nested = dir.resolve("a").resolve("b");

            new FileStatusRepository(nested);

            assertThat(nested).isDirectory();
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("the later of two same-timestamp records is the latest")
        void tieBreak() {
            var repository = new FileStatusRepository(dir);
            repository.append(new StatusRecord("httpd", ServiceStatus.UP, "a", T10));
            repository.append(new StatusRecord("httpd", ServiceStatus.DOWN, "b", T20));
            StatusRecord third = new StatusRecord("httpd", ServiceStatus.UP, "c", T20);
            repository.append(third);

            assertThat(repository.latestByName("httpd")).contains(third);
        }

        @Test
        @DisplayName("reloads the same latest records after a restart")
        void reloadKeepsTieBreak() {
            var repository = new FileStatusRepository(dir);
            repository.append(new StatusRecord("httpd", ServiceStatus.UP, "a", T10));
            repository.append(new StatusRecord("httpd", ServiceStatus.DOWN, "b", T20));
            StatusRecord third = new StatusRecord("httpd", ServiceStatus.UP, "c", T20);
            repository.append(third);
            repository.append(StatusRecord.of("rabbitmq", ServiceStatus.DOWN, T10));

            var reopened = new FileStatusRepository(dir);

            assertThat(reopened.latestByName("httpd")).contains(third);
            assertThat(reopened.latestAll()).containsOnlyKeys("httpd", "rabbitmq");
        }

        @Test
        @DisplayName("skips corrupt and foreign files on reload")
        void skipsCorruptFiles() throws IOException {
            var repository = new FileStatusRepository(dir);
            StatusRecord good = StatusRecord.of("httpd", ServiceStatus.UP, T10);
            repository.append(good);
            Files.writeString(dir.resolve("httpd-status-20240501T100020Z.json"), "{not json");
            Files.writeString(dir.resolve("notes.txt"), "hello");

            var reopened = new FileStatusRepository(dir);

            assertThat(reopened.latestByName("httpd")).contains(good);
        }

        @Test
        @DisplayName("a removed directory makes the store unavailable")
        void unavailableDirectory() throws IOException {
            Path storeDir = dir.resolve("store");
            var repository = new FileStatusRepository(storeDir);
            Files.delete(storeDir);

            assertThatThrownBy(repository::latestAll).isInstanceOf(StoreUnavailableException.class);
            assertThatThrownBy(() -> repository.latestByName("httpd"))
                    .isInstanceOf(StoreUnavailableException.class);
            assertThatThrownBy(() -> repository.append(StatusRecord.of("httpd", ServiceStatus.UP, T10)))
                    .isInstanceOf(StoreUnavailableException.class);
        }

        @Test
        @DisplayName("a path that is a regular file cannot be opened")
        void fileInsteadOfDirectory() throws IOException {
            Path file = Files.writeString(dir.resolve("occupied"), "x");

            assertThatThrownBy(() -> new FileStatusRepository(file))
                    .isInstanceOf(StoreUnavailableException.class);
        }
    }
}
