package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.model.AssetRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.jdbc.core.JdbcTemplate;
import org.sqlite.SQLiteDataSource;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class AssetTrackerTest {

    @TempDir
    Path tempDir;

    private AssetTracker tracker;

    @BeforeEach
    void setUp() {
        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("asset_tracker.db"));
        tracker = new AssetTracker(new JdbcTemplate(dataSource));
    }

    @Test
    void lookupOfUnknownPathIsEmpty() {
        assertThat(tracker.lookup("/assets/unknown.blend")).isEmpty();
        assertThat(tracker.find("/assets/unknown.blend")).isEmpty();
    }

    @Test
    void recordThenLookupReturnsHash() {
        tracker.record("/assets/shot.blend", "hash-1", 1700000000.5);

        assertThat(tracker.lookup("/assets/shot.blend")).contains("hash-1");
        assertThat(tracker.find("/assets/shot.blend"))
                .contains(new AssetRecord("/assets/shot.blend", "hash-1", 1700000000.5));
    }

    @Test
    void recordOverwritesExistingEntry() {
        tracker.record("/assets/shot.blend", "hash-1", 1.0);
        tracker.record("/assets/shot.blend", "hash-2", 2.0);

        assertThat(tracker.lookup("/assets/shot.blend")).contains("hash-2");
        assertThat(tracker.find("/assets/shot.blend").orElseThrow().modifiedTime()).isEqualTo(2.0);
    }

    @Test
    void needsUploadWhenUnknownOrHashDiffers() {
        tracker.record("/assets/shot.blend", "hash-1", 1.0);

        assertThat(tracker.needsUpload("/assets/shot.blend", "hash-1")).isFalse();
        assertThat(tracker.needsUpload("/assets/shot.blend", "hash-2")).isTrue();
        assertThat(tracker.needsUpload("/assets/other.blend", "hash-1")).isTrue();
    }

    @Test
    void entriesSurviveReopeningTheDatabase() {
        tracker.record("/assets/shot.blend", "hash-1", 1.0);

        SQLiteDataSource dataSource = new SQLiteDataSource();
        dataSource.setUrl("jdbc:sqlite:" + tempDir.resolve("asset_tracker.db"));
        AssetTracker reopened = new AssetTracker(new JdbcTemplate(dataSource));

        assertThat(reopened.lookup("/assets/shot.blend")).contains("hash-1");
        assertThat(Files.exists(tempDir.resolve("asset_tracker.db"))).isTrue();
    }

    @Test
    void hasherProducesMd5Hex() throws Exception {
        Path file = Files.writeString(tempDir.resolve("hello.txt"), "hello");

        assertThat(new AssetHasher().hash(file)).isEqualTo("5d41402abc4b2a76b9719d911017c592");
    }

    @Test
    void forgetRemovesEntry() {
        tracker.record("/assets/shot.blend", "hash-1", 1.0);

        tracker.forget("/assets/shot.blend");

        assertThat(tracker.lookup("/assets/shot.blend")).isEmpty();
        assertThat(tracker.needsUpload("/assets/shot.blend", "hash-1")).isTrue();
    }
}
