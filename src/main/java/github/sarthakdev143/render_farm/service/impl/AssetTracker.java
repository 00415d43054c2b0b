package github.sarthakdev143.render_farm.service.impl;

import github.sarthakdev143.render_farm.model.AssetRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Content hash and modification time per asset path, kept in a single SQLite table.
 */
@Component
public class AssetTracker {

    private static final Logger logger = LoggerFactory.getLogger(AssetTracker.class);

    private static final String CREATE_TABLE_SQL =
            "CREATE TABLE IF NOT EXISTS assets (path TEXT PRIMARY KEY, hash TEXT, last_modified REAL)";
    private static final String UPSERT_SQL =
            "INSERT OR REPLACE INTO assets (path, hash, last_modified) VALUES (?, ?, ?)";
    private static final String SELECT_SQL =
            "SELECT path, hash, last_modified FROM assets WHERE path = ?";
    private static final String DELETE_SQL =
            "DELETE FROM assets WHERE path = ?";

    private static final RowMapper<AssetRecord> ROW_MAPPER = (resultSet, rowNum) -> new AssetRecord(
            resultSet.getString("path"),
            resultSet.getString("hash"),
            resultSet.getDouble("last_modified"));

    private final JdbcTemplate jdbcTemplate;

    public AssetTracker(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
        jdbcTemplate.execute(CREATE_TABLE_SQL);
    }

    public Optional<String> lookup(String path) {
        return find(path).map(AssetRecord::contentHash);
    }

    public Optional<AssetRecord> find(String path) {
        List<AssetRecord> records = jdbcTemplate.query(SELECT_SQL, ROW_MAPPER, path);
        return records.stream().findFirst();
    }

    /**
     * Inserts or overwrites the entry for {@code path}.
     */
    public void record(String path, String contentHash, double modifiedTime) {
        jdbcTemplate.update(UPSERT_SQL, path, contentHash, modifiedTime);
        logger.debug("Recorded asset {} hash={}", path, contentHash);
    }

    public void forget(String path) {
        jdbcTemplate.update(DELETE_SQL, path);
        logger.debug("Forgot asset {}", path);
    }

    public boolean needsUpload(String path, String currentHash) {
        return lookup(path)
                .map(recordedHash -> !recordedHash.equals(currentHash))
                .orElse(true);
    }
}
