package io.tick4j.internal.postgres;

import io.tick4j.core.JobAndNextTick;
import io.tick4j.core.JobStoredData;
import io.tick4j.core.JobType;
import io.tick4j.store.AbstractMetadataStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.regex.Pattern;

/**
 * PostgreSQL persistence layer for job metadata.
 *
 * <p>Instants are stored as epoch seconds. A {@code next_tick} of 0 means the job has no next tick.
 * The table name is validated once and interpolated into the statement text; only values are
 * bound as parameters.
 */
public class PostgresMetadataStore extends AbstractMetadataStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresMetadataStore.class);

    public static final String DEFAULT_TABLE = "tick4j_jobs";
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final String COLUMNS = "id, last_updated, next_tick, last_tick, job_type, count, "
            + "ran, stopped, schedule, repeating, repeated_every, extra";

    private final JdbcTemplate jdbcTemplate;
    private final String table;
    private final boolean initTables;
    private final RowMapper<JobStoredData> rowMapper = this::mapRow;

    public PostgresMetadataStore(JdbcTemplate jdbcTemplate, String table, boolean initTables) {
        super();
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.table = validateTableName(table);
        this.initTables = initTables;
    }

    public PostgresMetadataStore(JdbcTemplate jdbcTemplate, String table, boolean initTables, Executor executor) {
        super(executor);
        this.jdbcTemplate = Objects.requireNonNull(jdbcTemplate, "jdbcTemplate must not be null");
        this.table = validateTableName(table);
        this.initTables = initTables;
    }

    public String table() {
        return table;
    }

    @Override
    protected void doInit() {
        if (initTables) {
            String sql = """
                    CREATE TABLE IF NOT EXISTS %s (
                        id UUID PRIMARY KEY,
                        last_updated BIGINT,
                        next_tick BIGINT,
                        last_tick BIGINT,
                        job_type INTEGER NOT NULL,
                        count BIGINT,
                        ran BOOLEAN,
                        stopped BOOLEAN,
                        schedule TEXT,
                        repeating BOOLEAN,
                        repeated_every BIGINT,
                        extra BYTEA
                    )
                    """.formatted(table);
            jdbcTemplate.execute(sql);
            log.info("tick4j ensured postgres table={}", table);
        } else {
            // fails fast when the table is missing
            jdbcTemplate.queryForObject("SELECT COUNT(*) FROM %s WHERE 1 = 0".formatted(table), Long.class);
        }
    }

    @Override
    protected Optional<JobStoredData> doGet(UUID id) {
        List<JobStoredData> rows = jdbcTemplate.query(
                "SELECT %s FROM %s WHERE id = ?".formatted(COLUMNS, table), rowMapper, id);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    @Override
    protected void doAddOrUpdate(JobStoredData data) {
        String sql = """
                INSERT INTO %s (%s)
                VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (id) DO UPDATE SET
                    last_updated = EXCLUDED.last_updated,
                    next_tick = EXCLUDED.next_tick,
                    last_tick = EXCLUDED.last_tick,
                    job_type = EXCLUDED.job_type,
                    count = EXCLUDED.count,
                    ran = EXCLUDED.ran,
                    stopped = EXCLUDED.stopped,
                    schedule = EXCLUDED.schedule,
                    repeating = EXCLUDED.repeating,
                    repeated_every = EXCLUDED.repeated_every,
                    extra = EXCLUDED.extra
                """.formatted(table, COLUMNS);
        jdbcTemplate.update(sql,
                data.id(),
                toSeconds(data.lastUpdated()),
                data.nextTick() == null ? 0L : data.nextTick().getEpochSecond(),
                toSeconds(data.lastTick()),
                data.jobType().code(),
                data.count(),
                data.ran(),
                data.stopped(),
                data.schedule(),
                data.repeating(),
                data.repeatedEverySeconds(),
                data.extra());
    }

    @Override
    protected void doDelete(UUID id) {
        int deleted = jdbcTemplate.update("DELETE FROM %s WHERE id = ?".formatted(table), id);
        log.debug("tick4j postgres delete id={} deleted={}", id, deleted);
    }

    @Override
    protected List<JobAndNextTick> doListNextTicks(Instant now) {
        return jdbcTemplate.query(
                "SELECT id, job_type, next_tick, last_tick FROM %s WHERE next_tick > 0 AND next_tick < ? ORDER BY next_tick ASC"
                        .formatted(table),
                (rs, rowNum) -> new JobAndNextTick(
                        rs.getObject("id", UUID.class),
                        JobType.fromCode(rs.getInt("job_type")),
                        nextTickOf(rs),
                        instantOf(rs, "last_tick")),
                now.getEpochSecond());
    }

    @Override
    protected boolean doSetNextAndLastTick(UUID id, Instant nextTick, Instant lastTick) {
        int updated = jdbcTemplate.update(
                "UPDATE %s SET next_tick = ?, last_tick = ?, last_updated = ? WHERE id = ?".formatted(table),
                nextTick == null ? 0L : nextTick.getEpochSecond(),
                toSeconds(lastTick),
                Instant.now().getEpochSecond(),
                id);
        return updated > 0;
    }

    @Override
    protected Optional<Instant> doFindNextTickAfter(Instant now) {
        List<Long> ticks = jdbcTemplate.queryForList(
                "SELECT next_tick FROM %s WHERE next_tick > 0 AND next_tick > ? ORDER BY next_tick ASC LIMIT 1"
                        .formatted(table),
                Long.class,
                now.getEpochSecond());
        return ticks.isEmpty() ? Optional.empty() : Optional.of(Instant.ofEpochSecond(ticks.get(0)));
    }

    private JobStoredData mapRow(ResultSet rs, int rowNum) throws SQLException {
        return new JobStoredData(
                rs.getObject("id", UUID.class),
                instantOf(rs, "last_updated"),
                instantOf(rs, "last_tick"),
                nextTickOf(rs),
                JobType.fromCode(rs.getInt("job_type")),
                rs.getLong("count"),
                rs.getBoolean("ran"),
                rs.getBoolean("stopped"),
                rs.getString("schedule"),
                rs.getObject("repeating", Boolean.class),
                rs.getObject("repeated_every", Long.class),
                rs.getBytes("extra"));
    }

    private static Instant nextTickOf(ResultSet rs) throws SQLException {
        long value = rs.getLong("next_tick");
        return rs.wasNull() || value == 0 ? null : Instant.ofEpochSecond(value);
    }

    private static Instant instantOf(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Instant.ofEpochSecond(value);
    }

    private static Long toSeconds(Instant instant) {
        return instant == null ? null : instant.getEpochSecond();
    }

    static String validateTableName(String table) {
        Objects.requireNonNull(table, "table must not be null");
        String trimmed = table.trim();
        if (!SAFE_IDENTIFIER.matcher(trimmed).matches()) {
            throw new IllegalArgumentException("Unsupported tick4j table name: " + table);
        }
        return trimmed;
    }
}
