package com.delta.adfeed.monitor.persistence;

import com.delta.adfeed.monitor.model.AdRecord;
import com.delta.adfeed.monitor.model.UpsertOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Locale;

/**
 * Durable dedup ledger of accepted ads, keyed by the content hash of the ad URL.
 */
@Repository
public class AdJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(AdJdbcRepository.class);

    private static final RowMapper<AdRecord> AD_ROW_MAPPER = (rs, rowNum) -> new AdRecord(
        rs.getString("ad_id"),
        rs.getString("title"),
        rs.getString("price"),
        rs.getString("url"),
        toInstant(rs.getObject("first_seen", OffsetDateTime.class)),
        toInstant(rs.getObject("last_checked", OffsetDateTime.class))
    );

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final boolean postgres;

    public AdJdbcRepository(NamedParameterJdbcTemplate jdbc, PlatformTransactionManager transactionManager, Clock clock) {
        this.jdbc = jdbc;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.postgres = detectPostgres(jdbc);
    }

    public boolean isDbReachable() {
        Integer value = jdbc.getJdbcTemplate().queryForObject("SELECT 1", Integer.class);
        return value != null && value == 1;
    }

    public boolean isKnown(String adId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM ad_changes WHERE ad_id = :adId",
            new MapSqlParameterSource().addValue("adId", adId),
            Integer.class
        );
        return count != null && count > 0;
    }

    public AdRecord findById(String adId) {
        List<AdRecord> rows = jdbc.query(
            """
                SELECT ad_id, url, title, price, first_seen, last_checked
                FROM ad_changes
                WHERE ad_id = :adId
                """,
            new MapSqlParameterSource().addValue("adId", adId),
            AD_ROW_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    public long countAds() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM ad_changes", Long.class);
        return count == null ? 0 : count;
    }

    /**
     * Inserts the ad or, when a row with the same id already exists, refreshes its title, price and
     * {@code last_checked}. {@code first_seen} is never overwritten. The primary key on {@code ad_id}
     * is the uniqueness guard: a lost insert race turns into an update instead of an error.
     */
    public UpsertOutcome upsert(AdRecord ad) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("adId", ad.id())
            .addValue("url", ad.url())
            .addValue("title", ad.title())
            .addValue("price", ad.price())
            .addValue("firstSeen", toOffset(ad.firstSeen()))
            .addValue("lastChecked", toOffset(ad.lastChecked()));
        UpsertOutcome outcome = transactionTemplate.execute(status -> postgres ? upsertPostgres(params) : upsertLegacy(params));
        return outcome == null ? UpsertOutcome.UPDATED : outcome;
    }

    private UpsertOutcome upsertPostgres(MapSqlParameterSource params) {
        int inserted = jdbc.update(
            """
                INSERT INTO ad_changes (ad_id, url, title, price, first_seen, last_checked)
                VALUES (:adId, :url, :title, :price, :firstSeen, :lastChecked)
                ON CONFLICT (ad_id) DO NOTHING
                """,
            params
        );
        if (inserted > 0) {
            return UpsertOutcome.INSERTED;
        }
        refreshSighting(params);
        return UpsertOutcome.UPDATED;
    }

    private UpsertOutcome upsertLegacy(MapSqlParameterSource params) {
        int updated = refreshSighting(params);
        if (updated > 0) {
            return UpsertOutcome.UPDATED;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO ad_changes (ad_id, url, title, price, first_seen, last_checked)
                    VALUES (:adId, :url, :title, :price, :firstSeen, :lastChecked)
                    """,
                params
            );
            return UpsertOutcome.INSERTED;
        } catch (DuplicateKeyException raced) {
            log.debug("Concurrent insert for ad {}; refreshing instead", params.getValue("adId"));
            refreshSighting(params);
            return UpsertOutcome.UPDATED;
        }
    }

    private int refreshSighting(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE ad_changes
                SET title = :title,
                    price = :price,
                    last_checked = :lastChecked
                WHERE ad_id = :adId
                """,
            params
        );
    }

    /**
     * Ads whose {@code last_checked} is at or after {@code since}, newest first.
     */
    public List<AdRecord> findRecent(Instant since, int limit) {
        return jdbc.query(
            """
                SELECT ad_id, url, title, price, first_seen, last_checked
                FROM ad_changes
                WHERE last_checked >= :since
                ORDER BY last_checked DESC, ad_id
                LIMIT :limit
                """,
            new MapSqlParameterSource()
                .addValue("since", toOffset(since))
                .addValue("limit", Math.max(1, limit)),
            AD_ROW_MAPPER
        );
    }

    public int prune(Duration retention) {
        return pruneOlderThan(Instant.now(clock).minus(retention));
    }

    /**
     * Deletes ads whose {@code last_checked} is strictly before {@code cutoff}.
     */
    public int pruneOlderThan(Instant cutoff) {
        return jdbc.update(
            "DELETE FROM ad_changes WHERE last_checked < :cutoff",
            new MapSqlParameterSource().addValue("cutoff", toOffset(cutoff))
        );
    }

    private static OffsetDateTime toOffset(Instant value) {
        return value == null ? null : value.atOffset(ZoneOffset.UTC);
    }

    private static Instant toInstant(OffsetDateTime value) {
        return value == null ? null : value.toInstant();
    }

    private boolean detectPostgres(NamedParameterJdbcTemplate jdbcTemplate) {
        if (jdbcTemplate.getJdbcTemplate().getDataSource() == null) {
            return false;
        }
        try (Connection connection = jdbcTemplate.getJdbcTemplate().getDataSource().getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            String productName = metaData == null ? null : metaData.getDatabaseProductName();
            String url = metaData == null ? null : metaData.getURL();
            if (url != null && url.toLowerCase(Locale.ROOT).startsWith("jdbc:h2:")) {
                return false;
            }
            return productName != null && productName.toLowerCase(Locale.ROOT).contains("postgres");
        } catch (Exception e) {
            log.warn("Unable to detect database product; defaulting to portable upsert", e);
            return false;
        }
    }
}
