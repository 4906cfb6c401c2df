package com.spa.aggregator.crawl.persistence;

import com.spa.aggregator.crawl.model.EnrichmentCandidate;
import com.spa.aggregator.crawl.model.EnrichmentFilterMode;
import com.spa.aggregator.crawl.model.ProductListQuery;
import com.spa.aggregator.crawl.model.ProductRecord;
import com.spa.aggregator.crawl.model.ReviewStatus;
import com.spa.aggregator.crawl.model.UpsertOutcome;
import com.spa.aggregator.product.model.NormalizedProduct;
import com.spa.aggregator.product.model.ProductAttribute;
import com.spa.aggregator.product.model.ProductJsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Persistence of {@code products}, keyed by a caller-supplied content hash. The row id is assigned once on insert
 * and never changes; {@code review_status} is owned by reviewers and never touched by upserts.
 */
@Repository
public class ProductJdbcRepository {
    private static final Logger log = LoggerFactory.getLogger(ProductJdbcRepository.class);

    private static final String SUMMARY_COLUMNS = """
        id, content_hash, source_kind, isin, valor_number, issuer_name, product_type, currency,
        maturity_date, coupon_rate_pct_pa, barrier_present, review_status, source_file_path,
        created_at, updated_at
        """;

    private static final RowMapper<ProductRecord> RECORD_MAPPER = ProductJdbcRepository::mapRecord;

    private final NamedParameterJdbcTemplate jdbc;
    private final ProductJsonCodec codec;
    private final boolean postgres;

    public ProductJdbcRepository(NamedParameterJdbcTemplate jdbc, ProductJsonCodec codec) {
        this.jdbc = jdbc;
        this.codec = codec;
        this.postgres = detectPostgres(jdbc);
    }

    /**
     * Inserts the record or updates the row with the same content hash in place.
     * {@code sourceFilePath} only overwrites the stored path when non-null.
     *
     * @throws StorageConflictException when the row can neither be inserted nor updated
     */
    public UpsertOutcome upsert(
        String contentHash,
        String sourceKind,
        NormalizedProduct product,
        String rawText,
        String sourceFilePath,
        Instant now
    ) {
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("contentHash is required");
        }
        String existingId = findIdByHash(contentHash);
        String id = existingId != null ? existingId : UUID.randomUUID().toString();
        MapSqlParameterSource params = upsertParams(id, contentHash, sourceKind, product.toBuilder().id(id).build(), now)
            .addValue("rawText", rawText, Types.VARCHAR)
            .addValue("sourceFilePath", sourceFilePath, Types.VARCHAR);

        try {
            if (postgres) {
                upsertPostgres(params);
            } else {
                upsertPortable(params);
            }
        } catch (DataIntegrityViolationException e) {
            throw new StorageConflictException("Upsert failed for content hash " + contentHash, e);
        }

        String storedId = findIdByHash(contentHash);
        if (storedId == null) {
            throw new StorageConflictException("Upserted product not found for content hash " + contentHash, null);
        }
        return new UpsertOutcome(storedId, existingId == null && storedId.equals(id));
    }

    public String findIdByHash(String contentHash) {
        List<String> ids = jdbc.queryForList(
            "SELECT id FROM products WHERE content_hash = :contentHash",
            new MapSqlParameterSource("contentHash", contentHash),
            String.class
        );
        return ids.isEmpty() ? null : ids.get(0);
    }

    public ProductRecord findById(String id) {
        List<ProductRecord> rows = jdbc.query(
            "SELECT " + SUMMARY_COLUMNS + " FROM products WHERE id = :id",
            new MapSqlParameterSource("id", id),
            RECORD_MAPPER
        );
        return rows.isEmpty() ? null : rows.get(0);
    }

    /**
     * Loads the stored record with its row id applied.
     */
    public NormalizedProduct findProduct(String id) {
        List<String> rows = jdbc.queryForList(
            "SELECT normalized_json FROM products WHERE id = :id",
            new MapSqlParameterSource("id", id),
            String.class
        );
        if (rows.isEmpty()) {
            return null;
        }
        return codec.fromJson(rows.get(0)).toBuilder().id(id).build();
    }

    public List<ProductRecord> list(ProductListQuery query) {
        MapSqlParameterSource params = filterParams(query)
            .addValue("limit", query.limit())
            .addValue("offset", query.offset());
        return jdbc.query(
            "SELECT " + SUMMARY_COLUMNS + " FROM products" + filterClause(query)
                + " ORDER BY updated_at DESC, id LIMIT :limit OFFSET :offset",
            params,
            RECORD_MAPPER
        );
    }

    public long count(ProductListQuery query) {
        Long count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM products" + filterClause(query),
            filterParams(query),
            Long.class
        );
        return count == null ? 0L : count;
    }

    public boolean updateNormalized(String id, NormalizedProduct product, Instant now) {
        NormalizedProduct withId = product.toBuilder().id(id).build();
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("normalizedJson", codec.toJson(withId))
            .addValue("now", toTimestamp(now));
        addDenormalizedColumns(params, withId);
        int updated = jdbc.update(
            """
                UPDATE products
                SET normalized_json = :normalizedJson,
                    isin = :isin,
                    valor_number = :valorNumber,
                    issuer_name = :issuerName,
                    product_type = :productType,
                    currency = :currency,
                    maturity_date = :maturityDate,
                    coupon_rate_pct_pa = :couponRatePctPa,
                    barrier_present = :barrierPresent,
                    updated_at = :now
                WHERE id = :id
                """,
            params
        );
        return updated == 1;
    }

    public boolean updateReviewStatus(String id, ReviewStatus status, Instant now) {
        int updated = jdbc.update(
            """
                UPDATE products
                SET review_status = :status,
                    updated_at = :now
                WHERE id = :id
                """,
            new MapSqlParameterSource()
                .addValue("id", id)
                .addValue("status", status.dbValue())
                .addValue("now", toTimestamp(now))
        );
        return updated == 1;
    }

    /**
     * Products with an ISIN matching {@code mode}, in stable creation order.
     */
    public List<EnrichmentCandidate> findEnrichmentCandidates(EnrichmentFilterMode mode, int limit, int offset) {
        String condition = switch (mode) {
            case MISSING_COUPON -> " AND coupon_rate_pct_pa IS NULL";
            case MISSING_BARRIER -> " AND barrier_present = FALSE";
            case MISSING_ANY -> " AND (coupon_rate_pct_pa IS NULL OR barrier_present = FALSE)";
            case ALL_WITH_ISIN -> "";
        };
        return jdbc.query(
            """
                SELECT id, isin, normalized_json
                FROM products
                WHERE isin IS NOT NULL
                  AND isin <> ''
                """ + condition + """

                ORDER BY created_at, id
                LIMIT :limit OFFSET :offset
                """,
            new MapSqlParameterSource()
                .addValue("limit", Math.max(1, limit))
                .addValue("offset", Math.max(0, offset)),
            (rs, rowNum) -> new EnrichmentCandidate(
                rs.getString("id"),
                rs.getString("isin"),
                rs.getString("normalized_json")
            )
        );
    }

    private void upsertPostgres(MapSqlParameterSource params) {
        jdbc.update(
            """
                INSERT INTO products (
                    id, content_hash, source_kind, isin, valor_number, issuer_name, product_type, currency,
                    maturity_date, coupon_rate_pct_pa, barrier_present, review_status, normalized_json,
                    raw_text, source_file_path, created_at, updated_at
                )
                VALUES (
                    :id, :contentHash, :sourceKind, :isin, :valorNumber, :issuerName, :productType, :currency,
                    :maturityDate, :couponRatePctPa, :barrierPresent, 'pending', :normalizedJson,
                    :rawText, :sourceFilePath, :now, :now
                )
                ON CONFLICT (content_hash) DO UPDATE SET
                    source_kind = EXCLUDED.source_kind,
                    isin = EXCLUDED.isin,
                    valor_number = EXCLUDED.valor_number,
                    issuer_name = EXCLUDED.issuer_name,
                    product_type = EXCLUDED.product_type,
                    currency = EXCLUDED.currency,
                    maturity_date = EXCLUDED.maturity_date,
                    coupon_rate_pct_pa = EXCLUDED.coupon_rate_pct_pa,
                    barrier_present = EXCLUDED.barrier_present,
                    normalized_json = EXCLUDED.normalized_json,
                    raw_text = EXCLUDED.raw_text,
                    source_file_path = COALESCE(EXCLUDED.source_file_path, products.source_file_path),
                    updated_at = EXCLUDED.updated_at
                """,
            params
        );
    }

    private void upsertPortable(MapSqlParameterSource params) {
        if (updateByHash(params) > 0) {
            return;
        }
        try {
            jdbc.update(
                """
                    INSERT INTO products (
                        id, content_hash, source_kind, isin, valor_number, issuer_name, product_type, currency,
                        maturity_date, coupon_rate_pct_pa, barrier_present, review_status, normalized_json,
                        raw_text, source_file_path, created_at, updated_at
                    )
                    VALUES (
                        :id, :contentHash, :sourceKind, :isin, :valorNumber, :issuerName, :productType, :currency,
                        :maturityDate, :couponRatePctPa, :barrierPresent, 'pending', :normalizedJson,
                        :rawText, :sourceFilePath, :now, :now
                    )
                    """,
                params
            );
        } catch (DuplicateKeyException e) {
            log.debug("Concurrent insert for content hash {}, updating instead", params.getValue("contentHash"));
            updateByHash(params);
        }
    }

    private int updateByHash(MapSqlParameterSource params) {
        return jdbc.update(
            """
                UPDATE products
                SET source_kind = :sourceKind,
                    isin = :isin,
                    valor_number = :valorNumber,
                    issuer_name = :issuerName,
                    product_type = :productType,
                    currency = :currency,
                    maturity_date = :maturityDate,
                    coupon_rate_pct_pa = :couponRatePctPa,
                    barrier_present = :barrierPresent,
                    normalized_json = :normalizedJson,
                    raw_text = :rawText,
                    source_file_path = COALESCE(:sourceFilePath, source_file_path),
                    updated_at = :now
                WHERE content_hash = :contentHash
                """,
            params
        );
    }

    private MapSqlParameterSource upsertParams(
        String id,
        String contentHash,
        String sourceKind,
        NormalizedProduct product,
        Instant now
    ) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("contentHash", contentHash)
            .addValue("sourceKind", sourceKind == null || sourceKind.isBlank() ? "unknown" : sourceKind)
            .addValue("normalizedJson", codec.toJson(product))
            .addValue("now", toTimestamp(now));
        addDenormalizedColumns(params, product);
        return params;
    }

    private void addDenormalizedColumns(MapSqlParameterSource params, NormalizedProduct product) {
        params
            .addValue("isin", limit(product.text(ProductAttribute.ISIN).value(), 12), Types.VARCHAR)
            .addValue("valorNumber", limit(product.text(ProductAttribute.VALOR_NUMBER).value(), 20), Types.VARCHAR)
            .addValue("issuerName", limit(product.text(ProductAttribute.ISSUER_NAME).value(), 255), Types.VARCHAR)
            .addValue("productType", limit(product.text(ProductAttribute.PRODUCT_TYPE).value(), 255), Types.VARCHAR)
            .addValue("currency", limit(product.text(ProductAttribute.CURRENCY).value(), 8), Types.VARCHAR)
            .addValue("maturityDate", limit(product.text(ProductAttribute.MATURITY_DATE).value(), 32), Types.VARCHAR)
            .addValue("couponRatePctPa", product.number(ProductAttribute.COUPON_RATE_PCT_PA).value(), Types.DOUBLE)
            .addValue("barrierPresent", product.hasBarrier());
    }

    private String filterClause(ProductListQuery query) {
        StringBuilder where = new StringBuilder(" WHERE 1 = 1");
        if (query.sourceKind() != null) {
            where.append(" AND source_kind = :sourceKind");
        }
        if (query.productType() != null) {
            where.append(" AND product_type = :productType");
        }
        if (query.currency() != null) {
            where.append(" AND currency = :currency");
        }
        if (query.reviewStatus() != null) {
            where.append(" AND review_status = :reviewStatus");
        }
        if (query.search() != null) {
            where.append(" AND (LOWER(isin) LIKE :search OR LOWER(issuer_name) LIKE :search OR valor_number LIKE :search)");
        }
        return where.toString();
    }

    private MapSqlParameterSource filterParams(ProductListQuery query) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("sourceKind", query.sourceKind(), Types.VARCHAR)
            .addValue("productType", query.productType(), Types.VARCHAR)
            .addValue("currency", query.currency(), Types.VARCHAR)
            .addValue("reviewStatus", query.reviewStatus(), Types.VARCHAR);
        String search = query.search() == null ? null : "%" + query.search().trim().toLowerCase(Locale.ROOT) + "%";
        params.addValue("search", search, Types.VARCHAR);
        return params;
    }

    private static ProductRecord mapRecord(ResultSet rs, int rowNum) throws SQLException {
        double coupon = rs.getDouble("coupon_rate_pct_pa");
        Double nullableCoupon = rs.wasNull() ? null : coupon;
        return new ProductRecord(
            rs.getString("id"),
            rs.getString("content_hash"),
            rs.getString("source_kind"),
            rs.getString("isin"),
            rs.getString("valor_number"),
            rs.getString("issuer_name"),
            rs.getString("product_type"),
            rs.getString("currency"),
            rs.getString("maturity_date"),
            nullableCoupon,
            rs.getBoolean("barrier_present"),
            rs.getString("review_status"),
            rs.getString("source_file_path"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static String limit(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() <= maxLength ? trimmed : trimmed.substring(0, maxLength);
    }

    private static Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
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
