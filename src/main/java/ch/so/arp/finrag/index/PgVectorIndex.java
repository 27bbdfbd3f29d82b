package ch.so.arp.finrag.index;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.JdbcClient;

/**
 * PostgreSQL/pgvector backed index. It scores by dense cosine similarity only,
 * so hybrid retrieval re-ranks its results on the client.
 */
class PgVectorIndex implements VectorIndex {

    private static final Logger LOGGER = LoggerFactory.getLogger(PgVectorIndex.class);

    private static final String QUERY_SQL = """
            SELECT
              c.id,
              COALESCE(c.text, '') AS text,
              COALESCE(c.source, '') AS source,
              c.ticker,
              c.fiscal_year,
              c.quarter,
              COALESCE(c.section, '') AS section,
              (1.0 - (c.embedding <=> CAST(:embedding AS vector))) AS score
            FROM finrag.chunks c
            WHERE c.embedding IS NOT NULL
              AND (CAST(:ticker AS text) IS NULL OR c.ticker = :ticker)
              AND (CAST(:fiscalYear AS integer) IS NULL OR c.fiscal_year = :fiscalYear)
              AND (CAST(:quarter AS text) IS NULL OR c.quarter = :quarter)
            ORDER BY c.embedding <=> CAST(:embedding AS vector)
            LIMIT :limit
            """;

    private final JdbcClient jdbcClient;

    PgVectorIndex(JdbcClient jdbcClient) {
        this.jdbcClient = Objects.requireNonNull(jdbcClient, "jdbcClient");
    }

    @Override
    public List<ScoredChunk> query(IndexQuery query) {
        MetadataFilter filter = query.filter();
        List<ScoredChunk> matches = jdbcClient.sql(QUERY_SQL)
                .param("embedding", toPgVectorLiteral(query.dense()))
                .param("ticker", filter.ticker())
                .param("fiscalYear", filter.fiscalYear())
                .param("quarter", filter.quarter())
                .param("limit", query.topK())
                .query(ScoredChunkRowMapper.INSTANCE)
                .list();
        LOGGER.debug("pgvector returned {} chunks (limit={}, filter={})", matches.size(), query.topK(), filter);
        return matches;
    }

    static String toPgVectorLiteral(float[] embedding) {
        StringBuilder builder = new StringBuilder();
        builder.append('[');
        for (int i = 0; i < embedding.length; i++) {
            if (i > 0) {
                builder.append(',');
            }
            builder.append(String.format(Locale.ROOT, "%f", embedding[i]));
        }
        builder.append(']');
        return builder.toString();
    }

    private enum ScoredChunkRowMapper implements RowMapper<ScoredChunk> {
        INSTANCE;

        @Override
        public ScoredChunk mapRow(ResultSet rs, int rowNum) throws SQLException {
            int year = rs.getInt("fiscal_year");
            Integer fiscalYear = rs.wasNull() ? null : year;
            Chunk chunk = new Chunk(
                    rs.getString("id"),
                    rs.getString("text"),
                    rs.getString("source"),
                    rs.getString("ticker"),
                    fiscalYear,
                    rs.getString("quarter"),
                    rs.getString("section"));
            return new ScoredChunk(chunk, rs.getDouble("score"));
        }
    }
}
