package com.example.FundScout.repository;

import com.example.FundScout.model.VectorMatch;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pgvector.PGvector;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Repository
@RequiredArgsConstructor
public class FundingVectorRepository {

    private static final Logger log = LoggerFactory.getLogger(FundingVectorRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Nearest programs within a namespace by pgvector cosine distance {@code <=>},
     * with similarity score = 1 - distance.
     */
    public List<VectorMatch> findNearest(float[] embedding, int limit, String namespace) {
        PGvector queryVector = new PGvector(embedding);

        String sql = """
                SELECT metadata,
                       1 - (embedding <=> ?) AS score
                FROM funding_programs
                WHERE namespace = ?
                ORDER BY embedding <=> ?
                LIMIT ?
                """;

        return jdbcTemplate.query(sql, ps -> {
            ps.setObject(1, queryVector); // for 1 - (embedding <=> ?)
            ps.setString(2, namespace);
            ps.setObject(3, queryVector); // for ORDER BY embedding <=> ?
            ps.setInt(4, limit);
        }, new VectorMatchRowMapper());
    }

    private class VectorMatchRowMapper implements RowMapper<VectorMatch> {
        @Override
        public VectorMatch mapRow(ResultSet rs, int rowNum) throws SQLException {
            Map<String, String> metadata = parseMetadata(rs.getString("metadata"));
            return new VectorMatch(metadata, rs.getDouble("score"));
        }
    }

    /**
     * Flattens the metadata JSON object into string values; unreadable metadata
     * becomes an empty map so one bad row does not fail the query.
     */
    Map<String, String> parseMetadata(String metadataJson) {
        if (metadataJson == null || metadataJson.isBlank()) {
            return Map.of();
        }
        try {
            JsonNode node = objectMapper.readTree(metadataJson);
            if (node == null || !node.isObject()) {
                return Map.of();
            }
            Map<String, String> flat = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode value = field.getValue();
                if (value == null || value.isNull()) {
                    continue;
                }
                flat.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
            return flat;
        } catch (IOException e) {
            log.warn("Unreadable program metadata, using empty metadata: {}", e.getMessage());
            return Map.of();
        }
    }
}
