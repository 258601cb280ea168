package com.renewalsync.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for contract_events (audit trail of applied ledger events).
 */
@Repository
@RequiredArgsConstructor
public class ContractEventRepository {

    private static final String COLUMNS = "id, sub_id, event_type, ledger, tx_hash, event_data::text AS event_data, processed_at";

    private final JdbcTemplate jdbc;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Batch insert; rows already present for (tx_hash, event_type, sub_id) are skipped.
     *
     * @return number of rows actually inserted
     */
    public int insertAll(List<ContractEventRecord> records) {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        List<Object[]> args = new ArrayList<>(records.size());
        for (ContractEventRecord r : records) {
            Instant processedAt = r.getProcessedAt() != null ? r.getProcessedAt() : now;
            args.add(new Object[]{
                    r.getSubId(), r.getEventType(), r.getLedger(), r.getTxHash(),
                    toJson(r.getEventData()), Timestamp.from(processedAt)
            });
        }
        int[] counts = jdbc.batchUpdate("""
                INSERT INTO contract_events (sub_id, event_type, ledger, tx_hash, event_data, processed_at)
                VALUES (?, ?, ?, ?, ?::jsonb, ?)
                ON CONFLICT (tx_hash, event_type, sub_id) DO NOTHING
                """, args);
        int inserted = 0;
        for (int c : counts) {
            inserted += Math.max(c, 0);
        }
        return inserted;
    }

    /** Rows at or above {@code ledger}, newest first. */
    public List<ContractEventRecord> findByLedgerGreaterThanEqual(long ledger) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM contract_events WHERE ledger >= ? ORDER BY ledger DESC, id DESC",
                rowMapper(), ledger);
    }

    /**
     * Most recent row for the subscription strictly below {@code ledger} whose type is one of {@code eventTypes}.
     */
    public Optional<ContractEventRecord> findLatestBefore(long subId, long ledger, Collection<String> eventTypes) {
        if (eventTypes == null || eventTypes.isEmpty()) {
            return Optional.empty();
        }
        String placeholders = String.join(", ", Collections.nCopies(eventTypes.size(), "?"));
        List<Object> args = new ArrayList<>();
        args.add(subId);
        args.add(ledger);
        args.addAll(eventTypes);
        List<ContractEventRecord> rows = jdbc.query(
                "SELECT " + COLUMNS + " FROM contract_events WHERE sub_id = ? AND ledger < ? AND event_type IN ("
                        + placeholders + ") ORDER BY ledger DESC, id DESC LIMIT 1",
                rowMapper(), args.toArray());
        return rows.stream().findFirst();
    }

    public List<ContractEventRecord> findBySubId(long subId) {
        return jdbc.query(
                "SELECT " + COLUMNS + " FROM contract_events WHERE sub_id = ? ORDER BY ledger, id",
                rowMapper(), subId);
    }

    public int deleteByLedgerGreaterThanEqual(long ledger) {
        return jdbc.update("DELETE FROM contract_events WHERE ledger >= ?", ledger);
    }

    private RowMapper<ContractEventRecord> rowMapper() {
        return (rs, i) -> map(rs);
    }

    private ContractEventRecord map(ResultSet rs) throws SQLException {
        ContractEventRecord r = new ContractEventRecord();
        r.setId(rs.getLong("id"));
        r.setSubId(rs.getLong("sub_id"));
        r.setEventType(rs.getString("event_type"));
        r.setLedger(rs.getLong("ledger"));
        r.setTxHash(rs.getString("tx_hash"));
        r.setEventData(fromJson(rs.getString("event_data")));
        Timestamp processedAt = rs.getTimestamp("processed_at");
        r.setProcessedAt(processedAt != null ? processedAt.toInstant() : null);
        return r;
    }

    private String toJson(JsonNode node) {
        try {
            return node == null ? "{}" : objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new InvalidDataAccessApiUsageException("Cannot serialize event_data", e);
        }
    }

    private JsonNode fromJson(String json) {
        if (json == null) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new DataRetrievalFailureException("Cannot parse stored event_data", e);
        }
    }
}
