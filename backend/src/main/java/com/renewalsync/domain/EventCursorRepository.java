package com.renewalsync.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Persistence for the singleton event_cursor row. All writes are conditional so concurrent pollers
 * never move the cursor backwards outside of an explicit rewind.
 */
@Repository
@RequiredArgsConstructor
public class EventCursorRepository {

    private final JdbcTemplate jdbc;

    public Optional<EventCursor> find() {
        List<EventCursor> rows = jdbc.query(
                "SELECT id, last_ledger, updated_at FROM event_cursor WHERE id = ?",
                (rs, i) -> {
                    EventCursor cursor = new EventCursor();
                    cursor.setId(rs.getInt("id"));
                    cursor.setLastLedger(rs.getLong("last_ledger"));
                    Timestamp updatedAt = rs.getTimestamp("updated_at");
                    cursor.setUpdatedAt(updatedAt != null ? updatedAt.toInstant() : null);
                    return cursor;
                },
                EventCursor.SINGLETON_ID);
        return rows.stream().findFirst();
    }

    /** Stored last ledger, 0 when the cursor row does not exist yet. */
    public long findLastLedger() {
        return find().map(EventCursor::getLastLedger).orElse(0L);
    }

    /**
     * Creates the row or moves it forward. Returns false when the stored value is already greater
     * (another instance got further).
     */
    public boolean advance(long ledger) {
        int updated = jdbc.update("""
                INSERT INTO event_cursor (id, last_ledger, updated_at)
                VALUES (?, ?, now())
                ON CONFLICT (id) DO UPDATE
                    SET last_ledger = EXCLUDED.last_ledger, updated_at = now()
                    WHERE event_cursor.last_ledger <= EXCLUDED.last_ledger
                """, EventCursor.SINGLETON_ID, ledger);
        return updated > 0;
    }

    /**
     * Lowers the cursor for a reorg rollback. No-op when the stored value is already at or below {@code ledger}.
     */
    public boolean rewindTo(long ledger) {
        int updated = jdbc.update(
                "UPDATE event_cursor SET last_ledger = ?, updated_at = now() WHERE id = ? AND last_ledger > ?",
                ledger, EventCursor.SINGLETON_ID, ledger);
        return updated > 0;
    }
}
