package com.pgoutbox.adapter.out.persistence;

import com.pgoutbox.application.port.out.ReplicationSlotManager;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.WalPosition;
import com.pgoutbox.infrastructure.exception.ConnectionFailureException;
import com.pgoutbox.infrastructure.exception.SchemaConflictException;
import com.pgoutbox.infrastructure.exception.SlotInUseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

public class JdbcReplicationSlotManager implements ReplicationSlotManager {

    private static final Logger log = LoggerFactory.getLogger(JdbcReplicationSlotManager.class);

    private static final String DUPLICATE_OBJECT = "42710";

    private static final RowMapper<SlotRow> SLOT_ROW_MAPPER = (rs, rowNum) -> new SlotRow(
        rs.getString("plugin"),
        rs.getString("slot_type"),
        rs.getBoolean("active"),
        rs.getString("confirmed")
    );

    private final JdbcTemplate jdbc;

    public JdbcReplicationSlotManager(JdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public SlotStatus ensureSlot(ReplicationSlotSpec slot) {
        if (slot.temporary()) {
            // created by the streaming connection, nothing to prepare here
            return new SlotStatus(false, WalPosition.INVALID);
        }
        return translated(() -> {
            Optional<SlotRow> existing = readSlot(slot.slotName());
            if (existing.isPresent()) {
                return validate(slot, existing.get());
            }
            try {
                String lsn = jdbc.queryForObject(
                    "SELECT lsn::text FROM pg_create_logical_replication_slot(?, ?)",
                    String.class,
                    slot.slotName(),
                    slot.plugin()
                );
                WalPosition position = lsn != null ? WalPosition.parse(lsn) : WalPosition.INVALID;
                log.info("Created replication slot {} ({}) at {}", slot.slotName(), slot.plugin(), position);
                return new SlotStatus(true, position);
            } catch (DataAccessException e) {
                if (!DUPLICATE_OBJECT.equals(sqlState(e))) {
                    throw e;
                }
                log.debug("Replication slot {} was created concurrently", slot.slotName());
                return validate(slot, readSlot(slot.slotName()).orElseThrow(() -> e));
            }
        });
    }

    @Override
    public Optional<WalPosition> readConfirmedPosition(String slotName) {
        return translated(() -> readSlot(slotName).map(SlotRow::confirmedPosition));
    }

    @Override
    public void dropSlot(String slotName) {
        translated(() -> {
            jdbc.query(
                "SELECT pg_drop_replication_slot(slot_name) FROM pg_replication_slots WHERE slot_name = ?",
                rs -> {
                    log.info("Dropped replication slot {}", slotName);
                },
                slotName
            );
            return null;
        });
    }

    private Optional<SlotRow> readSlot(String slotName) {
        List<SlotRow> rows = jdbc.query("""
            SELECT plugin, slot_type, active, confirmed_flush_lsn::text AS confirmed
            FROM pg_replication_slots
            WHERE slot_name = ?
            """,
            SLOT_ROW_MAPPER,
            slotName
        );
        return rows.stream().findFirst();
    }

    private static SlotStatus validate(ReplicationSlotSpec slot, SlotRow row) {
        if (!"logical".equals(row.slotType())) {
            throw new SchemaConflictException("Replication slot " + slot.slotName() + " is a " + row.slotType()
                + " slot, expected a logical slot");
        }
        if (!slot.plugin().equals(row.plugin())) {
            throw new SchemaConflictException("Replication slot " + slot.slotName() + " uses plugin " + row.plugin()
                + ", expected " + slot.plugin());
        }
        if (row.active()) {
            throw new SlotInUseException(slot.slotName());
        }
        return new SlotStatus(false, row.confirmedPosition());
    }

    private <T> T translated(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessResourceFailureException | TransientDataAccessException e) {
            throw new ConnectionFailureException("Cannot reach the database: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    private static String sqlState(DataAccessException e) {
        return e.getMostSpecificCause() instanceof SQLException sql ? sql.getSQLState() : null;
    }

    private record SlotRow(String plugin, String slotType, boolean active, String confirmed) {

        WalPosition confirmedPosition() {
            return confirmed != null ? WalPosition.parse(confirmed) : WalPosition.INVALID;
        }
    }
}
