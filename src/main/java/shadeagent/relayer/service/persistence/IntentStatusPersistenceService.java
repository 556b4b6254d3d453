package shadeagent.relayer.service.persistence;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import javax.sql.DataSource;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import shadeagent.relayer.dto.intent.IntentState;
import shadeagent.relayer.dto.intent.IntentStatus;
import shadeagent.relayer.dto.intent.ValidatedIntent;
import shadeagent.relayer.util.LogSanitizer;
import lombok.extern.slf4j.Slf4j;

/**
 * Write-through copy of intent statuses and dead letters. Every method is a no-op
 * without a datasource, and database errors never propagate into the pipeline.
 */
@Service
@Slf4j
public class IntentStatusPersistenceService {

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public IntentStatusPersistenceService(ObjectProvider<DataSource> dataSource, ObjectMapper objectMapper) {
        DataSource available = dataSource.getIfAvailable();
        this.jdbcTemplate = available != null ? new JdbcTemplate(available) : null;
        this.objectMapper = objectMapper;
    }

    public void upsert(IntentStatus status) {
        if (jdbcTemplate == null) {
            log.debug("Skipping status persistence (no datasource)");
            return;
        }
        try {
            jdbcTemplate.update(
                """
                INSERT INTO intent_status (
                    intent_id, state, attempt, tx_id, bridge_tx_id, deposit_address,
                    deposit_memo, expected_amount, error, detail, intent_json,
                    awaiting_since, updated_at
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON DUPLICATE KEY UPDATE
                    state = VALUES(state),
                    attempt = VALUES(attempt),
                    tx_id = VALUES(tx_id),
                    bridge_tx_id = VALUES(bridge_tx_id),
                    deposit_address = VALUES(deposit_address),
                    deposit_memo = VALUES(deposit_memo),
                    expected_amount = VALUES(expected_amount),
                    error = VALUES(error),
                    detail = VALUES(detail),
                    intent_json = VALUES(intent_json),
                    awaiting_since = VALUES(awaiting_since),
                    updated_at = VALUES(updated_at)
                """,
                status.getIntentId(),
                status.getState().getWireValue(),
                status.getAttempt(),
                status.getTxId(),
                status.getBridgeTxId(),
                status.getDepositAddress(),
                status.getDepositMemo(),
                status.getExpectedAmount(),
                status.getError(),
                status.getDetail(),
                toJson(status.getIntentData()),
                status.getAwaitingSince() != null ? Timestamp.from(status.getAwaitingSince()) : null,
                Timestamp.from(status.getUpdatedAt() != null ? status.getUpdatedAt() : Instant.now())
            );
        } catch (Exception e) {
            log.warn("Status persistence skipped for {}: {}", LogSanitizer.sanitize(status.getIntentId()), LogSanitizer.sanitize(e.getMessage()));
        }
    }

    public Optional<IntentStatus> findByIntentId(String intentId) {
        if (jdbcTemplate == null) {
            return Optional.empty();
        }
        try {
            return jdbcTemplate.query(
                "SELECT * FROM intent_status WHERE intent_id = ? LIMIT 1",
                this::mapRow,
                intentId
            ).stream().findFirst();
        } catch (Exception e) {
            log.warn("Status lookup skipped for {}: {}", LogSanitizer.sanitize(intentId), LogSanitizer.sanitize(e.getMessage()));
            return Optional.empty();
        }
    }

    /**
     * Statuses that still need the pipeline: pending, processing and awaiting.
     */
    public List<IntentStatus> findNonTerminal() {
        if (jdbcTemplate == null) {
            return List.of();
        }
        try {
            return jdbcTemplate.query(
                "SELECT * FROM intent_status WHERE state NOT IN ('succeeded', 'failed')",
                this::mapRow
            );
        } catch (Exception e) {
            log.warn("Non-terminal status lookup skipped: {}", LogSanitizer.sanitize(e.getMessage()));
            return List.of();
        }
    }

    public int deleteOlderThan(Instant cutoff) {
        if (jdbcTemplate == null) {
            return 0;
        }
        try {
            return jdbcTemplate.update("DELETE FROM intent_status WHERE updated_at < ?", Timestamp.from(cutoff));
        } catch (Exception e) {
            log.warn("Status cleanup skipped: {}", LogSanitizer.sanitize(e.getMessage()));
            return 0;
        }
    }

    public void recordDeadLetter(String rawItem) {
        if (jdbcTemplate == null) {
            return;
        }
        try {
            jdbcTemplate.update(
                "INSERT INTO intent_dead_letter (raw_item, created_at) VALUES (?, ?)",
                rawItem,
                Timestamp.from(Instant.now())
            );
        } catch (Exception e) {
            log.warn("Dead letter persistence skipped: {}", LogSanitizer.sanitize(e.getMessage()));
        }
    }

    private IntentStatus mapRow(ResultSet rs, int rowNum) throws SQLException {
        Timestamp awaitingSince = rs.getTimestamp("awaiting_since");
        Timestamp updatedAt = rs.getTimestamp("updated_at");
        return IntentStatus.builder()
            .intentId(rs.getString("intent_id"))
            .state(IntentState.fromWireValue(rs.getString("state")))
            .attempt(rs.getObject("attempt", Integer.class))
            .txId(rs.getString("tx_id"))
            .bridgeTxId(rs.getString("bridge_tx_id"))
            .depositAddress(rs.getString("deposit_address"))
            .depositMemo(rs.getString("deposit_memo"))
            .expectedAmount(rs.getString("expected_amount"))
            .error(rs.getString("error"))
            .detail(rs.getString("detail"))
            .intentData(fromJson(rs.getString("intent_json")))
            .awaitingSince(awaitingSince != null ? awaitingSince.toInstant() : null)
            .updatedAt(updatedAt != null ? updatedAt.toInstant() : null)
            .build();
    }

    private String toJson(ValidatedIntent intent) {
        if (intent == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(intent);
        } catch (Exception e) {
            log.warn("Unable to serialize intent {}: {}", LogSanitizer.sanitize(intent.getIntentId()), LogSanitizer.sanitize(e.getMessage()));
            return null;
        }
    }

    private ValidatedIntent fromJson(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ValidatedIntent.class);
        } catch (Exception e) {
            log.warn("Stored intent payload unreadable: {}", LogSanitizer.sanitize(e.getMessage()));
            return null;
        }
    }
}
