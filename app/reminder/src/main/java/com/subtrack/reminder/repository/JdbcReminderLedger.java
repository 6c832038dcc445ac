/*
 * Where: Reminder data access
 * What: reminders table upsert/claim/transition operations
 * Why: The partial unique index and SKIP LOCKED claims make scheduling and delivery exactly-once
 */
package com.subtrack.reminder.repository;

import static com.subtrack.common.JdbcTimestampUtils.toInstant;
import static com.subtrack.common.JdbcTimestampUtils.toLocalDate;
import static com.subtrack.common.JdbcTimestampUtils.toSqlDate;
import static com.subtrack.common.JdbcTimestampUtils.toTimestamp;

import com.subtrack.reminder.model.EnsureResult;
import com.subtrack.reminder.model.ReminderChannel;
import com.subtrack.reminder.model.ReminderDraft;
import com.subtrack.reminder.model.ReminderKey;
import com.subtrack.reminder.model.ReminderRecord;
import com.subtrack.reminder.model.ReminderStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcReminderLedger implements ReminderLedger {

  // a canceled row can free the key between our insert and our read; a few retries settle it
  private static final int ENSURE_MAX_ATTEMPTS = 3;

  private static final String COLUMNS =
      """
      reminder_id, subscription_id, user_id, due_date_referenced, lead_days, scheduled_at,
      channel, subject, message, status, locked_by, locked_at, lease_until, attempt_count,
      last_error, cancel_reason, created_at, sent_at, canceled_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public EnsureResult ensureExists(ReminderDraft draft, Instant now) {
    for (int attempt = 1; attempt <= ENSURE_MAX_ATTEMPTS; attempt++) {
      final Optional<ReminderRecord> inserted = insertIfCurrent(draft, now);
      if (inserted.isPresent()) {
        return new EnsureResult(inserted.get(), true);
      }
      final Optional<ReminderRecord> existing = findActiveByKey(draft.key());
      if (existing.isPresent()) {
        return new EnsureResult(existing.get(), false);
      }
      if (!isCurrentDueDate(draft.key())) {
        return EnsureResult.stale();
      }
    }
    throw new IllegalStateException("reminder key kept changing during upsert key=" + draft.key());
  }

  private Optional<ReminderRecord> insertIfCurrent(ReminderDraft draft, Instant now) {
    // FOR SHARE waits for an in-flight advance of the subscription row and then re-checks the
    // date, so a reminder is never inserted behind an advance that already canceled its key
    final String sql =
        """
        INSERT INTO reminders (
          reminder_id, subscription_id, user_id, due_date_referenced, lead_days, scheduled_at,
          channel, subject, message, status, attempt_count, created_at
        )
        SELECT
          CAST(:reminderId AS UUID), s.subscription_id, CAST(:userId AS TEXT),
          s.next_billing_date, CAST(:leadDays AS INTEGER), CAST(:scheduledAt AS TIMESTAMPTZ),
          CAST(:channel AS TEXT), CAST(:subject AS TEXT), CAST(:message AS TEXT),
          'PENDING', 0, CAST(:createdAt AS TIMESTAMPTZ)
        FROM subscriptions s
        WHERE s.subscription_id = :subscriptionId
          AND s.next_billing_date = :dueDate
          AND s.is_active = TRUE
        FOR SHARE
        ON CONFLICT (subscription_id, due_date_referenced, lead_days)
          WHERE status <> 'CANCELED'
          DO NOTHING
        RETURNING
        """
            + COLUMNS;
    final ReminderKey key = draft.key();
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reminderId", UUID.randomUUID())
            .addValue("subscriptionId", key.subscriptionId())
            .addValue("userId", draft.userId())
            .addValue("dueDate", toSqlDate(key.dueDateReferenced()))
            .addValue("leadDays", key.leadDays())
            .addValue("scheduledAt", toTimestamp(draft.scheduledAt()))
            .addValue("channel", draft.channel().name())
            .addValue("subject", draft.subject())
            .addValue("message", draft.message())
            .addValue("createdAt", toTimestamp(now));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private boolean isCurrentDueDate(ReminderKey key) {
    final String sql =
        """
        SELECT EXISTS (
          SELECT 1
          FROM subscriptions
          WHERE subscription_id = :subscriptionId
            AND next_billing_date = :dueDate
            AND is_active = TRUE
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", key.subscriptionId())
            .addValue("dueDate", toSqlDate(key.dueDateReferenced()));
    return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, params, Boolean.class));
  }

  private Optional<ReminderRecord> findActiveByKey(ReminderKey key) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM reminders
            WHERE subscription_id = :subscriptionId
              AND due_date_referenced = :dueDate
              AND lead_days = :leadDays
              AND status <> 'CANCELED'
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", key.subscriptionId())
            .addValue("dueDate", toSqlDate(key.dueDateReferenced()))
            .addValue("leadDays", key.leadDays());
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<ReminderRecord> claimDue(
      Instant now, int limit, Instant leaseUntil, String lockedBy) {
    // PENDING and lease-expired SENDING rows are claimed in one statement; SKIP LOCKED keeps
    // concurrent claimers on disjoint rows
    final String sql =
        """
        WITH cte AS (
          SELECT reminder_id
          FROM reminders
          WHERE (
            status = 'PENDING'
            AND scheduled_at <= :now
          )
          OR (
            status = 'SENDING'
            AND (lease_until IS NULL OR lease_until <= :now)
          )
          ORDER BY scheduled_at, reminder_id
          LIMIT :limit
          FOR UPDATE SKIP LOCKED
        )
        UPDATE reminders r
        SET status = 'SENDING',
            locked_by = :lockedBy,
            locked_at = :now,
            lease_until = :leaseUntil
        FROM cte
        WHERE r.reminder_id = cte.reminder_id
        RETURNING r.reminder_id, r.subscription_id, r.user_id, r.due_date_referenced, r.lead_days,
                  r.scheduled_at, r.channel, r.subject, r.message, r.status, r.locked_by,
                  r.locked_at, r.lease_until, r.attempt_count, r.last_error, r.cancel_reason,
                  r.created_at, r.sent_at, r.canceled_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("now", toTimestamp(now))
            .addValue("leaseUntil", toTimestamp(leaseUntil))
            .addValue("lockedBy", lockedBy)
            .addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public int markSent(UUID reminderId, Instant sentAt, String lockedBy) {
    final String sql =
        """
        UPDATE reminders
        SET status = 'SENT',
            sent_at = :sentAt,
            last_error = NULL,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE reminder_id = :reminderId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("sentAt", toTimestamp(sentAt))
            .addValue("reminderId", reminderId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int releaseClaim(UUID reminderId, String lockedBy, String error) {
    final String sql =
        """
        UPDATE reminders
        SET status = 'PENDING',
            attempt_count = attempt_count + 1,
            last_error = :error,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE reminder_id = :reminderId
          AND status = 'SENDING'
          AND locked_by = :lockedBy
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("error", error)
            .addValue("reminderId", reminderId)
            .addValue("lockedBy", lockedBy);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int markCanceled(UUID reminderId, String reason, Instant canceledAt) {
    final String sql =
        """
        UPDATE reminders
        SET status = 'CANCELED',
            cancel_reason = :reason,
            canceled_at = :canceledAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE reminder_id = :reminderId
          AND status IN ('PENDING', 'SENDING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reason", reason)
            .addValue("canceledAt", toTimestamp(canceledAt))
            .addValue("reminderId", reminderId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int cancelPendingForDueDate(
      UUID subscriptionId, LocalDate dueDateReferenced, String reason, Instant canceledAt) {
    final String sql =
        """
        UPDATE reminders
        SET status = 'CANCELED',
            cancel_reason = :reason,
            canceled_at = :canceledAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE subscription_id = :subscriptionId
          AND due_date_referenced = :dueDate
          AND status IN ('PENDING', 'SENDING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reason", reason)
            .addValue("canceledAt", toTimestamp(canceledAt))
            .addValue("subscriptionId", subscriptionId)
            .addValue("dueDate", toSqlDate(dueDateReferenced));
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public int cancelAllPending(UUID subscriptionId, String reason, Instant canceledAt) {
    final String sql =
        """
        UPDATE reminders
        SET status = 'CANCELED',
            cancel_reason = :reason,
            canceled_at = :canceledAt,
            locked_by = NULL,
            locked_at = NULL,
            lease_until = NULL
        WHERE subscription_id = :subscriptionId
          AND status IN ('PENDING', 'SENDING')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("reason", reason)
            .addValue("canceledAt", toTimestamp(canceledAt))
            .addValue("subscriptionId", subscriptionId);
    return jdbcTemplate.update(sql, params);
  }

  @Override
  public List<ReminderRecord> findBySubscriptionId(UUID subscriptionId) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM reminders
            WHERE subscription_id = :subscriptionId
            ORDER BY due_date_referenced DESC, lead_days DESC, created_at DESC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("subscriptionId", subscriptionId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public int countPendingDue(Instant now) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM reminders
        WHERE status = 'PENDING'
          AND scheduled_at <= :now
        """;
    return count(sql, new MapSqlParameterSource().addValue("now", toTimestamp(now)));
  }

  @Override
  public int countStaleActive(Instant threshold) {
    final String sql =
        """
        SELECT COUNT(*)
        FROM reminders
        WHERE created_at < :threshold
          AND status IN ('PENDING', 'SENDING')
        """;
    return count(sql, new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold)));
  }

  @Override
  public int deleteTerminalOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM reminders
        WHERE created_at < :threshold
          AND status IN ('SENT', 'CANCELED')
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }

  private int count(String sql, MapSqlParameterSource params) {
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private ReminderRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new ReminderRecord(
        UUID.fromString(rs.getString("reminder_id")),
        UUID.fromString(rs.getString("subscription_id")),
        rs.getString("user_id"),
        toLocalDate(rs.getDate("due_date_referenced")),
        rs.getInt("lead_days"),
        toInstant(rs.getTimestamp("scheduled_at")),
        ReminderChannel.valueOf(rs.getString("channel")),
        rs.getString("subject"),
        rs.getString("message"),
        ReminderStatus.valueOf(rs.getString("status")),
        rs.getString("locked_by"),
        toInstant(rs.getTimestamp("locked_at")),
        toInstant(rs.getTimestamp("lease_until")),
        rs.getInt("attempt_count"),
        rs.getString("last_error"),
        rs.getString("cancel_reason"),
        toInstant(rs.getTimestamp("created_at")),
        toInstant(rs.getTimestamp("sent_at")),
        toInstant(rs.getTimestamp("canceled_at")));
  }
}
