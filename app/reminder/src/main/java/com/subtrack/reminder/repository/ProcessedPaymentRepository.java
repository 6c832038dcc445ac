/*
 * Where: Reminder data access
 * What: Records processed payment ids and checks for duplicates
 * Why: Payment events are delivered at least once; each payment advances a cycle only once
 */
package com.subtrack.reminder.repository;

import static com.subtrack.common.JdbcTimestampUtils.toTimestamp;

import java.time.Instant;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class ProcessedPaymentRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public boolean insertIfAbsent(UUID paymentId, Instant processedAt) {
    final String sql =
        """
        INSERT INTO processed_payments (payment_id, processed_at)
        VALUES (:paymentId, :processedAt)
        ON CONFLICT (payment_id) DO NOTHING
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("paymentId", paymentId)
            .addValue("processedAt", toTimestamp(processedAt));
    return jdbcTemplate.update(sql, params) > 0;
  }

  public int deleteOlderThan(Instant threshold) {
    final String sql =
        """
        DELETE FROM processed_payments
        WHERE processed_at < :threshold
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("threshold", toTimestamp(threshold));
    return jdbcTemplate.update(sql, params);
  }
}
