/*
 * Where: Reminder data access
 * What: subscriptions table reads and the two conditional writes the engine is allowed to make
 * Why: Conditional updates keyed on the expected due date serialize advancement per subscription
 */
package com.subtrack.reminder.repository;

import static com.subtrack.common.JdbcTimestampUtils.toLocalDate;
import static com.subtrack.common.JdbcTimestampUtils.toSqlDate;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.subtrack.reminder.model.SubscriptionRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
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
public class JdbcSubscriptionStore implements SubscriptionStore {

  private static final Splitter LEAD_DAYS_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();
  private static final Joiner LEAD_DAYS_JOINER = Joiner.on(',');

  private static final String COLUMNS =
      """
      subscription_id, user_id, name, amount, currency, billing_cycle, billing_day,
      custom_interval_days, next_billing_date, start_date, end_date, auto_renew,
      reminder_lead_days, is_active
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(SubscriptionRecord record) {
    final String sql =
        """
        INSERT INTO subscriptions (
          subscription_id, user_id, name, amount, currency, billing_cycle, billing_day,
          custom_interval_days, next_billing_date, start_date, end_date, auto_renew,
          reminder_lead_days, is_active
        ) VALUES (
          :subscriptionId, :userId, :name, :amount, :currency, :billingCycle, :billingDay,
          :customIntervalDays, :nextBillingDate, :startDate, :endDate, :autoRenew,
          :reminderLeadDays, :active
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("subscriptionId", record.subscriptionId())
            .addValue("userId", record.userId())
            .addValue("name", record.name())
            .addValue("amount", record.amount())
            .addValue("currency", record.currency())
            .addValue("billingCycle", record.billingCycle())
            .addValue("billingDay", record.billingDay())
            .addValue("customIntervalDays", record.customIntervalDays())
            .addValue("nextBillingDate", toSqlDate(record.nextBillingDate()))
            .addValue("startDate", toSqlDate(record.startDate()))
            .addValue("endDate", toSqlDate(record.endDate()))
            .addValue("autoRenew", record.autoRenew())
            .addValue("reminderLeadDays", LEAD_DAYS_JOINER.join(record.reminderLeadDays()))
            .addValue("active", record.active());
    jdbcTemplate.update(sql, params);
  }

  @Override
  public Optional<SubscriptionRecord> findById(UUID subscriptionId) {
    final String sql = "SELECT " + COLUMNS + " FROM subscriptions WHERE subscription_id = :id";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", subscriptionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<SubscriptionRecord> listDueWithin(LocalDate from, LocalDate to) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE is_active = TRUE
              AND next_billing_date BETWEEN :from AND :to
            ORDER BY next_billing_date, subscription_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("from", toSqlDate(from))
            .addValue("to", toSqlDate(to));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<SubscriptionRecord> listLapsedAutoRenew(LocalDate today) {
    final String sql =
        "SELECT "
            + COLUMNS
            + """
            FROM subscriptions
            WHERE is_active = TRUE
              AND auto_renew = TRUE
              AND next_billing_date < :today
            ORDER BY next_billing_date, subscription_id
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("today", toSqlDate(today));
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public boolean updateNextBillingDate(
      UUID subscriptionId, LocalDate expectedOldDate, LocalDate newDate) {
    final String sql =
        """
        UPDATE subscriptions
        SET next_billing_date = :newDate,
            updated_at = now()
        WHERE subscription_id = :id
          AND next_billing_date = :expectedOldDate
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("id", subscriptionId)
            .addValue("expectedOldDate", toSqlDate(expectedOldDate))
            .addValue("newDate", toSqlDate(newDate));
    return jdbcTemplate.update(sql, params) > 0;
  }

  @Override
  public boolean deactivate(UUID subscriptionId) {
    final String sql =
        """
        UPDATE subscriptions
        SET is_active = FALSE,
            updated_at = now()
        WHERE subscription_id = :id
          AND is_active = TRUE
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", subscriptionId);
    return jdbcTemplate.update(sql, params) > 0;
  }

  private SubscriptionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new SubscriptionRecord(
        UUID.fromString(rs.getString("subscription_id")),
        rs.getString("user_id"),
        rs.getString("name"),
        rs.getBigDecimal("amount"),
        rs.getString("currency"),
        rs.getString("billing_cycle"),
        rs.getObject("billing_day", Integer.class),
        rs.getObject("custom_interval_days", Integer.class),
        toLocalDate(rs.getDate("next_billing_date")),
        toLocalDate(rs.getDate("start_date")),
        toLocalDate(rs.getDate("end_date")),
        rs.getBoolean("auto_renew"),
        parseLeadDays(rs.getString("reminder_lead_days")),
        rs.getBoolean("is_active"));
  }

  private List<Integer> parseLeadDays(String raw) {
    if (raw == null) {
      return List.of();
    }
    // the column check constraint guarantees a comma separated integer list
    return LEAD_DAYS_SPLITTER.splitToStream(raw).map(Integer::valueOf).toList();
  }
}
