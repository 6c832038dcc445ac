package com.subtrack.reminder.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.subtrack.reminder.AbstractPostgresContainerTest;
import com.subtrack.reminder.model.SubscriptionRecord;
import com.subtrack.reminder.support.Subscriptions;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class JdbcSubscriptionStoreTest extends AbstractPostgresContainerTest {

  private static final LocalDate TODAY = LocalDate.of(2026, 3, 10);

  @Autowired private SubscriptionStore store;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM reminders", new MapSqlParameterSource());
    jdbcTemplate.update("DELETE FROM subscriptions", new MapSqlParameterSource());
  }

  @Test
  void insertAndFindRoundTripsAllColumns() {
    final SubscriptionRecord subscription =
        Subscriptions.withEndDate(
            Subscriptions.monthly(TODAY.plusDays(3), 7, 3, 1), TODAY.plusYears(1));
    store.insert(subscription);

    final SubscriptionRecord found = store.findById(subscription.subscriptionId()).orElseThrow();

    assertThat(found.userId()).isEqualTo("user-1");
    assertThat(found.amount()).isEqualByComparingTo(new BigDecimal("186000"));
    assertThat(found.billingCycle()).isEqualTo("monthly");
    assertThat(found.billingDay()).isEqualTo(13);
    assertThat(found.customIntervalDays()).isNull();
    assertThat(found.nextBillingDate()).isEqualTo(TODAY.plusDays(3));
    assertThat(found.endDate()).isEqualTo(TODAY.plusYears(1));
    assertThat(found.reminderLeadDays()).containsExactly(7, 3, 1);
    assertThat(found.active()).isTrue();
    assertThat(store.findById(UUID.randomUUID())).isEmpty();
  }

  @Test
  void listDueWithinReturnsActiveSubscriptionsInWindow() {
    final SubscriptionRecord inWindow = Subscriptions.monthly(TODAY.plusDays(3), 3);
    final SubscriptionRecord atUpperBound = Subscriptions.monthly(TODAY.plusDays(30), 3);
    final SubscriptionRecord beyond = Subscriptions.monthly(TODAY.plusDays(31), 3);
    final SubscriptionRecord inactive = Subscriptions.monthly(TODAY.plusDays(5), 3).deactivated();
    store.insert(inWindow);
    store.insert(atUpperBound);
    store.insert(beyond);
    store.insert(inactive);

    assertThat(store.listDueWithin(TODAY, TODAY.plusDays(30)))
        .extracting(SubscriptionRecord::subscriptionId)
        .containsExactly(inWindow.subscriptionId(), atUpperBound.subscriptionId());
  }

  @Test
  void listLapsedAutoRenewSkipsManualRenewals() {
    final SubscriptionRecord lapsed = Subscriptions.monthly(TODAY.minusDays(2), 3);
    final SubscriptionRecord manual =
        Subscriptions.withAutoRenew(Subscriptions.monthly(TODAY.minusDays(2), 3), false);
    final SubscriptionRecord dueToday = Subscriptions.monthly(TODAY, 3);
    store.insert(lapsed);
    store.insert(manual);
    store.insert(dueToday);

    assertThat(store.listLapsedAutoRenew(TODAY))
        .extracting(SubscriptionRecord::subscriptionId)
        .containsExactly(lapsed.subscriptionId());
  }

  @Test
  void updateNextBillingDateRequiresExpectedOldDate() {
    final SubscriptionRecord subscription = Subscriptions.monthly(TODAY.plusDays(3), 3);
    store.insert(subscription);

    assertThat(
            store.updateNextBillingDate(
                subscription.subscriptionId(), TODAY.plusDays(2), TODAY.plusMonths(1)))
        .isFalse();
    assertThat(
            store.updateNextBillingDate(
                subscription.subscriptionId(), TODAY.plusDays(3), TODAY.plusDays(3).plusMonths(1)))
        .isTrue();
    assertThat(store.findById(subscription.subscriptionId()).orElseThrow().nextBillingDate())
        .isEqualTo(TODAY.plusDays(3).plusMonths(1));
  }

  @Test
  void deactivateIsOneShotAndBlocksFurtherAdvancement() {
    final SubscriptionRecord subscription = Subscriptions.monthly(TODAY.plusDays(3), 3);
    store.insert(subscription);

    assertThat(store.deactivate(subscription.subscriptionId())).isTrue();
    assertThat(store.deactivate(subscription.subscriptionId())).isFalse();
    assertThat(
            store.updateNextBillingDate(
                subscription.subscriptionId(), TODAY.plusDays(3), TODAY.plusMonths(1)))
        .isFalse();
    assertThat(store.findById(subscription.subscriptionId()).orElseThrow().active()).isFalse();
  }
}
