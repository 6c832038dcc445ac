/*
 * Where: Reminder NATS JetStream subscription test
 * What: Verifies start() wiring and the ack/nak/term mapping of handler outcomes
 * Why: A wrong mapping either loses payments or redelivers poison messages forever
 */
package com.subtrack.reminder.nats;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.subtrack.common.event.PaymentRecordedPayload;
import com.subtrack.reminder.config.PaymentNatsProperties;
import com.subtrack.reminder.service.PaymentEventHandler;
import com.subtrack.reminder.service.PaymentEventPermanentException;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.MessageHandler;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.NatsJetStreamMetaData;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class PaymentEventSubscriberTest {

  private static final String SUBJECT = "payment.recorded";
  private static final String STREAM = "payment-events";
  private static final String DURABLE = "reminder-payment-recorded";
  private static final String PAYLOAD =
      """
      {"payment_id":"11111111-1111-1111-1111-111111111111",
       "subscription_id":"22222222-2222-2222-2222-222222222222",
       "payment_date":"2026-03-10","amount":186000,"currency":"IDR","status":"paid"}
      """;

  @Mock private Connection connection;
  @Mock private JetStream jetStream;
  @Mock private JetStreamManagement jetStreamManagement;
  @Mock private Dispatcher dispatcher;
  @Mock private JetStreamSubscription subscription;
  @Mock private PaymentEventHandler eventHandler;

  @Captor private ArgumentCaptor<MessageHandler> handlerCaptor;
  @Captor private ArgumentCaptor<PaymentRecordedPayload> payloadCaptor;

  private PaymentEventSubscriber subscriber;

  @BeforeEach
  void setUp() {
    final PaymentNatsProperties properties =
        new PaymentNatsProperties(
            SUBJECT, STREAM, DURABLE, Duration.ofMinutes(2), Duration.ofSeconds(30), 10);
    subscriber = new PaymentEventSubscriber(connection, eventHandler, properties, new ObjectMapper());
  }

  @Test
  void startEnsuresStreamAndAcksHandledMessage() throws Exception {
    when(connection.jetStreamManagement()).thenReturn(jetStreamManagement);
    when(connection.jetStream()).thenReturn(jetStream);
    when(connection.createDispatcher()).thenReturn(dispatcher);
    when(jetStream.subscribe(
            eq(SUBJECT), eq(dispatcher), handlerCaptor.capture(), eq(false),
            any(PushSubscribeOptions.class)))
        .thenReturn(subscription);
    final Message message = message(PAYLOAD);

    subscriber.start();
    handlerCaptor.getValue().onMessage(message);

    verify(jetStreamManagement).updateStream(any(StreamConfiguration.class));
    verify(eventHandler).handlePaymentRecorded(payloadCaptor.capture());
    assertThat(payloadCaptor.getValue().subscriptionId())
        .isEqualTo("22222222-2222-2222-2222-222222222222");
    assertThat(payloadCaptor.getValue().isPaid()).isTrue();
    verify(message).ack();
  }

  @Test
  void malformedPayloadIsTerminated() {
    final Message message = message("{not json");

    subscriber.handleMessage(message);

    verifyNoInteractions(eventHandler);
    verify(message).term();
    verify(message, never()).ack();
  }

  @Test
  void permanentHandlerFailureIsTerminated() {
    final Message message = message(PAYLOAD);
    when(eventHandler.handlePaymentRecorded(any()))
        .thenThrow(new PaymentEventPermanentException("invalid payment event payment_id", null));

    subscriber.handleMessage(message);

    verify(message).term();
    verify(message, never()).nak();
  }

  @Test
  void dataAccessFailureIsRedelivered() {
    final Message message = message(PAYLOAD);
    when(eventHandler.handlePaymentRecorded(any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    subscriber.handleMessage(message);

    verify(message).nak();
    verify(message, never()).ack();
  }

  @Test
  void unknownFailureIsRedelivered() {
    final Message message = message(PAYLOAD);
    when(eventHandler.handlePaymentRecorded(any())).thenThrow(new IllegalStateException("boom"));

    subscriber.handleMessage(message);

    verify(message).nak();
  }

  @Test
  void failureOnFinalDeliveryIsStillNaked() {
    final Message message = message(PAYLOAD);
    final NatsJetStreamMetaData metaData = mock(NatsJetStreamMetaData.class);
    when(message.isJetStream()).thenReturn(true);
    when(message.metaData()).thenReturn(metaData);
    when(metaData.deliveredCount()).thenReturn(10L);
    when(eventHandler.handlePaymentRecorded(any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    subscriber.handleMessage(message);

    verify(metaData).deliveredCount();
    verify(message).nak();
  }

  private Message message(String json) {
    final Message message = mock(Message.class);
    when(message.getData()).thenReturn(json.getBytes(StandardCharsets.UTF_8));
    return message;
  }
}
