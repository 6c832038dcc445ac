/*
 * Where: Reminder NATS subscription
 * What: Consumes payment.recorded events from JetStream and hands them to the handler
 * Why: A recorded payment advances the billing cycle and retires reminders of the paid due date
 */
package com.subtrack.reminder.nats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.subtrack.common.event.PaymentRecordedPayload;
import com.subtrack.reminder.config.PaymentNatsProperties;
import com.subtrack.reminder.service.PaymentEventHandler;
import com.subtrack.reminder.service.PaymentEventPermanentException;
import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PushSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "nats.enabled", havingValue = "true", matchIfMissing = true)
public class PaymentEventSubscriber {

  private static final Logger logger = LoggerFactory.getLogger(PaymentEventSubscriber.class);
  private static final int STREAM_NOT_FOUND_ERROR = 404;
  private static final int STREAM_NOT_FOUND_API_ERROR = 10059;

  private final Connection connection;
  private final PaymentEventHandler eventHandler;
  private final PaymentNatsProperties properties;
  private final ObjectMapper objectMapper;
  private final AtomicBoolean started;
  private Dispatcher dispatcher;
  private JetStreamSubscription subscription;

  public PaymentEventSubscriber(
      Connection connection,
      PaymentEventHandler eventHandler,
      PaymentNatsProperties properties,
      ObjectMapper objectMapper) {
    this.connection = connection;
    this.eventHandler = eventHandler;
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.started = new AtomicBoolean(false);
  }

  @PostConstruct
  public void start() {
    if (!started.compareAndSet(false, true)) {
      return;
    }
    try {
      ensureStream();
      final JetStream jetStream = connection.jetStream();
      dispatcher = connection.createDispatcher();
      subscription =
          jetStream.subscribe(
              properties.subject(),
              dispatcher,
              this::handleMessage,
              false,
              buildPushSubscribeOptions());
      logger.info(
          "payment subscriber started subject={} stream={} durable={}",
          properties.subject(),
          properties.stream(),
          properties.durable());
    } catch (IOException | JetStreamApiException ex) {
      started.set(false);
      throw new IllegalStateException("failed to start JetStream subscription", ex);
    }
  }

  @PreDestroy
  public void stop() {
    if (subscription != null) {
      subscription.unsubscribe();
      subscription = null;
    }
    if (dispatcher != null) {
      connection.closeDispatcher(dispatcher);
      dispatcher = null;
    }
  }

  /** How a consumed message is settled with JetStream. */
  enum Disposition {
    ACK,
    NAK,
    TERM
  }

  @VisibleForTesting
  void handleMessage(Message message) {
    final Disposition disposition = dispose(message);
    if (disposition == Disposition.NAK && isFinalDelivery(message)) {
      logger.error(
          "payment event failed on its final delivery subject={} maxDeliver={}",
          message.getSubject(),
          properties.maxDeliver());
    }
    try {
      switch (disposition) {
        case ACK -> message.ack();
        case NAK -> message.nak();
        case TERM -> message.term();
      }
    } catch (IllegalStateException ex) {
      logger.warn("failed to settle payment event disposition={}", disposition, ex);
    }
  }

  private Disposition dispose(Message message) {
    final PaymentRecordedPayload payload;
    try {
      payload = objectMapper.readValue(message.getData(), PaymentRecordedPayload.class);
    } catch (IOException ex) {
      // a malformed payload stays malformed on redelivery
      logger.warn("failed to parse payment event payload subject={}", message.getSubject(), ex);
      return Disposition.TERM;
    }
    try {
      eventHandler.handlePaymentRecorded(payload);
      return Disposition.ACK;
    } catch (PaymentEventPermanentException ex) {
      logger.warn(
          "payment event rejected permanently paymentId={} subscriptionId={}",
          payload.paymentId(),
          payload.subscriptionId(),
          ex);
      return Disposition.TERM;
    } catch (DataAccessException ex) {
      logger.warn(
          "payment event hit a storage failure, will be redelivered paymentId={}",
          payload.paymentId(),
          ex);
      return Disposition.NAK;
    } catch (RuntimeException ex) {
      logger.warn(
          "payment event handling failed, will be redelivered paymentId={}",
          payload.paymentId(),
          ex);
      return Disposition.NAK;
    }
  }

  private boolean isFinalDelivery(Message message) {
    if (!message.isJetStream()) {
      return false;
    }
    return message.metaData().deliveredCount() >= properties.maxDeliver();
  }

  private void ensureStream() throws IOException, JetStreamApiException {
    // the stream carries the duplicate window used for Nats-Msg-Id dedupe
    final StreamConfiguration streamConfiguration =
        StreamConfiguration.builder()
            .name(properties.stream())
            .subjects(properties.subject())
            .duplicateWindow(properties.duplicateWindow())
            .build();
    final JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
    try {
      jetStreamManagement.updateStream(streamConfiguration);
    } catch (JetStreamApiException ex) {
      if (!isStreamNotFound(ex)) {
        throw ex;
      }
      jetStreamManagement.addStream(streamConfiguration);
    }
    logger.info(
        "payment stream ensured stream={} subject={} duplicateWindow={}",
        properties.stream(),
        properties.subject(),
        properties.duplicateWindow());
  }

  private boolean isStreamNotFound(JetStreamApiException ex) {
    return ex.getApiErrorCode() == STREAM_NOT_FOUND_API_ERROR
        || ex.getErrorCode() == STREAM_NOT_FOUND_ERROR;
  }

  private PushSubscribeOptions buildPushSubscribeOptions() {
    final ConsumerConfiguration consumerConfiguration =
        ConsumerConfiguration.builder()
            .ackPolicy(AckPolicy.Explicit)
            .ackWait(properties.ackWait())
            .maxDeliver(properties.maxDeliver())
            .build();
    return PushSubscribeOptions.builder()
        .stream(properties.stream())
        .durable(properties.durable())
        .configuration(consumerConfiguration)
        .build();
  }
}
