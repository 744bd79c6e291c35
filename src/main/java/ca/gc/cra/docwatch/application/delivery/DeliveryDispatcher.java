package ca.gc.cra.docwatch.application.delivery;

import ca.gc.cra.docwatch.application.port.DeliveryException;
import ca.gc.cra.docwatch.application.port.MailTransport;
import ca.gc.cra.docwatch.application.port.MetricsPort;
import ca.gc.cra.docwatch.application.port.RelayConnection;
import ca.gc.cra.docwatch.domain.delivery.DeliveryAttempt;
import ca.gc.cra.docwatch.domain.delivery.DeliveryResult;
import ca.gc.cra.docwatch.domain.delivery.FailureClassification;
import ca.gc.cra.docwatch.domain.delivery.OutgoingMessage;
import ca.gc.cra.docwatch.domain.delivery.RelayConfig;
import ca.gc.cra.docwatch.logging.Logs;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Delivers one message through an ordered relay list with classified failover.
 * <p><strong>Why:</strong> Consumer mail providers reject logins, throttle, or drop connections routinely; the
 * reminder must still go out through the next configured relay, and operators need to know why each relay
 * failed.</p>
 * <p><strong>Role:</strong> Application service consuming the {@link MailTransport} port.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Try relays strictly in order (primary, then backups), one at a time, with no retry or backoff.</li>
 *   <li>Per relay: connect, authenticate, bind the sender to the relay account, send to all recipients.</li>
 *   <li>Classify failures, attach a remediation hint, and always close the connection.</li>
 *   <li>Stop at the first success; report every hint when all relays fail.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one dispatch at a time.</p>
 * <p><strong>Observability:</strong> Logs one structured line per attempt and emits {@code delivery.*} metrics.</p>
 *
 * @since 0.1.0
 */
public final class DeliveryDispatcher {
  private static final int MAX_DETAIL_BYTES = 512;

  private final List<RelayConfig> relays;
  private final MailTransport transport;
  private final MetricsPort metrics;
  private final Logger log;

  /**
   * Creates a dispatcher logging through its class logger.
   *
   * @param relays relays in preference order; must not be empty
   * @param transport mail transport port
   * @param metrics metrics sink
   */
  public DeliveryDispatcher(List<RelayConfig> relays, MailTransport transport, MetricsPort metrics) {
    this(relays, transport, metrics, LoggerFactory.getLogger(DeliveryDispatcher.class));
  }

  /**
   * Creates a dispatcher.
   *
   * @param relays relays in preference order; must not be empty
   * @param transport mail transport port
   * @param metrics metrics sink
   * @param log run-scoped logger
   */
  public DeliveryDispatcher(
      List<RelayConfig> relays, MailTransport transport, MetricsPort metrics, Logger log) {
    this.relays = List.copyOf(Objects.requireNonNull(relays, "relays"));
    if (this.relays.isEmpty()) {
      throw new IllegalArgumentException("at least one relay is required");
    }
    this.transport = Objects.requireNonNull(transport, "transport");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.log = Objects.requireNonNull(log, "log");
  }

  /**
   * Delivers {@code message}.
   *
   * @param message unbound message; the sender is set per relay
   * @return delivery flag and the attempt log (one entry per relay tried)
   */
  public DeliveryResult dispatch(OutgoingMessage message) {
    Objects.requireNonNull(message, "message");
    List<DeliveryAttempt> attempts = new ArrayList<>(relays.size());
    log.info("Dispatching '{}' to {} recipient(s) via {} relay(s)",
        message.subject(), message.recipients().size(), relays.size());
    for (RelayConfig relay : relays) {
      DeliveryAttempt attempt = attempt(relay, message);
      attempts.add(attempt);
      if (attempt.succeeded()) {
        metrics.increment("delivery.delivered");
        log.info("Message delivered via relay {} after {} attempt(s)", relay.name(), attempts.size());
        return new DeliveryResult(true, attempts);
      }
    }
    metrics.increment("delivery.exhausted");
    DeliveryFailureReport report = new DeliveryFailureReport(attempts);
    log.error("Message not delivered. {}", report.render());
    return new DeliveryResult(false, attempts);
  }

  public List<RelayConfig> relays() {
    return relays;
  }

  private DeliveryAttempt attempt(RelayConfig relay, OutgoingMessage message) {
    metrics.increment("delivery.attempts");
    long start = System.nanoTime();
    DispatchState state = DispatchState.CONNECT;
    RelayConnection connection = null;
    try {
      log.debug("Connecting to relay {} ({}:{}, {})", relay.name(), relay.host(), relay.port(), relay.tlsMode());
      connection = transport.connect(relay);
      state = DispatchState.AUTHENTICATE;
      connection.authenticate();
      state = DispatchState.SEND;
      OutgoingMessage bound = message.fromSender(relay.username());
      if (!relay.senderName().isBlank()) {
        log.info("Relay {} sends as bare address {}; configured sender_name '{}' is not applied",
            relay.name(), Logs.maskAddress(relay.username()), relay.senderName());
      }
      connection.send(bound, message.recipients());
      long elapsed = elapsedMillis(start);
      recordSuccess(relay, elapsed);
      return DeliveryAttempt.success(relay, elapsed);
    } catch (DeliveryException ex) {
      return recordFailure(relay, reportedState(state, ex.classification()), ex.classification(),
          describe(ex), ex, start);
    } catch (RuntimeException ex) {
      return recordFailure(relay, state, FailureClassification.UNKNOWN, describe(ex), ex, start);
    } finally {
      close(relay, connection);
    }
  }

  private void recordSuccess(RelayConfig relay, long elapsed) {
    metrics.increment("delivery.attempt.success");
    metrics.observe("delivery.attempt.latencyMillis", elapsed);
    log.info("delivery.attempt relay={} ordinal={} outcome=SUCCESS elapsedMs={}",
        relay.name(), relay.ordinal(), elapsed);
  }

  private DeliveryAttempt recordFailure(
      RelayConfig relay,
      DispatchState state,
      FailureClassification classification,
      String detail,
      Exception cause,
      long start) {
    long elapsed = elapsedMillis(start);
    String hint = RemediationHints.lookup(relay.host(), classification);
    metrics.increment("delivery.attempt.failure." + classification.name().toLowerCase(Locale.ROOT));
    metrics.observe("delivery.attempt.latencyMillis", elapsed);
    log.warn("delivery.attempt relay={} ordinal={} outcome=FAILURE class={} state={} elapsedMs={} detail={}",
        relay.name(), relay.ordinal(), classification, state, elapsed, detail);
    log.debug("Relay {} failure cause", relay.name(), cause);
    return DeliveryAttempt.failure(relay, classification, hint, detail, elapsed);
  }

  private void close(RelayConfig relay, RelayConnection connection) {
    if (connection == null) {
      return;
    }
    try {
      connection.close();
    } catch (RuntimeException ex) {
      log.warn("Failed to close connection to relay {}", relay.name(), ex);
    }
  }

  private static String describe(Exception ex) {
    String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getSimpleName();
    }
    return Logs.detail(message, MAX_DETAIL_BYTES);
  }

  // Jakarta Mail opens the socket inside Transport.connect, which runs during authenticate().
  private static DispatchState reportedState(DispatchState state, FailureClassification classification) {
    if (state == DispatchState.AUTHENTICATE && classification == FailureClassification.CONNECT_FAILURE) {
      return DispatchState.CONNECT;
    }
    return state;
  }

  private static long elapsedMillis(long startNanos) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
  }

  /** Per-attempt state, reported with each failure. */
  enum DispatchState {
    CONNECT,
    AUTHENTICATE,
    SEND
  }
}
