/*
 * どこで: 配信ランの結合テスト(台帳は実装、永続層はメモリ上)
 * 何を: 時間帯境界をまたいで 2 回実行しても同一受信者へ同日 2 通目を送らないことを検証する
 * なぜ: 毎時トリガーのずれや再実行で重複送信しないことを、モックでない台帳経路で担保するため
 */
package com.example.dispatch.service;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.dispatch.activity.WorkerActivityRecorder;
import com.example.dispatch.config.DispatchProperties;
import com.example.dispatch.config.LedgerProperties;
import com.example.dispatch.config.RetryProperties;
import com.example.dispatch.content.DigestContent;
import com.example.dispatch.ledger.DeliveryAttemptRecord;
import com.example.dispatch.ledger.DeliveryAttemptRepository;
import com.example.dispatch.ledger.DeliveryAttemptStatus;
import com.example.dispatch.ledger.DeliveryLedger;
import com.example.dispatch.ledger.DeliveryMarkerCache;
import com.example.dispatch.recipient.EligibleRecipients;
import com.example.dispatch.recipient.Recipient;
import com.example.dispatch.recipient.RecipientDirectory;
import com.example.dispatch.retry.RetryPolicy;
import com.example.dispatch.retry.TransientFailureClassifier;
import com.example.dispatch.schedule.TimeWindowResolver;
import com.example.dispatch.transport.DeliveryReceipt;
import com.example.dispatch.transport.NotificationTransport;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class RepeatedDispatchTest {

  // Africa/Johannesburg では 08:59 と 09:01。どちらの実行でも 08:00 スロットが対象になる
  private static final Instant BEFORE_HOUR = Instant.parse("2026-01-17T06:59:00Z");
  private static final Instant AFTER_HOUR = Instant.parse("2026-01-17T07:01:00Z");
  private static final LocalDate DAY = LocalDate.of(2026, 1, 17);
  private static final String TYPE = "daily_digest";

  private static final List<Recipient> RECIPIENTS =
      List.of(
          recipient("r-1", "08:00"),
          recipient("r-2", "08:00"),
          recipient("r-3", "08:00"),
          recipient("r-4", "09:00"));

  @Mock private WorkerActivityRecorder activityRecorder;

  private final SteppingClock clock = new SteppingClock(BEFORE_HOUR);
  private final InMemoryMarkerCache markerCache = new InMemoryMarkerCache();
  private final InMemoryAttemptRepository attemptRepository = new InMemoryAttemptRepository();
  private final CountingTransport transport = new CountingTransport();
  private ExecutorService executor;
  private BatchDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    executor = Executors.newFixedThreadPool(3);
    final DispatchProperties properties =
        new DispatchProperties(
            false,
            null,
            null,
            TYPE,
            "Africa/Johannesburg",
            "+02:00",
            2,
            3,
            Duration.ofSeconds(2),
            10,
            1000);
    final DispatchMetrics metrics = new DispatchMetrics(new SimpleMeterRegistry());
    final DeliveryLedger ledger =
        new DeliveryLedger(
            markerCache, attemptRepository, new LedgerProperties(null, null), metrics, clock);
    final RecipientDeliveryService deliveryService =
        new RecipientDeliveryService(
            ledger,
            (recipient, day) -> new DigestContent("subject", "text", "<p>html</p>"),
            transport,
            new RetryPolicy(delay -> {}),
            new TransientFailureClassifier(),
            new RetryProperties(1, Duration.ofMillis(1), Duration.ofMillis(1), false),
            properties,
            metrics);
    dispatcher =
        new BatchDispatcher(
            new SlotDirectory(),
            deliveryService,
            new TimeWindowResolver(properties),
            ledger,
            activityRecorder,
            metrics,
            properties,
            executor,
            delay -> {},
            clock);
  }

  @AfterEach
  void tearDown() throws InterruptedException {
    executor.shutdownNow();
    executor.awaitTermination(5, TimeUnit.SECONDS);
  }

  @Test
  void secondRunAcrossHourBoundarySkipsAlreadySentRecipients() {
    final DispatchReport first = dispatcher.dispatchScheduled();
    clock.set(AFTER_HOUR);
    final DispatchReport second = dispatcher.dispatchScheduled();

    assertThat(first.timeSlots()).containsExactly("08:00", "07:00");
    assertThat(first.sent()).isEqualTo(3);
    assertThat(second.timeSlots()).containsExactly("09:00", "08:00");
    assertThat(second.sent()).isEqualTo(1);
    assertThat(second.skipped()).isEqualTo(3);
    assertThat(second.errors()).isZero();
    assertThat(second.results())
        .filteredOn(result -> result.outcome() == DeliveryOutcome.SKIPPED)
        .extracting(RecipientDeliveryResult::reason)
        .containsOnly(SkipReason.ALREADY_SENT_CACHED.value());
    assertThat(transport.sendsTo())
        .containsOnly(
            Map.entry("r-1@example.com", 1),
            Map.entry("r-2@example.com", 1),
            Map.entry("r-3@example.com", 1),
            Map.entry("r-4@example.com", 1));
    assertThat(attemptRepository.sentCount("r-1")).isEqualTo(1);
  }

  @Test
  void expiredMarkersFallBackToLedgerAndStillSendOnce() {
    dispatcher.dispatchScheduled();
    markerCache.clear();
    clock.set(AFTER_HOUR);
    final DispatchReport second = dispatcher.dispatchScheduled();
    final DispatchReport third = dispatcher.dispatchScheduled();

    assertThat(second.skipped()).isEqualTo(3);
    assertThat(second.results())
        .filteredOn(result -> result.outcome() == DeliveryOutcome.SKIPPED)
        .extracting(RecipientDeliveryResult::reason)
        .containsOnly(SkipReason.ALREADY_SENT_LEDGER.value());
    assertThat(third.sent()).isZero();
    assertThat(third.skipped()).isEqualTo(4);
    assertThat(transport.totalSends()).isEqualTo(4);
    for (Recipient recipient : RECIPIENTS) {
      assertThat(attemptRepository.sentCount(recipient.recipientId())).isEqualTo(1);
    }
  }

  private static Recipient recipient(String id, String slot) {
    return new Recipient(id, slot, List.of(), id + "@example.com", null, null);
  }

  private static final class SlotDirectory implements RecipientDirectory {

    @Override
    public EligibleRecipients fetchEligible(List<String> slots) {
      final List<Recipient> due = new ArrayList<>();
      for (Recipient recipient : RECIPIENTS) {
        if (slots.contains(recipient.scheduledSlot())) {
          due.add(recipient);
        }
      }
      return new EligibleRecipients(due, List.of());
    }

    @Override
    public Optional<Recipient> findEnabled(String recipientId) {
      return RECIPIENTS.stream().filter(r -> r.recipientId().equals(recipientId)).findFirst();
    }

    @Override
    public void ping() {}
  }

  private static final class InMemoryMarkerCache implements DeliveryMarkerCache {

    private final Set<String> markers = ConcurrentHashMap.newKeySet();

    @Override
    public boolean isMarked(String recipientId, String notificationType, LocalDate deliveryDay) {
      return markers.contains(key(recipientId, notificationType, deliveryDay));
    }

    @Override
    public void mark(
        String recipientId, String notificationType, LocalDate deliveryDay, Duration ttl) {
      markers.add(key(recipientId, notificationType, deliveryDay));
    }

    void clear() {
      markers.clear();
    }

    private static String key(String recipientId, String notificationType, LocalDate day) {
      return recipientId + ":" + notificationType + ":" + day;
    }
  }

  /** 部分一意インデックスと同じく、同日の SENT は 1 件だけ受け付ける。 */
  private static final class InMemoryAttemptRepository extends DeliveryAttemptRepository {

    private final List<DeliveryAttemptRecord> records =
        Collections.synchronizedList(new ArrayList<>());

    InMemoryAttemptRepository() {
      super(null);
    }

    @Override
    public boolean insert(DeliveryAttemptRecord record) {
      synchronized (records) {
        if (record.status() == DeliveryAttemptStatus.SENT
            && existsSent(record.recipientId(), record.notificationType(), record.deliveryDay())) {
          return false;
        }
        records.add(record);
        return true;
      }
    }

    @Override
    public boolean existsSent(String recipientId, String notificationType, LocalDate deliveryDay) {
      synchronized (records) {
        return records.stream()
            .anyMatch(
                record ->
                    record.status() == DeliveryAttemptStatus.SENT
                        && record.recipientId().equals(recipientId)
                        && record.notificationType().equals(notificationType)
                        && record.deliveryDay().equals(deliveryDay));
      }
    }

    long sentCount(String recipientId) {
      synchronized (records) {
        return records.stream()
            .filter(record -> record.status() == DeliveryAttemptStatus.SENT)
            .filter(record -> record.recipientId().equals(recipientId))
            .filter(record -> record.deliveryDay().equals(DAY))
            .count();
      }
    }
  }

  private static final class CountingTransport implements NotificationTransport {

    private final Map<String, Integer> sends = new ConcurrentHashMap<>();
    private final AtomicInteger total = new AtomicInteger();

    @Override
    public DeliveryReceipt send(DigestContent content, String address) {
      sends.merge(address, 1, Integer::sum);
      return new DeliveryReceipt("msg-" + total.incrementAndGet());
    }

    @Override
    public boolean configured() {
      return true;
    }

    Map<String, Integer> sendsTo() {
      return Map.copyOf(sends);
    }

    int totalSends() {
      return total.get();
    }
  }

  private static final class SteppingClock extends Clock {

    private volatile Instant instant;

    SteppingClock(Instant instant) {
      this.instant = instant;
    }

    void set(Instant next) {
      this.instant = next;
    }

    @Override
    public ZoneId getZone() {
      return ZoneOffset.UTC;
    }

    @Override
    public Clock withZone(ZoneId zone) {
      return this;
    }

    @Override
    public Instant instant() {
      return instant;
    }
  }
}
