/*
 * どこで: 配信台帳のユニットテスト
 * 何を: キャッシュ→DB の判定順序・障害時の縮退・書き込み失敗の計上を検証する
 * なぜ: 1 日 1 通の保証がキャッシュ障害で崩れないことを担保するため
 */
package com.example.dispatch.ledger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.dispatch.config.LedgerProperties;
import com.example.dispatch.service.DispatchMetrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.redis.RedisConnectionFailureException;

@ExtendWith(MockitoExtension.class)
class DeliveryLedgerTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T00:00:00Z");
  private static final LocalDate DAY = LocalDate.of(2026, 1, 17);
  private static final String TYPE = "daily_digest";

  @Mock private DeliveryMarkerCache markerCache;
  @Mock private DeliveryAttemptRepository attemptRepository;
  @Mock private DispatchMetrics metrics;

  private DeliveryLedger ledger;

  @BeforeEach
  void setUp() {
    ledger =
        new DeliveryLedger(
            markerCache,
            attemptRepository,
            new LedgerProperties(Duration.ofHours(24), "digest:sent:"),
            metrics,
            Clock.fixed(FIXED_NOW, ZoneOffset.UTC));
  }

  @Test
  void cacheHitShortCircuitsLedger() {
    when(markerCache.isMarked("r-1", TYPE, DAY)).thenReturn(true);

    final LedgerCheck check = ledger.wasDelivered("r-1", TYPE, DAY);

    assertThat(check).isEqualTo(new LedgerCheck(true, LedgerSource.CACHE, false));
    verify(attemptRepository, never()).existsSent(any(), any(), any());
  }

  @Test
  void ledgerHitBackfillsMarker() {
    when(markerCache.isMarked("r-1", TYPE, DAY)).thenReturn(false);
    when(attemptRepository.existsSent("r-1", TYPE, DAY)).thenReturn(true);

    final LedgerCheck check = ledger.wasDelivered("r-1", TYPE, DAY);

    assertThat(check).isEqualTo(new LedgerCheck(true, LedgerSource.LEDGER, false));
    verify(markerCache).mark("r-1", TYPE, DAY, Duration.ofHours(24));
  }

  @Test
  void cacheFailureFallsBackToLedger() {
    when(markerCache.isMarked("r-1", TYPE, DAY))
        .thenThrow(new RedisConnectionFailureException("down"));
    when(attemptRepository.existsSent("r-1", TYPE, DAY)).thenReturn(false);

    final LedgerCheck check = ledger.wasDelivered("r-1", TYPE, DAY);

    assertThat(check).isEqualTo(new LedgerCheck(false, LedgerSource.NONE, true));
  }

  @Test
  void ledgerFailureAssumesNotSent() {
    when(markerCache.isMarked("r-1", TYPE, DAY)).thenReturn(false);
    when(attemptRepository.existsSent("r-1", TYPE, DAY))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    final LedgerCheck check = ledger.wasDelivered("r-1", TYPE, DAY);

    assertThat(check.delivered()).isFalse();
    assertThat(check.degraded()).isTrue();
  }

  @Test
  void successfulAttemptIsRecordedAndMarked() {
    when(attemptRepository.insert(any())).thenReturn(true);

    final LedgerWrite write = ledger.recordAttempt("r-1", TYPE, DAY, true, "msg-1", null);

    assertThat(write).isEqualTo(LedgerWrite.RECORDED);
    final ArgumentCaptor<DeliveryAttemptRecord> captor =
        ArgumentCaptor.forClass(DeliveryAttemptRecord.class);
    verify(attemptRepository).insert(captor.capture());
    assertThat(captor.getValue().status()).isEqualTo(DeliveryAttemptStatus.SENT);
    assertThat(captor.getValue().attemptedAt()).isEqualTo(FIXED_NOW);
    assertThat(captor.getValue().externalMessageId()).isEqualTo("msg-1");
    verify(markerCache).mark("r-1", TYPE, DAY, Duration.ofHours(24));
  }

  @Test
  void failedAttemptIsRecordedWithoutMarker() {
    when(attemptRepository.insert(any())).thenReturn(true);

    ledger.recordAttempt("r-1", TYPE, DAY, false, null, "rejected");

    final ArgumentCaptor<DeliveryAttemptRecord> captor =
        ArgumentCaptor.forClass(DeliveryAttemptRecord.class);
    verify(attemptRepository).insert(captor.capture());
    assertThat(captor.getValue().status()).isEqualTo(DeliveryAttemptStatus.FAILED);
    assertThat(captor.getValue().errorDetail()).isEqualTo("rejected");
    verify(markerCache, never()).mark(any(), any(), any(), any());
  }

  @Test
  void duplicateSentIsIgnored() {
    when(attemptRepository.insert(any())).thenReturn(false);

    assertThat(ledger.recordAttempt("r-1", TYPE, DAY, true, "msg-2", null))
        .isEqualTo(LedgerWrite.DUPLICATE_IGNORED);
    assertThat(ledger.writeFailures()).isZero();
  }

  @Test
  void writeFailuresAreCountedNotThrown() {
    when(attemptRepository.insert(any()))
        .thenThrow(new DataAccessResourceFailureException("db down"));
    doThrow(new RedisConnectionFailureException("down"))
        .when(markerCache)
        .mark(eq("r-1"), eq(TYPE), eq(DAY), any());

    final LedgerWrite write = ledger.recordAttempt("r-1", TYPE, DAY, true, "msg-1", null);

    assertThat(write).isEqualTo(LedgerWrite.FAILED);
    assertThat(ledger.writeFailures()).isEqualTo(2);
    verify(metrics, times(2)).recordLedgerWriteFailure();
  }
}
