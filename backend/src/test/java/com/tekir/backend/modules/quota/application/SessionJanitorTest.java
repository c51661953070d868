package com.tekir.backend.modules.quota.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;

import com.tekir.backend.global.error.ProblemException;
import com.tekir.backend.modules.account.application.AccountDirectory;
import com.tekir.backend.modules.quota.infrastructure.persistence.DeviceDailyUsageRepository;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;
import com.tekir.backend.support.NoOpTransactionManager;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.data.domain.Pageable;

@ExtendWith(MockitoExtension.class)
class SessionJanitorTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T10:00:00Z");

    @Mock
    private QuotaSessionRepository sessionRepository;

    @Mock
    private DeviceDailyUsageRepository deviceUsageRepository;

    @Mock
    private AccountDirectory accountDirectory;

    private SessionJanitor janitor;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        janitor = new SessionJanitor(
                sessionRepository,
                deviceUsageRepository,
                accountDirectory,
                new NoOpTransactionManager(),
                clock,
                100,
                50,
                3,
                7
        );
    }

    @Test
    void expirySweepSkipsFailedRowsAndReportsMoreWork() {
        List<UUID> ids = ids(100);
        when(sessionRepository.findExpiredIds(eq(NOW), any(Pageable.class))).thenReturn(ids);
        when(sessionRepository.deleteExpiredById(any(UUID.class), eq(NOW))).thenReturn(1);
        when(sessionRepository.deleteExpiredById(ids.get(10), NOW))
                .thenThrow(new CannotAcquireLockException("row locked"));

        SweepResult result = janitor.sweepExpiredSessions();

        assertThat(result.processed()).isEqualTo(99);
        assertThat(result.failed()).isEqualTo(1);
        assertThat(result.hasMore()).isTrue();
        verify(sessionRepository, times(100)).deleteExpiredById(any(UUID.class), eq(NOW));
        verify(deviceUsageRepository).deleteOlderThan(LocalDate.of(2024, 12, 25));
    }

    @Test
    void partialExpiryBatchMeansDone() {
        when(sessionRepository.findExpiredIds(eq(NOW), any(Pageable.class))).thenReturn(ids(12));
        when(sessionRepository.deleteExpiredById(any(UUID.class), eq(NOW))).thenReturn(1);

        SweepResult result = janitor.sweepExpiredSessions();

        assertThat(result.processed()).isEqualTo(12);
        assertThat(result.hasMore()).isFalse();
    }

    @Test
    void resetStopsAtBatchCeilingAndReportsMoreWork() {
        when(sessionRepository.findResettableIds(eq(NOW), any(Pageable.class))).thenReturn(ids(50));
        when(sessionRepository.resetRequestCounts(anyCollection(), eq(NOW))).thenReturn(50);

        SweepResult result = janitor.resetDailyCounts();

        assertThat(result.processed()).isEqualTo(150);
        assertThat(result.hasMore()).isTrue();
        verify(sessionRepository, times(3)).resetRequestCounts(anyCollection(), eq(NOW));
    }

    @Test
    void resetFinishesOnShortBatch() {
        when(sessionRepository.findResettableIds(eq(NOW), any(Pageable.class)))
                .thenReturn(ids(50))
                .thenReturn(ids(20));
        when(sessionRepository.resetRequestCounts(anyCollection(), eq(NOW)))
                .thenReturn(50)
                .thenReturn(20);

        SweepResult result = janitor.resetDailyCounts();

        assertThat(result.processed()).isEqualTo(70);
        assertThat(result.hasMore()).isFalse();
    }

    @Test
    void manualResetRequiresAdministrator() {
        UUID caller = UUID.randomUUID();
        when(accountDirectory.isAdmin(caller)).thenReturn(false);

        ProblemException ex = assertThrows(ProblemException.class, () -> janitor.resetDailyCountsAsAdmin(caller));

        assertThat(ex.getCode()).isEqualTo("ADMIN_REQUIRED");
        verify(sessionRepository, never()).findResettableIds(any(), any());
    }

    @Test
    void administratorCanRunManualReset() {
        UUID caller = UUID.randomUUID();
        when(accountDirectory.isAdmin(caller)).thenReturn(true);
        when(sessionRepository.findResettableIds(eq(NOW), any(Pageable.class))).thenReturn(List.of());

        SweepResult result = janitor.resetDailyCountsAsAdmin(caller);

        assertThat(result.processed()).isZero();
        assertThat(result.hasMore()).isFalse();
    }

    private static List<UUID> ids(int count) {
        return IntStream.range(0, count).mapToObj(i -> UUID.randomUUID()).toList();
    }
}
