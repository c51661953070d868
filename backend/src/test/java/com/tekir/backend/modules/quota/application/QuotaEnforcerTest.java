package com.tekir.backend.modules.quota.application;

import static com.tekir.backend.support.QuotaSessionFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import com.tekir.backend.modules.quota.application.QuotaDecision.Outcome;
import com.tekir.backend.modules.quota.domain.DeviceDailyUsage;
import com.tekir.backend.modules.quota.domain.QuotaSession;
import com.tekir.backend.modules.quota.infrastructure.persistence.DeviceDailyUsageRepository;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;
import com.tekir.backend.support.NoOpTransactionManager;
import com.tekir.backend.support.QuotaSessionFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

@ExtendWith(MockitoExtension.class)
class QuotaEnforcerTest {

    private static final OffsetDateTime NOW = OffsetDateTime.parse("2025-01-01T10:00:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 1, 1);
    private static final String TOKEN = "s".repeat(64);

    @Mock
    private QuotaSessionRepository sessionRepository;

    @Mock
    private DeviceDailyUsageRepository deviceUsageRepository;

    @Mock
    private QuotaPolicyResolver policyResolver;

    @Mock
    private DailyCounterService dailyCounterService;

    @Mock
    private QuotaEventSink eventSink;

    private QuotaEnforcer enforcer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW.toInstant(), ZoneOffset.UTC);
        enforcer = new QuotaEnforcer(
                sessionRepository,
                deviceUsageRepository,
                policyResolver,
                dailyCounterService,
                eventSink,
                new NoOpTransactionManager(),
                clock
        );
    }

    @Test
    void unknownTokenIsDeniedWithZeroCount() {
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.empty());
        when(policyResolver.anonymousLimit()).thenReturn(150);

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.currentCount()).isZero();
        assertThat(decision.outcome()).isEqualTo(Outcome.UNKNOWN_SESSION);
        assertThat(decision.sessionInvalid()).isTrue();
    }

    @Test
    void expiredSessionIsDeniedWithoutIncrement() {
        QuotaSession expired = session(TOKEN, null, null, null, NOW.minusMinutes(1), 9);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(expired));
        when(policyResolver.anonymousLimit()).thenReturn(150);

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.currentCount()).isEqualTo(9);
        assertThat(decision.outcome()).isEqualTo(Outcome.EXPIRED_SESSION);
        assertThat(expired.getRequestCount()).isEqualTo(9);
        verify(sessionRepository, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("anonymous session: 150 calls pass, the 151st is denied")
    void anonymousSessionIsCappedAtOneHundredFifty() {
        QuotaSession anonymous = session(TOKEN, null, null, null, NOW.plusHours(24), 0);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(anonymous));
        when(sessionRepository.findById(anonymous.getId())).thenReturn(Optional.of(anonymous));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);

        int allowed = 0;
        QuotaDecision last = null;
        for (int i = 0; i < 200; i++) {
            last = enforcer.consume(TOKEN);
            if (last.allowed()) {
                allowed++;
            }
        }

        assertThat(allowed).isEqualTo(150);
        assertThat(anonymous.getRequestCount()).isEqualTo(150);
        assertThat(last.outcome()).isEqualTo(Outcome.SESSION_LIMIT_REACHED);
        assertThat(last.currentCount()).isEqualTo(150);
        assertThat(last.remaining()).isZero();
        verify(dailyCounterService, times(150)).recordApiHit();
    }

    @Test
    void freshSessionOnExhaustedDeviceIsDenied() {
        QuotaSession fresh = session(TOKEN, null, "ip-hash", "device-1", NOW.plusHours(24), 0);
        DeviceDailyUsage exhausted = new DeviceDailyUsage(TODAY, "device-1");
        QuotaSessionFixtures.setField(exhausted, "usageCount", 150);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(fresh));
        when(sessionRepository.findById(fresh.getId())).thenReturn(Optional.of(fresh));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(deviceUsageRepository.findByUsageDayAndDeviceKey(TODAY, "device-1")).thenReturn(Optional.of(exhausted));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.outcome()).isEqualTo(Outcome.DEVICE_LIMIT_REACHED);
        assertThat(decision.currentCount()).isZero();
        assertThat(fresh.getRequestCount()).isZero();
        verify(sessionRepository, never()).saveAndFlush(any());
        verify(dailyCounterService, never()).recordApiHit();
    }

    @Test
    void firstHitOfTheDayCreatesDeviceRowKeyedByHashedIpWhenNoDeviceId() {
        QuotaSession anonymous = session(TOKEN, null, "ip-hash", null, NOW.plusHours(24), 3);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(anonymous));
        when(sessionRepository.findById(anonymous.getId())).thenReturn(Optional.of(anonymous));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(deviceUsageRepository.findByUsageDayAndDeviceKey(TODAY, "ip-hash")).thenReturn(Optional.empty());

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.currentCount()).isEqualTo(4);
        assertThat(decision.remaining()).isEqualTo(146);

        ArgumentCaptor<DeviceDailyUsage> usage = ArgumentCaptor.forClass(DeviceDailyUsage.class);
        verify(deviceUsageRepository).saveAndFlush(usage.capture());
        assertThat(usage.getValue().getUsageDay()).isEqualTo(TODAY);
        assertThat(usage.getValue().getDeviceKey()).isEqualTo("ip-hash");
        assertThat(usage.getValue().getUsageCount()).isEqualTo(1);
    }

    @Test
    void lostRaceReReadsCommittedCountWithoutRetrying() {
        QuotaSession inTransaction = session(TOKEN, null, null, null, NOW.plusHours(24), 41);
        QuotaSession committed = session(TOKEN, null, null, null, NOW.plusHours(24), 42);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(inTransaction));
        when(sessionRepository.findById(inTransaction.getId()))
                .thenReturn(Optional.of(inTransaction))
                .thenReturn(Optional.of(committed));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(sessionRepository.saveAndFlush(inTransaction))
                .thenThrow(new ObjectOptimisticLockingFailureException(QuotaSession.class, inTransaction.getId()));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.incremented()).isFalse();
        assertThat(decision.currentCount()).isEqualTo(42);
        assertThat(decision.outcome()).isEqualTo(Outcome.CONFLICT_REREAD);
        verify(sessionRepository, times(1)).saveAndFlush(any());
        verify(dailyCounterService, never()).recordApiHit();

        ArgumentCaptor<QuotaEvent> event = ArgumentCaptor.forClass(QuotaEvent.class);
        verify(eventSink).publish(event.capture());
        assertThat(event.getValue().type()).isEqualTo(QuotaEvent.Type.CONFLICT_REREAD);
        assertThat(event.getValue().tokenPrefix()).doesNotContain(TOKEN);
    }

    @Test
    void lostRaceAtTheCeilingIsDenied() {
        QuotaSession inTransaction = session(TOKEN, null, null, null, NOW.plusHours(24), 149);
        QuotaSession committed = session(TOKEN, null, null, null, NOW.plusHours(24), 150);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(inTransaction));
        when(sessionRepository.findById(inTransaction.getId()))
                .thenReturn(Optional.of(inTransaction))
                .thenReturn(Optional.of(committed));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(sessionRepository.saveAndFlush(inTransaction))
                .thenThrow(new ObjectOptimisticLockingFailureException(QuotaSession.class, inTransaction.getId()));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.currentCount()).isEqualTo(150);
    }

    @Test
    void sessionDeletedDuringTheRaceIsDenied() {
        QuotaSession inTransaction = session(TOKEN, null, null, null, NOW.plusHours(24), 10);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(inTransaction));
        when(sessionRepository.findById(inTransaction.getId()))
                .thenReturn(Optional.of(inTransaction))
                .thenReturn(Optional.empty());
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(policyResolver.anonymousLimit()).thenReturn(150);
        when(sessionRepository.saveAndFlush(inTransaction))
                .thenThrow(new ObjectOptimisticLockingFailureException(QuotaSession.class, inTransaction.getId()));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.currentCount()).isZero();
        assertThat(decision.outcome()).isEqualTo(Outcome.UNKNOWN_SESSION);
        verify(dailyCounterService, never()).recordApiHit();
    }

    @Test
    void sessionDeactivatedDuringTheRaceIsDenied() {
        QuotaSession inTransaction = session(TOKEN, null, null, null, NOW.plusHours(24), 10);
        QuotaSession merged = session(TOKEN, null, null, null, NOW.plusHours(24), 10);
        merged.deactivate();
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(inTransaction));
        when(sessionRepository.findById(inTransaction.getId()))
                .thenReturn(Optional.of(inTransaction))
                .thenReturn(Optional.of(merged));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(policyResolver.anonymousLimit()).thenReturn(150);
        when(sessionRepository.saveAndFlush(inTransaction))
                .thenThrow(new ObjectOptimisticLockingFailureException(QuotaSession.class, inTransaction.getId()));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.outcome()).isEqualTo(Outcome.EXPIRED_SESSION);
    }

    @Test
    void lostDeviceRaceAtTheDeviceCapIsDenied() {
        UUID userId = UUID.fromString("00000000-0000-0000-0000-0000000000bb");
        QuotaSession inTransaction = session(TOKEN, userId, "ip-hash", "shared-device", NOW.plusHours(24), 5);
        QuotaSession committed = session(TOKEN, userId, "ip-hash", "shared-device", NOW.plusHours(24), 5);
        DeviceDailyUsage lastUnit = new DeviceDailyUsage(TODAY, "shared-device");
        QuotaSessionFixtures.setField(lastUnit, "usageCount", 299);
        DeviceDailyUsage exhausted = new DeviceDailyUsage(TODAY, "shared-device");
        QuotaSessionFixtures.setField(exhausted, "usageCount", 300);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(inTransaction));
        when(sessionRepository.findById(inTransaction.getId()))
                .thenReturn(Optional.of(inTransaction))
                .thenReturn(Optional.of(committed));
        when(policyResolver.resolveDailyLimit(userId)).thenReturn(300);
        when(deviceUsageRepository.findByUsageDayAndDeviceKey(TODAY, "shared-device"))
                .thenReturn(Optional.of(lastUnit))
                .thenReturn(Optional.of(exhausted));
        when(sessionRepository.saveAndFlush(inTransaction)).thenReturn(inTransaction);
        when(deviceUsageRepository.saveAndFlush(lastUnit))
                .thenThrow(new ObjectOptimisticLockingFailureException(DeviceDailyUsage.class, UUID.randomUUID()));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.incremented()).isFalse();
        assertThat(decision.currentCount()).isEqualTo(5);
        assertThat(decision.remaining()).isZero();
        assertThat(decision.outcome()).isEqualTo(Outcome.CONFLICT_REREAD);
        verify(dailyCounterService, never()).recordApiHit();
    }

    @Test
    void lostRaceWithRoomOnBothCountersIsAllowedWithTheTighterRemaining() {
        QuotaSession inTransaction = session(TOKEN, null, "ip-hash", "device-1", NOW.plusHours(24), 20);
        QuotaSession committed = session(TOKEN, null, "ip-hash", "device-1", NOW.plusHours(24), 21);
        DeviceDailyUsage committedUsage = new DeviceDailyUsage(TODAY, "device-1");
        QuotaSessionFixtures.setField(committedUsage, "usageCount", 140);
        when(sessionRepository.findByToken(TOKEN)).thenReturn(Optional.of(inTransaction));
        when(sessionRepository.findById(inTransaction.getId()))
                .thenReturn(Optional.of(inTransaction))
                .thenReturn(Optional.of(committed));
        when(policyResolver.resolveDailyLimit(null)).thenReturn(150);
        when(deviceUsageRepository.findByUsageDayAndDeviceKey(TODAY, "device-1"))
                .thenReturn(Optional.empty())
                .thenReturn(Optional.of(committedUsage));
        when(sessionRepository.saveAndFlush(inTransaction)).thenReturn(inTransaction);
        when(deviceUsageRepository.saveAndFlush(any(DeviceDailyUsage.class)))
                .thenThrow(new DataIntegrityViolationException("uq_device_daily_usage_day_key"));

        QuotaDecision decision = enforcer.consume(TOKEN);

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.incremented()).isFalse();
        assertThat(decision.remaining()).isEqualTo(10);
    }

    @Test
    void remainingIsBoundedByTheTighterCounter() {
        assertThat(QuotaEnforcer.remaining(300, 10, "device", 250)).isEqualTo(50);
        assertThat(QuotaEnforcer.remaining(300, 280, "device", 5)).isEqualTo(20);
        assertThat(QuotaEnforcer.remaining(300, 10, null, 999)).isEqualTo(290);
        assertThat(QuotaEnforcer.remaining(150, 160, null, 0)).isZero();
    }
}
