package com.tekir.backend.modules.quota.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.tekir.backend.global.error.ProblemException;
import com.tekir.backend.modules.quota.domain.QuotaSession;
import com.tekir.backend.modules.quota.infrastructure.persistence.QuotaSessionRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Attaches a pre-sign-in session to the account that just signed in.
 * When the account already owns a live session, the presented one is deactivated (never deleted)
 * and the caller is told to switch to the canonical token.
 */
@Service
public class SessionLinker {

    private static final Logger log = LoggerFactory.getLogger(SessionLinker.class);

    private final QuotaSessionRepository sessionRepository;
    private final QuotaPolicyResolver policyResolver;
    private final QuotaEventSink eventSink;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SessionLinker(
            QuotaSessionRepository sessionRepository,
            QuotaPolicyResolver policyResolver,
            QuotaEventSink eventSink,
            PlatformTransactionManager transactionManager,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.policyResolver = policyResolver;
        this.eventSink = eventSink;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    public Optional<LinkedSession> link(LinkSessionCommand command) {
        UUID userId = command.userId();
        if (userId == null || command.callerId() == null || !Objects.equals(command.callerId(), userId)) {
            throw ProblemException.forbidden("SESSION_LINK_FORBIDDEN",
                    "Sessions can only be linked to the signed-in account");
        }
        if (command.token() == null || command.token().isBlank()) {
            return Optional.empty();
        }
        String token = command.token().trim();
        int limit = policyResolver.resolveDailyLimit(userId);

        Optional<LinkedSession> linked;
        try {
            linked = transactionTemplate.execute(status -> linkInTransaction(token, userId, limit));
        } catch (DataIntegrityViolationException ex) {
            if (!QuotaSessionConstraints.isCanonicalConflict(ex)) {
                throw ex;
            }
            log.warn("Concurrent link for user={}, merging into canonical session", userId);
            linked = Optional.of(mergeIntoCanonical(token, userId, limit).orElseThrow(() -> ex));
        } catch (ConcurrencyFailureException ex) {
            log.warn("Session {} changed while linking to user={}, re-reading",
                    SessionTokenGenerator.abbreviate(token), userId);
            linked = transactionTemplate.execute(status -> linkInTransaction(token, userId, limit));
        }

        linked.ifPresent(result -> eventSink.publish(new QuotaEvent(
                QuotaEvent.Type.SESSION_LINKED,
                SessionTokenGenerator.abbreviate(result.token()),
                userId,
                0,
                result.limit(),
                OffsetDateTime.now(clock)
        )));
        return linked;
    }

    private Optional<LinkedSession> linkInTransaction(String token, UUID userId, int limit) {
        OffsetDateTime now = OffsetDateTime.now(clock);
        sessionRepository.retireExpiredForUser(userId, now);

        Optional<QuotaSession> maybePresented = sessionRepository.findByToken(token);
        if (maybePresented.isEmpty()) {
            return Optional.empty();
        }
        QuotaSession presented = maybePresented.get();
        if (presented.getUserId() != null && !presented.getUserId().equals(userId)) {
            throw ProblemException.forbidden("SESSION_OWNED_BY_ANOTHER_USER",
                    "Session belongs to a different account");
        }

        Optional<QuotaSession> canonical = sessionRepository.findLiveByUserId(userId, now);
        if (canonical.isPresent()) {
            QuotaSession target = canonical.get();
            if (target.getId().equals(presented.getId())) {
                return Optional.of(new LinkedSession(presented.getToken(), false, limit));
            }
            return Optional.of(mergeInto(target, presented, limit));
        }

        if (!presented.isLiveAt(now)) {
            log.debug("Session {} is no longer live, nothing to link", SessionTokenGenerator.abbreviate(token));
            return Optional.empty();
        }
        presented.attachUser(userId);
        sessionRepository.saveAndFlush(presented);
        log.debug("Promoted session {} to user={}", SessionTokenGenerator.abbreviate(token), userId);
        return Optional.of(new LinkedSession(presented.getToken(), false, limit));
    }

    private Optional<LinkedSession> mergeIntoCanonical(String token, UUID userId, int limit) {
        return Optional.ofNullable(transactionTemplate.execute(status -> {
            OffsetDateTime now = OffsetDateTime.now(clock);
            Optional<QuotaSession> canonical = sessionRepository.findLiveByUserId(userId, now);
            if (canonical.isEmpty()) {
                return null;
            }
            QuotaSession target = canonical.get();
            Optional<QuotaSession> presented = sessionRepository.findByToken(token);
            if (presented.isEmpty() || presented.get().getId().equals(target.getId())) {
                return new LinkedSession(target.getToken(), !target.getToken().equals(token), limit);
            }
            return mergeInto(target, presented.get(), limit);
        }));
    }

    private LinkedSession mergeInto(QuotaSession canonical, QuotaSession presented, int limit) {
        if (presented.isActive()) {
            presented.deactivate();
            sessionRepository.save(presented);
        }
        canonical.backfillDeviceId(presented.getDeviceId());
        sessionRepository.saveAndFlush(canonical);
        log.debug("Deactivated session {} in favour of canonical {}",
                SessionTokenGenerator.abbreviate(presented.getToken()),
                SessionTokenGenerator.abbreviate(canonical.getToken()));
        return new LinkedSession(canonical.getToken(), true, limit);
    }
}
