package com.prismTax.simulator.session.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import com.prismTax.simulator.gateway.util.PhoneNumberMasker;
import com.prismTax.simulator.session.model.EntityType;
import com.prismTax.simulator.session.model.SimulatorSession;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Session service - keeps one simulator session per simulated phone number in a Caffeine cache.
 *
 * Responsibilities:
 * - Get or create the session for a phone number
 * - Reset a session by replacing it, marking the old one discarded
 * - Expire idle sessions
 */
@Slf4j
@Service
public class SessionService {

    private static final EntityType DEFAULT_ENTITY_TYPE = EntityType.BUSINESS;

    private final Cache<String, SimulatorSession> sessionCache;

    public SessionService(@Value("${simulator.session.idle-ttl-minutes:30}") long idleTtlMinutes,
                          @Value("${simulator.session.max-sessions:10000}") long maxSessions) {
        this.sessionCache = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofMinutes(idleTtlMinutes))
                .maximumSize(maxSessions)
                .removalListener((String key, SimulatorSession value, RemovalCause cause) -> {
                    if (value != null && cause.wasEvicted()) {
                        value.setDiscarded(true);
                        log.debug("Session expired - phone: {}, sessionId: {}, cause: {}",
                                PhoneNumberMasker.mask(key), value.getSessionId(), cause);
                    }
                })
                .build();
    }

    /**
     * Gets the session for a phone number, creating it when absent.
     * A requested entity type that differs from the session's resets the session.
     *
     * @param phoneNumber simulated phone number
     * @param entityType requested entity type, or null to keep the current one
     */
    public SimulatorSession getOrCreateSession(String phoneNumber, EntityType entityType) {
        SimulatorSession session = sessionCache.asMap().compute(phoneNumber, (key, existing) -> {
            if (existing == null) {
                SimulatorSession created = newSession(key, entityType != null ? entityType : DEFAULT_ENTITY_TYPE);
                log.info("Created new session - phone: {}, sessionId: {}, entityType: {}, activeSessions: {}",
                        PhoneNumberMasker.mask(key), created.getSessionId(), created.getEntityType(),
                        getActiveSessionCount() + 1);
                return created;
            }
            if (entityType != null && entityType != existing.getEntityType()) {
                log.info("Entity type changed, resetting session - phone: {}, sessionId: {}, from: {}, to: {}",
                        PhoneNumberMasker.mask(key), existing.getSessionId(), existing.getEntityType(), entityType);
                existing.setDiscarded(true);
                return newSession(key, entityType);
            }
            return existing;
        });
        session.touch();
        return session;
    }

    /**
     * Returns the session for a phone number, or null if none exists.
     */
    public SimulatorSession getSession(String phoneNumber) {
        SimulatorSession session = sessionCache.getIfPresent(phoneNumber);
        if (session != null) {
            session.touch();
        }
        return session;
    }

    /**
     * Replaces the session with a fresh one in state NEW.
     *
     * Does not wait for a turn in flight: the old session is marked discarded
     * so its late results are dropped instead of reaching the new session.
     *
     * @param phoneNumber simulated phone number
     * @param entityType entity type of the new session, or null to keep the current one
     * @return the new session
     */
    public SimulatorSession resetSession(String phoneNumber, EntityType entityType) {
        SimulatorSession session = sessionCache.asMap().compute(phoneNumber, (key, existing) -> {
            EntityType type = entityType;
            if (type == null) {
                type = existing != null ? existing.getEntityType() : DEFAULT_ENTITY_TYPE;
            }
            if (existing != null) {
                existing.setDiscarded(true);
            }
            return newSession(key, type);
        });
        log.info("Session reset - phone: {}, sessionId: {}, entityType: {}",
                PhoneNumberMasker.mask(phoneNumber), session.getSessionId(), session.getEntityType());
        return session;
    }

    /**
     * Gets the current number of active sessions.
     */
    public long getActiveSessionCount() {
        return sessionCache.estimatedSize();
    }

    private SimulatorSession newSession(String phoneNumber, EntityType entityType) {
        Instant now = Instant.now();
        return SimulatorSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .phoneNumber(phoneNumber)
                .entityType(entityType)
                .createdAt(now)
                .lastAccessedAt(now)
                .build();
    }
}
