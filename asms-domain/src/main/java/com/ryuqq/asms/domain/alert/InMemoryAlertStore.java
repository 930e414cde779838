package com.ryuqq.asms.domain.alert;

import com.ryuqq.asms.core.context.CallContext;
import com.ryuqq.asms.core.error.ErrorCode;
import com.ryuqq.asms.core.error.UnitException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 메모리 기반 AlertStore.
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>create/update/delete는 write lock</li>
 *   <li>get/list는 read lock</li>
 * </ul>
 *
 * <p>조회 결과는 삽입 순서를 따르며, 알림 목록은 triggeredAt 오름차순입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class InMemoryAlertStore implements AlertStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAlertStore.class);
    private static final String DOMAIN = "alert";

    private final Clock clock;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, AlertRule> rules = new LinkedHashMap<>();
    private final Map<String, Alert> alerts = new LinkedHashMap<>();

    public InMemoryAlertStore() {
        this(Clock.systemUTC());
    }

    public InMemoryAlertStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public AlertRule createRule(CallContext ctx, AlertRule rule) {
        ctx.throwIfDone();
        requireRule(rule);
        lock.writeLock().lock();
        try {
            String id = rule.id().isEmpty() ? UUID.randomUUID().toString() : rule.id();
            if (rules.containsKey(id)) {
                throw UnitException.of(DOMAIN, ErrorCode.ALREADY_EXISTS, "rule already exists: " + id);
            }
            Instant now = clock.instant();
            AlertRule stored = rule.withId(id).withTimestamps(now, now);
            rules.put(id, stored);
            log.debug("Created alert rule {} ({})", id, stored.name());
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public AlertRule getRule(CallContext ctx, String id) {
        ctx.throwIfDone();
        lock.readLock().lock();
        try {
            AlertRule rule = rules.get(id);
            if (rule == null) {
                throw ruleNotFound(id);
            }
            return rule;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public AlertRule updateRule(CallContext ctx, AlertRule rule) {
        ctx.throwIfDone();
        requireRule(rule);
        lock.writeLock().lock();
        try {
            AlertRule existing = rules.get(rule.id());
            if (existing == null) {
                throw ruleNotFound(rule.id());
            }
            AlertRule stored = rule.withTimestamps(existing.createdAt(), clock.instant());
            rules.put(rule.id(), stored);
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void deleteRule(CallContext ctx, String id) {
        ctx.throwIfDone();
        lock.writeLock().lock();
        try {
            if (rules.remove(id) == null) {
                throw ruleNotFound(id);
            }
            log.debug("Deleted alert rule {}", id);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<AlertRule> listRules(CallContext ctx, RuleFilter filter) {
        ctx.throwIfDone();
        RuleFilter effective = filter == null ? RuleFilter.ALL : filter;
        lock.readLock().lock();
        try {
            List<AlertRule> result = new ArrayList<>();
            for (AlertRule rule : rules.values()) {
                if (effective.matches(rule)) {
                    result.add(rule);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Alert createAlert(CallContext ctx, Alert alert) {
        ctx.throwIfDone();
        requireAlert(alert);
        lock.writeLock().lock();
        try {
            Alert stored = alert.id().isEmpty() ? alert.withId(UUID.randomUUID().toString()) : alert;
            if (alerts.put(stored.id(), stored) != null) {
                log.debug("Overwrote alert {}", stored.id());
            }
            return stored;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Alert getAlert(CallContext ctx, String id) {
        ctx.throwIfDone();
        lock.readLock().lock();
        try {
            Alert alert = alerts.get(id);
            if (alert == null) {
                throw alertNotFound(id);
            }
            return alert;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Alert updateAlert(CallContext ctx, Alert alert) {
        ctx.throwIfDone();
        requireAlert(alert);
        lock.writeLock().lock();
        try {
            if (!alerts.containsKey(alert.id())) {
                throw alertNotFound(alert.id());
            }
            alerts.put(alert.id(), alert);
            return alert;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public AlertPage listAlerts(CallContext ctx, AlertFilter filter) {
        ctx.throwIfDone();
        AlertFilter effective = filter == null ? AlertFilter.ALL : filter;
        List<Alert> matched = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Alert alert : alerts.values()) {
                if (effective.matches(alert)) {
                    matched.add(alert);
                }
            }
        } finally {
            lock.readLock().unlock();
        }
        matched.sort(Comparator.comparing(Alert::triggeredAt));

        int total = matched.size();
        int from = Math.min(effective.offset(), total);
        int to = effective.limit() > 0 ? Math.min(from + effective.limit(), total) : total;
        return new AlertPage(matched.subList(from, to), total);
    }

    @Override
    public List<Alert> listActiveAlerts(CallContext ctx) {
        ctx.throwIfDone();
        lock.readLock().lock();
        try {
            List<Alert> result = new ArrayList<>();
            for (Alert alert : alerts.values()) {
                if (alert.isActive()) {
                    result.add(alert);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static void requireRule(AlertRule rule) {
        if (rule == null) {
            throw UnitException.of(DOMAIN, ErrorCode.INVALID_INPUT, "invalid rule: null");
        }
    }

    private static void requireAlert(Alert alert) {
        if (alert == null) {
            throw UnitException.of(DOMAIN, ErrorCode.INVALID_INPUT, "invalid alert: null");
        }
    }

    private static UnitException ruleNotFound(String id) {
        return UnitException.of(DOMAIN, ErrorCode.ALERT_RULE_NOT_FOUND, "rule not found: " + id);
    }

    private static UnitException alertNotFound(String id) {
        return UnitException.of(DOMAIN, ErrorCode.ALERT_NOT_FOUND, "alert not found: " + id);
    }
}
