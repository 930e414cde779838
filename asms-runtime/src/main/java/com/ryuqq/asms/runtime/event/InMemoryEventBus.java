package com.ryuqq.asms.runtime.event;

import com.ryuqq.asms.core.context.Cancellable;
import com.ryuqq.asms.core.event.Event;
import com.ryuqq.asms.core.event.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * 발행된 이벤트를 기록하고 타입별 구독자에게 동기 전달하는 in-memory publisher.
 *
 * <p>테스트와 단일 JVM 구성에서 사용합니다. 모든 연산은 thread-safe입니다.</p>
 *
 * <p><strong>테스트 지원:</strong></p>
 * <ul>
 *   <li>{@link #events()}, {@link #eventsOfType(String)}: 기록 조회</li>
 *   <li>{@link #clear()}: 기록과 구독 초기화</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private static final String ALL = "*";

    private final List<Event> events = new CopyOnWriteArrayList<>();
    private final Map<String, List<Consumer<Event>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(Event event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
        deliver(subscribers.get(event.type()), event);
        deliver(subscribers.get(ALL), event);
    }

    /**
     * 이벤트 타입 구독.
     *
     * @param type 이벤트 타입 (예: "alert.triggered")
     * @param subscriber 수신자
     * @return 구독 해제 핸들
     */
    public Cancellable subscribe(String type, Consumer<Event> subscriber) {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        List<Consumer<Event>> list = subscribers.computeIfAbsent(type, key -> new CopyOnWriteArrayList<>());
        list.add(subscriber);
        return () -> list.remove(subscriber);
    }

    public Cancellable subscribeAll(Consumer<Event> subscriber) {
        return subscribe(ALL, subscriber);
    }

    public List<Event> events() {
        return List.copyOf(events);
    }

    public List<Event> eventsOfType(String type) {
        List<Event> matched = new ArrayList<>();
        for (Event event : events) {
            if (event.type().equals(type)) {
                matched.add(event);
            }
        }
        return matched;
    }

    public int size() {
        return events.size();
    }

    public void clear() {
        events.clear();
        subscribers.clear();
    }

    private static void deliver(List<Consumer<Event>> targets, Event event) {
        if (targets == null) {
            return;
        }
        for (Consumer<Event> target : targets) {
            try {
                target.accept(event);
            } catch (RuntimeException e) {
                log.warn("Event subscriber failed for type={}", event.type(), e);
            }
        }
    }
}
