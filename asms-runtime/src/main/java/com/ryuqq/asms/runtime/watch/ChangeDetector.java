package com.ryuqq.asms.runtime.watch;

import com.ryuqq.asms.core.contract.ResourceOperation;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 성공한 tick의 값으로 알림 종류를 결정.
 *
 * <p>구현체는 구독마다 새로 만들어지며 이전 값을 내부에 보관할 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ChangeDetector {

    ResourceOperation detect(Object data);

    /**
     * 항상 같은 종류를 반환.
     */
    static ChangeDetector always(ResourceOperation operation) {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        return data -> operation;
    }

    /**
     * 맵 필드 값이 바뀌면 changed, 아니면 refresh (첫 tick은 refresh).
     */
    static ChangeDetector onFieldChange(String field, ResourceOperation changed) {
        return onFieldChange(field, changed, (previous, current) -> { });
    }

    /**
     * 맵 필드 값 변화 감지 + 변화 시 콜백.
     *
     * @param field 비교할 필드
     * @param changed 변화 시 반환할 종류
     * @param listener 변화 시 (이전 값, 현재 값)으로 호출
     */
    static ChangeDetector onFieldChange(String field, ResourceOperation changed, ChangeListener listener) {
        return new FieldChangeDetector(data -> fieldOf(data, field), changed, listener);
    }

    /**
     * 맵 리스트 필드의 크기가 바뀌면 changed, 아니면 refresh (첫 tick은 refresh).
     */
    static ChangeDetector onSizeChange(String listField, ResourceOperation changed) {
        return new FieldChangeDetector(data -> {
            Object value = fieldOf(data, listField);
            return value instanceof Collection<?> items ? items.size() : null;
        }, changed, (previous, current) -> { });
    }

    private static Object fieldOf(Object data, String field) {
        return data instanceof Map<?, ?> map ? map.get(field) : null;
    }

    /**
     * 변화 콜백.
     */
    @FunctionalInterface
    interface ChangeListener {
        void onChange(Object previous, Object current);
    }

    /**
     * 이전 값을 readers-writer lock으로 보관하는 감지기.
     */
    final class FieldChangeDetector implements ChangeDetector {

        private final Function<Object, Object> extractor;
        private final ResourceOperation changed;
        private final ChangeListener listener;
        private final ReadWriteLock lock = new ReentrantReadWriteLock();
        private boolean initialized;
        private Object last;

        FieldChangeDetector(
            Function<Object, Object> extractor,
            ResourceOperation changed,
            ChangeListener listener
        ) {
            if (changed == null) {
                throw new IllegalArgumentException("changed cannot be null");
            }
            this.extractor = extractor;
            this.changed = changed;
            this.listener = listener;
        }

        @Override
        public ResourceOperation detect(Object data) {
            Object current = extractor.apply(data);
            Object previous;
            boolean first;
            lock.readLock().lock();
            try {
                previous = last;
                first = !initialized;
            } finally {
                lock.readLock().unlock();
            }

            lock.writeLock().lock();
            try {
                last = current;
                initialized = true;
            } finally {
                lock.writeLock().unlock();
            }

            if (first || Objects.equals(previous, current)) {
                return ResourceOperation.REFRESH;
            }
            listener.onChange(previous, current);
            return changed;
        }
    }
}
