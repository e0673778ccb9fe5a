package com.sitemapper.core.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 런 하나에 하나. 코디네이터/워커 풀/HTTP 호출이 같은 인스턴스를 공유한다.
 * 한 번 울리면 되돌릴 수 없다.
 */
public final class CancellationSignal {

    private static final Logger LOG = LoggerFactory.getLogger(CancellationSignal.class);

    /** onCancel 등록 해제 핸들 (try-with-resources 용) */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        @Override void close();
    }

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Set<Listener> listeners = ConcurrentHashMap.newKeySet();

    /** @return 이번 호출이 실제로 신호를 울렸으면 true */
    public boolean cancel() {
        if (!cancelled.compareAndSet(false, true)) return false;
        for (Listener l : listeners) l.fire();
        listeners.clear();
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * 취소 시 실행할 동작 등록. 이미 취소됐으면 즉시 실행한다.
     * 동작은 최대 한 번만 실행된다.
     */
    public Registration onCancel(Runnable action) {
        Listener l = new Listener(Objects.requireNonNull(action, "action"));
        listeners.add(l);
        if (cancelled.get()) {
            // cancel()의 순회와 경합해도 Listener 내부 플래그로 1회 보장
            l.fire();
            listeners.remove(l);
        }
        return () -> listeners.remove(l);
    }

    private static final class Listener {
        private final Runnable action;
        private final AtomicBoolean fired = new AtomicBoolean(false);

        Listener(Runnable action) { this.action = action; }

        void fire() {
            if (!fired.compareAndSet(false, true)) return;
            try {
                action.run();
            } catch (RuntimeException e) {
                LOG.warn("cancel listener failed", e);
            }
        }
    }
}
