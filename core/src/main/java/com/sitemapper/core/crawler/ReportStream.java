package com.sitemapper.core.crawler;

import com.sitemapper.core.model.LinkReport;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 블로킹 리포트 스트림. 생산자(워커)는 막지 않고, 소비자는 for-each 로 끝까지 읽는다.
 * complete() 이후 iterator 는 남은 항목을 돌려준 뒤 끝난다. 소비자는 하나를 가정한다.
 */
public final class ReportStream implements ReportSink, Iterable<LinkReport> {

    private static final Object END = new Object();

    private final LinkedBlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean completed = new AtomicBoolean(false);

    @Override
    public void emit(LinkReport report) {
        if (report == null) return;
        if (completed.get()) throw new IllegalStateException("report stream already closed");
        queue.add(report);
    }

    @Override
    public void complete() {
        if (completed.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    public boolean isComplete() { return completed.get(); }

    /**
     * 스트림이 닫힐 때까지 모두 모은다.
     * @throws TimeoutException timeout 안에 닫히지 않은 경우
     */
    public List<LinkReport> collect(Duration timeout) throws InterruptedException, TimeoutException {
        long deadline = System.nanoTime() + timeout.toNanos();
        List<LinkReport> out = new ArrayList<>();
        while (true) {
            long left = deadline - System.nanoTime();
            Object next = queue.poll(Math.max(0, left), TimeUnit.NANOSECONDS);
            if (next == null) throw new TimeoutException("report stream not closed within " + timeout);
            if (next == END) {
                queue.add(END); // 다른 소비 경로도 끝을 보게
                return out;
            }
            out.add((LinkReport) next);
        }
    }

    /** 닫힐 때까지 블록. 인터럽트되면 플래그를 복원하고 순회를 끝낸다. */
    @Override
    public Iterator<LinkReport> iterator() {
        return new Iterator<>() {
            private Object next;

            @Override public boolean hasNext() {
                if (next == null) {
                    try {
                        next = queue.take();
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                    if (next == END) queue.add(END);
                }
                return next != END;
            }

            @Override public LinkReport next() {
                if (!hasNext()) throw new NoSuchElementException();
                LinkReport r = (LinkReport) next;
                next = null;
                return r;
            }
        };
    }
}
