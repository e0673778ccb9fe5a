package com.sitemapper.core.crawler;

import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 정규화된 경로 문자열 집합. 읽기는 공유, 쓰기는 배타. 삭제 없음.
 * 포함 = "이번 런에서 크롤 대상으로 선점됨" (완료를 뜻하지 않는다).
 */
public final class SeenSet {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Set<String> data = new HashSet<>();

    public boolean has(String key) {
        lock.readLock().lock();
        try {
            return data.contains(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void add(String... keys) {
        if (keys == null || keys.length == 0) return;
        lock.writeLock().lock();
        try {
            for (String k : keys) data.add(k);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /** 없으면 넣고 true. 이미 있으면 false (동시 선점 경쟁의 승자만 true). */
    public boolean claim(String key) {
        lock.writeLock().lock();
        try {
            return data.add(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return data.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
