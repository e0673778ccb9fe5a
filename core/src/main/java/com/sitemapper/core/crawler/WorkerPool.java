package com.sitemapper.core.crawler;

/** 인자 없는 작업을 제한된 병렬도로 실행하는 풀. */
public interface WorkerPool {

    /**
     * 작업 제출. 포화 상태면 워커가 빌 때까지 블록한다(버퍼링 없음).
     * @return 워커가 작업을 받았으면 true. 정지/취소/인터럽트로 버려졌으면 false
     *         (호출자 쪽 카운터 보정은 호출자 책임)
     */
    boolean add(Runnable task);

    /** 모든 워커에 종료 신호 후, 전부 빠질 때까지 블록. */
    void stop();

    /** 먼저 호출됐거나 동시에 진행 중인 stop()이 끝날 때까지 블록. */
    void waitOnStop() throws InterruptedException;
}
