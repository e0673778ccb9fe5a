package com.sitemapper.core.crawler;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SeenSetTest {

    @Test
    void add_then_has() {
        SeenSet seen = new SeenSet();
        assertThat(seen.has("/a")).isFalse();

        seen.add("/a", "/b");
        seen.add();            // no-op

        assertThat(seen.has("/a")).isTrue();
        assertThat(seen.has("/b")).isTrue();
        assertThat(seen.has("/c")).isFalse();
        assertThat(seen.size()).isEqualTo(2);
    }

    @Test
    void claim_succeeds_only_once() {
        SeenSet seen = new SeenSet();
        assertThat(seen.claim("/x")).isTrue();
        assertThat(seen.claim("/x")).isFalse();
        assertThat(seen.has("/x")).isTrue();
    }

    @Test
    void concurrent_claims_have_exactly_one_winner() throws Exception {
        final int THREADS = 16;
        SeenSet seen = new SeenSet();
        ExecutorService es = Executors.newFixedThreadPool(THREADS);
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < THREADS; i++) {
                results.add(es.submit(() -> {
                    go.await();
                    return seen.claim("/contended");
                }));
            }
            go.countDown();

            int winners = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) winners++;
            }
            assertThat(winners).isEqualTo(1);
            assertThat(seen.size()).isEqualTo(1);
        } finally {
            es.shutdownNow();
        }
    }
}
