package com.tempmail.service;

import com.tempmail.domain.Failure;
import com.tempmail.domain.FailureKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * BackgroundTasks unit tests
 */
class BackgroundTasksTest {

    @Test
    @DisplayName("Successful task settles with no failure")
    void testSuccess() {
        BackgroundTasks tasks = new BackgroundTasks(Schedulers.immediate());
        AtomicBoolean ran = new AtomicBoolean();

        Optional<Failure> outcome = tasks.submit("noop", () -> ran.set(true)).join();

        assertThat(ran).isTrue();
        assertThat(outcome).isEmpty();
        assertThat(tasks.pendingCount()).isZero();
    }

    @Test
    @DisplayName("Failing task settles with a side-channel failure, never exceptionally")
    void testFailure() {
        BackgroundTasks tasks = new BackgroundTasks(Schedulers.immediate());

        CompletableFuture<Optional<Failure>> future = tasks.submit("blob-delete:k", () -> {
            throw new IllegalStateException("boom");
        });

        assertThat(future).isCompletedWithValueMatching(o -> o.isPresent()
                && o.get().kind() == FailureKind.SIDE_CHANNEL
                && o.get().stage().equals("blob-delete:k")
                && o.get().detail().equals("boom"));
    }

    @Test
    @DisplayName("awaitAll waits for tasks still running")
    void testAwaitAll() throws Exception {
        Scheduler scheduler = Schedulers.newSingle("background-test");
        try {
            BackgroundTasks tasks = new BackgroundTasks(scheduler);
            CountDownLatch started = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);

            CompletableFuture<Optional<Failure>> future = tasks.submit("slow", () -> {
                started.countDown();
                release.await();
            });
            assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

            assertThat(tasks.pendingCount()).isEqualTo(1);
            assertThat(tasks.awaitAll(Duration.ofMillis(50))).isFalse();

            release.countDown();
            assertThat(tasks.awaitAll(Duration.ofSeconds(5))).isTrue();
            assertThat(future).isDone();
        } finally {
            scheduler.dispose();
        }
    }

    @Test
    @DisplayName("awaitAll with nothing pending returns at once")
    void testAwaitAllEmpty() {
        BackgroundTasks tasks = new BackgroundTasks(Schedulers.immediate());

        assertThat(tasks.awaitAll(Duration.ZERO)).isTrue();
    }
}
