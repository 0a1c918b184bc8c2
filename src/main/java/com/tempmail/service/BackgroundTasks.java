package com.tempmail.service;

import com.tempmail.domain.Failure;
import com.tempmail.domain.FailureKind;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fire-and-forget side effects (forwarding, blob deletes).
 * The caller does not wait for them, but they are tracked until they settle and
 * awaited before the application shuts down.
 */
@Slf4j
@Component
public class BackgroundTasks {

    @FunctionalInterface
    public interface Task {
        void run() throws Exception;
    }

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final Scheduler scheduler;
    private final Set<CompletableFuture<Optional<Failure>>> pending = ConcurrentHashMap.newKeySet();

    public BackgroundTasks(@Qualifier("backgroundScheduler") Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Run a task in the background.
     *
     * @return completes with the recovered failure, if any; never completes exceptionally
     */
    public CompletableFuture<Optional<Failure>> submit(String label, Task task) {
        CompletableFuture<Optional<Failure>> future = Mono.fromCallable(() -> {
                    task.run();
                    return Optional.<Failure>empty();
                })
                .subscribeOn(scheduler)
                .doOnSuccess(result -> log.debug("Background task {} completed", label))
                .onErrorResume(e -> {
                    log.warn("Background task {} failed: {}", label, e.getMessage());
                    return Mono.just(Optional.of(Failure.of(FailureKind.SIDE_CHANNEL, label, e)));
                })
                .toFuture();
        pending.add(future);
        future.whenComplete((result, error) -> pending.remove(future));
        return future;
    }

    public int pendingCount() {
        return pending.size();
    }

    /**
     * Wait until every task submitted so far has settled
     *
     * @return false when the timeout elapsed first
     */
    public boolean awaitAll(Duration timeout) {
        CompletableFuture<?>[] snapshot = pending.toArray(new CompletableFuture<?>[0]);
        if (snapshot.length == 0) {
            return true;
        }
        try {
            CompletableFuture.allOf(snapshot).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            log.error("Background task settled exceptionally", e);
            return true;
        }
    }

    @PreDestroy
    public void shutdown() {
        int count = pendingCount();
        if (count == 0) {
            return;
        }
        log.info("Waiting for {} background tasks to settle...", count);
        if (!awaitAll(SHUTDOWN_GRACE)) {
            log.warn("{} background tasks still running after {}s", pendingCount(), SHUTDOWN_GRACE.getSeconds());
        }
    }
}
