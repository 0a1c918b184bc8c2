package com.tempmail.service;

import com.tempmail.domain.Failure;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of one sweep tick
 *
 * @param blobDeletes background blob deletes scheduled by the tick
 */
public record SweepResult(int expiredBlobKeys,
                          int messagesDeleted,
                          int mailboxesDeleted,
                          Failure failure,
                          List<CompletableFuture<Optional<Failure>>> blobDeletes) {

    public SweepResult {
        blobDeletes = List.copyOf(blobDeletes);
    }

    public static SweepResult completed(int expiredBlobKeys, int messagesDeleted, int mailboxesDeleted,
                                        List<CompletableFuture<Optional<Failure>>> blobDeletes) {
        return new SweepResult(expiredBlobKeys, messagesDeleted, mailboxesDeleted, null, blobDeletes);
    }

    public static SweepResult failed(Failure failure, List<CompletableFuture<Optional<Failure>>> blobDeletes) {
        return new SweepResult(0, 0, 0, failure, blobDeletes);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
