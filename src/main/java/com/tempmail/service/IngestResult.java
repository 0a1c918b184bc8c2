package com.tempmail.service;

import com.tempmail.domain.Failure;
import com.tempmail.domain.FailureKind;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of ingesting one inbound message
 *
 * @param recorded   whether a message metadata row was written
 * @param mailboxId  owning mailbox, null when not recorded
 * @param objectKey  archive key, "" when archiving failed or the message was not recorded
 * @param failures   failures recovered or encountered, in pipeline order
 * @param forwarding the background forward dispatch, if one was started
 */
public record IngestResult(boolean recorded,
                           Long mailboxId,
                           String objectKey,
                           List<Failure> failures,
                           CompletableFuture<Optional<Failure>> forwarding) {

    public IngestResult {
        failures = List.copyOf(failures);
        if (forwarding == null) {
            forwarding = CompletableFuture.completedFuture(Optional.empty());
        }
    }

    public static IngestResult recorded(long mailboxId, String objectKey, List<Failure> failures,
                                        CompletableFuture<Optional<Failure>> forwarding) {
        return new IngestResult(true, mailboxId, objectKey, failures, forwarding);
    }

    public static IngestResult rejected(List<Failure> failures, CompletableFuture<Optional<Failure>> forwarding) {
        return new IngestResult(false, null, "", failures, forwarding);
    }

    public boolean hasFailure(FailureKind kind) {
        return failures.stream().anyMatch(f -> f.kind() == kind);
    }
}
