package com.tempmail.service;

import com.tempmail.config.RetentionPolicy;
import com.tempmail.domain.Failure;
import com.tempmail.domain.FailureKind;
import com.tempmail.mapper.MailboxMapper;
import com.tempmail.mapper.MessageMapper;
import com.tempmail.storage.BlobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic expiry of mailboxes older than the retention window.
 * Pinned and favorited mailboxes are kept together with their messages and archives.
 * Blob deletes are scheduled before the metadata deletes and are not rolled back with them;
 * the age predicate is evaluated inside the datastore.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExpiryService {

    private final MessageMapper messageMapper;
    private final MailboxMapper mailboxMapper;
    private final BlobStore blobStore;
    private final BackgroundTasks backgroundTasks;
    private final RetentionPolicy retentionPolicy;

    private final AtomicReference<SweepState> state = new AtomicReference<>(SweepState.IDLE);

    @Scheduled(fixedDelayString = "${tempmail.retention.sweep-interval-ms:60000}",
            initialDelayString = "${tempmail.retention.sweep-initial-delay-ms:60000}")
    public void onTick() {
        sweep();
    }

    public SweepResult sweep() {
        int minutes = retentionPolicy.minutes();
        List<CompletableFuture<Optional<Failure>>> blobDeletes = new ArrayList<>();
        try {
            state.set(SweepState.SCANNING);
            List<String> keys = messageMapper.findExpiredObjectKeys(minutes);

            state.set(SweepState.PURGING);
            for (String key : keys) {
                if (key == null || key.isEmpty()) {
                    continue;
                }
                blobDeletes.add(backgroundTasks.submit("blob-delete:" + key, () -> blobStore.delete(key)));
            }
            int messages = messageMapper.deleteExpired(minutes);
            int mailboxes = mailboxMapper.deleteExpired(minutes);

            log.info("Expiry sweep done: retention={}m, blobs={}, messages={}, mailboxes={}",
                    minutes, blobDeletes.size(), messages, mailboxes);
            return SweepResult.completed(keys.size(), messages, mailboxes, blobDeletes);
        } catch (DataAccessException e) {
            log.error("Expiry sweep failed, expired data kept until the next tick", e);
            return SweepResult.failed(Failure.of(FailureKind.INFRASTRUCTURE, "sweep", e), blobDeletes);
        } finally {
            state.set(SweepState.IDLE);
        }
    }

    public SweepState getState() {
        return state.get();
    }
}
