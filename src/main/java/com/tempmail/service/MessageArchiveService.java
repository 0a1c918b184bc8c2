package com.tempmail.service;

import com.tempmail.config.ServerProperties;
import com.tempmail.domain.Failure;
import com.tempmail.domain.FailureKind;
import com.tempmail.domain.MailContent;
import com.tempmail.domain.Message;
import com.tempmail.mapper.MessageMapper;
import com.tempmail.storage.BlobStore;
import com.tempmail.util.ObjectKeyUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;

/**
 * Message archiving service
 * - Store one raw EML per message under a dated, per-mailbox object key
 * - Record message metadata whether or not the blob write succeeded
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageArchiveService {

    public static final String EML_CONTENT_TYPE = "message/rfc822";

    /**
     * Outcome of a blob write: the stored key, or "" and the recovered failure
     */
    public record ArchiveResult(String objectKey, Failure failure) {

        public static ArchiveResult stored(String objectKey) {
            return new ArchiveResult(objectKey, null);
        }

        public static ArchiveResult failed(Failure failure) {
            return new ArchiveResult("", failure);
        }

        public boolean isStored() {
            return failure == null;
        }
    }

    private final BlobStore blobStore;
    private final MessageMapper messageMapper;
    private final ServerProperties properties;

    /**
     * Write the raw message to the blob store. Failures are logged and reported, never thrown.
     */
    public ArchiveResult archive(byte[] emlData, String mailbox) {
        String objectKey = ObjectKeyUtil.buildObjectKey(mailbox);
        if (emlData == null || emlData.length == 0) {
            log.warn("No raw content to archive for {}", mailbox);
            return ArchiveResult.failed(new Failure(FailureKind.SIDE_CHANNEL, "archive", "empty message"));
        }
        try {
            blobStore.put(objectKey, emlData, EML_CONTENT_TYPE);
            log.debug("EML archived: {}", objectKey);
            return ArchiveResult.stored(objectKey);
        } catch (IOException | RuntimeException e) {
            log.warn("Blob write failed for {} ({}), recording message without archive: {}",
                    mailbox, objectKey, e.getMessage());
            return ArchiveResult.failed(Failure.of(FailureKind.SIDE_CHANNEL, "archive", e));
        }
    }

    /**
     * Insert the message metadata row
     */
    public Message record(long mailboxId, String sender, String toAddrs, String subject,
                          MailContent content, ArchiveResult archive) {
        Message message = Message.builder()
                .mailboxId(mailboxId)
                .sender(sender == null ? "" : sender)
                .toAddrs(toAddrs == null ? "" : toAddrs)
                .subject(subject == null || subject.isBlank() ? properties.getSubjectPlaceholder() : subject)
                .verificationCode(emptyToNull(content.verificationCode()))
                .preview(emptyToNull(content.preview()))
                .bucket(properties.getStorage().getBucket())
                .objectKey(archive.objectKey() == null ? "" : archive.objectKey())
                .build();
        messageMapper.insert(message);
        return message;
    }

    private static String emptyToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }
}
