package com.tempmail.service;

import com.tempmail.domain.EnvelopeRecipient;
import com.tempmail.domain.Failure;
import com.tempmail.domain.FailureKind;
import com.tempmail.domain.InboundMail;
import com.tempmail.domain.MailContent;
import com.tempmail.service.MessageArchiveService.ArchiveResult;
import com.tempmail.util.AddressUtil;
import com.tempmail.util.EmlParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Inbound message ingestion
 * - Resolve the canonical recipient and sender
 * - Dispatch forwarding in the background
 * - Extract bodies, preview and verification code
 * - Find or create the owning mailbox
 * - Archive the raw EML, then record the metadata row
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MessageService {

    private final MailboxService mailboxService;
    private final MessageArchiveService archiveService;
    private final ForwardingService forwardingService;

    /**
     * Process one inbound message, once per distinct envelope recipient (the "To" header when the
     * envelope is absent). Never throws; each result carries its outcome and failure kinds.
     */
    public List<IngestResult> processIncomingMail(InboundMail mail) {
        EnvelopeRecipient envelope = mail.getEnvelope();
        if (envelope.kind() != EnvelopeRecipient.Kind.MANY) {
            return List.of(processForRecipient(mail, envelope));
        }

        // Deduplicated on the canonical address, first spelling kept
        Map<String, String> uniqueRecipients = new LinkedHashMap<>();
        for (String rcpt : envelope.addresses()) {
            String key = AddressUtil.extractEmail(rcpt).toLowerCase(Locale.ROOT);
            uniqueRecipients.putIfAbsent(key.isEmpty() ? rcpt.trim() : key, rcpt);
        }

        List<IngestResult> results = new ArrayList<>();
        for (String rcpt : uniqueRecipients.values()) {
            results.add(processForRecipient(mail, EnvelopeRecipient.single(rcpt)));
        }
        return results;
    }

    /**
     * Run the pipeline for one recipient. The recorded recipient list is always the full envelope.
     */
    IngestResult processForRecipient(InboundMail mail, EnvelopeRecipient recipientEnvelope) {
        List<Failure> failures = new ArrayList<>();
        CompletableFuture<Optional<Failure>> forwarding = null;

        try {
            String toHeader = mail.header("To");
            String fromHeader = mail.header("From");
            String subject = mail.subject();

            String resolved = AddressUtil.resolveRecipient(recipientEnvelope, toHeader);
            String recipient = AddressUtil.canonicalRecipient(recipientEnvelope, toHeader);
            if (recipient.isEmpty()) {
                failures.add(new Failure(FailureKind.PARSING, "address", "no recipient address in '" + resolved + "'"));
            }

            forwarding = forwardingService.dispatch(mail, recipient);

            MailContent content = EmlParser.extractContent(mail.getRaw(), subject);
            if (content.parseFailed()) {
                failures.add(new Failure(FailureKind.PARSING, "content", "MIME body unreadable"));
            }

            String sender = AddressUtil.extractEmail(fromHeader);
            if (sender.isEmpty()) {
                sender = AddressUtil.extractEmail(mail.getEnvelopeSender());
            }

            long mailboxId = mailboxService.resolveMailboxId(recipient);

            ArchiveResult archive = archiveService.archive(mail.getRaw(), recipient);
            if (!archive.isStored()) {
                failures.add(archive.failure());
            }

            String toAddrs = AddressUtil.joinRecipients(mail.getEnvelope(), toHeader);
            archiveService.record(mailboxId, sender, toAddrs, subject, content, archive);

            log.info("Mail recorded: mailbox={}, from={}, key={}, code={}",
                    recipient, sender, archive.objectKey(), content.hasVerificationCode());
            return IngestResult.recorded(mailboxId, archive.objectKey(), failures, forwarding);

        } catch (MailboxResolutionException e) {
            log.error("Mail dropped, {}", e.getMessage());
            failures.add(Failure.of(FailureKind.RESOLUTION, "mailbox", e));
            return IngestResult.rejected(failures, forwarding);
        } catch (DataAccessException e) {
            log.error("Mail dropped, datastore unavailable", e);
            failures.add(Failure.of(FailureKind.INFRASTRUCTURE, "datastore", e));
            return IngestResult.rejected(failures, forwarding);
        }
    }
}
