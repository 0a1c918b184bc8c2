package com.tempmail.service;

import com.tempmail.config.ForwardRules;
import com.tempmail.domain.Failure;
import com.tempmail.domain.InboundMail;
import com.tempmail.forward.MailForwarder;
import com.tempmail.util.AddressUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Forwarding decision for one inbound message.
 * A mailbox-level target takes precedence over the local-part rule table; exactly one of the two
 * is dispatched, in the background.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForwardingService {

    static final String MAILBOX_FORWARD = "forward:mailbox";
    static final String LOCAL_PART_FORWARD = "forward:local-part";

    private final MailboxService mailboxService;
    private final MailForwarder forwarder;
    private final BackgroundTasks backgroundTasks;
    private final ForwardRules forwardRules;

    public CompletableFuture<Optional<Failure>> dispatch(InboundMail mail, String recipient) {
        String target = mailboxService.getForwardTarget(recipient);
        if (target != null) {
            log.debug("Forwarding mail for {} to mailbox target {}", recipient, target);
            return backgroundTasks.submit(MAILBOX_FORWARD, () -> forwarder.forwardToTarget(mail, target));
        }

        String localPart = AddressUtil.localPart(recipient);
        return backgroundTasks.submit(LOCAL_PART_FORWARD,
                () -> forwarder.forwardByLocalPart(mail, localPart, forwardRules));
    }
}
