package com.tempmail.forward;

import com.tempmail.config.ForwardRules;
import com.tempmail.domain.InboundMail;
import jakarta.mail.MessagingException;

/**
 * Transport used to pass a copy of an inbound message on to another address
 */
public interface MailForwarder {

    /**
     * Forward to the target configured on the recipient's mailbox
     */
    void forwardToTarget(InboundMail mail, String target) throws MessagingException;

    /**
     * Forward according to the local-part rule table; does nothing when no rule matches
     */
    void forwardByLocalPart(InboundMail mail, String localPart, ForwardRules rules) throws MessagingException;
}
