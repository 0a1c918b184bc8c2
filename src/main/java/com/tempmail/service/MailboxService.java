package com.tempmail.service;

import com.tempmail.domain.Mailbox;
import com.tempmail.mapper.MailboxMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Mailbox management service
 * - Idempotent find-or-create keyed on the lowercase address
 * - Mailbox-level forwarding target
 * - Pin / favorite flags (exempt from expiry)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MailboxService {

    private final MailboxMapper mailboxMapper;

    /**
     * Find or create the mailbox owning an address and return its id.
     * Never trusts its own insert: the id is always re-read, so a concurrent creator wins harmlessly.
     *
     * @throws MailboxResolutionException when the address has no usable local part or domain
     */
    public long resolveMailboxId(String address) {
        String canonical = normalize(address);

        Long id = mailboxMapper.findIdByAddress(canonical);
        if (id != null) {
            return id;
        }

        int at = canonical.indexOf('@');
        String localPart = at > 0 ? canonical.substring(0, at) : "";
        String domain = at > 0 ? canonical.substring(at + 1) : "";
        if (!localPart.isEmpty() && !domain.isEmpty() && domain.indexOf('@') < 0) {
            try {
                if (mailboxMapper.insertIfAbsent(canonical, localPart, domain) > 0) {
                    log.info("Mailbox created: {}", canonical);
                }
            } catch (DataIntegrityViolationException e) {
                log.debug("Mailbox {} inserted concurrently, re-resolving: {}", canonical, e.getMessage());
            }
            id = mailboxMapper.findIdByAddress(canonical);
        }

        if (id == null) {
            throw new MailboxResolutionException(canonical);
        }
        return id;
    }

    /**
     * Explicit provisioning (same path as lazy creation on first message)
     */
    public Mailbox provision(String address) {
        resolveMailboxId(address);
        return mailboxMapper.findByAddress(normalize(address));
    }

    public Mailbox findByAddress(String address) {
        return mailboxMapper.findByAddress(normalize(address));
    }

    /**
     * Mailbox-level forwarding target, or null when none is configured
     */
    public String getForwardTarget(String address) {
        String canonical = normalize(address);
        if (canonical.isEmpty()) {
            return null;
        }
        String target = mailboxMapper.findForwardTarget(canonical);
        return target == null || target.isBlank() ? null : target.trim();
    }

    public boolean setForwardTarget(String address, String target) {
        String value = target == null || target.isBlank() ? null : target.trim();
        boolean updated = mailboxMapper.updateForwardTarget(normalize(address), value) > 0;
        log.info("Forward target for {} set to {}: {}", address, value, updated);
        return updated;
    }

    public boolean setPinned(String address, boolean pinned) {
        return mailboxMapper.updatePinned(normalize(address), pinned ? 1 : 0) > 0;
    }

    public boolean setFavorite(String address, boolean favorite) {
        return mailboxMapper.updateFavorite(normalize(address), favorite ? 1 : 0) > 0;
    }

    /**
     * Record an access (does not affect retention, which runs from creation time)
     */
    public boolean touch(String address) {
        return mailboxMapper.touch(normalize(address)) > 0;
    }

    private static String normalize(String address) {
        return address == null ? "" : address.trim().toLowerCase(Locale.ROOT);
    }
}
