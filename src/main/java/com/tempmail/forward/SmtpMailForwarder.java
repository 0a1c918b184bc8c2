package com.tempmail.forward;

import com.tempmail.config.ForwardRules;
import com.tempmail.config.ServerProperties;
import com.tempmail.domain.InboundMail;
import com.tempmail.util.AddressUtil;
import com.tempmail.util.DnsUtil;
import jakarta.mail.Address;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Optional;
import java.util.Properties;
import java.util.function.Function;

/**
 * SMTP forwarding with Jakarta Mail.
 * Uses the configured relay host, or the target domain's MX hosts when no relay is set.
 */
@Slf4j
@Component
public class SmtpMailForwarder implements MailForwarder {

    private static final int SMTP_PORT = 25;

    /**
     * Hosts to try in order, and the port they listen on
     */
    record Route(List<String> hosts, int port) {
    }

    private final ServerProperties properties;
    private final Function<String, List<String>> mxLookup;

    @Autowired
    public SmtpMailForwarder(ServerProperties properties) {
        this(properties, DnsUtil::lookupMx);
    }

    SmtpMailForwarder(ServerProperties properties, Function<String, List<String>> mxLookup) {
        this.properties = properties;
        this.mxLookup = mxLookup;
    }

    @Override
    public void forwardToTarget(InboundMail mail, String target) throws MessagingException {
        send(mail, target);
    }

    @Override
    public void forwardByLocalPart(InboundMail mail, String localPart, ForwardRules rules) throws MessagingException {
        Optional<String> target = rules.resolve(localPart);
        if (target.isEmpty()) {
            log.debug("No forward rule for local part '{}'", localPart);
            return;
        }
        send(mail, target.get());
    }

    Route route(String target) {
        String relayHost = properties.getForward().getRelayHost();
        if (relayHost != null && !relayHost.isBlank()) {
            return new Route(List.of(relayHost.trim()), properties.getForward().getRelayPort());
        }
        return new Route(mxLookup.apply(AddressUtil.domain(target)), SMTP_PORT);
    }

    private void send(InboundMail mail, String target) throws MessagingException {
        Route route = route(target);
        if (route.hosts().isEmpty()) {
            throw new MessagingException("No delivery host for forward target " + target);
        }

        MessagingException lastError = null;
        for (String host : route.hosts()) {
            try {
                deliver(mail, target, host, route.port());
                log.info("Mail forwarded to {} via {}", target, host);
                return;
            } catch (MessagingException e) {
                log.warn("Failed to forward to {} via {}: {}", target, host, e.getMessage());
                lastError = e;
            }
        }
        throw new MessagingException("All hosts failed for forward target " + target, lastError);
    }

    private void deliver(InboundMail mail, String target, String host, int port) throws MessagingException {
        Properties props = new Properties();
        props.put("mail.smtp.host", host);
        props.put("mail.smtp.port", String.valueOf(port));
        props.put("mail.smtp.connectiontimeout", "10000");
        props.put("mail.smtp.timeout", "30000");
        props.put("mail.smtp.writetimeout", "20000");
        props.put("mail.smtp.localhost", properties.getHostname());
        props.put("mail.smtp.starttls.enable", "true");
        props.put("mail.smtp.starttls.required", "false");
        if (!mail.getEnvelopeSender().isBlank()) {
            props.put("mail.smtp.from", mail.getEnvelopeSender());
        }

        Session session = Session.getInstance(props);
        MimeMessage message = new MimeMessage(session, new ByteArrayInputStream(mail.getRaw()));

        Transport transport = session.getTransport("smtp");
        try {
            transport.connect(host, port, null, null);
            transport.sendMessage(message, new Address[]{new InternetAddress(target)});
        } finally {
            transport.close();
        }
    }
}
