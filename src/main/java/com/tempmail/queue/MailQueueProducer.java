package com.tempmail.queue;

import com.tempmail.config.ServerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.core.JmsTemplate;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Puts mail accepted by the SMTP receiver on the inbound queue
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MailQueueProducer {

    static final String SENDER = "sender";
    static final String RECIPIENTS = "recipients";

    private final JmsTemplate jmsTemplate;
    private final ServerProperties properties;

    public void enqueueInbound(byte[] emlData, String sender, List<String> recipients) {
        String destination = properties.getQueue().getInboundDestination();
        jmsTemplate.send(destination, session -> {
            var message = session.createBytesMessage();
            message.writeBytes(emlData);
            message.setStringProperty(SENDER, sender == null ? "" : sender);
            message.setStringProperty(RECIPIENTS, String.join(",", recipients));
            return message;
        });
        log.info("Mail enqueued to inbound: {} -> {}", sender, recipients);
    }
}
