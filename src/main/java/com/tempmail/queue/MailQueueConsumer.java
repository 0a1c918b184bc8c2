package com.tempmail.queue;

import com.tempmail.domain.EnvelopeRecipient;
import com.tempmail.domain.InboundMail;
import com.tempmail.service.IngestResult;
import com.tempmail.service.MessageService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.jms.BytesMessage;
import jakarta.jms.JMSException;
import jakarta.jms.Message;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jms.annotation.JmsListener;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/**
 * Inbound queue consumer: one ingestion per recipient of each queued message.
 * Ingestion outcomes never propagate back to the queue, so nothing is redelivered or bounced.
 */
@Slf4j
@Component
public class MailQueueConsumer {

    private final MessageService messageService;
    private final Counter recordedCounter;
    private final Counter failedCounter;

    public MailQueueConsumer(MessageService messageService, MeterRegistry meterRegistry) {
        this.messageService = messageService;
        this.recordedCounter = Counter.builder("mail.ingest.recorded")
                .description("Inbound message copies recorded, one per recipient")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("mail.ingest.failed")
                .description("Inbound message copies dropped, one per recipient")
                .register(meterRegistry);
    }

    @JmsListener(destination = "${tempmail.queue.inbound-destination:mail.inbound.queue}")
    public void processInbound(Message message) {
        try {
            if (!(message instanceof BytesMessage bytesMessage)) {
                log.warn("Unexpected message type in inbound queue");
                return;
            }

            byte[] emlData = new byte[(int) bytesMessage.getBodyLength()];
            bytesMessage.readBytes(emlData);

            String sender = bytesMessage.getStringProperty(MailQueueProducer.SENDER);
            String recipientsStr = bytesMessage.getStringProperty(MailQueueProducer.RECIPIENTS);

            InboundMail mail = InboundMail.of(emlData, sender, toEnvelope(recipientsStr));
            log.info("Processing inbound mail: {} -> {}", sender, recipientsStr);

            for (IngestResult result : messageService.processIncomingMail(mail)) {
                if (result.recorded()) {
                    recordedCounter.increment();
                } else {
                    failedCounter.increment();
                }
            }
        } catch (JMSException e) {
            log.error("Error reading inbound queue message", e);
            failedCounter.increment();
        }
    }

    static EnvelopeRecipient toEnvelope(String recipients) {
        if (recipients == null || recipients.isBlank()) {
            return EnvelopeRecipient.absent();
        }
        List<String> list = Arrays.stream(recipients.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
        return EnvelopeRecipient.many(list);
    }
}
