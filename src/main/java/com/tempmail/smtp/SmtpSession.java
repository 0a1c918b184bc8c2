package com.tempmail.smtp;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * SMTP session context
 * State for a single inbound SMTP connection
 */
@Data
public class SmtpSession {

    private SmtpState state = SmtpState.CONNECTED;
    private String clientHostname;
    private String remoteIp;

    // Mail transaction
    private String mailFrom;
    private List<String> recipients = new ArrayList<>();
    private StringBuilder dataBuffer = new StringBuilder();
    private boolean dataOverflow = false;

    /**
     * Reset mail transaction (RSET)
     */
    public void resetTransaction() {
        this.mailFrom = null;
        this.recipients.clear();
        this.dataBuffer = new StringBuilder();
        this.dataOverflow = false;
        if (state != SmtpState.CONNECTED) {
            state = SmtpState.GREETED;
        }
    }

    /**
     * Add recipient (ignores a repeated RCPT TO for the same address)
     */
    public void addRecipient(String recipient) {
        if (!recipients.contains(recipient)) {
            this.recipients.add(recipient);
        }
    }

    /**
     * Append a line to the DATA buffer
     */
    public void appendData(String line) {
        dataBuffer.append(line).append("\r\n");
    }

    /**
     * Return raw DATA bytes, as received on the wire
     */
    public byte[] getDataBytes() {
        return dataBuffer.toString().getBytes(SmtpServerInitializer.WIRE_CHARSET);
    }
}
