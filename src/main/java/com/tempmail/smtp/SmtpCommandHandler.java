package com.tempmail.smtp;

import com.tempmail.config.ServerProperties;
import com.tempmail.queue.MailQueueProducer;
import com.tempmail.util.AddressUtil;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.timeout.IdleStateEvent;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.util.ArrayList;
import java.util.List;

/**
 * Netty-based inbound SMTP command handler.
 * Accepts mail for the configured domains and hands it to the inbound queue; the client gets
 * 250 as soon as the message is queued, whatever happens during ingestion.
 */
@Slf4j
public class SmtpCommandHandler extends SimpleChannelInboundHandler<String> {

    private final SmtpSession session = new SmtpSession();
    private final ServerProperties properties;
    private final MailQueueProducer queueProducer;
    private final Counter mailReceivedCounter;
    private final Counter rcptRejectedCounter;

    public SmtpCommandHandler(ServerProperties properties,
            MailQueueProducer queueProducer,
            MeterRegistry meterRegistry) {
        this.properties = properties;
        this.queueProducer = queueProducer;
        this.mailReceivedCounter = Counter.builder("smtp.mail.received")
                .description("Number of mails received")
                .register(meterRegistry);
        this.rcptRejectedCounter = Counter.builder("smtp.rcpt.rejected")
                .description("Recipients rejected for a foreign domain")
                .register(meterRegistry);
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) {
        session.setRemoteIp(remoteIp(ctx.channel().remoteAddress()));
        log.info("SMTP connection from: {}", session.getRemoteIp());
        respond(ctx, "220 " + properties.getHostname() + " " + properties.getSmtp().getBanner());
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, String msg) {
        // DATA state: preserve original line content (RFC 5321 - no trimming)
        if (session.getState() == SmtpState.DATA) {
            handleDataLine(ctx, msg);
            return;
        }

        String line = msg.trim();
        log.debug("SMTP << {}", line);

        String upperLine = line.toUpperCase();
        if (upperLine.startsWith("EHLO") || upperLine.startsWith("HELO")) {
            handleEhlo(ctx, line);
        } else if (upperLine.startsWith("MAIL FROM:")) {
            handleMailFrom(ctx, line);
        } else if (upperLine.startsWith("RCPT TO:")) {
            handleRcptTo(ctx, line);
        } else if (upperLine.equals("DATA")) {
            handleData(ctx);
        } else if (upperLine.equals("RSET")) {
            session.resetTransaction();
            respond(ctx, "250 2.0.0 OK");
        } else if (upperLine.equals("NOOP")) {
            respond(ctx, "250 2.0.0 OK");
        } else if (upperLine.startsWith("VRFY")) {
            respond(ctx, "252 2.5.2 Cannot VRFY user, but will accept message and attempt delivery");
        } else if (upperLine.equals("QUIT")) {
            respond(ctx, "221 2.0.0 " + properties.getHostname() + " closing connection");
            ctx.close();
        } else if (upperLine.startsWith("AUTH") || upperLine.equals("STARTTLS")) {
            respond(ctx, "502 5.5.1 Command not implemented");
        } else {
            respond(ctx, "500 5.5.1 Unrecognized command");
        }
    }

    // ======== EHLO / HELO ========
    private void handleEhlo(ChannelHandlerContext ctx, String line) {
        String[] parts = line.split("\\s+", 2);
        session.setClientHostname(parts.length > 1 ? parts[1] : "unknown");
        session.resetTransaction();
        session.setState(SmtpState.GREETED);

        if (line.toUpperCase().startsWith("EHLO")) {
            String hello = properties.getHostname() + " Hello " + session.getClientHostname();
            ctx.writeAndFlush("250-" + hello + "\r\n"
                    + "250-SIZE " + properties.getSmtp().getMaxMessageSize() + "\r\n"
                    + "250-8BITMIME\r\n"
                    + "250-PIPELINING\r\n"
                    + "250 ENHANCEDSTATUSCODES\r\n");
        } else {
            respond(ctx, "250 " + properties.getHostname() + " Hello " + session.getClientHostname());
        }
    }

    // ======== MAIL FROM ========
    private void handleMailFrom(ChannelHandlerContext ctx, String line) {
        if (session.getState() != SmtpState.GREETED) {
            respond(ctx, "503 5.5.1 Bad sequence of commands");
            return;
        }

        String from = extractAddress(line, "MAIL FROM:");
        if (from == null) {
            respond(ctx, "501 5.1.7 Syntax error in MAIL FROM address");
            return;
        }

        // Null reverse-path (<>) is allowed for bounces
        session.setMailFrom(AddressUtil.stripAngleBrackets(from));
        session.setState(SmtpState.MAIL_FROM);
        respond(ctx, "250 2.1.0 OK");
    }

    // ======== RCPT TO ========
    private void handleRcptTo(ChannelHandlerContext ctx, String line) {
        if (session.getState() != SmtpState.MAIL_FROM && session.getState() != SmtpState.RCPT_TO) {
            respond(ctx, "503 5.5.1 Bad sequence of commands");
            return;
        }

        if (session.getRecipients().size() >= properties.getSmtp().getMaxRecipients()) {
            respond(ctx, "452 4.5.3 Too many recipients");
            return;
        }

        String to = extractAddress(line, "RCPT TO:");
        String rcptEmail = to == null ? "" : AddressUtil.stripAngleBrackets(to);
        if (rcptEmail.indexOf('@') <= 0) {
            respond(ctx, "501 5.1.3 Syntax error in RCPT TO address");
            return;
        }

        if (!properties.isLocalDomain(AddressUtil.domain(rcptEmail))) {
            rcptRejectedCounter.increment();
            log.info("SMTP RCPT rejected for foreign domain: {} (from {})", rcptEmail, session.getRemoteIp());
            respond(ctx, "550 5.1.2 Domain not served here: " + AddressUtil.domain(rcptEmail));
            return;
        }

        session.addRecipient(rcptEmail);
        session.setState(SmtpState.RCPT_TO);
        respond(ctx, "250 2.1.5 OK");
    }

    // ======== DATA ========
    private void handleData(ChannelHandlerContext ctx) {
        if (session.getState() != SmtpState.RCPT_TO) {
            respond(ctx, "503 5.5.1 Bad sequence of commands");
            return;
        }
        session.setState(SmtpState.DATA);
        respond(ctx, "354 Start mail input; end with <CRLF>.<CRLF>");
    }

    private void handleDataLine(ChannelHandlerContext ctx, String rawLine) {
        // Strip trailing CR/LF but preserve leading whitespace (RFC 5321)
        String line = rawLine;
        while (line.endsWith("\r") || line.endsWith("\n")) {
            line = line.substring(0, line.length() - 1);
        }

        if (".".equals(line)) {
            if (session.isDataOverflow()) {
                respond(ctx, "552 5.3.4 Message too large");
                session.resetTransaction();
            } else {
                processReceivedMail(ctx);
            }
            return;
        }

        if (session.isDataOverflow()) {
            return;
        }
        // Remove byte-stuffing
        String dataLine = line.startsWith("..") ? line.substring(1) : line;
        session.appendData(dataLine);
        if (session.getDataBuffer().length() > properties.getSmtp().getMaxMessageSize()) {
            // Keep reading until the terminating dot, then reject
            session.setDataOverflow(true);
            session.setDataBuffer(new StringBuilder());
        }
    }

    private void processReceivedMail(ChannelHandlerContext ctx) {
        byte[] emlData = session.getDataBytes();
        List<String> recipients = new ArrayList<>(session.getRecipients());
        String sender = session.getMailFrom();
        try {
            queueProducer.enqueueInbound(emlData, sender, recipients);
            mailReceivedCounter.increment();
            respond(ctx, "250 2.0.0 OK: queued");
        } catch (RuntimeException e) {
            log.error("Failed to queue received mail from {}", sender, e);
            respond(ctx, "451 4.3.0 Mail processing error");
        } finally {
            session.resetTransaction();
        }
    }

    // ======== Utilities ========
    private void respond(ChannelHandlerContext ctx, String response) {
        log.debug("SMTP >> {}", response);
        ctx.writeAndFlush(response + "\r\n");
    }

    private String extractAddress(String line, String prefix) {
        int idx = line.toUpperCase().indexOf(prefix.toUpperCase());
        if (idx < 0)
            return null;
        String addr = line.substring(idx + prefix.length()).trim();
        // Strip optional SIZE= / BODY= parameters
        int spaceIdx = addr.indexOf(' ');
        if (spaceIdx > 0)
            addr = addr.substring(0, spaceIdx);
        return addr.isEmpty() ? null : addr;
    }

    private static String remoteIp(SocketAddress address) {
        if (address instanceof InetSocketAddress inet && inet.getAddress() != null) {
            return inet.getAddress().getHostAddress();
        }
        return String.valueOf(address);
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof IdleStateEvent) {
            log.debug("SMTP idle timeout for {}", session.getRemoteIp());
            respond(ctx, "421 4.4.2 " + properties.getHostname() + " Timeout, closing connection");
            ctx.close();
        } else {
            super.userEventTriggered(ctx, evt);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (cause instanceof IOException) {
            log.debug("SMTP connection reset from {}: {}", session.getRemoteIp(), cause.getMessage());
        } else {
            log.error("SMTP error from {}: {}", session.getRemoteIp(), cause.getMessage());
        }
        ctx.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) {
        log.info("SMTP connection closed: {}", session.getRemoteIp());
    }
}
