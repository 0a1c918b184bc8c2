package com.tempmail.smtp;

import com.tempmail.config.ServerProperties;
import com.tempmail.queue.MailQueueProducer;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.socket.SocketChannel;
import io.netty.handler.codec.DelimiterBasedFrameDecoder;
import io.netty.handler.codec.Delimiters;
import io.netty.handler.codec.string.StringDecoder;
import io.netty.handler.codec.string.StringEncoder;
import io.netty.handler.timeout.IdleStateHandler;
import lombok.RequiredArgsConstructor;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * SMTP Netty channel initializer (line oriented, 8-bit transparent)
 */
@RequiredArgsConstructor
public class SmtpServerInitializer extends ChannelInitializer<SocketChannel> {

    private static final int MAX_LINE_LENGTH = 65536;

    /**
     * One char per octet, so 8BITMIME bodies in any charset reach the archive byte for byte
     */
    static final Charset WIRE_CHARSET = StandardCharsets.ISO_8859_1;

    private final ServerProperties properties;
    private final MailQueueProducer queueProducer;
    private final MeterRegistry meterRegistry;

    @Override
    protected void initChannel(SocketChannel ch) {
        initPipeline(ch.pipeline());
    }

    void initPipeline(ChannelPipeline pipeline) {

        pipeline.addLast("idleState", new IdleStateHandler(
                0, 0, properties.getSmtp().getTimeout(), TimeUnit.MILLISECONDS));

        pipeline.addLast("framer", new DelimiterBasedFrameDecoder(
                MAX_LINE_LENGTH, Delimiters.lineDelimiter()));
        pipeline.addLast("decoder", new StringDecoder(WIRE_CHARSET));
        pipeline.addLast("encoder", new StringEncoder(WIRE_CHARSET));

        pipeline.addLast("handler", new SmtpCommandHandler(properties, queueProducer, meterRegistry));
    }
}
