package com.tempmail.smtp;

import com.tempmail.config.ServerProperties;
import com.tempmail.queue.MailQueueProducer;
import io.micrometer.core.instrument.MeterRegistry;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.logging.LogLevel;
import io.netty.handler.logging.LoggingHandler;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Netty-based inbound SMTP receiver
 * - RFC 5321 ESMTP subset for receiving mail (no AUTH, no relaying)
 * - Accepts recipients in the configured mail domains only
 * - Pipelining
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SmtpServer {

    private final ServerProperties properties;
    private final MailQueueProducer queueProducer;
    private final MeterRegistry meterRegistry;

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    @PostConstruct
    public void start() {
        Mono.fromRunnable(this::startServer)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(ignored -> { }, e -> log.error("SMTP receiver failed to start", e));
    }

    private void startServer() {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();

        try {
            ServerBootstrap bootstrap = new ServerBootstrap();
            bootstrap.group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new LoggingHandler(LogLevel.INFO))
                    .childHandler(new SmtpServerInitializer(properties, queueProducer, meterRegistry))
                    .option(ChannelOption.SO_BACKLOG, 128)
                    .childOption(ChannelOption.SO_KEEPALIVE, true)
                    .childOption(ChannelOption.TCP_NODELAY, true);

            serverChannel = bootstrap.bind(properties.getSmtp().getPort()).sync().channel();
            log.info("=== SMTP receiver started on port {} (domains: {}) ===",
                    properties.getSmtp().getPort(), properties.getDomainList());

            serverChannel.closeFuture().addListener(future -> log.info("SMTP receiver channel closed"));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("SMTP receiver start interrupted", e);
        }
    }

    @PreDestroy
    public void stop() {
        log.info("Shutting down SMTP receiver...");
        if (serverChannel != null) {
            serverChannel.close();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
    }
}
