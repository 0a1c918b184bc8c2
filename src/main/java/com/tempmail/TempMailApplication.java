package com.tempmail;

import org.mybatis.spring.annotation.MapperScan;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * TempMail disposable mailbox backend
 *
 * - Netty-based inbound SMTP receiver
 * - ActiveMQ inbound queue
 * - MyBatis + SQLite mailbox/message metadata
 * - Filesystem EML archive
 * - Scheduled expiry of old mailboxes
 */
@SpringBootApplication
@MapperScan("com.tempmail.mapper")
@EnableConfigurationProperties
@EnableScheduling
public class TempMailApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempMailApplication.class, args);
    }
}
