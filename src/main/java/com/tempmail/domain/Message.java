package com.tempmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Received message metadata
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private Long id;
    private Long mailboxId;
    private String sender;
    private String toAddrs;         // Envelope recipients joined by ','
    private String subject;
    private String verificationCode;
    private String preview;
    private String bucket;
    private String objectKey;       // Empty when archiving failed
    private String receivedAt;
}
