package com.tempmail.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Disposable mailbox entity
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Mailbox {

    private Long id;
    private String address;         // Lowercase local_part@domain
    private String localPart;
    private String domain;
    private String passwordHash;
    private String forwardTo;       // Mailbox-level forwarding target
    private String createdAt;       // Drives retention
    private String lastAccessedAt;
    private int isPinned;
    private int isFavorite;
}
