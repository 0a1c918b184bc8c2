package com.tempmail.mapper;

import com.tempmail.domain.Message;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface MessageMapper {

    void insert(Message message);

    List<Message> findByMailboxId(@Param("mailboxId") long mailboxId);

    int countByMailboxId(@Param("mailboxId") long mailboxId);

    /**
     * Non-empty object keys of messages whose mailbox has expired
     */
    List<String> findExpiredObjectKeys(@Param("minutes") int minutes);

    int deleteExpired(@Param("minutes") int minutes);
}
