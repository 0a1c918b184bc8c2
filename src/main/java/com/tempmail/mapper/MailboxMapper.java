package com.tempmail.mapper;

import com.tempmail.domain.Mailbox;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

@Mapper
public interface MailboxMapper {

    int insertIfAbsent(@Param("address") String address,
                       @Param("localPart") String localPart,
                       @Param("domain") String domain);

    Mailbox findByAddress(@Param("address") String address);

    Long findIdByAddress(@Param("address") String address);

    String findForwardTarget(@Param("address") String address);

    int updateForwardTarget(@Param("address") String address, @Param("forwardTo") String forwardTo);

    int updatePinned(@Param("address") String address, @Param("pinned") int pinned);

    int updateFavorite(@Param("address") String address, @Param("favorite") int favorite);

    int touch(@Param("address") String address);

    /**
     * Delete mailboxes created at least {@code minutes} ago, except pinned or favorited ones
     */
    int deleteExpired(@Param("minutes") int minutes);
}
