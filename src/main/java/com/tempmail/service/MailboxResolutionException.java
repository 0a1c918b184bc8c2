package com.tempmail.service;

/**
 * No mailbox identifier could be found or created for an address
 */
public class MailboxResolutionException extends RuntimeException {

    private final String address;

    public MailboxResolutionException(String address) {
        super("Cannot resolve or create mailbox for address '" + address + "'");
        this.address = address;
    }

    public String getAddress() {
        return address;
    }
}
