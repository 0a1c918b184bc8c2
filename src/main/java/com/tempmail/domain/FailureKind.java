package com.tempmail.domain;

/**
 * Kind of a failure recovered or reported while handling one message or one sweep tick
 */
public enum FailureKind {
    /** Datastore or blob store unreachable - aborts the current invocation */
    INFRASTRUCTURE,
    /** Malformed address or MIME body - recovered with empty/default values */
    PARSING,
    /** No mailbox identifier could be derived - the message is not recorded */
    RESOLUTION,
    /** Forwarding, blob write or blob delete failed - logged and ignored */
    SIDE_CHANNEL
}
