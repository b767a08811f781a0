package com.yoursp.emailconnections.modules.connections;

/**
 * Contributed by any module that stores records derived from a connection's
 * mailbox (harvested messages, attachments). A connection with related records
 * is archived instead of deleted.
 */
public interface ConnectionUsageProvider {

    /** Label reported in the usage breakdown, e.g. {@code stored_emails}. */
    String recordType();

    long countRelated(Long connectionId);
}
