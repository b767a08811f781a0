package com.yoursp.emailconnections.modules.connections.dto;

import java.util.Map;

/**
 * Deletion-safety check: how many downstream records depend on a connection.
 */
public record ConnectionUsage(
        Long connectionId,
        Map<String, Long> relatedRecords,
        long relatedCount,
        boolean canDelete) {
}
