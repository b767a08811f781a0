package com.yoursp.emailconnections.modules.connections.dto;

import java.util.List;

public record BulkConnectionStatus(
        long total,
        long active,
        long expired,
        long error,
        List<ConnectionStatusSummary> connections) {
}
