package com.yoursp.emailconnections.modules.connections.dto;

import java.util.List;

public record ConnectionListResponse(
        List<ConnectionResponse> connections,
        int total,
        long activeCount,
        long expiredCount,
        long errorCount) {
}
