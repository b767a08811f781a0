package com.yoursp.emailconnections.modules.connections.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record ConnectionTestResponse(
        Long connectionId,
        boolean healthy,
        String emailAddress,
        List<String> scopesGranted,
        boolean canReadMail,
        OffsetDateTime testedAt) {
}
