package com.yoursp.emailconnections.modules.monitor.dto;

import java.time.OffsetDateTime;
import java.util.List;

public record MonitorStatus(
        boolean running,
        Stats stats,
        List<Job> jobs) {

    public record Stats(
            OffsetDateTime lastHealthCheck,
            long connectionsChecked,
            long tokensRefreshed,
            long errorsDetected,
            long connectionsRecovered) {
    }

    public record Job(
            String id,
            String name,
            String schedule) {
    }

    public static MonitorStatus stopped() {
        return new MonitorStatus(false, new Stats(null, 0, 0, 0, 0), List.of());
    }
}
