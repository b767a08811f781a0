package com.yoursp.emailconnections.modules.monitor;

import com.yoursp.emailconnections.modules.monitor.dto.MonitorStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class MonitorController {

    private final ObjectProvider<ConnectionHealthMonitor> monitor;

    @GetMapping("/health/connections")
    public ResponseEntity<MonitorStatus> status() {
        ConnectionHealthMonitor healthMonitor = monitor.getIfAvailable();
        return ResponseEntity.ok(healthMonitor != null ? healthMonitor.getStatus() : MonitorStatus.stopped());
    }
}
