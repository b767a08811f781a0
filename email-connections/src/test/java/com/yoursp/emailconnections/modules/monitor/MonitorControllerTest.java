package com.yoursp.emailconnections.modules.monitor;

import com.yoursp.emailconnections.modules.monitor.dto.MonitorStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MonitorControllerTest {

    @Mock
    private ObjectProvider<ConnectionHealthMonitor> monitorProvider;

    @Mock
    private ConnectionHealthMonitor monitor;

    @Test
    void reportsRunningMonitor() {
        MonitorStatus running = new MonitorStatus(true, new MonitorStatus.Stats(null, 3, 1, 0, 0), List.of());
        when(monitorProvider.getIfAvailable()).thenReturn(monitor);
        when(monitor.getStatus()).thenReturn(running);

        MonitorStatus status = new MonitorController(monitorProvider).status().getBody();

        assertTrue(status.running());
        assertEquals(3, status.stats().connectionsChecked());
    }

    @Test
    void reportsStoppedWhenMonitorDisabled() {
        when(monitorProvider.getIfAvailable()).thenReturn(null);

        MonitorStatus status = new MonitorController(monitorProvider).status().getBody();

        assertFalse(status.running());
        assertTrue(status.jobs().isEmpty());
    }
}
