package com.yoursp.emailconnections.modules.connections;

import com.yoursp.emailconnections.modules.connections.dto.BulkConnectionStatus;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionDeleteResponse;
import com.yoursp.emailconnections.modules.connections.dto.ConnectionListResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.oauth2.jwt.Jwt;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionControllerTest {

    @Mock
    private ConnectionService connectionService;

    private ConnectionController controller;
    private Jwt jwt;

    @BeforeEach
    void setUp() {
        controller = new ConnectionController(connectionService);
        jwt = Jwt.withTokenValue("token").header("alg", "HS256").subject("1").build();
    }

    @Test
    void listUsesTheTokenSubject() {
        ConnectionListResponse body = new ConnectionListResponse(List.of(), 0, 0, 0, 0);
        when(connectionService.list(1L, true)).thenReturn(body);

        ResponseEntity<ConnectionListResponse> response = controller.list(jwt, true);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertSame(body, response.getBody());
    }

    @Test
    void deleteReturnsOutcome() {
        ConnectionDeleteResponse body = new ConnectionDeleteResponse(7L, "u@x.com", true, false,
                "Connection archived due to 3 related records");
        when(connectionService.delete(7L, 1L)).thenReturn(body);

        ResponseEntity<ConnectionDeleteResponse> response = controller.delete(jwt, 7L);

        assertTrue(response.getBody().archived());
    }

    @Test
    void statusAggregatesForCaller() {
        when(connectionService.bulkStatus(1L)).thenReturn(new BulkConnectionStatus(1, 1, 0, 0, List.of()));

        assertEquals(1, controller.status(jwt).getBody().active());
        verify(connectionService).bulkStatus(1L);
        verifyNoMoreInteractions(connectionService);
    }
}
