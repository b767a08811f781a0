package com.yoursp.emailconnections.modules.connections.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConnectionUpdateRequest {

    @Size(min = 1, max = 255)
    private String connectionName;

    @Pattern(regexp = "active|expired|error|revoked", message = "must be one of active, expired, error, revoked")
    private String connectionStatus;
}
