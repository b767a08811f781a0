package com.yoursp.emailconnections.modules.oauth.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class OAuthInitiateRequest {

    @Pattern(regexp = "gmail", message = "only gmail is supported")
    private String provider = "gmail";

    @Pattern(regexp = "^https?://.+", message = "must be an absolute http(s) URL")
    private String redirectUri;

    @Size(max = 20)
    private List<String> scopes;
}
