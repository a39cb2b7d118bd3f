package me.botfleet.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Credential as exposed by the API. The token itself is never included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CredentialDto {
    private String id;
    private String name;
    private boolean active;
    private boolean hasToken;
    private Instant createdAt;
}
