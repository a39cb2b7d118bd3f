package me.botfleet.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Partial update; omitted fields keep their value.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateInstanceRequest {
    private String displayName;
    private String templateId;
    private String credentialRef;
    private String personalityOverride;
    private Boolean autoStart;
}
