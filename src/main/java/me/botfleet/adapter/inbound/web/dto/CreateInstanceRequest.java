package me.botfleet.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateInstanceRequest {
    private String id;
    private String displayName;
    private String templateId;
    private String credentialRef;
    private String personalityOverride;
    private boolean autoStart;
}
