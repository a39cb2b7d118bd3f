package me.botfleet.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateRequest {
    private String id;
    private String name;
    private String description;
    private String personality;

    @Builder.Default
    private boolean loadEmbedder = true;

    @Builder.Default
    private Map<String, Boolean> features = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, String> settings = new LinkedHashMap<>();
}
