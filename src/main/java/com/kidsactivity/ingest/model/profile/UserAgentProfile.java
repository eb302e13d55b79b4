package com.kidsactivity.ingest.model.profile;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Desktop browser fingerprint applied to a pooled session's context.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserAgentProfile {
    private String id;
    private String userAgent;
    private ViewPort viewport;
    private String platform;
    private String locale;
    private String timeZone;
    private Map<String, String> headers;
}
