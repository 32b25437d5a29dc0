package com.eainde.dealflow.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.eainde.dealflow.util.NullSafe;

import java.io.Serializable;
import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceEstimate(
        @JsonProperty("team_size") String teamSize,
        @JsonProperty("duration")  String duration,
        @JsonProperty("key_roles") List<String> keyRoles
) implements Serializable {

    public ResourceEstimate {
        keyRoles = NullSafe.list(keyRoles);
    }

    public static ResourceEstimate empty() {
        return new ResourceEstimate(null, null, List.of());
    }
}
