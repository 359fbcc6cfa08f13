package com.bluxguard.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class NetworkPolicy {

    /**
     * restricted | open | none
     */
    @JsonProperty("egress")
    String egress;

    @JsonProperty("allowed_hosts")
    List<String> allowedHosts;
}
