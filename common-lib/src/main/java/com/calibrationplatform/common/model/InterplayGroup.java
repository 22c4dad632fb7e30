package com.calibrationplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * A set of methods whose outputs are fused into one target output.
 *
 * @param fusionRule     declared fusion rule, {@code null} when none is declared
 * @param providedInputs inputs actually available to the fusion step
 */
public record InterplayGroup(
    @JsonProperty("group_id")        String groupId,
    @JsonProperty("members")         List<String> memberMethodIds,
    @JsonProperty("target_output")   String targetOutput,
    @JsonProperty("fusion_rule")     String fusionRule,
    @JsonProperty("provided_inputs") Set<String> providedInputs
) {
    public InterplayGroup {
        memberMethodIds = memberMethodIds == null ? List.of() : List.copyOf(memberMethodIds);
        providedInputs  = providedInputs == null ? Set.of()
            : Collections.unmodifiableSortedSet(new TreeSet<>(providedInputs));
    }
}
