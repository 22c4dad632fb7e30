package com.calibrationplatform.common.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The complete universe of questions, dimensions and policy areas a plan may address.
 * Anti-universality is checked against this set.
 */
public record ContextDomain(
    @JsonProperty("questions")     List<String> questions,
    @JsonProperty("dimensions")    List<String> dimensions,
    @JsonProperty("policy_areas")  List<String> policyAreas
) {
    public ContextDomain {
        questions   = questions == null ? List.of() : List.copyOf(questions);
        dimensions  = dimensions == null ? List.of() : List.copyOf(dimensions);
        policyAreas = policyAreas == null ? List.of() : List.copyOf(policyAreas);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return questions.isEmpty() && dimensions.isEmpty() && policyAreas.isEmpty();
    }
}
