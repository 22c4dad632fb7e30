package com.calibrationplatform.common.evidence;

import com.calibrationplatform.common.exception.EvidenceException;
import com.calibrationplatform.common.model.CanonicalLayer;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-call evidence for the layers that need more than the subject itself.
 *
 * <p>Parts may be {@code null}. {@code missingFields} remembers which field made a part
 * unusable when it was built from partial input, so the error raised on access names
 * the field and not just the part.
 */
public record EvidenceBundle(
    @JsonProperty("chain")          ChainEvidence chain,
    @JsonProperty("unit")           UnitEvidence unit,
    @JsonProperty("meta")           MetaEvidence meta,
    @JsonProperty("missing_fields") Map<CanonicalLayer, String> missingFields
) {
    public EvidenceBundle {
        missingFields = missingFields == null || missingFields.isEmpty()
            ? Map.of() : Map.copyOf(new EnumMap<>(missingFields));
    }

    public static EvidenceBundle of(ChainEvidence chain, UnitEvidence unit, MetaEvidence meta) {
        return new EvidenceBundle(chain, unit, meta, Map.of());
    }

    public static EvidenceBundle empty() {
        return of(null, null, null);
    }

    /**
     * Builds a bundle from part factories, recording instead of throwing when a
     * part's constructor rejects a missing field.
     */
    public static EvidenceBundle collect(Supplier<ChainEvidence> chain,
                                         Supplier<UnitEvidence> unit,
                                         Supplier<MetaEvidence> meta) {
        Map<CanonicalLayer, String> missing = new EnumMap<>(CanonicalLayer.class);
        return new EvidenceBundle(
            attempt(chain, missing), attempt(unit, missing), attempt(meta, missing), missing);
    }

    private static <T> T attempt(Supplier<T> factory, Map<CanonicalLayer, String> missing) {
        if (factory == null) return null;
        try {
            return factory.get();
        } catch (EvidenceException e) {
            missing.put(e.getLayer(), e.getField());
            return null;
        }
    }

    public ChainEvidence requireChain() {
        if (chain == null) throw missing(CanonicalLayer.CHAIN, "chain");
        return chain;
    }

    public UnitEvidence requireUnit() {
        if (unit == null) throw missing(CanonicalLayer.UNIT, "unit");
        return unit;
    }

    public MetaEvidence requireMeta() {
        if (meta == null) throw missing(CanonicalLayer.META, "meta");
        return meta;
    }

    private EvidenceException missing(CanonicalLayer layer, String part) {
        return new EvidenceException(layer, missingFields.getOrDefault(layer, part));
    }
}
