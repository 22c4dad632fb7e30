package com.calibrationplatform.common.model;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The closed set of eight calibration layers.
 *
 * <p>The symbol ({@code @b}, {@code @chain}, ...) is only used at the JSON boundary;
 * everything inside the engine dispatches on the enum constant.
 * Declaration order is the canonical order used for traces, tie-breaks and certificate keys.
 */
public enum CanonicalLayer {

    BASE("@b"),
    CHAIN("@chain"),
    UNIT("@u"),
    QUESTION("@q"),
    DIMENSION("@d"),
    POLICY("@p"),
    CONGRUENCE("@C"),
    META("@m");

    private static final Map<String, CanonicalLayer> BY_SYMBOL = Arrays.stream(values())
        .collect(Collectors.toUnmodifiableMap(CanonicalLayer::symbol, Function.identity()));

    private final String symbol;

    CanonicalLayer(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** True for the three context-compatibility layers (@q, @d, @p). */
    public boolean isContextual() {
        return this == QUESTION || this == DIMENSION || this == POLICY;
    }

    /**
     * Resolves a layer from its symbol.
     *
     * @throws IllegalArgumentException for an unknown symbol
     */
    public static CanonicalLayer fromSymbol(String symbol) {
        CanonicalLayer layer = BY_SYMBOL.get(symbol);
        if (layer == null) {
            throw new IllegalArgumentException("Unknown layer symbol: " + symbol);
        }
        return layer;
    }
}
