package com.calibrationplatform.common.registry;

import com.calibrationplatform.common.exception.CalibrationConfigException;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Immutable lookup of declared methods by canonical method id.
 *
 * <p>Lookups accept aliases as well as canonical ids; see {@link #resolve(String)}.
 */
public final class MethodRegistry {

    private final Map<String, MethodDeclaration> declarations;

    public MethodRegistry(Collection<MethodDeclaration> declarations) {
        Map<String, MethodDeclaration> byId = new TreeMap<>();
        for (MethodDeclaration d : declarations) {
            if (byId.put(d.methodId(), d) != null) {
                throw new CalibrationConfigException("methods", "duplicate method id: " + d.methodId());
            }
        }
        this.declarations = Collections.unmodifiableMap(byId);
    }

    public Optional<MethodDeclaration> find(String methodId) {
        return Optional.ofNullable(declarations.get(resolve(methodId)));
    }

    public boolean isRegistered(String methodId) {
        return declarations.containsKey(resolve(methodId));
    }

    /**
     * Maps an identifier to its canonical {@code module.Class.method} form.
     *
     * <ol>
     *   <li>{@code ::} and {@code /} separators become dots; surrounding whitespace and dots are dropped.</li>
     *   <li>A declared id is returned as is.</li>
     *   <li>A bare class name ({@code PolicyContradictionDetector}) resolves to the only declared
     *       method of that class. With no match, or more than one, the normalized id is returned.</li>
     * </ol>
     */
    public String resolve(String methodId) {
        String normalized = normalize(methodId);
        if (declarations.containsKey(normalized) || normalized.indexOf('.') >= 0) return normalized;
        String match = null;
        for (String id : declarations.keySet()) {
            if (!normalized.equals(className(id))) continue;
            if (match != null) return normalized;
            match = id;
        }
        return match == null ? normalized : match;
    }

    static String normalize(String rawId) {
        String id = rawId.replace("::", ".").replace('/', '.').strip();
        int start = 0;
        int end = id.length();
        while (start < end && id.charAt(start) == '.') start++;
        while (end > start && id.charAt(end - 1) == '.') end--;
        return id.substring(start, end);
    }

    private static String className(String methodId) {
        int last = methodId.lastIndexOf('.');
        if (last <= 0) return methodId;
        int previous = methodId.lastIndexOf('.', last - 1);
        return methodId.substring(previous + 1, last);
    }

    /** Declarations sorted by method id. */
    public Collection<MethodDeclaration> all() {
        return declarations.values();
    }

    public int size() {
        return declarations.size();
    }
}
