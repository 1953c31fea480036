package com.voucherpay.eventmodel;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Which {@link FeatureArea}s a request touched. Serialized as a map holding every area,
 * e.g. {@code {"social_security": false, "jobs": true, ...}}.
 */
public final class EmpowermentFeatureFlags {

    private static final EmpowermentFeatureFlags NONE = new EmpowermentFeatureFlags(EnumSet.noneOf(FeatureArea.class));

    private final Set<FeatureArea> touched;

    private EmpowermentFeatureFlags(EnumSet<FeatureArea> touched) {
        this.touched = Collections.unmodifiableSet(touched);
    }

    public static EmpowermentFeatureFlags none() {
        return NONE;
    }

    public static EmpowermentFeatureFlags of(Collection<FeatureArea> areas) {
        if (areas.isEmpty()) {
            return NONE;
        }
        return new EmpowermentFeatureFlags(EnumSet.copyOf(areas));
    }

    public static EmpowermentFeatureFlags of(FeatureArea first, FeatureArea... rest) {
        return new EmpowermentFeatureFlags(EnumSet.of(first, rest));
    }

    public boolean touched(FeatureArea area) {
        return touched.contains(area);
    }

    public boolean anyTouched() {
        return !touched.isEmpty();
    }

    /** Number of areas touched. */
    public int featuresAccessed() {
        return touched.size();
    }

    public Set<FeatureArea> areas() {
        return touched;
    }

    @JsonValue
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        for (FeatureArea area : FeatureArea.values()) {
            map.put(area.key(), touched.contains(area));
        }
        return map;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof EmpowermentFeatureFlags other && touched.equals(other.touched);
    }

    @Override
    public int hashCode() {
        return touched.hashCode();
    }

    @Override
    public String toString() {
        return "EmpowermentFeatureFlags" + touched;
    }
}
