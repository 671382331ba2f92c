package com.residualcarbon.analysis.models;

import java.util.Comparator;
import java.util.Objects;

/**
 * One scored input layer: a soil property, optionally at a named depth band such as "b0" (surface) or "b10".
 */
public class Layer implements Comparable<Layer> {

    private static final Comparator<Layer> ORDER = Comparator
            .comparing((Layer l) -> l.property)
            .thenComparing(l -> l.depth, Comparator.nullsFirst(Comparator.naturalOrder()));

    public final SoilProperty property;

    /** Null when the property has a single layer. */
    public final String depth;

    public Layer (SoilProperty property, String depth) {
        this.property = Objects.requireNonNull(property);
        this.depth = depth;
    }

    public static Layer of (SoilProperty property) {
        return new Layer(property, null);
    }

    public static Layer parse (String name) {
        for (SoilProperty property : SoilProperty.values()) {
            if (name.equals(property.key)) return new Layer(property, null);
            if (name.startsWith(property.key + "_")) {
                return new Layer(property, name.substring(property.key.length() + 1));
            }
        }
        throw new IllegalArgumentException("Not a layer name: " + name);
    }

    public String name () {
        return depth == null ? property.key : property.key + "_" + depth;
    }

    @Override
    public int compareTo (Layer other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals (Object other) {
        if (!(other instanceof Layer)) return false;
        Layer o = (Layer) other;
        return property == o.property && Objects.equals(depth, o.depth);
    }

    @Override
    public int hashCode () {
        return Objects.hash(property, depth);
    }

    @Override
    public String toString () {
        return name();
    }
}
