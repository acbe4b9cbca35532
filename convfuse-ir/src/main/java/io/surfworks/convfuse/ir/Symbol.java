package io.surfworks.convfuse.ir;

import java.util.Objects;

/**
 * Qualified operator identifier such as {@code aten::conv2d}.
 *
 * @param namespace the operator namespace ({@code aten}, {@code prim}, ...)
 * @param name      the unqualified operator name
 */
public record Symbol(String namespace, String name) {

    public Symbol {
        Objects.requireNonNull(namespace, "namespace cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        if (namespace.isEmpty() || name.isEmpty()) {
            throw new IllegalArgumentException("Symbol parts cannot be empty: " + namespace + "::" + name);
        }
    }

    /**
     * Parses a qualified string of the form {@code namespace::name}.
     *
     * @param qualified the qualified operator string
     * @return the symbol
     * @throws IllegalArgumentException if the string has no {@code ::} separator
     */
    public static Symbol fromQualString(String qualified) {
        int sep = qualified.indexOf("::");
        if (sep <= 0 || sep + 2 >= qualified.length()) {
            throw new IllegalArgumentException("Not a qualified symbol: " + qualified);
        }
        return new Symbol(qualified.substring(0, sep), qualified.substring(sep + 2));
    }

    public static Symbol aten(String name) {
        return new Symbol("aten", name);
    }

    public static Symbol prim(String name) {
        return new Symbol("prim", name);
    }

    public String toQualString() {
        return namespace + "::" + name;
    }

    @Override
    public String toString() {
        return toQualString();
    }
}
