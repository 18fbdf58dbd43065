package com.spendguard.core.model;

import java.util.Objects;

/**
 * Identifies a subject of enforcement, e.g. {@code user:42} or {@code project:search}.
 */
public final class BudgetScope {

    private final ScopeType type;
    private final String id;

    public BudgetScope(ScopeType type, String id) {
        this.type = Objects.requireNonNull(type, "type");
        this.id = Objects.requireNonNull(id, "id");
    }

    public static BudgetScope user(String id) {
        return new BudgetScope(ScopeType.USER, id);
    }

    public static BudgetScope project(String id) {
        return new BudgetScope(ScopeType.PROJECT, id);
    }

    public static BudgetScope organization(String id) {
        return new BudgetScope(ScopeType.ORGANIZATION, id);
    }

    /**
     * Parses the {@link #key()} form, e.g. {@code user:42}.
     *
     * @throws IllegalArgumentException if the type is unknown or the id is missing
     */
    public static BudgetScope parse(String key) {
        int sep = key.indexOf(':');
        if (sep <= 0 || sep == key.length() - 1)
            throw new IllegalArgumentException("Expected <type>:<id>, got '" + key + "'");
        ScopeType type = ScopeType.valueOf(key.substring(0, sep).trim().toUpperCase());
        return new BudgetScope(type, key.substring(sep + 1).trim());
    }

    public ScopeType getType() {
        return type;
    }

    public String getId() {
        return id;
    }

    /** Stable string form used in store and cache keys. */
    public String key() {
        return type.name().toLowerCase() + ":" + id;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof BudgetScope))
            return false;
        BudgetScope that = (BudgetScope) o;
        return type == that.type && id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, id);
    }

    @Override
    public String toString() {
        return key();
    }
}
