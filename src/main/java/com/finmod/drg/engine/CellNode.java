package com.finmod.drg.engine;

import com.finmod.drg.formula.CellAddress;
import com.finmod.drg.formula.ParsedFormula;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A cell in the dependency graph.
 *
 * <p>
 * A node is either a literal (no formula) or a computed cell (formula
 * present). Edges are kept on both ends: if this node lists {@code X} in
 * {@link #dependencies()}, then {@code X} lists this node in
 * {@link #dependents()}, and vice versa. Literal nodes never have
 * dependencies.
 *
 * <p>
 * Edge sets are only written while a {@link DependencyGraph} is being
 * committed; afterwards the only mutable field is {@link #level()}, written by
 * {@link LevelAssigner}.
 */
public final class CellNode {
    private final CellAddress address;
    private final String fullAddress;
    private final String formula;
    private final Object value;
    private final ParsedFormula parsed;

    private final Set<String> dependencies = new LinkedHashSet<>();
    private final Set<String> dependents = new LinkedHashSet<>();
    private int level;

    public CellNode(CellAddress address, String formula, Object value, ParsedFormula parsed) {
        this.address = Objects.requireNonNull(address, "address");
        this.fullAddress = address.fullAddress();
        this.formula = formula;
        this.value = value;
        this.parsed = parsed;
        if (formula == null && parsed != null)
            throw new IllegalArgumentException("Parsed formula given for literal cell " + fullAddress);
    }

    /** Creates a literal cell. */
    public static CellNode literal(CellAddress address, Object value) {
        return new CellNode(address, null, value, null);
    }

    public CellAddress address() {
        return address;
    }

    /** Canonical {@code Sheet!A1} key. */
    public String fullAddress() {
        return fullAddress;
    }

    public String sheet() {
        return address.sheet();
    }

    /** Formula text as supplied, or null for a literal cell. */
    public String formula() {
        return formula;
    }

    /** Literal (or cached) value; may be null. */
    public Object value() {
        return value;
    }

    /** Parse result for formula cells, null for literals. */
    public ParsedFormula parsed() {
        return parsed;
    }

    public boolean hasFormula() {
        return formula != null;
    }

    /** Addresses this cell reads. Read-only view. */
    public Set<String> dependencies() {
        return Collections.unmodifiableSet(dependencies);
    }

    /** Addresses that read this cell. Read-only view. */
    public Set<String> dependents() {
        return Collections.unmodifiableSet(dependents);
    }

    /** Topological level; 0 until levels have been assigned. */
    public int level() {
        return level;
    }

    void addDependency(String fullAddress) {
        if (formula == null)
            throw new IllegalStateException("Literal cell " + this.fullAddress + " cannot depend on " + fullAddress);
        dependencies.add(fullAddress);
    }

    void addDependent(String fullAddress) {
        dependents.add(fullAddress);
    }

    void setLevel(int level) {
        this.level = level;
    }

    @Override
    public String toString() {
        return formula != null
                ? fullAddress + " = " + formula + " [L" + level + "]"
                : fullAddress + " : " + value;
    }
}
