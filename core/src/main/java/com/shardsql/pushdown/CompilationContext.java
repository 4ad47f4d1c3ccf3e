package com.shardsql.pushdown;

import com.shardsql.expression.AttributeReference;
import com.shardsql.expression.ExprId;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Mutable state of one compilation.
 *
 * <p>Holds the synthetic field counter and the display names of renamed
 * columns. A context is created per {@link PushdownCompiler#compile} call and
 * never shared between compilations, so field names are unique within a tree
 * and compiling the same plan twice yields the same names.
 */
public final class CompilationContext {

    private final String fieldPrefix;
    private final Map<ExprId, String> displayNames = new HashMap<>();
    private int nextFieldId;

    public CompilationContext(String fieldPrefix) {
        this.fieldPrefix = Objects.requireNonNull(fieldPrefix, "fieldPrefix must not be null");
    }

    /**
     * Allocates a fresh synthetic field name.
     *
     * @return {@code <prefix><n>}, for example {@code f_0}
     */
    public String nextFieldName() {
        return fieldPrefix + nextFieldId++;
    }

    /**
     * Records the host-facing name of a column.
     *
     * @param exprId the column id
     * @param displayName the name the host expects
     */
    public void recordDisplayName(ExprId exprId, String displayName) {
        displayNames.put(exprId, displayName);
    }

    /**
     * Returns the recorded display name of a column.
     *
     * @param exprId the column id
     * @return the display name, or empty if the column was never renamed
     */
    public Optional<String> displayName(ExprId exprId) {
        return Optional.ofNullable(displayNames.get(exprId));
    }

    /**
     * Returns the display name of an attribute, falling back to its own name.
     *
     * @param attribute the attribute
     * @return the display name
     */
    public String displayNameOf(AttributeReference attribute) {
        return displayName(attribute.exprId()).orElse(attribute.name());
    }

    public int allocatedFieldCount() {
        return nextFieldId;
    }
}
