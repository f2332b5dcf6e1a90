package com.odata.writer.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A declared navigation property: a relationship from one entity type to another.
 *
 * The partner is referenced by name; it is resolved on the target entity type
 * through {@link SchemaModel#findPartner(NavigationProperty)}.
 */
@Value
@Builder(toBuilder = true)
public class NavigationProperty {
    @NonNull
    String name;

    /**
     * Entity type reference, or a collection of one.
     */
    @NonNull
    EdmTypeReference type;

    @NonNull
    String declaringTypeName;

    String partnerName;

    boolean containsTarget;

    @Singular
    List<String> dependentProperties;

    @Builder.Default
    OnDeleteAction onDelete = OnDeleteAction.NONE;

    /**
     * Qualified name of the entity type this property points at.
     */
    public String getTargetTypeName() {
        return type.unwrapCollection().getFullName();
    }

    public Multiplicity getTargetMultiplicity() {
        if (type.isCollection()) {
            return Multiplicity.MANY;
        }
        return type.isNullable() ? Multiplicity.ZERO_OR_ONE : Multiplicity.ONE;
    }

    public boolean hasPartner() {
        return partnerName != null;
    }
}
