package com.odata.writer.entry;

import com.odata.writer.model.Multiplicity;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

@Value
@Builder
public class ODataNavigationLink {

    public static final String RELATED_LINK_PREFIX = "http://docs.oasis-open.org/odata/ns/related/";

    @NonNull
    String name;

    /**
     * Whether the relationship is many-valued as seen from the partner side.
     */
    boolean collection;

    /**
     * Multiplicity of the navigation property itself; decides between a single
     * binding and an array of bindings in JSON payloads.
     */
    @NonNull
    @Builder.Default
    Multiplicity targetMultiplicity = Multiplicity.ZERO_OR_ONE;

    /**
     * Qualified name of the linked entity type.
     */
    @NonNull
    String targetTypeName;

    @NonNull
    LinkReference reference;

    /**
     * Atom relation for the link, e.g. {@code http://docs.oasis-open.org/odata/ns/related/Manager}.
     */
    public String getRelation() {
        return RELATED_LINK_PREFIX + name;
    }
}
