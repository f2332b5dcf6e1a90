package com.odata.writer.entry;

import lombok.NonNull;
import lombok.Value;

/**
 * Address of a linked entity: either a resolved entity-set URI or a pending batch content id.
 */
public sealed interface LinkReference permits LinkReference.Resolved, LinkReference.Pending {

    /**
     * Relative URI written into the payload.
     */
    String toUri();

    static LinkReference resolved(String entitySetName, String formattedKey) {
        return new Resolved(entitySetName, formattedKey);
    }

    static LinkReference pending(int contentId) {
        return new Pending(contentId);
    }

    /**
     * An existing entity addressed as {@code EntitySet(key)}.
     */
    @Value
    final class Resolved implements LinkReference {
        @NonNull
        String entitySetName;

        @NonNull
        String formattedKey;

        @Override
        public String toUri() {
            return entitySetName + formattedKey;
        }
    }

    /**
     * An entity created earlier in the same batch, addressed as {@code $contentId}.
     */
    @Value
    final class Pending implements LinkReference {
        int contentId;

        @Override
        public String toUri() {
            return "$" + contentId;
        }
    }
}
