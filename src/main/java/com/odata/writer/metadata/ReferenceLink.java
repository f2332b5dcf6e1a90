package com.odata.writer.metadata;

import lombok.NonNull;
import lombok.Value;

/**
 * A navigation value found in entry data. {@code linkData} is the linked entity's data
 * map, or null when the caller supplied no target.
 */
@Value
public class ReferenceLink {
    @NonNull
    String linkName;

    Object linkData;
}
