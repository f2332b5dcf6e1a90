package com.odata.writer.model;

/**
 * Target multiplicity of a navigation property.
 */
public enum Multiplicity {
    ZERO_OR_ONE,
    ONE,
    MANY
}
