package com.odata.writer.coercion;

import java.util.function.Predicate;

import com.odata.writer.model.EdmPrimitiveKind;

import lombok.NonNull;
import lombok.Value;

/**
 * One row of the coercion table: a native representation, the wire kind it maps to,
 * and an optional constraint the converted value must satisfy.
 */
@Value
public class TypeMapping {
    @NonNull
    Class<?> nativeType;

    @NonNull
    EdmPrimitiveKind wireKind;

    @NonNull
    Predicate<Object> constraint;

    public static TypeMapping of(Class<?> nativeType, EdmPrimitiveKind wireKind) {
        return new TypeMapping(nativeType, wireKind, value -> true);
    }

    public static TypeMapping of(Class<?> nativeType, EdmPrimitiveKind wireKind, Predicate<Object> constraint) {
        return new TypeMapping(nativeType, wireKind, constraint);
    }

    public boolean handles(Class<?> type) {
        return nativeType.isAssignableFrom(type);
    }
}
