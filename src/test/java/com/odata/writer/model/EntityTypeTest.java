package com.odata.writer.model;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EntityTypeTest {

    private static final EdmTypeReference INT32 = EdmTypeReference.primitive(EdmPrimitiveKind.INT32, false);
    private static final EdmTypeReference STRING = EdmTypeReference.primitive(EdmPrimitiveKind.STRING, true);

    @Test
    void testBuilderCollectsPropertiesInOrder() {
        EntityType type = EntityType.builder()
                .namespace("Shop")
                .name("Line")
                .key("OrderId")
                .key("LineNo")
                .property("OrderId", INT32)
                .property("LineNo", INT32)
                .property(StructuralProperty.builder()
                        .name("Version")
                        .type(INT32)
                        .concurrencyMode(ConcurrencyMode.FIXED)
                        .build())
                .build();

        assertThat(type.getFullName()).isEqualTo("Shop.Line");
        assertThat(type.getDeclaredKey()).containsExactly("OrderId", "LineNo");
        assertThat(type.getStructuralProperties()).extracting(StructuralProperty::getName)
                .containsExactly("OrderId", "LineNo", "Version");
        assertThat(type.getNavigationProperties()).isEmpty();
        assertThat(type.hasConcurrencyTokens()).isTrue();
    }

    @Test
    void testBuiltListsAreImmutable() {
        EntityType type = EntityType.builder()
                .namespace("Shop")
                .name("Tag")
                .declaredKey(List.of("Id"))
                .property("Id", INT32)
                .build();

        assertThatThrownBy(() -> type.getStructuralProperties().add(null))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThat(type.hasConcurrencyTokens()).isFalse();
    }

    @Test
    void testComplexTypeBuilder() {
        ComplexType address = ComplexType.builder()
                .namespace("Shop")
                .name("Address")
                .property("Street", STRING)
                .property("City", STRING)
                .build();

        assertThat(address.getTypeKind()).isEqualTo(EdmTypeKind.COMPLEX);
        assertThat(address.findProperty("City")).isPresent();
        assertThat(address.findProperty("city")).isEmpty();
    }

    @Test
    void testSchemaModelIndexesDeclaredTypes() {
        ComplexType address = ComplexType.builder().namespace("Shop").name("Address").build();
        EntityType tag = EntityType.builder().namespace("Shop").name("Tag").key("Id").property("Id", INT32).build();

        DefaultSchemaModel model = DefaultSchemaModel.builder()
                .element(address)
                .element(tag)
                .build();

        assertThat(model.findDeclaredType("Shop.Tag")).containsSame(tag);
        assertThat(model.findEntityType("Shop.Address")).isEmpty();
        assertThat(model.getDeclaredNamespaces()).containsExactly("Shop");
        assertThat(model.getReferencedModels()).isEmpty();
    }
}
