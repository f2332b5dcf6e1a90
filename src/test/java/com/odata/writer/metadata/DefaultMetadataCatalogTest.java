package com.odata.writer.metadata;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.odata.writer.SalesSchema;
import com.odata.writer.exception.MetadataException;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for entity set lookup and entry parsing.
 */
class DefaultMetadataCatalogTest {

    private final MetadataCatalog catalog = SalesSchema.catalog();

    @Test
    void testEntityCollectionLookupIsNameInsensitive() {
        assertThat(catalog.getConcreteEntityCollection("Orders").getName()).isEqualTo("Orders");
        assertThat(catalog.getConcreteEntityCollection("orders").getName()).isEqualTo("Orders");
        assertThat(catalog.getConcreteEntityCollection("Category").getName()).isEqualTo("Categories");
        assertThat(catalog.getConcreteEntityCollection("Orders/Sales.SpecialOrder").getName()).isEqualTo("Orders");
    }

    @Test
    void testUnknownCollection() {
        assertThatThrownBy(() -> catalog.getConcreteEntityCollection("Invoices"))
                .isInstanceOf(MetadataException.class)
                .hasMessage("Entity collection not found: Invoices");
    }

    @Test
    void testEntitySetTypeName() {
        assertThat(catalog.getEntitySetTypeNamespace("employees")).isEqualTo("Sales");
        assertThat(catalog.getEntitySetTypeName("employees")).isEqualTo("Employee");
    }

    @Test
    void testOptimisticConcurrencyCheck() {
        assertThat(catalog.entitySetTypeRequiresOptimisticConcurrencyCheck("Categories")).isTrue();
        assertThat(catalog.entitySetTypeRequiresOptimisticConcurrencyCheck("Orders")).isFalse();
    }

    @Test
    void testParseEntryDetailsSplitsPropertiesAndLinks() {
        Map<String, Object> customer = Map.of("Id", 9);
        Map<String, Object> first = Map.of("Id", 1);
        Map<String, Object> second = Map.of("Id", 2);
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("Id", 5);
        entry.put("customer", customer);
        entry.put("Total", "3.10");
        entry.put("Items", List.of(first, second));

        EntryDetails details = catalog.parseEntryDetails("Orders", entry, 4);

        assertThat(details.getContentId()).isEqualTo(4);
        assertThat(details.getProperties()).containsExactly(Map.entry("Id", 5), Map.entry("Total", "3.10"));
        assertThat(details.getLinks())
                .extracting(ReferenceLink::getLinkName)
                .containsExactly("customer", "Items", "Items");
        assertThat(details.getLinks().get(0).getLinkData()).isSameAs(customer);
        assertThat(details.getLinks().get(2).getLinkData()).isSameAs(second);
    }

    @Test
    void testParseEntryDetailsSplitsArrayLinks() {
        Map<String, Object> first = Map.of("Id", 1);
        Map<String, Object> second = Map.of("Id", 2);
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("Id", 5);
        entry.put("Items", new Object[] {first, second});

        EntryDetails details = catalog.parseEntryDetails("Orders", entry, null);

        assertThat(details.getLinks())
                .extracting(ReferenceLink::getLinkName)
                .containsExactly("Items", "Items");
        assertThat(details.getLinks().get(0).getLinkData()).isSameAs(first);
        assertThat(details.getLinks().get(1).getLinkData()).isSameAs(second);
    }

    @Test
    void testConvertKeyToUriLiteral() {
        Map<String, Object> composite = new LinkedHashMap<>();
        composite.put("OrderID", 1);
        composite.put("ProductID", "x'y");

        assertThat(catalog.convertKeyToUriLiteral(Map.of("Id", 3))).isEqualTo("(3)");
        assertThat(catalog.convertKeyToUriLiteral(composite)).isEqualTo("(OrderID=1,ProductID='x''y')");
    }
}
