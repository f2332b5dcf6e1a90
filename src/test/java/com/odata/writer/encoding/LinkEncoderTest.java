package com.odata.writer.encoding;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.odata.writer.SalesSchema;
import com.odata.writer.batch.InMemoryBatchWriter;
import com.odata.writer.entry.LinkReference;
import com.odata.writer.entry.ODataNavigationLink;
import com.odata.writer.exception.MissingNavigationTargetException;
import com.odata.writer.exception.RequestWriterException;
import com.odata.writer.exception.SchemaMismatchException;
import com.odata.writer.metadata.DefaultMetadataCatalog;
import com.odata.writer.metadata.MetadataCatalog;
import com.odata.writer.model.DefaultSchemaModel;
import com.odata.writer.model.EdmPrimitiveKind;
import com.odata.writer.model.EdmTypeReference;
import com.odata.writer.model.EntityContainer;
import com.odata.writer.model.EntitySet;
import com.odata.writer.model.EntityType;
import com.odata.writer.model.Multiplicity;
import com.odata.writer.model.NavigationProperty;
import com.odata.writer.util.SimplePluralizer;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for navigation link encoding.
 */
class LinkEncoderTest {

    private final MetadataCatalog catalog = SalesSchema.catalog();

    @Test
    void testLinkToExistingEntityUsesEntitySetAndKey() {
        LinkEncoder encoder = new LinkEncoder(catalog, null);

        ODataNavigationLink link = encoder.encode("Sales.Employee", "Manager", Map.of("EmployeeId", 3, "Name", "Ann"));

        assertThat(link.getName()).isEqualTo("Manager");
        assertThat(link.getTargetTypeName()).isEqualTo("Sales.Employee");
        assertThat(link.getReference()).isEqualTo(LinkReference.resolved("Employees", "(3)"));
        assertThat(link.getReference().toUri()).isEqualTo("Employees(3)");
        assertThat(link.getTargetMultiplicity()).isEqualTo(Multiplicity.ZERO_OR_ONE);
    }

    @Test
    void testCollectionFlagFollowsPartnerMultiplicity() {
        LinkEncoder encoder = new LinkEncoder(catalog, null);

        // Customer.Orders is many-valued
        assertThat(encoder.encode("Sales.Order", "Customer", Map.of("Id", 1)).isCollection()).isTrue();
        // Order.Items has no partner
        assertThat(encoder.encode("Sales.Order", "Items", Map.of("Id", 1)).isCollection()).isFalse();
        // Employee.Manager is single-valued
        assertThat(encoder.encode("Sales.Employee", "Subordinates", Map.of("EmployeeId", 2)).isCollection()).isFalse();
    }

    @Test
    void testLinkNameIsMatchedInsensitively() {
        LinkEncoder encoder = new LinkEncoder(catalog, null);

        ODataNavigationLink link = encoder.encode("Sales.Order", "customer", Map.of("id", 12));

        assertThat(link.getName()).isEqualTo("Customer");
        assertThat(link.getReference().toUri()).isEqualTo("Customers(12)");
    }

    @Test
    void testLinkToEntityCreatedEarlierInBatchIsPending() {
        InMemoryBatchWriter batch = new InMemoryBatchWriter();
        Map<String, Object> parent = new HashMap<>(Map.of("Id", 10, "Name", "A"));
        batch.mapContentId(parent, 1);
        LinkEncoder encoder = new LinkEncoder(catalog, batch);

        ODataNavigationLink link = encoder.encode("Sales.Category", "Parent", parent);

        assertThat(link.getReference()).isEqualTo(LinkReference.pending(1));
        assertThat(link.getReference().toUri()).isEqualTo("$1");
    }

    @Test
    void testContentIdsAreMatchedByIdentity() {
        InMemoryBatchWriter batch = new InMemoryBatchWriter();
        Map<String, Object> parent = new HashMap<>(Map.of("Id", 10));
        batch.mapContentId(parent, 1);
        LinkEncoder encoder = new LinkEncoder(catalog, batch);

        ODataNavigationLink link = encoder.encode("Sales.Category", "Parent", new HashMap<>(parent));

        assertThat(link.getReference().toUri()).isEqualTo("Categories(10)");
    }

    @Test
    void testUnknownLinkName() {
        LinkEncoder encoder = new LinkEncoder(catalog, null);

        assertThatThrownBy(() -> encoder.encode("Sales.Order", "Supplier", Map.of("Id", 1)))
                .isInstanceOf(SchemaMismatchException.class);
    }

    @Test
    void testLinkDataMustCarryTheKey() {
        LinkEncoder encoder = new LinkEncoder(catalog, null);

        assertThatThrownBy(() -> encoder.encode("Sales.Employee", "Manager", Map.of("Name", "Ann")))
                .isInstanceOf(RequestWriterException.class)
                .hasMessage("Link Manager is missing key property EmployeeId");
        assertThatThrownBy(() -> encoder.encode("Sales.Employee", "Manager", "Ann"))
                .isInstanceOf(RequestWriterException.class)
                .hasMessageContaining("must reference an entity data map");
    }

    @Test
    void testTargetWithoutEntitySet() {
        EntityType person = EntityType.builder().namespace("Docs").name("Person")
                .key("Id")
                .property("Id", EdmTypeReference.primitive(EdmPrimitiveKind.INT32, false))
                .build();
        EntityType document = EntityType.builder().namespace("Docs").name("Document")
                .key("Id")
                .property("Id", EdmTypeReference.primitive(EdmPrimitiveKind.INT32, false))
                .navigation(NavigationProperty.builder()
                        .name("Owner")
                        .type(EdmTypeReference.entity("Docs.Person", true))
                        .declaringTypeName("Docs.Document")
                        .build())
                .build();
        EntityContainer container = EntityContainer.builder()
                .namespace("Docs")
                .name("Container")
                .entitySet(new EntitySet("Documents", "Docs.Document"))
                .build();
        DefaultSchemaModel model = DefaultSchemaModel.builder()
                .element(person)
                .element(document)
                .element(container)
                .build();
        LinkEncoder encoder = new LinkEncoder(new DefaultMetadataCatalog(model, new SimplePluralizer()), null);

        assertThatThrownBy(() -> encoder.encode("Docs.Document", "Owner", Map.of("Id", 1)))
                .isInstanceOf(MissingNavigationTargetException.class)
                .hasMessage("No entity set found for type Docs.Person referenced by link 'Owner'");
    }
}
