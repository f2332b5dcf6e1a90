package com.odata.writer.request;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.odata.writer.SalesSchema;
import com.odata.writer.batch.DeferredBatchWriter;
import com.odata.writer.batch.InMemoryBatchWriter;
import com.odata.writer.entry.ODataEntry;
import com.odata.writer.entry.ODataProperty;
import com.odata.writer.exception.SchemaMismatchException;
import com.odata.writer.format.PayloadFormat;
import com.odata.writer.metadata.MetadataCatalog;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for writing entity requests, standalone and in a batch.
 */
class RequestWriterTest {

    private static final String URL_BASE = "https://example.org/svc/";

    private final ObjectMapper mapper = new ObjectMapper();
    private MetadataCatalog catalog;
    private WriterSettings settings;

    @BeforeEach
    void setUp() {
        catalog = SalesSchema.catalog();
        settings = WriterSettings.builder().urlBase(URL_BASE).build();
    }

    @Test
    void testPatchEncodesOnlySuppliedFields() throws IOException {
        RequestWriter writer = new RequestWriter(settings, catalog);
        Map<String, Object> data = Map.of("Total", "12.50");

        ODataEntry entry = writer.encodeEntry("PATCH", "Orders", data);
        JsonNode body = read(writer.writeEntryContent("PATCH", "Orders", data, "Orders(1)"));

        assertThat(entry.getProperties()).containsExactly(new ODataProperty("Total", new BigDecimal("12.50"), "Edm.Decimal"));
        assertThat(body.get("@odata.type").asText()).isEqualTo("#Sales.Order");
        assertThat(body.get("Total").decimalValue()).isEqualByComparingTo("12.50");
        assertThat(body.has("Id")).isFalse();
    }

    @Test
    void testLinkToExistingEntityOutsideBatch() throws IOException {
        RequestWriter writer = new RequestWriter(settings, catalog);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("EmployeeId", 7);
        data.put("Name", "Bob");
        data.put("Manager", Map.of("EmployeeId", 3));

        JsonNode body = read(writer.writeEntryContent("POST", "Employees", data, "Employees"));

        assertThat(body.get("Manager@odata.bind").asText()).isEqualTo("Employees(3)");
        assertThat(body.get("EmployeeId").asInt()).isEqualTo(7);
    }

    @Test
    void testCollectionPropertyKeepsOrder() throws IOException {
        RequestWriter writer = new RequestWriter(settings, catalog);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Id", 1);
        data.put("Tags", List.of("a", "b", "c"));

        JsonNode body = read(writer.writeEntryContent("POST", "Orders", data, "Orders"));

        assertThat(body.get("Tags").toString()).isEqualTo("[\"a\",\"b\",\"c\"]");
    }

    @Test
    void testBatchLinksToEntityCreatedEarlier() throws IOException {
        InMemoryBatchWriter batch = new InMemoryBatchWriter();
        RequestWriter writer = new RequestWriter(settings, catalog, DeferredBatchWriter.of(batch));
        Map<String, Object> parent = new HashMap<>(Map.of("Id", 100, "Name", "A"));
        Map<String, Object> child = new LinkedHashMap<>();
        child.put("Id", 101);
        child.put("Name", "B");
        child.put("Parent", parent);

        assertThat(writer.writeEntryContent("POST", "Categories", parent, "Categories")).isNull();
        assertThat(writer.writeEntryContent("POST", "Categories", child, "Categories")).isNull();

        assertThat(batch.isStarted()).isTrue();
        assertThat(batch.getOperations()).hasSize(2);
        RequestMessage first = batch.getOperations().get(0);
        RequestMessage second = batch.getOperations().get(1);
        assertThat(first.getHeader("Content-ID")).isEqualTo("1");
        assertThat(second.getHeader("content-id")).isEqualTo("2");
        assertThat(second.getUri()).hasToString(URL_BASE + "Categories");
        assertThat(read(second.getStream()).get("Parent@odata.bind").asText()).isEqualTo("$1");
    }

    @Test
    void testConcurrencyCheckedTypesGetIfMatchForUpdates() {
        InMemoryBatchWriter batch = new InMemoryBatchWriter();
        RequestWriter writer = new RequestWriter(settings, catalog, DeferredBatchWriter.of(batch));

        writer.writeEntryContent("PUT", "Categories", Map.of("Id", 1, "Name", "X"), "Categories(1)");
        writer.writeEntryContent("POST", "Categories", Map.of("Id", 2, "Name", "Y"), "Categories");
        writer.writeEntryContent("PUT", "Orders", Map.of("Id", 1), "Orders(1)");
        writer.writeEntryContent("DELETE", "Categories", null, "Categories(1)");

        List<InMemoryRequestMessage> operations = batch.getOperations();
        assertThat(operations.get(0).getHeader("If-Match")).isEqualTo("*");
        assertThat(operations.get(1).getHeader("If-Match")).isNull();
        assertThat(operations.get(2).getHeader("If-Match")).isNull();
        assertThat(operations.get(3).getHeader("If-Match")).isEqualTo("*");
        assertThat(operations.get(3).getHeader("Content-ID")).isNull();
        assertThat(operations.get(3).getBodyBytes()).isEmpty();
    }

    @Test
    void testStandaloneMessageCarriesHeaders() {
        RequestWriter writer = new RequestWriter(settings, catalog);

        RequestMessage message = writer.writeEntry("PATCH", "Categories", Map.of("Name", "Z"), "Categories(4)");

        assertThat(message.getHeader("If-Match")).isEqualTo("*");
        assertThat(message.getHeader("Content-Type")).isEqualTo(PayloadFormat.JSON.getContentType());
        assertThat(message.getUri()).hasToString(URL_BASE + "Categories(4)");
    }

    @Test
    void testDeleteHasNoBody() {
        RequestWriter writer = new RequestWriter(settings, catalog);

        assertThat(writer.writeEntryContent("DELETE", "Orders", Map.of(), "Orders(1)")).isNull();
    }

    @Test
    void testUnknownFieldWritesNothing() {
        InMemoryBatchWriter batch = new InMemoryBatchWriter();
        RequestWriter writer = new RequestWriter(settings, catalog, DeferredBatchWriter.of(batch));

        assertThatThrownBy(() -> writer.writeEntryContent("POST", "Orders", Map.of("Id", 1, "Bogus", 2), "Orders"))
                .isInstanceOf(SchemaMismatchException.class);
        assertThat(batch.getOperations()).isEmpty();
    }

    @Test
    void testWritingIsIdempotent() throws IOException {
        RequestWriter writer = new RequestWriter(settings, catalog);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Id", 5);
        data.put("Total", 3.25);
        data.put("ShipTo", Map.of("City", "Bergen"));

        byte[] first = writer.writeEntryContent("POST", "Orders", data, "Orders").readAllBytes();
        byte[] second = writer.writeEntryContent("POST", "Orders", data, "Orders").readAllBytes();

        assertThat(second).isEqualTo(first);
    }

    @Test
    void testWriteLinkContent() throws IOException {
        RequestWriter writer = new RequestWriter(settings, catalog);

        JsonNode body = read(writer.writeLinkContent("Employees(3)"));

        assertThat(body.get("@odata.id").asText()).isEqualTo("Employees(3)");
    }

    @Test
    void testAtomFormat() throws IOException {
        WriterSettings atom = WriterSettings.builder().urlBase(URL_BASE).payloadFormat(PayloadFormat.ATOM).build();
        RequestWriter writer = new RequestWriter(atom, catalog);

        String body = new String(writer.writeEntryContent("POST", "Products", Map.of("Id", 4, "Name", "Tea"),
                "Products").readAllBytes(), StandardCharsets.UTF_8);

        assertThat(body).startsWith("<?xml").contains("term=\"#Sales.Product\"").contains(">Tea</d:Name>");
    }

    @Test
    void testAtomUsesDeclaredByteType() throws IOException {
        WriterSettings atom = WriterSettings.builder().urlBase(URL_BASE).payloadFormat(PayloadFormat.ATOM).build();
        RequestWriter writer = new RequestWriter(atom, catalog);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("Id", 1);
        data.put("Rating", 200);
        data.put("Scores", List.of(1, 2));

        String body = new String(writer.writeEntryContent("POST", "Products", data, "Products").readAllBytes(),
                StandardCharsets.UTF_8);

        assertThat(body).contains("<d:Rating m:type=\"Edm.Byte\">200</d:Rating>")
                .contains("<m:element m:type=\"Edm.Byte\">1</m:element>")
                .doesNotContain("Edm.Int16");
    }

    @Test
    void testConcurrentBatchWritesGetRisingContentIds() throws Exception {
        InMemoryBatchWriter batch = new InMemoryBatchWriter();
        RequestWriter writer = new RequestWriter(settings, catalog, DeferredBatchWriter.of(batch));
        int writes = 64;
        CountDownLatch ready = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < writes; i++) {
                int id = i;
                results.add(executor.submit(() -> {
                    ready.await();
                    return writer.writeEntryContent("POST", "Products", Map.of("Id", id), "Products");
                }));
            }
            ready.countDown();
            for (Future<?> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        List<Integer> contentIds = new ArrayList<>();
        batch.getOperations().forEach(op -> contentIds.add(Integer.valueOf(op.getHeader("Content-ID"))));
        assertThat(contentIds).hasSize(writes).isSorted().doesNotHaveDuplicates();
        assertThat(contentIds.get(0)).isEqualTo(1);
        assertThat(contentIds.get(writes - 1)).isEqualTo(writes);
    }

    private JsonNode read(InputStream stream) throws IOException {
        return mapper.readTree(stream);
    }
}
