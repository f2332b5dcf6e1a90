package com.odata.writer.format;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import javax.xml.parsers.DocumentBuilderFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import com.odata.writer.entry.LinkReference;
import com.odata.writer.entry.ODataCollectionValue;
import com.odata.writer.entry.ODataComplexValue;
import com.odata.writer.entry.ODataEntry;
import com.odata.writer.entry.ODataNavigationLink;
import com.odata.writer.entry.ODataProperty;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for the Atom payload format.
 */
class AtomPayloadSerializerTest {

    private static final String ATOM = "http://www.w3.org/2005/Atom";
    private static final String DATA = "http://docs.oasis-open.org/odata/ns/data";
    private static final String METADATA = "http://docs.oasis-open.org/odata/ns/metadata";

    private AtomPayloadSerializer serializer;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2024-01-02T03:04:05Z"), ZoneOffset.UTC);
        serializer = new AtomPayloadSerializer("https://example.org/svc/", clock);
    }

    @Test
    void testWritesEntryDocument() throws Exception {
        ODataEntry entry = ODataEntry.builder()
                .typeName("Sales.Order")
                .property(new ODataProperty("Id", 1))
                .property(new ODataProperty("Total", new BigDecimal("12.50")))
                .property(new ODataProperty("Name", "Fish & Chips <large>"))
                .property(new ODataProperty("Note", null))
                .link(ODataNavigationLink.builder()
                        .name("Customer")
                        .collection(true)
                        .targetTypeName("Sales.Customer")
                        .reference(LinkReference.resolved("Customers", "(9)"))
                        .build())
                .build();

        Document document = parse(write(entry));
        Element root = document.getDocumentElement();

        assertThat(root.getLocalName()).isEqualTo("entry");
        assertThat(root.getAttribute("xml:base")).isEqualTo("https://example.org/svc/");
        assertThat(text(root, ATOM, "updated")).isEqualTo("2024-01-02T03:04:05Z");

        Element category = (Element) root.getElementsByTagNameNS(ATOM, "category").item(0);
        assertThat(category.getAttribute("term")).isEqualTo("#Sales.Order");

        Element link = (Element) root.getElementsByTagNameNS(ATOM, "link").item(0);
        assertThat(link.getAttribute("rel")).isEqualTo("http://docs.oasis-open.org/odata/ns/related/Customer");
        assertThat(link.getAttribute("type")).isEqualTo("application/atom+xml;type=feed");
        assertThat(link.getAttribute("href")).isEqualTo("Customers(9)");

        Element id = property(root, "Id");
        assertThat(id.getTextContent()).isEqualTo("1");
        assertThat(id.getAttributeNS(METADATA, "type")).isEqualTo("Edm.Int32");
        assertThat(property(root, "Total").getTextContent()).isEqualTo("12.50");
        assertThat(property(root, "Name").getTextContent()).isEqualTo("Fish & Chips <large>");
        assertThat(property(root, "Name").hasAttributeNS(METADATA, "type")).isFalse();
        assertThat(property(root, "Note").getAttributeNS(METADATA, "null")).isEqualTo("true");
    }

    @Test
    void testWritesComplexAndCollectionValues() throws Exception {
        ODataEntry entry = ODataEntry.builder()
                .typeName("Sales.Order")
                .property(new ODataProperty("ShipTo", new ODataComplexValue("Sales.Address",
                        List.of(new ODataProperty("City", "Oslo")))))
                .property(new ODataProperty("Tags", new ODataCollectionValue("Collection(Edm.String)",
                        List.of("a", "b"))))
                .build();

        Element root = parse(write(entry)).getDocumentElement();

        Element shipTo = property(root, "ShipTo");
        assertThat(shipTo.getAttributeNS(METADATA, "type")).isEqualTo("#Sales.Address");
        assertThat(text(shipTo, DATA, "City")).isEqualTo("Oslo");

        Element tags = property(root, "Tags");
        assertThat(tags.getAttributeNS(METADATA, "type")).isEqualTo("#Collection(Edm.String)");
        NodeList elements = tags.getElementsByTagNameNS(METADATA, "element");
        assertThat(elements.getLength()).isEqualTo(2);
        assertThat(elements.item(0).getTextContent()).isEqualTo("a");
        assertThat(elements.item(1).getTextContent()).isEqualTo("b");
    }

    @Test
    void testDeclaredTypeWinsOverValueClass() throws Exception {
        ODataEntry entry = ODataEntry.builder()
                .typeName("Sales.Product")
                .property(new ODataProperty("Rating", (short) 200, "Edm.Byte"))
                .property(new ODataProperty("Count", (short) 7, "Edm.Int16"))
                .property(new ODataProperty("Scores", new ODataCollectionValue("Collection(Edm.Byte)",
                        List.of((short) 1, (short) 2)), "Collection(Edm.Byte)"))
                .property(new ODataProperty("Extra", (short) 3))
                .build();

        Element root = parse(write(entry)).getDocumentElement();

        assertThat(property(root, "Rating").getAttributeNS(METADATA, "type")).isEqualTo("Edm.Byte");
        assertThat(property(root, "Rating").getTextContent()).isEqualTo("200");
        assertThat(property(root, "Count").getAttributeNS(METADATA, "type")).isEqualTo("Edm.Int16");
        assertThat(property(root, "Extra").getAttributeNS(METADATA, "type")).isEqualTo("Edm.Int16");
        Element first = (Element) property(root, "Scores").getElementsByTagNameNS(METADATA, "element").item(0);
        assertThat(first.getAttributeNS(METADATA, "type")).isEqualTo("Edm.Byte");
    }

    @Test
    void testWritesReferenceLink() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        serializer.writeReferenceLink("Employees(3)", out);

        Element ref = parse(out.toString(StandardCharsets.UTF_8)).getDocumentElement();
        assertThat(ref.getLocalName()).isEqualTo("ref");
        assertThat(ref.getNamespaceURI()).isEqualTo(METADATA);
        assertThat(ref.getAttribute("id")).isEqualTo("Employees(3)");
    }

    private String write(ODataEntry entry) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.writeEntry(entry, out);
        return out.toString(StandardCharsets.UTF_8);
    }

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }

    private static Element property(Element root, String name) {
        return (Element) root.getElementsByTagNameNS(DATA, name).item(0);
    }

    private static String text(Element parent, String namespace, String localName) {
        return parent.getElementsByTagNameNS(namespace, localName).item(0).getTextContent();
    }
}
