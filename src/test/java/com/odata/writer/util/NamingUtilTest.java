package com.odata.writer.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for name homogenization and comparison.
 */
class NamingUtilTest {

    private final Pluralizer pluralizer = new SimplePluralizer();

    @Test
    void testHomogenizeStripsNamespaceAndSeparators() {
        assertThat(NamingUtil.homogenize("Sales.Order_Details")).isEqualTo("orderdetails");
        assertThat(NamingUtil.homogenize("ORDER-ID")).isEqualTo("orderid");
        assertThat(NamingUtil.homogenize(null)).isNull();
    }

    @ParameterizedTest
    @CsvSource({
            "Orders, orders",
            "Orders, Order",
            "Categories, category",
            "People, Person",
            "Order_Details, OrderDetail",
            "Address, Addresses"
    })
    void testNamesAreEqual(String actual, String requested) {
        assertThat(NamingUtil.namesAreEqual(actual, requested, pluralizer)).isTrue();
    }

    @Test
    void testNamesDifferWithoutPluralizer() {
        assertThat(NamingUtil.namesAreEqual("Orders", "order", null)).isFalse();
        assertThat(NamingUtil.namesAreEqual("Orders", "ORDERS", null)).isTrue();
    }

    @Test
    void testUnrelatedNamesAreNotEqual() {
        assertThat(NamingUtil.namesAreEqual("Orders", "Customers", pluralizer)).isFalse();
        assertThat(NamingUtil.namesAreEqual("Orders", null, pluralizer)).isFalse();
    }
}
