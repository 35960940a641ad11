package io.kubecache.slf4j;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

import org.testng.annotations.Test;

public class MDCTest {

    @Test
    public void testNestedScopesRestorePreviousValues() {
        try (final MDC.MDCCloseable outer = MDC.put("Cluster", "cluster-a")) {
            try (final MDC.MDCCloseable inner = MDC.put("Cluster", "cluster-b").andPut("Kind", "ResourceQuota")) {
                assertEquals(org.slf4j.MDC.get("Cluster"), "cluster-b");
                assertEquals(org.slf4j.MDC.get("Kind"), "ResourceQuota");
            }

            assertEquals(org.slf4j.MDC.get("Cluster"), "cluster-a");
            assertNull(org.slf4j.MDC.get("Kind"));
        }

        assertNull(org.slf4j.MDC.get("Cluster"));
    }
}
