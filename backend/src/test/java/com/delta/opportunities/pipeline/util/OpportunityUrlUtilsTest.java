package com.delta.opportunities.pipeline.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class OpportunityUrlUtilsTest {

    @Test
    void canonicalUrlDropsTrackingNoiseAndFoldsScheme() {
        String canonical = OpportunityUrlUtils.canonicalUrl(
            "http://WWW.Example.com:80/jobs/123/?utm_source=x&b=2&gclid=abc&a=1#apply"
        );
        assertEquals("https://example.com/jobs/123?a=1&b=2", canonical);
    }

    @Test
    void canonicalUrlKeepsNonDefaultPort() {
        assertEquals("https://example.com:8443/p", OpportunityUrlUtils.canonicalUrl("https://example.com:8443/p/"));
    }

    @Test
    void canonicalUrlRejectsNonHttpAndRelativeValues() {
        assertNull(OpportunityUrlUtils.canonicalUrl("mailto:jobs@example.com"));
        assertNull(OpportunityUrlUtils.canonicalUrl("/jobs/123"));
        assertNull(OpportunityUrlUtils.canonicalUrl("  "));
        assertNull(OpportunityUrlUtils.canonicalUrl("http://bad host/x"));
    }
}
