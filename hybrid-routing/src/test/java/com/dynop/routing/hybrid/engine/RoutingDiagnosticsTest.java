package com.dynop.routing.hybrid.engine;

import com.dynop.routing.hybrid.config.RoutingConfig;
import com.dynop.routing.hybrid.testutil.EngineFixture;
import com.dynop.routing.hybrid.testutil.FakeRouteTransport;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RoutingDiagnosticsTest {

    private final EngineFixture fixture = new EngineFixture();

    @Test
    void probeReportsRoutedAnswer() {
        DiagnosticsReport report = fixture.engine(EngineFixture.withKey().build()).getDiagnostics().probe().join();

        assertTrue(report.isSuccess());
        assertEquals("routed", report.getMethod());
        assertNull(report.getError());
        assertEquals(1, fixture.transport.getCallCount());
    }

    @Test
    void probeWithoutCredentialIsGeometric() {
        DiagnosticsReport report = fixture.engine(RoutingConfig.defaults()).getDiagnostics().probe().join();

        assertTrue(report.isSuccess());
        assertEquals("geometry", report.getMethod());
        assertEquals(0, fixture.transport.getCallCount());
    }

    @Test
    void probeMeasuresElapsedTimeIncludingBackoff() {
        fixture.transport.byDefault(FakeRouteTransport.status(500));

        DiagnosticsReport report = fixture.engine(EngineFixture.withKey().maxRetries(1).retryBackoffBaseMs(400).build())
                .getDiagnostics().probe().join();

        assertTrue(report.isSuccess());
        assertEquals("routed-fallback", report.getMethod());
        assertEquals(400, report.getElapsedMs());
    }
}
