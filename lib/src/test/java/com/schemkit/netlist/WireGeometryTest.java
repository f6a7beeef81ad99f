package com.schemkit.netlist;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.schemkit.model.Wire;
import org.junit.jupiter.api.Test;

class WireGeometryTest {

    @Test
    void sharedEndpointsTouch() {
        assertTrue(WireGeometry.touches(new Wire(0, 0, 100, 0), new Wire(100, 0, 100, 50)));
        assertTrue(WireGeometry.touches(new Wire(0, 0, 100, 0), new Wire(100.3, 0.2, 200, 0)));
        assertFalse(WireGeometry.touches(new Wire(0, 0, 100, 0), new Wire(101, 0, 200, 0)));
    }

    @Test
    void endpointOnSegmentIsATJunction() {
        Wire bar = new Wire(0, 0, 100, 0);

        assertTrue(WireGeometry.touches(bar, new Wire(50, 0, 50, 80)));
        assertTrue(WireGeometry.touches(new Wire(50, -80, 50, 0), bar));
        assertFalse(WireGeometry.touches(bar, new Wire(50, 1, 50, 80)));
    }

    @Test
    void crossingWithoutSharedPointDoesNotTouch() {
        assertFalse(WireGeometry.touches(new Wire(0, 0, 100, 0), new Wire(50, -50, 50, 50)));
    }

    @Test
    void pointOnDiagonalWire() {
        Wire diagonal = new Wire(0, 0, 100, 100);

        assertTrue(WireGeometry.pointOnWire(40, 40, diagonal));
        assertFalse(WireGeometry.pointOnWire(40, 45, diagonal));
        assertFalse(WireGeometry.pointOnWire(120, 120, diagonal));
    }

    @Test
    void pointTouchesEndpointsOfZeroLengthWire() {
        Wire dot = new Wire(10, 10, 10, 10);

        assertTrue(WireGeometry.pointTouches(10.2, 9.9, dot));
        assertFalse(WireGeometry.pointTouches(11, 10, dot));
    }
}
