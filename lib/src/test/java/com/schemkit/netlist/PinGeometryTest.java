package com.schemkit.netlist;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import com.schemkit.model.Instance;
import com.schemkit.model.Layers;
import com.schemkit.model.Rect;
import com.schemkit.model.Symbol;
import java.util.List;
import org.junit.jupiter.api.Test;

class PinGeometryTest {
    private static final double TOLERANCE = 1e-9;

    @Test
    void quarterTurnsRotateCounterClockwiseInScreenTerms() {
        assertArrayEquals(new double[] {10, 0}, PinGeometry.transform(10, 0, 0, 0, 0, 0), TOLERANCE);
        assertArrayEquals(new double[] {0, 10}, PinGeometry.transform(10, 0, 1, 0, 0, 0), TOLERANCE);
        assertArrayEquals(new double[] {-10, 0}, PinGeometry.transform(10, 0, 2, 0, 0, 0), TOLERANCE);
        assertArrayEquals(new double[] {0, -10}, PinGeometry.transform(10, 0, 3, 0, 0, 0), TOLERANCE);
    }

    @Test
    void flipIsAppliedBeforeRotationAndTranslationLast() {
        assertArrayEquals(new double[] {-10, 5}, PinGeometry.transform(10, 5, 0, 1, 0, 0), TOLERANCE);
        assertArrayEquals(new double[] {-5, -10}, PinGeometry.transform(10, 5, 1, 1, 0, 0), TOLERANCE);
        assertArrayEquals(new double[] {95, 190}, PinGeometry.transform(10, 5, 1, 1, 100, 200), TOLERANCE);
    }

    @Test
    void locateUsesPinBoxCentersInPinOrder() {
        Symbol symbol = new Symbol("res.sym");
        Rect plus = new Rect(-2.5, -32.5, 2.5, -27.5);
        plus.setProp("name=P dir=inout");
        Rect minus = new Rect(-2.5, 27.5, 2.5, 32.5);
        minus.setProp("name=M dir=inout");
        symbol.getRects().add(Layers.PIN, plus);
        symbol.getRects().add(Layers.PIN, minus);
        symbol.getRects().add(Layers.SYMBOL, new Rect(-10, -20, 10, 20));

        List<PinGeometry.PinLocation> pins = PinGeometry.locate(new Instance("res.sym", 100, 0, 1, 0), symbol);

        assertEquals(2, pins.size());
        assertEquals("P", pins.get(0).pinName());
        assertEquals(130, pins.get(0).x(), TOLERANCE);
        assertEquals(0, pins.get(0).y(), TOLERANCE);
        assertEquals("M", pins.get(1).pinName());
        assertEquals(1, pins.get(1).pinIndex());
        assertEquals(70, pins.get(1).x(), TOLERANCE);
    }
}
