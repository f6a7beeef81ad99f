package com.schemkit.netlist;

import com.schemkit.model.Instance;
import com.schemkit.model.Rect;
import com.schemkit.model.Symbol;
import java.util.ArrayList;
import java.util.List;

/** Maps symbol pin positions into drawing coordinates for a placed instance. */
public final class PinGeometry {

    /** World position of one pin; {@code pinIndex} follows the symbol's pin order. */
    public record PinLocation(int pinIndex, String pinName, double x, double y) {}

    private PinGeometry() {}

    /**
     * Applies, in order, a horizontal flip about the origin, {@code rot} quarter turns and the
     * translation to ({@code x0}, {@code y0}).
     *
     * @return {@code {x, y}} in drawing coordinates
     */
    public static double[] transform(double x, double y, int rot, int flip, double x0, double y0) {
        double cx = flip != 0 ? -x : x;
        double cy = y;
        double t;
        switch (Math.floorMod(rot, 4)) {
            case 1:
                t = cx;
                cx = -cy;
                cy = t;
                break;
            case 2:
                cx = -cx;
                cy = -cy;
                break;
            case 3:
                t = cx;
                cx = cy;
                cy = -t;
                break;
            default:
                break;
        }
        return new double[] {x0 + cx, y0 + cy};
    }

    /** Centers of the symbol's pin boxes, placed through the instance transform. */
    public static List<PinLocation> locate(Instance instance, Symbol symbol) {
        List<Rect> pins = symbol.getPins();
        List<String> names = symbol.getPinNames();
        List<PinLocation> locations = new ArrayList<>(pins.size());
        for (int i = 0; i < pins.size(); i++) {
            Rect pin = pins.get(i);
            double[] world = transform(
                    pin.getCenterX(),
                    pin.getCenterY(),
                    instance.getRot(),
                    instance.getFlip(),
                    instance.getX0(),
                    instance.getY0());
            locations.add(new PinLocation(i, names.get(i), world[0], world[1]));
        }
        return locations;
    }
}
