package com.example.aspects;

import com.example.aspects.area.AreaGeometry;
import com.example.aspects.area.AreaSpec;
import com.example.aspects.area.AreaTemplate;
import com.example.aspects.area.TargetingMode;
import com.example.aspects.model.Point;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AreaGeometry Tests")
class AreaGeometryTest {

    private static final Point ORIGIN = new Point(0, 0);

    private static AreaTemplate placed(AreaSpec spec, double direction) {
        return new AreaTemplate("t", "caster", spec, ORIGIN, direction, 1);
    }

    @ParameterizedTest
    @CsvSource({"10, 0, true", "0, -10, true", "7, 7, true", "10.01, 0, false", "8, 8, false"})
    @DisplayName("Circle radius is half the diameter, edge inclusive")
    void circle(double x, double y, boolean inside) {
        AreaTemplate t = placed(AreaSpec.circle(20, TargetingMode.ALL), 0);
        assertEquals(inside, AreaGeometry.contains(t, new Point(x, y)));
    }

    @ParameterizedTest
    @CsvSource({"30, 0, true", "10, 10, true", "10, -10, true", "10, 10.5, false", "-1, 0, false", "31, 0, false", "0, 0, true"})
    @DisplayName("Cone opens symmetrically around its direction, edges inclusive")
    void cone(double x, double y, boolean inside) {
        AreaTemplate t = placed(AreaSpec.cone(30, 90, TargetingMode.ALL), 0);
        assertEquals(inside, AreaGeometry.contains(t, new Point(x, y)));
    }

    @ParameterizedTest
    @CsvSource({"2.5, 30, true", "-2.5, 0, true", "0, 15, true", "2.6, 10, false", "0, 30.1, false", "0, -1, false"})
    @DisplayName("Ray is a strip of its width along the direction")
    void ray(double x, double y, boolean inside) {
        AreaTemplate t = placed(AreaSpec.ray(30, 5, TargetingMode.ALL), 90);
        assertEquals(inside, AreaGeometry.contains(t, new Point(x, y)));
    }

    @ParameterizedTest
    @CsvSource({"10, 10, true", "-10, 10, true", "0, 0, true", "10.1, 0, false", "0, -10.1, false"})
    @DisplayName("Rect is an axis-aligned square centered on the placement point")
    void rect(double x, double y, boolean inside) {
        AreaTemplate t = placed(AreaSpec.rect(20 * Math.sqrt(2), TargetingMode.ALL), 0);
        assertEquals(inside, AreaGeometry.contains(t, new Point(x, y)));
    }

    @Test
    @DisplayName("Rect side is the diagonal over root two")
    void rectSide() {
        assertEquals(10.0, AreaGeometry.rectSide(Math.sqrt(200)), 1e-9);
    }

    @Test
    @DisplayName("Cone and ray defaults apply when unset")
    void defaults() {
        assertEquals(AreaSpec.DEFAULT_CONE_ANGLE, AreaSpec.cone(15, 0, TargetingMode.ALL).angle(), 1e-9);
        assertEquals(AreaSpec.DEFAULT_RAY_WIDTH, AreaSpec.ray(15, 0, TargetingMode.ALL).width(), 1e-9);
    }
}
