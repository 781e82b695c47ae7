package beamline.domain.beam;

import beamline.physics.geometry.Vec3;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BeamRotationTest {

    private static final double EPS = 1e-12;

    private MonochromaticBeam beam;

    @BeforeEach
    void setUp() {
        beam = new MonochromaticBeam(Vec3.UNIT_Z, 1.2, 0.001, 0.0002, Vec3.UNIT_Y,
                0.9, 1e10, 0.8, Probe.XRAY, 120.0);
    }

    @Test
    @DisplayName("Rotación conocida: 90° alrededor de x lleva z → -y y la normal y → z")
    void rotateAroundOrigin_shouldRotateDirectionAndPolarizationNormal() {
        // ACT
        beam.rotateAroundOrigin(Vec3.UNIT_X, Math.PI / 2);

        // ASSERT
        assertVecEquals(new Vec3(0.0, -1.0, 0.0), beam.getSampleToSourceDirection());
        assertVecEquals(Vec3.UNIT_Z, beam.getPolarizationNormal());
    }

    @Test
    @DisplayName("Ángulo cero: el haz no cambia")
    void rotateAroundOrigin_withZeroAngleShouldBeNoOp() {
        MonochromaticBeam before = beam.copy();

        beam.rotateAroundOrigin(new Vec3(1.0, 1.0, 0.0), 0.0);

        assertEquals(before, beam);
        assertVecEquals(before.getSampleToSourceDirection(), beam.getSampleToSourceDirection());
    }

    @Test
    @DisplayName("Ida y vuelta: girar θ y luego -θ recupera el haz original")
    void rotateAroundOrigin_thenInverseShouldRestoreBeam() {
        // ARRANGE
        Vec3 axis = new Vec3(0.3, -0.5, 0.8);
        double theta = 0.73;
        Vec3 direction = beam.getSampleToSourceDirection();
        Vec3 normal = beam.getPolarizationNormal();

        // ACT
        beam.rotateAroundOrigin(axis, theta);
        beam.rotateAroundOrigin(axis, -theta);

        // ASSERT
        assertVecEquals(direction, beam.getSampleToSourceDirection());
        assertVecEquals(normal, beam.getPolarizationNormal());
    }

    @Test
    @DisplayName("Aislamiento: La rotación solo toca dirección y normal de polarización")
    void rotateAroundOrigin_shouldLeaveOtherFieldsUntouched() {
        // ARRANGE
        List<Vec3> scan = List.of(new Vec3(0.0, 0.0, -1.0), new Vec3(0.0, 0.01, -1.0));
        beam.setS0AtScanPoints(scan);

        // ACT
        beam.rotateAroundOrigin(Vec3.UNIT_Y, 0.4);

        // ASSERT
        assertEquals(1.2, beam.getWavelength());
        assertEquals(0.001, beam.getDivergence());
        assertEquals(0.0002, beam.getSigmaDivergence());
        assertEquals(0.9, beam.getPolarizationFraction());
        assertEquals(1e10, beam.getFlux());
        assertEquals(0.8, beam.getTransmission());
        assertEquals(Probe.XRAY, beam.getProbe());
        assertEquals(120.0, beam.getSampleToSourceDistance());
        assertEquals(scan, beam.getS0AtScanPoints());
    }

    @Test
    @DisplayName("Rotación: la dirección sigue siendo unitaria")
    void rotateAroundOrigin_shouldKeepDirectionNormalized() {
        beam.rotateAroundOrigin(new Vec3(2.0, 1.0, -3.0), 2.1);

        assertEquals(1.0, beam.getSampleToSourceDirection().length(), EPS);
    }

    @Test
    @DisplayName("Policromático: También rota dirección y normal")
    void rotateAroundOrigin_shouldApplyToPolychromaticBeams() {
        PolychromaticBeam poly = new PolychromaticBeam(Vec3.UNIT_Z, 500.0);

        poly.rotateAroundOrigin(Vec3.UNIT_Y, Math.PI / 2);

        assertVecEquals(Vec3.UNIT_X, poly.getSampleToSourceDirection());
        assertVecEquals(Vec3.UNIT_Y, poly.getPolarizationNormal());
        assertEquals(500.0, poly.getSampleToSourceDistance());
    }

    @Test
    @DisplayName("Eje nulo: se rechaza sin modificar el haz")
    void rotateAroundOrigin_shouldRejectZeroAxis() {
        MonochromaticBeam before = beam.copy();

        assertThrows(IllegalArgumentException.class, () -> beam.rotateAroundOrigin(Vec3.ZERO, 1.0));
        assertEquals(before, beam);
    }

    private static void assertVecEquals(Vec3 expected, Vec3 actual) {
        assertEquals(expected.x(), actual.x(), EPS);
        assertEquals(expected.y(), actual.y(), EPS);
        assertEquals(expected.z(), actual.z(), EPS);
    }
}
