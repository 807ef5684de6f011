package nl.bytesoflife.deltakicad.netlist;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ResolverSettingsTest {

    @Test
    void defaultsComeFromClasspath() {
        ResolverSettings settings = ResolverSettings.defaults();
        assertEquals("power:", settings.powerNamespace());
        assertEquals(List.of("Mechanical:"), settings.nonElectricalNamespaces());
        assertEquals("NC", settings.noConnectName());
    }

    @Test
    void defaultsAreCached() {
        assertSame(ResolverSettings.defaults(), ResolverSettings.defaults());
    }

    @Test
    void namespaceMatching() {
        ResolverSettings settings = ResolverSettings.defaults();
        assertTrue(settings.isPower("power:GND"));
        assertFalse(settings.isPower("Device:R"));
        assertTrue(settings.isNonElectrical("Mechanical:MountingHole"));
        assertFalse(settings.isNonElectrical("Device:R"));
    }

    @Test
    void overrideNonElectricalNamespaces() {
        ResolverSettings settings = ResolverSettings.defaults().withNonElectricalNamespaces("Graphic:", "Mechanical:");
        assertTrue(settings.isNonElectrical("Graphic:Logo"));
        assertEquals("power:", settings.powerNamespace());
        assertTrue(ResolverSettings.defaults().withNonElectricalNamespaces().nonElectricalNamespaces().isEmpty());
    }
}
