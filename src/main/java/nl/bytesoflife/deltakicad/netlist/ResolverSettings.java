package nl.bytesoflife.deltakicad.netlist;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;

/**
 * Library namespaces and names the resolver treats specially.
 *
 * @param powerNamespace lib id prefix of power symbols, whose value names the net
 * @param nonElectricalNamespaces lib id prefixes whose pins take no part in connectivity
 * @param noConnectName name of a net that ends in a no-connect marker
 */
public record ResolverSettings(String powerNamespace, List<String> nonElectricalNamespaces, String noConnectName) {

    private static final String RESOURCE = "/netlist/resolver.properties";

    private static volatile ResolverSettings cachedDefaults;

    public ResolverSettings {
        nonElectricalNamespaces = List.copyOf(nonElectricalNamespaces);
    }

    public static ResolverSettings defaults() {
        if (cachedDefaults == null) {
            synchronized (ResolverSettings.class) {
                if (cachedDefaults == null) {
                    cachedDefaults = load();
                }
            }
        }
        return cachedDefaults;
    }

    public boolean isPower(String libId) {
        return libId.startsWith(powerNamespace);
    }

    public boolean isNonElectrical(String libId) {
        for (String namespace : nonElectricalNamespaces) {
            if (libId.startsWith(namespace)) {
                return true;
            }
        }
        return false;
    }

    public ResolverSettings withNonElectricalNamespaces(String... namespaces) {
        return new ResolverSettings(powerNamespace, Arrays.asList(namespaces), noConnectName);
    }

    private static ResolverSettings load() {
        try (InputStream is = ResolverSettings.class.getResourceAsStream(RESOURCE)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + RESOURCE);
            Properties properties = new Properties();
            properties.load(is);
            return new ResolverSettings(
                    properties.getProperty("power.namespace", "power:"),
                    Arrays.stream(properties.getProperty("non-electrical.namespaces", "Mechanical:").split(","))
                            .map(String::trim)
                            .filter(s -> !s.isEmpty())
                            .toList(),
                    properties.getProperty("no-connect.name", "NC"));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load resolver settings", e);
        }
    }
}
