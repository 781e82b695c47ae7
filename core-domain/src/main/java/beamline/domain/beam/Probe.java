package beamline.domain.beam;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Tipo de radiación que incide sobre la muestra.
 * <p>
 * Los nombres textuales siguen la clase base NXsource de NeXus y deben conservarse
 * tal cual: otros componentes del pipeline los usan como clave estable.
 */
@Getter
@RequiredArgsConstructor
public enum Probe {

    XRAY("x-ray"),
    ELECTRON("electron"),
    NEUTRON("neutron");

    private final String nexusName;

    // Clave: nombre NeXus -> Valor: ENUM
    private static final Map<String, Probe> BY_NAME = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(Probe::getNexusName, Function.identity())));

    /**
     * Busca la sonda asociada a un nombre NeXus.
     *
     * @param name Nombre exacto ("x-ray", "electron" o "neutron").
     * @return la sonda correspondiente.
     * @throws IllegalArgumentException si el nombre no corresponde a ninguna sonda.
     */
    public static Probe fromName(String name) {
        Probe probe = name == null ? null : BY_NAME.get(name);
        if (probe == null) {
            throw new IllegalArgumentException("Sonda desconocida: " + name);
        }
        return probe;
    }
}
