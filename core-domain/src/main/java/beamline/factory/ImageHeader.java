package beamline.factory;

import java.util.Map;
import java.util.Optional;

/**
 * Vista de solo lectura de la cabecera (clave → valor) de una imagen ya leída.
 * <p>
 * La lectura del fichero la hace otra capa; aquí solo se consultan valores.
 */
@FunctionalInterface
public interface ImageHeader {

    /**
     * @param key Clave de la cabecera (p. ej. "WAVELENGTH").
     * @return el valor asociado, o vacío si la cabecera no lo contiene.
     */
    Optional<String> get(String key);

    static ImageHeader fromMap(Map<String, String> values) {
        Map<String, String> snapshot = Map.copyOf(values);
        return key -> Optional.ofNullable(snapshot.get(key));
    }
}
