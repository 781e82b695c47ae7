package beamline.factory;

import beamline.domain.beam.MonochromaticBeam;
import lombok.extern.slf4j.Slf4j;

/**
 * Construye el modelo del haz a partir de la cabecera de una imagen SMV.
 * <p>
 * Las imágenes de los simuladores se reconocen por {@code BEAMLINE=fake}; su cabecera
 * solo aporta la longitud de onda, así que el haz resultante es el simple de
 * {@link BeamFactory#simple(double)}.
 */
@Slf4j
public final class HeaderBeamFactory {

    static final String BEAMLINE_KEY = "BEAMLINE";
    static final String SIMULATED_BEAMLINE = "fake";
    static final String WAVELENGTH_KEY = "WAVELENGTH";

    private HeaderBeamFactory() {
    }

    /**
     * @return {@code true} si {@code BEAMLINE} vale exactamente {@code fake}.
     */
    public static boolean isSimulatedImage(ImageHeader header) {
        return header.get(BEAMLINE_KEY)
                .filter(SIMULATED_BEAMLINE::equals)
                .isPresent();
    }

    /**
     * @param header Cabecera de la imagen.
     * @return el haz monocromático descrito por la cabecera.
     * @throws IllegalArgumentException si falta {@code WAVELENGTH} o no es un número positivo.
     */
    public static MonochromaticBeam createBeam(ImageHeader header) {
        String raw = header.get(WAVELENGTH_KEY).orElseThrow(() -> {
            log.warn("Cabecera sin clave {}: no se puede construir el haz.", WAVELENGTH_KEY);
            return new IllegalArgumentException("La cabecera no contiene " + WAVELENGTH_KEY + ".");
        });

        double wavelength;
        try {
            wavelength = Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Valor de {} no numérico: '{}'", WAVELENGTH_KEY, raw);
            throw new IllegalArgumentException("Valor de " + WAVELENGTH_KEY + " inválido: " + raw, e);
        }
        return BeamFactory.simple(wavelength);
    }
}
