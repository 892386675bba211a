package fbgsimulator.io;

import fbgsimulator.domain.deformation.ConditionDataset;
import fbgsimulator.domain.deformation.RawConditionSample;
import fbgsimulator.domain.fiber.DistanceUnits;
import fbgsimulator.exception.DataRangeException;
import fbgsimulator.exception.FileAccessException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Lector del fichero de condiciones de deformación/tensión.
 * <p>
 * Formato: texto delimitado con una fila por punto de la fibra y las columnas
 * {@code posición, deformación[, tensión]}. Se aceptan como separador la coma,
 * el punto y coma, el tabulador o espacios; con cualquiera de los tres últimos la
 * coma decimal también es válida. Las líneas vacías y las que empiezan
 * por {@code #} se ignoran, igual que las cabeceras no numéricas al principio.
 */
@Slf4j
public class ConditionDataLoader {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Lee el fichero y convierte las posiciones a milímetros.
     *
     * @throws FileAccessException si la ruta no existe o no se puede leer.
     * @throws DataRangeException  si alguna fila de datos está mal formada.
     */
    public ConditionDataset load(Path file, DistanceUnits units) {
        if (file == null || !Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new FileAccessException("'" + file + "' no es un fichero de datos válido.");
        }
        DistanceUnits effectiveUnits = units != null ? units : DistanceUnits.MILLIMETERS;

        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileAccessException("No se pudo leer el fichero de datos " + file + ": " + e.getMessage(), e);
        }

        List<RawConditionSample> samples = new ArrayList<>(lines.size());
        for (int n = 0; n < lines.size(); n++) {
            String line = lines.get(n).trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            double[] values = parseRow(line);
            if (values == null) {
                if (samples.isEmpty()) {
                    log.debug("Línea {} tratada como cabecera: '{}'", n + 1, line);
                    continue;
                }
                throw new DataRangeException(String.format(
                        "Línea %d del fichero %s: valor no numérico en '%s'.", n + 1, file.getFileName(), line));
            }
            if (values.length < 2) {
                throw new DataRangeException(String.format(
                        "Línea %d del fichero %s: se esperan al menos las columnas posición y deformación.",
                        n + 1, file.getFileName()));
            }

            double position = effectiveUnits.toMillimeters(values[0]);
            double stress = values.length > 2 ? values[2] : Double.NaN;
            samples.add(new RawConditionSample(position, values[1], stress));
        }

        ConditionDataset dataset = new ConditionDataset(samples);
        if (dataset.isEmpty()) {
            log.warn("El fichero {} no contiene ninguna muestra.", file);
        } else {
            log.info("Cargadas {} muestras de {} (rango [{}, {}] mm, tensión: {})", dataset.size(), file.getFileName(),
                    dataset.firstPosition(), dataset.lastPosition(), dataset.hasStress());
        }
        return dataset;
    }

    /**
     * Valores de la fila según el primer separador que la interprete entera, o
     * {@code null} si ninguno lo consigue (cabecera o fila mal formada).
     */
    private static double[] parseRow(String line) {
        for (String[] tokens : candidateSplits(line)) {
            double[] values = parse(tokens);
            if (values != null) {
                return values;
            }
        }
        return null;
    }

    /**
     * Posibles particiones de la fila. Con punto y coma, tabulador o espacios la coma
     * se lee como separador decimal; una fila con comas y espacios prueba primero la
     * coma como separador ({@code 0, 1e-4}) y después los espacios ({@code 0,1 2e-4}).
     */
    private static List<String[]> candidateSplits(String line) {
        if (line.indexOf(';') >= 0) {
            return List.<String[]>of(line.replace(',', '.').split(";"));
        }
        if (line.indexOf('\t') >= 0) {
            return List.<String[]>of(line.replace(',', '.').split("\t"));
        }
        boolean hasComma = line.indexOf(',') >= 0;
        boolean hasWhitespace = WHITESPACE.matcher(line).find();
        if (hasComma && hasWhitespace) {
            return List.of(line.split(","), WHITESPACE.split(line.replace(',', '.')));
        }
        if (hasComma) {
            return List.<String[]>of(line.split(","));
        }
        return List.<String[]>of(WHITESPACE.split(line));
    }

    /**
     * Valores numéricos de la fila, o {@code null} si alguno no lo es.
     */
    private static double[] parse(String[] tokens) {
        double[] values = new double[tokens.length];
        for (int i = 0; i < tokens.length; i++) {
            try {
                values[i] = Double.parseDouble(tokens[i].trim());
            } catch (NumberFormatException e) {
                return null;
            }
            if (!Double.isFinite(values[i])) {
                return null;
            }
        }
        return values;
    }
}
