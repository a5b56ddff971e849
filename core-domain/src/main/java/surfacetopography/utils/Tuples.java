package surfacetopography.utils;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Formato homogéneo de tuplas (resoluciones, tamaños físicos, offsets) para mensajes de error y logs.
 * Ejemplo: {@code (8, 9)} o {@code (1.0, 2.5)}.
 */
public final class Tuples {

    private Tuples() {}

    public static String format(int[] values) {
        if (values == null) return "None";
        return Arrays.stream(values)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining(", ", "(", values.length == 1 ? ",)" : ")"));
    }

    public static String format(double[] values) {
        if (values == null) return "None";
        return Arrays.stream(values)
                .mapToObj(String::valueOf)
                .collect(Collectors.joining(", ", "(", values.length == 1 ? ",)" : ")"));
    }
}
