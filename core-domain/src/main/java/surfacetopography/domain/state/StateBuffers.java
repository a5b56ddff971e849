package surfacetopography.domain.state;

import surfacetopography.domain.topography.HeightArray;

/**
 * Conversión entre {@link HeightArray} y la forma plana que guardan los estados exportados:
 * valores en orden row-major (0.0 en las muestras indefinidas) más una máscara de validez
 * que es null cuando todas las muestras son válidas.
 */
public final class StateBuffers {

    private StateBuffers() {}

    public static double[] values(HeightArray heights) {
        double[] values = heights.toArray();
        for (int k = 0; k < values.length; k++) {
            if (!heights.isValid(k)) values[k] = 0.0;
        }
        return values;
    }

    public static boolean[] mask(HeightArray heights) {
        return heights.hasUndefinedData() ? heights.validMask() : null;
    }

    public static HeightArray toHeights(int[] shape, double[] values, boolean[] mask) {
        return HeightArray.of(shape, values, mask);
    }
}
