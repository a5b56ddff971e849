package surfacetopography.physics.solver.impl;

import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.physics.solver.DerivativeKernel;

import java.util.List;

/**
 * Diferencias finitas sobre line scans con separación variable. Nunca periódico.
 * <p>
 * Primera derivada entre muestras consecutivas, {@code Δh/Δx} (n-1 valores). Segunda derivada con el
 * stencil de tres puntos para separaciones desiguales (n-2 valores):
 * <pre>
 *   d²h/dx² ≈ 2·(dxm·(h[i+1]-h[i]) + dxp·(h[i-1]-h[i])) / (dxp·dxm·(dxp+dxm))
 * </pre>
 * con {@code dxp = x[i+1]-x[i]} y {@code dxm = x[i]-x[i-1]}.
 */
public class NonuniformFiniteDifferenceKernel implements DerivativeKernel {

    @Override
    public String getName() {
        return "FD_Nonuniform";
    }

    @Override
    public String getDescription() {
        return "Diferencias entre vecinos con separación variable (stencil de tres puntos desigual para orden 2).";
    }

    @Override
    public List<HeightArray> derivative(HeightContainer topography, int n, Boolean periodic, int scaleFactor) {
        DerivativeKernel.checkOrder(n);
        if (Boolean.TRUE.equals(periodic)) {
            throw new IllegalArgumentException("Un line scan no uniforme no puede derivarse como periódico.");
        }
        if (scaleFactor != 1) {
            throw new IllegalArgumentException(
                    "La separación del stencil solo está soportada en mallas uniformes, recibido " + scaleFactor + ".");
        }
        HeightArray x = topography.positions().get(0);
        HeightArray h = topography.heights();
        int size = h.size();
        if (size <= n) {
            throw new IllegalArgumentException(String.format(
                    "Se necesitan más de %d puntos para la derivada de orden %d.", n, n));
        }

        double[] out = new double[size - n];
        boolean[] valid = new boolean[out.length];
        boolean allValid = true;
        for (int i = 0; i < out.length; i++) {
            boolean ok = h.isValid(i) && h.isValid(i + 1) && (n == 1 || h.isValid(i + 2));
            valid[i] = ok;
            if (!ok) {
                allValid = false;
                out[i] = Double.NaN;
            } else if (n == 1) {
                out[i] = (h.get(i + 1) - h.get(i)) / (x.get(i + 1) - x.get(i));
            } else {
                double dxp = x.get(i + 2) - x.get(i + 1);
                double dxm = x.get(i + 1) - x.get(i);
                out[i] = 2 * (dxm * (h.get(i + 2) - h.get(i + 1)) + dxp * (h.get(i) - h.get(i + 1)))
                        / (dxp * dxm * (dxp + dxm));
            }
        }
        return List.of(HeightArray.of(new int[]{out.length}, out, allValid ? null : valid));
    }
}
