package surfacetopography.parallel;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import surfacetopography.domain.pipeline.DetrendedTopography;
import surfacetopography.domain.topography.HeightArray;
import surfacetopography.domain.topography.HeightContainer;
import surfacetopography.domain.topography.Topography;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Slf4j
class LocalGroupReductionTest {

    private static final int NX = 9;
    private static final int NY = 6;

    private ExecutorService executor;
    private HeightArray global;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        double[][] h = new double[NX][NY];
        for (int i = 0; i < NX; i++) {
            for (int j = 0; j < NY; j++) {
                h[i][j] = Math.sin(0.9 * i) + 0.3 * j * j + 0.1 * i * j;
            }
        }
        global = HeightArray.of(h);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * Ejecuta la misma tarea en cada miembro del grupo, un hilo por rango.
     */
    private <T> List<T> runOnGroup(int size, Function<LocalGroupReduction, T> task) throws Exception {
        List<Future<T>> futures = new ArrayList<>();
        for (LocalGroupReduction member : LocalGroupReduction.createGroup(size)) {
            futures.add(executor.submit(() -> task.apply(member)));
        }
        List<T> results = new ArrayList<>();
        for (Future<T> future : futures) {
            results.add(future.get(10, TimeUnit.SECONDS));
        }
        return results;
    }

    private Topography localTopography(LocalGroupReduction reduction, List<Decomposition> parts, HeightArray heights) {
        Decomposition part = parts.get(reduction.rank());
        return Topography.builder()
                .heights(heights)
                .physicalSizes(new double[]{3.0, 2.0})
                .decomposition(DecompositionMode.DOMAIN)
                .subdomainLocations(part.subdomainLocations())
                .nbSubdomainGridPts(part.nbSubdomainGridPts())
                .reduction(reduction)
                .build();
    }

    @Test
    @DisplayName("Reducciones colectivas: todos los rangos obtienen el mismo resultado global")
    void collectives_shouldCombineAllRanks() throws Exception {
        // ACT
        List<double[]> results = runOnGroup(3, r -> new double[]{
                r.sum(r.rank() + 1.0),
                r.sum((long) r.rank()),
                r.min(r.rank() * 2.0),
                r.max(r.rank() * 2.0),
                r.any(r.rank() == 2) ? 1 : 0,
                r.sum(new double[]{1, r.rank()})[1]
        });

        // ASSERT
        for (double[] result : results) {
            assertThat(result).containsExactly(6.0, 3.0, 0.0, 4.0, 1.0, 3.0);
        }
    }

    @Test
    @DisplayName("Topografía repartida: media, extremos y datos indefinidos coinciden con la ejecución en serie")
    void decomposedTopography_statisticsMatchSerial() throws Exception {
        // ARRANGE
        Topography serial = new Topography(global, new double[]{3.0, 2.0}, false, null);
        List<Decomposition> parts = DomainDecomposer.grid(new int[]{NX, NY}, 2, 2);

        // ACT
        List<double[]> results = runOnGroup(4, r -> {
            Topography local = localTopography(r, parts, global);
            return new double[]{local.mean(), local.min(), local.max(), local.hasUndefinedData() ? 1 : 0};
        });

        // ASSERT
        for (double[] result : results) {
            assertEquals(serial.mean(), result[0], 1e-12);
            assertEquals(serial.min(), result[1], 1e-12);
            assertEquals(serial.max(), result[2], 1e-12);
            assertEquals(0.0, result[3]);
        }
    }

    @Test
    @DisplayName("Datos indefinidos en un solo rango: todos los rangos lo detectan")
    void decomposedTopography_undefinedDataIsGlobal() throws Exception {
        double[] values = global.toArray();
        values[values.length - 1] = Double.NaN;
        HeightArray withHole = HeightArray.of(global.shape(), values);
        List<Decomposition> parts = DomainDecomposer.stripes(new int[]{NX, NY}, 3);

        List<Boolean> results = runOnGroup(3, r -> localTopography(r, parts, withHole).hasUndefinedData());

        assertThat(results).containsOnly(true);
    }

    @Test
    @DisplayName("Detrend repartido: los coeficientes del ajuste coinciden con el ajuste en serie")
    void decomposedDetrend_matchesSerialFit() throws Exception {
        // ARRANGE
        Topography serial = new Topography(global, new double[]{3.0, 2.0}, false, null);
        double[] expectedPlane = new DetrendedTopography(serial, "height").getCoeffs();
        double[] expectedQuadratic = new DetrendedTopography(serial, "curvature").getCoeffs();
        HeightArray serialResidual = new DetrendedTopography(serial, "height").heights();
        List<Decomposition> parts = DomainDecomposer.grid(new int[]{NX, NY}, 3, 1);

        // ACT
        List<double[][]> results = runOnGroup(3, r -> {
            Topography local = localTopography(r, parts, global);
            DetrendedTopography plane = new DetrendedTopography(local, "height");
            DetrendedTopography quadratic = new DetrendedTopography(local, "curvature");
            HeightArray residual = plane.heights();
            int[] loc = local.subdomainLocations();
            return new double[][]{plane.getCoeffs(), quadratic.getCoeffs(),
                    {residual.get(0, 0), serialResidual.get(loc[0], loc[1])}};
        });

        // ASSERT
        for (double[][] result : results) {
            assertThat(result[0]).containsExactly(expectedPlane, within(1e-10));
            assertThat(result[1]).containsExactly(expectedQuadratic, within(1e-10));
            assertEquals(result[2][1], result[2][0], 1e-10, "La reconstrucción usa el índice global.");
        }
    }

    @Test
    @DisplayName("Squeeze repartido: conserva el subdominio y la malla global")
    void decomposedSqueeze_keepsSubdomain() throws Exception {
        List<Decomposition> parts = DomainDecomposer.stripes(new int[]{NX, NY}, 2);

        List<HeightContainer> results = runOnGroup(2, r -> localTopography(r, parts, global).scale(2.0).squeeze());

        for (int rank = 0; rank < 2; rank++) {
            HeightContainer squeezed = results.get(rank);
            assertThat(squeezed.nbGridPts()).containsExactly(NX, NY);
            assertThat(squeezed.subdomainLocations()).containsExactly(parts.get(rank).subdomainLocations());
            assertTrue(squeezed.isDomainDecomposed());
        }
    }

    @Test
    @DisplayName("Topografía repartida: modo SERIAL con varios procesos y parámetros ausentes son errores")
    void decomposedTopography_invalidConstruction() throws Exception {
        List<String> errors = runOnGroup(2, r -> {
            List<String> messages = new ArrayList<>();
            try {
                new Topography(global, new double[]{1, 1}, false, null);
                Topography.builder().heights(global).physicalSizes(new double[]{1, 1}).reduction(r).build();
            } catch (IllegalArgumentException e) {
                messages.add(e.getMessage());
            }
            try {
                Topography.builder().heights(global).physicalSizes(new double[]{1, 1}).reduction(r)
                        .decomposition(DecompositionMode.SUBDOMAIN).subdomainLocations(new int[]{0, 0}).build();
            } catch (IllegalArgumentException e) {
                messages.add(e.getMessage());
            }
            return String.join(" | ", messages);
        });

        for (String message : errors) {
            assertThat(message).contains("SERIAL").contains("nbGridPts");
        }
        assertFalse(new Topography(global, new double[]{1, 1}, false, null).isDomainDecomposed());
        assertThatThrownBy(() -> LocalGroupReduction.createGroup(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
