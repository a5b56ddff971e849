package surfacetopography.parallel;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.function.Function;

/**
 * Grupo SPMD en memoria: cada "proceso" es un hilo que posee su propio miembro del grupo.
 * <p>
 * Cada reducción publica el valor local en una ranura, espera a que todos los miembros lleguen
 * a la barrera, combina todas las ranuras y vuelve a esperar antes de que las ranuras se reutilicen.
 * Como en cualquier implementación colectiva, todos los miembros deben invocar las mismas
 * reducciones en el mismo orden; si uno no lo hace, el resto queda bloqueado en la barrera.
 */
@Slf4j
public final class LocalGroupReduction implements Reduction {

    private final Group group;
    private final int rank;

    private LocalGroupReduction(Group group, int rank) {
        this.group = group;
        this.rank = rank;
    }

    /**
     * Crea un grupo de {@code size} miembros. El miembro i tiene rango i.
     */
    public static List<LocalGroupReduction> createGroup(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("El grupo debe tener al menos un miembro.");
        }
        Group group = new Group(size);
        List<LocalGroupReduction> members = new ArrayList<>(size);
        for (int r = 0; r < size; r++) {
            members.add(new LocalGroupReduction(group, r));
        }
        log.debug("Grupo de reducción local creado con {} miembros.", size);
        return Collections.unmodifiableList(members);
    }

    @Override
    public int rank() {
        return rank;
    }

    @Override
    public int size() {
        return group.size;
    }

    @Override
    public double sum(double localValue) {
        return collective(localValue, slots -> Arrays.stream(slots).mapToDouble(v -> (Double) v).sum());
    }

    @Override
    public long sum(long localValue) {
        return collective(localValue, slots -> Arrays.stream(slots).mapToLong(v -> (Long) v).sum());
    }

    @Override
    public double[] sum(double[] localValues) {
        return collective(localValues.clone(), slots -> {
            double[] total = new double[localValues.length];
            for (Object slot : slots) {
                double[] values = (double[]) slot;
                if (values.length != total.length) {
                    throw new IllegalStateException("Los miembros del grupo reducen vectores de longitudes distintas.");
                }
                for (int k = 0; k < total.length; k++) {
                    total[k] += values[k];
                }
            }
            return total;
        });
    }

    @Override
    public double min(double localValue) {
        return collective(localValue, slots -> Arrays.stream(slots).mapToDouble(v -> (Double) v).min().orElseThrow());
    }

    @Override
    public double max(double localValue) {
        return collective(localValue, slots -> Arrays.stream(slots).mapToDouble(v -> (Double) v).max().orElseThrow());
    }

    @Override
    public boolean any(boolean localValue) {
        return collective(localValue, slots -> Arrays.stream(slots).anyMatch(v -> (Boolean) v));
    }

    private <T> T collective(Object localValue, Function<Object[], T> combine) {
        group.slots[rank] = localValue;
        await();
        T result = combine.apply(group.slots);
        await();
        return result;
    }

    private void await() {
        try {
            group.barrier.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Reducción colectiva interrumpida en el rango " + rank + ".", e);
        } catch (BrokenBarrierException e) {
            throw new IllegalStateException("Barrera rota: otro miembro del grupo abandonó la reducción (rango " + rank + ").", e);
        }
    }

    @Override
    public String toString() {
        return "LocalGroupReduction[rank=" + rank + ", size=" + group.size + "]";
    }

    private static final class Group {
        private final int size;
        private final CyclicBarrier barrier;
        private final Object[] slots;

        private Group(int size) {
            this.size = size;
            this.barrier = new CyclicBarrier(size);
            this.slots = new Object[size];
        }
    }
}
