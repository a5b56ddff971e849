package surfacetopography.parallel;

/**
 * Reducción trivial para ejecuciones de un solo proceso: todas las operaciones devuelven el valor local.
 */
public final class SerialReduction implements Reduction {

    public static final SerialReduction INSTANCE = new SerialReduction();

    private SerialReduction() {}

    @Override
    public int rank() {
        return 0;
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public double sum(double localValue) {
        return localValue;
    }

    @Override
    public long sum(long localValue) {
        return localValue;
    }

    @Override
    public double[] sum(double[] localValues) {
        return localValues.clone();
    }

    @Override
    public double min(double localValue) {
        return localValue;
    }

    @Override
    public double max(double localValue) {
        return localValue;
    }

    @Override
    public boolean any(boolean localValue) {
        return localValue;
    }

    @Override
    public String toString() {
        return "SerialReduction";
    }
}
