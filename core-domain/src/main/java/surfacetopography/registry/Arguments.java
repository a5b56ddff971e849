package surfacetopography.registry;

/**
 * Lectura tipada de los argumentos posicionales que llegan a una {@link TopographyFunction}.
 * Un argumento ausente o nulo toma el valor por defecto; uno de tipo incorrecto es un error de entrada.
 */
public final class Arguments {

    private Arguments() {}

    public static boolean isPresent(Object[] args, int index) {
        return args != null && args.length > index && args[index] != null;
    }

    public static double asDouble(Object[] args, int index, String name) {
        Object value = require(args, index, name);
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw wrongType(name, "número", value);
    }

    public static int asInt(Object[] args, int index, String name) {
        Object value = require(args, index, name);
        if (value instanceof Integer || value instanceof Long || value instanceof Short) {
            return ((Number) value).intValue();
        }
        throw wrongType(name, "entero", value);
    }

    public static int asInt(Object[] args, int index, String name, int defaultValue) {
        return isPresent(args, index) ? asInt(args, index, name) : defaultValue;
    }

    public static String asString(Object[] args, int index, String name, String defaultValue) {
        if (!isPresent(args, index)) {
            return defaultValue;
        }
        Object value = args[index];
        if (value instanceof String s) {
            return s;
        }
        throw wrongType(name, "texto", value);
    }

    /**
     * @return El booleano indicado, o null si el argumento no se proporcionó.
     */
    public static Boolean asOptionalBoolean(Object[] args, int index, String name) {
        if (!isPresent(args, index)) {
            return null;
        }
        Object value = args[index];
        if (value instanceof Boolean b) {
            return b;
        }
        throw wrongType(name, "booleano", value);
    }

    /**
     * Lee un vector de enteros, aceptando tanto {@code int[]} como varios enteros sueltos a partir del índice.
     */
    public static int[] asIntVector(Object[] args, int index, String name) {
        Object value = require(args, index, name);
        if (value instanceof int[] vector) {
            return vector.clone();
        }
        int[] vector = new int[args.length - index];
        for (int k = index; k < args.length; k++) {
            vector[k - index] = asInt(args, k, name);
        }
        return vector;
    }

    private static Object require(Object[] args, int index, String name) {
        if (!isPresent(args, index)) {
            throw new IllegalArgumentException("Falta el argumento obligatorio '" + name + "'.");
        }
        return args[index];
    }

    private static IllegalArgumentException wrongType(String name, String expected, Object value) {
        return new IllegalArgumentException(String.format(
                "El argumento '%s' debe ser de tipo %s, recibido %s.", name, expected, value.getClass().getSimpleName()));
    }
}
