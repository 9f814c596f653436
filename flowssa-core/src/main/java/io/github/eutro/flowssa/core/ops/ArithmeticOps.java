package io.github.eutro.flowssa.core.ops;

import org.jetbrains.annotations.Nullable;

import java.util.*;

/**
 * The operators that can be evaluated on constants, by callee name.
 * <p>
 * Evaluation follows R on scalar values: logicals act as integers in arithmetic,
 * integer {@code + - * %% %/%} stay integer, {@code /} and {@code ^} always give doubles,
 * and mixing integers with doubles gives a double. Results that R would give as {@code NA}
 * (integer overflow, integer division by zero, {@code NaN}) are not constants.
 */
public final class ArithmeticOps {
    private static final Map<String, ConstantFolder> BINARY = new HashMap<>();
    private static final Map<String, ConstantFolder> UNARY = new HashMap<>();

    private ArithmeticOps() {
    }

    /**
     * Whether a call to {@code fn} with {@code arity} arguments may be evaluated on constants.
     *
     * @param fn    The callee.
     * @param arity The number of arguments.
     * @return Whether the call is foldable.
     */
    public static boolean isFoldable(String fn, int arity) {
        return getFolder(fn, arity) != null;
    }

    /**
     * Get the folder of a call.
     *
     * @param fn    The callee.
     * @param arity The number of arguments.
     * @return The folder, or null if the call is not foldable.
     */
    public static @Nullable ConstantFolder getFolder(String fn, int arity) {
        switch (arity) {
            case 1:
                return UNARY.get(fn);
            case 2:
                return BINARY.get(fn);
            default:
                return null;
        }
    }

    /**
     * Evaluate a call on constant arguments.
     *
     * @param fn   The callee.
     * @param args The argument values.
     * @return The result, or empty if the call is not foldable or has no single constant result.
     */
    public static Optional<Object> fold(String fn, List<Object> args) {
        ConstantFolder folder = getFolder(fn, args.size());
        if (folder == null) return Optional.empty();
        return folder.fold(args);
    }

    /**
     * Get the truth value a constant has as the condition of an {@code if} or loop.
     *
     * @param value The constant.
     * @return The truth value, or empty if the constant is not a valid condition.
     */
    public static Optional<Boolean> truthiness(@Nullable Object value) {
        if (value instanceof Boolean) return Optional.of((Boolean) value);
        if (value instanceof Integer) {
            if (isNa((Integer) value)) return Optional.empty();
            return Optional.of((Integer) value != 0);
        }
        if (value instanceof Double) {
            double d = (Double) value;
            if (Double.isNaN(d)) return Optional.empty();
            return Optional.of(d != 0);
        }
        return Optional.empty();
    }

    private interface IntOp {
        long apply(long a, long b);
    }

    private interface DoubleOp {
        double apply(double a, double b);
    }

    private interface Comparison {
        boolean test(double a, double b);
    }

    private static boolean isNa(int value) {
        return value == Integer.MIN_VALUE;
    }

    private static boolean isNumeric(@Nullable Object value) {
        if (value instanceof Boolean) return true;
        if (value instanceof Integer) return !isNa((Integer) value);
        if (value instanceof Double) return !Double.isNaN((Double) value);
        return false;
    }

    private static boolean isIntLike(Object value) {
        return value instanceof Boolean || value instanceof Integer;
    }

    private static int asInt(Object value) {
        if (value instanceof Boolean) return (Boolean) value ? 1 : 0;
        return (Integer) value;
    }

    private static double asDouble(Object value) {
        if (value instanceof Double) return (Double) value;
        return asInt(value);
    }

    private static Optional<Object> ofInt(long value) {
        if (value > Integer.MAX_VALUE || value <= Integer.MIN_VALUE) return Optional.empty();
        return Optional.of((int) value);
    }

    private static Optional<Object> ofDouble(double value) {
        if (Double.isNaN(value)) return Optional.empty();
        return Optional.of(value);
    }

    private static void arith(String name, @Nullable IntOp intOp, DoubleOp doubleOp) {
        BINARY.put(name, args -> {
            Object lhs = args.get(0);
            Object rhs = args.get(1);
            if (!isNumeric(lhs) || !isNumeric(rhs)) return Optional.empty();
            if (intOp != null && isIntLike(lhs) && isIntLike(rhs)) {
                int a = asInt(lhs);
                int b = asInt(rhs);
                try {
                    return ofInt(intOp.apply(a, b));
                } catch (ArithmeticException e) {
                    return Optional.empty(); // NA_integer_
                }
            }
            return ofDouble(doubleOp.apply(asDouble(lhs), asDouble(rhs)));
        });
    }

    private static void compare(String name, Comparison cmp) {
        BINARY.put(name, args -> {
            Object lhs = args.get(0);
            Object rhs = args.get(1);
            if (isNumeric(lhs) && isNumeric(rhs)) {
                return Optional.of(cmp.test(asDouble(lhs), asDouble(rhs)));
            }
            return Optional.empty();
        });
    }

    private static Optional<Boolean> logical(@Nullable Object value) {
        if (!isNumeric(value)) return Optional.empty();
        return truthiness(value);
    }

    static {
        arith("+", Long::sum, Double::sum);
        arith("-", (a, b) -> a - b, (a, b) -> a - b);
        arith("*", (a, b) -> a * b, (a, b) -> a * b);
        arith("/", null, (a, b) -> a / b);
        arith("^", null, Math::pow);
        arith("%%", (a, b) -> {
            if (b == 0) throw new ArithmeticException("integer modulo by zero");
            return Math.floorMod(a, b);
        }, (a, b) -> a - Math.floor(a / b) * b);
        arith("%/%", (a, b) -> {
            if (b == 0) throw new ArithmeticException("integer division by zero");
            return Math.floorDiv(a, b);
        }, (a, b) -> Math.floor(a / b));

        compare("<", (a, b) -> a < b);
        compare(">", (a, b) -> a > b);
        compare("<=", (a, b) -> a <= b);
        compare(">=", (a, b) -> a >= b);
        for (String eqOp : new String[]{"==", "!="}) {
            boolean negate = eqOp.equals("!=");
            BINARY.put(eqOp, args -> {
                Object lhs = args.get(0);
                Object rhs = args.get(1);
                if (lhs instanceof String && rhs instanceof String) {
                    return Optional.of(lhs.equals(rhs) != negate);
                }
                if (isNumeric(lhs) && isNumeric(rhs)) {
                    return Optional.of((asDouble(lhs) == asDouble(rhs)) != negate);
                }
                return Optional.empty();
            });
        }

        for (String andOp : new String[]{"&", "&&"}) {
            BINARY.put(andOp, args -> {
                Optional<Boolean> lhs = logical(args.get(0));
                Optional<Boolean> rhs = logical(args.get(1));
                if (!lhs.isPresent() || !rhs.isPresent()) return Optional.empty();
                return Optional.of(lhs.get() && rhs.get());
            });
        }
        for (String orOp : new String[]{"|", "||"}) {
            BINARY.put(orOp, args -> {
                Optional<Boolean> lhs = logical(args.get(0));
                Optional<Boolean> rhs = logical(args.get(1));
                if (!lhs.isPresent() || !rhs.isPresent()) return Optional.empty();
                return Optional.of(lhs.get() || rhs.get());
            });
        }

        UNARY.put("-", args -> {
            Object value = args.get(0);
            if (!isNumeric(value)) return Optional.empty();
            if (isIntLike(value)) return ofInt(-(long) asInt(value));
            return ofDouble(-asDouble(value));
        });
        UNARY.put("+", args -> {
            Object value = args.get(0);
            if (!isNumeric(value)) return Optional.empty();
            if (isIntLike(value)) return ofInt(asInt(value));
            return ofDouble(asDouble(value));
        });
        UNARY.put("!", args -> {
            Optional<Boolean> value = logical(args.get(0));
            return value.<Object>map(b -> !b);
        });
        UNARY.put("(", args -> Optional.ofNullable(args.get(0)));
    }
}
