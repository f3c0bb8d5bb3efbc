package com.formula.meta;

import com.formula.ast.Argument;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives transformation parameters and generated column names from function calls.
 */
public final class TransformationRules {

    private static final String POLY = "poly";
    private static final String LOG = "log";
    private static final Set<String> CATEGORICAL = Set.of("c", "factor");

    private TransformationRules() {
    }

    /**
     * First positional identifier argument, i.e. the variable a function is applied to.
     *
     * @return Identifier name, or null when the call has none (e.g. {@code cs(1)})
     */
    public static String baseIdentifier(List<Argument> args) {
        for (Argument arg : args) {
            if (arg instanceof Argument.Ident ident) {
                return ident.name();
            }
        }
        return null;
    }

    public static boolean isCategorical(String function) {
        return CATEGORICAL.contains(function);
    }

    /**
     * Build the transformation record for {@code function(args)} applied to {@code base}.
     */
    public static Transformation transformation(String function, List<Argument> args, String base) {
        return new Transformation(function, parameters(function, args), generatedColumns(function, args, base));
    }

    /**
     * Parameters of a call.
     * <ul>
     *   <li>{@code poly(x, k)}: {@code degree} and {@code orthogonal} ({@code false} with {@code raw = TRUE})</li>
     *   <li>{@code log(x)}: none</li>
     *   <li>anything else: {@code arg_i} for the positional argument at index {@code i}, named ones by name,
     *       so {@code c(x, ref = a)} yields {@code {arg_0: x, ref: a}}</li>
     * </ul>
     */
    public static Map<String, Object> parameters(String function, List<Argument> args) {
        Map<String, Object> params = new LinkedHashMap<>();
        switch (function) {
            case POLY -> {
                Integer degree = polyDegree(args);
                if (degree != null) {
                    params.put("degree", degree);
                    params.put("orthogonal", !isRaw(args));
                }
            }
            case LOG -> {
                // no parameters
            }
            default -> {
                for (int i = 0; i < args.size(); i++) {
                    Argument arg = args.get(i);
                    if (arg instanceof Argument.Named named) {
                        params.put(named.name(), named.value());
                    } else {
                        params.put("arg_" + i, arg.value());
                    }
                }
            }
        }
        return params;
    }

    /**
     * Columns produced by a call on {@code base}.
     */
    public static List<String> generatedColumns(String function, List<Argument> args, String base) {
        if (POLY.equals(function)) {
            Integer degree = polyDegree(args);
            if (degree == null) {
                return List.of(base + "_poly");
            }
            List<String> columns = new ArrayList<>(degree);
            for (int i = 1; i <= degree; i++) {
                columns.add(base + "_poly_" + i);
            }
            return Collections.unmodifiableList(columns);
        }
        return List.of(base + "_" + function);
    }

    private static Integer polyDegree(List<Argument> args) {
        if (args.size() > 1 && args.get(1) instanceof Argument.IntLiteral literal) {
            return literal.number();
        }
        for (Argument arg : args) {
            if (arg instanceof Argument.Named named && "degree".equals(named.name())
                    && named.argument() instanceof Argument.IntLiteral literal) {
                return literal.number();
            }
        }
        return null;
    }

    private static boolean isRaw(List<Argument> args) {
        for (Argument arg : args) {
            if (arg instanceof Argument.Named named && "raw".equals(named.name())
                    && named.argument() instanceof Argument.BoolLiteral bool) {
                return bool.flag();
            }
        }
        return false;
    }
}
