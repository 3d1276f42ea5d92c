package com.relcore.analysis;

import com.relcore.exception.AnalysisException;
import com.relcore.expression.AggregateFunction;
import com.relcore.expression.Expression;
import com.relcore.expression.ScalarFunction;
import com.relcore.types.DataTypes;
import com.relcore.types.IntegerType;
import com.relcore.types.LongType;
import com.relcore.types.StringType;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FunctionRegistry} backed by a concurrent map. Function names are case insensitive.
 *
 * <p>{@link #withBuiltins()} returns a registry holding the built-in functions:
 * <ul>
 *   <li>aggregates: count, sum, min, max, avg</li>
 *   <li>scalars: upper, lower, abs</li>
 * </ul>
 */
public class SimpleFunctionRegistry implements FunctionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SimpleFunctionRegistry.class);

    private final Map<String, FunctionBuilder> functions = new ConcurrentHashMap<>();

    /**
     * Creates a registry holding the built-in functions.
     *
     * @return the registry
     */
    public static SimpleFunctionRegistry withBuiltins() {
        SimpleFunctionRegistry registry = new SimpleFunctionRegistry();
        registry.registerFunction("count", aggregate(AggregateFunction.Kind.COUNT));
        registry.registerFunction("sum", aggregate(AggregateFunction.Kind.SUM));
        registry.registerFunction("min", aggregate(AggregateFunction.Kind.MIN));
        registry.registerFunction("max", aggregate(AggregateFunction.Kind.MAX));
        registry.registerFunction("avg", aggregate(AggregateFunction.Kind.AVG));
        registry.registerFunction("upper", string("upper", s -> s.toUpperCase(Locale.ROOT)));
        registry.registerFunction("lower", string("lower", s -> s.toLowerCase(Locale.ROOT)));
        registry.registerFunction("abs", SimpleFunctionRegistry::abs);
        return registry;
    }

    @Override
    public void registerFunction(String name, FunctionBuilder builder) {
        functions.put(normalize(name), builder);
        logger.debug("Registered function {}", name);
    }

    @Override
    public Expression lookupFunction(String name, List<Expression> children) {
        FunctionBuilder builder = functions.get(normalize(name));
        if (builder == null) {
            throw new AnalysisException("undefined function " + name);
        }
        return builder.build(children);
    }

    @Override
    public boolean functionExists(String name) {
        return functions.containsKey(normalize(name));
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static void checkArity(String name, List<Expression> children, int arity) {
        if (children.size() != arity) {
            throw new AnalysisException("function %s takes %d argument(s), got %d"
                .formatted(name, arity, children.size()));
        }
    }

    private static FunctionBuilder aggregate(AggregateFunction.Kind kind) {
        return children -> {
            checkArity(kind.name().toLowerCase(Locale.ROOT), children, 1);
            return new AggregateFunction(kind, children.get(0));
        };
    }

    private static FunctionBuilder string(String name, Function<String, String> f) {
        return children -> {
            checkArity(name, children, 1);
            if (!(children.get(0).dataType() instanceof StringType)) {
                throw new AnalysisException("function %s requires a string argument, not %s"
                    .formatted(name, children.get(0).dataType()));
            }
            return new ScalarFunction(name, children, StringType.get(),
                args -> args.get(0) == null ? null : f.apply((String) args.get(0)));
        };
    }

    private static Expression abs(List<Expression> children) {
        checkArity("abs", children, 1);
        Expression child = children.get(0);
        if (!DataTypes.isNumeric(child.dataType())) {
            throw new AnalysisException("function abs requires a numeric argument, not " + child.dataType());
        }
        return new ScalarFunction("abs", children, child.dataType(), args -> {
            Object value = args.get(0);
            if (value == null) {
                return null;
            }
            if (child.dataType() instanceof IntegerType) {
                return Math.abs((Integer) value);
            }
            if (child.dataType() instanceof LongType) {
                return Math.abs((Long) value);
            }
            return Math.abs(((Number) value).doubleValue());
        });
    }
}
