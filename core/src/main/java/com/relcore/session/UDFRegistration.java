package com.relcore.session;

import com.relcore.analysis.FunctionRegistry;
import com.relcore.expression.ScalarFunction;
import com.relcore.types.DataType;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Registers user-defined scalar functions with a session.
 *
 * <p>Example usage:
 * <pre>
 *   session.udf().register("strLen", IntegerType.get(), args -&gt; ((String) args.get(0)).length());
 *   session.sql("SELECT strLen(name) FROM people");
 * </pre>
 */
public class UDFRegistration {

    private final FunctionRegistry registry;

    UDFRegistration(FunctionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Registers a function, replacing any function of the same name.
     *
     * @param name the function name
     * @param returnType the result type
     * @param function the implementation, receiving the evaluated arguments
     */
    public void register(String name, DataType returnType, Function<List<Object>, Object> function) {
        Objects.requireNonNull(returnType, "returnType must not be null");
        Objects.requireNonNull(function, "function must not be null");
        registry.registerFunction(name, children -> new ScalarFunction(name, children, returnType, function));
    }
}
