package org.pragmatica.pascal.eval;

import org.pragmatica.pascal.value.Numeric;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of evaluating a program: final variables by display name, in first-assignment order, and the last computed value.
 */
public record Evaluation(Map<String, Numeric> variables, Numeric lastValue) {

    public Evaluation {
        variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    public static Evaluation of(Evaluator evaluator) {
        return new Evaluation(evaluator.environment()
                                       .asMap(),
                              evaluator.accumulator());
    }

    /**
     * Variable lookup with the same case folding as {@link Environment}.
     */
    public Optional<Numeric> variable(String name) {
        var key = Environment.key(name);
        return variables.entrySet()
                        .stream()
                        .filter(entry -> Environment.key(entry.getKey())
                                                    .equals(key))
                        .map(Map.Entry::getValue)
                        .findFirst();
    }
}
