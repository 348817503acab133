package nl.vu.kai.ontostructure.store;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * One solution of a SELECT query: variable name to bound term. Unbound variables are absent.
 */
public final class QueryRow {

    private final Map<String, RdfTerm> bindings;

    public QueryRow(Map<String, RdfTerm> bindings) {
        this.bindings = Collections.unmodifiableMap(new LinkedHashMap<>(bindings));
    }

    public Optional<RdfTerm> get(String variable) {
        return Optional.ofNullable(bindings.get(variable));
    }

    public Set<String> variables() {
        return bindings.keySet();
    }

    /**
     * Value of a variable that the query guarantees to be bound.
     */
    public String value(String variable) {
        RdfTerm term = bindings.get(variable);
        if (term == null)
            throw new IllegalStateException("Variable ?" + variable + " is unbound in " + bindings);
        return term.value();
    }

    /**
     * Numeric value of an aggregate such as {@code COUNT(*)}; 0 when unbound or not numeric.
     */
    public double number(String variable) {
        RdfTerm term = bindings.get(variable);
        return term == null ? 0 : term.asNumber().orElse(0);
    }

    @Override
    public String toString() {
        return bindings.toString();
    }
}
