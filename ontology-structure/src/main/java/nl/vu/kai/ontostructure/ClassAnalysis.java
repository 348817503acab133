package nl.vu.kai.ontostructure;

import com.google.common.collect.ImmutableList;
import nl.vu.kai.ontostructure.predicates.PredicateDecision;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Predicate decisions for one kept class. Absent decisions mean the class has no informative predicate.
 */
public final class ClassAnalysis {

    private final String classIri;
    private final List<PredicateDecision> decisions;

    private ClassAnalysis(String classIri, List<PredicateDecision> decisions) {
        this.classIri = classIri;
        this.decisions = decisions;
    }

    public static ClassAnalysis of(String classIri, List<PredicateDecision> decisions) {
        return new ClassAnalysis(classIri, ImmutableList.copyOf(decisions));
    }

    public static ClassAnalysis uninformative(String classIri) {
        return new ClassAnalysis(classIri, null);
    }

    public String getClassIri() {
        return classIri;
    }

    public Optional<List<PredicateDecision>> getDecisions() {
        return Optional.ofNullable(decisions);
    }

    public List<String> droppedPredicates() {
        return getDecisions().orElse(List.of()).stream()
                .filter(d -> !d.isKeep())
                .map(PredicateDecision::getPredicate)
                .collect(Collectors.toList());
    }

    public boolean isDropped(String predicate) {
        return droppedPredicates().contains(predicate);
    }
}
