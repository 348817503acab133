package nl.vu.kai.ontostructure;

public enum AnalysisPhase {
    GRAPH_BUILD,
    RANKING,
    PREDICATE_ANALYSIS,
    MUTATION
}
