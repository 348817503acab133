package nl.vu.kai.ontostructure.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One aggregated row of the relation query: {@code count} triples with predicate {@code predicate}
 * go from an instance of {@code source} to an instance of {@code target}.
 */
public final class RelationCount {

    private final String source;
    private final String predicate;
    private final String target;
    private final double count;

    @JsonCreator
    public RelationCount(@JsonProperty("source") String source,
                         @JsonProperty("predicate") String predicate,
                         @JsonProperty("target") String target,
                         @JsonProperty("count") double count) {
        this.source = source;
        this.predicate = predicate;
        this.target = target;
        this.count = count;
    }

    @JsonProperty
    public String getSource() {
        return source;
    }

    @JsonProperty
    public String getPredicate() {
        return predicate;
    }

    @JsonProperty
    public String getTarget() {
        return target;
    }

    @JsonProperty
    public double getCount() {
        return count;
    }
}
