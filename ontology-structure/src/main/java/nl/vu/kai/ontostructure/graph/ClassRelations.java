package nl.vu.kai.ontostructure.graph;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Cached form of a {@link ClassGraph}: the typed classes and the aggregated relations between them.
 */
public final class ClassRelations {

    private final List<String> classes;
    private final List<RelationCount> relations;

    @JsonCreator
    public ClassRelations(@JsonProperty("classes") List<String> classes,
                          @JsonProperty("relations") List<RelationCount> relations) {
        this.classes = List.copyOf(classes);
        this.relations = List.copyOf(relations);
    }

    @JsonProperty
    public List<String> getClasses() {
        return classes;
    }

    @JsonProperty
    public List<RelationCount> getRelations() {
        return relations;
    }

    public ClassGraph toGraph() {
        ClassGraph.Builder builder = ClassGraph.builder();
        classes.forEach(builder::addNode);
        relations.forEach(r -> builder.addEdge(r.getSource(), r.getPredicate(), r.getTarget(), r.getCount()));
        return builder.build();
    }
}
