package nl.vu.kai.ontostructure.mutation;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ListMultimap;

import java.util.List;

public final class MutationReport {

    private final List<String> removedClasses;
    private final ListMultimap<String, String> droppedPredicates;
    private final int typeRewrites;
    private final long triplesBefore;
    private final long triplesAfter;

    public MutationReport(List<String> removedClasses, ListMultimap<String, String> droppedPredicates,
                          int typeRewrites, long triplesBefore, long triplesAfter) {
        this.removedClasses = ImmutableList.copyOf(removedClasses);
        this.droppedPredicates = ImmutableListMultimap.copyOf(droppedPredicates);
        this.typeRewrites = typeRewrites;
        this.triplesBefore = triplesBefore;
        this.triplesAfter = triplesAfter;
    }

    public List<String> getRemovedClasses() {
        return removedClasses;
    }

    /**
     * Class to the predicates deleted from its instances.
     */
    public ListMultimap<String, String> getDroppedPredicates() {
        return droppedPredicates;
    }

    public int getTypeRewrites() {
        return typeRewrites;
    }

    public long getTriplesBefore() {
        return triplesBefore;
    }

    public long getTriplesAfter() {
        return triplesAfter;
    }

    public long getTripleDelta() {
        return triplesAfter - triplesBefore;
    }

    @Override
    public String toString() {
        return "removed " + removedClasses.size() + " classes, dropped " + droppedPredicates.size()
                + " predicates, " + typeRewrites + " type rewrites, " + triplesBefore + " -> " + triplesAfter + " triples";
    }
}
