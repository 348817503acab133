package nl.vu.kai.ontostructure.ranking;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableTable;
import com.google.common.collect.Table;

import java.util.Map;

/**
 * Result of one ranking direction: the visitation share per class and the traversal share per
 * (class, predicate).
 */
public final class RankTables {

    private final Map<String, Double> pageRank;
    private final Table<String, String, Double> edgeRank;

    public RankTables(Map<String, Double> pageRank, Table<String, String, Double> edgeRank) {
        this.pageRank = ImmutableMap.copyOf(pageRank);
        this.edgeRank = ImmutableTable.copyOf(edgeRank);
    }

    public static RankTables empty() {
        return new RankTables(ImmutableMap.of(), ImmutableTable.of());
    }

    public double pageRank(String classIri) {
        return pageRank.getOrDefault(classIri, 0.0);
    }

    public Map<String, Double> getPageRank() {
        return pageRank;
    }

    /**
     * @return predicate to traversal share for walks leaving {@code classIri}; empty if never left
     */
    public Map<String, Double> edgeRank(String classIri) {
        return edgeRank.row(classIri);
    }

    public Table<String, String, Double> getEdgeRank() {
        return edgeRank;
    }
}
