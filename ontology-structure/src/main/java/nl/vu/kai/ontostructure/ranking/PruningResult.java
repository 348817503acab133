package nl.vu.kai.ontostructure.ranking;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

public final class PruningResult {

    private static final Comparator<ClassRoundRecord> RANKING =
            Comparator.comparingInt(ClassRoundRecord::getRound).reversed()
                    .thenComparing(Comparator.comparingDouble(ClassRoundRecord::getScore).reversed())
                    .thenComparing(ClassRoundRecord::getClassIri);

    private final List<String> keepSet;
    private final Map<String, ClassRoundRecord> records;
    private final RankTables forwardRanks;

    public PruningResult(List<String> keepSet, Map<String, ClassRoundRecord> records, RankTables forwardRanks) {
        this.keepSet = ImmutableList.copyOf(keepSet);
        this.records = ImmutableMap.copyOf(records);
        this.forwardRanks = forwardRanks;
    }

    /**
     * Surviving classes, deepest first.
     */
    public List<String> getKeepSet() {
        return keepSet;
    }

    public boolean isKept(String classIri) {
        return keepSet.contains(classIri);
    }

    public Map<String, ClassRoundRecord> getRecords() {
        return records;
    }

    /**
     * Last recorded score per class.
     */
    public Map<String, Double> getScores() {
        return records.values().stream()
                .collect(Collectors.toMap(ClassRoundRecord::getClassIri, ClassRoundRecord::getScore,
                        (a, b) -> a, LinkedHashMap::new));
    }

    /**
     * Records ordered by the last round a class survived to, then by score.
     */
    public List<ClassRoundRecord> getRanking() {
        return records.values().stream().sorted(RANKING).collect(Collectors.toList());
    }

    /**
     * Forward ranks of the last round, whose edge ranks feed the predicate analysis.
     */
    public RankTables getForwardRanks() {
        return forwardRanks;
    }
}
