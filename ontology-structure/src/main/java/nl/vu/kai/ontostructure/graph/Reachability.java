package nl.vu.kai.ontostructure.graph;

import java.util.Objects;

/**
 * A class reached from the root, with its breadth-first distance.
 */
public final class Reachability {

    private final String classIri;
    private final int depth;

    public Reachability(String classIri, int depth) {
        this.classIri = classIri;
        this.depth = depth;
    }

    public String getClassIri() {
        return classIri;
    }

    public int getDepth() {
        return depth;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Reachability that = (Reachability) o;
        return depth == that.depth && classIri.equals(that.classIri);
    }

    @Override
    public int hashCode() {
        return Objects.hash(classIri, depth);
    }

    @Override
    public String toString() {
        return classIri + "@" + depth;
    }
}
