package nl.vu.kai.ontostructure.tools;

/**
 * Pair whose equality ignores the order of its elements, e.g. two classes asserted for one entity.
 */
public class UnorderedPair<T> extends Pair<T,T> {
    public UnorderedPair(T a, T b){
        super(a,b);
    }

    @Override
    public boolean equals(Object o) {
        if(this==o)
            return true;
        if(!(o instanceof UnorderedPair))
            return false;
        UnorderedPair<?> other = (UnorderedPair<?>) o;
        return (getKey().equals(other.getKey()) && getValue().equals(other.getValue())) ||
                (getKey().equals(other.getValue()) && getValue().equals(other.getKey()));
    }

    @Override
    public int hashCode(){
        return getKey().hashCode()+getValue().hashCode();
    }
}
