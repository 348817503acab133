package nl.vu.kai.ontostructure.tools;

import java.util.Objects;

public class Pair<V,H> {
    private final V key;
    private final H value;

    public Pair(V key, H value) {
        this.key = key;
        this.value = value;
    }

    public static <V,H> Pair<V,H> of(V key, H value) {
        return new Pair<>(key, value);
    }

    public V getKey() {
        return key;
    }

    public H getValue() {
        return value;
    }

    @Override
    public String toString() {
        return key + "=" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (o == null || getClass() != o.getClass()) return false;
        Pair<?, ?> pair = (Pair<?, ?>) o;
        return Objects.equals(key, pair.key) && Objects.equals(value, pair.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, value);
    }
}
