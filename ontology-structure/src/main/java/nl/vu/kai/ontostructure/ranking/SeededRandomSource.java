package nl.vu.kai.ontostructure.ranking;

import java.util.SplittableRandom;

public class SeededRandomSource implements RandomSource {

    private final SplittableRandom random;

    public SeededRandomSource(long seed) {
        this.random = new SplittableRandom(seed);
    }

    private SeededRandomSource(SplittableRandom random) {
        this.random = random;
    }

    public static SeededRandomSource unseeded() {
        return new SeededRandomSource(new SplittableRandom());
    }

    @Override
    public double nextDouble() {
        return random.nextDouble();
    }
}
