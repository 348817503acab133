package nl.vu.kai.ontostructure.mutation;

import nl.vu.kai.ontostructure.Fixtures;
import nl.vu.kai.ontostructure.store.JenaStore;
import nl.vu.kai.ontostructure.tools.UnorderedPair;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.util.Map;

import static org.junit.Assert.*;

public class TestDuplicateTypeResolver {

    private static final String EX = "http://example.org/";
    private static final String ADDITIONAL_TYPE = Fixtures.SCHEMA + "additionalType";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private JenaStore store;
    private DuplicateTypeResolver resolver;

    @Before
    public void setUp() throws Exception {
        store = Fixtures.empty(folder, "duplicates");
        resolver = new DuplicateTypeResolver(store, Fixtures.RDF_TYPE, ADDITIONAL_TYPE);
    }

    private boolean ask(String pattern) throws Exception {
        return !store.query("SELECT * WHERE { " + pattern + " } LIMIT 1").isEmpty();
    }

    @Test
    public void testHigherScoreStaysPrimary() throws Exception {
        store.update("INSERT DATA { <" + EX + "E> a <" + EX + "A> , <" + EX + "B> }");

        int rewrites = resolver.resolve(Map.of(EX + "A", 0.9, EX + "B", 0.4));

        assertEquals(1, rewrites);
        assertTrue(ask("<" + EX + "E> a <" + EX + "A>"));
        assertFalse(ask("<" + EX + "E> a <" + EX + "B>"));
        assertTrue(ask("<" + EX + "E> <" + ADDITIONAL_TYPE + "> <" + EX + "B>"));
        assertTrue(resolver.conflicts().isEmpty());
        assertTrue(store.getHistory().read().contains("```sparql"));
        assertTrue(store.historyVersion() > 0);
    }

    @Test
    public void testThreeTypesReachFixpoint() throws Exception {
        store.update("INSERT DATA { " +
                "<" + EX + "E1> a <" + EX + "A> , <" + EX + "B> , <" + EX + "C> . " +
                "<" + EX + "E2> a <" + EX + "B> , <" + EX + "C> }");

        int rewrites = resolver.resolve(Map.of(EX + "A", 0.2, EX + "B", 0.5, EX + "C", 0.7));

        // A loses to B first, so the A/C pair no longer co-occurs and is skipped
        assertEquals(2, rewrites);
        assertEquals(2L, store.getHistory().read().lines()
                .filter(line -> line.startsWith("Duplicate types"))
                .count());

        assertTrue(ask("<" + EX + "E1> a <" + EX + "C>"));
        assertTrue(ask("<" + EX + "E2> a <" + EX + "C>"));
        assertEquals(1, store.query("SELECT ?t WHERE { <" + EX + "E1> a ?t }").size());
        assertEquals(2, store.query("SELECT ?t WHERE { <" + EX + "E1> <" + ADDITIONAL_TYPE + "> ?t }").size());
        assertTrue(resolver.conflicts().isEmpty());
    }

    @Test
    public void testNoConflicts() throws Exception {
        store.update("INSERT DATA { <" + EX + "E> a <" + EX + "A> }");
        assertEquals(0, resolver.resolve(Map.of()));
        assertEquals(0, store.historyVersion());
    }

    @Test
    public void testWinner() {
        UnorderedPair<String> pair = new UnorderedPair<>("A", "B");
        assertEquals("B", DuplicateTypeResolver.winner(pair, Map.of("A", 0.1, "B", 0.2)));
        assertEquals("A", DuplicateTypeResolver.winner(pair, Map.of("A", 0.3)));
        // ties go to the smaller IRI
        assertEquals("A", DuplicateTypeResolver.winner(new UnorderedPair<>("B", "A"), Map.of()));
        assertEquals(pair, new UnorderedPair<>("B", "A"));
    }
}
