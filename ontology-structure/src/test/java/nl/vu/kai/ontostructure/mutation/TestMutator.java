package nl.vu.kai.ontostructure.mutation;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import nl.vu.kai.ontostructure.Fixtures;
import nl.vu.kai.ontostructure.store.JenaStore;
import nl.vu.kai.ontostructure.store.StoreOperations;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class TestMutator {

    private static final String LIB = "http://example.org/library/";

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    private static Mutator mutator(JenaStore store) {
        return new Mutator(store, Fixtures.RDF_TYPE, Fixtures.SCHEMA + "additionalType");
    }

    private static long count(JenaStore store, String pattern) throws Exception {
        return (long) store.query("SELECT (COUNT(*) AS ?count) WHERE { " + pattern + " }").get(0).number("count");
    }

    @Test
    public void testRemoveClass() throws Exception {
        JenaStore store = Fixtures.library(folder);
        store.update("INSERT DATA { <" + LIB + "review0> a <http://schema.org/CreativeWork> }");

        mutator(store).removeClass(Fixtures.REVIEW);

        assertEquals(0, count(store, "?s a <" + Fixtures.REVIEW + ">"));
        // review0 has another type and keeps its data
        assertEquals(3, count(store, "<" + LIB + "review0> ?p ?o"));
        assertEquals(0, count(store, "<" + LIB + "review1> ?p ?o"));
        assertTrue(store.getHistory().read().startsWith("Removing class " + Fixtures.REVIEW));
    }

    @Test
    public void testDropPredicate() throws Exception {
        JenaStore store = Fixtures.library(folder);
        mutator(store).dropPredicate(Fixtures.BOOK, Fixtures.GENRE);
        assertEquals(0, count(store, "?s <" + Fixtures.GENRE + "> ?o"));
        assertEquals(Fixtures.LIBRARY_TRIPLES - 100, StoreOperations.countTriples(store));
    }

    @Test
    public void testApply() throws Exception {
        JenaStore store = Fixtures.library(folder);
        ListMultimap<String, String> dropped = ArrayListMultimap.create();
        dropped.put(Fixtures.BOOK, Fixtures.GENRE);
        dropped.put(Fixtures.REVIEW, Fixtures.SCHEMA + "reviewBody");

        MutationReport report = mutator(store).apply(List.of(Fixtures.REVIEW), dropped, Map.of());

        assertEquals(List.of(Fixtures.REVIEW), report.getRemovedClasses());
        assertEquals(List.of(Fixtures.GENRE), report.getDroppedPredicates().get(Fixtures.BOOK));
        assertTrue(report.getDroppedPredicates().get(Fixtures.REVIEW).isEmpty());
        assertEquals(0, report.getTypeRewrites());
        assertEquals(Fixtures.LIBRARY_TRIPLES, report.getTriplesBefore());
        assertEquals(Fixtures.LIBRARY_TRIPLES - 130, report.getTriplesAfter());
        assertEquals(-130, report.getTripleDelta());
    }

    @Test
    public void testMergeEntities() throws Exception {
        JenaStore store = Fixtures.empty(folder, "people");
        store.update("PREFIX s: <http://schema.org/> INSERT DATA { " +
                "<" + LIB + "a> a s:Person ; s:name \"Ada\" ; s:birthDate \"1815\" . " +
                "<" + LIB + "b> a s:Person ; s:name \"Ada\" ; s:birthDate \"1815\" ; s:nationality \"GB\" . " +
                "<" + LIB + "c> a s:Person ; s:name \"Ada\" ; s:birthDate \"1900\" . " +
                "<" + LIB + "book> s:author <" + LIB + "b> }");

        int merged = mutator(store).mergeEntities(Fixtures.PERSON,
                List.of(Fixtures.NAME, Fixtures.SCHEMA + "birthDate"));

        assertEquals(1, merged);
        assertEquals(0, count(store, "<" + LIB + "b> ?p ?o"));
        assertEquals(1, count(store, "<" + LIB + "book> <" + Fixtures.AUTHOR + "> <" + LIB + "a>"));
        assertEquals(1, count(store, "<" + LIB + "a> <" + Fixtures.NATIONALITY + "> ?o"));
        assertEquals(2, count(store, "?s a <" + Fixtures.PERSON + ">"));
        assertTrue(store.getHistory().read().contains("{{s2}}"));
    }
}
