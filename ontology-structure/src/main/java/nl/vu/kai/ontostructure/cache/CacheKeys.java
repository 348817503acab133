package nl.vu.kai.ontostructure.cache;

public final class CacheKeys {

    private CacheKeys() {
    }

    public static String relations(String dataset) {
        return "relations/" + sanitize(dataset);
    }

    public static String predicates(String dataset, String classIri) {
        return "predicates/" + sanitize(dataset) + "/" + sanitize(classIri);
    }

    /**
     * Strips angle brackets and colons and turns slashes into underscores, so an IRI can be a file name.
     */
    public static String sanitize(String iri) {
        return iri.replace("<", "")
                .replace(">", "")
                .replace(":", "")
                .replace("/", "_");
    }
}
