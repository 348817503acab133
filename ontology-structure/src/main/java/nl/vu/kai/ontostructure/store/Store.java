package nl.vu.kai.ontostructure.store;

import java.util.List;

/**
 * Query/update access to the dataset under analysis, together with its append-only audit log.
 * <p>
 * Every call is blocking. Implementations give no transactional guarantee across several
 * {@link #update(String)} calls: a failure in the middle of a sequence leaves the dataset in the
 * state the last successful update produced.
 */
public interface Store {

    /**
     * Evaluates a SPARQL SELECT query. Rows keep the order the engine produced.
     */
    List<QueryRow> query(String sparql) throws QueryFailedException;

    /**
     * Applies a SPARQL UPDATE (insert/delete) request.
     */
    void update(String sparql) throws QueryFailedException;

    /**
     * Number of lines in the audit log. Never decreases while the store is open.
     */
    int historyVersion();

    /**
     * Appends to the audit log. A multi-line entry advances {@link #historyVersion()} by its line count.
     */
    void writeHistory(String line);

    /**
     * Short name of the dataset, used to key caches.
     */
    String datasetName();
}
