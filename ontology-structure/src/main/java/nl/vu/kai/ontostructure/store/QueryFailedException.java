package nl.vu.kai.ontostructure.store;

/**
 * The store rejected a query or update, or could not evaluate it.
 */
public class QueryFailedException extends Exception {

    private final String query;

    public QueryFailedException(String query, Throwable cause) {
        super("Query failed: " + cause.getMessage(), cause);
        this.query = query;
    }

    public QueryFailedException(String query, String message) {
        super(message);
        this.query = query;
    }

    public String getQuery() {
        return query;
    }
}
