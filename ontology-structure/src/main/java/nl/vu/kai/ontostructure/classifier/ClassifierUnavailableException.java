package nl.vu.kai.ontostructure.classifier;

public class ClassifierUnavailableException extends Exception {

    public ClassifierUnavailableException(String message) {
        super(message);
    }

    public ClassifierUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
