package nl.vu.kai.ontostructure.store;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * A value bound in a query row: an IRI, a literal or a blank node.
 */
public final class RdfTerm {

    private static final String XSD_STRING = "http://www.w3.org/2001/XMLSchema#string";

    private enum Kind { IRI, LITERAL, BLANK }

    private final Kind kind;
    private final String value;
    private final String datatype;
    private final String language;

    private RdfTerm(Kind kind, String value, String datatype, String language) {
        this.kind = kind;
        this.value = Objects.requireNonNull(value);
        this.datatype = datatype;
        this.language = language;
    }

    public static RdfTerm iri(String iri) {
        return new RdfTerm(Kind.IRI, iri, null, null);
    }

    /**
     * @param datatype datatype IRI, or null for a plain string
     * @param language language tag, or null or empty when the literal has none
     */
    public static RdfTerm literal(String lexicalForm, String datatype, String language) {
        if (language != null && !language.isEmpty())
            return new RdfTerm(Kind.LITERAL, lexicalForm, null, language);
        if (XSD_STRING.equals(datatype))
            datatype = null;
        return new RdfTerm(Kind.LITERAL, lexicalForm, datatype, null);
    }

    public static RdfTerm blank(String label) {
        return new RdfTerm(Kind.BLANK, label, null, null);
    }

    /**
     * IRI without angle brackets, lexical form of a literal, or label of a blank node.
     */
    public String value() {
        return value;
    }

    public boolean isIri() {
        return kind == Kind.IRI;
    }

    public boolean isLiteral() {
        return kind == Kind.LITERAL;
    }

    public Optional<String> datatype() {
        return Optional.ofNullable(datatype);
    }

    public Optional<String> language() {
        return Optional.ofNullable(language);
    }

    public OptionalDouble asNumber() {
        if (kind != Kind.LITERAL)
            return OptionalDouble.empty();
        try {
            return OptionalDouble.of(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Renders the term so that it can be pasted back into a SPARQL request.
     */
    public String toSparql() {
        switch (kind) {
            case IRI:
                return "<" + value + ">";
            case BLANK:
                return "_:" + value;
            default:
                String quoted = "\"" + value
                        .replace("\\", "\\\\")
                        .replace("\"", "\\\"")
                        .replace("\n", "\\n")
                        .replace("\r", "\\r") + "\"";
                if (language != null)
                    return quoted + "@" + language;
                if (datatype != null)
                    return quoted + "^^<" + datatype + ">";
                return quoted;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        RdfTerm other = (RdfTerm) o;
        return kind == other.kind && value.equals(other.value)
                && Objects.equals(datatype, other.datatype) && Objects.equals(language, other.language);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, value, datatype, language);
    }

    @Override
    public String toString() {
        return toSparql();
    }
}
