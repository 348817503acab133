package nl.vu.kai.ontostructure;

import nl.vu.kai.ontostructure.graph.ClassEdge;
import nl.vu.kai.ontostructure.graph.ClassGraph;
import nl.vu.kai.ontostructure.ranking.ClassRoundRecord;
import org.semanticweb.owlapi.model.*;

import java.util.Optional;

/**
 * Renders the kept part of an analysis as an OWL ontology: one class per kept class and, for every kept
 * predicate between kept classes, an existential restriction on the source class. Predicates landing on
 * literals become data properties.
 */
public class SchemaSummaryConverter {

    private final OWLOntologyManager manager;
    private final OWLDataFactory factory;

    public SchemaSummaryConverter(OWLOntologyManager manager){
        this.manager=manager;
        this.factory= manager.getOWLDataFactory();
    }

    public OWLOntology convert(AnalysisReport report) throws OWLOntologyCreationException {
        OWLOntology result = manager.createOntology();
        ClassGraph graph = report.getGraph();

        report.getKeepSet().forEach(cls ->
                result.add(factory.getOWLDeclarationAxiom(clazz(cls))));

        for (ClassEdge edge : graph.edges()) {
            String source = graph.iri(edge.source());
            if (!report.getPruning().isKept(source) || isDropped(report, source, edge.predicate()))
                continue;

            if (graph.isLiteral(edge.target())) {
                OWLDataProperty property = factory.getOWLDataProperty(IRI.create(edge.predicate()));
                result.add(factory.getOWLDeclarationAxiom(property));
                result.add(factory.getOWLSubClassOfAxiom(clazz(source),
                        factory.getOWLDataSomeValuesFrom(property, factory.getTopDatatype())));
            } else if (report.getPruning().isKept(graph.iri(edge.target()))) {
                OWLObjectProperty property = factory.getOWLObjectProperty(IRI.create(edge.predicate()));
                result.add(factory.getOWLDeclarationAxiom(property));
                result.add(factory.getOWLSubClassOfAxiom(clazz(source),
                        factory.getOWLObjectSomeValuesFrom(property, clazz(graph.iri(edge.target())))));
            }
        }
        return result;
    }

    private static boolean isDropped(AnalysisReport report, String cls, String predicate) {
        Optional<ClassAnalysis> analysis = report.getClassAnalysis(cls);
        return analysis.isPresent() && analysis.get().isDropped(predicate);
    }

    public OWLClass clazz(String classIri) {
        return factory.getOWLClass(IRI.create(classIri));
    }

    /**
     * Labels every kept class with its instance count and final score.
     */
    public void addScores2Label(OWLOntology ontology, AnalysisReport report) {
        report.getKeepSet().forEach(cls -> {
            ClassRoundRecord record = report.getPruning().getRecords().get(cls);
            OWLClass clazz = clazz(cls);
            ontology.add(
                    factory.getOWLAnnotationAssertionAxiom(
                            clazz.getIRI(),
                            factory.getRDFSLabel(clazz.getIRI().getShortForm()+" - "+record.getEntityCount()+" - "+record.getScore())));
        });
    }
}
