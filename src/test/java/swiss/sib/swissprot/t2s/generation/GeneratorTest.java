package swiss.sib.swissprot.t2s.generation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Literal;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Triple;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.LinkedHashModel;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.util.Models;
import org.eclipse.rdf4j.model.vocabulary.DCAT;
import org.eclipse.rdf4j.model.vocabulary.DCTERMS;
import org.eclipse.rdf4j.model.vocabulary.FOAF;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.eclipse.rdf4j.rio.helpers.StatementCollector;
import org.junit.jupiter.api.Test;

import swiss.sib.swissprot.t2s.MalformedSpecificationException;
import swiss.sib.swissprot.t2s.generation.RunReport.Issue;
import swiss.sib.swissprot.t2s.generation.RunReport.IssueKind;
import swiss.sib.swissprot.t2s.mapping.MappingDocument;
import swiss.sib.swissprot.t2s.mapping.MappingParser;
import swiss.sib.swissprot.t2s.source.Row;
import swiss.sib.swissprot.t2s.source.RowSources;
import swiss.sib.swissprot.t2s.source.SourceCache;
import swiss.sib.swissprot.t2s.source.SourcePathResolver;
import swiss.sib.swissprot.t2s.term.Kind;
import swiss.sib.swissprot.t2s.term.Vocabulary;

public class GeneratorTest {
	private static final ValueFactory vf = SimpleValueFactory.getInstance();
	private static final String EX = "http://example.org/";
	private static final IRI CONFIDENCE = vf.createIRI(EX, "confidence");
	private static final IRI DATASET_7 = vf.createIRI(EX, "dataset/7");

	static Generator generator(String mapping, GeneratorConfig config)
			throws IOException, MalformedSpecificationException, URISyntaxException {
		Path p = Path.of(GeneratorTest.class.getResource("/generation/" + mapping).toURI());
		MappingDocument doc = new MappingParser().parse(p);
		SourceCache sources = new SourceCache(new RowSources(new SourcePathResolver(p.getParent())));
		return new Generator(doc, sources, config);
	}

	static RunReport run(String mapping, List<Statement> into) throws Exception {
		return generator(mapping, GeneratorConfig.defaults()).run(new StatementCollector(into));
	}

	private static List<Statement> withPredicate(List<Statement> statements, IRI predicate) {
		return statements.stream().filter(s -> s.getPredicate().equals(predicate)).collect(Collectors.toList());
	}

	@Test
	public void datasetWithQualityAnnotations() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("quality.yaml", statements);

		assertEquals(2, report.baseTriples());
		assertEquals(2, report.reifiers());
		assertEquals(2, report.annotationStatements());
		assertEquals(3, report.rowsProcessed());
		assertTrue(report.issues().isEmpty(), report.issues().toString());

		assertEquals(vf.createStatement(DATASET_7, DCTERMS.TITLE, vf.createLiteral("Kinases")), statements.get(0));
		assertEquals(vf.createStatement(DATASET_7, DCTERMS.CREATOR, vf.createLiteral("Jane")), statements.get(1));

		List<Statement> reifies = withPredicate(statements, Vocabulary.REIFIES);
		assertEquals(2, reifies.size());
		Set<Triple> quoted = new HashSet<>();
		Set<Resource> reifiers = new HashSet<>();
		for (Statement r : reifies) {
			assertTrue(r.getSubject().isBNode());
			Triple t = (Triple) r.getObject();
			assertEquals(DATASET_7, t.getSubject());
			quoted.add(t);
			reifiers.add(r.getSubject());
		}
		assertEquals(2, quoted.size(), "each base triple is annotated once");
		assertEquals(2, reifiers.size(), "every match gets its own reifier");

		List<Statement> confidence = withPredicate(statements, CONFIDENCE);
		assertEquals(2, confidence.size());
		for (Statement c : confidence) {
			assertTrue(reifiers.contains(c.getSubject()));
			assertEquals(vf.createLiteral("0.9", XSD.DECIMAL), c.getObject());
		}
		assertEquals(6, statements.size());
	}

	@Test
	public void typedDatasetWithConfidence() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("acme.yaml", statements);
		Statement type = vf.createStatement(DATASET_7, RDF.TYPE, vf.createIRI(EX, "Dataset"));
		Statement title = vf.createStatement(DATASET_7, vf.createIRI(EX, "title"), vf.createLiteral("Acme"));
		assertEquals(List.of(type, title), statements.subList(0, 2));
		assertEquals(2, report.baseTriples());
		assertEquals(2, report.reifiers());

		Map<Resource, Triple> reified = new HashMap<>();
		for (Statement s : withPredicate(statements, Vocabulary.REIFIES)) {
			reified.put(s.getSubject(), (Triple) s.getObject());
		}
		assertEquals(Set.of(vf.createTriple(DATASET_7, RDF.TYPE, vf.createIRI(EX, "Dataset")),
				vf.createTriple(DATASET_7, vf.createIRI(EX, "title"), vf.createLiteral("Acme"))),
				new HashSet<>(reified.values()), "the type triple is annotated as well");
		List<Statement> confidence = withPredicate(statements, CONFIDENCE);
		assertEquals(2, confidence.size());
		for (Statement c : confidence) {
			assertTrue(reified.containsKey(c.getSubject()));
			assertEquals(vf.createLiteral("0.9"), c.getObject());
		}
		assertEquals(6, statements.size());
	}

	@Test
	public void baseTriplesAreNotChangedByAnnotation() throws Exception {
		List<Statement> statements = new ArrayList<>();
		run("quality.yaml", statements);
		long plain = statements.stream().filter(s -> s.getSubject().equals(DATASET_7)).count();
		assertEquals(2, plain);
	}

	@Test
	public void repeatedRunsAreIsomorphic() throws Exception {
		List<Statement> first = new ArrayList<>();
		List<Statement> second = new ArrayList<>();
		run("namespace.yaml", first);
		run("namespace.yaml", second);
		assertEquals(first.size(), second.size());
		assertTrue(Models.isomorphic(new LinkedHashModel(first), new LinkedHashModel(second)));
		List<Statement> firstGround = first.stream().filter(s -> !s.getSubject().isBNode())
				.collect(Collectors.toList());
		List<Statement> secondGround = second.stream().filter(s -> !s.getSubject().isBNode())
				.collect(Collectors.toList());
		assertEquals(firstGround, secondGround, "same order as well");
	}

	@Test
	public void namespaceFilterKeepsFamiliesApart() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("namespace.yaml", statements);
		assertEquals(3, report.baseTriples());

		Map<Resource, Triple> reified = new HashMap<>();
		for (Statement s : withPredicate(statements, Vocabulary.REIFIES)) {
			reified.put(s.getSubject(), (Triple) s.getObject());
		}
		List<Statement> confidence = withPredicate(statements, CONFIDENCE);
		assertEquals(2, confidence.size());
		for (Statement c : confidence) {
			Triple t = reified.get(c.getSubject());
			assertTrue(t.getSubject().stringValue().startsWith(EX + "dataset/"), t.toString());
		}

		List<Statement> audited = withPredicate(statements, vf.createIRI(EX, "audited"));
		assertEquals(3, audited.size(), "without a namespace the sample is annotated as well");
		assertEquals(3, withPredicate(statements, RDF.TYPE).size());
		assertEquals(5, report.reifiers());
		assertEquals(8, report.annotationStatements());
	}

	@Test
	public void badRowIsSkipped() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("bad-row.yaml", statements);
		assertEquals(3, report.rowsProcessed());
		assertEquals(2, report.baseTriples());
		assertEquals(2, statements.size());
		assertEquals(vf.createIRI(EX, "a"), statements.get(0).getSubject());
		assertEquals(vf.createIRI(EX, "c"), statements.get(1).getSubject());
		List<Issue> issues = report.issues(IssueKind.ROW_EVALUATION);
		assertEquals(1, issues.size());
		assertEquals(2, issues.get(0).row());
		assertEquals("page", issues.get(0).map());
	}

	@Test
	public void mailtoObjectKeepsTheRow() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("contacts.yaml", statements);
		IRI jane = vf.createIRI(EX, "person/1");
		assertTrue(report.issues().isEmpty(), report.issues().toString());
		assertEquals(List.of(vf.createStatement(jane, FOAF.NAME, vf.createLiteral("Jane")),
				vf.createStatement(jane, FOAF.MBOX, vf.createIRI("mailto:jane@example.org"))), statements);
	}

	@Test
	public void invalidJoinSkipsOnlyThatMap() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("invalid-join.yaml", statements);
		assertEquals(1, report.baseTriples());
		assertEquals(0, report.reifiers());
		assertEquals(2, report.mapsSkipped());
		assertEquals(2, report.issues(IssueKind.JOIN_CONDITION_INVALID).size());
		assertEquals(1, statements.size());
	}

	@Test
	public void missingAndUnavailableSources() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = run("missing-source.yaml", statements);
		assertEquals(1, report.issues(IssueKind.MISSING_SOURCE).size());
		assertEquals("lonely", report.issues(IssueKind.MISSING_SOURCE).get(0).map());
		assertEquals(1, report.issues(IssueKind.SOURCE_UNAVAILABLE).size());
		assertEquals("ghost", report.issues(IssueKind.SOURCE_UNAVAILABLE).get(0).map());
		assertEquals(2, report.mapsSkipped());
		assertEquals(List.of(vf.createStatement(DATASET_7, vf.createIRI(EX, "title"), vf.createLiteral("Kinases"))),
				statements);
	}

	@Test
	public void graphsAndInversePredicates() throws Exception {
		List<Statement> statements = new ArrayList<>();
		Generator generator = generator("graphs.yaml", GeneratorConfig.defaults());
		RunReport report = generator.run(new StatementCollector(statements));
		IRI jane = vf.createIRI(EX, "person/1");
		IRI group = vf.createIRI(EX, "group/g1");
		IRI people = vf.createIRI(EX, "graph/people");

		assertEquals(5, statements.size());
		assertEquals(5, report.baseTriples());
		assertEquals(3, report.baseTriples(Kind.IRI));
		assertEquals(2, report.baseTriples(Kind.LITERAL));
		assertEquals(0, report.baseTriples(Kind.TRIPLE));
		assertTrue(statements.contains(vf.createStatement(jane, RDF.TYPE, vf.createIRI(EX, "Person"), people)));
		assertTrue(statements.contains(vf.createStatement(jane, vf.createIRI(EX, "memberOf"), group, people)));
		assertTrue(statements.contains(vf.createStatement(group, vf.createIRI(EX, "hasMember"), jane, people)));
		Literal name = vf.createLiteral("Jane");
		assertTrue(statements.contains(
				vf.createStatement(jane, vf.createIRI(EX, "name"), name, vf.createIRI(EX, "graph/names"))));
		assertTrue(statements
				.contains(vf.createStatement(jane, vf.createIRI(EX, "name"), name, vf.createIRI(EX, "graph/all"))));

		TripleCache cache = generator.cache();
		assertEquals(4, cache.size(), "one cache entry per triple, not per graph");
		assertTrue(cache.isFrozen());
		assertThrows(IllegalStateException.class, () -> cache.add("late", new Row(1, Map.of()),
				vf.createTriple(jane, RDF.TYPE, vf.createIRI(EX, "Late"))));
	}

	@Test
	public void mapOrder() throws Exception {
		List<Statement> statements = new ArrayList<>();
		generator("namespace.yaml", GeneratorConfig.defaults().withMapOrder(List.of("sample", "nothere")))
				.run(new StatementCollector(statements));
		assertEquals(vf.createIRI(EX, "sample/7"), statements.get(0).getSubject());
		assertNotEquals(vf.createIRI(EX, "sample/7"), statements.get(1).getSubject());
	}

	@Test
	public void mapOrderAppliesToAnnotationMaps() throws Exception {
		List<Statement> statements = new ArrayList<>();
		generator("namespace.yaml", GeneratorConfig.defaults().withMapOrder(List.of("audit")))
				.run(new StatementCollector(statements));
		Statement firstReifies = withPredicate(statements, Vocabulary.REIFIES).get(0);
		assertTrue(statements.contains(
				vf.createStatement(firstReifies.getSubject(), RDF.TYPE, vf.createIRI(EX, "Audit"))));
	}

	@Test
	public void sharedSourceRowsCountOnce() throws Exception {
		RunReport report = run("namespace.yaml", new ArrayList<>());
		assertEquals(4, report.rowsProcessed(), "datasets, samples and quality once, not twice");
	}

	@Test
	public void runMetadata() throws Exception {
		List<Statement> statements = new ArrayList<>();
		RunReport report = generator("quality.yaml", GeneratorConfig.defaults().withRunMetadata(true))
				.run(new StatementCollector(statements));
		IRI dataset = vf.createIRI(Vocabulary.DEFAULT_BASE);
		assertTrue(statements.contains(vf.createStatement(dataset, RDF.TYPE, DCAT.DATASET)));
		assertEquals(1, withPredicate(statements, DCTERMS.CREATED).size());
		assertEquals(1, withPredicate(statements, DCTERMS.CREATOR).stream().filter(s -> s.getSubject().equals(dataset))
				.count());
		assertTrue(report.metadataStatements() > 0);
		assertEquals(6 + report.metadataStatements(), statements.size());
	}
}
