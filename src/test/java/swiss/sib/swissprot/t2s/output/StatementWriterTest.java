package swiss.sib.swissprot.t2s.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Triple;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.LinkedHashModel;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.util.Models;
import org.eclipse.rdf4j.model.vocabulary.DCTERMS;
import org.eclipse.rdf4j.model.vocabulary.XSD;
import org.eclipse.rdf4j.query.BindingSet;
import org.eclipse.rdf4j.query.TupleQueryResult;
import org.eclipse.rdf4j.repository.RepositoryConnection;
import org.eclipse.rdf4j.repository.sail.SailRepository;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.Rio;
import org.eclipse.rdf4j.sail.memory.MemoryStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import swiss.sib.swissprot.t2s.mapping.Target;
import swiss.sib.swissprot.t2s.source.Compression;
import swiss.sib.swissprot.t2s.term.Vocabulary;

public class StatementWriterTest {
	private static final ValueFactory vf = SimpleValueFactory.getInstance();
	private static final String EX = "http://example.org/";

	@TempDir
	public File temp;

	static List<Statement> annotated() {
		List<Statement> statements = new ArrayList<>();
		IRI dataset = vf.createIRI(EX, "dataset/7");
		Statement title = vf.createStatement(dataset, DCTERMS.TITLE, vf.createLiteral("Kinases"));
		statements.add(title);
		Triple quoted = vf.createTriple(dataset, DCTERMS.TITLE, vf.createLiteral("Kinases"));
		BNode reifier = vf.createBNode();
		statements.add(vf.createStatement(reifier, Vocabulary.REIFIES, quoted));
		statements.add(vf.createStatement(reifier, vf.createIRI(EX, "confidence"), vf.createLiteral("0.9", XSD.DECIMAL)));
		return statements;
	}

	@ParameterizedTest
	@ValueSource(strings = { "trig", "turtle", "nquads", "ntriples" })
	public void roundTrip(String serialization) throws IOException {
		RDFFormat format = StatementWriter.formatFor(serialization);
		File f = new File(temp, "out." + format.getDefaultFileExtension());
		try (StatementWriter writer = StatementWriter.open(f.toPath(), format, Compression.NONE)) {
			writer.handler().startRDF();
			for (Statement s : annotated()) {
				writer.handler().handleStatement(s);
			}
			writer.handler().endRDF();
		}
		Model back;
		try (InputStream in = Compression.NONE.open(f.toPath())) {
			back = Rio.parse(in, EX, format);
		}
		assertTrue(Models.isomorphic(new LinkedHashModel(annotated()), back), back.toString());
	}

	@Test
	public void formats() {
		assertEquals(RDFFormat.TRIGSTAR, StatementWriter.formatFor(null));
		assertEquals(RDFFormat.TURTLESTAR, StatementWriter.formatFor("turtle"));
		assertEquals(RDFFormat.NQUADS, StatementWriter.formatFor("nq"));
		assertEquals(RDFFormat.TURTLESTAR, StatementWriter.formatForFileName("out.ttl.gz"));
		assertEquals(RDFFormat.NQUADS, StatementWriter.formatForFileName("out.nq"));
		assertEquals(RDFFormat.TRIGSTAR, StatementWriter.formatForFileName("out"));
		assertThrows(IllegalArgumentException.class, () -> StatementWriter.formatFor("excel"));
	}

	@Test
	public void compressedTarget() throws IOException {
		Path out = temp.toPath().resolve("nested").resolve("out.nq.gz");
		Target target = new Target("out", "out.nq.gz", "localfile", "nquads", "gzip");
		try (StatementWriter writer = StatementWriter.open(out, target)) {
			writer.handler().startRDF();
			for (Statement s : annotated()) {
				writer.handler().handleStatement(s);
			}
			writer.handler().endRDF();
		}
		Model back;
		try (InputStream in = Compression.GZIP.open(out)) {
			back = Rio.parse(in, EX, RDFFormat.NQUADS);
		}
		assertEquals(3, back.size());
	}

	@Test
	public void loadsIntoAStore() throws IOException {
		File f = new File(temp, "out.trig");
		try (OutputStream out = Files.newOutputStream(f.toPath())) {
			StatementWriter.write(annotated(), Map.of("ex", EX), RDFFormat.TRIGSTAR, out);
		}
		SailRepository repository = new SailRepository(new MemoryStore());
		try (RepositoryConnection conn = repository.getConnection()) {
			conn.add(f, EX, RDFFormat.TRIGSTAR);
			try (TupleQueryResult result = conn
					.prepareTupleQuery("SELECT (COUNT(*) AS ?c) WHERE { ?r <" + EX + "confidence> ?confidence }")
					.evaluate()) {
				BindingSet bs = result.next();
				assertEquals(1, Integer.parseInt(bs.getValue("c").stringValue()));
			}
			assertEquals(3, conn.size());
		} finally {
			repository.shutDown();
		}
	}
}
