package swiss.sib.swissprot.t2s;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import org.eclipse.rdf4j.model.Model;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.Rio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;
import swiss.sib.swissprot.t2s.Main.Failures;
import swiss.sib.swissprot.t2s.source.Compression;
import swiss.sib.swissprot.t2s.term.Vocabulary;

public class MainTest {

	@TempDir
	public File temp;

	private final StringWriter out = new StringWriter();
	private final StringWriter err = new StringWriter();

	@BeforeEach
	public void fixtures() throws IOException {
		for (String name : new String[] { "quality.yaml", "datasets.csv", "quality.csv" }) {
			try (InputStream in = MainTest.class.getResourceAsStream("/generation/" + name)) {
				Files.copy(in, temp.toPath().resolve(name));
			}
		}
	}

	private int execute(String... args) {
		CommandLine cmd = new CommandLine(new Main());
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd.execute(args);
	}

	private String mapping() {
		return new File(temp, "quality.yaml").getAbsolutePath();
	}

	@Test
	public void generatesIntoAFile() throws IOException {
		File output = new File(temp, "out.trig");
		assertEquals(0, execute(mapping(), output.getAbsolutePath()));
		Model model;
		try (InputStream in = Files.newInputStream(output.toPath())) {
			model = Rio.parse(in, Vocabulary.DEFAULT_BASE, RDFFormat.TRIGSTAR);
		}
		assertEquals(6, model.size());
		assertEquals(2, model.filter(null, Vocabulary.REIFIES, null).size());
		assertTrue(out.toString().contains("2 base triples"), out.toString());
	}

	@Test
	public void formatOptionAndCompression() throws IOException {
		Path output = temp.toPath().resolve("out.data.gz");
		assertEquals(0, execute("--format", "nquads", mapping(), output.toString()));
		Model model;
		try (InputStream in = Compression.GZIP.open(output)) {
			model = Rio.parse(in, Vocabulary.DEFAULT_BASE, RDFFormat.NQUADS);
		}
		assertEquals(6, model.size());
	}

	@Test
	public void writesToTheMappingTarget() throws IOException {
		Path mapping = temp.toPath().resolve("targeted.yaml");
		String yaml = Files.readString(temp.toPath().resolve("quality.yaml"))
				+ "targets:\n  out: [ 'generated/out.nq.gz', 'nquads', 'gzip' ]\n";
		Files.writeString(mapping, yaml);
		assertEquals(0, execute("--metadata", mapping.toString()));
		Path written = temp.toPath().resolve("generated").resolve("out.nq.gz");
		assertTrue(Files.exists(written));
		Model model;
		try (InputStream in = Compression.GZIP.open(written)) {
			model = Rio.parse(in, Vocabulary.DEFAULT_BASE, RDFFormat.NQUADS);
		}
		assertTrue(model.size() > 6, "base, annotations and run metadata");
	}

	@Test
	public void missingMapping() {
		assertEquals(Failures.MAPPING_NOT_FOUND.exitCode(),
				execute(new File(temp, "nothere.yaml").getAbsolutePath()));
		assertTrue(err.toString().contains("nothere.yaml"));
	}

	@Test
	public void malformedMapping() throws IOException {
		Path mapping = temp.toPath().resolve("broken.yaml");
		Files.writeString(mapping, "mappings: [ a, b");
		assertEquals(Failures.MALFORMED_MAPPING.exitCode(), execute(mapping.toString()));
	}

	@Test
	public void authorWithoutAnIriWebid() throws IOException {
		Path mapping = temp.toPath().resolve("author.yaml");
		Files.writeString(mapping, Files.readString(temp.toPath().resolve("quality.yaml"))
				.replace("  - Jane Doe <jane@example.org>", "  - webid: janedoe"));
		assertEquals(Failures.MALFORMED_MAPPING.exitCode(), execute("--metadata", mapping.toString()));
		assertTrue(err.toString().contains("janedoe"), err.toString());
	}

	@Test
	public void unsupportedConstruct() throws IOException {
		Path mapping = temp.toPath().resolve("function.yaml");
		try (InputStream in = MainTest.class.getResourceAsStream("/mappings/value-function.yaml")) {
			Files.copy(in, mapping);
		}
		assertEquals(Failures.UNSUPPORTED_CONSTRUCT.exitCode(), execute(mapping.toString()));
	}

	@Test
	public void outputNotWritable() throws IOException {
		File directory = new File(temp, "a-directory");
		assertTrue(directory.mkdir());
		assertEquals(Failures.OUTPUT_NOT_WRITABLE.exitCode(), execute(mapping(), directory.getAbsolutePath()));
	}
}
