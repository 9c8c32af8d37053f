package swiss.sib.swissprot.t2s.output;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFWriter;
import org.eclipse.rdf4j.rio.Rio;
import org.eclipse.rdf4j.rio.WriterConfig;
import org.eclipse.rdf4j.rio.helpers.BasicWriterSettings;

import swiss.sib.swissprot.t2s.mapping.Target;
import swiss.sib.swissprot.t2s.source.Compression;

/**
 * Serializes generated statements with Rio, TriG-star unless told otherwise.
 */
public class StatementWriter implements Closeable {
	public static final RDFFormat DEFAULT_FORMAT = RDFFormat.TRIGSTAR;

	private final OutputStream out;
	private final RDFWriter writer;
	private final boolean owned;

	private StatementWriter(OutputStream out, RDFWriter writer, boolean owned) {
		this.out = out;
		this.writer = writer;
		this.owned = owned;
	}

	/**
	 * @param serialization a name as used in mapping targets, e.g. "turtle" or
	 *                      "nquads". Null for the default.
	 */
	public static RDFFormat formatFor(String serialization) {
		if (serialization == null || serialization.isBlank()) {
			return DEFAULT_FORMAT;
		}
		switch (serialization.trim().toLowerCase()) {
		case "turtle":
		case "ttl":
		case "turtlestar":
		case "ttls":
			return RDFFormat.TURTLESTAR;
		case "trig":
		case "trigstar":
		case "trigs":
			return RDFFormat.TRIGSTAR;
		case "nquads":
		case "nq":
			return RDFFormat.NQUADS;
		case "ntriples":
		case "nt":
			return RDFFormat.NTRIPLES;
		default:
			return Rio.getWriterFormatForMIMEType(serialization)
					.orElseThrow(() -> new IllegalArgumentException("Unknown serialization: " + serialization));
		}
	}

	/**
	 * The format a file name asks for, ignoring a compression extension.
	 */
	public static RDFFormat formatForFileName(String fileName) {
		String name = Compression.removeExtension(fileName);
		return Rio.getWriterFormatForFileName(name).map(StatementWriter::withRdfStar).orElse(DEFAULT_FORMAT);
	}

	private static RDFFormat withRdfStar(RDFFormat format) {
		if (RDFFormat.TURTLE.equals(format)) {
			return RDFFormat.TURTLESTAR;
		} else if (RDFFormat.TRIG.equals(format)) {
			return RDFFormat.TRIGSTAR;
		}
		return format;
	}

	public static RDFWriter createWriter(RDFFormat format, OutputStream out) {
		RDFWriter writer = Rio.createWriter(format, out);
		WriterConfig writerConfig = writer.getWriterConfig();
		writerConfig.set(BasicWriterSettings.PRETTY_PRINT, Boolean.TRUE);
		writerConfig.set(BasicWriterSettings.INLINE_BLANK_NODES, Boolean.TRUE);
		return writer;
	}

	public static StatementWriter open(Path file, RDFFormat format, Compression compression) throws IOException {
		Path parent = file.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
		OutputStream out = compression.compress(new BufferedOutputStream(Files.newOutputStream(file)));
		return new StatementWriter(out, createWriter(format, out), true);
	}

	/**
	 * Open the file a mapping target points to, with its serialization and
	 * compression.
	 */
	public static StatementWriter open(Path file, Target target) throws IOException {
		RDFFormat format = target.serialization() == null ? formatForFileName(file.getFileName().toString())
				: formatFor(target.serialization());
		Compression compression = target.compression() == null ? Compression.fromFileName(file.getFileName().toString())
				: Compression.fromLabel(target.compression());
		return open(file, format, compression);
	}

	/**
	 * Write to a stream that stays open on close, e.g. standard out.
	 */
	public static StatementWriter wrap(OutputStream out, RDFFormat format) {
		return new StatementWriter(out, createWriter(format, out), false);
	}

	/**
	 * @return the handler to generate into, it expects startRDF and endRDF
	 */
	public RDFWriter handler() {
		return writer;
	}

	/**
	 * Write a complete set of statements in one go.
	 */
	public static void write(Iterable<Statement> statements, Map<String, String> namespaces, RDFFormat format,
			OutputStream out) {
		RDFWriter writer = createWriter(format, out);
		writer.startRDF();
		for (var ns : namespaces.entrySet()) {
			writer.handleNamespace(ns.getKey(), ns.getValue());
		}
		for (var s : statements) {
			writer.handleStatement(s);
		}
		writer.endRDF();
	}

	@Override
	public void close() throws IOException {
		if (owned) {
			out.close();
		} else {
			out.flush();
		}
	}
}
