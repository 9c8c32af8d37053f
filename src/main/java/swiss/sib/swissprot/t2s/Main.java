package swiss.sib.swissprot.t2s;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.eclipse.rdf4j.rio.RDFFormat;
import org.eclipse.rdf4j.rio.RDFHandlerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;
import swiss.sib.swissprot.t2s.generation.Generator;
import swiss.sib.swissprot.t2s.generation.GeneratorConfig;
import swiss.sib.swissprot.t2s.generation.RunReport;
import swiss.sib.swissprot.t2s.mapping.MappingDocument;
import swiss.sib.swissprot.t2s.mapping.MappingParser;
import swiss.sib.swissprot.t2s.mapping.Target;
import swiss.sib.swissprot.t2s.output.StatementWriter;
import swiss.sib.swissprot.t2s.source.Compression;
import swiss.sib.swissprot.t2s.source.RowSources;
import swiss.sib.swissprot.t2s.source.SourceCache;
import swiss.sib.swissprot.t2s.source.SourcePathResolver;

@Command(name = "t2s", mixinStandardHelpOptions = true, showDefaultValues = true,
		description = "Generate RDF-star statements and annotations from tables with a YARRRML-star mapping")
public class Main implements Callable<Integer> {
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	/**
	 * Error exit codes.
	 */
	public static enum Failures {
		MAPPING_NOT_FOUND(2), MALFORMED_MAPPING(3), UNSUPPORTED_CONSTRUCT(4), OUTPUT_NOT_WRITABLE(5);

		private final int exitCode;

		Failures(int i) {
			this.exitCode = i;
		}

		public int exitCode() {
			return exitCode;
		}
	}

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", paramLabel = "MAPPING", description = "the YARRRML-star mapping document")
	private Path mapping;

	@Parameters(index = "1", arity = "0..1", paramLabel = "OUTPUT",
			description = "where to write, defaults to the first target of the mapping or standard out")
	private Path output;

	@Option(names = "--metadata", description = "also describe the generated dataset")
	private boolean metadata = false;

	@Option(names = { "-f", "--format" }, description = "turtle, trig, nquads or ntriples, defaults to trig")
	private String format;

	@Option(names = "--map-order", split = ",", description = "triples maps to generate first")
	private List<String> mapOrder = new ArrayList<>();

	public static void main(String[] args) {
		int status = new CommandLine(new Main()).execute(args);
		System.exit(status);
	}

	@Override
	public Integer call() {
		PrintWriter err = spec.commandLine().getErr();
		if (!Files.isRegularFile(mapping)) {
			err.println("No mapping document at " + mapping);
			return Failures.MAPPING_NOT_FOUND.exitCode();
		}
		MappingDocument document;
		try {
			document = new MappingParser().parse(mapping);
		} catch (UnsupportedConstructException e) {
			err.println(e.getMessage());
			return Failures.UNSUPPORTED_CONSTRUCT.exitCode();
		} catch (MalformedSpecificationException e) {
			err.println(e.getMessage());
			return Failures.MALFORMED_MAPPING.exitCode();
		} catch (IOException e) {
			err.println("Could not read " + mapping + ": " + e.getMessage());
			return Failures.MAPPING_NOT_FOUND.exitCode();
		}

		Path mappingDirectory = mapping.toAbsolutePath().getParent();
		SourcePathResolver resolver = new SourcePathResolver(mappingDirectory);
		SourceCache sources = new SourceCache(new RowSources(resolver));
		GeneratorConfig config = GeneratorConfig.defaults().withRunMetadata(metadata).withMapOrder(mapOrder);
		Generator generator = new Generator(document, sources, config);

		RunReport report;
		boolean toStandardOut = false;
		try (StatementWriter writer = openWriter(document, mappingDirectory, resolver)) {
			toStandardOut = writer == null;
			if (toStandardOut) {
				try (StatementWriter stdout = StatementWriter.wrap(System.out, StatementWriter.formatFor(format))) {
					report = generator.run(stdout.handler());
				}
			} else {
				report = generator.run(writer.handler());
			}
		} catch (IOException | RDFHandlerException | IllegalArgumentException e) {
			logger.error("Could not write output", e);
			err.println("Could not write output: " + e.getMessage());
			return Failures.OUTPUT_NOT_WRITABLE.exitCode();
		}
		PrintWriter summary = toStandardOut ? err : spec.commandLine().getOut();
		summary.println(report.summary());
		for (RunReport.Issue issue : report.issues()) {
			summary.println(issue);
		}
		summary.flush();
		return 0;
	}

	/**
	 * @return null when writing to standard out
	 */
	private StatementWriter openWriter(MappingDocument document, Path mappingDirectory, SourcePathResolver resolver)
			throws IOException {
		if (output != null) {
			RDFFormat rdfFormat = format == null ? StatementWriter.formatForFileName(output.getFileName().toString())
					: StatementWriter.formatFor(format);
			return StatementWriter.open(output, rdfFormat, Compression.fromFileName(output.getFileName().toString()));
		}
		if (!document.targets().isEmpty()) {
			Target target = document.targets().values().iterator().next();
			if (document.targets().size() > 1) {
				logger.warn("Only writing to the first target " + target.name());
			}
			Path file = mappingDirectory.resolve(resolver.interpolate(target.access()));
			if (format != null) {
				target = new Target(target.name(), target.access(), target.type(), format, target.compression());
			}
			return StatementWriter.open(file, target);
		}
		return null;
	}
}
