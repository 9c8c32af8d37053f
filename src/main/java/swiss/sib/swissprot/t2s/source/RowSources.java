package swiss.sib.swissprot.t2s.source;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import swiss.sib.swissprot.t2s.SourceUnavailableException;
import swiss.sib.swissprot.t2s.mapping.SourceReference;

/**
 * Picks the connector for a source reference.
 */
public class RowSources {
	private static final Set<String> DATABASES = Set.of("jdbc", "duckdb", "h2", "mysql", "postgresql", "sqlite");
	private final SourcePathResolver resolver;

	public RowSources(SourcePathResolver resolver) {
		this.resolver = resolver;
	}

	/**
	 * @return the key under which rows of this source are cached. Equal for two
	 *         references to the same file or query.
	 */
	public String locator(SourceReference ref) {
		if (isJdbc(ref)) {
			return jdbcUrl(ref) + " " + query(ref);
		}
		return resolver.resolve(ref.access()).toString();
	}

	public RowSource of(SourceReference ref) throws SourceUnavailableException {
		if (isJdbc(ref)) {
			if (ref.query() == null && ref.table() == null) {
				throw new SourceUnavailableException(ref.name(), "a database source needs a query or a table");
			}
			Map<String, String> credentials = new LinkedHashMap<>();
			for (var en : ref.credentials().entrySet()) {
				credentials.put(en.getKey(), resolver.interpolate(en.getValue()));
			}
			return new JdbcRowSource(jdbcUrl(ref), query(ref), credentials);
		}
		if (!ref.isLocalFile()) {
			throw new SourceUnavailableException(ref.name(), "no connector for source type " + ref.type());
		}
		String formulation = ref.referenceFormulation() == null ? "csv" : ref.referenceFormulation();
		Path file = resolver.resolve(ref.access());
		switch (formulation) {
		case "csv":
		case "tsv":
			char delimiter;
			if (ref.delimiter() != null) {
				delimiter = ref.delimiter();
			} else {
				delimiter = "tsv".equals(formulation) ? '\t' : CsvRowSource.defaultDelimiter(file);
			}
			return new CsvRowSource(file, delimiter, charset(ref));
		default:
			throw new SourceUnavailableException(ref.name(), "no connector for " + formulation);
		}
	}

	private static boolean isJdbc(SourceReference ref) {
		return ref.access().startsWith("jdbc:") || (ref.type() != null && DATABASES.contains(ref.type()))
				|| "jdbc".equals(ref.referenceFormulation());
	}

	private String jdbcUrl(SourceReference ref) {
		String access = resolver.interpolate(ref.access());
		if (access.startsWith("jdbc:")) {
			return access;
		}
		String type = ref.type();
		if (type == null || SourceReference.LOCAL_FILE.equals(type) || "jdbc".equals(type)) {
			type = "duckdb";
		}
		return JdbcRowSource.jdbcUrl(type, resolver.resolve(access).toString());
	}

	private static String query(SourceReference ref) {
		if (ref.query() != null) {
			return ref.query();
		}
		return ref.table() == null ? null : JdbcRowSource.tableQuery(ref.table());
	}

	private static Charset charset(SourceReference ref) throws SourceUnavailableException {
		if (ref.encoding() == null) {
			return StandardCharsets.UTF_8;
		}
		try {
			return Charset.forName(ref.encoding());
		} catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
			throw new SourceUnavailableException(ref.name(), "unknown encoding " + ref.encoding());
		}
	}
}
