package swiss.sib.swissprot.t2s.mapping;

import java.util.Map;

/**
 * Where the rows of a triples map come from.
 *
 * @param name                 the name of a root level source, or the access
 *                             path for inline sources
 * @param access               a file path or a JDBC url
 * @param type                 <code>localfile</code> or the kind of database
 * @param referenceFormulation csv, tsv, jsonpath, ...
 */
public record SourceReference(String name, String access, String type, String referenceFormulation,
		String iterator, String query, String table, Character delimiter, String encoding,
		Map<String, String> credentials) {

	public static final String LOCAL_FILE = "localfile";

	public SourceReference {
		credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
	}

	public static SourceReference file(String access, String referenceFormulation) {
		return new SourceReference(access, access, LOCAL_FILE, referenceFormulation, null, null, null, null, null,
				null);
	}

	public SourceReference withName(String newName) {
		return new SourceReference(newName, access, type, referenceFormulation, iterator, query, table, delimiter,
				encoding, credentials);
	}

	public boolean isLocalFile() {
		return (type == null || LOCAL_FILE.equals(type)) && !access.startsWith("jdbc:");
	}
}
