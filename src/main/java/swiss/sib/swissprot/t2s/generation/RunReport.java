package swiss.sib.swissprot.t2s.generation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import swiss.sib.swissprot.t2s.term.Kind;

/**
 * What one generation run did, and what it had to skip.
 */
public class RunReport {

	public static enum IssueKind {
		MISSING_SOURCE, SOURCE_UNAVAILABLE, ROW_EVALUATION, JOIN_CONDITION_INVALID;
	}

	/**
	 * @param map the triples map the issue happened in
	 * @param row the index of the row in its source, 0 if not about a row
	 */
	public static record Issue(IssueKind kind, String map, long row, String message) {

		@Override
		public String toString() {
			if (row > 0) {
				return kind + " in " + map + " at row " + row + ": " + message;
			}
			return kind + " in " + map + ": " + message;
		}
	}

	private long rowsProcessed;
	private long baseTriples;
	private long reifiers;
	private long annotationStatements;
	private long metadataStatements;
	private int mapsSkipped;
	private final Map<Kind, Long> baseObjects = new EnumMap<>(Kind.class);
	private final List<Issue> issues = new ArrayList<>();

	void rowsRead(int count) {
		rowsProcessed += count;
	}

	void baseTriples(int count) {
		baseTriples += count;
	}

	void baseObject(Kind kind) {
		baseObjects.merge(kind, 1L, Long::sum);
	}

	void reifiers(int count) {
		reifiers += count;
	}

	void annotationStatements(int count) {
		annotationStatements += count;
	}

	void metadataStatements(int count) {
		metadataStatements += count;
	}

	void mapSkipped() {
		mapsSkipped++;
	}

	void record(Issue issue) {
		issues.add(issue);
	}

	/**
	 * @return rows read from sources, a source shared by several maps counts once
	 */
	public long rowsProcessed() {
		return rowsProcessed;
	}

	public long baseTriples() {
		return baseTriples;
	}

	/**
	 * @return how many base statements have an object of the given kind
	 */
	public long baseTriples(Kind objectKind) {
		return baseObjects.getOrDefault(objectKind, 0L);
	}

	public long reifiers() {
		return reifiers;
	}

	/**
	 * @return statements about reifiers, not counting the <code>rdf:reifies</code>
	 *         link itself
	 */
	public long annotationStatements() {
		return annotationStatements;
	}

	public long metadataStatements() {
		return metadataStatements;
	}

	public int mapsSkipped() {
		return mapsSkipped;
	}

	public List<Issue> issues() {
		return Collections.unmodifiableList(issues);
	}

	public List<Issue> issues(IssueKind kind) {
		List<Issue> l = new ArrayList<>();
		for (Issue i : issues) {
			if (i.kind() == kind) {
				l.add(i);
			}
		}
		return l;
	}

	public String summary() {
		return "Processed " + rowsProcessed + " rows into " + baseTriples + " base triples and " + reifiers
				+ " reifiers carrying " + annotationStatements + " annotations, skipped " + mapsSkipped
				+ " maps with " + issues.size() + " issues";
	}

	@Override
	public String toString() {
		return summary();
	}
}
