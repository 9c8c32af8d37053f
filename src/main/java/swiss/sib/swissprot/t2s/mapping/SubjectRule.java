package swiss.sib.swissprot.t2s.mapping;

/**
 * How the subject of a triples map is produced. Either {@link TemplateSubject} or
 * {@link QuotedSubject}, decided once by the parser.
 */
public interface SubjectRule {

	public boolean isQuoted();
}
