package swiss.sib.swissprot.t2s.mapping;

/**
 * The subject of an annotation map: the statements of another triples map, selected
 * by a join with the rows of this one.
 *
 * @param quotedMapping  the name of the triples map that is quoted
 * @param joinExpression <code>equal(str1=$(a), str2=$(b))</code>, null if none was
 *                       given. Only checked by the generator.
 * @param namespace      if not null only cached statements whose subject starts
 *                       with this (prefixed or absolute) namespace are annotated
 */
public record QuotedSubject(String quotedMapping, String joinExpression, String namespace) implements SubjectRule {

	@Override
	public boolean isQuoted() {
		return true;
	}
}
