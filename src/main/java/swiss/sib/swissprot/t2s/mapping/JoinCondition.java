package swiss.sib.swissprot.t2s.mapping;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import swiss.sib.swissprot.t2s.JoinConditionInvalidException;

/**
 * Equality between a column of the rows that produced a cached statement and a
 * column of an annotation row. Values are compared as raw strings.
 *
 * @param leftKey  column of the cached (quoted) row
 * @param rightKey column of the annotation row
 */
public record JoinCondition(String leftKey, String rightKey) {
	private static final Pattern EQUAL = Pattern.compile("^\\s*equal\\s*\\((.*)\\)\\s*$");
	private static final Pattern STR1 = Pattern.compile("str1\\s*=\\s*\\$\\(([^)]+)\\)");
	private static final Pattern STR2 = Pattern.compile("str2\\s*=\\s*\\$\\(([^)]+)\\)");

	public static JoinCondition parse(String expression) throws JoinConditionInvalidException {
		if (expression == null || expression.isBlank()) {
			throw new JoinConditionInvalidException("No join condition given");
		}
		Matcher equal = EQUAL.matcher(expression);
		if (!equal.matches()) {
			throw new JoinConditionInvalidException("Only equal(str1=$(a), str2=$(b)) joins are known, not: " + expression);
		}
		String args = equal.group(1);
		Matcher left = STR1.matcher(args);
		Matcher right = STR2.matcher(args);
		if (!left.find() || !right.find()) {
			throw new JoinConditionInvalidException("Join needs both str1 and str2 as references: " + expression);
		}
		return new JoinCondition(left.group(1).trim(), right.group(1).trim());
	}

	public String expression() {
		return "equal(str1=$(" + leftKey + "), str2=$(" + rightKey + "))";
	}
}
