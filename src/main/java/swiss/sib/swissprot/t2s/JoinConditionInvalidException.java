package swiss.sib.swissprot.t2s;

public class JoinConditionInvalidException extends Exception {

	private static final long serialVersionUID = 1L;

	public JoinConditionInvalidException(String message) {
		super(message);
	}
}
