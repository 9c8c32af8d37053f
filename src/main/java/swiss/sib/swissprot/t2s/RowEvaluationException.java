package swiss.sib.swissprot.t2s;

/**
 * One row could not be turned into statements. The generator records it and skips
 * the row.
 */
public class RowEvaluationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public RowEvaluationException(String message) {
		super(message);
	}

	public RowEvaluationException(String message, Throwable cause) {
		super(message, cause);
	}
}
