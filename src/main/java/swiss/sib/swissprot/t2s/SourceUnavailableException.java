package swiss.sib.swissprot.t2s;

public class SourceUnavailableException extends Exception {

	private static final long serialVersionUID = 1L;
	private final String source;

	public SourceUnavailableException(String source, String message) {
		super("Source " + source + " unavailable: " + message);
		this.source = source;
	}

	public SourceUnavailableException(String source, Throwable cause) {
		super("Source " + source + " unavailable: " + cause.getMessage(), cause);
		this.source = source;
	}

	public String source() {
		return source;
	}
}
