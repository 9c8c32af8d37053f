package swiss.sib.swissprot.t2s;

/**
 * A mapping document that can not be turned into a mapping specification. Always
 * raised before any statement is generated.
 */
public class MalformedSpecificationException extends Exception {

	private static final long serialVersionUID = 1L;
	private final String section;

	public MalformedSpecificationException(String section, String message) {
		super(section + ": " + message);
		this.section = section;
	}

	public MalformedSpecificationException(String section, String message, Throwable cause) {
		super(section + ": " + message, cause);
		this.section = section;
	}

	/**
	 * @return the part of the document that is wrong, e.g. "prefixes" or
	 *         "mappings.person"
	 */
	public String section() {
		return section;
	}
}
