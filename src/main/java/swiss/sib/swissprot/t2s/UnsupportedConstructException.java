package swiss.sib.swissprot.t2s;

/**
 * A mapping construct that is valid YARRRML but for which the generator has no
 * semantics, e.g. value functions or conditions.
 */
public class UnsupportedConstructException extends MalformedSpecificationException {

	private static final long serialVersionUID = 1L;
	private final String construct;

	public UnsupportedConstructException(String section, String construct) {
		super(section, "unsupported construct '" + construct + "'");
		this.construct = construct;
	}

	public String construct() {
		return construct;
	}
}
