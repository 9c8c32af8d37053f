package swiss.sib.swissprot.t2s.mapping;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

public record Author(String name, String email, String website, String webid) {
	private static final Pattern SHORTHAND = Pattern
			.compile("^\\s*([^<(]*?)\\s*(?:<([^>]*)>)?\\s*(?:\\(([^)]*)\\))?\\s*$");

	/**
	 * Parse the <code>Jane Doe &lt;jane@doe.com&gt; (https://janedoe.com)</code>
	 * form. A bare IRI is taken as a WebID.
	 */
	public static Author fromShorthand(String text) {
		String trimmed = text.trim();
		if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
			return new Author(null, null, null, trimmed);
		}
		Matcher m = SHORTHAND.matcher(trimmed);
		if (m.matches()) {
			String name = m.group(1).isEmpty() ? null : m.group(1);
			return new Author(name, m.group(2), m.group(3), null);
		}
		return new Author(trimmed, null, null, null);
	}

	/**
	 * @return the best human readable label
	 */
	public String label() {
		if (name != null)
			return name;
		else if (webid != null)
			return webid;
		else if (email != null)
			return email;
		return "Unknown";
	}
}
