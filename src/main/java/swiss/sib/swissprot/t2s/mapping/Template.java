package swiss.sib.swissprot.t2s.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A string with <code>$(name)</code> placeholders, split once into its constant
 * parts and the names it references.
 */
public final class Template {
	public static final String IRI_MARKER = "~iri";
	private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\(([^)]+)\\)");

	private final String text;
	private final boolean iriMarked;
	private final List<String> parts;
	private final List<String> references;

	private Template(String text, boolean iriMarked, List<String> parts, List<String> references) {
		this.text = text;
		this.iriMarked = iriMarked;
		this.parts = parts;
		this.references = references;
	}

	public static Template parse(String raw) {
		Objects.requireNonNull(raw, "template");
		String text = raw.trim();
		boolean iriMarked = false;
		if (text.endsWith(IRI_MARKER)) {
			iriMarked = true;
			text = text.substring(0, text.length() - IRI_MARKER.length());
		}
		List<String> parts = new ArrayList<>();
		List<String> references = new ArrayList<>();
		Matcher m = PLACEHOLDER.matcher(text);
		int last = 0;
		while (m.find()) {
			parts.add(text.substring(last, m.start()));
			references.add(m.group(1).trim());
			last = m.end();
		}
		parts.add(text.substring(last));
		return new Template(text, iriMarked, Collections.unmodifiableList(parts),
				Collections.unmodifiableList(references));
	}

	/**
	 * @return the names of all placeholders, in order of appearance
	 */
	public List<String> references() {
		return references;
	}

	/**
	 * @return true if the template is exactly one placeholder and nothing else
	 */
	public boolean isReference() {
		return references.size() == 1 && parts.get(0).isEmpty() && parts.get(1).isEmpty();
	}

	public boolean isConstant() {
		return references.isEmpty();
	}

	/**
	 * @return true if the template carried the <code>~iri</code> marker
	 */
	public boolean iriMarked() {
		return iriMarked;
	}

	/**
	 * Replace every placeholder by the value the function gives for its name.
	 */
	public String fill(Function<String, String> valueFor) {
		if (references.isEmpty()) {
			return parts.get(0);
		}
		StringBuilder sb = new StringBuilder(text.length() + 16 * references.size());
		for (int i = 0; i < references.size(); i++) {
			sb.append(parts.get(i));
			sb.append(valueFor.apply(references.get(i)));
		}
		sb.append(parts.get(references.size()));
		return sb.toString();
	}

	/**
	 * @return the template text without the <code>~iri</code> marker
	 */
	public String text() {
		return text;
	}

	@Override
	public int hashCode() {
		return Objects.hash(text, iriMarked);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Template other = (Template) obj;
		return iriMarked == other.iriMarked && Objects.equals(text, other.text);
	}

	@Override
	public String toString() {
		return iriMarked ? text + IRI_MARKER : text;
	}
}
