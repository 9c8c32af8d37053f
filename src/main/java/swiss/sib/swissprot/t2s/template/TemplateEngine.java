package swiss.sib.swissprot.t2s.template;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;

import swiss.sib.swissprot.t2s.RowEvaluationException;
import swiss.sib.swissprot.t2s.mapping.MappingDocument;
import swiss.sib.swissprot.t2s.mapping.PredicateObjectRule;
import swiss.sib.swissprot.t2s.mapping.Template;
import swiss.sib.swissprot.t2s.source.Row;
import swiss.sib.swissprot.t2s.term.ObjectKind;
import swiss.sib.swissprot.t2s.term.Vocabulary;

/**
 * Turns templates and a row into RDF terms. Holds the prefix table of one mapping
 * document and two bounded memo tables, one per engine instance.
 */
public class TemplateEngine {
	public static final String UNKNOWN = "unknown";
	public static final int DEFAULT_SANITIZE_CAPACITY = 10_000;
	public static final int DEFAULT_EXPANSION_CAPACITY = 1_000;

	private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9_.\\-]");
	private static final Pattern DIRECT_IRI = Pattern.compile("^[A-Za-z][A-Za-z0-9+.\\-]*:.*$");
	private static final ValueFactory vf = SimpleValueFactory.getInstance();

	private final Map<String, String> prefixes;
	private final Map<String, String> external;
	private final LookupTable<String, String> sanitized;
	private final LookupTable<String, String> expanded;

	public TemplateEngine(Map<String, String> prefixes, Map<String, String> external) {
		this(prefixes, external, DEFAULT_SANITIZE_CAPACITY, DEFAULT_EXPANSION_CAPACITY);
	}

	public TemplateEngine(Map<String, String> prefixes, Map<String, String> external, int sanitizeCapacity,
			int expansionCapacity) {
		this.prefixes = new HashMap<>(Vocabulary.DEFAULT_PREFIXES);
		this.prefixes.putAll(prefixes);
		this.external = Map.copyOf(external);
		this.sanitized = new LookupTable<>(sanitizeCapacity);
		this.expanded = new LookupTable<>(expansionCapacity);
	}

	public static TemplateEngine forDocument(MappingDocument document, int sanitizeCapacity, int expansionCapacity) {
		return new TemplateEngine(document.prefixes(), document.external(), sanitizeCapacity, expansionCapacity);
	}

	/**
	 * Make a value safe to embed in an IRI. Every character outside
	 * <code>[A-Za-z0-9_.-]</code> becomes an underscore.
	 */
	public static String sanitize(String value) {
		if (value == null || value.isEmpty()) {
			return UNKNOWN;
		}
		return UNSAFE.matcher(value).replaceAll("_");
	}

	/**
	 * Replace a known <code>prefix:</code> by its namespace. Anything else, including
	 * absolute IRIs, is returned as is.
	 */
	public String expand(String value) {
		return expanded.get(value, this::expandUncached);
	}

	private String expandUncached(String value) {
		int colon = value.indexOf(':');
		if (colon < 0) {
			return value;
		}
		String namespace = prefixes.get(value.substring(0, colon));
		if (namespace == null) {
			return value;
		}
		return namespace + value.substring(colon + 1);
	}

	/**
	 * @return the raw value for a placeholder, or null if absent or blank
	 */
	public String rawValue(String reference, Row row) {
		String v;
		if (reference.startsWith(MappingDocument.EXTERNAL_REFERENCE_PREFIX)) {
			v = external.get(reference.substring(MappingDocument.EXTERNAL_REFERENCE_PREFIX.length()));
			if (v == null) {
				v = row.get(reference);
			}
		} else {
			v = row.get(reference);
		}
		if (v == null || v.isBlank()) {
			return null;
		}
		return v;
	}

	/**
	 * Fill in raw values, for literals.
	 */
	public String fill(Template template, Row row) {
		return template.fill(r -> {
			String v = rawValue(r, row);
			return v == null ? UNKNOWN : v;
		});
	}

	/**
	 * Fill in sanitized values, for IRIs.
	 */
	public String fillSanitized(Template template, Row row) {
		return template.fill(r -> {
			String v = rawValue(r, row);
			return v == null ? UNKNOWN : sanitized.get(v, TemplateEngine::sanitize);
		});
	}

	public IRI iri(Template template, Row row) {
		if (template.isReference()) {
			String raw = rawValue(template.references().get(0), row);
			if (raw != null && DIRECT_IRI.matcher(raw).matches()) {
				return createIRI(expand(raw.trim()), template);
			}
		}
		return createIRI(expand(fillSanitized(template, row)), template);
	}

	public List<IRI> iris(List<Template> templates, Row row) {
		List<IRI> l = new ArrayList<>(templates.size());
		for (Template t : templates) {
			l.add(iri(t, row));
		}
		return l;
	}

	private static IRI createIRI(String value, Template template) {
		try {
			return vf.createIRI(value);
		} catch (IllegalArgumentException e) {
			throw new RowEvaluationException("Template " + template + " gave '" + value + "' which is not an IRI", e);
		}
	}

	/**
	 * The object of a rule for one row. Empty when the object is a single reference
	 * to a value the row does not have.
	 */
	public Optional<Value> object(PredicateObjectRule rule, Row row) {
		Template object = rule.object();
		if (object.isReference() && rawValue(object.references().get(0), row) == null) {
			return Optional.empty();
		}
		if (rule.objectKind() == ObjectKind.IRI) {
			return Optional.of(iri(object, row));
		}
		String label = fill(object, row);
		if (rule.language() != null) {
			String language = fill(rule.language(), row);
			return Optional.of(vf.createLiteral(label, language));
		} else if (rule.datatype() != null) {
			return Optional.of(vf.createLiteral(label, datatype(rule.datatype(), row)));
		}
		return Optional.of(vf.createLiteral(label));
	}

	/**
	 * A datatype given by a single reference is a whole prefixed name or IRI, it is
	 * expanded but not sanitized.
	 */
	private IRI datatype(Template datatype, Row row) {
		if (datatype.isReference()) {
			String raw = rawValue(datatype.references().get(0), row);
			if (raw != null) {
				return createIRI(expand(raw.trim()), datatype);
			}
		}
		return iri(datatype, row);
	}

	int sanitizedSize() {
		return sanitized.size();
	}

	int expandedSize() {
		return expanded.size();
	}
}
