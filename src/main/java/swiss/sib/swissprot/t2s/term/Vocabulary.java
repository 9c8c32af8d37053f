package swiss.sib.swissprot.t2s.term;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.RDFS;
import org.eclipse.rdf4j.model.vocabulary.XSD;

public class Vocabulary {
	private Vocabulary() {

	}

	/** rdf:reifies from RDF 1.2, links a reifier to the triple it is about. */
	public static final IRI REIFIES = SimpleValueFactory.getInstance().createIRI(RDF.NAMESPACE,
			"reifies");

	/** Used when a document has no base IRI and run metadata is requested. */
	public static final String DEFAULT_BASE = "http://example.org/";

	/**
	 * Prefixes every mapping document can use without declaring them.
	 */
	public static final Map<String, String> DEFAULT_PREFIXES = defaultPrefixes();

	private static Map<String, String> defaultPrefixes() {
		Map<String, String> prefixes = new LinkedHashMap<>();
		prefixes.put(RDF.PREFIX, RDF.NAMESPACE);
		prefixes.put(RDFS.PREFIX, RDFS.NAMESPACE);
		prefixes.put(XSD.PREFIX, XSD.NAMESPACE);
		return Collections.unmodifiableMap(prefixes);
	}
}
