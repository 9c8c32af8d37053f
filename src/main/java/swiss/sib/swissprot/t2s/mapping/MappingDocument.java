package swiss.sib.swissprot.t2s.mapping;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed mapping document. Triples maps keep the order in which they were
 * declared.
 */
public class MappingDocument {
	/** Placeholders starting with this resolve against the external references. */
	public static final String EXTERNAL_REFERENCE_PREFIX = "_";

	private final String base;
	private final Map<String, String> prefixes;
	private final List<Author> authors;
	private final Map<String, String> external;
	private final Map<String, SourceReference> sources;
	private final Map<String, Target> targets;
	private final Map<String, TriplesMap> triplesMaps;

	public MappingDocument(String base, Map<String, String> prefixes, List<Author> authors,
			Map<String, String> external, Map<String, SourceReference> sources, Map<String, Target> targets,
			Map<String, TriplesMap> triplesMaps) {
		this.base = base;
		this.prefixes = Collections.unmodifiableMap(new LinkedHashMap<>(prefixes));
		this.authors = List.copyOf(authors);
		this.external = Collections.unmodifiableMap(new LinkedHashMap<>(external));
		this.sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
		this.targets = Collections.unmodifiableMap(new LinkedHashMap<>(targets));
		this.triplesMaps = Collections.unmodifiableMap(new LinkedHashMap<>(triplesMaps));
	}

	public String base() {
		return base;
	}

	public Map<String, String> prefixes() {
		return prefixes;
	}

	public List<Author> authors() {
		return authors;
	}

	public Map<String, String> external() {
		return external;
	}

	public Map<String, SourceReference> sources() {
		return sources;
	}

	public Map<String, Target> targets() {
		return targets;
	}

	public Map<String, TriplesMap> triplesMaps() {
		return triplesMaps;
	}

	public TriplesMap triplesMap(String name) {
		return triplesMaps.get(name);
	}

	/**
	 * @return the triples maps with a template subject, in document order
	 */
	public List<TriplesMap> materialMaps() {
		List<TriplesMap> l = new ArrayList<>();
		for (TriplesMap tm : triplesMaps.values()) {
			if (!tm.isQuoted()) {
				l.add(tm);
			}
		}
		return l;
	}

	/**
	 * @return the annotation maps, in document order
	 */
	public List<TriplesMap> quotedMaps() {
		List<TriplesMap> l = new ArrayList<>();
		for (TriplesMap tm : triplesMaps.values()) {
			if (tm.isQuoted()) {
				l.add(tm);
			}
		}
		return l;
	}
}
