package swiss.sib.swissprot.t2s.generation;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

import org.eclipse.rdf4j.model.Resource;

/**
 * Hash join between cached base triples and annotation rows. Keys are raw row
 * values, compared as strings.
 */
public final class JoinResolver {

	private JoinResolver() {

	}

	/**
	 * Index the cache on the value of one column of the rows that produced each
	 * entry. Entries without a value for that column are left out.
	 */
	public static Map<String, List<CacheEntry>> buildIndex(Iterable<CacheEntry> cache, String joinKey,
			Predicate<CacheEntry> filter) {
		Map<String, List<CacheEntry>> index = new HashMap<>();
		for (CacheEntry entry : cache) {
			String key = entry.originRow().get(joinKey);
			if (key == null || key.isBlank() || !filter.test(entry)) {
				continue;
			}
			index.computeIfAbsent(key, k -> new ArrayList<>()).add(entry);
		}
		return index;
	}

	public static Map<String, List<CacheEntry>> buildIndex(Iterable<CacheEntry> cache, String joinKey) {
		return buildIndex(cache, joinKey, e -> true);
	}

	/**
	 * @return the matching entries in cache order, empty if none
	 */
	public static List<CacheEntry> lookup(Map<String, List<CacheEntry>> index, String value) {
		if (value == null) {
			return List.of();
		}
		return index.getOrDefault(value, List.of());
	}

	/**
	 * Keeps only entries whose triple has an IRI subject in the given namespace.
	 */
	public static Predicate<CacheEntry> subjectIn(String namespace) {
		return e -> {
			Resource subject = e.triple().getSubject();
			return subject.isIRI() && subject.stringValue().startsWith(namespace);
		};
	}
}
