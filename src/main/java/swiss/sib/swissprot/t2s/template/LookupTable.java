package swiss.sib.swissprot.t2s.template;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * A least recently used memo of a pure function, bounded in size. Not thread safe,
 * each engine owns its own.
 */
final class LookupTable<K, V> {
	private final Map<K, V> entries;
	private final int capacity;
	private long hits;
	private long misses;

	LookupTable(int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("A lookup table needs room for at least one entry");
		}
		this.capacity = capacity;
		this.entries = new LinkedHashMap<>(Math.min(capacity, 1024), 0.75f, true) {
			private static final long serialVersionUID = 1L;

			@Override
			protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
				return size() > LookupTable.this.capacity;
			}
		};
	}

	V get(K key, Function<K, V> compute) {
		V v = entries.get(key);
		if (v == null) {
			misses++;
			v = compute.apply(key);
			entries.put(key, v);
		} else {
			hits++;
		}
		return v;
	}

	int size() {
		return entries.size();
	}

	int capacity() {
		return capacity;
	}

	long hits() {
		return hits;
	}

	long misses() {
		return misses;
	}
}
