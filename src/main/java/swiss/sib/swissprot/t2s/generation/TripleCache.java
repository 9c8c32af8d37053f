package swiss.sib.swissprot.t2s.generation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import org.eclipse.rdf4j.model.Triple;

import swiss.sib.swissprot.t2s.source.Row;

/**
 * Every base triple made in the first pass, in the order it was made. Append only
 * until frozen, read only afterwards.
 */
public class TripleCache implements Iterable<CacheEntry> {
	private final List<CacheEntry> entries = new ArrayList<>();
	private boolean frozen = false;

	public void add(String mapName, Row originRow, Triple triple) {
		if (frozen) {
			throw new IllegalStateException("Triple cache is frozen, can not add " + triple);
		}
		entries.add(new CacheEntry(mapName, originRow, triple));
	}

	public void freeze() {
		frozen = true;
	}

	public boolean isFrozen() {
		return frozen;
	}

	public int size() {
		return entries.size();
	}

	public List<CacheEntry> entries() {
		return Collections.unmodifiableList(entries);
	}

	@Override
	public Iterator<CacheEntry> iterator() {
		return entries().iterator();
	}
}
