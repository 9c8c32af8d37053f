package swiss.sib.swissprot.t2s.source;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import swiss.sib.swissprot.t2s.SourceUnavailableException;
import swiss.sib.swissprot.t2s.mapping.SourceReference;

/**
 * Loads every distinct source at most once per run. A failure is remembered as
 * well, so a broken source is not retried by every map that uses it.
 */
public class SourceCache {
	private static final Logger logger = LoggerFactory.getLogger(SourceCache.class);

	private final RowSources sources;
	private final Map<String, List<Row>> loaded = new HashMap<>();
	private final Map<String, SourceUnavailableException> failed = new HashMap<>();

	public SourceCache(RowSources sources) {
		this.sources = sources;
	}

	/**
	 * @return the key two references share when they read the same rows
	 */
	public String locator(SourceReference ref) {
		return sources.locator(ref);
	}

	public List<Row> rows(SourceReference ref) throws SourceUnavailableException {
		String key = locator(ref);
		List<Row> rows = loaded.get(key);
		if (rows != null) {
			return rows;
		}
		SourceUnavailableException earlier = failed.get(key);
		if (earlier != null) {
			throw earlier;
		}
		try {
			RowSource source = sources.of(ref);
			logger.info("Loading source " + source.describe());
			rows = List.copyOf(source.rows());
			loaded.put(key, rows);
			return rows;
		} catch (SourceUnavailableException e) {
			failed.put(key, e);
			throw e;
		}
	}

	/**
	 * @return how many distinct sources were loaded
	 */
	public int size() {
		return loaded.size();
	}
}
