package swiss.sib.swissprot.t2s.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * One record of a source: column name to raw string value. A column that is
 * missing or SQL NULL is absent, never mapped to null.
 */
public final class Row {
	private final long index;
	private final Map<String, String> values;

	public Row(long index, Map<String, String> values) {
		this.index = index;
		Map<String, String> copy = new LinkedHashMap<>();
		for (var en : values.entrySet()) {
			if (en.getValue() != null) {
				copy.put(en.getKey(), en.getValue());
			}
		}
		this.values = Collections.unmodifiableMap(copy);
	}

	/**
	 * @return the position of this row in its source, starting at 1
	 */
	public long index() {
		return index;
	}

	/**
	 * @return the raw value or null if the column is absent
	 */
	public String get(String column) {
		return values.get(column);
	}

	/**
	 * @return true if the column is absent or only whitespace
	 */
	public boolean isBlank(String column) {
		String v = values.get(column);
		return v == null || v.isBlank();
	}

	public Set<String> columns() {
		return values.keySet();
	}

	public Map<String, String> values() {
		return values;
	}

	@Override
	public String toString() {
		return "row " + index + " " + values;
	}
}
