package swiss.sib.swissprot.t2s.source;

import java.util.List;

import swiss.sib.swissprot.t2s.SourceUnavailableException;

/**
 * Anything that can give the ordered rows of one source.
 */
public interface RowSource {

	/**
	 * @return all rows, in source order
	 * @throws SourceUnavailableException if the source can not be opened or read
	 */
	public List<Row> rows() throws SourceUnavailableException;

	/**
	 * @return a human readable locator, for logging
	 */
	public String describe();
}
