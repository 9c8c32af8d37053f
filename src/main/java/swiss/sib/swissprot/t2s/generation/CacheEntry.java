package swiss.sib.swissprot.t2s.generation;

import org.eclipse.rdf4j.model.Triple;

import swiss.sib.swissprot.t2s.source.Row;

/**
 * A base triple together with the row and map that produced it.
 */
public record CacheEntry(String mapName, Row originRow, Triple triple) {

}
