package swiss.sib.swissprot.t2s.term;

import org.eclipse.rdf4j.model.Value;

/**
 * The kind of an RDF term as produced by the generator.
 */
public enum Kind {
	BNODE(), IRI(), LITERAL(), TRIPLE();

	Kind() {
	}

	public static Kind of(Value val) {
		if (val.isIRI())
			return IRI;
		else if (val.isBNode())
			return BNODE;
		else if (val.isTriple())
			return TRIPLE;
		else
			return LITERAL;
	}
}
