package swiss.sib.swissprot.t2s.term;

/**
 * The declared kind of the object of a predicate object rule. Only the two kinds a
 * row can produce directly, blank nodes and quoted triples are made by the
 * generator itself.
 */
public enum ObjectKind {
	LITERAL(Kind.LITERAL), IRI(Kind.IRI);

	private final Kind kind;

	ObjectKind(Kind kind) {
		this.kind = kind;
	}

	public Kind kind() {
		return kind;
	}

	public static ObjectKind fromLabel(String label) {
		switch (label.trim().toLowerCase()) {
		case "iri":
			return IRI;
		case "literal":
			return LITERAL;
		default:
			throw new IllegalArgumentException("Objects can not be declared as " + label);
		}
	}
}
