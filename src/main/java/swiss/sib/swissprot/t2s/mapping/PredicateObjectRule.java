package swiss.sib.swissprot.t2s.mapping;

import java.util.List;

import swiss.sib.swissprot.t2s.term.ObjectKind;

/**
 * @param datatype         a template for the datatype IRI, null for none
 * @param language         a template for the language tag, null for none
 * @param graphs           named graphs for the statements, empty for the map
 *                         default
 * @param inversePredicate if not null also generate object, inverse, subject
 */
public record PredicateObjectRule(Template predicate, Template object, ObjectKind objectKind, Template datatype,
		Template language, List<Template> graphs, Template inversePredicate) {

	public PredicateObjectRule {
		graphs = graphs == null ? List.of() : List.copyOf(graphs);
	}

	public static PredicateObjectRule literal(String predicate, String object) {
		return new PredicateObjectRule(Template.parse(predicate), Template.parse(object), ObjectKind.LITERAL, null,
				null, List.of(), null);
	}
}
