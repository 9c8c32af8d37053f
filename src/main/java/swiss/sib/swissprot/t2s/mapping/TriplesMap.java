package swiss.sib.swissprot.t2s.mapping;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public record TriplesMap(String name, List<SourceReference> sources, SubjectRule subject, List<Template> types,
		List<PredicateObjectRule> predicateObjects, List<Template> graphs) {

	public TriplesMap {
		sources = List.copyOf(sources);
		types = List.copyOf(types);
		predicateObjects = List.copyOf(predicateObjects);
		graphs = List.copyOf(graphs);
	}

	public boolean isQuoted() {
		return subject.isQuoted();
	}

	/**
	 * @return every column a row needs to fully evaluate this map
	 */
	public Set<String> referencedColumns() {
		Set<String> columns = new LinkedHashSet<>();
		if (subject instanceof TemplateSubject ts) {
			for (Template t : ts.templates()) {
				add(columns, t);
			}
		}
		for (Template t : types) {
			add(columns, t);
		}
		for (PredicateObjectRule po : predicateObjects) {
			add(columns, po.predicate());
			add(columns, po.object());
			add(columns, po.datatype());
			add(columns, po.language());
		}
		return columns;
	}

	private static void add(Set<String> columns, Template t) {
		if (t != null) {
			for (String r : t.references()) {
				if (!r.startsWith(MappingDocument.EXTERNAL_REFERENCE_PREFIX)) {
					columns.add(r);
				}
			}
		}
	}
}
