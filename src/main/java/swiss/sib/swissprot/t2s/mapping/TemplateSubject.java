package swiss.sib.swissprot.t2s.mapping;

import java.util.List;

/**
 * One or more IRI templates, each giving a subject per row.
 */
public record TemplateSubject(List<Template> templates) implements SubjectRule {

	public TemplateSubject {
		if (templates.isEmpty()) {
			throw new IllegalArgumentException("A subject needs at least one template");
		}
		templates = List.copyOf(templates);
	}

	@Override
	public boolean isQuoted() {
		return false;
	}
}
