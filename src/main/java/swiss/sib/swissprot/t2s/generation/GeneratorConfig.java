package swiss.sib.swissprot.t2s.generation;

import java.util.List;

import swiss.sib.swissprot.t2s.template.TemplateEngine;

/**
 * @param mapOrder           names of triples maps to run first, in this order.
 *                           The others follow in document order.
 * @param includeRunMetadata describe the generated dataset, makes the output
 *                           depend on the time of the run
 */
public record GeneratorConfig(List<String> mapOrder, boolean includeRunMetadata, int sanitizeCapacity,
		int expansionCapacity) {

	public GeneratorConfig {
		mapOrder = mapOrder == null ? List.of() : List.copyOf(mapOrder);
	}

	public static GeneratorConfig defaults() {
		return new GeneratorConfig(List.of(), false, TemplateEngine.DEFAULT_SANITIZE_CAPACITY,
				TemplateEngine.DEFAULT_EXPANSION_CAPACITY);
	}

	public GeneratorConfig withRunMetadata(boolean include) {
		return new GeneratorConfig(mapOrder, include, sanitizeCapacity, expansionCapacity);
	}

	public GeneratorConfig withMapOrder(List<String> order) {
		return new GeneratorConfig(order, includeRunMetadata, sanitizeCapacity, expansionCapacity);
	}
}
