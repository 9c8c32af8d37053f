package swiss.sib.swissprot.t2s.mapping;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.DuplicateKeyException;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.Mark;
import org.yaml.snakeyaml.error.YAMLException;
import org.yaml.snakeyaml.nodes.MappingNode;
import org.yaml.snakeyaml.nodes.Node;
import org.yaml.snakeyaml.nodes.NodeTuple;
import org.yaml.snakeyaml.nodes.ScalarNode;

import swiss.sib.swissprot.t2s.MalformedSpecificationException;
import swiss.sib.swissprot.t2s.UnsupportedConstructException;
import swiss.sib.swissprot.t2s.term.ObjectKind;
import swiss.sib.swissprot.t2s.term.Vocabulary;

/**
 * Reads a YARRRML-star document into a {@link MappingDocument}. Only the document
 * is read, sources are never opened.
 */
public class MappingParser {
	private static final Logger logger = LoggerFactory.getLogger(MappingParser.class);

	private static final String DOCUMENT = "document";
	private static final String PREFIXES = "prefixes";
	private static final String SOURCES = "sources";
	private static final String TARGETS = "targets";
	private static final String AUTHORS = "authors";
	private static final String EXTERNAL = "external";
	private static final String MAPPINGS = "mappings";

	private static final String LANG_MARKER = "~lang";
	private static final Pattern INLINE_JOIN = Pattern
			.compile("^\\s*join\\s*\\(\\s*quoted\\s*=\\s*([^,\\s)]+)\\s*(?:,\\s*(.*))?\\)\\s*$");

	private final LoaderOptions loaderOptions;

	public MappingParser() {
		this.loaderOptions = new LoaderOptions();
		this.loaderOptions.setAllowDuplicateKeys(false);
	}

	public MappingDocument parse(Path mappingFile) throws IOException, MalformedSpecificationException {
		return parse(Files.readString(mappingFile, StandardCharsets.UTF_8));
	}

	public MappingDocument parse(Reader mapping) throws IOException, MalformedSpecificationException {
		StringWriter text = new StringWriter();
		mapping.transferTo(text);
		return parse(text.toString());
	}

	public MappingDocument parse(String mapping) throws MalformedSpecificationException {
		Object root;
		try {
			root = new Yaml(new SafeConstructor(loaderOptions)).load(mapping);
		} catch (DuplicateKeyException e) {
			throw new MalformedSpecificationException(sectionAt(mapping, e.getProblemMark()),
					"duplicate key " + e.getMessage(), e);
		} catch (YAMLException e) {
			throw new MalformedSpecificationException(DOCUMENT, "not a YAML document " + e.getMessage(), e);
		}
		if (!(root instanceof Map<?, ?> document)) {
			throw new MalformedSpecificationException(DOCUMENT, "expected a map at the top level");
		}
		String base = optionalString(document.get("base"), DOCUMENT);
		Map<String, String> prefixes = parsePrefixes(document.get(PREFIXES));
		for (var en : Vocabulary.DEFAULT_PREFIXES.entrySet()) {
			prefixes.putIfAbsent(en.getKey(), en.getValue());
		}
		List<Author> authors = parseAuthors(document.get(AUTHORS));
		Map<String, String> external = parseStringMap(document.get(EXTERNAL), EXTERNAL);
		Map<String, SourceReference> sources = parseRootSources(document.get(SOURCES));
		Map<String, Target> targets = parseTargets(document.get(TARGETS));

		Object mappings = document.get(MAPPINGS);
		if (!(mappings instanceof Map<?, ?> mappingsMap)) {
			throw new MalformedSpecificationException(MAPPINGS, "expected a map of named triples maps");
		}
		Map<String, TriplesMap> triplesMaps = new LinkedHashMap<>();
		for (var en : mappingsMap.entrySet()) {
			String name = String.valueOf(en.getKey());
			triplesMaps.put(name, parseTriplesMap(name, en.getValue(), sources));
		}
		for (TriplesMap tm : triplesMaps.values()) {
			if (tm.subject() instanceof QuotedSubject qs && !triplesMaps.containsKey(qs.quotedMapping())) {
				logger.warn("Triples map " + tm.name() + " quotes " + qs.quotedMapping()
						+ " which is not declared, joins are on keys so this may still match");
			}
		}
		logger.info("Parsed " + triplesMaps.size() + " triples maps using " + prefixes.size() + " prefixes");
		return new MappingDocument(base, prefixes, authors, external, sources, targets, triplesMaps);
	}

	private static Map<String, String> parsePrefixes(Object prefixes) throws MalformedSpecificationException {
		Map<String, String> parsed = parseStringMap(prefixes, PREFIXES);
		for (var en : parsed.entrySet()) {
			if (en.getKey().isEmpty() || en.getValue().isEmpty()) {
				throw new MalformedSpecificationException(PREFIXES, "empty prefix or namespace for '" + en.getKey() + "'");
			}
		}
		return parsed;
	}

	private static Map<String, String> parseStringMap(Object raw, String section)
			throws MalformedSpecificationException {
		Map<String, String> parsed = new LinkedHashMap<>();
		if (raw == null) {
			return parsed;
		}
		if (!(raw instanceof Map<?, ?> map)) {
			throw new MalformedSpecificationException(section, "expected a map");
		}
		for (var en : map.entrySet()) {
			if (en.getValue() instanceof Map || en.getValue() instanceof Collection) {
				throw new MalformedSpecificationException(section, "value of '" + en.getKey() + "' is not a scalar");
			}
			parsed.put(String.valueOf(en.getKey()), en.getValue() == null ? "" : String.valueOf(en.getValue()));
		}
		return parsed;
	}

	private static List<Author> parseAuthors(Object raw) throws MalformedSpecificationException {
		List<Author> authors = new ArrayList<>();
		if (raw == null) {
			return authors;
		}
		List<?> list = raw instanceof List<?> l ? l : List.of(raw);
		for (Object a : list) {
			Author author;
			if (a instanceof String s) {
				author = Author.fromShorthand(s);
			} else if (a instanceof Map<?, ?> m) {
				author = new Author(optionalString(m.get("name"), AUTHORS), optionalString(m.get("email"), AUTHORS),
						optionalString(m.get("website"), AUTHORS), optionalString(m.get("webid"), AUTHORS));
			} else {
				throw new MalformedSpecificationException(AUTHORS, "an author is a string or a map, not " + a);
			}
			if (author.webid() != null) {
				try {
					SimpleValueFactory.getInstance().createIRI(author.webid());
				} catch (IllegalArgumentException e) {
					throw new MalformedSpecificationException(AUTHORS, "webid " + author.webid() + " is not an IRI",
							e);
				}
			}
			authors.add(author);
		}
		return authors;
	}

	/**
	 * The top level section, or triples map, whose value contains the mark. Used
	 * to name where a duplicate key is.
	 */
	private String sectionAt(String mapping, Mark mark) {
		if (mark == null) {
			return DOCUMENT;
		}
		Node root;
		try {
			root = new Yaml(new SafeConstructor(loaderOptions)).compose(new StringReader(mapping));
		} catch (YAMLException e) {
			logger.debug("Could not compose the document to locate a duplicate key", e);
			return DOCUMENT;
		}
		String section = DOCUMENT;
		Node within = root;
		for (int depth = 0; depth < 2 && within instanceof MappingNode m; depth++) {
			Node next = null;
			for (NodeTuple t : m.getValue()) {
				Node value = t.getValueNode();
				if (t.getKeyNode() instanceof ScalarNode key && value.getStartMark().getIndex() <= mark.getIndex()
						&& mark.getIndex() <= value.getEndMark().getIndex()) {
					section = depth == 0 ? key.getValue() : section + "." + key.getValue();
					next = value;
				}
			}
			if (next == null || !MAPPINGS.equals(section)) {
				break;
			}
			within = next;
		}
		return section;
	}

	private static Map<String, Target> parseTargets(Object raw) throws MalformedSpecificationException {
		Map<String, Target> targets = new LinkedHashMap<>();
		if (raw == null) {
			return targets;
		}
		if (!(raw instanceof Map<?, ?> map)) {
			throw new MalformedSpecificationException(TARGETS, "expected a map of named targets");
		}
		for (var en : map.entrySet()) {
			String name = String.valueOf(en.getKey());
			Object def = en.getValue();
			if (def instanceof Map<?, ?> m) {
				String access = requiredString(m.get("access"), TARGETS + "." + name, "access");
				targets.put(name, new Target(name, access, optionalString(m.get("type"), TARGETS),
						optionalString(m.get("serialization"), TARGETS), optionalString(m.get("compression"), TARGETS)));
			} else if (def instanceof List<?> l && !l.isEmpty()) {
				String[] accessAndType = splitTilde(String.valueOf(l.get(0)));
				String serialization = l.size() > 1 ? String.valueOf(l.get(1)) : null;
				String compression = l.size() > 2 ? String.valueOf(l.get(2)) : null;
				targets.put(name, new Target(name, accessAndType[0], accessAndType[1], serialization, compression));
			} else if (def instanceof String s) {
				String[] accessAndType = splitTilde(s);
				targets.put(name, new Target(name, accessAndType[0], accessAndType[1], null, null));
			} else {
				throw new MalformedSpecificationException(TARGETS + "." + name, "unreadable target " + def);
			}
		}
		return targets;
	}

	private static Map<String, SourceReference> parseRootSources(Object raw) throws MalformedSpecificationException {
		Map<String, SourceReference> sources = new LinkedHashMap<>();
		if (raw == null) {
			return sources;
		}
		if (!(raw instanceof Map<?, ?> map)) {
			throw new MalformedSpecificationException(SOURCES, "expected a map of named sources");
		}
		for (var en : map.entrySet()) {
			String name = String.valueOf(en.getKey());
			sources.put(name, parseSource(name, en.getValue(), SOURCES + "." + name));
		}
		return sources;
	}

	/**
	 * A single source in any of its forms, but not a reference to a root level one.
	 */
	private static SourceReference parseSource(String name, Object def, String section)
			throws MalformedSpecificationException {
		if (def instanceof String s) {
			String[] pathAndFormat = splitTilde(s);
			String path = pathAndFormat[0];
			return SourceReference.file(path, formatOf(path, pathAndFormat[1]))
					.withName(name == null ? path : name);
		} else if (def instanceof List<?> l && !l.isEmpty() && l.get(0) instanceof String first) {
			String[] pathAndFormat = splitTilde(first);
			String path = pathAndFormat[0];
			String iterator = l.size() > 1 ? String.valueOf(l.get(1)) : null;
			return new SourceReference(name == null ? path : name, path, SourceReference.LOCAL_FILE,
					formatOf(path, pathAndFormat[1]), iterator, null, null, null, null, null);
		} else if (def instanceof Map<?, ?> m) {
			String access = requiredString(m.get("access"), section, "access");
			String type = optionalString(m.get("type"), section);
			String formulation = optionalString(m.get("referenceFormulation"), section);
			String delimiter = optionalString(m.get("delimiter"), section);
			if (delimiter != null && delimiter.length() != 1) {
				throw new MalformedSpecificationException(section, "a delimiter is a single character");
			}
			Map<String, String> credentials = parseStringMap(m.get("credentials"), section);
			return new SourceReference(name == null ? access : name, access,
					type == null ? SourceReference.LOCAL_FILE : type.toLowerCase(),
					formulation == null ? formatOf(access, null) : formulation.toLowerCase(),
					optionalString(m.get("iterator"), section), optionalString(m.get("query"), section),
					optionalString(m.get("table"), section), delimiter == null ? null : delimiter.charAt(0),
					optionalString(m.get("encoding"), section), credentials);
		}
		throw new MalformedSpecificationException(section, "unreadable source " + def);
	}

	private static List<SourceReference> parseMapSources(Object raw, Map<String, SourceReference> rootSources,
			String section) throws MalformedSpecificationException {
		List<SourceReference> sources = new ArrayList<>();
		if (raw == null) {
			return sources;
		}
		if (raw instanceof String s) {
			sources.add(referencedOrInline(s, rootSources, section));
		} else if (raw instanceof Map) {
			sources.add(parseSource(null, raw, section));
		} else if (raw instanceof List<?> l) {
			boolean allStrings = l.stream().allMatch(String.class::isInstance);
			boolean allReferences = allStrings && l.stream().allMatch(rootSources::containsKey);
			if (allStrings && !allReferences) {
				// [path~format, iterator]
				sources.add(parseSource(null, l, section));
			} else {
				for (Object o : l) {
					if (o instanceof String s) {
						sources.add(referencedOrInline(s, rootSources, section));
					} else {
						sources.add(parseSource(null, o, section));
					}
				}
			}
		} else {
			throw new MalformedSpecificationException(section, "unreadable sources " + raw);
		}
		return sources;
	}

	private static SourceReference referencedOrInline(String s, Map<String, SourceReference> rootSources,
			String section) throws MalformedSpecificationException {
		SourceReference root = rootSources.get(s);
		if (root != null) {
			return root;
		}
		return parseSource(null, s, section);
	}

	private static TriplesMap parseTriplesMap(String name, Object raw, Map<String, SourceReference> rootSources)
			throws MalformedSpecificationException {
		String section = MAPPINGS + "." + name;
		if (!(raw instanceof Map<?, ?> def)) {
			throw new MalformedSpecificationException(section, "a triples map is a map");
		}
		if (def.containsKey("condition")) {
			throw new UnsupportedConstructException(section, "condition");
		}
		List<SourceReference> sources = parseMapSources(first(def, "sources", "source"), rootSources, section);
		Object subjectDef = first(def, "subjects", "subject", "s");
		if (subjectDef == null) {
			throw new MalformedSpecificationException(section, "no subject");
		}
		SubjectRule subject = parseSubject(subjectDef, section);
		List<Template> graphs = templates(first(def, "graphs", "graph", "g"), section);

		List<Template> types = new ArrayList<>();
		List<PredicateObjectRule> pos = new ArrayList<>();
		Object poDef = first(def, "predicateobjects", "po");
		if (poDef != null) {
			if (!(poDef instanceof List<?> poList)) {
				throw new MalformedSpecificationException(section, "predicateobjects must be a list");
			}
			for (Object po : poList) {
				parsePredicateObject(po, types, pos, section);
			}
		}
		return new TriplesMap(name, sources, subject, types, pos, graphs);
	}

	private static SubjectRule parseSubject(Object subjectDef, String section) throws MalformedSpecificationException {
		if (subjectDef instanceof String s) {
			return new TemplateSubject(List.of(Template.parse(s)));
		} else if (subjectDef instanceof Map<?, ?> m) {
			return parseSubjectMap(m, section);
		} else if (subjectDef instanceof List<?> l && !l.isEmpty()) {
			List<Template> templates = new ArrayList<>();
			for (Object o : l) {
				if (o instanceof Map<?, ?> m) {
					if (l.size() > 1) {
						throw new MalformedSpecificationException(section, "a quoted subject must be the only subject");
					}
					return parseSubjectMap(m, section);
				} else if (o instanceof String s) {
					templates.add(Template.parse(s));
				} else {
					throw new MalformedSpecificationException(section, "unreadable subject " + o);
				}
			}
			return new TemplateSubject(templates);
		}
		throw new MalformedSpecificationException(section, "unreadable subject " + subjectDef);
	}

	private static SubjectRule parseSubjectMap(Map<?, ?> m, String section) throws MalformedSpecificationException {
		String namespace = optionalString(m.get("namespace"), section);
		if (m.containsKey("quoted")) {
			String quoted = requiredString(m.get("quoted"), section, "quoted");
			Object condition = m.get("condition");
			String join = null;
			if (condition != null) {
				join = joinExpression(condition, section);
			}
			return new QuotedSubject(quoted, join, namespace);
		} else if (m.containsKey("function")) {
			String function = requiredString(m.get("function"), section, "function");
			Matcher matcher = INLINE_JOIN.matcher(function);
			if (!matcher.matches()) {
				throw new UnsupportedConstructException(section, "function " + function);
			}
			String join = matcher.group(2);
			return new QuotedSubject(matcher.group(1), join == null ? null : join.trim(), namespace);
		} else if (m.containsKey("value")) {
			return new TemplateSubject(List.of(Template.parse(requiredString(m.get("value"), section, "value"))));
		}
		throw new MalformedSpecificationException(section, "a subject map needs quoted, function or value");
	}

	/**
	 * Normalize a long form condition to the inline <code>equal(str1=..,
	 * str2=..)</code> form. Anything that is not an equal over two parameters is kept
	 * as text, so that the generator can skip just this annotation map.
	 */
	private static String joinExpression(Object condition, String section) throws MalformedSpecificationException {
		if (condition instanceof String s) {
			return s;
		}
		if (!(condition instanceof Map<?, ?> c)) {
			throw new MalformedSpecificationException(section, "unreadable join condition " + condition);
		}
		String function = optionalString(c.get("function"), section);
		Object parameters = first(c, "parameters", "pms");
		if (function == null || !(parameters instanceof List<?> params)) {
			return String.valueOf(function) + "()";
		}
		String left = null;
		String right = null;
		StringBuilder raw = new StringBuilder();
		for (Object p : params) {
			if (!(p instanceof List<?> param) || param.size() < 2) {
				raw.append(p).append(' ');
				continue;
			}
			String pname = String.valueOf(param.get(0));
			String pvalue = String.valueOf(param.get(1));
			String side = param.size() > 2 ? String.valueOf(param.get(2)) : null;
			raw.append(pname).append('=').append(pvalue).append(' ');
			if ("o".equals(side) || (side == null && "str1".equals(pname))) {
				left = pvalue;
			} else if ("s".equals(side) || (side == null && "str2".equals(pname))) {
				right = pvalue;
			}
		}
		boolean isEqual = function.equals("equal") || function.endsWith(":equal");
		if (!isEqual || left == null || right == null) {
			return function + "(" + raw.toString().trim() + ")";
		}
		return "equal(str1=" + left + ", str2=" + right + ")";
	}

	private static void parsePredicateObject(Object po, List<Template> types, List<PredicateObjectRule> pos,
			String section) throws MalformedSpecificationException {
		if (po instanceof List<?> l) {
			if (l.size() < 2) {
				throw new MalformedSpecificationException(section, "a predicate object needs at least two elements");
			}
			String predicate = String.valueOf(l.get(0));
			String modifier = l.size() > 2 ? String.valueOf(l.get(2)) : null;
			if (isType(predicate)) {
				types.add(Template.parse(scalar(l.get(1), section)));
			} else {
				pos.add(shorthandObject(Template.parse(predicate), scalar(l.get(1), section), modifier, List.of(),
						null));
			}
		} else if (po instanceof Map<?, ?> m) {
			if (m.containsKey("condition")) {
				throw new UnsupportedConstructException(section, "condition");
			}
			List<String> predicates = strings(first(m, "predicates", "predicate", "p"), section);
			Object objects = first(m, "objects", "object", "o");
			if (predicates.isEmpty() || objects == null) {
				throw new MalformedSpecificationException(section, "a predicate object needs predicates and objects");
			}
			List<Template> graphs = templates(first(m, "graphs", "graph", "g"), section);
			List<String> inverse = strings(first(m, "inversepredicates", "inversepredicate", "i"), section);
			if (inverse.size() > 1) {
				throw new UnsupportedConstructException(section, "more than one inverse predicate");
			}
			Template inversePredicate = inverse.isEmpty() ? null : Template.parse(inverse.get(0));
			List<?> objectList = objects instanceof List<?> ol ? ol : List.of(objects);
			for (String predicate : predicates) {
				for (Object object : objectList) {
					if (isType(predicate)) {
						types.add(Template.parse(objectValue(object, section)));
					} else {
						pos.add(longObject(Template.parse(predicate), object, graphs, inversePredicate, section));
					}
				}
			}
		} else {
			throw new MalformedSpecificationException(section, "unreadable predicate object " + po);
		}
	}

	private static PredicateObjectRule longObject(Template predicate, Object object, List<Template> graphs,
			Template inversePredicate, String section) throws MalformedSpecificationException {
		if (object instanceof Map<?, ?> om) {
			if (om.containsKey("function")) {
				throw new UnsupportedConstructException(section, "function");
			} else if (om.containsKey("mapping")) {
				throw new UnsupportedConstructException(section, "mapping");
			} else if (om.containsKey("quoted") || om.containsKey("quotedNonAsserted")) {
				throw new UnsupportedConstructException(section, "quoted object");
			} else if (om.containsKey("condition")) {
				throw new UnsupportedConstructException(section, "condition");
			}
			String value = requiredString(om.get("value"), section, "value");
			Template objectTemplate = Template.parse(value);
			String type = optionalString(om.get("type"), section);
			ObjectKind kind;
			try {
				kind = type == null ? (objectTemplate.iriMarked() ? ObjectKind.IRI : ObjectKind.LITERAL)
						: ObjectKind.fromLabel(type);
			} catch (IllegalArgumentException e) {
				throw new UnsupportedConstructException(section, "object type " + type);
			}
			Template datatype = optionalTemplate(om.get("datatype"), section);
			Template language = optionalTemplate(om.get("language"), section);
			if (datatype != null && language != null) {
				throw new MalformedSpecificationException(section, "an object can not have a datatype and a language");
			}
			return new PredicateObjectRule(predicate, objectTemplate, kind, datatype, language, graphs,
					inversePredicate);
		} else if (object instanceof List<?> ol && !ol.isEmpty()) {
			String modifier = ol.size() > 1 ? String.valueOf(ol.get(1)) : null;
			return shorthandObject(predicate, scalar(ol.get(0), section), modifier, graphs, inversePredicate);
		}
		return shorthandObject(predicate, scalar(object, section), null, graphs, inversePredicate);
	}

	private static PredicateObjectRule shorthandObject(Template predicate, String value, String modifier,
			List<Template> graphs, Template inversePredicate) {
		Template object = Template.parse(value);
		ObjectKind kind = object.iriMarked() ? ObjectKind.IRI : ObjectKind.LITERAL;
		Template datatype = null;
		Template language = null;
		if (modifier != null) {
			if ("iri".equals(modifier)) {
				kind = ObjectKind.IRI;
			} else if (modifier.endsWith(LANG_MARKER)) {
				language = Template.parse(modifier.substring(0, modifier.length() - LANG_MARKER.length()));
			} else if (!"literal".equals(modifier)) {
				datatype = Template.parse(modifier);
			}
		}
		return new PredicateObjectRule(predicate, object, kind, datatype, language, graphs, inversePredicate);
	}

	private static String objectValue(Object object, String section) throws MalformedSpecificationException {
		if (object instanceof Map<?, ?> om) {
			return requiredString(om.get("value"), section, "value");
		} else if (object instanceof List<?> ol && !ol.isEmpty()) {
			return scalar(ol.get(0), section);
		}
		return scalar(object, section);
	}

	private static boolean isType(String predicate) {
		return "a".equals(predicate) || "rdf:type".equals(predicate)
				|| "http://www.w3.org/1999/02/22-rdf-syntax-ns#type".equals(predicate);
	}

	private static Object first(Map<?, ?> map, String... keys) {
		for (String key : keys) {
			Object o = map.get(key);
			if (o != null) {
				return o;
			}
		}
		return null;
	}

	private static List<String> strings(Object raw, String section) throws MalformedSpecificationException {
		List<String> l = new ArrayList<>();
		if (raw == null) {
			return l;
		} else if (raw instanceof List<?> list) {
			for (Object o : list) {
				l.add(scalar(o, section));
			}
		} else {
			l.add(scalar(raw, section));
		}
		return l;
	}

	private static List<Template> templates(Object raw, String section) throws MalformedSpecificationException {
		List<Template> l = new ArrayList<>();
		for (String s : strings(raw, section)) {
			l.add(Template.parse(s));
		}
		return l;
	}

	private static Template optionalTemplate(Object raw, String section) throws MalformedSpecificationException {
		String s = optionalString(raw, section);
		return s == null ? null : Template.parse(s);
	}

	private static String scalar(Object raw, String section) throws MalformedSpecificationException {
		if (raw == null || raw instanceof Map || raw instanceof Collection) {
			throw new MalformedSpecificationException(section, "expected a single value but got " + raw);
		}
		return String.valueOf(raw);
	}

	private static String optionalString(Object raw, String section) throws MalformedSpecificationException {
		if (raw == null) {
			return null;
		}
		return scalar(raw, section);
	}

	private static String requiredString(Object raw, String section, String key)
			throws MalformedSpecificationException {
		if (raw == null) {
			throw new MalformedSpecificationException(section, "missing " + key);
		}
		return scalar(raw, section);
	}

	/**
	 * Split <code>value~kind</code>, the kind is null when there is no tilde.
	 */
	private static String[] splitTilde(String s) {
		int at = s.lastIndexOf('~');
		if (at < 0) {
			return new String[] { s, null };
		}
		return new String[] { s.substring(0, at), s.substring(at + 1) };
	}

	private static String formatOf(String path, String declared) {
		if (declared != null && !declared.isBlank()) {
			return declared.toLowerCase();
		}
		String lower = path.toLowerCase();
		if (lower.contains(".tsv")) {
			return "tsv";
		} else if (lower.contains(".json")) {
			return "jsonpath";
		} else if (lower.contains(".xml")) {
			return "xpath";
		}
		return "csv";
	}
}
