/*******************************************************************************
 * Copyright (c) 2022 Eclipse RDF4J contributors.
 *
 * All rights reserved. This program and the accompanying materials
 * are made available under the terms of the Eclipse Distribution License v1.0
 * which accompanies this distribution, and is available at
 * http://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 *******************************************************************************/
package swiss.sib.swissprot.t2s.generation;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Predicate;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.Triple;
import org.eclipse.rdf4j.model.Value;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.rio.RDFHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import swiss.sib.swissprot.t2s.JoinConditionInvalidException;
import swiss.sib.swissprot.t2s.SourceUnavailableException;
import swiss.sib.swissprot.t2s.generation.RunReport.Issue;
import swiss.sib.swissprot.t2s.generation.RunReport.IssueKind;
import swiss.sib.swissprot.t2s.mapping.JoinCondition;
import swiss.sib.swissprot.t2s.mapping.MappingDocument;
import swiss.sib.swissprot.t2s.mapping.PredicateObjectRule;
import swiss.sib.swissprot.t2s.mapping.QuotedSubject;
import swiss.sib.swissprot.t2s.mapping.SourceReference;
import swiss.sib.swissprot.t2s.mapping.Template;
import swiss.sib.swissprot.t2s.mapping.TemplateSubject;
import swiss.sib.swissprot.t2s.mapping.TriplesMap;
import swiss.sib.swissprot.t2s.output.RunMetadata;
import swiss.sib.swissprot.t2s.source.Row;
import swiss.sib.swissprot.t2s.source.SourceCache;
import swiss.sib.swissprot.t2s.template.TemplateEngine;
import swiss.sib.swissprot.t2s.term.Kind;
import swiss.sib.swissprot.t2s.term.Vocabulary;

/**
 * Runs a mapping document in two passes. The first makes the base triples of every
 * triples map with a template subject and remembers them. The second joins the
 * rows of every quoted triples map against those and annotates each match with a
 * fresh reifier.
 */
public class Generator {
	private static final Logger logger = LoggerFactory.getLogger(Generator.class);
	private static final ValueFactory vf = SimpleValueFactory.getInstance();

	private final MappingDocument document;
	private final SourceCache sources;
	private final GeneratorConfig config;
	private final TemplateEngine engine;

	private TripleCache cache;
	private RunReport report;
	private Set<String> countedSources;
	private RDFHandler handler;

	private static final Map<String, Consumer<Generator>> STEPS = stepsInOrder();

	private static Map<String, Consumer<Generator>> stepsInOrder() {
		Map<String, Consumer<Generator>> steps = new LinkedHashMap<>();
		steps.put("base triples", Generator::materialize);
		steps.put("freeze", g -> g.cache.freeze());
		steps.put("annotations", Generator::annotate);
		steps.put("run metadata", Generator::describe);
		return steps;
	}

	public Generator(MappingDocument document, SourceCache sources, GeneratorConfig config) {
		this.document = document;
		this.sources = sources;
		this.config = config;
		this.engine = TemplateEngine.forDocument(document, config.sanitizeCapacity(), config.expansionCapacity());
	}

	/**
	 * Generate every statement into the handler, framed by startRDF and endRDF.
	 *
	 * @return what was generated and what was skipped
	 */
	public RunReport run(RDFHandler handler) {
		this.handler = handler;
		this.cache = new TripleCache();
		this.report = new RunReport();
		this.countedSources = new HashSet<>();
		handler.startRDF();
		for (var prefix : document.prefixes().entrySet()) {
			handler.handleNamespace(prefix.getKey(), prefix.getValue());
		}
		logger.info("Starting all steps ");
		Instant start = Instant.now();
		for (var step : STEPS.entrySet()) {
			logger.info("Starting step " + step.getKey());
			Instant stepStart = Instant.now();
			step.getValue().accept(this);
			logger.info("Finished step " + step.getKey() + " in " + Duration.between(stepStart, Instant.now()));
		}
		handler.endRDF();
		logger.info("Finished all steps in " + Duration.between(start, Instant.now()));
		logger.info(report.summary());
		return report;
	}

	/**
	 * @return the cache of the last run, frozen once it finished
	 */
	public TripleCache cache() {
		return cache;
	}

	List<TriplesMap> orderedMaterialMaps() {
		return ordered(document.materialMaps());
	}

	List<TriplesMap> orderedQuotedMaps() {
		return ordered(document.quotedMaps());
	}

	/**
	 * The maps named in the configured map order first, then the rest in document
	 * order.
	 */
	private List<TriplesMap> ordered(List<TriplesMap> maps) {
		Set<TriplesMap> ordered = new LinkedHashSet<>();
		for (String name : config.mapOrder()) {
			TriplesMap tm = document.triplesMap(name);
			if (tm == null) {
				logger.warn("Map order names " + name + " which is not in the mapping document");
			} else if (maps.contains(tm)) {
				ordered.add(tm);
			}
		}
		ordered.addAll(maps);
		return new ArrayList<>(ordered);
	}

	private void materialize() {
		for (TriplesMap tm : orderedMaterialMaps()) {
			List<Row> rows = rowsOf(tm);
			if (rows == null) {
				continue;
			}
			TemplateSubject subject = (TemplateSubject) tm.subject();
			for (Row row : rows) {
				List<Statement> buffer = new ArrayList<>();
				List<Triple> triples = new ArrayList<>();
				try {
					materializeRow(tm, subject, row, buffer, triples);
				} catch (RuntimeException e) {
					rowFailed(tm, row, e);
					continue;
				}
				flush(buffer);
				for (Triple t : triples) {
					cache.add(tm.name(), row, t);
				}
				report.baseTriples(buffer.size());
				for (Statement s : buffer) {
					report.baseObject(Kind.of(s.getObject()));
				}
			}
		}
		logger.info("Cached " + cache.size() + " base triples for annotation");
	}

	private void materializeRow(TriplesMap tm, TemplateSubject subjectRule, Row row, List<Statement> buffer,
			List<Triple> triples) {
		List<IRI> mapGraphs = engine.iris(tm.graphs(), row);
		for (Template subjectTemplate : subjectRule.templates()) {
			IRI subject = engine.iri(subjectTemplate, row);
			for (Template type : tm.types()) {
				addBase(subject, RDF.TYPE, engine.iri(type, row), mapGraphs, buffer, triples);
			}
			for (PredicateObjectRule po : tm.predicateObjects()) {
				Optional<Value> object = engine.object(po, row);
				if (object.isEmpty()) {
					continue;
				}
				IRI predicate = engine.iri(po.predicate(), row);
				List<IRI> graphs = po.graphs().isEmpty() ? mapGraphs : engine.iris(po.graphs(), row);
				addBase(subject, predicate, object.get(), graphs, buffer, triples);
				if (po.inversePredicate() != null && object.get().isIRI()) {
					addBase((IRI) object.get(), engine.iri(po.inversePredicate(), row), subject, graphs, buffer,
							triples);
				}
			}
		}
	}

	/**
	 * Buffer one statement per graph, or one in the default graph.
	 */
	private static void add(Resource subject, IRI predicate, Value object, List<IRI> graphs, List<Statement> buffer) {
		if (graphs.isEmpty()) {
			buffer.add(vf.createStatement(subject, predicate, object));
		} else {
			for (IRI graph : graphs) {
				buffer.add(vf.createStatement(subject, predicate, object, graph));
			}
		}
	}

	private static void addBase(Resource subject, IRI predicate, Value object, List<IRI> graphs,
			List<Statement> buffer, List<Triple> triples) {
		add(subject, predicate, object, graphs, buffer);
		triples.add(vf.createTriple(subject, predicate, object));
	}

	private void annotate() {
		for (TriplesMap tm : orderedQuotedMaps()) {
			QuotedSubject quoted = (QuotedSubject) tm.subject();
			JoinCondition join;
			try {
				join = JoinCondition.parse(quoted.joinExpression());
			} catch (JoinConditionInvalidException e) {
				logger.warn("Skipping annotation map " + tm.name() + ": " + e.getMessage());
				report.record(new Issue(IssueKind.JOIN_CONDITION_INVALID, tm.name(), 0, e.getMessage()));
				report.mapSkipped();
				continue;
			}
			List<Row> rows = rowsOf(tm);
			if (rows == null) {
				continue;
			}
			Predicate<CacheEntry> filter = e -> true;
			if (quoted.namespace() != null) {
				filter = JoinResolver.subjectIn(engine.expand(quoted.namespace()));
			}
			Map<String, List<CacheEntry>> index = JoinResolver.buildIndex(cache, join.leftKey(), filter);
			logger.info("Annotating " + tm.name() + " joining " + index.size() + " keys of " + quoted.quotedMapping()
					+ " on " + join.expression());
			for (Row row : rows) {
				List<CacheEntry> matches = JoinResolver.lookup(index, row.get(join.rightKey()));
				if (matches.isEmpty()) {
					continue;
				}
				List<Statement> buffer = new ArrayList<>();
				int[] counts = new int[2];
				try {
					annotateRow(tm, row, matches, buffer, counts);
				} catch (RuntimeException e) {
					rowFailed(tm, row, e);
					continue;
				}
				flush(buffer);
				report.reifiers(counts[0]);
				report.annotationStatements(counts[1]);
			}
		}
	}

	private void annotateRow(TriplesMap tm, Row row, List<CacheEntry> matches, List<Statement> buffer,
			int[] counts) {
		List<IRI> mapGraphs = engine.iris(tm.graphs(), row);
		for (CacheEntry match : matches) {
			BNode reifier = vf.createBNode();
			add(reifier, Vocabulary.REIFIES, match.triple(), mapGraphs, buffer);
			counts[0]++;
			for (Template type : tm.types()) {
				add(reifier, RDF.TYPE, engine.iri(type, row), mapGraphs, buffer);
				counts[1]++;
			}
			for (PredicateObjectRule po : tm.predicateObjects()) {
				Optional<Value> object = engine.object(po, row);
				if (object.isEmpty()) {
					continue;
				}
				List<IRI> graphs = po.graphs().isEmpty() ? mapGraphs : engine.iris(po.graphs(), row);
				add(reifier, engine.iri(po.predicate(), row), object.get(), graphs, buffer);
				counts[1]++;
			}
		}
	}

	private void describe() {
		if (!config.includeRunMetadata()) {
			return;
		}
		List<Statement> metadata = RunMetadata.describe(document, Instant.now());
		flush(metadata);
		report.metadataStatements(metadata.size());
	}

	/**
	 * @return all rows of all sources of the map, or null if the map must be skipped
	 */
	private List<Row> rowsOf(TriplesMap tm) {
		if (tm.sources().isEmpty()) {
			logger.warn("Triples map " + tm.name() + " has no source, skipping it");
			report.record(new Issue(IssueKind.MISSING_SOURCE, tm.name(), 0, "no source declared"));
			report.mapSkipped();
			return null;
		}
		List<Row> rows = new ArrayList<>();
		for (SourceReference ref : tm.sources()) {
			try {
				List<Row> sourceRows = sources.rows(ref);
				if (countedSources.add(sources.locator(ref))) {
					report.rowsRead(sourceRows.size());
				}
				warnOnMissingColumns(tm, ref, sourceRows);
				rows.addAll(sourceRows);
			} catch (SourceUnavailableException e) {
				logger.error("Skipping triples map " + tm.name() + ": " + e.getMessage());
				report.record(new Issue(IssueKind.SOURCE_UNAVAILABLE, tm.name(), 0, e.getMessage()));
				report.mapSkipped();
				return null;
			}
		}
		return rows;
	}

	private static void warnOnMissingColumns(TriplesMap tm, SourceReference ref, List<Row> rows) {
		if (rows.isEmpty()) {
			return;
		}
		Set<String> missing = new LinkedHashSet<>(tm.referencedColumns());
		missing.removeAll(rows.get(0).columns());
		if (!missing.isEmpty()) {
			logger.warn("Source " + ref.name() + " of " + tm.name() + " has no column(s) " + missing);
		}
	}

	private void rowFailed(TriplesMap tm, Row row, RuntimeException e) {
		logger.warn("Skipping row " + row.index() + " of " + tm.name() + ": " + e.getMessage());
		report.record(new Issue(IssueKind.ROW_EVALUATION, tm.name(), row.index(), e.getMessage()));
	}

	private void flush(List<Statement> statements) {
		for (Statement s : statements) {
			handler.handleStatement(s);
		}
	}
}
