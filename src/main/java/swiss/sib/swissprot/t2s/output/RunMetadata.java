package swiss.sib.swissprot.t2s.output;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.eclipse.rdf4j.model.BNode;
import org.eclipse.rdf4j.model.IRI;
import org.eclipse.rdf4j.model.Resource;
import org.eclipse.rdf4j.model.Statement;
import org.eclipse.rdf4j.model.ValueFactory;
import org.eclipse.rdf4j.model.impl.SimpleValueFactory;
import org.eclipse.rdf4j.model.vocabulary.DCAT;
import org.eclipse.rdf4j.model.vocabulary.DCTERMS;
import org.eclipse.rdf4j.model.vocabulary.FOAF;
import org.eclipse.rdf4j.model.vocabulary.RDF;
import org.eclipse.rdf4j.model.vocabulary.XSD;

import swiss.sib.swissprot.t2s.mapping.Author;
import swiss.sib.swissprot.t2s.mapping.MappingDocument;
import swiss.sib.swissprot.t2s.term.Vocabulary;

/**
 * A DCAT description of the dataset a run produced.
 */
public class RunMetadata {
	private static final ValueFactory vf = SimpleValueFactory.getInstance();

	private RunMetadata() {

	}

	public static IRI datasetIri(MappingDocument document) {
		String base = document.base() == null || document.base().isBlank() ? Vocabulary.DEFAULT_BASE : document.base();
		return vf.createIRI(base);
	}

	public static List<Statement> describe(MappingDocument document, Instant created) {
		List<Statement> statements = new ArrayList<>();
		IRI dataset = datasetIri(document);
		statements.add(vf.createStatement(dataset, RDF.TYPE, DCAT.DATASET));
		statements.add(vf.createStatement(dataset, DCTERMS.TITLE,
				vf.createLiteral("RDF-star dataset generated from " + document.triplesMaps().size() + " triples maps")));
		statements.add(vf.createStatement(dataset, DCTERMS.DESCRIPTION, vf.createLiteral(
				"Statements from " + document.materialMaps().size() + " triples maps annotated by "
						+ document.quotedMaps().size() + " quoted triples maps: "
						+ String.join(", ", document.triplesMaps().keySet()))));
		statements.add(vf.createStatement(dataset, DCTERMS.CREATED, vf.createLiteral(created.toString(), XSD.DATETIME)));
		for (Author author : document.authors()) {
			Resource creator = creator(author, statements);
			statements.add(vf.createStatement(dataset, DCTERMS.CREATOR, creator));
		}
		return statements;
	}

	private static Resource creator(Author author, List<Statement> statements) {
		if (author.webid() != null && author.name() == null && author.email() == null) {
			return vf.createIRI(author.webid());
		}
		BNode agent = vf.createBNode();
		statements.add(vf.createStatement(agent, RDF.TYPE, FOAF.AGENT));
		statements.add(vf.createStatement(agent, FOAF.NAME, vf.createLiteral(author.label())));
		if (author.email() != null) {
			statements.add(vf.createStatement(agent, FOAF.MBOX, vf.createIRI("mailto:" + author.email())));
		}
		if (author.website() != null && author.website().indexOf(':') > 0) {
			statements.add(vf.createStatement(agent, FOAF.HOMEPAGE, vf.createIRI(author.website())));
		}
		return agent;
	}
}
