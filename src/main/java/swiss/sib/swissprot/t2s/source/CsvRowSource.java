package swiss.sib.swissprot.t2s.source;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import swiss.sib.swissprot.t2s.SourceUnavailableException;

/**
 * Rows of a delimited text file with a header line. Compressed files are
 * decompressed on the fly, see {@link Compression}.
 */
public class CsvRowSource implements RowSource {
	private static final Logger logger = LoggerFactory.getLogger(CsvRowSource.class);

	private final Path file;
	private final char delimiter;
	private final Charset encoding;

	public CsvRowSource(Path file) {
		this(file, defaultDelimiter(file), StandardCharsets.UTF_8);
	}

	public CsvRowSource(Path file, char delimiter, Charset encoding) {
		this.file = file;
		this.delimiter = delimiter;
		this.encoding = encoding;
	}

	static char defaultDelimiter(Path file) {
		String name = Compression.removeExtension(file.getFileName().toString().toLowerCase());
		return name.endsWith(".tsv") || name.endsWith(".tab") ? '\t' : ',';
	}

	@Override
	public List<Row> rows() throws SourceUnavailableException {
		if (!Files.isRegularFile(file)) {
			throw new SourceUnavailableException(describe(), "no such file");
		}
		CSVFormat format = CSVFormat.DEFAULT.builder()
				.setHeader()
				.setSkipHeaderRecord(true)
				.setDelimiter(delimiter)
				.build();
		Compression compression = Compression.fromFileName(file.getFileName().toString());
		List<Row> rows = new ArrayList<>();
		try (Reader r = new InputStreamReader(compression.open(file), encoding);
				CSVParser parser = format.parse(r)) {
			if (parser.getHeaderNames().isEmpty()) {
				throw new SourceUnavailableException(describe(), "no header line");
			}
			long index = 1;
			for (CSVRecord rec : parser) {
				rows.add(new Row(index++, rec.toMap()));
			}
		} catch (IOException | IllegalArgumentException e) {
			throw new SourceUnavailableException(describe(), e);
		}
		logger.debug("Read " + rows.size() + " rows from " + file);
		return rows;
	}

	@Override
	public String describe() {
		return file.toString();
	}
}
