package swiss.sib.swissprot.t2s.source;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SourcePathResolverTest {

	@TempDir
	public File temp;

	@Test
	public void nextToMapping() throws IOException {
		Path mappings = Files.createDirectories(temp.toPath().resolve("mappings"));
		Path data = Files.createFile(mappings.resolve("people.csv"));
		assertEquals(data, new SourcePathResolver(mappings).resolve("people.csv"));
	}

	@Test
	public void inDataDirectoryOfParent() throws IOException {
		Path mappings = Files.createDirectories(temp.toPath().resolve("mappings"));
		Path dataDir = Files.createDirectories(temp.toPath().resolve("data"));
		Path data = Files.createFile(dataDir.resolve("people.csv"));
		assertEquals(data.toAbsolutePath().normalize(), new SourcePathResolver(mappings).resolve("people.csv"));
	}

	@Test
	public void inBenchmarkData() throws IOException {
		Path mappings = Files.createDirectories(temp.toPath().resolve("mappings"));
		Path dataDir = Files.createDirectories(mappings.resolve("benchmark_data"));
		Path data = Files.createFile(dataDir.resolve("people.csv"));
		assertEquals(data.toAbsolutePath().normalize(), new SourcePathResolver(mappings).resolve("people.csv"));
	}

	@Test
	public void notFoundGivesFirstCandidate() {
		Path mappings = temp.toPath().resolve("mappings");
		assertEquals(mappings.resolve("nothere.csv").toAbsolutePath().normalize(),
				new SourcePathResolver(mappings).resolve("nothere.csv"));
	}

	@Test
	public void absolute() throws IOException {
		Path data = Files.createFile(temp.toPath().resolve("abs.csv")).toAbsolutePath();
		assertEquals(data, new SourcePathResolver(temp.toPath().resolve("x")).resolve(data.toString()));
	}

	@Test
	public void environment() {
		Map<String, String> env = Map.of("DATA_DIR", "/srv/data", "USER", "jane");
		SourcePathResolver resolver = new SourcePathResolver(temp.toPath(), env::get);
		assertEquals("/srv/data/people.csv", resolver.interpolate("${DATA_DIR}/people.csv"));
		assertEquals("jane:${UNSET}", resolver.interpolate("${USER}:${UNSET}"));
		assertEquals("plain", resolver.interpolate("plain"));
	}
}
