package swiss.sib.swissprot.t2s.source;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the file a source access path points to. Relative paths are tried against
 * the directory of the mapping document, its parent, and a <code>data</code> and
 * <code>benchmark_data</code> directory next to either.
 */
public class SourcePathResolver {
	private static final Pattern ENV = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)\\}");

	private final Path mappingDirectory;
	private final Function<String, String> environment;

	public SourcePathResolver(Path mappingDirectory) {
		this(mappingDirectory, System::getenv);
	}

	public SourcePathResolver(Path mappingDirectory, Function<String, String> environment) {
		this.mappingDirectory = mappingDirectory == null ? Path.of(".").toAbsolutePath().normalize()
				: mappingDirectory.toAbsolutePath().normalize();
		this.environment = environment;
	}

	/**
	 * Replace <code>${NAME}</code> by the value of that environment variable. Unset
	 * variables are left as they are.
	 */
	public String interpolate(String value) {
		if (value == null || value.indexOf("${") < 0) {
			return value;
		}
		Matcher m = ENV.matcher(value);
		StringBuilder sb = new StringBuilder();
		while (m.find()) {
			String replacement = environment.apply(m.group(1));
			m.appendReplacement(sb, Matcher.quoteReplacement(replacement == null ? m.group() : replacement));
		}
		m.appendTail(sb);
		return sb.toString();
	}

	/**
	 * @return the first existing candidate, or the first candidate if none exists
	 */
	public Path resolve(String access) {
		List<Path> candidates = candidates(interpolate(access));
		for (Path p : candidates) {
			if (Files.exists(p)) {
				return p;
			}
		}
		return candidates.get(0);
	}

	List<Path> candidates(String access) {
		Path given = Path.of(access);
		List<Path> candidates = new ArrayList<>();
		if (given.isAbsolute()) {
			candidates.add(given.normalize());
			return candidates;
		}
		candidates.add(mappingDirectory.resolve(given).normalize());
		Path parent = mappingDirectory.getParent();
		if (parent != null) {
			candidates.add(parent.resolve(given).normalize());
		}
		for (String dir : List.of("data", "benchmark_data")) {
			candidates.add(mappingDirectory.resolve(dir).resolve(given).normalize());
			if (parent != null) {
				candidates.add(parent.resolve(dir).resolve(given).normalize());
			}
		}
		return candidates;
	}
}
