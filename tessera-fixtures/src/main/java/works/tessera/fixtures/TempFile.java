package works.tessera.fixtures;

import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.FixtureKey;
import works.tessera.FixtureSpec;
import works.tessera.Scope;

/**
 * A fresh, empty temporary file, deleted on teardown if it still exists.
 */
public final class TempFile {
	public static final FixtureKey KEY = FixtureKey.of("tempFile");

	private TempFile() { }

	public static FixtureSpec spec() {
		return spec(KEY, Scope.FRESH, ".tmp");
	}

	public static FixtureSpec spec(FixtureKey key, Scope scope, String suffix) {
		return FixtureSpec.builder(key)
			.scope(scope)
			.provides(Path.class)
			.constructor(args -> {
				Path file = Files.createTempFile("tessera-", suffix);
				LOGGER.debug("Created temporary file {}", file);
				return file;
			})
			.teardown(value -> {
				if (Files.deleteIfExists((Path) value)) {
					LOGGER.debug("Deleted temporary file {}", value);
				}
			})
			.build();
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TempFile.class);
}
