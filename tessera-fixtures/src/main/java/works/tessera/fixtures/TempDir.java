package works.tessera.fixtures;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import works.tessera.FixtureKey;
import works.tessera.FixtureSpec;
import works.tessera.Scope;

/**
 * A fresh temporary directory, deleted along with everything in it on teardown.
 */
public final class TempDir {
	public static final FixtureKey KEY = FixtureKey.of("tempDir");

	private TempDir() { }

	public static FixtureSpec spec() {
		return spec(KEY, Scope.FRESH);
	}

	public static FixtureSpec spec(FixtureKey key, Scope scope) {
		return FixtureSpec.builder(key)
			.scope(scope)
			.provides(Path.class)
			.constructor(args -> {
				Path dir = Files.createTempDirectory("tessera-");
				LOGGER.debug("Created temporary directory {}", dir);
				return dir;
			})
			.teardown(value -> deleteRecursively((Path) value))
			.build();
	}

	static void deleteRecursively(Path root) throws IOException {
		if (!Files.exists(root)) {
			return;
		}
		Files.walkFileTree(root, new SimpleFileVisitor<>() {
			@Override
			public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
				Files.delete(file);
				return FileVisitResult.CONTINUE;
			}

			@Override
			public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
				if (exc != null) {
					throw exc;
				}
				Files.delete(dir);
				return FileVisitResult.CONTINUE;
			}
		});
		LOGGER.debug("Deleted temporary directory {}", root);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(TempDir.class);
}
