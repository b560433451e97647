package works.tessera.fixtures;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import works.tessera.CaseResult;
import works.tessera.FixtureRegistry;
import works.tessera.Outcome;
import works.tessera.RunSettings;
import works.tessera.RunSummary;
import works.tessera.TesseraConfig;
import works.tessera.TesseraEngine;
import works.tessera.TestDefinition;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TempDirTest {
	final List<CaseResult> results = new ArrayList<>();
	final List<Path> seen = new ArrayList<>();

	@Test
	void tempDir_deletedWithContents() throws InterruptedException {
		RunSummary summary = run(TestDefinition.builder("writes")
			.uses(TempDir.KEY)
			.body(args -> {
				Path dir = args.get(TempDir.KEY, Path.class);
				assertTrue(Files.isDirectory(dir));
				Path nested = Files.createDirectories(dir.resolve("a/b"));
				Files.writeString(nested.resolve("file.txt"), "contents");
				seen.add(dir);
			})
			.build());

		assertEquals(1, summary.count(Outcome.PASSED), () -> "Results: " + results);
		assertEquals(0, summary.teardownFailures());
		assertFalse(Files.exists(seen.get(0)));
	}

	@Test
	void tempDir_freshForEachCase() throws InterruptedException {
		run(
			TestDefinition.builder("first").uses(TempDir.KEY).body(args -> seen.add(args.get(TempDir.KEY, Path.class))).build(),
			TestDefinition.builder("second").uses(TempDir.KEY).body(args -> seen.add(args.get(TempDir.KEY, Path.class))).build());

		assertEquals(2, seen.size());
		assertNotEquals(seen.get(0), seen.get(1));
	}

	@Test
	void tempFile_deletedEvenIfMoved() throws InterruptedException {
		RunSummary summary = run(TestDefinition.builder("moves")
			.uses(TempFile.KEY)
			.body(args -> {
				Path file = args.get(TempFile.KEY, Path.class);
				assertTrue(Files.isRegularFile(file));
				seen.add(file);
				Files.delete(file);
			})
			.build());

		assertEquals(1, summary.count(Outcome.PASSED));
		assertEquals(0, summary.teardownFailures(), "A missing file is not a teardown failure");
		assertFalse(Files.exists(seen.get(0)));
	}

	@Test
	void deleteRecursively_missingDirectoryIgnored() throws IOException {
		Path dir = Files.createTempDirectory("tessera-test-");
		Files.delete(dir);
		TempDir.deleteRecursively(dir);
		assertFalse(Files.exists(dir));
	}

	private RunSummary run(TestDefinition... definitions) throws InterruptedException {
		FixtureRegistry registry = StandardFixtures.registerIn(FixtureRegistry.builder()).build();
		TesseraConfig config = TesseraConfig.builder().reporter(results::add).build();
		return new TesseraEngine(registry, List.of(definitions), config)
			.run(RunSettings.builder().threads(1).build());
	}
}
