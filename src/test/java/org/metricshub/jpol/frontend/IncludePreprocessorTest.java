package org.metricshub.jpol.frontend;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jpol.PolicyFileNotFoundException;

public class IncludePreprocessorTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private IncludePreprocessor preprocessor;

	@Before
	public void setUp() {
		preprocessor = new IncludePreprocessor(folder.getRoot().toPath());
	}

	private void write(String name, String content) throws IOException {
		File file = new File(folder.getRoot(), name);
		file.getParentFile().mkdirs();
		Files.write(file.toPath(), content.getBytes(StandardCharsets.UTF_8));
	}

	@Test
	public void testNoInclude() {
		assertEquals(
				Arrays.asList("header {", "  target:: mock", "}"),
				preprocessor.preprocess("header {   \n  target:: mock\t\n}\n", 5));
	}

	@Test
	public void testQuotedAndUnquotedIncludes() throws Exception {
		write("a.inc", "term a { action:: accept }\n");
		write("sub/b.inc", "term b { action:: deny }\n");
		List<String> lines = preprocessor.preprocess("first\n#include \"a.inc\"\n  #include sub/b.inc\nlast\n", 5);
		assertEquals(Arrays.asList("first", "term a { action:: accept }", "term b { action:: deny }", "last"), lines);
	}

	@Test
	public void testNestedIncludes() throws Exception {
		write("outer.inc", "outer\n#include 'inner.inc'\n");
		write("inner.inc", "inner\n");
		assertEquals(Arrays.asList("outer", "inner"), preprocessor.preprocess("#include outer.inc", 5));
	}

	@Test
	public void testLoneIncludeIsKept() {
		assertEquals(Arrays.asList("#include", "# include x.inc"), preprocessor.preprocess("#include\n# include x.inc\n", 5));
	}

	@Test
	public void testRecursion() throws Exception {
		write("loop.inc", "#include loop.inc\n");
		assertThrows(RecursionTooDeepException.class, () -> preprocessor.preprocess("#include loop.inc\n", 5));
		assertThrows(RecursionTooDeepException.class, () -> preprocessor.preprocess("anything\n", 0));
	}

	@Test
	public void testDepthLimit() throws Exception {
		write("one.inc", "#include two.inc\n");
		write("two.inc", "two\n");
		assertEquals(Arrays.asList("two"), preprocessor.preprocess("#include one.inc\n", 3));
		assertThrows(RecursionTooDeepException.class, () -> preprocessor.preprocess("#include one.inc\n", 2));
	}

	@Test
	public void testBadSuffix() throws Exception {
		write("terms.pol", "term x { action:: accept }\n");
		assertThrows(BadIncludePathException.class, () -> preprocessor.preprocess("#include terms.pol\n", 5));
	}

	@Test
	public void testOutsideBaseDirectory() throws Exception {
		File base = folder.newFolder("base");
		write("escape.inc", "term x { action:: accept }\n");
		IncludePreprocessor confined = new IncludePreprocessor(base.toPath());
		assertThrows(BadIncludePathException.class, () -> confined.preprocess("#include ../escape.inc\n", 5));
		assertThrows(BadIncludePathException.class, () -> confined.preprocess("#include ../does-not-exist.inc\n", 5));
	}

	@Test
	public void testSymbolicLinks() throws Exception {
		File base = folder.newFolder("confined");
		File outside = folder.newFolder("outside");
		Files.write(new File(outside, "secret.inc").toPath(), "SECRET LINE\n".getBytes(StandardCharsets.UTF_8));
		Files.write(new File(base, "real.inc").toPath(), "term x { action:: accept }\n".getBytes(StandardCharsets.UTF_8));
		Files.createSymbolicLink(new File(base, "link.inc").toPath(), new File(outside, "secret.inc").toPath());
		Files.createSymbolicLink(new File(base, "alias.inc").toPath(), new File(base, "real.inc").toPath());

		IncludePreprocessor confined = new IncludePreprocessor(base.toPath());
		assertThrows(BadIncludePathException.class, () -> confined.preprocess("#include link.inc\n", 5));
		assertEquals(Arrays.asList("term x { action:: accept }"), confined.preprocess("#include alias.inc\n", 5));
	}

	@Test
	public void testMissingInclude() {
		assertThrows(PolicyFileNotFoundException.class, () -> preprocessor.preprocess("#include missing.inc\n", 5));
	}
}
