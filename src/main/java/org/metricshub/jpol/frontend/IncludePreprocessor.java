package org.metricshub.jpol.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jpol
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.jpol.FileReadException;
import org.metricshub.jpol.util.JpolLogger;
import org.metricshub.jpol.util.PolicyFileSource;
import org.slf4j.Logger;

/**
 * Expands <code>#include</code> directives before the policy text is parsed.
 * <p>
 * A line whose first word is <code>#include</code> and which has a second
 * word is replaced by the content of the named file, itself preprocessed.
 * The path may be quoted, is resolved against the base directory, must end
 * with <code>.inc</code> and must not point outside the base directory,
 * directly or through symbolic links.
 * Any other line, including a lone <code>#include</code>, is kept as is
 * (the lexer then skips it as a comment).
 */
public class IncludePreprocessor {

	private static final Logger LOG = JpolLogger.getLogger(IncludePreprocessor.class);

	private static final String INCLUDE_DIRECTIVE = "#include";
	private static final String INCLUDE_SUFFIX = ".inc";

	private final Path baseDirectory;

	/**
	 * <p>
	 * Constructor for IncludePreprocessor.
	 * </p>
	 *
	 * @param baseDirectory the directory include paths are resolved against
	 */
	public IncludePreprocessor(Path baseDirectory) {
		this.baseDirectory = baseDirectory.toAbsolutePath().normalize();
	}

	/**
	 * Expands the include directives of <code>text</code>.
	 *
	 * @param text the policy text
	 * @param depth how many more levels of includes are allowed
	 * @return the expanded lines, right-trimmed
	 * @throws RecursionTooDeepException when <code>depth</code> is exhausted
	 * @throws BadIncludePathException when an include path is not acceptable
	 * @throws org.metricshub.jpol.PolicyFileNotFoundException when an included file does not exist
	 * @throws FileReadException when an included file cannot be read
	 */
	public List<String> preprocess(String text, int depth) {
		if (depth <= 0) {
			throw new RecursionTooDeepException(
					"Your include depth limit has been exceeded, check for recursive includes under " + baseDirectory);
		}
		List<String> lines = new ArrayList<String>();
		for (String rawLine : text.split("\r?\n", -1)) {
			String line = rightTrim(rawLine);
			String[] words = line.trim().split("\\s+");
			if (words.length > 1 && INCLUDE_DIRECTIVE.equals(words[0])) {
				String includeFile = stripQuotes(words[1]);
				Path includePath = resolve(includeFile);
				checkRealPath(includePath, includeFile);
				LOG.debug("Including {}", includePath);
				lines.addAll(preprocess(read(includePath), depth - 1));
			} else {
				lines.add(line);
			}
		}
		// a trailing newline would otherwise add an empty line
		if (!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty() && text.endsWith("\n")) {
			lines.remove(lines.size() - 1);
		}
		return lines;
	}

	/**
	 * Checks an include path without touching the file system.
	 */
	private Path resolve(String includeFile) {
		Path includePath = baseDirectory.resolve(includeFile).toAbsolutePath().normalize();
		Path fileName = includePath.getFileName();
		if (fileName == null || !fileName.toString().endsWith(INCLUDE_SUFFIX)) {
			throw new BadIncludePathException(
					"Include file name must end in \"" + INCLUDE_SUFFIX + "\": " + includeFile);
		}
		if (!includePath.startsWith(baseDirectory)) {
			throw new BadIncludePathException(
					"Include file cannot be loaded from outside the base directory " + baseDirectory + ": " + includeFile);
		}
		return includePath;
	}

	/**
	 * Follows the symbolic links of an existing include file: the file they
	 * lead to must be inside the base directory as well.
	 */
	private void checkRealPath(Path includePath, String includeFile) {
		if (!Files.exists(includePath)) {
			return;
		}
		try {
			if (!includePath.toRealPath().startsWith(baseDirectory.toRealPath())) {
				throw new BadIncludePathException(
						"Include file links to outside the base directory " + baseDirectory + ": " + includeFile);
			}
		} catch (IOException e) {
			throw new FileReadException(includePath.toString(), e);
		}
	}

	private static String read(Path includePath) {
		PolicyFileSource source = new PolicyFileSource(includePath);
		StringBuilder content = new StringBuilder();
		try (Reader reader = source.getReader(); BufferedReader lines = new BufferedReader(reader)) {
			String line;
			while ((line = lines.readLine()) != null) {
				content.append(line).append('\n');
			}
		} catch (IOException e) {
			throw new FileReadException(includePath.toString(), e);
		}
		return content.toString();
	}

	private static String stripQuotes(String word) {
		int start = 0;
		int end = word.length();
		while (start < end && (word.charAt(start) == '"' || word.charAt(start) == '\'')) {
			start++;
		}
		while (end > start && (word.charAt(end - 1) == '"' || word.charAt(end - 1) == '\'')) {
			end--;
		}
		return word.substring(start, end);
	}

	private static String rightTrim(String line) {
		int end = line.length();
		while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
			end--;
		}
		return line.substring(0, end);
	}
}
