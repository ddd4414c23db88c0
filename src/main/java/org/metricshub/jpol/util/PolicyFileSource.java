package org.metricshub.jpol.util;

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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.metricshub.jpol.FileReadException;
import org.metricshub.jpol.PolicyFileNotFoundException;

/**
 * Represents one policy file (or include file) content source.
 */
public class PolicyFileSource extends PolicySource {

	private final Path filePath;
	private Reader fileReader;

	/**
	 * <p>
	 * Constructor for PolicyFileSource.
	 * </p>
	 *
	 * @param filePath a {@link java.nio.file.Path} object
	 */
	public PolicyFileSource(Path filePath) {
		super(filePath.toString(), null);
		this.filePath = filePath;
		this.fileReader = null;
	}

	/**
	 * <p>
	 * Getter for the field <code>filePath</code>.
	 * </p>
	 *
	 * @return a {@link java.nio.file.Path} object
	 */
	public Path getFilePath() {
		return filePath;
	}

	/**
	 * {@inheritDoc}
	 *
	 * @throws PolicyFileNotFoundException when the file does not exist
	 * @throws FileReadException when the file cannot be opened
	 */
	@Override
	public Reader getReader() {
		if (fileReader == null) {
			if (!Files.isRegularFile(filePath)) {
				throw new PolicyFileNotFoundException(filePath.toString());
			}
			try {
				fileReader = Files.newBufferedReader(filePath, StandardCharsets.UTF_8);
			} catch (IOException ex) {
				throw new FileReadException(filePath.toString(), ex);
			}
		}

		return fileReader;
	}
}
