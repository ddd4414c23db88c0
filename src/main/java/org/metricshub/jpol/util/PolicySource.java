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

import java.io.Reader;
import java.io.StringReader;

/**
 * Represents one policy content source.
 * This is usually either a policy file, or text handed over by
 * the embedding application.
 * <p>
 * The description is what error messages report as the file name.
 */
public class PolicySource {

	/** Constant <code>DESCRIPTION_INLINE_POLICY="&lt;inline-policy&gt;"</code> */
	public static final String DESCRIPTION_INLINE_POLICY = "<inline-policy>";

	private final String description;
	private final Reader reader;

	/**
	 * <p>
	 * Constructor for PolicySource.
	 * </p>
	 *
	 * @param description a {@link java.lang.String} object
	 * @param reader a {@link java.io.Reader} object
	 */
	public PolicySource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * Creates a source over policy text.
	 *
	 * @param description name reported in error messages, may be <code>null</code>
	 * @param text the policy text
	 * @return a new source
	 */
	public static PolicySource fromText(String description, String text) {
		return new PolicySource(
				description == null ? DESCRIPTION_INLINE_POLICY : description,
				new StringReader(text));
	}

	/**
	 * <p>
	 * Getter for the field <code>description</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the policy contents.
	 *
	 * @return The reader which contains the policy contents.
	 */
	public Reader getReader() {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
