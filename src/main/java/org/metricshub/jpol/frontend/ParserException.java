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

import org.metricshub.jpol.PolicyException;

/**
 * The policy text does not follow the grammar, or a term mixes verbatim
 * text with regular attributes.
 */
public class ParserException extends PolicyException {

	private static final long serialVersionUID = 1L;

	private final String tokenText;
	private final String tokenType;
	private final String sourceDescription;

	/**
	 * @param msg what went wrong
	 */
	public ParserException(String msg) {
		super(msg);
		this.tokenText = null;
		this.tokenType = null;
		this.sourceDescription = null;
	}

	/**
	 * @param msg what went wrong
	 * @param sourceDescription the policy file
	 * @param lineNumber the offending line
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber) {
		super(lineNumber, msg + " (" + sourceDescription + ":" + lineNumber + ")");
		this.tokenText = null;
		this.tokenType = null;
		this.sourceDescription = sourceDescription;
	}

	/**
	 * <p>
	 * Constructor for ParserException.
	 * </p>
	 *
	 * @param msg what went wrong
	 * @param tokenText the text of the offending token
	 * @param tokenType the type of the offending token
	 * @param sourceDescription the policy file
	 * @param lineNumber the line of the offending token
	 */
	public ParserException(String msg, String tokenText, String tokenType, String sourceDescription, int lineNumber) {
		super(
				lineNumber,
				String.format(
						"%s: ERROR on \"%s\" (type %s, file %s, line %d)",
						msg,
						tokenText,
						tokenType,
						sourceDescription,
						lineNumber));
		this.tokenText = tokenText;
		this.tokenType = tokenType;
		this.sourceDescription = sourceDescription;
	}

	public String getTokenText() {
		return tokenText;
	}

	public String getTokenType() {
		return tokenType;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}
}
