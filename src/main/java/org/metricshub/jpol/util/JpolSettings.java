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

/**
 * A simple container for the parameters of a policy parse.
 * These values have defaults, which may be changed when
 * invoking Jpol from within Java code.
 */
public class JpolSettings {

	/** Default depth of nested <code>#include</code> directives. */
	public static final int DEFAULT_INCLUDE_DEPTH = 5;

	/**
	 * Whether address lists are collapsed to their minimal covering set;
	 * <code>true</code> by default. When <code>false</code>, they are only sorted.
	 */
	private boolean optimize = true;

	/**
	 * Whether each filter is checked for shaded terms;
	 * <code>false</code> by default.
	 */
	private boolean shadeCheck = false;

	/**
	 * Whether terms are kept exactly as parsed, skipping
	 * validation and normalization;
	 * <code>false</code> by default.
	 */
	private boolean preserveOriginal = false;

	/**
	 * Directory against which <code>#include</code> paths are resolved,
	 * and outside of which no include may point.
	 */
	private String baseDirectory = ".";

	/**
	 * How many levels of <code>#include</code> may be nested.
	 */
	private int includeDepth = DEFAULT_INCLUDE_DEPTH;

	/**
	 * Directory holding the <code>.net</code> and <code>.svc</code> definitions
	 * used when no naming service is supplied.
	 */
	private String definitionsDirectory = "./def";

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("optimize = ").append(isOptimize()).append(newLine);
		desc.append("shadeCheck = ").append(isShadeCheck()).append(newLine);
		desc.append("preserveOriginal = ").append(isPreserveOriginal()).append(newLine);
		desc.append("baseDirectory = ").append(getBaseDirectory()).append(newLine);
		desc.append("includeDepth = ").append(getIncludeDepth()).append(newLine);
		desc.append("definitionsDirectory = ").append(getDefinitionsDirectory()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return whether address lists are collapsed
	 */
	public boolean isOptimize() {
		return optimize;
	}

	/**
	 * @param optimize whether address lists are collapsed
	 */
	public void setOptimize(boolean optimize) {
		this.optimize = optimize;
	}

	/**
	 * @return whether filters are checked for shaded terms
	 */
	public boolean isShadeCheck() {
		return shadeCheck;
	}

	/**
	 * @param shadeCheck whether filters are checked for shaded terms
	 */
	public void setShadeCheck(boolean shadeCheck) {
		this.shadeCheck = shadeCheck;
	}

	/**
	 * @return whether terms are kept exactly as parsed
	 */
	public boolean isPreserveOriginal() {
		return preserveOriginal;
	}

	/**
	 * @param preserveOriginal whether terms are kept exactly as parsed
	 */
	public void setPreserveOriginal(boolean preserveOriginal) {
		this.preserveOriginal = preserveOriginal;
	}

	/**
	 * @return the include base directory
	 */
	public String getBaseDirectory() {
		return baseDirectory;
	}

	/**
	 * @param baseDirectory the include base directory
	 */
	public void setBaseDirectory(String baseDirectory) {
		this.baseDirectory = baseDirectory;
	}

	/**
	 * @return how many levels of includes may be nested
	 */
	public int getIncludeDepth() {
		return includeDepth;
	}

	/**
	 * @param includeDepth how many levels of includes may be nested
	 */
	public void setIncludeDepth(int includeDepth) {
		this.includeDepth = includeDepth;
	}

	/**
	 * @return the definitions directory of the default naming service
	 */
	public String getDefinitionsDirectory() {
		return definitionsDirectory;
	}

	/**
	 * @param definitionsDirectory the definitions directory of the default naming service
	 */
	public void setDefinitionsDirectory(String definitionsDirectory) {
		this.definitionsDirectory = definitionsDirectory;
	}
}
