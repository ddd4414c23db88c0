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

import org.metricshub.jpol.naming.Naming;

/**
 * Everything one parse needs to know about its environment: the settings,
 * the naming service resolving symbolic addresses and services, and the name
 * of the file being parsed.
 * <p>
 * One instance is created per parse and handed to every stage, so that
 * parses with different settings never interfere with each other.
 */
public final class ParseContext {

	private final JpolSettings settings;
	private final Naming naming;
	private final String filename;

	/**
	 * @param settings settings of this parse
	 * @param naming naming service
	 * @param filename name reported in error messages
	 */
	public ParseContext(JpolSettings settings, Naming naming, String filename) {
		this.settings = settings;
		this.naming = naming;
		this.filename = filename;
	}

	public JpolSettings getSettings() {
		return settings;
	}

	public Naming getNaming() {
		return naming;
	}

	public String getFilename() {
		return filename;
	}
}
