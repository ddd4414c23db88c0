package org.metricshub.jpol.model;

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

import java.util.Objects;

/**
 * Text passed untouched to the generator of one platform.
 */
public final class Verbatim implements Comparable<Verbatim> {

	private final String platform;
	private final String text;

	/**
	 * @param platform the platform the text is meant for
	 * @param text the text, with <code>\"</code> already turned into <code>"</code>
	 */
	public Verbatim(String platform, String text) {
		this.platform = platform;
		this.text = text;
	}

	public String getPlatform() {
		return platform;
	}

	public String getText() {
		return text;
	}

	/** {@inheritDoc} */
	@Override
	public int compareTo(Verbatim other) {
		int cmp = platform.compareTo(other.platform);
		return cmp != 0 ? cmp : text.compareTo(other.text);
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Verbatim)) {
			return false;
		}
		Verbatim other = (Verbatim) obj;
		return platform.equals(other.platform) && text.equals(other.text);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects.hash(platform, text);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return platform + ": " + text;
	}
}
