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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A platform a filter is generated for, with the options the
 * platform's generator interprets (filter name, direction, family...).
 */
public final class Target {

	private final String platform;
	private final List<String> options;

	/**
	 * @param platform the platform identifier, e.g. <code>juniper</code>
	 * @param options the generator options, in order
	 */
	public Target(String platform, List<String> options) {
		this.platform = platform;
		this.options = Collections.unmodifiableList(new ArrayList<String>(options));
	}

	public String getPlatform() {
		return platform;
	}

	/**
	 * @return the options, unmodifiable
	 */
	public List<String> getOptions() {
		return options;
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Target)) {
			return false;
		}
		Target other = (Target) obj;
		return platform.equals(other.platform) && options.equals(other.options);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return 31 * platform.hashCode() + options.hashCode();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "target: " + platform + (options.isEmpty() ? "" : " " + String.join(" ", options));
	}
}
