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
 * Logging rate limit, e.g. <code>10/minute</code>.
 */
public final class LogLimit {

	private final int rate;
	private final String period;

	/**
	 * @param rate how many entries
	 * @param period per which period (<code>second</code>, <code>minute</code>...)
	 */
	public LogLimit(int rate, String period) {
		this.rate = rate;
		this.period = period;
	}

	public int getRate() {
		return rate;
	}

	public String getPeriod() {
		return period;
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof LogLimit)) {
			return false;
		}
		LogLimit other = (LogLimit) obj;
		return rate == other.rate && period.equals(other.period);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects.hash(rate, period);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return rate + "/" + period;
	}
}
