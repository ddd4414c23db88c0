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

import java.util.List;

/**
 * An inclusive range of ports, <code>low &lt;= high</code>.
 * A single port <code>N</code> is the range <code>[N, N]</code>.
 */
public final class PortRange implements Comparable<PortRange> {

	private final int low;
	private final int high;

	/**
	 * @param low first port of the range
	 * @param high last port of the range
	 * @throws IllegalArgumentException if <code>low &gt; high</code>
	 */
	public PortRange(int low, int high) {
		if (low > high) {
			throw new IllegalArgumentException("Invalid port range " + low + "-" + high);
		}
		this.low = low;
		this.high = high;
	}

	/**
	 * Whether every range of <code>subset</code> lies within some range of
	 * <code>superset</code>. An empty <code>subset</code> is contained in
	 * anything; an empty <code>superset</code> only contains an empty
	 * <code>subset</code>.
	 *
	 * @param superset the candidate enclosing ranges
	 * @param subset the candidate enclosed ranges
	 * @return <code>true</code> if <code>superset</code> covers <code>subset</code>
	 */
	public static boolean isContained(List<PortRange> superset, List<PortRange> subset) {
		for (PortRange sub : subset) {
			boolean found = false;
			for (PortRange sup : superset) {
				if (sup.encloses(sub)) {
					found = true;
					break;
				}
			}
			if (!found) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Parses <code>"N"</code> or <code>"N-M"</code>.
	 *
	 * @param text the port or port range
	 * @return the range
	 * @throws IllegalArgumentException if <code>text</code> is not a port range
	 */
	public static PortRange parse(String text) {
		int dash = text.indexOf('-');
		try {
			if (dash < 0) {
				int port = Integer.parseInt(text.trim());
				return new PortRange(port, port);
			}
			return new PortRange(
					Integer.parseInt(text.substring(0, dash).trim()),
					Integer.parseInt(text.substring(dash + 1).trim()));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid port range " + text, e);
		}
	}

	public int getLow() {
		return low;
	}

	public int getHigh() {
		return high;
	}

	/**
	 * @param other another range
	 * @return <code>true</code> if <code>other</code> lies within this range
	 */
	public boolean encloses(PortRange other) {
		return low <= other.low && other.high <= high;
	}

	/** {@inheritDoc} */
	@Override
	public int compareTo(PortRange other) {
		if (low != other.low) {
			return Integer.compare(low, other.low);
		}
		return Integer.compare(high, other.high);
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof PortRange)) {
			return false;
		}
		PortRange other = (PortRange) obj;
		return low == other.low && high == other.high;
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return 31 * low + high;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return low == high ? Integer.toString(low) : low + "-" + high;
	}
}
