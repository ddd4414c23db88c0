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
 * VPN a term sends its traffic through, with the name of the paired policy
 * (empty when there is none).
 */
public final class Vpn {

	private final String name;
	private final String pairPolicy;

	/**
	 * @param name the VPN name
	 * @param pairPolicy the paired policy, or an empty string
	 */
	public Vpn(String name, String pairPolicy) {
		this.name = name;
		this.pairPolicy = pairPolicy == null ? "" : pairPolicy;
	}

	public String getName() {
		return name;
	}

	public String getPairPolicy() {
		return pairPolicy;
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Vpn)) {
			return false;
		}
		Vpn other = (Vpn) obj;
		return name.equals(other.name) && pairPolicy.equals(other.pairPolicy);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects.hash(name, pairPolicy);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return pairPolicy.isEmpty() ? name : name + " " + pairPolicy;
	}
}
