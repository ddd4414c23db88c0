package org.metricshub.jpol.analysis;

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

import org.metricshub.jpol.model.Term;

/**
 * A term that can never match because an earlier term of the same filter
 * matches everything it does.
 */
public final class Shading {

	private final Term shadedTerm;
	private final Term shadingTerm;

	/**
	 * <p>
	 * Constructor for Shading.
	 * </p>
	 *
	 * @param shadedTerm the term that never matches
	 * @param shadingTerm the earlier term that matches first
	 */
	public Shading(Term shadedTerm, Term shadingTerm) {
		this.shadedTerm = shadedTerm;
		this.shadingTerm = shadingTerm;
	}

	public Term getShadedTerm() {
		return shadedTerm;
	}

	public Term getShadingTerm() {
		return shadingTerm;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return shadedTerm.getName() + " is shaded by " + shadingTerm.getName();
	}
}
