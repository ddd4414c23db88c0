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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.util.JpolLogger;
import org.slf4j.Logger;

/**
 * Finds the terms of a filter that an earlier term shades. Findings are
 * reported as warnings and returned; they never abort the compilation.
 */
public class ShadingDetector {

	private static final Logger LOG = JpolLogger.getLogger(ShadingDetector.class);

	private static final String NEXT_ACTION = "next";

	private final TermContainment containment;

	/**
	 * <p>
	 * Constructor for ShadingDetector.
	 * </p>
	 */
	public ShadingDetector() {
		this(new TermContainment());
	}

	/**
	 * <p>
	 * Constructor for ShadingDetector.
	 * </p>
	 *
	 * @param containment the containment check to use
	 */
	public ShadingDetector(TermContainment containment) {
		this.containment = containment;
	}

	/**
	 * Checks every term against the terms before it.
	 *
	 * @param terms normalized terms of one filter, in order
	 * @return one entry per shaded term and shading term pair, in term order
	 */
	public List<Shading> detect(List<Term> terms) {
		List<Shading> shadings = new ArrayList<Shading>();
		for (int index = 1; index < terms.size(); index++) {
			Term term = terms.get(index);
			for (int prior = 0; prior < index; prior++) {
				Term priorTerm = terms.get(prior);
				// a "next" term lets packets continue to the following terms
				if (priorTerm.getAction().contains(NEXT_ACTION)) {
					continue;
				}
				if (containment.contains(priorTerm, term)) {
					Shading shading = new Shading(term, priorTerm);
					LOG.warn("{}", shading);
					shadings.add(shading);
				}
			}
		}
		return shadings;
	}
}
