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
 * A header and the terms that follow it, in source order.
 */
public final class Filter {

	private final Header header;
	private final List<Term> terms;

	/**
	 * @param header the filter header
	 * @param terms the terms, in source order
	 */
	public Filter(Header header, List<Term> terms) {
		this.header = header;
		this.terms = Collections.unmodifiableList(new ArrayList<Term>(terms));
	}

	public Header getHeader() {
		return header;
	}

	/**
	 * @return the terms, unmodifiable
	 */
	public List<Term> getTerms() {
		return terms;
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Filter)) {
			return false;
		}
		Filter other = (Filter) obj;
		return header.equals(other.header) && terms.equals(other.terms);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return 31 * header.hashCode() + terms.size();
	}
}
