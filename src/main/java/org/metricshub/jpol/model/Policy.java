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
 * A parsed policy file: its filters, in source order.
 * <p>
 * This is what generators consume. Consumers see the filters through
 * unmodifiable views.
 */
public class Policy {

	private final String filename;
	private final List<Filter> filters = new ArrayList<Filter>();

	/**
	 * @param filename the policy file name, as reported in messages
	 */
	public Policy(String filename) {
		this.filename = filename;
	}

	/**
	 * @param header the filter header
	 * @param terms the filter terms
	 * @throws NoTermsException if <code>terms</code> is empty
	 */
	public void addFilter(Header header, List<Term> terms) {
		if (terms.isEmpty()) {
			throw new NoTermsException("There must be at least one term in policy " + filename);
		}
		filters.add(new Filter(header, terms));
	}

	public String getFilename() {
		return filename;
	}

	/**
	 * @return the filters, unmodifiable
	 */
	public List<Filter> getFilters() {
		return Collections.unmodifiableList(filters);
	}

	/**
	 * @return the header of every filter, in order
	 */
	public List<Header> getHeaders() {
		List<Header> headers = new ArrayList<Header>();
		for (Filter filter : filters) {
			headers.add(filter.getHeader());
		}
		return headers;
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Policy)) {
			return false;
		}
		return filters.equals(((Policy) obj).filters);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return filters.hashCode();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder("Policy: ").append(filename).append('\n');
		for (Filter filter : filters) {
			text.append(filter.getHeader()).append('\n');
			for (Term term : filter.getTerms()) {
				text.append(term).append('\n');
			}
		}
		return text.toString();
	}
}
