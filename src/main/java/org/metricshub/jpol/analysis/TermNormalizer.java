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
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.metricshub.jpol.PolicyException;
import org.metricshub.jpol.addr.AddressLists;
import org.metricshub.jpol.model.PortRange;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.naming.Naming;
import org.metricshub.jpol.util.JpolLogger;
import org.slf4j.Logger;

/**
 * Brings a validated term to the form generators expect: service names
 * become collapsed port ranges, and address lists lose their excluded parts
 * and are sorted or collapsed.
 * <p>
 * Normalizing a term twice gives the same result as normalizing it once.
 */
public class TermNormalizer {

	private static final Logger LOG = JpolLogger.getLogger(TermNormalizer.class);

	private final Naming naming;
	private final boolean optimize;

	/**
	 * <p>
	 * Constructor for TermNormalizer.
	 * </p>
	 *
	 * @param naming resolves service names
	 * @param optimize whether address lists are collapsed (otherwise only sorted)
	 */
	public TermNormalizer(Naming naming, boolean optimize) {
		this.naming = naming;
		this.optimize = optimize;
	}

	/**
	 * Normalizes the ports and addresses of <code>term</code>, in place.
	 *
	 * @param term a validated term
	 * @param addressBook whether the policy is rendered with address books, in
	 *            which case source and destination addresses keep one entry
	 *            group per naming token
	 * @throws TermPortProtocolException when ports resolve to nothing for the term's protocols
	 * @throws org.metricshub.jpol.naming.UndefinedServiceException on an undefined service name
	 */
	public void normalize(Term term, boolean addressBook) {
		if (!term.getPort().isEmpty()) {
			term.setPortRanges(collapsePortList(resolvePorts(term.getPort(), term)));
		}
		if (!term.getSourcePort().isEmpty()) {
			term.setSourcePortRanges(collapsePortList(resolvePorts(term.getSourcePort(), term)));
		}
		if (!term.getDestinationPort().isEmpty()) {
			term.setDestinationPortRanges(collapsePortList(resolvePorts(term.getDestinationPort(), term)));
		}
		cleanupAddresses(term, addressBook);
	}

	private List<PortRange> resolvePorts(List<String> services, Term term) {
		List<PortRange> ports = translatePorts(services, term.getProtocol(), term.getName());
		if (ports.isEmpty()) {
			throw new TermPortProtocolException(
					"Term " + term.getName() + " contains ports " + services + " but none is defined for protocols "
							+ term.getProtocol());
		}
		return ports;
	}

	/**
	 * Resolves service names to the port ranges they define for each protocol.
	 * A service that defines nothing for one of the protocols is skipped, with
	 * a warning.
	 *
	 * @param services service names
	 * @param protocols protocols of the term
	 * @param termName name of the term, for messages
	 * @return the port ranges, in protocol then service order
	 */
	public List<PortRange> translatePorts(List<String> services, List<String> protocols, String termName) {
		List<PortRange> ports = new ArrayList<PortRange>();
		Set<String> distinctProtocols = new LinkedHashSet<String>(protocols);
		for (String protocol : distinctProtocols) {
			for (String service : services) {
				List<String> definitions = naming.getServiceByProto(service, protocol);
				if (definitions.isEmpty()) {
					LOG.warn(
							"Term {} has service {} which is not defined with protocol {}, but will be permitted. "
									+ "Unless intended, you should consider splitting the protocols into separate terms!",
							termName,
							service,
							protocol);
				}
				for (String definition : definitions) {
					try {
						ports.add(PortRange.parse(definition));
					} catch (IllegalArgumentException e) {
						throw new PolicyException("Service " + service + " has an invalid port " + definition + " for " + protocol, e);
					}
				}
			}
		}
		return ports;
	}

	private void cleanupAddresses(Term term, boolean addressBook) {
		term.flattenAll();
		if (!optimize) {
			term.setAddress(AddressLists.sort(term.getAddress()));
			term.setAddressExclude(AddressLists.sort(term.getAddressExclude()));
			term.setSourceAddress(AddressLists.sort(term.getSourceAddress()));
			term.setSourceAddressExclude(AddressLists.sort(term.getSourceAddressExclude()));
			term.setDestinationAddress(AddressLists.sort(term.getDestinationAddress()));
			term.setDestinationAddressExclude(AddressLists.sort(term.getDestinationAddressExclude()));
		} else if (addressBook) {
			term.setAddress(AddressLists.sort(term.getAddress()));
			term.setAddressExclude(AddressLists.sort(term.getAddressExclude()));
			term.setSourceAddress(AddressLists.collapsePreserveTokens(term.getSourceAddress()));
			term.setSourceAddressExclude(AddressLists.collapsePreserveTokens(term.getSourceAddressExclude()));
			term.setDestinationAddress(AddressLists.collapsePreserveTokens(term.getDestinationAddress()));
			term.setDestinationAddressExclude(AddressLists.collapsePreserveTokens(term.getDestinationAddressExclude()));
		} else {
			term.setAddress(AddressLists.collapse(term.getAddress(), term.getAddressExclude()));
			term.setAddressExclude(AddressLists.collapse(term.getAddressExclude(), term.getAddress()));
			term.setSourceAddress(AddressLists.collapse(term.getSourceAddress(), term.getSourceAddressExclude()));
			term.setSourceAddressExclude(AddressLists.collapse(term.getSourceAddressExclude(), term.getSourceAddress()));
			term.setDestinationAddress(AddressLists.collapse(term.getDestinationAddress(), term.getDestinationAddressExclude()));
			term.setDestinationAddressExclude(
					AddressLists.collapse(term.getDestinationAddressExclude(), term.getDestinationAddress()));
		}
	}

	/**
	 * Sorts port ranges and merges the ones that nest, overlap or touch,
	 * e.g. <code>[10-20, 21-30]</code> becomes <code>[10-30]</code>.
	 *
	 * @param ports port ranges, in any order
	 * @return a new sorted list of disjoint, non-adjacent ranges
	 */
	public static List<PortRange> collapsePortList(List<PortRange> ports) {
		List<PortRange> sorted = new ArrayList<PortRange>(ports);
		Collections.sort(sorted);
		List<PortRange> collapsed = new ArrayList<PortRange>();
		for (PortRange range : sorted) {
			if (!collapsed.isEmpty()) {
				PortRange last = collapsed.get(collapsed.size() - 1);
				if (range.getLow() <= last.getHigh() + 1) {
					collapsed.set(collapsed.size() - 1, new PortRange(last.getLow(), Math.max(last.getHigh(), range.getHigh())));
					continue;
				}
			}
			collapsed.add(range);
		}
		return collapsed;
	}
}
