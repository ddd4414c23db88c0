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

import java.util.List;
import org.metricshub.jpol.frontend.ParserException;
import org.metricshub.jpol.model.IcmpTypes;
import org.metricshub.jpol.model.InvalidTermActionException;
import org.metricshub.jpol.model.Term;

/**
 * Checks the rules that tie term attributes together and that the grammar
 * cannot express. The first broken rule aborts with its exception.
 */
public class TermValidator {

	private static final int MAX_TTL = 255;
	private static final int MAX_PROTOCOL = 255;

	/**
	 * Validates a complete term.
	 *
	 * @param term the term, as built by the parser
	 * @throws ParserException when verbatim text is mixed with regular attributes
	 * @throws TermNoActionException when the term does not say what to do
	 * @throws InvalidTermActionException when <code>filter-term</code> comes with actions
	 * @throws MixedPortAndNonPortProtocolsException when ports come with protocols with and without ports
	 * @throws TermPortProtocolException when ports come with protocols without ports only
	 * @throws TermProtocolEtherTypeException when ether-type comes with IP level attributes
	 * @throws IcmpCodeException when ICMP codes do not fit the ICMP type
	 * @throws TermInvalidIcmpTypeException on an unknown ICMP type
	 * @throws InvalidTermTtlException on a TTL out of range
	 * @throws InvalidNumericProtocolException on a numeric protocol out of range
	 */
	public void validate(Term term) {
		String name = term.getName();

		if (!term.getVerbatim().isEmpty()) {
			if (!term.getAction().isEmpty()
					|| term.hasPorts()
					|| !term.getProtocol().isEmpty()
					|| !term.getOption().isEmpty()) {
				throw new ParserException("Term " + name + " has both verbatim and non-verbatim tokens.");
			}
		} else {
			if (term.getAction().isEmpty()
					&& term.getRoutingInstance() == null
					&& term.getNextIp().isEmpty()
					&& term.getEncapsulate() == null
					&& term.getFilterTerm() == null
					&& term.getPortMirror() == null) {
				throw new TermNoActionException("No action specified for term " + name);
			}
			if (term.getFilterTerm() != null && !term.getAction().isEmpty()) {
				throw new InvalidTermActionException(
						"Term " + name + " has both filter-term and actions " + term.getAction()
								+ ", filter-term only allows a jump to another filter");
			}
		}

		checkPortProtocols(term);
		checkEtherType(term);
		checkIcmpCodes(term);

		for (String icmpType : term.getIcmpType()) {
			if (!IcmpTypes.isKnown(icmpType)) {
				throw new TermInvalidIcmpTypeException("Term " + name + " contains an invalid icmp-type: " + icmpType);
			}
		}

		Integer ttl = term.getTtl();
		if (ttl != null && (ttl < 0 || ttl > MAX_TTL)) {
			throw new InvalidTermTtlException("Term " + name + " has an invalid TTL " + ttl + ", it must be in [0, " + MAX_TTL + "]");
		}

		for (String protocol : term.getProtocol()) {
			if (isNumeric(protocol) && (protocol.length() > 9 || Integer.parseInt(protocol) > MAX_PROTOCOL)) {
				throw new InvalidNumericProtocolException(
						"Term " + name + " has an invalid numeric protocol " + protocol + ", it must be in [0, " + MAX_PROTOCOL + "]");
			}
		}
	}

	private static void checkPortProtocols(Term term) {
		if (!term.hasPorts()) {
			return;
		}
		boolean withPorts = false;
		boolean withoutPorts = false;
		for (String protocol : term.getProtocol()) {
			if (Term.PROTOS_WITH_PORTS.contains(protocol)) {
				withPorts = true;
			} else {
				withoutPorts = true;
			}
		}
		if (withoutPorts && withPorts) {
			throw new MixedPortAndNonPortProtocolsException(
					"Term " + term.getName() + " contains mixed uses of protocols with and without port numbers: "
							+ term.getProtocol());
		}
		if (withoutPorts) {
			throw new TermPortProtocolException(
					"Term " + term.getName() + " contains ports with protocols that do not have ports: " + term.getProtocol());
		}
	}

	private static void checkEtherType(Term term) {
		if (term.getEtherType().isEmpty()) {
			return;
		}
		if (!term.getProtocol().isEmpty()
				|| !term.getAddress().isEmpty()
				|| !term.getAddressExclude().isEmpty()
				|| !term.getDestinationAddress().isEmpty()
				|| !term.getDestinationAddressExclude().isEmpty()
				|| !term.getDestinationPort().isEmpty()
				|| !term.getDestinationPrefix().isEmpty()
				|| !term.getSourceAddress().isEmpty()
				|| !term.getSourceAddressExclude().isEmpty()
				|| !term.getSourcePort().isEmpty()
				|| !term.getSourcePrefix().isEmpty()) {
			throw new TermProtocolEtherTypeException(
					"Term " + term.getName() + " contains both ether-type and IP protocol or address matches");
		}
	}

	private static void checkIcmpCodes(Term term) {
		if (term.getIcmpCode().isEmpty()) {
			return;
		}
		if (term.getIcmpType().size() != 1) {
			throw new IcmpCodeException(
					"Term " + term.getName() + " uses icmp-code with " + term.getIcmpType().size()
							+ " icmp-type(s), icmp-code requires exactly one icmp-type");
		}
		String icmpType = term.getIcmpType().get(0);
		List<Integer> validCodes = IcmpTypes.codes(icmpType);
		for (Integer code : term.getIcmpCode()) {
			if (!validCodes.contains(code)) {
				throw new IcmpCodeException(
						"Term " + term.getName() + " has icmp-code " + code + " which is not valid for icmp-type " + icmpType
								+ ", valid codes: " + validCodes);
			}
		}
	}

	private static boolean isNumeric(String value) {
		if (value.isEmpty()) {
			return false;
		}
		for (int i = 0; i < value.length(); i++) {
			if (!Character.isDigit(value.charAt(i))) {
				return false;
			}
		}
		return true;
	}
}
