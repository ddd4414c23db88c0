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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Names of the ICMP and ICMPv6 message types a term may match, with their
 * numeric values, and the codes valid for the types that have any.
 */
public final class IcmpTypes {

	private static final Map<String, Integer> IPV4 = new LinkedHashMap<String, Integer>();
	private static final Map<String, Integer> IPV6 = new LinkedHashMap<String, Integer>();
	private static final Map<String, List<Integer>> CODES = new HashMap<String, List<Integer>>();

	static {
		IPV4.put("echo-reply", 0);
		IPV4.put("unreachable", 3);
		IPV4.put("source-quench", 4);
		IPV4.put("redirect", 5);
		IPV4.put("alternate-address", 6);
		IPV4.put("echo-request", 8);
		IPV4.put("router-advertisement", 9);
		IPV4.put("router-solicitation", 10);
		IPV4.put("time-exceeded", 11);
		IPV4.put("parameter-problem", 12);
		IPV4.put("timestamp-request", 13);
		IPV4.put("timestamp-reply", 14);
		IPV4.put("information-request", 15);
		IPV4.put("information-reply", 16);
		IPV4.put("mask-request", 17);
		IPV4.put("mask-reply", 18);
		IPV4.put("conversion-error", 31);
		IPV4.put("mobile-redirect", 32);

		IPV6.put("destination-unreachable", 1);
		IPV6.put("packet-too-big", 2);
		IPV6.put("time-exceeded", 3);
		IPV6.put("parameter-problem", 4);
		IPV6.put("echo-request", 128);
		IPV6.put("echo-reply", 129);
		IPV6.put("multicast-listener-query", 130);
		IPV6.put("multicast-listener-report", 131);
		IPV6.put("multicast-listener-done", 132);
		IPV6.put("router-solicit", 133);
		IPV6.put("router-advertisement", 134);
		IPV6.put("neighbor-solicit", 135);
		IPV6.put("neighbor-advertisement", 136);
		IPV6.put("redirect-message", 137);
		IPV6.put("router-renumbering", 138);
		IPV6.put("icmp-node-information-query", 139);
		IPV6.put("icmp-node-information-response", 140);
		IPV6.put("inverse-neighbor-discovery-solicitation", 141);
		IPV6.put("inverse-neighbor-discovery-advertisement", 142);
		IPV6.put("version-2-multicast-listener-report", 143);
		IPV6.put("home-agent-address-discovery-request", 144);
		IPV6.put("home-agent-address-discovery-reply", 145);
		IPV6.put("mobile-prefix-solicitation", 146);
		IPV6.put("mobile-prefix-advertisement", 147);
		IPV6.put("certification-path-solicitation", 148);
		IPV6.put("certification-path-advertisement", 149);
		IPV6.put("multicast-router-advertisement", 151);
		IPV6.put("multicast-router-solicitation", 152);
		IPV6.put("multicast-router-termination", 153);

		CODES.put("unreachable", range(0, 15));
		CODES.put("redirect", range(0, 3));
		CODES.put("router-advertisement", Arrays.asList(0, 16));
		CODES.put("time-exceeded", Arrays.asList(0, 1));
		CODES.put("destination-unreachable", range(0, 7));
		CODES.put("parameter-problem", range(0, 3));
		CODES.put("router-renumbering", Arrays.asList(0, 1, 255));
		CODES.put("icmp-node-information-query", Arrays.asList(0, 1, 2));
		CODES.put("icmp-node-information-response", Arrays.asList(0, 1, 2));
	}

	/**
	 * Private constructor to prevent instantiation.
	 */
	private IcmpTypes() {
		// utility class
	}

	private static List<Integer> range(int from, int to) {
		Integer[] values = new Integer[to - from + 1];
		for (int i = from; i <= to; i++) {
			values[i - from] = i;
		}
		return Arrays.asList(values);
	}

	/**
	 * @param name an ICMP type name
	 * @return <code>true</code> if <code>name</code> is an IPv4 or an IPv6 ICMP type
	 */
	public static boolean isKnown(String name) {
		return IPV4.containsKey(name) || IPV6.containsKey(name);
	}

	/**
	 * @return IPv4 ICMP type names and values, unmodifiable
	 */
	public static Map<String, Integer> ipv4() {
		return Collections.unmodifiableMap(IPV4);
	}

	/**
	 * @return ICMPv6 type names and values, unmodifiable
	 */
	public static Map<String, Integer> ipv6() {
		return Collections.unmodifiableMap(IPV6);
	}

	/**
	 * @param name an ICMP type name
	 * @return the codes valid for this type, empty when the type takes no code
	 */
	public static List<Integer> codes(String name) {
		List<Integer> codes = CODES.get(name);
		return codes == null ? Collections.<Integer>emptyList() : codes;
	}
}
