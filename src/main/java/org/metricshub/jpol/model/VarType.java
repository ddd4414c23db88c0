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

import java.util.Map;
import java.util.Objects;

/**
 * One value parsed from an attribute line, tagged with the attribute it
 * belongs to. {@link Term#addObject(VarType, org.metricshub.jpol.naming.Naming)}
 * and {@link Header#addObject(VarType)} dispatch on the {@link Kind}.
 * <p>
 * The payload type depends on the kind: most kinds carry a {@link String},
 * <code>TTL</code>, <code>TIMEOUT</code>, <code>PRIORITY</code>,
 * <code>PRECEDENCE</code> and <code>ICMP_CODE</code> carry an {@link Integer},
 * and a few carry a dedicated type ({@link LogLimit}, {@link Vpn},
 * {@link Verbatim}, {@link java.time.LocalDate}, {@link java.util.Map.Entry}).
 */
public final class VarType {

	/** Attribute a value belongs to. */
	public enum Kind {
		ACTION,
		ADDRESS,
		ADDREXCLUDE,
		APPLY_GROUPS,
		APPLY_GROUPS_EXCEPT,
		COMMENT,
		COUNTER,
		DADDRESS,
		DADDREXCLUDE,
		DINTERFACE,
		DPFX,
		DPFX_EXCEPT,
		DPORT,
		DSCP_EXCEPT,
		DSCP_MATCH,
		DSCP_SET,
		DTAG,
		DZONE,
		ENCAPSULATE,
		ETHER_TYPE,
		EXPIRATION,
		FILTER_TERM,
		FLEXIBLE_MATCH_RANGE,
		FORWARDING_CLASS,
		FORWARDING_CLASS_EXCEPT,
		FRAGMENT_OFFSET,
		HOP_LIMIT,
		ICMP_CODE,
		ICMP_TYPE,
		LOGGING,
		LOG_LIMIT,
		LOG_NAME,
		LOSS_PRIORITY,
		NEXT_IP,
		OPTION,
		OWNER,
		PACKET_LEN,
		PAN_APPLICATION,
		PLATFORM,
		PLATFORMEXCLUDE,
		POLICER,
		PORT,
		PORT_MIRROR,
		PRECEDENCE,
		PRIORITY,
		PROTOCOL,
		PROTOCOL_EXCEPT,
		QOS,
		RESTRICT_ADDRESS_FAMILY,
		ROUTING_INSTANCE,
		SADDRESS,
		SADDREXCLUDE,
		SINTERFACE,
		SPFX,
		SPFX_EXCEPT,
		SPORT,
		STAG,
		SZONE,
		TARGET,
		TARGET_RESOURCES,
		TARGET_SERVICE_ACCOUNTS,
		TIMEOUT,
		TRAFFIC_CLASS_COUNT,
		TRAFFIC_TYPE,
		TTL,
		VERBATIM,
		VPN
	}

	private final Kind kind;
	private final Object value;
	private final Map.Entry<String, String> pair;

	/**
	 * <p>
	 * Constructor for VarType.
	 * </p>
	 * <code>COMMENT</code> and <code>LOG_NAME</code> text loses its surrounding
	 * double quotes and the leading blanks of every line.
	 *
	 * @param kind the attribute
	 * @param value the payload
	 */
	public VarType(Kind kind, Object value) {
		this.kind = kind;
		if ((kind == Kind.COMMENT || kind == Kind.LOG_NAME) && value instanceof String) {
			this.value = cleanText((String) value);
		} else {
			this.value = value;
		}
		this.pair = null;
	}

	/**
	 * Creates a value made of a key and a value, such as a
	 * <code>flexible-match-range</code> setting or a
	 * <code>target-resources</code> tuple.
	 *
	 * @param kind the attribute
	 * @param pair the key and its value
	 */
	public VarType(Kind kind, Map.Entry<String, String> pair) {
		this.kind = kind;
		this.value = pair;
		this.pair = pair;
	}

	private static String cleanText(String text) {
		String unquoted = text;
		while (unquoted.startsWith("\"")) {
			unquoted = unquoted.substring(1);
		}
		while (unquoted.endsWith("\"")) {
			unquoted = unquoted.substring(0, unquoted.length() - 1);
		}
		StringBuilder result = new StringBuilder();
		String[] lines = unquoted.split("\n", -1);
		for (int i = 0; i < lines.length; i++) {
			if (i > 0) {
				result.append('\n');
			}
			int start = 0;
			while (start < lines[i].length() && Character.isWhitespace(lines[i].charAt(start))) {
				start++;
			}
			result.append(lines[i].substring(start));
		}
		return result.toString();
	}

	public Kind getKind() {
		return kind;
	}

	public Object getValue() {
		return value;
	}

	/**
	 * @return the payload as a key and value, <code>null</code> when the
	 *         payload is not a pair
	 */
	public Map.Entry<String, String> getPair() {
		return pair;
	}

	/**
	 * @return the payload as a string
	 */
	public String getString() {
		return String.valueOf(value);
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof VarType)) {
			return false;
		}
		VarType other = (VarType) obj;
		return kind == other.kind && Objects.equals(value, other.value);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects.hash(kind, value);
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return String.valueOf(value);
	}
}
