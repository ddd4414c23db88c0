package org.metricshub.jpol.addr;

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

import com.google.common.net.InetAddresses;
import java.math.BigInteger;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An IPv4 or IPv6 network: a network address and a prefix length.
 * Host bits are always cleared, so <code>10.1.2.3/8</code> is the
 * same network as <code>10.0.0.0/8</code>.
 * <p>
 * Each network remembers the naming token it was resolved from (if any),
 * which address-book style output uses to keep per-token groups apart.
 * The token does not take part in {@link #equals(Object)} or ordering.
 */
public final class NetAddress implements Comparable<NetAddress> {

	private final int version;
	private final BigInteger network;
	private final int prefixLength;
	private final String token;

	private NetAddress(int version, BigInteger network, int prefixLength, String token) {
		this.version = version;
		this.network = network;
		this.prefixLength = prefixLength;
		this.token = token;
	}

	/**
	 * Parses <code>address</code> or <code>address/prefix</code>.
	 * A bare address is a host network (<code>/32</code> or <code>/128</code>).
	 *
	 * @param text the address literal
	 * @return the parsed network, without token
	 * @throws IllegalArgumentException if <code>text</code> is not an address literal
	 */
	public static NetAddress parse(String text) {
		return parse(text, null);
	}

	/**
	 * Parses <code>address</code> or <code>address/prefix</code>, recording
	 * the naming token it was resolved from.
	 *
	 * @param text the address literal
	 * @param token the naming token, may be <code>null</code>
	 * @return the parsed network
	 * @throws IllegalArgumentException if <code>text</code> is not an address literal
	 */
	public static NetAddress parse(String text, String token) {
		String addressText = text.trim();
		int prefix = -1;
		int slash = addressText.indexOf('/');
		if (slash >= 0) {
			try {
				prefix = Integer.parseInt(addressText.substring(slash + 1));
			} catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid prefix length in '" + text + "'", e);
			}
			addressText = addressText.substring(0, slash);
		}

		// no DNS lookup happens here, unlike InetAddress.getByName()
		byte[] bytes = InetAddresses.forString(addressText).getAddress();
		int version = bytes.length == 4 ? 4 : 6;
		int maxLength = bytes.length * 8;
		if (prefix < 0) {
			prefix = maxLength;
		}
		if (prefix > maxLength) {
			throw new IllegalArgumentException("Invalid prefix length in '" + text + "'");
		}
		return new NetAddress(version, mask(new BigInteger(1, bytes), prefix, maxLength), prefix, token);
	}

	private static BigInteger mask(BigInteger value, int prefix, int maxLength) {
		int hostBits = maxLength - prefix;
		return value.shiftRight(hostBits).shiftLeft(hostBits);
	}

	/**
	 * @return 4 or 6
	 */
	public int getVersion() {
		return version;
	}

	public BigInteger getNetwork() {
		return network;
	}

	public int getPrefixLength() {
		return prefixLength;
	}

	/**
	 * @return the naming token this network was resolved from, or <code>null</code>
	 */
	public String getToken() {
		return token;
	}

	/**
	 * @param newToken the naming token
	 * @return the same network, attributed to <code>newToken</code>
	 */
	public NetAddress withToken(String newToken) {
		return new NetAddress(version, network, prefixLength, newToken);
	}

	/**
	 * @return 32 for IPv4, 128 for IPv6
	 */
	public int getMaxPrefixLength() {
		return version == 4 ? 32 : 128;
	}

	/**
	 * @return the first address of the network
	 */
	public BigInteger first() {
		return network;
	}

	/**
	 * @return the last address of the network
	 */
	public BigInteger last() {
		return network.add(BigInteger.ONE.shiftLeft(getMaxPrefixLength() - prefixLength)).subtract(BigInteger.ONE);
	}

	/**
	 * Whether this network lies entirely within <code>other</code>.
	 * A network is a subnet of itself. Networks of different versions
	 * are never subnets of each other.
	 *
	 * @param other the candidate supernet
	 * @return <code>true</code> if every address of this network is in <code>other</code>
	 */
	public boolean isSubnetOf(NetAddress other) {
		if (version != other.version || other.prefixLength > prefixLength) {
			return false;
		}
		int hostBits = getMaxPrefixLength() - other.prefixLength;
		return network.shiftRight(hostBits).equals(other.network.shiftRight(hostBits));
	}

	/**
	 * Whether <code>other</code> lies entirely within this network.
	 *
	 * @param other the candidate subnet
	 * @return <code>true</code> if <code>other</code> is a subnet of this network
	 */
	public boolean contains(NetAddress other) {
		return other.isSubnetOf(this);
	}

	/**
	 * @return the network one bit shorter that contains this one
	 * @throws IllegalStateException on a <code>/0</code> network
	 */
	public NetAddress supernet() {
		if (prefixLength == 0) {
			throw new IllegalStateException(this + " has no supernet");
		}
		return new NetAddress(version, mask(network, prefixLength - 1, getMaxPrefixLength()), prefixLength - 1, token);
	}

	/**
	 * Returns the networks left once <code>other</code> is taken out of this one.
	 *
	 * @param other a subnet of this network
	 * @return sorted list of the remaining networks, empty when <code>other</code>
	 *         equals this network
	 * @throws IllegalArgumentException if <code>other</code> is not a subnet of this network
	 */
	public List<NetAddress> exclude(NetAddress other) {
		if (!other.isSubnetOf(this)) {
			throw new IllegalArgumentException(other + " is not a subnet of " + this);
		}
		List<NetAddress> remaining = new ArrayList<NetAddress>();
		NetAddress current = this;
		while (current.prefixLength < other.prefixLength) {
			int childLength = current.prefixLength + 1;
			NetAddress low = new NetAddress(version, current.network, childLength, token);
			NetAddress high = new NetAddress(
					version,
					current.network.setBit(getMaxPrefixLength() - childLength),
					childLength,
					token);
			if (other.isSubnetOf(low)) {
				remaining.add(high);
				current = low;
			} else {
				remaining.add(low);
				current = high;
			}
		}
		Collections.sort(remaining);
		return remaining;
	}

	/** {@inheritDoc} */
	@Override
	public int compareTo(NetAddress other) {
		if (version != other.version) {
			return version < other.version ? -1 : 1;
		}
		int cmp = network.compareTo(other.network);
		if (cmp != 0) {
			return cmp;
		}
		return Integer.compare(prefixLength, other.prefixLength);
	}

	/** {@inheritDoc} */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof NetAddress)) {
			return false;
		}
		NetAddress other = (NetAddress) obj;
		return version == other.version && prefixLength == other.prefixLength && network.equals(other.network);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects.hash(version, network, prefixLength);
	}

	/**
	 * @return the network in CIDR notation, e.g. <code>10.0.0.0/8</code> or <code>2001:db8::/32</code>
	 */
	@Override
	public String toString() {
		int length = version == 4 ? 4 : 16;
		byte[] raw = network.toByteArray();
		byte[] bytes = new byte[length];
		int copy = Math.min(raw.length, length);
		System.arraycopy(raw, raw.length - copy, bytes, length - copy, copy);
		try {
			return InetAddresses.toAddrString(InetAddress.getByAddress(bytes)) + "/" + prefixLength;
		} catch (UnknownHostException e) {
			// only thrown for an illegal array length
			throw new IllegalStateException(e);
		}
	}
}
