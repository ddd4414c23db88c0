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
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import org.metricshub.jpol.addr.AddressLists;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.model.PortRange;
import org.metricshub.jpol.model.Term;

/**
 * Decides whether every packet one term matches is also matched by another.
 * <p>
 * The check is conservative: when in doubt, a term is not contained. It works
 * on normalized terms (port ranges resolved), and looks at the flattened
 * address views, so that excluded addresses are taken into account.
 */
public class TermContainment {

	/**
	 * Whether <code>a</code> matches everything <code>b</code> matches.
	 *
	 * @param a the candidate container
	 * @param b the candidate contained term
	 * @return <code>true</code> if <code>a</code> contains <code>b</code>
	 */
	public boolean contains(Term a, Term b) {
		if ((!a.getVerbatim().isEmpty() || !b.getVerbatim().isEmpty())
				&& !sorted(a.getVerbatim()).equals(sorted(b.getVerbatim()))) {
			return false;
		}
		return protocolsContain(a, b)
				&& addressesContain(a, b)
				&& portsContain(a, b)
				&& exactMatchesContain(a, b)
				&& memberships(a, b)
				&& presences(a, b)
				&& rangesContain(a, b)
				&& setsEqual(a, b);
	}

	private static boolean protocolsContain(Term a, Term b) {
		if (!a.getProtocol().isEmpty()) {
			// b with protocol-except or without protocol matches protocols a does not
			return !b.getProtocol().isEmpty() && a.getProtocol().containsAll(b.getProtocol());
		}
		if (!a.getProtocolExcept().isEmpty()) {
			if (!b.getProtocolExcept().isEmpty()) {
				return b.getProtocolExcept().containsAll(a.getProtocolExcept());
			}
			if (!b.getProtocol().isEmpty()) {
				return Collections.disjoint(b.getProtocol(), a.getProtocolExcept());
			}
			return false;
		}
		return true;
	}

	private static boolean addressesContain(Term a, Term b) {
		List<NetAddress> aAddress = a.flattenedAddress();
		List<NetAddress> aSource = a.flattenedSourceAddress();
		List<NetAddress> aDestination = a.flattenedDestinationAddress();
		List<NetAddress> bAddress = b.flattenedAddress();
		List<NetAddress> bSource = b.flattenedSourceAddress();
		List<NetAddress> bDestination = b.flattenedDestinationAddress();

		if (!addressListContains(aAddress, bAddress)
				&& !addressListContains(aAddress, bSource)
				&& !addressListContains(aAddress, bDestination)) {
			return false;
		}
		// b's generic address stands for its source and its destination
		List<NetAddress> bEffectiveSource = bSource.isEmpty() ? bAddress : bSource;
		List<NetAddress> bEffectiveDestination = bDestination.isEmpty() ? bAddress : bDestination;
		return addressListContains(aSource, bEffectiveSource)
				&& addressListContains(aDestination, bEffectiveDestination);
	}

	/**
	 * Containment of one side of two terms. An empty list places no
	 * restriction: as a superset it contains any list, as a subset it matches
	 * more than any non-empty superset does.
	 */
	static boolean addressListContains(List<NetAddress> superset, List<NetAddress> subset) {
		if (superset.isEmpty()) {
			return true;
		}
		return !subset.isEmpty() && AddressLists.isContained(superset, subset);
	}

	private static boolean portsContain(Term a, Term b) {
		if (!portListContains(a.getPortRanges(), b.getPortRanges())
				&& !portListContains(a.getPortRanges(), b.getSourcePortRanges())
				&& !portListContains(a.getPortRanges(), b.getDestinationPortRanges())) {
			return false;
		}
		List<PortRange> bEffectiveSource = b.getSourcePortRanges().isEmpty() ? b.getPortRanges() : b.getSourcePortRanges();
		List<PortRange> bEffectiveDestination = b.getDestinationPortRanges().isEmpty()
				? b.getPortRanges()
				: b.getDestinationPortRanges();
		return portListContains(a.getSourcePortRanges(), bEffectiveSource)
				&& portListContains(a.getDestinationPortRanges(), bEffectiveDestination);
	}

	private static boolean portListContains(List<PortRange> superset, List<PortRange> subset) {
		if (superset.isEmpty()) {
			return true;
		}
		return !subset.isEmpty() && PortRange.isContained(superset, subset);
	}

	private static boolean exactMatchesContain(Term a, Term b) {
		if (!equalWhenRestricted(a.getSourcePrefix(), b.getSourcePrefix())
				|| !equalWhenRestricted(a.getSourcePrefixExcept(), b.getSourcePrefixExcept())
				|| !equalWhenRestricted(a.getDestinationPrefix(), b.getDestinationPrefix())
				|| !equalWhenRestricted(a.getDestinationPrefixExcept(), b.getDestinationPrefixExcept())) {
			return false;
		}
		if (!a.getSourceTag().isEmpty()) {
			return sorted(a.getSourceTag()).equals(sorted(b.getSourceTag()))
					&& sorted(a.getDestinationTag()).equals(sorted(b.getDestinationTag()));
		}
		return equalWhenRestricted(a.getDestinationTag(), b.getDestinationTag());
	}

	private static boolean equalWhenRestricted(List<String> a, List<String> b) {
		return a.isEmpty() || sorted(a).equals(sorted(b));
	}

	private static boolean memberships(Term a, Term b) {
		return strictMemberOf(a.getPrecedence(), b.getPrecedence())
				&& strictMemberOf(a.getOption(), b.getOption())
				&& memberOf(a.getForwardingClass(), b.getForwardingClass())
				&& memberOf(a.getForwardingClassExcept(), b.getForwardingClassExcept());
	}

	private static <T> boolean memberOf(List<T> a, List<T> b) {
		return a.isEmpty() || (!b.isEmpty() && a.containsAll(b));
	}

	/**
	 * Like {@link #memberOf(List, List)}, but an unrestricted <code>a</code>
	 * does not contain a restricted <code>b</code> either.
	 */
	private static <T> boolean strictMemberOf(List<T> a, List<T> b) {
		if (a.isEmpty()) {
			return b.isEmpty();
		}
		return memberOf(a, b);
	}

	private static boolean presences(Term a, Term b) {
		if (!a.getNextIp().isEmpty() && b.getNextIp().isEmpty()) {
			return false;
		}
		if (a.getEncapsulate() != null && b.getEncapsulate() == null) {
			return false;
		}
		return a.getPortMirror() == null || b.getPortMirror() != null;
	}

	private static boolean rangesContain(Term a, Term b) {
		return rangeContains(a.getFragmentOffset(), b.getFragmentOffset())
				&& rangeContains(a.getHopLimit(), b.getHopLimit())
				&& rangeContains(a.getPacketLength(), b.getPacketLength());
	}

	/**
	 * <code>"N"</code> and <code>"N-M"</code> ranges, as closed intervals, in
	 * whichever order their bounds are written. A range that is not made of
	 * numbers is never contained.
	 */
	private static boolean rangeContains(String a, String b) {
		if (a == null) {
			return true;
		}
		if (b == null) {
			return false;
		}
		try {
			return interval(a).encloses(interval(b));
		} catch (NumberFormatException e) {
			return false;
		}
	}

	private static PortRange interval(String text) {
		int dash = text.indexOf('-');
		if (dash < 0) {
			int value = Integer.parseInt(text.trim());
			return new PortRange(value, value);
		}
		int first = Integer.parseInt(text.substring(0, dash).trim());
		int second = Integer.parseInt(text.substring(dash + 1).trim());
		return new PortRange(Math.min(first, second), Math.max(first, second));
	}

	private static boolean setsEqual(Term a, Term b) {
		return setEqualWhenRestricted(a.getIcmpType(), b.getIcmpType())
				&& setEqualWhenRestricted(a.getIcmpCode(), b.getIcmpCode())
				&& setEqualWhenRestricted(a.getPlatform(), b.getPlatform())
				&& setEqualWhenRestricted(a.getPlatformExclude(), b.getPlatformExclude())
				&& setEqualWhenRestricted(a.getSourceZone(), b.getSourceZone())
				&& setEqualWhenRestricted(a.getDestinationZone(), b.getDestinationZone());
	}

	private static <T> boolean setEqualWhenRestricted(Collection<T> a, Collection<T> b) {
		return a.isEmpty() || new HashSet<T>(a).equals(new HashSet<T>(b));
	}

	private static <T extends Comparable<? super T>> List<T> sorted(Collection<T> values) {
		List<T> copy = new ArrayList<T>(values);
		Collections.sort(copy);
		return copy;
	}
}
