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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Operations on lists of {@link NetAddress}: sorting, exclusion and
 * collapsing to a minimal covering list.
 * <p>
 * None of the methods modify their arguments.
 */
public final class AddressLists {

	/**
	 * Private constructor to prevent instantiation.
	 */
	private AddressLists() {
		// utility class
	}

	/**
	 * @param addresses networks to sort
	 * @return a new list, IPv4 first, then by network address and prefix length
	 */
	public static List<NetAddress> sort(Collection<NetAddress> addresses) {
		List<NetAddress> sorted = new ArrayList<NetAddress>(addresses);
		Collections.sort(sorted);
		return sorted;
	}

	/**
	 * Whether every network of <code>subset</code> is a subnet of some network
	 * of <code>superset</code>. An empty <code>subset</code> is contained in
	 * anything; an empty <code>superset</code> only contains an empty
	 * <code>subset</code>. Networks of different versions never contain
	 * each other.
	 *
	 * @param superset the candidate containing networks
	 * @param subset the candidate contained networks
	 * @return <code>true</code> if <code>superset</code> covers <code>subset</code>
	 */
	public static boolean isContained(List<NetAddress> superset, List<NetAddress> subset) {
		for (NetAddress sub : subset) {
			boolean found = false;
			for (NetAddress sup : superset) {
				if (sub.isSubnetOf(sup)) {
					found = true;
					break;
				}
			}
			if (!found) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Computes <code>includes</code> minus <code>excludes</code>.
	 * An include entirely covered by an exclude disappears; an include that
	 * contains an exclude is split around it. The pieces keep the token of the
	 * include they come from.
	 *
	 * @param includes networks to keep
	 * @param excludes networks to take out
	 * @return sorted list of the remaining networks
	 */
	public static List<NetAddress> exclude(List<NetAddress> includes, List<NetAddress> excludes) {
		if (excludes.isEmpty()) {
			return sort(includes);
		}
		List<NetAddress> result = new ArrayList<NetAddress>();
		for (NetAddress include : includes) {
			List<NetAddress> pieces = Collections.singletonList(include);
			for (NetAddress exclude : excludes) {
				List<NetAddress> next = new ArrayList<NetAddress>();
				for (NetAddress piece : pieces) {
					if (piece.isSubnetOf(exclude)) {
						continue;
					}
					if (exclude.isSubnetOf(piece)) {
						next.addAll(piece.exclude(exclude));
					} else {
						next.add(piece);
					}
				}
				pieces = next;
			}
			result.addAll(pieces);
		}
		return sort(result);
	}

	/**
	 * Collapses <code>addresses</code> to the smallest list covering the
	 * same addresses.
	 *
	 * @param addresses networks to collapse
	 * @return sorted collapsed list
	 */
	public static List<NetAddress> collapse(List<NetAddress> addresses) {
		return collapse(addresses, Collections.<NetAddress>emptyList());
	}

	/**
	 * Collapses <code>addresses</code> to the smallest list covering the
	 * same addresses, without changing the meaning of the <code>complements</code>.
	 * <p>
	 * With most-specific-match semantics, dropping <code>10.0.0.0/10</code>
	 * because <code>10.0.0.0/8</code> covers it is wrong when
	 * <code>10.0.0.0/9</code> is excluded: the /10 would stop matching.
	 * A contained network is therefore only dropped when no complement sits
	 * between it and its container.
	 *
	 * @param addresses networks to collapse
	 * @param complements networks excluded alongside <code>addresses</code>
	 * @return sorted collapsed list
	 */
	public static List<NetAddress> collapse(List<NetAddress> addresses, List<NetAddress> complements) {
		List<NetAddress> collapsed = new ArrayList<NetAddress>();
		for (NetAddress address : sort(addresses)) {
			NetAddress current = address;
			while (true) {
				if (collapsed.isEmpty()) {
					collapsed.add(current);
					break;
				}
				NetAddress previous = collapsed.get(collapsed.size() - 1);
				if (current.isSubnetOf(previous)) {
					if (complementBetween(previous, current, complements)) {
						collapsed.add(current);
					}
					break;
				}
				if (areSiblings(previous, current)) {
					collapsed.remove(collapsed.size() - 1);
					NetAddress merged = previous.supernet();
					current = Objects.equals(previous.getToken(), current.getToken()) ? merged : merged.withToken(null);
					continue;
				}
				collapsed.add(current);
				break;
			}
		}
		return collapsed;
	}

	/**
	 * Collapses <code>addresses</code> separately for each naming token, so that
	 * no network resolved from one token is merged into a network of another.
	 *
	 * @param addresses networks to collapse
	 * @return sorted list of the collapsed groups
	 */
	public static List<NetAddress> collapsePreserveTokens(List<NetAddress> addresses) {
		Map<String, List<NetAddress>> byToken = new LinkedHashMap<String, List<NetAddress>>();
		for (NetAddress address : addresses) {
			String token = address.getToken() == null ? "" : address.getToken();
			List<NetAddress> group = byToken.get(token);
			if (group == null) {
				group = new ArrayList<NetAddress>();
				byToken.put(token, group);
			}
			group.add(address);
		}
		List<NetAddress> result = new ArrayList<NetAddress>();
		for (List<NetAddress> group : byToken.values()) {
			result.addAll(collapse(group));
		}
		return sort(result);
	}

	private static boolean areSiblings(NetAddress a, NetAddress b) {
		return a.getVersion() == b.getVersion()
				&& a.getPrefixLength() == b.getPrefixLength()
				&& a.getPrefixLength() > 0
				&& !a.equals(b)
				&& a.supernet().equals(b.supernet());
	}

	private static boolean complementBetween(NetAddress container, NetAddress contained, List<NetAddress> complements) {
		for (NetAddress complement : complements) {
			if (complement.getPrefixLength() > container.getPrefixLength()
					&& complement.isSubnetOf(container)
					&& contained.isSubnetOf(complement)) {
				return true;
			}
		}
		return false;
	}
}
