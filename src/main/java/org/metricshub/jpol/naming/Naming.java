package org.metricshub.jpol.naming;

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
import org.metricshub.jpol.addr.NetAddress;

/**
 * Resolves the symbolic network and service names a policy refers to.
 * <p>
 * Implementations must be usable from one parse at a time; distinct parses
 * running concurrently should each get their own instance unless the
 * implementation is read-only.
 */
public interface Naming {

	/**
	 * Resolves a network name to its addresses.
	 *
	 * @param name the network name, as written in the policy
	 * @return the addresses, in definition order, each tagged with the name of
	 *         the definition it comes from
	 * @throws UndefinedAddressException if <code>name</code> is not defined
	 */
	List<NetAddress> getNetAddr(String name);

	/**
	 * Resolves a service name to the ports it defines for one protocol.
	 *
	 * @param name the service name, as written in the policy
	 * @param protocol the protocol, e.g. <code>tcp</code>
	 * @return port strings (<code>"N"</code> or <code>"N-M"</code>), empty when
	 *         the service defines nothing for <code>protocol</code>
	 * @throws UndefinedServiceException if <code>name</code> is not defined
	 */
	List<String> getServiceByProto(String name, String protocol);
}
