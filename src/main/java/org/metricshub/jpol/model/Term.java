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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.metricshub.jpol.addr.AddressLists;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.naming.Naming;

/**
 * One rule of a filter: what traffic it matches and what happens to it.
 * <p>
 * A term is created empty and filled by the parser, one attribute line at a
 * time, through {@link #addObject(VarType, Naming)}. Attribute order does not
 * matter and repeated list attributes accumulate. Once the term is complete,
 * it is validated and normalized once ({@link #isTranslated()} guards against
 * doing it twice).
 * <p>
 * Port attributes exist twice: the service names as written in the policy
 * ({@link #getPort()}...), and the port ranges they resolve to once the term
 * is normalized ({@link #getPortRanges()}...).
 */
@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Term lists are shared with the normalizer and the generators")
public class Term {

	/** Actions a term may take. */
	public static final Set<String> ACTIONS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"accept",
			"count",
			"deny",
			"reject",
			"next",
			"reject-with-tcp-rst")));

	/** Accepted values of the <code>logging</code> attribute. */
	public static final Set<String> LOGGING = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"true",
			"True",
			"syslog",
			"local",
			"disable",
			"log-both")));

	/** Protocols that carry ports. */
	public static final Set<String> PROTOS_WITH_PORTS = Collections.unmodifiableSet(new HashSet<String>(Arrays.asList(
			"tcp",
			"udp",
			"udplite",
			"sctp")));

	/** Address list attributes, see {@link #getAddressOfVersion(AddressField, int)}. */
	public enum AddressField {
		ADDRESS,
		ADDRESS_EXCLUDE,
		SOURCE_ADDRESS,
		SOURCE_ADDRESS_EXCLUDE,
		DESTINATION_ADDRESS,
		DESTINATION_ADDRESS_EXCLUDE,
		NEXT_IP
	}

	private String name;

	private final List<String> action = new ArrayList<String>();
	private List<NetAddress> address = new ArrayList<NetAddress>();
	private List<NetAddress> addressExclude = new ArrayList<NetAddress>();
	private String restrictAddressFamily;
	private final List<String> comment = new ArrayList<String>();
	private String counter;
	private LocalDate expiration;
	private List<NetAddress> destinationAddress = new ArrayList<NetAddress>();
	private List<NetAddress> destinationAddressExclude = new ArrayList<NetAddress>();
	private final List<String> destinationPort = new ArrayList<String>();
	private List<PortRange> destinationPortRanges = new ArrayList<PortRange>();
	private final List<String> destinationPrefix = new ArrayList<String>();
	private final List<String> destinationPrefixExcept = new ArrayList<String>();
	private String filterTerm;
	private final List<String> forwardingClass = new ArrayList<String>();
	private final List<String> forwardingClassExcept = new ArrayList<String>();
	private final List<String> logging = new ArrayList<String>();
	private LogLimit logLimit;
	private String logName;
	private String lossPriority;
	private final List<String> option = new ArrayList<String>();
	private String owner;
	private String policer;
	private final List<String> port = new ArrayList<String>();
	private List<PortRange> portRanges = new ArrayList<PortRange>();
	private final List<Integer> precedence = new ArrayList<Integer>();
	private final List<String> protocol = new ArrayList<String>();
	private final List<String> protocolExcept = new ArrayList<String>();
	private String qos;
	private final List<String> panApplication = new ArrayList<String>();
	private String routingInstance;
	private List<NetAddress> sourceAddress = new ArrayList<NetAddress>();
	private List<NetAddress> sourceAddressExclude = new ArrayList<NetAddress>();
	private final List<String> sourcePort = new ArrayList<String>();
	private List<PortRange> sourcePortRanges = new ArrayList<PortRange>();
	private final List<String> sourcePrefix = new ArrayList<String>();
	private final List<String> sourcePrefixExcept = new ArrayList<String>();
	private Integer ttl;
	private final List<Verbatim> verbatim = new ArrayList<Verbatim>();
	private String packetLength;
	private String fragmentOffset;
	private String hopLimit;
	private final List<String> icmpType = new ArrayList<String>();
	private final List<Integer> icmpCode = new ArrayList<Integer>();
	private final List<String> etherType = new ArrayList<String>();
	private String trafficClassCount;
	private final List<String> trafficType = new ArrayList<String>();
	private String dscpSet;
	private final List<String> dscpMatch = new ArrayList<String>();
	private final List<String> dscpExcept = new ArrayList<String>();
	private List<NetAddress> nextIp = new ArrayList<NetAddress>();
	private final List<Map.Entry<String, String>> flexibleMatchRange = new ArrayList<Map.Entry<String, String>>();
	private String encapsulate;
	private String portMirror;
	private final List<String> destinationZone = new ArrayList<String>();
	private final List<String> sourceZone = new ArrayList<String>();
	private Vpn vpn;
	private final List<String> sourceTag = new ArrayList<String>();
	private final List<String> destinationTag = new ArrayList<String>();
	private Integer priority;
	private String sourceInterface;
	private String destinationInterface;
	private final List<String> platform = new ArrayList<String>();
	private final List<String> platformExclude = new ArrayList<String>();
	private final List<Map.Entry<String, String>> targetResources = new ArrayList<Map.Entry<String, String>>();
	private final List<String> targetServiceAccounts = new ArrayList<String>();
	private Integer timeout;

	private boolean translated;

	/**
	 * Adds the values of one attribute line.
	 *
	 * @param values the values, all of the same kind
	 * @param naming resolves network names
	 * @throws org.metricshub.jpol.PolicyException if a value is not acceptable
	 */
	public void addObject(List<VarType> values, Naming naming) {
		for (VarType value : values) {
			addObject(value, naming);
		}
	}

	/**
	 * Adds one attribute value. List attributes accumulate, single valued
	 * attributes are overwritten. Network names are resolved right away.
	 *
	 * @param value the value
	 * @param naming resolves network names
	 * @throws InvalidTermActionException on an unknown action
	 * @throws InvalidTermLoggingException on an unknown logging value
	 * @throws TermObjectTypeException on a header only attribute
	 * @throws org.metricshub.jpol.naming.UndefinedAddressException on an undefined network name
	 */
	public void addObject(VarType value, Naming naming) {
		switch (value.getKind()) {
		case ACTION:
			if (!ACTIONS.contains(value.getString())) {
				throw new InvalidTermActionException("Invalid action: " + value + " in term " + name);
			}
			action.add(value.getString());
			break;
		case ADDRESS:
			address.addAll(naming.getNetAddr(value.getString()));
			break;
		case ADDREXCLUDE:
			addressExclude.addAll(naming.getNetAddr(value.getString()));
			break;
		case SADDRESS:
			sourceAddress.addAll(naming.getNetAddr(value.getString()));
			break;
		case SADDREXCLUDE:
			sourceAddressExclude.addAll(naming.getNetAddr(value.getString()));
			break;
		case DADDRESS:
			destinationAddress.addAll(naming.getNetAddr(value.getString()));
			break;
		case DADDREXCLUDE:
			destinationAddressExclude.addAll(naming.getNetAddr(value.getString()));
			break;
		case NEXT_IP:
			nextIp = new ArrayList<NetAddress>(naming.getNetAddr(value.getString()));
			break;
		case PORT:
			port.add(value.getString());
			break;
		case SPORT:
			sourcePort.add(value.getString());
			break;
		case DPORT:
			destinationPort.add(value.getString());
			break;
		case PROTOCOL:
			protocol.add(value.getString());
			break;
		case PROTOCOL_EXCEPT:
			protocolExcept.add(value.getString());
			break;
		case OPTION:
			option.add(value.getString());
			break;
		case LOGGING:
			if (!LOGGING.contains(value.getString())) {
				throw new InvalidTermLoggingException("Invalid logging: " + value + " in term " + name);
			}
			logging.add(value.getString());
			break;
		case COMMENT:
			comment.add(value.getString());
			break;
		case COUNTER:
			counter = value.getString();
			break;
		case EXPIRATION:
			expiration = (LocalDate) value.getValue();
			break;
		case DPFX:
			destinationPrefix.add(value.getString());
			break;
		case DPFX_EXCEPT:
			destinationPrefixExcept.add(value.getString());
			break;
		case SPFX:
			sourcePrefix.add(value.getString());
			break;
		case SPFX_EXCEPT:
			sourcePrefixExcept.add(value.getString());
			break;
		case FILTER_TERM:
			filterTerm = value.getString();
			break;
		case FORWARDING_CLASS:
			forwardingClass.add(value.getString());
			break;
		case FORWARDING_CLASS_EXCEPT:
			forwardingClassExcept.add(value.getString());
			break;
		case LOG_LIMIT:
			logLimit = (LogLimit) value.getValue();
			break;
		case LOG_NAME:
			logName = value.getString();
			break;
		case LOSS_PRIORITY:
			lossPriority = value.getString();
			break;
		case OWNER:
			owner = value.getString();
			break;
		case POLICER:
			policer = value.getString();
			break;
		case PRECEDENCE:
			precedence.add(toInteger(value));
			break;
		case QOS:
			qos = value.getString();
			break;
		case PAN_APPLICATION:
			panApplication.add(value.getString());
			break;
		case ROUTING_INSTANCE:
			routingInstance = value.getString();
			break;
		case RESTRICT_ADDRESS_FAMILY:
			restrictAddressFamily = value.getString();
			break;
		case TTL:
			ttl = toInteger(value);
			break;
		case VERBATIM:
			verbatim.add((Verbatim) value.getValue());
			break;
		case PACKET_LEN:
			packetLength = value.getString();
			break;
		case FRAGMENT_OFFSET:
			fragmentOffset = value.getString();
			break;
		case HOP_LIMIT:
			hopLimit = value.getString();
			break;
		case ICMP_TYPE:
			icmpType.add(value.getString());
			break;
		case ICMP_CODE:
			icmpCode.add(toInteger(value));
			break;
		case ETHER_TYPE:
			etherType.add(value.getString());
			break;
		case TRAFFIC_CLASS_COUNT:
			trafficClassCount = value.getString();
			break;
		case TRAFFIC_TYPE:
			trafficType.add(value.getString());
			break;
		case DSCP_SET:
			dscpSet = value.getString();
			break;
		case DSCP_MATCH:
			dscpMatch.add(value.getString());
			break;
		case DSCP_EXCEPT:
			dscpExcept.add(value.getString());
			break;
		case FLEXIBLE_MATCH_RANGE:
			flexibleMatchRange.add(toPair(value));
			break;
		case ENCAPSULATE:
			encapsulate = value.getString();
			break;
		case PORT_MIRROR:
			portMirror = value.getString();
			break;
		case SZONE:
			sourceZone.add(value.getString());
			break;
		case DZONE:
			destinationZone.add(value.getString());
			break;
		case VPN:
			vpn = (Vpn) value.getValue();
			break;
		case STAG:
			sourceTag.add(value.getString());
			break;
		case DTAG:
			destinationTag.add(value.getString());
			break;
		case PRIORITY:
			priority = toInteger(value);
			break;
		case SINTERFACE:
			sourceInterface = value.getString();
			break;
		case DINTERFACE:
			destinationInterface = value.getString();
			break;
		case PLATFORM:
			platform.add(value.getString());
			break;
		case PLATFORMEXCLUDE:
			platformExclude.add(value.getString());
			break;
		case TARGET_RESOURCES:
			targetResources.add(toPair(value));
			break;
		case TARGET_SERVICE_ACCOUNTS:
			targetServiceAccounts.add(value.getString());
			break;
		case TIMEOUT:
			timeout = toInteger(value);
			break;
		case TARGET:
		case APPLY_GROUPS:
		case APPLY_GROUPS_EXCEPT:
		default:
			throw new TermObjectTypeException(value.getKind() + " (" + value + ") is not a term attribute, in term " + name);
		}
	}

	private Map.Entry<String, String> toPair(VarType value) {
		if (value.getPair() == null) {
			throw new TermObjectTypeException(value.getKind() + " expects a key and a value, got " + value + " in term " + name);
		}
		return value.getPair();
	}

	private Integer toInteger(VarType value) {
		if (value.getValue() instanceof Integer) {
			return (Integer) value.getValue();
		}
		try {
			return Integer.valueOf(value.getString());
		} catch (NumberFormatException e) {
			throw new TermObjectTypeException(value.getKind() + " expects an integer, got " + value + " in term " + name);
		}
	}

	/**
	 * @return <code>address</code> minus <code>address-exclude</code>, computed on each call
	 */
	public List<NetAddress> flattenedAddress() {
		return AddressLists.exclude(address, addressExclude);
	}

	/**
	 * @return <code>source-address</code> minus <code>source-exclude</code>, computed on each call
	 */
	public List<NetAddress> flattenedSourceAddress() {
		return AddressLists.exclude(sourceAddress, sourceAddressExclude);
	}

	/**
	 * @return <code>destination-address</code> minus <code>destination-exclude</code>, computed on each call
	 */
	public List<NetAddress> flattenedDestinationAddress() {
		return AddressLists.exclude(destinationAddress, destinationAddressExclude);
	}

	/**
	 * Replaces each include list with its flattened view. Exclude lists are
	 * left as they are; as they no longer overlap the include lists,
	 * flattening again changes nothing.
	 */
	public void flattenAll() {
		address = flattenedAddress();
		sourceAddress = flattenedSourceAddress();
		destinationAddress = flattenedDestinationAddress();
	}

	/**
	 * @param field an address attribute
	 * @param version 4 or 6
	 * @return the addresses of that attribute with the given IP version
	 */
	public List<NetAddress> getAddressOfVersion(AddressField field, int version) {
		List<NetAddress> result = new ArrayList<NetAddress>();
		for (NetAddress candidate : getAddressField(field)) {
			if (candidate.getVersion() == version) {
				result.add(candidate);
			}
		}
		return result;
	}

	/**
	 * @param field an address attribute
	 * @return the live list behind the attribute
	 */
	public List<NetAddress> getAddressField(AddressField field) {
		switch (field) {
		case ADDRESS:
			return address;
		case ADDRESS_EXCLUDE:
			return addressExclude;
		case SOURCE_ADDRESS:
			return sourceAddress;
		case SOURCE_ADDRESS_EXCLUDE:
			return sourceAddressExclude;
		case DESTINATION_ADDRESS:
			return destinationAddress;
		case DESTINATION_ADDRESS_EXCLUDE:
			return destinationAddressExclude;
		case NEXT_IP:
		default:
			return nextIp;
		}
	}

	/**
	 * Size of the source and destination addresses as some hardware counts it:
	 * one unit per IPv4 network, four per IPv6 network.
	 *
	 * @param families IP versions to count
	 * @return the total size
	 */
	public int addressesByteLength(Collection<Integer> families) {
		int counter = 0;
		for (NetAddress candidate : sourceAddress) {
			counter += byteLength(candidate, families);
		}
		for (NetAddress candidate : destinationAddress) {
			counter += byteLength(candidate, families);
		}
		return counter;
	}

	private static int byteLength(NetAddress candidate, Collection<Integer> families) {
		if (!families.contains(candidate.getVersion())) {
			return 0;
		}
		return candidate.getVersion() == 6 ? 4 : 1;
	}

	/**
	 * @return <code>true</code> if any of port, source-port or destination-port is set
	 */
	public boolean hasPorts() {
		return !port.isEmpty() || !sourcePort.isEmpty() || !destinationPort.isEmpty();
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public List<String> getAction() {
		return action;
	}

	public List<NetAddress> getAddress() {
		return address;
	}

	public void setAddress(List<NetAddress> address) {
		this.address = new ArrayList<NetAddress>(address);
	}

	public List<NetAddress> getAddressExclude() {
		return addressExclude;
	}

	public void setAddressExclude(List<NetAddress> addressExclude) {
		this.addressExclude = new ArrayList<NetAddress>(addressExclude);
	}

	public String getRestrictAddressFamily() {
		return restrictAddressFamily;
	}

	public List<String> getComment() {
		return comment;
	}

	public String getCounter() {
		return counter;
	}

	public LocalDate getExpiration() {
		return expiration;
	}

	public List<NetAddress> getDestinationAddress() {
		return destinationAddress;
	}

	public void setDestinationAddress(List<NetAddress> destinationAddress) {
		this.destinationAddress = new ArrayList<NetAddress>(destinationAddress);
	}

	public List<NetAddress> getDestinationAddressExclude() {
		return destinationAddressExclude;
	}

	public void setDestinationAddressExclude(List<NetAddress> destinationAddressExclude) {
		this.destinationAddressExclude = new ArrayList<NetAddress>(destinationAddressExclude);
	}

	/**
	 * @return the destination service names, as written
	 */
	public List<String> getDestinationPort() {
		return destinationPort;
	}

	/**
	 * @return the destination port ranges, once normalized
	 */
	public List<PortRange> getDestinationPortRanges() {
		return destinationPortRanges;
	}

	public void setDestinationPortRanges(List<PortRange> destinationPortRanges) {
		this.destinationPortRanges = new ArrayList<PortRange>(destinationPortRanges);
	}

	public List<String> getDestinationPrefix() {
		return destinationPrefix;
	}

	public List<String> getDestinationPrefixExcept() {
		return destinationPrefixExcept;
	}

	public String getFilterTerm() {
		return filterTerm;
	}

	public List<String> getForwardingClass() {
		return forwardingClass;
	}

	public List<String> getForwardingClassExcept() {
		return forwardingClassExcept;
	}

	public List<String> getLogging() {
		return logging;
	}

	public LogLimit getLogLimit() {
		return logLimit;
	}

	public String getLogName() {
		return logName;
	}

	public String getLossPriority() {
		return lossPriority;
	}

	public List<String> getOption() {
		return option;
	}

	public String getOwner() {
		return owner;
	}

	public String getPolicer() {
		return policer;
	}

	/**
	 * @return the service names of the <code>port</code> attribute, as written
	 */
	public List<String> getPort() {
		return port;
	}

	/**
	 * @return the port ranges of the <code>port</code> attribute, once normalized
	 */
	public List<PortRange> getPortRanges() {
		return portRanges;
	}

	public void setPortRanges(List<PortRange> portRanges) {
		this.portRanges = new ArrayList<PortRange>(portRanges);
	}

	public List<Integer> getPrecedence() {
		return precedence;
	}

	public List<String> getProtocol() {
		return protocol;
	}

	public List<String> getProtocolExcept() {
		return protocolExcept;
	}

	public String getQos() {
		return qos;
	}

	public List<String> getPanApplication() {
		return panApplication;
	}

	public String getRoutingInstance() {
		return routingInstance;
	}

	public List<NetAddress> getSourceAddress() {
		return sourceAddress;
	}

	public void setSourceAddress(List<NetAddress> sourceAddress) {
		this.sourceAddress = new ArrayList<NetAddress>(sourceAddress);
	}

	public List<NetAddress> getSourceAddressExclude() {
		return sourceAddressExclude;
	}

	public void setSourceAddressExclude(List<NetAddress> sourceAddressExclude) {
		this.sourceAddressExclude = new ArrayList<NetAddress>(sourceAddressExclude);
	}

	/**
	 * @return the source service names, as written
	 */
	public List<String> getSourcePort() {
		return sourcePort;
	}

	/**
	 * @return the source port ranges, once normalized
	 */
	public List<PortRange> getSourcePortRanges() {
		return sourcePortRanges;
	}

	public void setSourcePortRanges(List<PortRange> sourcePortRanges) {
		this.sourcePortRanges = new ArrayList<PortRange>(sourcePortRanges);
	}

	public List<String> getSourcePrefix() {
		return sourcePrefix;
	}

	public List<String> getSourcePrefixExcept() {
		return sourcePrefixExcept;
	}

	public Integer getTtl() {
		return ttl;
	}

	public List<Verbatim> getVerbatim() {
		return verbatim;
	}

	public String getPacketLength() {
		return packetLength;
	}

	public String getFragmentOffset() {
		return fragmentOffset;
	}

	public String getHopLimit() {
		return hopLimit;
	}

	public List<String> getIcmpType() {
		return icmpType;
	}

	public List<Integer> getIcmpCode() {
		return icmpCode;
	}

	public List<String> getEtherType() {
		return etherType;
	}

	public String getTrafficClassCount() {
		return trafficClassCount;
	}

	public List<String> getTrafficType() {
		return trafficType;
	}

	public String getDscpSet() {
		return dscpSet;
	}

	public List<String> getDscpMatch() {
		return dscpMatch;
	}

	public List<String> getDscpExcept() {
		return dscpExcept;
	}

	public List<NetAddress> getNextIp() {
		return nextIp;
	}

	public List<Map.Entry<String, String>> getFlexibleMatchRange() {
		return flexibleMatchRange;
	}

	public String getEncapsulate() {
		return encapsulate;
	}

	public String getPortMirror() {
		return portMirror;
	}

	public List<String> getDestinationZone() {
		return destinationZone;
	}

	public List<String> getSourceZone() {
		return sourceZone;
	}

	public Vpn getVpn() {
		return vpn;
	}

	public List<String> getSourceTag() {
		return sourceTag;
	}

	public List<String> getDestinationTag() {
		return destinationTag;
	}

	public Integer getPriority() {
		return priority;
	}

	public String getSourceInterface() {
		return sourceInterface;
	}

	public String getDestinationInterface() {
		return destinationInterface;
	}

	public List<String> getPlatform() {
		return platform;
	}

	public List<String> getPlatformExclude() {
		return platformExclude;
	}

	public List<Map.Entry<String, String>> getTargetResources() {
		return targetResources;
	}

	public List<String> getTargetServiceAccounts() {
		return targetServiceAccounts;
	}

	public Integer getTimeout() {
		return timeout;
	}

	/**
	 * @return whether the term has been validated and normalized
	 */
	public boolean isTranslated() {
		return translated;
	}

	public void setTranslated(boolean translated) {
		this.translated = translated;
	}

	private static <T extends Comparable<? super T>> List<T> sorted(Collection<T> values) {
		List<T> copy = new ArrayList<T>(values);
		Collections.sort(copy);
		return copy;
	}

	/**
	 * Two terms are equal when they match the same traffic the same way.
	 * The name is not compared, and neither is the order of list attributes.
	 */
	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Term)) {
			return false;
		}
		Term other = (Term) obj;
		return sorted(action).equals(sorted(other.action))
				&& sorted(address).equals(sorted(other.address))
				&& sorted(addressExclude).equals(sorted(other.addressExclude))
				&& sorted(sourceAddress).equals(sorted(other.sourceAddress))
				&& sorted(sourceAddressExclude).equals(sorted(other.sourceAddressExclude))
				&& sorted(destinationAddress).equals(sorted(other.destinationAddress))
				&& sorted(destinationAddressExclude).equals(sorted(other.destinationAddressExclude))
				&& sorted(port).equals(sorted(other.port))
				&& sorted(sourcePort).equals(sorted(other.sourcePort))
				&& sorted(destinationPort).equals(sorted(other.destinationPort))
				&& sorted(portRanges).equals(sorted(other.portRanges))
				&& sorted(sourcePortRanges).equals(sorted(other.sourcePortRanges))
				&& sorted(destinationPortRanges).equals(sorted(other.destinationPortRanges))
				&& sorted(protocol).equals(sorted(other.protocol))
				&& sorted(protocolExcept).equals(sorted(other.protocolExcept))
				&& sorted(option).equals(sorted(other.option))
				&& sorted(logging).equals(sorted(other.logging))
				&& sorted(precedence).equals(sorted(other.precedence))
				&& sorted(sourcePrefix).equals(sorted(other.sourcePrefix))
				&& sorted(sourcePrefixExcept).equals(sorted(other.sourcePrefixExcept))
				&& sorted(destinationPrefix).equals(sorted(other.destinationPrefix))
				&& sorted(destinationPrefixExcept).equals(sorted(other.destinationPrefixExcept))
				&& sorted(forwardingClass).equals(sorted(other.forwardingClass))
				&& sorted(forwardingClassExcept).equals(sorted(other.forwardingClassExcept))
				&& sorted(icmpType).equals(sorted(other.icmpType))
				&& sorted(icmpCode).equals(sorted(other.icmpCode))
				&& sorted(etherType).equals(sorted(other.etherType))
				&& sorted(trafficType).equals(sorted(other.trafficType))
				&& sorted(dscpMatch).equals(sorted(other.dscpMatch))
				&& sorted(dscpExcept).equals(sorted(other.dscpExcept))
				&& sorted(sourceZone).equals(sorted(other.sourceZone))
				&& sorted(destinationZone).equals(sorted(other.destinationZone))
				&& sorted(sourceTag).equals(sorted(other.sourceTag))
				&& sorted(destinationTag).equals(sorted(other.destinationTag))
				&& sorted(platform).equals(sorted(other.platform))
				&& sorted(platformExclude).equals(sorted(other.platformExclude))
				&& sorted(panApplication).equals(sorted(other.panApplication))
				&& sorted(targetServiceAccounts).equals(sorted(other.targetServiceAccounts))
				&& sorted(verbatim).equals(sorted(other.verbatim))
				&& sorted(nextIp).equals(sorted(other.nextIp))
				&& comment.equals(other.comment)
				&& flexibleMatchRange.equals(other.flexibleMatchRange)
				&& targetResources.equals(other.targetResources)
				&& Objects.equals(counter, other.counter)
				&& Objects.equals(expiration, other.expiration)
				&& Objects.equals(filterTerm, other.filterTerm)
				&& Objects.equals(logLimit, other.logLimit)
				&& Objects.equals(logName, other.logName)
				&& Objects.equals(lossPriority, other.lossPriority)
				&& Objects.equals(owner, other.owner)
				&& Objects.equals(policer, other.policer)
				&& Objects.equals(qos, other.qos)
				&& Objects.equals(routingInstance, other.routingInstance)
				&& Objects.equals(restrictAddressFamily, other.restrictAddressFamily)
				&& Objects.equals(ttl, other.ttl)
				&& Objects.equals(packetLength, other.packetLength)
				&& Objects.equals(fragmentOffset, other.fragmentOffset)
				&& Objects.equals(hopLimit, other.hopLimit)
				&& Objects.equals(trafficClassCount, other.trafficClassCount)
				&& Objects.equals(dscpSet, other.dscpSet)
				&& Objects.equals(encapsulate, other.encapsulate)
				&& Objects.equals(portMirror, other.portMirror)
				&& Objects.equals(vpn, other.vpn)
				&& Objects.equals(priority, other.priority)
				&& Objects.equals(sourceInterface, other.sourceInterface)
				&& Objects.equals(destinationInterface, other.destinationInterface)
				&& Objects.equals(timeout, other.timeout);
	}

	/** {@inheritDoc} */
	@Override
	public int hashCode() {
		return Objects.hash(sorted(action), sorted(protocol));
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		StringBuilder text = new StringBuilder("name: ").append(name);
		append(text, "action", action);
		append(text, "address", address);
		append(text, "address-exclude", addressExclude);
		append(text, "source-address", sourceAddress);
		append(text, "source-exclude", sourceAddressExclude);
		append(text, "destination-address", destinationAddress);
		append(text, "destination-exclude", destinationAddressExclude);
		append(text, "protocol", protocol);
		append(text, "protocol-except", protocolExcept);
		append(text, "port", portRanges.isEmpty() ? port : portRanges);
		append(text, "source-port", sourcePortRanges.isEmpty() ? sourcePort : sourcePortRanges);
		append(text, "destination-port", destinationPortRanges.isEmpty() ? destinationPort : destinationPortRanges);
		append(text, "option", option);
		append(text, "icmp-type", icmpType);
		append(text, "icmp-code", icmpCode);
		append(text, "logging", logging);
		append(text, "comment", comment);
		append(text, "verbatim", verbatim);
		if (counter != null) {
			text.append("\n  counter: ").append(counter);
		}
		if (ttl != null) {
			text.append("\n  ttl: ").append(ttl);
		}
		if (expiration != null) {
			text.append("\n  expiration: ").append(expiration);
		}
		return text.toString();
	}

	private static void append(StringBuilder text, String label, List<?> values) {
		if (!values.isEmpty()) {
			text.append("\n  ").append(label).append(": ").append(values);
		}
	}
}
