package org.metricshub.jpol.analysis;

import static org.junit.Assert.*;
import static org.metricshub.jpol.PolicyTestSupport.parseTerm;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jpol.PolicyTestSupport;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.model.PortRange;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.naming.UndefinedServiceException;

public class TermNormalizerTest {

	private final TermNormalizer normalizer = new TermNormalizer(PolicyTestSupport.defaultNaming(), true);

	private static List<PortRange> ranges(int... bounds) {
		List<PortRange> ranges = new ArrayList<PortRange>();
		for (int i = 0; i < bounds.length; i += 2) {
			ranges.add(new PortRange(bounds[i], bounds[i + 1]));
		}
		return ranges;
	}

	@Test
	public void testCollapsePortList() {
		assertEquals(
				ranges(53, 53, 80, 80, 1024, 65535),
				TermNormalizer.collapsePortList(ranges(80, 80, 53, 53, 1024, 65535)));
		assertEquals(ranges(10, 30), TermNormalizer.collapsePortList(ranges(10, 20, 21, 30)));
		assertEquals(ranges(10, 30), TermNormalizer.collapsePortList(ranges(10, 20, 15, 30)));
		assertEquals(ranges(10, 20, 22, 30), TermNormalizer.collapsePortList(ranges(10, 20, 22, 30)));
		assertEquals(ranges(1, 100), TermNormalizer.collapsePortList(ranges(1, 100, 20, 30, 50, 50)));
		assertTrue(TermNormalizer.collapsePortList(Collections.<PortRange>emptyList()).isEmpty());
	}

	@Test
	public void testTranslatePorts() {
		List<PortRange> ports = normalizer.translatePorts(Arrays.asList("HTTP", "DNS"), Arrays.asList("tcp", "udp", "tcp"), "t");
		assertEquals("HTTP has no udp port and is skipped for udp", ranges(80, 80, 53, 53, 53, 53), ports);
		assertThrows(
				UndefinedServiceException.class,
				() -> normalizer.translatePorts(Collections.singletonList("GOPHER"), Collections.singletonList("tcp"), "t"));
	}

	@Test
	public void testPorts() {
		Term term = parseTerm("protocol:: tcp udp\ndestination-port:: DNS HTTP HIGH_PORTS\nsource-port:: HIGH_PORTS\naction:: accept");
		normalizer.normalize(term, false);
		assertEquals(ranges(53, 53, 80, 80, 1024, 65535), term.getDestinationPortRanges());
		assertEquals(ranges(1024, 65535), term.getSourcePortRanges());
		assertTrue(term.getPortRanges().isEmpty());
		assertEquals("service names are kept", Arrays.asList("DNS", "HTTP", "HIGH_PORTS"), term.getDestinationPort());
	}

	@Test
	public void testPortsWithoutMatchingProtocol() {
		Term udpOnly = parseTerm("protocol:: udp\ndestination-port:: HTTP\naction:: accept");
		assertThrows(TermPortProtocolException.class, () -> normalizer.normalize(udpOnly, false));
		Term noProtocol = parseTerm("port:: HTTP\naction:: accept");
		assertThrows(TermPortProtocolException.class, () -> normalizer.normalize(noProtocol, false));
	}

	@Test
	public void testExcludesAreApplied() {
		Term term = parseTerm("source-address:: INTERNAL\nsource-exclude:: WEB_SERVERS\naction:: accept");
		normalizer.normalize(term, false);
		NetAddress excluded = NetAddress.parse("10.1.1.0/24");
		assertEquals(16, term.getSourceAddress().size());
		for (NetAddress address : term.getSourceAddress()) {
			assertTrue(address + " is inside 10.0.0.0/8", address.isSubnetOf(NetAddress.parse("10.0.0.0/8")));
			assertFalse(address + " overlaps the exclude", address.contains(excluded) || excluded.contains(address));
		}
		assertEquals(Collections.singletonList(excluded), term.getSourceAddressExclude());
	}

	@Test
	public void testAddressModes() {
		String body = "source-address:: WEB_SERVERS INTERNAL\ndestination-address:: DNS_SERVERS\naction:: accept";
		List<NetAddress> both = Arrays.asList(NetAddress.parse("10.0.0.0/8"), NetAddress.parse("10.1.1.0/24"));

		Term collapsed = parseTerm(body);
		normalizer.normalize(collapsed, false);
		assertEquals(Collections.singletonList(NetAddress.parse("10.0.0.0/8")), collapsed.getSourceAddress());

		Term sorted = parseTerm(body);
		new TermNormalizer(PolicyTestSupport.defaultNaming(), false).normalize(sorted, false);
		assertEquals(both, sorted.getSourceAddress());

		Term addressBook = parseTerm(body);
		normalizer.normalize(addressBook, true);
		assertEquals(both, addressBook.getSourceAddress());
		assertEquals("INTERNAL", addressBook.getSourceAddress().get(0).getToken());
		assertEquals("WEB_SERVERS", addressBook.getSourceAddress().get(1).getToken());
		assertEquals(2, addressBook.getDestinationAddress().size());
	}

	@Test
	public void testIdempotence() {
		Term term = parseTerm(
				"protocol:: tcp\n"
						+ "destination-port:: WEB HTTP\n"
						+ "source-address:: INTERNAL DMZ\n"
						+ "source-exclude:: WEB_SERVERS\n"
						+ "destination-address:: DNS_SERVERS\n"
						+ "action:: accept");
		normalizer.normalize(term, false);
		List<PortRange> ports = new ArrayList<PortRange>(term.getDestinationPortRanges());
		List<NetAddress> sources = new ArrayList<NetAddress>(term.getSourceAddress());
		List<NetAddress> destinations = new ArrayList<NetAddress>(term.getDestinationAddress());

		normalizer.normalize(term, false);
		assertEquals(ranges(80, 80, 443, 443), term.getDestinationPortRanges());
		assertEquals(ports, term.getDestinationPortRanges());
		assertEquals(sources, term.getSourceAddress());
		assertEquals(destinations, term.getDestinationAddress());
	}
}
