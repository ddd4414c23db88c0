package org.metricshub.jpol.analysis;

import static org.junit.Assert.*;
import static org.metricshub.jpol.PolicyTestSupport.filter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jpol.Jpol;
import org.metricshub.jpol.PolicyTestSupport;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.model.PortRange;
import org.metricshub.jpol.model.Term;

public class TermContainmentTest {

	private final TermContainment containment = new TermContainment();

	/**
	 * Validated and normalized terms <code>a</code> and <code>b</code>.
	 */
	private static List<Term> pair(String a, String b) {
		Jpol jpol = new Jpol(PolicyTestSupport.defaultNaming().addService("ALT_HTTP", "8080/tcp"));
		return jpol.parseText(filter("term a {\n" + a + "\n}", "term b {\n" + b + "\n}")).getFilters().get(0).getTerms();
	}

	private void assertContains(String a, String b) {
		List<Term> terms = pair(a, b);
		assertTrue("[" + a + "] should contain [" + b + "]", containment.contains(terms.get(0), terms.get(1)));
	}

	private void assertNotContains(String a, String b) {
		List<Term> terms = pair(a, b);
		assertFalse("[" + a + "] should not contain [" + b + "]", containment.contains(terms.get(0), terms.get(1)));
	}

	@Test
	public void testEmptySideIsUnrestricted() {
		List<NetAddress> internal = Collections.singletonList(NetAddress.parse("10.0.0.0/8"));
		List<NetAddress> none = Collections.<NetAddress>emptyList();
		assertTrue(TermContainment.addressListContains(none, internal));
		assertTrue(TermContainment.addressListContains(none, none));
		assertFalse(TermContainment.addressListContains(internal, none));
		assertTrue(TermContainment.addressListContains(internal, Collections.singletonList(NetAddress.parse("10.1.0.0/16"))));
		assertFalse(TermContainment.addressListContains(
				Collections.singletonList(NetAddress.parse("::/0")),
				internal));
	}

	@Test
	public void testPortListContainment() {
		List<PortRange> high = Collections.singletonList(new PortRange(1024, 65535));
		assertTrue(PortRange.isContained(high, Arrays.asList(new PortRange(8080, 8080), new PortRange(2000, 3000))));
		assertFalse(PortRange.isContained(high, Arrays.asList(new PortRange(80, 80), new PortRange(8080, 8080))));
		assertFalse(PortRange.isContained(high, Collections.singletonList(new PortRange(1000, 2000))));
		assertTrue(PortRange.isContained(high, Collections.<PortRange>emptyList()));
		assertFalse(PortRange.isContained(Collections.<PortRange>emptyList(), high));
	}

	@Test
	public void testIdenticalTerms() {
		String term = "protocol:: tcp\nsource-address:: INTERNAL\ndestination-port:: WEB\naction:: accept";
		assertContains(term, term);
		assertContains("action:: accept", "action:: deny");
	}

	@Test
	public void testProtocols() {
		assertContains("protocol:: tcp udp\naction:: accept", "protocol:: tcp\naction:: accept");
		assertNotContains("protocol:: tcp\naction:: accept", "protocol:: tcp udp\naction:: accept");
		assertContains("action:: accept", "protocol:: tcp\naction:: accept");
		assertNotContains("protocol:: tcp\naction:: accept", "action:: accept");
		assertNotContains("protocol:: tcp\naction:: accept", "protocol-except:: udp\naction:: accept");
	}

	@Test
	public void testProtocolExcept() {
		String exceptUdp = "protocol-except:: udp\naction:: accept";
		assertContains(exceptUdp, "protocol:: tcp icmp\naction:: accept");
		assertNotContains(exceptUdp, "protocol:: tcp udp\naction:: accept");
		assertContains(exceptUdp, "protocol-except:: udp icmp\naction:: accept");
		assertNotContains(exceptUdp, "protocol-except:: icmp\naction:: accept");
		assertNotContains(exceptUdp, "action:: accept");
	}

	@Test
	public void testAddresses() {
		assertContains("source-address:: INTERNAL\naction:: accept", "source-address:: WEB_SERVERS\naction:: accept");
		assertNotContains("source-address:: WEB_SERVERS\naction:: accept", "source-address:: INTERNAL\naction:: accept");
		assertNotContains("source-address:: INTERNAL\naction:: accept", "action:: accept");
		assertNotContains("source-address:: INTERNAL\naction:: accept", "source-address:: INTERNAL DMZ\naction:: accept");
		assertContains("destination-address:: ANY\naction:: accept", "destination-address:: DMZ DNS_SERVERS\naction:: accept");
	}

	@Test
	public void testGenericAddressStandsForBothSides() {
		assertContains("source-address:: INTERNAL\naction:: accept", "address:: WEB_SERVERS\naction:: accept");
		assertContains(
				"source-address:: INTERNAL\ndestination-address:: INTERNAL\naction:: accept",
				"address:: WEB_SERVERS\naction:: accept");
		assertContains("address:: INTERNAL\naction:: accept", "destination-address:: WEB_SERVERS\naction:: accept");
		assertNotContains("address:: INTERNAL\naction:: accept", "destination-address:: DMZ\naction:: accept");
		assertNotContains("address:: INTERNAL\naction:: accept", "action:: accept");
	}

	@Test
	public void testExcludedAddresses() {
		String internalButWeb = "source-address:: INTERNAL\nsource-exclude:: WEB_SERVERS\naction:: accept";
		assertNotContains(internalButWeb, "source-address:: WEB_SERVERS\naction:: accept");
		assertContains(internalButWeb, "source-address:: DNS_SERVERS\naction:: accept");
		assertContains("source-address:: INTERNAL\naction:: accept", internalButWeb);
	}

	@Test
	public void testPorts() {
		assertContains(
				"protocol:: tcp\ndestination-port:: HIGH_PORTS\naction:: accept",
				"protocol:: tcp\ndestination-port:: ALT_HTTP\naction:: accept");
		assertNotContains(
				"protocol:: tcp\ndestination-port:: HIGH_PORTS\naction:: accept",
				"protocol:: tcp\ndestination-port:: HTTP ALT_HTTP\naction:: accept");
		assertNotContains(
				"protocol:: tcp\ndestination-port:: HTTP\naction:: accept",
				"protocol:: tcp\naction:: accept");
		assertNotContains(
				"protocol:: tcp\nsource-port:: HTTP\naction:: accept",
				"protocol:: tcp\ndestination-port:: HTTP\naction:: accept");
		assertContains(
				"protocol:: tcp\nport:: WEB\naction:: accept",
				"protocol:: tcp\ndestination-port:: HTTP\naction:: accept");
		assertContains(
				"protocol:: tcp\ndestination-port:: WEB\naction:: accept",
				"protocol:: tcp\nport:: HTTPS\naction:: accept");
	}

	@Test
	public void testOptionsAndPrecedence() {
		assertContains("option:: established tcp-established\naction:: accept", "option:: established\naction:: accept");
		assertNotContains("action:: accept", "option:: established\naction:: accept");
		assertNotContains("option:: established\naction:: accept", "action:: accept");
		assertContains("precedence:: 1 2\naction:: accept", "precedence:: 2\naction:: accept");
		assertNotContains("action:: accept", "precedence:: 2\naction:: accept");
	}

	@Test
	public void testForwardingClass() {
		assertContains("action:: accept", "forwarding-class:: gold\naction:: accept");
		assertContains("forwarding-class:: gold silver\naction:: accept", "forwarding-class:: gold\naction:: accept");
		assertNotContains("forwarding-class:: gold\naction:: accept", "forwarding-class:: gold silver\naction:: accept");
		assertNotContains("forwarding-class:: gold\naction:: accept", "action:: accept");
	}

	@Test
	public void testExactMatches() {
		assertContains("source-prefix:: trusted\naction:: accept", "source-prefix:: trusted\naction:: accept");
		assertNotContains("source-prefix:: trusted\naction:: accept", "source-prefix:: other\naction:: accept");
		assertContains("action:: accept", "source-prefix:: trusted\naction:: accept");
		assertContains(
				"source-tag:: web\ndestination-tag:: db\naction:: accept",
				"source-tag:: web\ndestination-tag:: db\naction:: accept");
		assertNotContains("source-tag:: web\naction:: accept", "source-tag:: web\ndestination-tag:: db\naction:: accept");
		assertNotContains("destination-tag:: db\naction:: accept", "destination-tag:: cache\naction:: accept");
	}

	@Test
	public void testPresences() {
		assertNotContains("next-ip:: DMZ", "action:: accept");
		assertContains("next-ip:: DMZ", "next-ip:: DMZ");
		assertNotContains("encapsulate:: tunnel", "action:: accept");
		assertNotContains("port-mirror:: true", "action:: accept");
		assertContains("action:: accept", "next-ip:: DMZ");
	}

	@Test
	public void testRanges() {
		assertContains("hop-limit:: 1-100\naction:: accept", "hop-limit:: 5-10\naction:: accept");
		assertNotContains("hop-limit:: 1-100\naction:: accept", "hop-limit:: 90-200\naction:: accept");
		assertNotContains("hop-limit:: 1-100\naction:: accept", "action:: accept");
		assertContains("packet-length:: 1-1500\naction:: accept", "packet-length:: 1500\naction:: accept");
		assertNotContains("fragment-offset:: 1\naction:: accept", "fragment-offset:: 1-2\naction:: accept");
	}

	@Test
	public void testSets() {
		assertContains(
				"protocol:: icmp\nicmp-type:: echo-request echo-reply\naction:: accept",
				"protocol:: icmp\nicmp-type:: echo-reply echo-request\naction:: accept");
		assertNotContains(
				"protocol:: icmp\nicmp-type:: echo-request echo-reply\naction:: accept",
				"protocol:: icmp\nicmp-type:: echo-request\naction:: accept");
		assertContains("protocol:: icmp\naction:: accept", "protocol:: icmp\nicmp-type:: echo-request\naction:: accept");
		assertNotContains("platform:: juniper\naction:: accept", "platform:: juniper cisco\naction:: accept");
		assertNotContains("source-zone:: trust\naction:: accept", "source-zone:: untrust\naction:: accept");
	}

	@Test
	public void testVerbatim() {
		String raw = "verbatim:: juniper \"raw text\"";
		assertContains(raw, raw);
		assertNotContains(raw, "verbatim:: juniper \"other text\"");
		assertNotContains("action:: accept", raw);
		assertNotContains(raw, "action:: accept");
	}
}
