package org.metricshub.jpol.model;

import static org.junit.Assert.*;

import java.util.AbstractMap;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.jpol.PolicyTestSupport;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.naming.DefinitionsNaming;
import org.metricshub.jpol.naming.Naming;
import org.metricshub.jpol.naming.UndefinedAddressException;

public class TermTest {

	private static final Naming NAMING = PolicyTestSupport.defaultNaming()
			.addNetwork("MIXED", "10.0.0.0/24", "2001:db8::/32", "192.168.0.1");

	private static Term term(String name, VarType... values) {
		Term term = new Term();
		term.setName(name);
		term.addObject(Arrays.asList(values), NAMING);
		return term;
	}

	private static VarType v(VarType.Kind kind, Object value) {
		return new VarType(kind, value);
	}

	@Test
	public void testListsAccumulateAndScalarsOverwrite() {
		Term term = term(
				"t",
				v(VarType.Kind.PROTOCOL, "tcp"),
				v(VarType.Kind.PROTOCOL, "udp"),
				v(VarType.Kind.COUNTER, "first"),
				v(VarType.Kind.COUNTER, "second"),
				v(VarType.Kind.TTL, "64"),
				v(VarType.Kind.ICMP_CODE, 3));
		assertEquals(Arrays.asList("tcp", "udp"), term.getProtocol());
		assertEquals("second", term.getCounter());
		assertEquals(Integer.valueOf(64), term.getTtl());
		assertEquals(Collections.singletonList(3), term.getIcmpCode());
	}

	@Test
	public void testNextIpIsReplaced() {
		Term term = term("t", v(VarType.Kind.NEXT_IP, "DMZ"), v(VarType.Kind.NEXT_IP, "WEB_SERVERS"));
		assertEquals(Collections.singletonList(NetAddress.parse("10.1.1.0/24")), term.getNextIp());
	}

	@Test
	public void testPairValues() {
		Term term = new Term();
		term.setName("t");
		term.addObject(
				new VarType(VarType.Kind.TARGET_RESOURCES, new AbstractMap.SimpleImmutableEntry<String, String>("project", "vpc")),
				NAMING);
		assertEquals("vpc", term.getTargetResources().get(0).getValue());
		assertThrows(TermObjectTypeException.class, () -> term("t", v(VarType.Kind.TARGET_RESOURCES, "project")));
		assertThrows(TermObjectTypeException.class, () -> term("t", v(VarType.Kind.FLEXIBLE_MATCH_RANGE, "bit-length")));
	}

	@Test
	public void testRejectedValues() {
		assertThrows(InvalidTermActionException.class, () -> term("t", v(VarType.Kind.ACTION, "allow")));
		assertThrows(InvalidTermLoggingException.class, () -> term("t", v(VarType.Kind.LOGGING, "maybe")));
		assertThrows(TermObjectTypeException.class, () -> term("t", v(VarType.Kind.APPLY_GROUPS, "group")));
		assertThrows(TermObjectTypeException.class, () -> term("t", v(VarType.Kind.TTL, "sixty")));
		assertThrows(UndefinedAddressException.class, () -> term("t", v(VarType.Kind.ADDRESS, "NOWHERE")));
	}

	@Test
	public void testFlattening() {
		Term term = term("t", v(VarType.Kind.SADDRESS, "INTERNAL"), v(VarType.Kind.SADDREXCLUDE, "WEB_SERVERS"));
		assertEquals(Collections.singletonList(NetAddress.parse("10.0.0.0/8")), term.getSourceAddress());
		int pieces = term.flattenedSourceAddress().size();
		assertEquals("a /24 taken out of a /8 leaves 16 networks", 16, pieces);
		for (NetAddress piece : term.flattenedSourceAddress()) {
			assertFalse(piece.contains(NetAddress.parse("10.1.1.0/24")));
			assertEquals("INTERNAL", piece.getToken());
		}

		term.flattenAll();
		assertEquals(16, term.getSourceAddress().size());
		assertEquals(Collections.singletonList(NetAddress.parse("10.1.1.0/24")), term.getSourceAddressExclude());
		term.flattenAll();
		assertEquals("flattening twice changes nothing", 16, term.getSourceAddress().size());
	}

	@Test
	public void testAddressOfVersion() {
		Term term = term("t", v(VarType.Kind.DADDRESS, "MIXED"), v(VarType.Kind.SADDRESS, "DMZ"));
		assertEquals(
				Arrays.asList(NetAddress.parse("10.0.0.0/24"), NetAddress.parse("192.168.0.1/32")),
				term.getAddressOfVersion(Term.AddressField.DESTINATION_ADDRESS, 4));
		assertEquals(
				Collections.singletonList(NetAddress.parse("2001:db8::/32")),
				term.getAddressOfVersion(Term.AddressField.DESTINATION_ADDRESS, 6));
		assertEquals(7, term.addressesByteLength(Arrays.asList(4, 6)));
		assertEquals(3, term.addressesByteLength(Collections.singletonList(4)));
	}

	@Test
	public void testEqualityIgnoresNameAndOrder() {
		Term a = term("a", v(VarType.Kind.PROTOCOL, "tcp"), v(VarType.Kind.PROTOCOL, "udp"), v(VarType.Kind.ACTION, "accept"));
		Term b = term("b", v(VarType.Kind.ACTION, "accept"), v(VarType.Kind.PROTOCOL, "udp"), v(VarType.Kind.PROTOCOL, "tcp"));
		Term c = term("a", v(VarType.Kind.PROTOCOL, "tcp"), v(VarType.Kind.ACTION, "deny"));
		assertEquals(a, b);
		assertEquals(a.hashCode(), b.hashCode());
		assertNotEquals(a, c);
	}

	@Test
	public void testToString() {
		Term term = term("web", v(VarType.Kind.PROTOCOL, "tcp"), v(VarType.Kind.ACTION, "accept"));
		String text = term.toString();
		assertTrue(text.startsWith("name: web"));
		assertTrue(text.contains("protocol: [tcp]"));
		assertTrue(text.contains("action: [accept]"));
	}

	@Test
	public void testVarTypeComments() {
		assertEquals("one\ntwo", new VarType(VarType.Kind.COMMENT, "\"one\n    two\"").getString());
		assertEquals("  kept", new VarType(VarType.Kind.OWNER, "  kept").getString());
	}

	@Test
	public void testEmptyNamingStillResolvesNothing() {
		Term term = new Term();
		term.addObject(new VarType(VarType.Kind.PROTOCOL, "tcp"), new DefinitionsNaming());
		assertTrue(term.getAddress().isEmpty());
		assertFalse(term.hasPorts());
	}
}
