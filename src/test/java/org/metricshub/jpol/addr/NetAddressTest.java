package org.metricshub.jpol.addr;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.Arrays;
import org.junit.Test;

public class NetAddressTest {

	private static NetAddress net(String text) {
		return NetAddress.parse(text);
	}

	@Test
	public void testParse() {
		NetAddress v4 = net("10.1.2.3/8");
		assertEquals(4, v4.getVersion());
		assertEquals(8, v4.getPrefixLength());
		assertEquals("host bits are masked", "10.0.0.0/8", v4.toString());
		assertNull(v4.getToken());

		assertEquals("192.168.1.1/32", net("192.168.1.1").toString());
		assertEquals("2001:db8::/32", net("2001:DB8:0:0::/32").toString());
		assertEquals(128, net("::1").getPrefixLength());
		assertEquals(6, net("::1").getVersion());
		assertEquals("NAME", NetAddress.parse("10.0.0.0/8", "NAME").getToken());
	}

	@Test
	public void testParseErrors() {
		assertThrows(IllegalArgumentException.class, () -> net("10.0.0.0/33"));
		assertThrows(IllegalArgumentException.class, () -> net("10.0.0.0/x"));
		assertThrows(IllegalArgumentException.class, () -> net("10.0.0"));
		assertThrows(IllegalArgumentException.class, () -> net("example.com"));
	}

	@Test
	public void testSubnets() {
		assertTrue(net("10.1.0.0/16").isSubnetOf(net("10.0.0.0/8")));
		assertTrue(net("10.0.0.0/8").isSubnetOf(net("10.0.0.0/8")));
		assertFalse(net("10.0.0.0/8").isSubnetOf(net("10.1.0.0/16")));
		assertFalse(net("11.0.0.0/16").isSubnetOf(net("10.0.0.0/8")));
		assertFalse("versions never mix", net("::/128").isSubnetOf(net("0.0.0.0/0")));
		assertTrue(net("0.0.0.0/0").contains(net("172.16.4.1")));
	}

	@Test
	public void testRange() {
		NetAddress net = net("10.0.0.0/30");
		assertEquals(BigInteger.valueOf(0x0A000000L), net.first());
		assertEquals(BigInteger.valueOf(0x0A000003L), net.last());
		assertEquals(net("10.0.0.0/29"), net.supernet());
		assertThrows(IllegalStateException.class, () -> net("0.0.0.0/0").supernet());
	}

	@Test
	public void testExcludeSplitsAroundTheHole() {
		assertEquals(
				Arrays.asList(net("10.0.0.0/25"), net("10.0.0.128/26")),
				net("10.0.0.0/24").exclude(net("10.0.0.192/26")));
		assertEquals(
				Arrays.asList(net("10.0.0.64/26"), net("10.0.0.128/25")),
				net("10.0.0.0/24").exclude(net("10.0.0.0/26")));
		assertTrue(net("10.0.0.0/24").exclude(net("10.0.0.0/24")).isEmpty());
		assertThrows(IllegalArgumentException.class, () -> net("10.0.0.0/24").exclude(net("10.0.1.0/24")));
	}

	@Test
	public void testExcludeKeepsToken() {
		for (NetAddress piece : NetAddress.parse("10.0.0.0/24", "LAN").exclude(net("10.0.0.1"))) {
			assertEquals("LAN", piece.getToken());
		}
	}

	@Test
	public void testOrderingAndEquality() {
		assertTrue(net("10.0.0.0/8").compareTo(net("10.0.0.0/16")) < 0);
		assertTrue(net("9.0.0.0/8").compareTo(net("10.0.0.0/8")) < 0);
		assertTrue("IPv4 sorts before IPv6", net("255.0.0.0/8").compareTo(net("::/0")) < 0);
		assertEquals("tokens do not matter", NetAddress.parse("10.0.0.0/8", "A"), NetAddress.parse("10.0.0.0/8", "B"));
		assertEquals(NetAddress.parse("10.0.0.0/8", "A").hashCode(), net("10.0.0.0/8").hashCode());
		assertEquals("T", net("10.0.0.0/8").withToken("T").getToken());
	}
}
