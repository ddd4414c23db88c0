package org.metricshub.jpol.addr;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class AddressListsTest {

	private static List<NetAddress> nets(String... texts) {
		List<NetAddress> result = new ArrayList<NetAddress>();
		for (String text : texts) {
			result.add(NetAddress.parse(text));
		}
		return result;
	}

	@Test
	public void testSort() {
		assertEquals(
				nets("10.0.0.0/8", "10.0.0.0/16", "192.168.0.0/16", "2001:db8::/32"),
				AddressLists.sort(nets("2001:db8::/32", "192.168.0.0/16", "10.0.0.0/16", "10.0.0.0/8")));
	}

	@Test
	public void testIsContained() {
		assertTrue(AddressLists.isContained(nets("10.0.0.0/8", "192.168.0.0/16"), nets("10.1.0.0/16", "192.168.1.1/32")));
		assertTrue(AddressLists.isContained(nets("10.0.0.0/8"), nets("10.0.0.0/8")));
		assertFalse(AddressLists.isContained(nets("10.0.0.0/8"), nets("10.1.0.0/16", "172.16.0.0/12")));
		assertFalse(AddressLists.isContained(nets("10.1.0.0/16"), nets("10.0.0.0/8")));
	}

	@Test
	public void testIsContainedWithEmptyLists() {
		assertTrue("an empty subset is always contained", AddressLists.isContained(nets("10.0.0.0/8"), nets()));
		assertTrue(AddressLists.isContained(nets(), nets()));
		assertFalse("an empty superset contains nothing", AddressLists.isContained(nets(), nets("10.0.0.0/8")));
	}

	@Test
	public void testIsContainedAcrossVersions() {
		assertFalse(AddressLists.isContained(nets("::/0"), nets("10.0.0.0/8")));
		assertFalse(AddressLists.isContained(nets("0.0.0.0/0"), nets("2001:db8::/32")));
		assertTrue(AddressLists.isContained(nets("0.0.0.0/0", "::/0"), nets("10.0.0.0/8", "2001:db8::/32")));
	}

	@Test
	public void testExclude() {
		assertEquals(nets("10.0.0.128/25"), AddressLists.exclude(nets("10.0.0.0/24"), nets("10.0.0.0/25")));
		assertTrue(AddressLists.exclude(nets("10.0.0.0/24"), nets("10.0.0.0/8")).isEmpty());
		assertEquals(
				"unrelated excludes change nothing",
				nets("10.0.0.0/24", "172.16.0.0/12"),
				AddressLists.exclude(nets("172.16.0.0/12", "10.0.0.0/24"), nets("192.168.0.0/16", "2001:db8::/32")));
		assertEquals(
				nets("10.0.0.0/25", "10.0.0.192/26"),
				AddressLists.exclude(nets("10.0.0.0/24"), nets("10.0.0.128/26", "10.0.0.128/27")));
	}

	@Test
	public void testCollapse() {
		assertEquals(nets("10.0.0.0/24"), AddressLists.collapse(nets("10.0.0.128/25", "10.0.0.0/25")));
		assertEquals(
				nets("10.0.0.0/23", "10.0.2.0/24"),
				AddressLists.collapse(nets("10.0.2.0/24", "10.0.1.0/24", "10.0.0.0/24")));
		assertEquals(nets("10.0.0.0/8"), AddressLists.collapse(nets("10.1.0.0/16", "10.0.0.0/8", "10.1.2.0/24")));
		assertEquals(
				nets("10.0.0.0/24", "2001:db8::/32"),
				AddressLists.collapse(nets("2001:db8::/33", "10.0.0.0/24", "2001:db8:8000::/33")));
		assertEquals(nets("10.0.0.0/8"), AddressLists.collapse(nets("10.0.0.0/8", "10.0.0.0/8")));
		assertTrue(AddressLists.collapse(Collections.<NetAddress>emptyList()).isEmpty());
	}

	@Test
	public void testCollapseIsIdempotent() {
		List<NetAddress> once = AddressLists.collapse(nets("10.0.0.0/25", "10.0.0.128/25", "10.0.1.0/24", "172.16.0.0/16"));
		assertEquals(nets("10.0.0.0/23", "172.16.0.0/16"), once);
		assertEquals(once, AddressLists.collapse(once));
	}

	@Test
	public void testCollapseKeepsNetworksSplitByComplement() {
		assertEquals(
				nets("10.0.0.0/8", "10.0.0.0/10"),
				AddressLists.collapse(nets("10.0.0.0/10", "10.0.0.0/8"), nets("10.0.0.0/9")));
		assertEquals(
				"a complement outside the container does not matter",
				nets("10.0.0.0/8"),
				AddressLists.collapse(nets("10.0.0.0/10", "10.0.0.0/8"), nets("192.168.0.0/16")));
	}

	@Test
	public void testMergedTokens() {
		List<NetAddress> same = AddressLists.collapse(Arrays.asList(
				NetAddress.parse("10.0.0.0/25", "LAN"),
				NetAddress.parse("10.0.0.128/25", "LAN")));
		assertEquals("LAN", same.get(0).getToken());

		List<NetAddress> different = AddressLists.collapse(Arrays.asList(
				NetAddress.parse("10.0.0.0/25", "LAN"),
				NetAddress.parse("10.0.0.128/25", "WLAN")));
		assertEquals(nets("10.0.0.0/24"), different);
		assertNull(different.get(0).getToken());
	}

	@Test
	public void testCollapsePreserveTokens() {
		List<NetAddress> collapsed = AddressLists.collapsePreserveTokens(Arrays.asList(
				NetAddress.parse("10.0.0.128/25", "WLAN"),
				NetAddress.parse("10.0.0.0/25", "LAN"),
				NetAddress.parse("10.1.0.0/25", "LAN"),
				NetAddress.parse("10.1.0.128/25", "LAN")));
		assertEquals(nets("10.0.0.0/25", "10.0.0.128/25", "10.1.0.0/24"), collapsed);
		assertEquals("LAN", collapsed.get(0).getToken());
		assertEquals("WLAN", collapsed.get(1).getToken());
		assertEquals("LAN", collapsed.get(2).getToken());
	}
}
