package org.metricshub.jpol.model;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class HeaderTest {

	@Test
	public void testFilterName() {
		Header header = new Header();
		header.addObject(new Target("juniper", Arrays.asList("edge-in", "inet")));
		header.addObject(new Target("srx", Arrays.asList("from-zone", "trust", "to-zone", "untrust")));
		header.addObject(new Target("paloalto", Collections.singletonList("short")));
		header.addObject(new Target("mock", Collections.<String>emptyList()));

		assertEquals(Arrays.asList("juniper", "srx", "paloalto", "mock"), header.getPlatforms());
		assertEquals("edge-in", header.getFilterName("juniper"));
		assertEquals("trust>untrust", header.getFilterName("srx"));
		assertEquals("short", header.getFilterName("paloalto"));
		assertNull(header.getFilterName("mock"));
		assertNull(header.getFilterName("cisco"));
		assertTrue(header.getFilterOptions("cisco").isEmpty());
	}

	@Test
	public void testAttributes() {
		Header header = new Header();
		header.addObject(Arrays.asList(
				new VarType(VarType.Kind.COMMENT, "\"edge filter\""),
				new VarType(VarType.Kind.APPLY_GROUPS, "base"),
				new VarType(VarType.Kind.APPLY_GROUPS_EXCEPT, "lab")));
		assertEquals(Collections.singletonList("edge filter"), header.getComments());
		assertEquals(Collections.singletonList("base"), header.getApplyGroups());
		assertEquals(Collections.singletonList("lab"), header.getApplyGroupsExcept());

		assertThrows(TermObjectTypeException.class, () -> header.addObject(new VarType(VarType.Kind.ACTION, "accept")));
		assertThrows(UnsupportedOperationException.class, () -> header.getComments().add("sneaky"));
	}

	@Test
	public void testPolicyRequiresTerms() {
		Policy policy = new Policy("p.pol");
		assertThrows(NoTermsException.class, () -> policy.addFilter(new Header(), Collections.<Term>emptyList()));
		policy.addFilter(new Header(), Collections.singletonList(new Term()));
		assertEquals(1, policy.getFilters().size());
		assertThrows(UnsupportedOperationException.class, () -> policy.getFilters().clear());
	}

	@Test
	public void testTargetOptionsAreCopied() {
		List<String> options = new ArrayList<String>(Arrays.asList("a", "b"));
		Target target = new Target("mock", options);
		options.add("c");
		assertEquals(Arrays.asList("a", "b"), target.getOptions());
	}
}
