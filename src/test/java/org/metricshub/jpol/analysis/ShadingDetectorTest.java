package org.metricshub.jpol.analysis;

import static org.junit.Assert.*;
import static org.metricshub.jpol.PolicyTestSupport.filter;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.jpol.Jpol;
import org.metricshub.jpol.PolicyTestSupport;
import org.metricshub.jpol.frontend.ParserException;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.model.VarType;

public class ShadingDetectorTest {

	private final ShadingDetector detector = new ShadingDetector();

	private static List<Term> terms(String... blocks) {
		return new Jpol(PolicyTestSupport.defaultNaming()).parseText(filter(blocks)).getFilters().get(0).getTerms();
	}

	@Test
	public void testShadedTerm() {
		List<Term> terms = terms(
				"term all-tcp { protocol:: tcp action:: accept }",
				"term web { protocol:: tcp destination-port:: HTTP action:: deny }");
		List<Shading> shadings = detector.detect(terms);
		assertEquals(1, shadings.size());
		assertSame(terms.get(1), shadings.get(0).getShadedTerm());
		assertSame(terms.get(0), shadings.get(0).getShadingTerm());
		assertEquals("web is shaded by all-tcp", shadings.get(0).toString());
	}

	@Test
	public void testNoShading() {
		assertTrue(detector.detect(terms(
				"term web { protocol:: tcp destination-port:: HTTP action:: accept }",
				"term all-tcp { protocol:: tcp action:: deny }")).isEmpty());
		assertTrue(detector.detect(terms("term only { action:: accept }")).isEmpty());
		assertTrue(detector.detect(Collections.<Term>emptyList()).isEmpty());
	}

	@Test
	public void testNextActionDoesNotShade() {
		assertTrue(detector.detect(terms(
				"term count-tcp { protocol:: tcp action:: next }",
				"term web { protocol:: tcp destination-port:: HTTP action:: accept }")).isEmpty());
	}

	@Test
	public void testEveryShadingTermIsReported() {
		List<Shading> shadings = detector.detect(terms(
				"term internal { source-address:: INTERNAL action:: accept }",
				"term web-servers { source-address:: WEB_SERVERS action:: deny }",
				"term web-http { source-address:: WEB_SERVERS protocol:: tcp destination-port:: HTTP action:: reject }"));
		assertEquals(3, shadings.size());
		assertEquals("web-servers is shaded by internal", shadings.get(0).toString());
		assertEquals("web-http is shaded by internal", shadings.get(1).toString());
		assertEquals("web-http is shaded by web-servers", shadings.get(2).toString());
	}

	private static Term term(String name, String packetLength) {
		Term term = new Term();
		term.setName(name);
		term.addObject(new VarType(VarType.Kind.ACTION, "accept"), PolicyTestSupport.defaultNaming());
		term.addObject(new VarType(VarType.Kind.PACKET_LEN, packetLength), PolicyTestSupport.defaultNaming());
		return term;
	}

	@Test
	public void testRangesWrittenBackwards() {
		List<Shading> shadings = detector.detect(Arrays.asList(term("wide", "100-50"), term("narrow", "60")));
		assertEquals(1, shadings.size());
		assertEquals("narrow is shaded by wide", shadings.get(0).toString());
		assertTrue(detector.detect(Arrays.asList(term("odd", "large"), term("narrow", "60"))).isEmpty());
	}

	@Test
	public void testShadeCheckWithReversedRange() {
		PolicyTestSupport.policyTest("reversed range")
				.policy(filter(
						"term a { packet-length:: 100-50 action:: accept }",
						"term b { packet-length:: 60 action:: accept }"))
				.shadeCheck(true)
				.expectThrow(ParserException.class)
				.build()
				.runAndAssert();
	}

	@Test
	public void testCustomContainment() {
		ShadingDetector never = new ShadingDetector(new TermContainment() {
			@Override
			public boolean contains(Term a, Term b) {
				return false;
			}
		});
		assertTrue(never.detect(terms(
				"term a { action:: accept }",
				"term b { action:: accept }")).isEmpty());
	}
}
