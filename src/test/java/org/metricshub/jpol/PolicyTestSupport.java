package org.metricshub.jpol;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.jpol.model.Filter;
import org.metricshub.jpol.model.Policy;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.naming.DefinitionsNaming;
import org.metricshub.jpol.util.JpolSettings;

/**
 * Reusable helpers for building and executing Jpol tests. Tests describe the
 * policy text, the network and service definitions it refers to, the settings
 * and the expected outcome with the fluent builder returned by
 * {@link #policyTest(String)}, then run it through {@link Jpol}.
 */
public final class PolicyTestSupport {

	/**
	 * Definitions most tests rely on.
	 */
	private static final String[][] DEFAULT_NETWORKS = {
			{ "ANY", "0.0.0.0/0" },
			{ "INTERNAL", "10.0.0.0/8" },
			{ "DMZ", "192.168.1.0/24" },
			{ "WEB_SERVERS", "10.1.1.0/24" },
			{ "DNS_SERVERS", "10.2.2.53/32", "10.2.3.53/32" } };

	private static final String[][] DEFAULT_SERVICES = {
			{ "HTTP", "80/tcp" },
			{ "HTTPS", "443/tcp" },
			{ "WEB", "HTTP", "HTTPS" },
			{ "DNS", "53/tcp", "53/udp" },
			{ "HIGH_PORTS", "1024-65535/tcp", "1024-65535/udp" } };

	private PolicyTestSupport() {}

	/**
	 * Creates a builder for a test that parses a policy with {@link Jpol}.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static PolicyTestBuilder policyTest(String description) {
		return new PolicyTestBuilder(description);
	}

	/**
	 * A naming service holding the default definitions.
	 *
	 * @return a new naming service
	 */
	public static DefinitionsNaming defaultNaming() {
		DefinitionsNaming naming = new DefinitionsNaming();
		for (String[] network : DEFAULT_NETWORKS) {
			naming.addNetwork(network[0], Arrays.copyOfRange(network, 1, network.length));
		}
		for (String[] service : DEFAULT_SERVICES) {
			naming.addService(service[0], Arrays.copyOfRange(service, 1, service.length));
		}
		return naming;
	}

	/**
	 * Wraps terms into a minimal policy with a <code>mock</code> target.
	 *
	 * @param terms the term blocks
	 * @return the policy text
	 */
	public static String filter(String... terms) {
		StringBuilder text = new StringBuilder("header {\n  target:: mock\n}\n");
		for (String term : terms) {
			text.append(term).append('\n');
		}
		return text.toString();
	}

	/**
	 * Parses terms with the default definitions, without validating or
	 * normalizing them.
	 *
	 * @param terms the term blocks
	 * @return the terms, as the parser built them
	 */
	public static List<Term> parseTerms(String... terms) {
		JpolSettings settings = new JpolSettings();
		settings.setPreserveOriginal(true);
		return new Jpol(defaultNaming(), settings).parseText(filter(terms)).getFilters().get(0).getTerms();
	}

	/**
	 * @param body the attribute lines of a term named <code>t</code>
	 * @return the term, as the parser built it
	 */
	public static Term parseTerm(String body) {
		return parseTerms("term t {\n" + body + "\n}").get(0);
	}

	/**
	 * Fluent builder for policy tests.
	 */
	public static final class PolicyTestBuilder {
		private final String description;
		private final DefinitionsNaming naming = defaultNaming();
		private final JpolSettings settings = new JpolSettings();
		private String policyText;
		private Class<? extends Throwable> expectedException;

		private PolicyTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * @param text the policy text to parse
		 * @return this builder for method chaining
		 */
		public PolicyTestBuilder policy(String text) {
			this.policyText = text;
			return this;
		}

		/**
		 * Defines a network, on top of the default definitions.
		 *
		 * @param name network name
		 * @param values addresses or network names
		 * @return this builder for method chaining
		 */
		public PolicyTestBuilder network(String name, String... values) {
			naming.addNetwork(name, values);
			return this;
		}

		/**
		 * Defines a service, on top of the default definitions.
		 *
		 * @param name service name
		 * @param values <code>port/protocol</code> or service names
		 * @return this builder for method chaining
		 */
		public PolicyTestBuilder service(String name, String... values) {
			naming.addService(name, values);
			return this;
		}

		public PolicyTestBuilder optimize(boolean optimize) {
			settings.setOptimize(optimize);
			return this;
		}

		public PolicyTestBuilder shadeCheck(boolean shadeCheck) {
			settings.setShadeCheck(shadeCheck);
			return this;
		}

		public PolicyTestBuilder preserveOriginal(boolean preserveOriginal) {
			settings.setPreserveOriginal(preserveOriginal);
			return this;
		}

		public PolicyTestBuilder baseDirectory(Path baseDirectory) {
			settings.setBaseDirectory(baseDirectory.toString());
			return this;
		}

		/**
		 * @param exception the exception parsing must fail with
		 * @return this builder for method chaining
		 */
		public PolicyTestBuilder expectThrow(Class<? extends Throwable> exception) {
			this.expectedException = exception;
			return this;
		}

		/**
		 * @return the configured test
		 */
		public PolicyTestCase build() {
			if (policyText == null) {
				throw new IllegalStateException("No policy text for " + description);
			}
			return new PolicyTestCase(description, policyText, naming, settings, expectedException);
		}
	}

	/**
	 * A configured policy test, ready to run.
	 */
	public static final class PolicyTestCase {
		private final String description;
		private final String policyText;
		private final DefinitionsNaming naming;
		private final JpolSettings settings;
		private final Class<? extends Throwable> expectedException;

		private PolicyTestCase(
				String description,
				String policyText,
				DefinitionsNaming naming,
				JpolSettings settings,
				Class<? extends Throwable> expectedException) {
			this.description = description;
			this.policyText = policyText;
			this.naming = naming;
			this.settings = settings;
			this.expectedException = expectedException;
		}

		/**
		 * Parses the policy, letting any exception through.
		 *
		 * @return the policy
		 */
		public Policy run() {
			return new Jpol(naming, settings).parseText(policyText, description);
		}

		/**
		 * Parses the policy and checks the outcome against the expected
		 * exception, if any.
		 *
		 * @return the result, holding the policy when parsing succeeded
		 */
		public TestResult runAndAssert() {
			Policy policy = null;
			Throwable thrown = null;
			try {
				policy = run();
			} catch (RuntimeException e) {
				thrown = e;
			}
			TestResult result = new TestResult(description, policy, thrown);
			result.assertExpected(expectedException);
			return result;
		}
	}

	/**
	 * Captures the outcome of a policy test.
	 */
	public static final class TestResult {
		private final String description;
		private final Policy policy;
		private final Throwable thrownException;

		TestResult(String description, Policy policy, Throwable thrownException) {
			this.description = description;
			this.policy = policy;
			this.thrownException = thrownException;
		}

		public Policy policy() {
			return policy;
		}

		public Throwable thrownException() {
			return thrownException;
		}

		/**
		 * @param filter index of the filter
		 * @return the terms of that filter
		 */
		public List<Term> terms(int filter) {
			return policy.getFilters().get(filter).getTerms();
		}

		/**
		 * @return the terms of the first filter
		 */
		public List<Term> terms() {
			return terms(0);
		}

		/**
		 * @return the first term of the first filter
		 */
		public Term term() {
			return terms().get(0);
		}

		/**
		 * @return the names of the terms of every filter, in order
		 */
		public List<String> termNames() {
			if (policy == null) {
				return Collections.emptyList();
			}
			List<String> names = new ArrayList<String>();
			for (Filter filter : policy.getFilters()) {
				for (Term term : filter.getTerms()) {
					names.add(term.getName());
				}
			}
			return names;
		}

		void assertExpected(Class<? extends Throwable> expectedException) {
			if (expectedException != null) {
				if (thrownException == null) {
					throw new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but parsing completed successfully");
				}
				if (!expectedException.isInstance(thrownException)) {
					AssertionError error = new AssertionError(
							"Expected exception "
									+ expectedException.getName()
									+ " for "
									+ description
									+ " but got "
									+ thrownException.getClass().getName());
					error.initCause(thrownException);
					throw error;
				}
				return;
			}
			if (thrownException != null) {
				AssertionError error = new AssertionError(
						"Unexpected exception for " + description + ": " + thrownException);
				error.initCause(thrownException);
				throw error;
			}
		}
	}
}
