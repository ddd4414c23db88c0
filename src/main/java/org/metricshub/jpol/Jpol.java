package org.metricshub.jpol;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import org.metricshub.jpol.analysis.ShadingDetector;
import org.metricshub.jpol.analysis.TermNormalizer;
import org.metricshub.jpol.analysis.TermValidator;
import org.metricshub.jpol.frontend.IncludePreprocessor;
import org.metricshub.jpol.frontend.PolicyParser;
import org.metricshub.jpol.model.Filter;
import org.metricshub.jpol.model.Header;
import org.metricshub.jpol.model.Policy;
import org.metricshub.jpol.model.Target;
import org.metricshub.jpol.model.Term;
import org.metricshub.jpol.naming.DefinitionsNaming;
import org.metricshub.jpol.naming.Naming;
import org.metricshub.jpol.util.JpolLogger;
import org.metricshub.jpol.util.JpolSettings;
import org.metricshub.jpol.util.ParseContext;
import org.metricshub.jpol.util.PolicyFileSource;
import org.metricshub.jpol.util.PolicySource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and analysis of a policy.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Expand the <code>#include</code> directives of the policy text.
 * <li>Parse the expanded text, producing a {@link Policy} of filters whose
 * terms have their symbolic addresses resolved.
 * <li>Validate and normalize every term, unless the settings ask to preserve
 * the terms as parsed.
 * <li>Optionally, report the terms that an earlier term of the same filter
 * shades.
 * </ul>
 * The first error aborts the process with a {@link PolicyException}.
 * <p>
 * A Jpol instance may parse several policies, one after the other. Separate
 * instances, each with its own settings and naming service, may be used
 * concurrently.
 */
public class Jpol {

	private static final Logger LOG = JpolLogger.getLogger(Jpol.class);

	private static final String ADDRESS_BOOK_PLATFORM = "srx";
	private static final String ADDRESS_BOOK_OPTION = "object-group";

	private final JpolSettings settings;

	private Naming naming;

	/**
	 * Create a new instance of Jpol with the default settings. Names are
	 * resolved with the definitions of the settings' definitions directory,
	 * loaded on first use.
	 */
	public Jpol() {
		this(null, new JpolSettings());
	}

	/**
	 * Create a new instance of Jpol with the default settings.
	 *
	 * @param naming resolves symbolic addresses and services
	 */
	public Jpol(Naming naming) {
		this(naming, new JpolSettings());
	}

	/**
	 * Create a new instance of Jpol.
	 *
	 * @param naming resolves symbolic addresses and services, or
	 *        <code>null</code> to load the settings' definitions directory
	 * @param settings the parameters of the parses
	 */
	public Jpol(Naming naming, JpolSettings settings) {
		this.naming = naming;
		this.settings = settings;
	}

	/**
	 * @return the settings of this instance
	 */
	public JpolSettings getSettings() {
		return settings;
	}

	/**
	 * Parses a policy file.
	 *
	 * @param file path of the policy file, read as UTF-8
	 * @return the policy
	 * @throws PolicyFileNotFoundException when the file does not exist
	 * @throws FileReadException when the file cannot be read
	 * @throws PolicyException on any error in the policy
	 */
	public Policy parseFile(Path file) {
		return parse(new PolicyFileSource(file));
	}

	/**
	 * Parses a policy file.
	 *
	 * @param file path of the policy file, read as UTF-8
	 * @return the policy
	 * @throws PolicyException on any error in the policy
	 */
	public Policy parseFile(String file) {
		return parseFile(Paths.get(file));
	}

	/**
	 * Parses policy text.
	 *
	 * @param text the policy
	 * @return the policy
	 * @throws PolicyException on any error in the policy
	 */
	public Policy parseText(String text) {
		return parseText(text, null);
	}

	/**
	 * Parses policy text.
	 *
	 * @param text the policy
	 * @param filename name reported in error messages, or <code>null</code>
	 * @return the policy
	 * @throws PolicyException on any error in the policy
	 */
	public Policy parseText(String text, String filename) {
		return parse(PolicySource.fromText(filename, text));
	}

	/**
	 * Parses a policy, whatever its source.
	 *
	 * @param source where the policy text comes from
	 * @return the policy
	 * @throws PolicyException on any error in the policy
	 */
	public Policy parse(PolicySource source) {
		String filename = source.getDescription();
		if (LOG.isDebugEnabled()) {
			LOG.debug("Parsing {} with settings:\n{}", filename, settings.toDescriptionString());
		}
		String text = read(source);

		IncludePreprocessor preprocessor = new IncludePreprocessor(Paths.get(settings.getBaseDirectory()));
		List<String> lines = preprocessor.preprocess(text, settings.getIncludeDepth());

		Naming parseNaming = getNaming();
		PolicyParser parser = new PolicyParser(new ParseContext(settings, parseNaming, filename));
		Policy policy;
		try {
			policy = parser.parse(new StringReader(join(lines)));
		} catch (IOException e) {
			throw new FileReadException(filename, e);
		}
		LOG.debug("Parsed {} filter(s) from {}", policy.getFilters().size(), filename);

		if (!settings.isPreserveOriginal()) {
			translate(policy, parseNaming);
		}
		if (settings.isShadeCheck()) {
			ShadingDetector detector = new ShadingDetector();
			for (Filter filter : policy.getFilters()) {
				detector.detect(filter.getTerms());
			}
		}
		return policy;
	}

	/**
	 * Validates and normalizes the terms of every filter, in order. Once a
	 * header requires address books, the terms of every later filter keep
	 * their addresses grouped per name.
	 */
	private void translate(Policy policy, Naming parseNaming) {
		TermValidator validator = new TermValidator();
		TermNormalizer normalizer = new TermNormalizer(parseNaming, settings.isOptimize());
		boolean addressBook = false;
		for (Filter filter : policy.getFilters()) {
			addressBook = addressBook || needsAddressBook(filter.getHeader());
			for (Term term : filter.getTerms()) {
				if (term.isTranslated()) {
					continue;
				}
				validator.validate(term);
				normalizer.normalize(term, addressBook);
				term.setTranslated(true);
			}
		}
	}

	private static boolean needsAddressBook(Header header) {
		for (Target target : header.getTargets()) {
			if (ADDRESS_BOOK_PLATFORM.equals(target.getPlatform())) {
				return true;
			}
			for (String option : target.getOptions()) {
				if (ADDRESS_BOOK_OPTION.equals(option)) {
					return true;
				}
			}
		}
		return false;
	}

	private synchronized Naming getNaming() {
		if (naming == null) {
			naming = new DefinitionsNaming(Paths.get(settings.getDefinitionsDirectory()));
		}
		return naming;
	}

	private static String read(PolicySource source) {
		StringBuilder text = new StringBuilder();
		try (Reader reader = source.getReader(); BufferedReader lines = new BufferedReader(reader)) {
			String line;
			while ((line = lines.readLine()) != null) {
				text.append(line).append('\n');
			}
		} catch (IOException e) {
			throw new FileReadException(source.getDescription(), e);
		}
		return text.toString();
	}

	private static String join(List<String> lines) {
		StringBuilder text = new StringBuilder();
		for (String line : lines) {
			text.append(line).append('\n');
		}
		return text.toString();
	}
}
