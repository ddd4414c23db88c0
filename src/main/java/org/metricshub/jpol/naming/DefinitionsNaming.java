package org.metricshub.jpol.naming;

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
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jpol.FileReadException;
import org.metricshub.jpol.PolicyFileNotFoundException;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.util.JpolLogger;
import org.metricshub.jpol.util.PolicyFileSource;
import org.metricshub.jpol.util.PolicySource;
import org.slf4j.Logger;

/**
 * {@link Naming} backed by definition files.
 * <p>
 * Network definitions live in <code>*.net</code> files and service definitions
 * in <code>*.svc</code> files, both with the same layout:
 *
 * <pre>
 * INTERNAL = 10.0.0.0/8      # comment
 *            172.16.0.0/12
 *            OTHER_NETWORK
 * WEB      = 80/tcp 443/tcp
 * HIGH     = 1024-65535/udp
 * </pre>
 *
 * A line starting with whitespace continues the previous definition.
 * Values are either literals (addresses, or <code>port/protocol</code>) or
 * the names of other definitions, resolved recursively. When a name is
 * defined twice, the last definition wins.
 * <p>
 * Definitions can also be added programmatically, which is what embedders
 * and tests without definition files do.
 */
public class DefinitionsNaming implements Naming {

	private static final Logger LOG = JpolLogger.getLogger(DefinitionsNaming.class);

	private final Map<String, List<String>> networks = new HashMap<String, List<String>>();
	private final Map<String, List<String>> services = new HashMap<String, List<String>>();

	/**
	 * Creates a naming service without any definition.
	 */
	public DefinitionsNaming() {}

	/**
	 * Creates a naming service from every <code>*.net</code> and
	 * <code>*.svc</code> file of <code>directory</code>, read in file name order.
	 *
	 * @param directory the definitions directory
	 * @throws PolicyFileNotFoundException if the directory does not exist
	 * @throws FileReadException if a file cannot be read
	 */
	public DefinitionsNaming(Path directory) {
		if (!Files.isDirectory(directory)) {
			throw new PolicyFileNotFoundException(directory.toString());
		}
		List<Path> files = new ArrayList<Path>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.{net,svc}")) {
			for (Path file : stream) {
				files.add(file);
			}
		} catch (IOException e) {
			throw new FileReadException(directory.toString(), e);
		}
		Collections.sort(files);
		for (Path file : files) {
			PolicyFileSource source = new PolicyFileSource(file);
			if (file.getFileName().toString().endsWith(".net")) {
				parseNetworkDefinitions(source);
			} else {
				parseServiceDefinitions(source);
			}
		}
		LOG.debug("Loaded {} network and {} service definitions from {}", networks.size(), services.size(), directory);
	}

	/**
	 * Defines (or redefines) a network.
	 *
	 * @param name the network name
	 * @param values address literals or names of other networks
	 * @return this naming service
	 */
	public DefinitionsNaming addNetwork(String name, String... values) {
		define(networks, "network", name, new ArrayList<String>(Arrays.asList(values)));
		return this;
	}

	/**
	 * Defines (or redefines) a service.
	 *
	 * @param name the service name
	 * @param values <code>port/protocol</code> literals or names of other services
	 * @return this naming service
	 */
	public DefinitionsNaming addService(String name, String... values) {
		define(services, "service", name, new ArrayList<String>(Arrays.asList(values)));
		return this;
	}

	/**
	 * Reads network definitions.
	 *
	 * @param source the definitions
	 * @throws DefinitionFormatException on a malformed line
	 * @throws FileReadException if the source cannot be read
	 */
	public void parseNetworkDefinitions(PolicySource source) {
		parseDefinitions(source, networks, "network");
	}

	/**
	 * Reads service definitions.
	 *
	 * @param source the definitions
	 * @throws DefinitionFormatException on a malformed line
	 * @throws FileReadException if the source cannot be read
	 */
	public void parseServiceDefinitions(PolicySource source) {
		parseDefinitions(source, services, "service");
	}

	private void parseDefinitions(PolicySource source, Map<String, List<String>> definitions, String kind) {
		String currentName = null;
		List<String> currentValues = null;
		int lineNumber = 0;
		try (Reader reader = source.getReader(); BufferedReader lines = new BufferedReader(reader)) {
			String line;
			while ((line = lines.readLine()) != null) {
				lineNumber++;
				int hash = line.indexOf('#');
				String content = hash >= 0 ? line.substring(0, hash) : line;
				if (content.trim().isEmpty()) {
					continue;
				}
				if (Character.isWhitespace(content.charAt(0))) {
					if (currentValues == null) {
						throw new DefinitionFormatException(
								"Continuation line without a definition",
								source.getDescription(),
								lineNumber);
					}
					currentValues.addAll(splitValues(content));
					continue;
				}
				int equals = content.indexOf('=');
				if (equals < 0) {
					throw new DefinitionFormatException(
							"Expecting NAME = VALUES. Found: " + content.trim(),
							source.getDescription(),
							lineNumber);
				}
				if (currentName != null) {
					define(definitions, kind, currentName, currentValues);
				}
				currentName = content.substring(0, equals).trim();
				if (currentName.isEmpty()) {
					throw new DefinitionFormatException("Missing definition name", source.getDescription(), lineNumber);
				}
				currentValues = splitValues(content.substring(equals + 1));
			}
		} catch (IOException e) {
			throw new FileReadException(source.getDescription(), e);
		}
		if (currentName != null) {
			define(definitions, kind, currentName, currentValues);
		}
	}

	private static List<String> splitValues(String text) {
		List<String> values = new ArrayList<String>();
		for (String value : text.trim().split("\\s+")) {
			if (!value.isEmpty()) {
				values.add(value);
			}
		}
		return values;
	}

	private static void define(Map<String, List<String>> definitions, String kind, String name, List<String> values) {
		if (definitions.put(name, values) != null) {
			LOG.warn("{} {} is defined more than once, keeping the last definition", kind, name);
		}
	}

	/** {@inheritDoc} */
	@Override
	public List<NetAddress> getNetAddr(String name) {
		List<NetAddress> result = new ArrayList<NetAddress>();
		resolveNetwork(name, result, new ArrayDeque<String>());
		return result;
	}

	private void resolveNetwork(String name, List<NetAddress> result, Deque<String> resolving) {
		List<String> values = networks.get(name);
		if (values == null) {
			throw new UndefinedAddressException("Network " + name + " is not defined");
		}
		if (resolving.contains(name)) {
			throw new UndefinedAddressException("Network " + name + " is defined in terms of itself: " + resolving);
		}
		resolving.push(name);
		for (String value : values) {
			if (isAddressLiteral(value)) {
				try {
					result.add(NetAddress.parse(value, name));
				} catch (IllegalArgumentException e) {
					throw new UndefinedAddressException("Network " + name + " has an invalid address " + value + ": " + e.getMessage());
				}
			} else {
				resolveNetwork(value, result, resolving);
			}
		}
		resolving.pop();
	}

	private static boolean isAddressLiteral(String value) {
		return Character.isDigit(value.charAt(0)) || value.indexOf(':') >= 0;
	}

	/** {@inheritDoc} */
	@Override
	public List<String> getServiceByProto(String name, String protocol) {
		Set<String> ports = new LinkedHashSet<String>();
		resolveService(name, protocol, ports, new ArrayDeque<String>());
		return new ArrayList<String>(ports);
	}

	private void resolveService(String name, String protocol, Set<String> ports, Deque<String> resolving) {
		List<String> values = services.get(name);
		if (values == null) {
			throw new UndefinedServiceException("Service " + name + " is not defined");
		}
		if (resolving.contains(name)) {
			throw new UndefinedServiceException("Service " + name + " is defined in terms of itself: " + resolving);
		}
		resolving.push(name);
		for (String value : values) {
			int slash = value.indexOf('/');
			if (slash >= 0) {
				if (value.substring(slash + 1).equals(protocol)) {
					ports.add(value.substring(0, slash));
				}
			} else {
				resolveService(value, protocol, ports, resolving);
			}
		}
		resolving.pop();
	}
}
