package org.metricshub.jpol.naming;

import static org.junit.Assert.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jpol.PolicyFileNotFoundException;
import org.metricshub.jpol.addr.NetAddress;
import org.metricshub.jpol.util.PolicySource;

public class DefinitionsNamingTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testNetworkResolution() {
		DefinitionsNaming naming = new DefinitionsNaming()
				.addNetwork("WEB", "10.1.1.0/24", "2001:db8:1::/48")
				.addNetwork("DB", "10.2.2.10")
				.addNetwork("SERVERS", "WEB", "DB");
		assertEquals(
				Arrays.asList(NetAddress.parse("10.1.1.0/24"), NetAddress.parse("2001:db8:1::/48"), NetAddress.parse("10.2.2.10/32")),
				naming.getNetAddr("SERVERS"));
		assertEquals("addresses carry the name that defines them", "DB", naming.getNetAddr("SERVERS").get(2).getToken());
	}

	@Test
	public void testNetworkErrors() {
		DefinitionsNaming naming = new DefinitionsNaming()
				.addNetwork("LOOP_A", "LOOP_B")
				.addNetwork("LOOP_B", "LOOP_A")
				.addNetwork("BROKEN", "10.0.0.0/40");
		assertThrows(UndefinedAddressException.class, () -> naming.getNetAddr("UNKNOWN"));
		assertThrows(UndefinedAddressException.class, () -> naming.getNetAddr("LOOP_A"));
		assertThrows(UndefinedAddressException.class, () -> naming.getNetAddr("BROKEN"));
	}

	@Test
	public void testServiceResolution() {
		DefinitionsNaming naming = new DefinitionsNaming()
				.addService("HTTP", "80/tcp")
				.addService("HTTPS", "443/tcp", "443/udp")
				.addService("WEB", "HTTP", "HTTPS", "HTTP")
				.addService("HIGH", "1024-65535/tcp");
		assertEquals(Arrays.asList("80", "443"), naming.getServiceByProto("WEB", "tcp"));
		assertEquals(Collections.singletonList("443"), naming.getServiceByProto("WEB", "udp"));
		assertTrue(naming.getServiceByProto("HTTP", "udp").isEmpty());
		assertEquals(Collections.singletonList("1024-65535"), naming.getServiceByProto("HIGH", "tcp"));
		assertThrows(UndefinedServiceException.class, () -> naming.getServiceByProto("FTP", "tcp"));
	}

	@Test
	public void testDefinitionFormat() {
		DefinitionsNaming naming = new DefinitionsNaming();
		naming.parseNetworkDefinitions(PolicySource.fromText(
				"networks.net",
				"# internal networks\n"
						+ "INTERNAL = 10.0.0.0/8      # RFC 1918\n"
						+ "           172.16.0.0/12\n"
						+ "\n"
						+ "           192.168.0.0/16\n"
						+ "GUEST = 10.9.0.0/16\n"
						+ "GUEST = 10.8.0.0/16\n"));
		assertEquals(3, naming.getNetAddr("INTERNAL").size());
		assertEquals("the last definition wins", Collections.singletonList(NetAddress.parse("10.8.0.0/16")), naming.getNetAddr("GUEST"));

		DefinitionFormatException orphan = assertThrows(
				DefinitionFormatException.class,
				() -> naming.parseServiceDefinitions(PolicySource.fromText("services.svc", "  80/tcp\n")));
		assertEquals(1, orphan.getLineNumber());
		DefinitionFormatException noEquals = assertThrows(
				DefinitionFormatException.class,
				() -> naming.parseServiceDefinitions(PolicySource.fromText("services.svc", "HTTP = 80/tcp\nHTTPS 443/tcp\n")));
		assertEquals(2, noEquals.getLineNumber());
	}

	@Test
	public void testDirectory() throws Exception {
		File directory = folder.newFolder("def");
		Files.write(new File(directory, "a.net").toPath(), "LAN = 10.0.0.0/24\n".getBytes(StandardCharsets.UTF_8));
		Files.write(new File(directory, "b.net").toPath(), "ALL = LAN 10.0.1.0/24\n".getBytes(StandardCharsets.UTF_8));
		Files.write(new File(directory, "web.svc").toPath(), "HTTP = 80/tcp\n".getBytes(StandardCharsets.UTF_8));
		Files.write(new File(directory, "notes.txt").toPath(), "NOT = parsed\n".getBytes(StandardCharsets.UTF_8));

		DefinitionsNaming naming = new DefinitionsNaming(directory.toPath());
		assertEquals(2, naming.getNetAddr("ALL").size());
		assertEquals(Collections.singletonList("80"), naming.getServiceByProto("HTTP", "tcp"));
		assertThrows(UndefinedAddressException.class, () -> naming.getNetAddr("NOT"));
	}

	@Test
	public void testMissingDirectory() {
		assertThrows(
				PolicyFileNotFoundException.class,
				() -> new DefinitionsNaming(new File(folder.getRoot(), "missing").toPath()));
	}
}
