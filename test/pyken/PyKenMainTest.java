package pyken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

@RunWith(Parameterized.class)
public class PyKenMainTest {

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{ "vault" },
		});
	}

	private String fixture;
	private Path tempDirPath;

	public PyKenMainTest(String fixture) {
		this.fixture = fixture;
	}

	@Before
	public void setup() throws IOException {
		tempDirPath = Files.createTempDirectory("pykentest");
	}

	@After
	public void teardown() throws IOException {
		FileUtils.deleteDirectory(tempDirPath.toFile());
	}

	private static String resource(String name) throws IOException {
		try (InputStream in = PyKenMainTest.class.getResourceAsStream("/fixtures/" + name)) {
			assertNotNull("missing fixture " + name, in);
			return IOUtils.toString(in, StandardCharsets.UTF_8);
		}
	}

	@Test
	public void test() throws IOException {
		Path input = tempDirPath.resolve(fixture + ".json");
		Path output = tempDirPath.resolve(fixture + ".ak");
		FileUtils.writeStringToFile(input.toFile(), resource(fixture + ".json"), StandardCharsets.UTF_8);

		assertTrue(new PyKenMain(new String[]{"-q", "-o", output.toString(), input.toString()}).run());
		assertThat(FileUtils.readFileToString(output.toFile(), StandardCharsets.UTF_8),
				is(resource(fixture + ".ak")));
	}

	@Test
	public void defaultOutputPath() throws IOException {
		Path input = tempDirPath.resolve(fixture + ".json");
		FileUtils.writeStringToFile(input.toFile(), resource(fixture + ".json"), StandardCharsets.UTF_8);

		assertTrue(new PyKenMain(new String[]{"-q", input.toString()}).run());
		assertTrue(Files.exists(tempDirPath.resolve(fixture + ".ak")));
	}

	@Test
	public void malformedInputFails() throws IOException {
		Path input = tempDirPath.resolve("broken.json");
		Path output = tempDirPath.resolve("broken.ak");
		FileUtils.writeStringToFile(input.toFile(), "{\"_type\": \"Module\", \"body\": [", StandardCharsets.UTF_8);

		assertFalse(new PyKenMain(new String[]{"-q", "-o", output.toString(), input.toString()}).run());
		assertFalse(Files.exists(output));
	}

	@Test
	public void missingInputFails() {
		assertFalse(new PyKenMain(new String[]{"-q", tempDirPath.resolve("absent.json").toString()}).run());
	}

}
