package pyken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.apache.commons.io.FileUtils;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class PyKenOptionsTest {

	private Path tempDirPath;

	@Before
	public void setup() throws IOException {
		tempDirPath = Files.createTempDirectory("pykentest");
	}

	@After
	public void teardown() throws IOException {
		FileUtils.deleteDirectory(tempDirPath.toFile());
	}

	private PyKenOptions parse(String... args) throws PyKenOptionException {
		PyKenOptions options = new PyKenOptions(args);
		options.parse();
		return options;
	}

	private String config(String json) throws IOException {
		Path path = tempDirPath.resolve("pyken.json");
		FileUtils.writeStringToFile(path.toFile(), json, StandardCharsets.UTF_8);
		return path.toString();
	}

	// with no other option the output is written next to the input
	@Test
	public void testOutputNextToInput() throws PyKenOptionException {
		PyKenOptions options = parse("contracts/vault.json");
		assertThat(options.inputFilePath, is("contracts/vault.json"));
		assertThat(options.getOutputFilePath(), is(Paths.get("contracts/vault.ak")));
	}

	@Test
	public void testConfiguredOutputDirectory() throws PyKenOptionException, IOException {
		String configPath = config("{\"build\": {\"output_dir\": \"out\", \"extension\": \".aiken\"}}");
		PyKenOptions options = parse("-c", configPath, "contracts/vault.json");
		assertThat(options.getOutputFilePath(), is(Paths.get("out", "vault.aiken")));
	}

	// -o wins over the configuration file
	@Test
	public void testExplicitOutputWins() throws PyKenOptionException, IOException {
		String configPath = config("{\"build\": {\"output_dir\": \"out\"}}");
		PyKenOptions options = parse("-c", configPath, "-o", "elsewhere/v.ak", "contracts/vault.json");
		assertThat(options.getOutputFilePath(), is(Paths.get("elsewhere/v.ak")));
	}

	@Test
	public void testEmptyBuildSectionKeepsDefaults() throws PyKenOptionException, IOException {
		PyKenOptions options = parse("-c", config("{}"), "vault.json");
		assertThat(options.build.extension, is(PyKenBuildOptions.DEFAULT_EXTENSION));
		assertThat(options.build.outputDir, is(nullValue()));
	}

	@Test
	public void testFlags() throws PyKenOptionException {
		PyKenOptions options = parse("-q", "vault.json");
		assertTrue(options.quiet);
		assertFalse(options.verbose);
	}

	@Test
	public void testHelpNeedsNoInput() throws PyKenOptionException {
		assertTrue(parse("-h").help);
	}

	@Test(expected = PyKenOptionException.class)
	public void testMissingInput() throws PyKenOptionException {
		parse();
	}

	@Test(expected = PyKenOptionException.class)
	public void testTwoInputs() throws PyKenOptionException {
		parse("a.json", "b.json");
	}

	@Test(expected = PyKenOptionException.class)
	public void testUnknownOption() throws PyKenOptionException {
		parse("--no-such-option", "a.json");
	}

	@Test(expected = PyKenOptionException.class)
	public void testMissingConfigFile() throws PyKenOptionException {
		parse("-c", tempDirPath.resolve("missing.json").toString(), "a.json");
	}

	@Test(expected = PyKenOptionException.class)
	public void testMalformedConfigFile() throws PyKenOptionException, IOException {
		parse("-c", config("{\"build\": "), "a.json");
	}

}
