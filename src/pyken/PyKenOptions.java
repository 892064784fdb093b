package pyken;

import org.apache.commons.io.FileUtils;
import org.apache.commons.io.FilenameUtils;
import org.json.JSONException;
import org.json.JSONObject;
import org.plumelib.options.Option;
import org.plumelib.options.Options;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;

public class PyKenOptions {
	public static final String VERSION = "0.1.0";

	@Option(value = "Print the version and exit", aliases = {"-version"})
	public boolean version = false;

	@Option(value = "-h Print usage information", aliases = {"-help"})
	public boolean help = false;

	@Option(value = "-q Reduce printing during execution", aliases = {"-quiet"})
	public boolean quiet = false;

	/**
	 * Be verbose, print extra detailed information. Sets the log level to FINE.
	 */
	@Option(value = "-v Print detailed information during execution", aliases = {"-verbose"})
	public boolean verbose = false;

	@Option(value = "Fail instead of writing output when any construct was translated in a degraded way")
	public boolean warningsAsErrors = false;

	@Option(value = "-o path to the Aiken file to write")
	public String outputFilePath;

	@Option(value = "-c path to the configuration file, if any")
	public String configFilePath;

	public String inputFilePath;

	// extracted from the JSON configuration file
	public PyKenBuildOptions build = new PyKenBuildOptions();

	private final Options plumeOptions;
	private final String[] args;
	private String[] remainingArgs;

	public PyKenOptions(String[] args) {
		this.args = args;
		plumeOptions = new Options("pyken [options] ast.json", this);
	}

	public void printHelp() {
		plumeOptions.printUsage();
	}

	public void parse() throws PyKenOptionException {
		try {
			remainingArgs = plumeOptions.parse(args);
		} catch (Options.ArgException e) {
			throw new PyKenOptionException(e.getMessage());
		}

		if (version || help) {
			return;
		}

		if (remainingArgs.length != 1) {
			throw new PyKenOptionException("Expected exactly one input file, found " + remainingArgs.length);
		}
		inputFilePath = remainingArgs[0];

		if (configFilePath == null || configFilePath.isEmpty()) {
			return;
		}

		String s;
		try {
			s = FileUtils.readFileToString(new File(configFilePath), StandardCharsets.UTF_8);
		} catch (IOException ex) {
			throw new PyKenOptionException("Error reading configuration file: " + ex.getMessage());
		}

		JSONObject config;
		try {
			config = new JSONObject(s);
			if (config.has("build")) {
				build = new PyKenBuildOptions(config.getJSONObject("build"));
			}
		} catch (JSONException e) {
			throw new PyKenOptionException(configFilePath + ": parsing error: " + e.getMessage());
		}
	}

	/**
	 * The -o option wins over the configured output directory, which wins over writing next to the
	 * input file.
	 */
	public Path getOutputFilePath() {
		if (outputFilePath != null) {
			return Paths.get(outputFilePath);
		}
		String fileName = FilenameUtils.getBaseName(inputFilePath) + build.extension;
		if (build.outputDir != null) {
			return Paths.get(build.outputDir, fileName);
		}
		return Paths.get(FilenameUtils.removeExtension(inputFilePath) + build.extension);
	}
}
