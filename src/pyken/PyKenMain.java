package pyken;

import org.apache.commons.io.FileUtils;
import pyken.errors.Issue;
import pyken.errors.TopLevelIssueContext;
import pyken.model.python.PythonModule;
import pyken.trans.IOErrorIssue;
import pyken.trans.PyKenTransException;
import pyken.trans.PyKenTranslator;
import pyken.trans.TranslationResult;
import pyken.trans.passes.parse.json.PythonAstJsonParsingPass;
import pyken.trans.passes.parse.option.OptionParsingPass;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.logging.Logger;

public class PyKenMain {
	private String[] cmdArgs;
	private static Logger logger;

	public PyKenMain(String[] args) {
		cmdArgs = args;
		logger = Logger.getLogger("PyKenMain");
	}

	public static void main(String[] args) {
		if (new PyKenMain(args).run()) {
			logger.info("Finished");
		} else {
			logger.info("Terminated with errors");
			System.exit(1);
		}
	}

	// Top-level workhorse method.
	public boolean run() {
		try {
			TopLevelIssueContext ctx = new TopLevelIssueContext();

			// Check options, set up logging.
			PyKenOptions opts = OptionParsingPass.perform(ctx, logger, cmdArgs);
			if (ctx.hasErrors()) {
				System.err.println(ctx.format());
				opts.printHelp();
				return false;
			}
			if (opts.version) {
				System.out.println("PyKen version " + PyKenOptions.VERSION);
				return true;
			}
			if (opts.help) {
				opts.printHelp();
				return true;
			}

			logger.info("Opening AST file");
			Path inputFilePath = Paths.get(opts.inputFilePath);
			String inputFileContents = null;
			try {
				inputFileContents = FileUtils.readFileToString(inputFilePath.toFile(), StandardCharsets.UTF_8);
			} catch (IOException e) {
				ctx.error(new IOErrorIssue(e));
			}
			checkErrors(ctx);

			logger.info("Parsing Python AST");
			PythonModule module = PythonAstJsonParsingPass.perform(ctx, inputFilePath, inputFileContents);
			checkErrors(ctx);

			logger.info("Translating to Aiken");
			TranslationResult result = PyKenTranslator.translate(module);
			for (Issue warning : result.getWarnings()) {
				logger.warning(warning.getMessage());
			}
			if (opts.warningsAsErrors) {
				for (Issue warning : result.getWarnings()) {
					ctx.error(warning);
				}
				checkErrors(ctx);
			}

			Path outputFilePath = opts.getOutputFilePath();
			logger.info("Writing Aiken module to \"" + outputFilePath + "\"");
			FileUtils.writeStringToFile(outputFilePath.toFile(), result.getText(), StandardCharsets.UTF_8);
		} catch (PyKenTransException | IOException e) {
			logger.severe("found issues");
			System.err.println(e.getMessage());
			return false;
		}

		return true;
	}

	private static void checkErrors(TopLevelIssueContext ctx) throws PyKenTransException {
		if (ctx.hasErrors()) {
			throw new PyKenTransException(ctx.format());
		}
	}
}
