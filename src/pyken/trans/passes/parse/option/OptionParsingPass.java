package pyken.trans.passes.parse.option;

import pyken.PyKenOptionException;
import pyken.PyKenOptions;
import pyken.errors.IssueContext;

import java.util.logging.Level;
import java.util.logging.Logger;

public class OptionParsingPass {
	private OptionParsingPass() {}

	public static PyKenOptions perform(IssueContext ctx, Logger logger, String[] args) {
		PyKenOptions opts = new PyKenOptions(args);
		try {
			opts.parse();
		} catch (PyKenOptionException e) {
			ctx.error(new OptionParserIssue(e.getMessage()));
		}
		// set the logger's log level based on command line arguments
		if (opts.quiet) {
			logger.setLevel(Level.WARNING);
		} else if (opts.verbose) {
			logger.setLevel(Level.FINE);
		} else {
			logger.setLevel(Level.INFO);
		}
		return opts;
	}
}
