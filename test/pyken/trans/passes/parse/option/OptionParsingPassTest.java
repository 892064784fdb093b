package pyken.trans.passes.parse.option;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.util.logging.Level;
import java.util.logging.Logger;

import org.junit.Test;

import pyken.PyKenOptions;
import pyken.errors.TopLevelIssueContext;

public class OptionParsingPassTest {

	private static final Logger logger = Logger.getLogger("OptionParsingPassTest");

	@Test
	public void logLevels() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		OptionParsingPass.perform(ctx, logger, new String[]{"-q", "a.json"});
		assertThat(logger.getLevel(), is(Level.WARNING));
		OptionParsingPass.perform(ctx, logger, new String[]{"-v", "a.json"});
		assertThat(logger.getLevel(), is(Level.FINE));
		OptionParsingPass.perform(ctx, logger, new String[]{"a.json"});
		assertThat(logger.getLevel(), is(Level.INFO));
		assertFalse(ctx.hasErrors());
	}

	@Test
	public void badArgumentsBecomeAnIssue() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PyKenOptions options = OptionParsingPass.perform(ctx, logger, new String[]{});
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0), is(instanceOf(OptionParserIssue.class)));
		assertThat(options.inputFilePath, is(nullValue()));
	}

}
