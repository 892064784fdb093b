package pyken.errors;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;

import java.nio.file.Paths;

import org.junit.Test;

import pyken.trans.PyKenTransException;
import pyken.trans.passes.codegen.aiken.UnsupportedConstructIssue;
import pyken.trans.passes.codegen.aiken.WhileEmittingDeclaration;
import pyken.util.SourceLocation;

public class TopLevelIssueContextTest {

	@Test
	public void nestedWarningsCarryTheirDeclaration() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		SourceLocation declaration = new SourceLocation(Paths.get("vault.json"), 4, 9, 0, 20);
		IssueContext nested = ctx.withContext(new WhileEmittingDeclaration("spend_check", declaration));
		nested.warn(new UnsupportedConstructIssue("While", new SourceLocation(Paths.get("vault.json"), 6, 6, 4, 12)));

		assertTrue(nested.hasWarnings());
		assertFalse(ctx.hasErrors());
		assertThat(ctx.getWarnings().size(), is(1));
		assertThat(ctx.getWarnings().get(0), is(instanceOf(IssueWithContext.class)));
		assertThat(ctx.formatWarnings(), is("Detected 1 issue(s):\n" +
				"while emitting declaration spend_check at 4:1-9:20 in file vault.json\n" +
				"  no translation rule for While, emitted a placeholder at 6:5-12 in file vault.json"));
	}

	@Test
	public void errorsAndWarningsAreKeptApart() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.warn(new UnsupportedConstructIssue("Lambda", SourceLocation.unknown()));
		assertFalse(ctx.hasErrors());
		assertThat(ctx.format(), is("Detected 0 issue(s):"));
		ctx.error(new UnsupportedConstructIssue("Lambda", SourceLocation.unknown()));
		assertTrue(ctx.hasErrors());
		assertThat(ctx.getIssues().get(0).getMessage(),
				is("no translation rule for Lambda, emitted a placeholder at unknown source location"));
	}

	@Test
	public void failedTranslationIsReportedWithItsPrefix() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		ctx.error(new UnsupportedConstructIssue("Lambda", SourceLocation.unknown()));
		PyKenTransException e = new PyKenTransException(ctx.format());
		assertThat(e.getMessage(), is("Translation Error: Detected 1 issue(s):\n" +
				"no translation rule for Lambda, emitted a placeholder at unknown source location"));
	}

}
