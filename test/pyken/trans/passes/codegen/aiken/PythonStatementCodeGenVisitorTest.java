package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pyken.errors.TopLevelIssueContext;
import pyken.model.aiken.*;
import pyken.model.python.PythonBinaryOperator;
import pyken.model.python.PythonComparisonOperator;
import pyken.model.python.PythonStatement;
import pyken.model.type.RecordField;
import pyken.model.type.TypeProvenance;
import pyken.model.type.TypeRecord;
import pyken.model.type.TypeRegistry;
import pyken.model.type.TypeSymbol;
import pyken.scope.NameScope;

@RunWith(Parameterized.class)
public class PythonStatementCodeGenVisitorTest {

	private static List<AikenStatement> statements(AikenStatement... statements) {
		return Arrays.asList(statements);
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						body(assign("total", binop(name("a"), PythonBinaryOperator.ADD, name("b")))),
						false,
						statements(new AikenLet("total", "a + b")),
						0,
				},
				{
						body(assign(tuple(name("a"), name("b")), name("pair"))),
						false,
						statements(new AikenLet("(a, b)", "pair")),
						0,
				},
				{
						body(assign(subscript(name("m"), num(0)), num(1))),
						false,
						statements(new AikenExpression("todo")),
						1,
				},
				{
						body(annAssign("count", name("int"), num(0)), annAssign("later", name("int"), null)),
						false,
						statements(new AikenLet("count", "0")),
						0,
				},
				{
						body(augAssign("count", PythonBinaryOperator.ADD, num(1))),
						false,
						statements(new AikenLet("count", "count + 1")),
						0,
				},
				// record construction bound to a capitalized name
				{
						body(assign("Order", call(name("Order"), Collections.emptyList(), kw("amount", num(1))))),
						false,
						statements(new AikenRecordDestructure("Order", Collections.singletonList("amount"), "Order")),
						0,
				},
				{
						body(assign("Marker", call("Unknown"))),
						false,
						statements(new AikenRecordDestructure("Unknown", null, "Marker")),
						0,
				},
				// element extraction inside tests
				{
						body(assign("outputs", subscript(attr(attr("ctx", "transaction"), "outputs"), num(0))),
								assertStmt(compare(attr("outputs", "value"), PythonComparisonOperator.GT, num(0)))),
						true,
						statements(new AikenExpect("[output]", "ctx.transaction.outputs"),
								new AikenExpect(null, "output.value > 0")),
						0,
				},
				{
						body(assign("first", subscript(unsupportedExpr("Lambda"), num(0)))),
						true,
						statements(new AikenLet("first", "todo[0]")),
						1,
				},
				{
						body(assign("outputs", subscript(attr(attr("ctx", "transaction"), "outputs"), num(0)))),
						false,
						statements(new AikenLet("outputs", "ctx.transaction.outputs[0]")),
						0,
				},
				// optional unwrapping
				{
						body(ifStmt(compare(name("owner"), PythonComparisonOperator.IS, none()), raise(null))),
						false,
						statements(new AikenExpect("Some(owner)", "owner")),
						0,
				},
				{
						body(ifStmt(name("ok"), body(ret(num(1))), body(raise(call("ValueError"))))),
						false,
						statements(new AikenIf("ok",
								statements(new AikenExpression("1")),
								statements(new AikenFail()))),
						0,
				},
				{
						body(ret(), ret(name("datum"))),
						false,
						statements(new AikenExpression("()"), new AikenExpression("None")),
						0,
				},
				// failure expectations
				{
						body(tryStmt(body(expr(call(attr("validator", "spend"), name("a"), name("b")))),
								except(name("Exception"), pass()))),
						true,
						statements(new AikenExpression("!validator.spend(a, b)")),
						0,
				},
				{
						body(tryStmt(body(assign("x", num(1)), expr(call("f", name("x")))),
								except(null, pass()))),
						true,
						statements(new AikenExpect(null, "False")),
						0,
				},
				// skipped statements
				{
						body(expr(str("Docstring.")), pass()),
						false,
						Collections.emptyList(),
						0,
				},
				{
						body(expr(call("check", name("x")))),
						false,
						statements(new AikenExpression("check(x)")),
						0,
				},
				{
						body(unsupportedStmt("While"), def("inner", args("x"), ret(name("x")))),
						false,
						statements(new AikenExpression("todo"), new AikenExpression("todo")),
						2,
				},
		});
	}

	private List<PythonStatement> body;
	private boolean inTest;
	private List<AikenStatement> expected;
	private int warnings;

	public PythonStatementCodeGenVisitorTest(List<PythonStatement> body, boolean inTest,
	                                         List<AikenStatement> expected, int warnings) {
		this.body = body;
		this.inTest = inTest;
		this.expected = expected;
		this.warnings = warnings;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TypeRegistry registry = new TypeRegistry();
		registry.addRecord(new TypeRecord("Order", Collections.singletonList(
				new RecordField("amount", new TypeSymbol("Int", TypeProvenance.ANNOTATION)))));
		List<AikenStatement> rendered = new PythonStatementCodeGenVisitor(ctx, registry, new NameScope(), inTest)
				.renderBody(body);
		assertThat(rendered, is(expected));
		assertThat(ctx.getWarnings().size(), is(warnings));
	}

}
