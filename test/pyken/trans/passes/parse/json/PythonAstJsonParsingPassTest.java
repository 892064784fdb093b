package pyken.trans.passes.parse.json;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.math.BigInteger;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameters;

import pyken.errors.TopLevelIssueContext;
import pyken.model.python.PythonBinaryOperator;
import pyken.model.python.PythonComparisonOperator;
import pyken.model.python.PythonModule;

@RunWith(Parameterized.class)
public class PythonAstJsonParsingPassTest {

	private static String jsonModule(String... statements) {
		return "{\"_type\": \"Module\", \"body\": [" + String.join(", ", statements) + "]}";
	}

	private static String jsonName(String id) {
		return "{\"_type\": \"Name\", \"id\": \"" + id + "\", \"ctx\": {\"_type\": \"Load\"}}";
	}

	private static String jsonConstant(String json) {
		return "{\"_type\": \"Constant\", \"value\": " + json + "}";
	}

	private static String jsonExpr(String value) {
		return "{\"_type\": \"Expr\", \"value\": " + value + ", \"lineno\": 1, \"col_offset\": 0}";
	}

	@Parameters
	public static List<Object[]> data() {
		return Arrays.asList(new Object[][] {
				{
						jsonModule(jsonExpr(jsonConstant("true")), jsonExpr(jsonConstant("null")),
								jsonExpr(jsonConstant("7")), jsonExpr(jsonConstant("123456789012345678901234567890")),
								jsonExpr(jsonConstant("2.5")), jsonExpr(jsonConstant("\"text\"")),
								jsonExpr(jsonConstant("{\"_type\": \"bytes\", \"hex\": \"6869\"}"))),
						module(expr(bool(true)), expr(none()), expr(num(7)),
								expr(num(new BigInteger("123456789012345678901234567890"))),
								expr(floatNum("2.5")), expr(str("text")), expr(bytes("hi"))),
				},
				{
						jsonModule("{\"_type\": \"ImportFrom\", \"module\": \"aiken.collection\", \"names\": " +
								"[{\"_type\": \"alias\", \"name\": \"list\", \"asname\": null}], \"level\": 0}"),
						module(importFrom("aiken.collection", alias("list"))),
				},
				{
						jsonModule("{\"_type\": \"FunctionDef\", \"name\": \"f\", \"args\": {\"_type\": \"arguments\", " +
								"\"posonlyargs\": [], \"args\": [{\"_type\": \"arg\", \"arg\": \"a\", \"annotation\": null}, " +
								"{\"_type\": \"arg\", \"arg\": \"b\", \"annotation\": " + jsonName("int") + "}], " +
								"\"kwonlyargs\": [], \"kw_defaults\": [], \"defaults\": [" + jsonConstant("1") + "]}, " +
								"\"body\": [{\"_type\": \"Return\", \"value\": {\"_type\": \"BinOp\", \"left\": " +
								jsonName("a") + ", \"op\": {\"_type\": \"Add\"}, \"right\": " + jsonName("b") + "}}], " +
								"\"decorator_list\": [], \"returns\": null}"),
						module(def("f", args(arg("a"), arg("b", name("int"), num(1))),
								ret(binop(name("a"), PythonBinaryOperator.ADD, name("b"))))),
				},
				{
						jsonModule(jsonExpr("{\"_type\": \"Compare\", \"left\": " + jsonName("x") + ", \"ops\": " +
								"[{\"_type\": \"In\"}], \"comparators\": [" + jsonName("xs") + "]}")),
						module(expr(compare(name("x"), PythonComparisonOperator.IN, name("xs")))),
				},
				// Python 3.8 wraps subscript indices in Index
				{
						jsonModule(jsonExpr("{\"_type\": \"Subscript\", \"value\": " + jsonName("xs") + ", \"slice\": " +
								"{\"_type\": \"Index\", \"value\": " + jsonConstant("0") + "}}")),
						module(expr(subscript(name("xs"), num(0)))),
				},
				{
						jsonModule("{\"_type\": \"While\", \"test\": " + jsonConstant("true") + ", \"body\": []}",
								jsonExpr("{\"_type\": \"Lambda\"}"),
								jsonExpr("{\"_type\": \"BinOp\", \"left\": " + jsonName("a") +
										", \"op\": {\"_type\": \"Unknown\"}, \"right\": " + jsonName("b") + "}")),
						module(unsupportedStmt("While"), expr(unsupportedExpr("Lambda")), expr(unsupportedExpr("BinOp"))),
				},
		});
	}

	private String json;
	private PythonModule expected;

	public PythonAstJsonParsingPassTest(String json, PythonModule expected) {
		this.json = json;
		this.expected = expected;
	}

	@Test
	public void test() {
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		PythonModule module = PythonAstJsonParsingPass.perform(ctx, Paths.get("contract.json"), json);
		assertFalse(ctx.format(), ctx.hasErrors());
		assertThat(module, is(expected));
	}

}
