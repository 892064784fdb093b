package pyken.trans.passes.declaration;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import pyken.model.declaration.*;
import pyken.model.python.PythonBinaryOperator;
import pyken.model.python.PythonComparisonOperator;

public class DeclarationCollectionPassTest {

	@Test
	public void sourceOrderIsKept() {
		List<Declaration> declarations = DeclarationCollectionPass.perform(module(
				importFrom("aiken.collection", alias("list"), alias("dict", "d")),
				importModule(alias("cardano.transaction", "tx")),
				assign("LIMIT", num(10)),
				def("helper", args("x"), ret(name("x"))),
				def("test_helper", Collections.emptyList(), assertStmt(bool(true))),
				classDef("Empty", pass())));
		assertThat(declarations.size(), is(6));
		assertThat(declarations.get(0), is(instanceOf(ImportDeclaration.class)));
		ImportDeclaration from = (ImportDeclaration) declarations.get(0);
		assertThat(from.getModule(), is("aiken/collection"));
		assertThat(from.getNames(), is(Arrays.asList("list", "dict as d")));
		ImportDeclaration plain = (ImportDeclaration) declarations.get(1);
		assertThat(plain.getModule(), is("cardano/transaction"));
		assertThat(plain.getAlias(), is("tx"));
		assertThat(declarations.get(2), is(instanceOf(ConstantDeclaration.class)));
		assertThat(declarations.get(3), is(instanceOf(FunctionDeclaration.class)));
		assertThat(declarations.get(4), is(instanceOf(TestDeclaration.class)));
		assertThat(declarations.get(4).getName(), is("helper"));
		assertThat(((RecordDeclaration) declarations.get(5)).getShape(), is(RecordDeclaration.Shape.NULLARY));
	}

	@Test
	public void validatorClass() {
		List<Declaration> declarations = DeclarationCollectionPass.perform(module(
				classDef("Vault",
						def("__init__", args("self", "owner"), pass()),
						def("spend", args("self", "datum", "redeemer", "ctx"), ret(bool(true))),
						def("else_", args("self", "ctx"), raise(null)))));
		ValidatorDeclaration validator = (ValidatorDeclaration) declarations.get(0);
		assertThat(validator.getParameters().size(), is(1));
		assertThat(validator.getParameters().get(0).getName(), is("owner"));
		assertThat(validator.getEntryPoints().size(), is(2));
		EntryPoint spend = validator.getEntryPoints().get(0);
		assertThat(spend.getName(), is("spend"));
		assertThat(spend.getParameters().size(), is(3));
		assertFalse(spend.isCatchAll());
		assertTrue(validator.getEntryPoints().get(1).isCatchAll());
	}

	@Test
	public void recordShapes() {
		List<Declaration> declarations = DeclarationCollectionPass.perform(module(
				classDef("Point",
						def("__init__", args("self", "x", "y"), pass())),
				classDef("Settings",
						expr(str("Configuration.")),
						annAssign("limit", name("int"), num(5)),
						annAssign("owner", name("bytes"), null)),
				classDef("Action",
						assign("Pay", str("pay")),
						assign("Close", str("close")))));
		RecordDeclaration point = (RecordDeclaration) declarations.get(0);
		assertThat(point.getShape(), is(RecordDeclaration.Shape.FIELDS));
		assertThat(point.getFields().size(), is(2));
		RecordDeclaration settings = (RecordDeclaration) declarations.get(1);
		assertThat(settings.getShape(), is(RecordDeclaration.Shape.FIELDS));
		assertThat(settings.getFields().get(1).getName(), is("owner"));
		RecordDeclaration action = (RecordDeclaration) declarations.get(2);
		assertThat(action.getShape(), is(RecordDeclaration.Shape.ENUMERATION));
		assertThat(action.getVariants(), is(Arrays.asList("Pay", "Close")));
	}

	@Test
	public void skippedAndUnsupported() {
		List<Declaration> declarations = DeclarationCollectionPass.perform(module(
				expr(str("Module docstring.")),
				importFrom(null, alias("sibling")),
				ifStmt(compare(name("__name__"), PythonComparisonOperator.EQ, str("__main__")),
						expr(call("main"))),
				augAssign("counter", PythonBinaryOperator.ADD, num(1)),
				unsupportedStmt("While")));
		assertThat(declarations.size(), is(2));
		assertThat(declarations.get(0).getName(), is("AugAssign"));
		assertThat(declarations.get(1).getName(), is("While"));
		assertThat(DeclarationCollectionPass.perform(module()), is(Collections.<Declaration>emptyList()));
	}

}
