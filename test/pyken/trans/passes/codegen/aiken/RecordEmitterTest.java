package pyken.trans.passes.codegen.aiken;

import static org.junit.Assert.*;
import static org.hamcrest.CoreMatchers.*;
import static pyken.model.python.PythonBuilder.*;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import pyken.errors.TopLevelIssueContext;
import pyken.formatters.AikenNodeFormattingVisitor;
import pyken.formatters.IndentingWriter;
import pyken.model.aiken.AikenConstructor;
import pyken.model.aiken.AikenField;
import pyken.model.aiken.AikenTypeDefinition;
import pyken.model.declaration.RecordDeclaration;
import pyken.model.type.TypeRegistry;
import pyken.trans.passes.type.TypeUnresolvedIssue;
import pyken.util.SourceLocation;

public class RecordEmitterTest {

	private static String format(AikenTypeDefinition definition) throws IOException {
		StringWriter writer = new StringWriter();
		try (IndentingWriter out = new IndentingWriter(writer)) {
			definition.accept(new AikenNodeFormattingVisitor(out));
		}
		return writer.toString();
	}

	@Test
	public void unannotatedFieldIsData() throws IOException {
		// class Foo:
		//     def __init__(self, secret):
		//         self.secret = secret
		RecordDeclaration foo = RecordDeclaration.withFields(SourceLocation.unknown(), "Foo",
				args("secret"), body(assign(attr("self", "secret"), name("secret"))));
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		TypeRegistry registry = new TypeRegistry();
		AikenTypeDefinition definition = RecordEmitter.emit(ctx, registry, foo);
		assertThat(format(definition), is("pub type Foo {\n  secret: Data\n}"));
		assertThat(ctx.getWarnings().size(), is(1));
		assertThat(((TypeUnresolvedIssue) ctx.getWarnings().get(0)).getName(), is("secret"));
		assertTrue(registry.hasFields("Foo"));
	}

	@Test
	public void fieldTypesFromEverySignal() throws IOException {
		RecordDeclaration order = RecordDeclaration.withFields(SourceLocation.unknown(), "Order",
				args(arg("amount", name("int")), arg("memo", null, str("")), arg("is_open")),
				Collections.emptyList());
		TopLevelIssueContext ctx = new TopLevelIssueContext();
		AikenTypeDefinition definition = RecordEmitter.emit(ctx, new TypeRegistry(), order);
		assertThat(definition, is(new AikenTypeDefinition("Order", Collections.singletonList(
				new AikenConstructor("Order", Arrays.asList(
						new AikenField("amount", "Int"),
						new AikenField("memo", "String"),
						new AikenField("is_open", "Bool")))))));
		assertFalse(ctx.hasWarnings());
		assertThat(format(definition), is("pub type Order {\n  amount: Int,\n  memo: String,\n  is_open: Bool\n}"));
	}

	@Test
	public void enumeration() throws IOException {
		RecordDeclaration action = RecordDeclaration.enumeration(SourceLocation.unknown(), "Action",
				Arrays.asList("Pay", "Close"));
		TypeRegistry registry = new TypeRegistry();
		AikenTypeDefinition definition = RecordEmitter.emit(new TopLevelIssueContext(), registry, action);
		assertThat(format(definition), is("pub type Action {\n  Pay\n  Close\n}"));
		assertTrue(registry.findRecord("Action").isPresent());
		assertFalse(registry.hasFields("Action"));
	}

	@Test
	public void nullary() throws IOException {
		AikenTypeDefinition definition = RecordEmitter.emit(new TopLevelIssueContext(), new TypeRegistry(),
				RecordDeclaration.nullary(SourceLocation.unknown(), "Unit"));
		assertThat(format(definition), is("pub type Unit {\n  Unit\n}"));
	}

}
