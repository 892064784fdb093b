package pyken.trans.passes.codegen.aiken;

import pyken.Unreachable;
import pyken.errors.IssueContext;
import pyken.model.aiken.AikenConstructor;
import pyken.model.aiken.AikenField;
import pyken.model.aiken.AikenTypeDefinition;
import pyken.model.declaration.RecordDeclaration;
import pyken.model.python.PythonArgument;
import pyken.model.type.RecordField;
import pyken.model.type.TypeRecord;
import pyken.model.type.TypeRegistry;
import pyken.model.type.TypeSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Emits a data class as a {@code pub type} and registers its fields for the declarations that
 * follow it.
 */
public class RecordEmitter {

	private RecordEmitter() {}

	public static AikenTypeDefinition emit(IssueContext ctx, TypeRegistry registry, RecordDeclaration record) {
		String name = record.getName();
		switch (record.getShape()) {
			case FIELDS: {
				List<AikenField> fields = new ArrayList<>();
				List<RecordField> recordFields = new ArrayList<>();
				for (PythonArgument argument : record.getFields()) {
					TypeSymbol type = ParameterTypes.resolve(ctx, argument, record.getFieldScope());
					fields.add(new AikenField(argument.getName(), type.getName()));
					recordFields.add(new RecordField(argument.getName(), type));
				}
				registry.addRecord(new TypeRecord(name, recordFields));
				return new AikenTypeDefinition(name,
						Collections.singletonList(new AikenConstructor(name, fields)));
			}
			case ENUMERATION: {
				List<AikenConstructor> constructors = new ArrayList<>();
				for (String variant : record.getVariants()) {
					constructors.add(new AikenConstructor(variant, Collections.emptyList()));
				}
				registry.addRecord(new TypeRecord(name, Collections.emptyList()));
				return new AikenTypeDefinition(name, constructors);
			}
			case NULLARY:
				registry.addRecord(new TypeRecord(name, Collections.emptyList()));
				return new AikenTypeDefinition(name,
						Collections.singletonList(new AikenConstructor(name, Collections.emptyList())));
			default:
				throw new Unreachable();
		}
	}
}
