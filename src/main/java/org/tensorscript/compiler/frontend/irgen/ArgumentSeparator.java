package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.api.ArityException;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.KeywordArg;
import org.tensorscript.compiler.schema.AttributeSchema;
import org.tensorscript.compiler.schema.FormalParameter;
import org.tensorscript.compiler.schema.OpSchema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits the arguments of a call into graph inputs and attributes according to the callee's schema.
 * Positional arguments fill the formal inputs first, then the attributes in declaration order;
 * keyword arguments are matched by name.
 */
final class ArgumentSeparator {

	/**
	 * @param inputs The input expressions in formal order; {@code null} marks an omitted optional input.
	 *               Trailing omitted inputs are dropped.
	 * @param attributes The attribute expressions by attribute name, in schema order.
	 */
	record Separated(List<ExprNode> inputs, Map<String, ExprNode> attributes) {}

	private ArgumentSeparator() {}

	static Separated separate(OpSchema schema, List<ExprNode> args, List<KeywordArg> keywords, SourceInfo source) {
		Map<String, ExprNode> byName = new LinkedHashMap<>();
		for (KeywordArg kw : keywords) {
			if (byName.put(kw.name(), kw.value()) != null) {
				throw new ArityException("Keyword argument '" + kw.name() + "' repeated in call of '" + schema.name() + "'.", source);
			}
		}

		List<ExprNode> inputs = new ArrayList<>();
		int pos = 0;
		for (FormalParameter formal : schema.inputs()) {
			if (formal.isVariadic()) {
				while (pos < args.size()) inputs.add(args.get(pos++));
				continue;
			}
			if (pos < args.size()) {
				rejectDuplicate(byName, formal.name(), schema, source);
				inputs.add(args.get(pos++));
			} else if (byName.containsKey(formal.name())) {
				inputs.add(byName.remove(formal.name()));
			} else if (formal.isOptional()) {
				inputs.add(null);
			} else {
				throw new ArityException("Missing required input '" + formal.name() + "' of '" + schema.name() + "'.", source);
			}
		}

		Map<String, ExprNode> attributes = new LinkedHashMap<>();
		for (AttributeSchema attribute : schema.attributes()) {
			if (pos < args.size()) {
				rejectDuplicate(byName, attribute.name(), schema, source);
				attributes.put(attribute.name(), args.get(pos++));
			} else if (byName.containsKey(attribute.name())) {
				attributes.put(attribute.name(), byName.remove(attribute.name()));
			} else if (attribute.required()) {
				throw new ArityException("Missing required attribute '" + attribute.name() + "' of '" + schema.name() + "'.", source);
			}
		}

		if (pos < args.size()) {
			throw new ArityException("Too many positional arguments in call of '" + schema.name() + "': "
					+ args.size() + " given, at most " + pos + " accepted.", source);
		}
		if (!byName.isEmpty()) {
			throw new ArityException("Unknown keyword argument '" + byName.keySet().iterator().next()
					+ "' in call of '" + schema.name() + "'.", source);
		}

		int end = inputs.size();
		while (end > 0 && inputs.get(end - 1) == null) end--;
		return new Separated(Collections.unmodifiableList(new ArrayList<>(inputs.subList(0, end))), attributes);
	}

	private static void rejectDuplicate(Map<String, ExprNode> byName, String name, OpSchema schema, SourceInfo source) {
		if (byName.containsKey(name)) {
			throw new ArityException("Argument '" + name + "' of '" + schema.name() + "' given both by position and by keyword.", source);
		}
	}
}
