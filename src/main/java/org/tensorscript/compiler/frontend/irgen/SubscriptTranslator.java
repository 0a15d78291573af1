package org.tensorscript.compiler.frontend.irgen;

import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.TypeMismatchException;
import org.tensorscript.compiler.api.UnsupportedConstructException;
import org.tensorscript.compiler.frontend.parser.ast.ExprNode;
import org.tensorscript.compiler.frontend.parser.ast.SliceNode;
import org.tensorscript.compiler.frontend.parser.ast.SubscriptNode;
import org.tensorscript.compiler.ir.IrAttribute;
import org.tensorscript.compiler.ir.TranslatedExpression;
import org.tensorscript.compiler.types.AttributeType;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Lowers indexing expressions.
 * <p>
 * Slices and constant integer indices become one {@code Slice} (followed by a {@code Squeeze} of the
 * integer-indexed axes); any other index becomes a {@code Gather} along its axis. A single constant
 * integer index alone is a plain {@code Gather}.
 */
final class SubscriptTranslator {

	private record AxisIndex(int axis, ExprNode index) {}

	/**
	 * One slice bound: the name of its 1-D value and the constant, if known.
	 */
	private record Component(String name, Long value) {}

	private record SliceInputs(String start, String end, String step) {}

	private final TranslationContext ctx;
	private final ExpressionTranslator expressions;

	SubscriptTranslator(TranslationContext ctx, ExpressionTranslator expressions) {
		this.ctx = ctx;
		this.expressions = expressions;
	}

	TranslatedExpression translate(SubscriptNode node, String target) {
		String var = expressions.translate(node.value(), null).name();
		String result = ctx.uniqueName(target != null ? target : var + "_subscripted");
		SourceInfo source = node.source();
		Map<Long, String> constants1d = new HashMap<>();

		List<AxisIndex> sliced = new ArrayList<>();
		List<AxisIndex> scalars = new ArrayList<>();
		List<AxisIndex> gathered = new ArrayList<>();
		List<ExprNode> elements = node.indexElements();
		for (int axis = 0; axis < elements.size(); axis++) {
			ExprNode element = elements.get(axis);
			if (element instanceof SliceNode slice) {
				if (!slice.isFull()) sliced.add(new AxisIndex(axis, slice));
			} else if (ctx.constants().isConstant(element) && ctx.constants().evaluate(element) instanceof Long) {
				scalars.add(new AxisIndex(axis, element));
			} else {
				gathered.add(new AxisIndex(axis, element));
			}
		}

		if (sliced.isEmpty() && scalars.isEmpty() && gathered.isEmpty()) {
			ctx.emit("Identity", List.of(var), List.of(result), List.of(), source);
			return TranslatedExpression.any(result);
		}

		String current = var;
		if (!sliced.isEmpty() || scalars.size() > 1) {
			List<String> starts = new ArrayList<>();
			List<String> ends = new ArrayList<>();
			List<String> axes = new ArrayList<>();
			List<String> steps = new ArrayList<>();
			List<Long> squeezedAxes = new ArrayList<>();

			for (AxisIndex index : sliced) {
				axes.add(const1d(index.axis(), constants1d, source));
				SliceInputs inputs = sliceInputs((SliceNode) index.index(), constants1d, source);
				starts.add(inputs.start());
				ends.add(inputs.end());
				steps.add(inputs.step());
			}
			for (AxisIndex index : scalars) {
				long i = (Long) ctx.constants().evaluate(index.index());
				axes.add(const1d(index.axis(), constants1d, source));
				steps.add(const1d(1L, constants1d, source));
				starts.add(const1d(i, constants1d, source));
				ends.add(const1d(i == -1 ? Long.MAX_VALUE : i + 1, constants1d, source));
				squeezedAxes.add((long) index.axis());
			}
			scalars.clear();

			String start = concat(starts, var + "_start", source);
			String end = concat(ends, var + "_end", source);
			String axis = concat(axes, var + "_axis", source);
			String step = concat(steps, var + "_step", source);
			List<String> sliceInputs = List.of(var, start, end, axis, step);

			if (!squeezedAxes.isEmpty()) {
				String slicedName = ctx.uniqueName(var + "_sliced");
				ctx.emit("Slice", sliceInputs, List.of(slicedName), List.of(), source);
				String squeezeAxes = ctx.emitConstant(squeezedAxes, "squeezed_axes", source).name();
				current = gathered.isEmpty() ? result : ctx.uniqueName(var + "_squeezed");
				ctx.emit("Squeeze", List.of(slicedName, squeezeAxes), List.of(current), List.of(), source);
			} else {
				current = gathered.isEmpty() ? result : ctx.uniqueName(var + "_sliced");
				ctx.emit("Slice", sliceInputs, List.of(current), List.of(), source);
			}
		}

		gathered.addAll(scalars);
		for (int k = 0; k < gathered.size(); k++) {
			AxisIndex index = gathered.get(k);
			String indexName = expressions.translate(index.index(), null).name();
			String out = k == gathered.size() - 1 ? result : ctx.uniqueName(var + "_axis_" + index.axis());
			IrAttribute axisAttribute = ctx.builder().makeAttribute("axis", (long) index.axis(), AttributeType.INT);
			ctx.emit("Gather", List.of(current, indexName), List.of(out), List.of(axisAttribute), source);
			current = out;
		}
		return TranslatedExpression.any(current);
	}

	private String const1d(long value, Map<Long, String> cache, SourceInfo source) {
		String name = cache.get(value);
		if (name == null) {
			name = ctx.emitConstant(List.of(value), null, source).name();
			cache.put(value, name);
		}
		return name;
	}

	private String concat(List<String> parts, String preferred, SourceInfo source) {
		if (parts.size() == 1) return parts.get(0);
		String result = ctx.uniqueName(preferred);
		ctx.emit("Concat", parts, List.of(result), List.of(ctx.builder().makeAttribute("axis", 0L, AttributeType.INT)), source);
		return result;
	}

	private SliceInputs sliceInputs(SliceNode slice, Map<Long, String> cache, SourceInfo source) {
		Component step = component(slice.step(), 1L, cache, source);
		Component start;
		Component end;
		if (step.value() == null) {
			start = component(slice.lower(), null, cache, source);
			end = component(slice.upper(), null, cache, source);
		} else if (step.value() > 0) {
			start = component(slice.lower(), 0L, cache, source);
			end = component(slice.upper(), Long.MAX_VALUE, cache, source);
		} else {
			start = component(slice.lower(), Long.MAX_VALUE, cache, source);
			end = component(slice.upper(), Long.MIN_VALUE, cache, source);
		}
		return new SliceInputs(start.name(), end.name(), step.name());
	}

	private Component component(ExprNode expr, Long defaultValue, Map<Long, String> cache, SourceInfo source) {
		if (expr == null) {
			if (defaultValue == null) {
				throw new UnsupportedConstructException(
						"A slice with a non-constant step needs explicit start and stop values.", source);
			}
			return new Component(const1d(defaultValue, cache, source), defaultValue);
		}
		if (ctx.constants().isConstant(expr)) {
			Object value = ctx.constants().evaluate(expr);
			if (value instanceof Long l) return new Component(const1d(l, cache, source), l);
			throw new TypeMismatchException("Slice bounds must be integers, not " + value + ".", expr.source());
		}
		String name = expressions.translate(expr, null).name();
		String reshaped = ctx.uniqueName(name + "_reshaped");
		ctx.emit("Reshape", List.of(name, const1d(1L, cache, source)), List.of(reshaped), List.of(), source);
		return new Component(reshaped, null);
	}
}
