package org.tensorscript.runtime;

import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.autocast.AutoCaster;
import org.tensorscript.compiler.autocast.LiteralPromotion;
import org.tensorscript.compiler.schema.OpSchema;
import org.tensorscript.compiler.types.ElementType;
import org.tensorscript.runtime.model.Tensor;

import java.util.List;
import java.util.Optional;

/**
 * The interpreted-path autocast specialization.
 * <p>
 * {@link Tensor} arguments provide the element type of their type variable. Literal booleans,
 * numbers and lists become tensors, converted to the bound element type when there is one and
 * promoted by the default rule otherwise. Any other argument is passed through unchanged.
 */
public final class EagerAutoCast {

    private EagerAutoCast() {}

    /**
     * Casts the arguments of one operator call.
     * @param schema The operator schema, or {@code null}.
     * @param args The actual arguments.
     * @return The cast arguments.
     */
    public static List<Object> castInputs(OpSchema schema, List<Object> args) {
        return AutoCaster.<Object, ElementType, Object>castInputs(
                schema,
                args,
                arg -> arg instanceof Tensor t ? Optional.of(t.elementType()) : Optional.empty(),
                (arg, binding) -> {
                    if (!LiteralPromotion.isPromotable(arg)) return arg;
                    return Tensor.fromLiteral(LiteralPromotion.promote(arg, binding.orElse(null), SourceInfo.UNKNOWN));
                },
                SourceInfo.UNKNOWN);
    }
}
