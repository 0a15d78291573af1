package org.tensorscript.compiler.autocast;

import org.tensorscript.compiler.api.EmptyListException;
import org.tensorscript.compiler.api.SourceInfo;
import org.tensorscript.compiler.api.TypeMismatchException;
import org.tensorscript.compiler.ir.TensorLiteral;
import org.tensorscript.compiler.types.ElementType;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link LiteralPromotion}.
 */
public class LiteralPromotionTest {

    @Test
    @Tag("unit")
    void defaultPromotionPerLiteralKind() {
        assertThat(LiteralPromotion.promotedType(true, SourceInfo.UNKNOWN)).isEqualTo(ElementType.BOOL);
        assertThat(LiteralPromotion.promotedType(3L, SourceInfo.UNKNOWN)).isEqualTo(ElementType.INT64);
        assertThat(LiteralPromotion.promotedType(2.5, SourceInfo.UNKNOWN)).isEqualTo(ElementType.FLOAT);
        assertThat(LiteralPromotion.promotedType("s", SourceInfo.UNKNOWN)).isEqualTo(ElementType.STRING);
        assertThat(LiteralPromotion.promotedType(List.of(1L, 2L), SourceInfo.UNKNOWN)).isEqualTo(ElementType.INT64);
    }

    @Test
    @Tag("unit")
    void listBecomesRankOneTensor() {
        // Act
        TensorLiteral literal = LiteralPromotion.promote(List.of(1.0, 2.0, 3.0), SourceInfo.UNKNOWN);

        // Assert
        assertThat(literal.elementType()).isEqualTo(ElementType.FLOAT);
        assertThat(literal.dims()).containsExactly(3L);
        assertThat(literal.values()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    @Tag("unit")
    void scalarBecomesRankZeroTensor() {
        // Act
        TensorLiteral literal = LiteralPromotion.promote(7L, SourceInfo.UNKNOWN);

        // Assert
        assertThat(literal.rank()).isZero();
        assertThat(literal.values()).containsExactly(7L);
    }

    /**
     * Values are converted when a target element type is bound.
     */
    @Test
    @Tag("unit")
    void convertsToBoundElementType() {
        assertThat(LiteralPromotion.promote(1L, ElementType.FLOAT, SourceInfo.UNKNOWN).values()).containsExactly(1.0);
        assertThat(LiteralPromotion.promote(2.7, ElementType.INT64, SourceInfo.UNKNOWN).values()).containsExactly(2L);
        assertThat(LiteralPromotion.promote(0L, ElementType.BOOL, SourceInfo.UNKNOWN).values()).containsExactly(false);
    }

    @Test
    @Tag("unit")
    void emptyListIsRejected() {
        assertThatThrownBy(() -> LiteralPromotion.promote(List.of(), SourceInfo.UNKNOWN))
                .isInstanceOf(EmptyListException.class);
    }

    @Test
    @Tag("unit")
    void mixedListIsRejected() {
        assertThatThrownBy(() -> LiteralPromotion.promote(List.of(1L, 2.0), SourceInfo.UNKNOWN))
                .isInstanceOf(TypeMismatchException.class)
                .hasMessageContaining("different types");
    }

    @Test
    @Tag("unit")
    void stringCannotBecomeNumber() {
        assertThatThrownBy(() -> LiteralPromotion.promote("abc", ElementType.FLOAT, SourceInfo.UNKNOWN))
                .isInstanceOf(TypeMismatchException.class);
    }
}
