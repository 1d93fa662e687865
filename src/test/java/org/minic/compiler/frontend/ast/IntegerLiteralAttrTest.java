package org.minic.compiler.frontend.ast;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for parsing integer literal spellings.
 */
@Tag("unit")
public class IntegerLiteralAttrTest {

    @Test
    void testParse_Decimal() {
        assertThat(IntegerLiteralAttr.parse("0", 1).unsignedValue()).isEqualTo(0L);
        assertThat(IntegerLiteralAttr.parse("10", 1).unsignedValue()).isEqualTo(10L);
        assertThat(IntegerLiteralAttr.parse("7", 1).unsignedValue()).isEqualTo(7L);
    }

    @Test
    void testParse_LeadingZero_IsOctal() {
        assertThat(IntegerLiteralAttr.parse("010", 1).unsignedValue()).isEqualTo(8L);
        assertThat(IntegerLiteralAttr.parse("00", 1).unsignedValue()).isEqualTo(0L);
        assertThat(IntegerLiteralAttr.parse("0777", 1).unsignedValue()).isEqualTo(511L);
    }

    @Test
    void testParse_HexPrefix_EitherCase() {
        assertThat(IntegerLiteralAttr.parse("0x10", 1).unsignedValue()).isEqualTo(16L);
        assertThat(IntegerLiteralAttr.parse("0X10", 1).unsignedValue()).isEqualTo(16L);
        assertThat(IntegerLiteralAttr.parse("0xfF", 1).unsignedValue()).isEqualTo(255L);
    }

    /**
     * Values up to 2^32-1 are accepted; above {@link Integer#MAX_VALUE} the stored pattern is negative.
     */
    @Test
    void testParse_FullUnsignedRange() {
        IntegerLiteralAttr max = IntegerLiteralAttr.parse("0xFFFFFFFF", 3);

        assertThat(max.unsignedValue()).isEqualTo(4294967295L);
        assertThat(max.value()).isEqualTo(-1);
        assertThat(max.line()).isEqualTo(3);
        assertThat(max.display()).isEqualTo("4294967295");
        assertThat(IntegerLiteralAttr.parse("4294967295", 1).unsignedValue()).isEqualTo(4294967295L);
    }

    @Test
    void testParse_Malformed_Throws() {
        assertThatThrownBy(() -> IntegerLiteralAttr.parse("09", 1)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IntegerLiteralAttr.parse("0x", 1)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IntegerLiteralAttr.parse("0xG", 1)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IntegerLiteralAttr.parse("4294967296", 1)).isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IntegerLiteralAttr.parse("0x+1", 1)).isInstanceOf(NumberFormatException.class);
    }

    @Test
    void testLeafKind() {
        assertThat(AstFactory.leaf(IntegerLiteralAttr.parse("1", 2)).kind()).isEqualTo(AstOperatorType.LEAF_LITERAL_UINT);
    }
}
