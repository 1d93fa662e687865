package org.minic.compiler.frontend.ast;

/**
 * An unsigned 32-bit integer literal and the line it appeared on.
 * <p>
 * The value is stored as its 32-bit pattern; literals above {@link Integer#MAX_VALUE} therefore
 * read as negative through {@link #value()}. Use {@link #unsignedValue()} for the numeric value.
 *
 * @param value The 32-bit pattern of the literal.
 * @param line The line of the literal.
 */
public record IntegerLiteralAttr(int value, int line) implements Attribute {

    /**
     * Parses the spelling of a MiniC integer literal.
     * <ul>
     *   <li>{@code 0x...} or {@code 0X...}: hexadecimal</li>
     *   <li>{@code 0...} with at least one more digit: octal</li>
     *   <li>anything else, including {@code 0} itself: decimal</li>
     * </ul>
     *
     * @param text The literal text.
     * @param line The line of the literal.
     * @return The parsed attribute.
     * @throws NumberFormatException if the digits are not valid in the selected radix
     *                               or the value does not fit into 32 unsigned bits.
     */
    public static IntegerLiteralAttr parse(String text, int line) {
        int radix = 10;
        String digits = text;
        if (text.length() > 1 && text.charAt(0) == '0') {
            if (text.length() > 2 && (text.charAt(1) == 'x' || text.charAt(1) == 'X')) {
                radix = 16;
                digits = text.substring(2);
            } else {
                radix = 8;
                digits = text.substring(1);
            }
        }
        if (digits.startsWith("+") || digits.startsWith("-")) {
            throw new NumberFormatException("Signed literal text: " + text);
        }
        return new IntegerLiteralAttr(Integer.parseUnsignedInt(digits, radix), line);
    }

    /**
     * @return The literal value in the range 0 to 2^32-1.
     */
    public long unsignedValue() {
        return Integer.toUnsignedLong(value);
    }

    @Override
    public AstOperatorType leafKind() {
        return AstOperatorType.LEAF_LITERAL_UINT;
    }

    @Override
    public String display() {
        return Long.toString(unsignedValue());
    }
}
