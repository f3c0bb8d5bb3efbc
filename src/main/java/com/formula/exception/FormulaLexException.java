package com.formula.exception;

/**
 * Exception thrown when formula text contains a character sequence that is not a token.
 */
public class FormulaLexException extends FormulaParseException {

    private final String slice;
    private final int offset;

    public FormulaLexException(String slice, int offset, int tokenIndex) {
        super(ParseErrorKind.LEX, "Lexing error at offset " + offset + ": '" + slice + "'",
                tokenIndex, null, null);
        this.slice = slice;
        this.offset = offset;
    }

    /**
     * The unrecognized slice of input text.
     */
    public String getSlice() {
        return slice;
    }

    /**
     * Character offset of the slice in the input.
     */
    public int getOffset() {
        return offset;
    }
}
