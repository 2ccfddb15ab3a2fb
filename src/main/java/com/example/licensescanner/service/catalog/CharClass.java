package com.example.licensescanner.service.catalog;

/**
 * Character classes a document-number segment may require. Only upper-case ASCII letters and ASCII
 * digits are recognised; OCR output is expected to be upper-cased before matching.
 */
public enum CharClass {

    LETTER('L') {
        @Override
        public boolean accepts(char value) {
            return value >= 'A' && value <= 'Z';
        }
    },
    DIGIT('D') {
        @Override
        public boolean accepts(char value) {
            return value >= '0' && value <= '9';
        }
    };

    private final char symbol;

    CharClass(char symbol) {
        this.symbol = symbol;
    }

    public abstract boolean accepts(char value);

    public char symbol() {
        return symbol;
    }

    public static CharClass fromSymbol(char symbol) {
        char upper = Character.toUpperCase(symbol);
        for (CharClass charClass : values()) {
            if (charClass.symbol == upper) {
                return charClass;
            }
        }
        throw new IllegalArgumentException("Unknown character class symbol '" + symbol + "'");
    }
}
