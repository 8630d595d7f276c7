package com.example.aspects.roll;

/**
 * Thrown when a roll formula cannot be parsed or evaluated.
 */
public class FormulaException extends RuntimeException {

    private final String formula;
    private final int position;

    public FormulaException(String message, String formula, int position) {
        super(message + " at position " + position + " in '" + formula + "'");
        this.formula = formula;
        this.position = position;
    }

    public String getFormula() { return formula; }
    public int getPosition() { return position; }
}
