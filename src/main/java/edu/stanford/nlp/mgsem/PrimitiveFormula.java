package edu.stanford.nlp.mgsem;

/**
 * A PrimitiveFormula represents an atomic formula which cannot be decomposed further: a ConstantFormula, a
 * VariableFormula or a QuantifierFormula.
 */
public abstract class PrimitiveFormula extends Formula
{
}
