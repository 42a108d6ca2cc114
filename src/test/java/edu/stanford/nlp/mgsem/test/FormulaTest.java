package edu.stanford.nlp.mgsem.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

import edu.stanford.nlp.mgsem.BadFormulaException;
import edu.stanford.nlp.mgsem.ClosureFormula;
import edu.stanford.nlp.mgsem.ConjunctionFormula;
import edu.stanford.nlp.mgsem.ConstantFormula;
import edu.stanford.nlp.mgsem.Formula;
import edu.stanford.nlp.mgsem.Formulas;
import edu.stanford.nlp.mgsem.IndexedInternalFormula;
import edu.stanford.nlp.mgsem.QuantifierFormula;
import edu.stanford.nlp.mgsem.RoleFormula;
import edu.stanford.nlp.mgsem.VariableFormula;
import java.util.Arrays;
import org.testng.annotations.Test;

/**
 * Test Formulas.
 */
public class FormulaTest
{
	private static Formula F(final String s)
	{
		return Formulas.fromString(s);
	}

	@Test
	public void readAndPrint()
	{
		assertEquals("alice", F("alice").toString());
		assertEquals("", F("(const \"\")").toString());
		assertEquals("x_1", F("(var 1)").toString());
		assertEquals("int(bob)", F("(int bob)").toString());
		assertEquals("ext(x_-2)", F("(ext (var -2))").toString());
		assertEquals("int_-1(girl)", F("(int_i girl -1)").toString());
		assertEquals("some", F("(quantifier exists)").toString());
		assertEquals("every", F("(quantifier forall)").toString());
		assertEquals("<present & chase & int(bob) & ext(alice)>", F("(closure (and present chase (int bob) (ext alice)))").toString());
		assertEquals("carol chasing bob", F("\"carol chasing bob\"").toString());
	}

	@Test
	public void structure()
	{
		final Formula expected = new ConjunctionFormula(new QuantifierFormula(QuantifierFormula.Mode.exists), new IndexedInternalFormula(new ConstantFormula("girl"), -1));
		assertEquals(expected, F("(and (quantifier exists) (int_i girl -1))"));
		assertEquals(expected.hashCode(), F("(and (quantifier exists) (int_i girl -1))").hashCode());
		assertEquals(new ClosureFormula(new RoleFormula(RoleFormula.Mode.internal, new VariableFormula(3))), F("(closure (int (var 3)))"));
		assertFalse(F("(int bob)").equals(F("(ext bob)")));
		assertFalse(F("(int_i girl -1)").equals(F("(int_i girl -2)")));
		// n-ary conjunctions nest to the right
		assertEquals(new ConjunctionFormula(F("a"), new ConjunctionFormula(F("b"), F("c"))), F("(and a b c)"));
	}

	@Test
	public void quantificationalShape()
	{
		assertTrue(Formulas.isQuantifier(F("(quantifier forall)")));
		assertTrue(Formulas.isQuantifier(F("(and (quantifier exists) (int_i girl -4))")));
		assertFalse(Formulas.isQuantifier(F("(and girl (quantifier exists))")));
		assertFalse(Formulas.isQuantifier(F("(closure (and (quantifier exists) girl))")));
		assertFalse(Formulas.isQuantifier(F("girl")));
		assertEquals(-4, Formulas.boundIndex(F("(and (quantifier exists) (int_i girl -4))")));
	}

	@Test(expectedExceptions = BadFormulaException.class)
	public void quantifierWithoutIndexedRestrictor()
	{
		Formulas.boundIndex(F("(quantifier exists)"));
	}

	@Test
	public void conjoin()
	{
		assertEquals("a & b & base", Formulas.conjoin(Arrays.asList(F("a"), F("b")), F("base")).toString());
		assertEquals("base", Formulas.conjoin(Arrays.<Formula> asList(), F("base")).toString());
	}

	@Test
	public void badFormulas()
	{
		for (final String s : new String[] { "(and a)", "(foo a)", "(var x)", "(int a", "a)", "(quantifier most)", "\"open", "" })
			try
			{
				F(s);
				throw new AssertionError("Expected failure on " + s);
			}
			catch (final BadFormulaException e)
			{
				assertTrue(e.getMessage(), e.getMessage().length() > 0);
			}
	}
}
