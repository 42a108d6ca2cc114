package edu.stanford.nlp.mgsem.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertNull;
import static org.testng.AssertJUnit.assertTrue;

import edu.stanford.nlp.mgsem.BadFormulaException;
import edu.stanford.nlp.mgsem.BooleanValue;
import edu.stanford.nlp.mgsem.EntityValue;
import edu.stanford.nlp.mgsem.Formula;
import edu.stanford.nlp.mgsem.Formulas;
import edu.stanford.nlp.mgsem.Model;
import edu.stanford.nlp.mgsem.ModelEvaluator;
import org.testng.annotations.Test;

/**
 * Test truth and satisfaction of formulas in the basic model.
 */
public class ModelEvaluatorTest
{
	private final Model model = TestUtils.makeBasicModel();

	private static Formula F(final String s)
	{
		return Formulas.fromString(s);
	}

	private boolean holds(final String entity, final String formula)
	{
		return ModelEvaluator.hasValue(new EntityValue(entity), model, F(formula));
	}

	private boolean eval(final String formula)
	{
		return ModelEvaluator.eval(model, F(formula));
	}

	@Test
	public void constants()
	{
		assertTrue(holds("carol", "girl"));
		assertFalse(holds("alice", "girl"));
		assertTrue(holds("running", "run"));
		// Proper names denote themselves
		assertTrue(holds("alice", "alice"));
		assertFalse(holds("alice", "bob"));
		// ... but only for entities of the model
		assertFalse(holds("dave", "dave"));
		// A bare constant is not a sentence
		assertFalse(eval("girl"));
		assertFalse(ModelEvaluator.hasValue(BooleanValue.FALSE, model, F("girl")));
	}

	@Test
	public void conjunction()
	{
		assertTrue(holds("carol", "(and fast girl)"));
		assertFalse(holds("carol", "(and fast boy)"));
		assertTrue(holds("chasing", "(and present (and chase quick))"));
	}

	@Test
	public void thetaRoles()
	{
		assertTrue(holds("chasing", "(int bob)"));
		assertFalse(holds("chasing", "(int carol)"));
		assertTrue(holds("carol chasing bob", "(ext (and fast girl))"));
		assertFalse(holds("running", "(int alice)"));
		// At the sentence level a role is closed existentially over events
		assertTrue(eval("(int carol)"));
		assertFalse(eval("(int alice)"));
		assertTrue(ModelEvaluator.hasValue(BooleanValue.FALSE, model, F("(ext bob)")));
	}

	@Test
	public void closure()
	{
		assertTrue(eval("(closure (and present (and chase (and (int bob) (ext alice)))))"));
		assertFalse(eval("(closure (and present (and chase (and (int alice) (ext bob)))))"));
		assertTrue(eval("(closure (and quick (and chase (ext alice))))"));
		assertFalse(eval("(closure (and quick (and run (ext alice))))"));
		assertTrue(ModelEvaluator.hasValue(BooleanValue.FALSE, model, F("(closure (and run (int bob)))")));
		// Once an event is fixed, closure is the identity
		assertTrue(holds("running", "(closure run)"));
		assertFalse(holds("chasing", "(closure run)"));
	}

	@Test
	public void variables()
	{
		assertTrue(holds("bob", "(var 1)"));
		assertFalse(holds("alice", "(var 1)"));
		assertFalse(eval("(closure (and chase (ext (var 1))))"));
		assertTrue(eval("(closure (and chase (int (var 1))))"));
	}

	@Test
	public void restrictedQuantifiers()
	{
		// some girl is chased by alice
		assertTrue(eval("(and (and (quantifier exists) (int_i girl -1)) (closure (and chase (and (int (var -1)) (ext alice)))))"));
		// every girl chases bob
		assertTrue(eval("(and (and (quantifier forall) (int_i girl -1)) (closure (and chase (and (int bob) (ext (var -1))))))"));
		// every girl chases alice
		assertFalse(eval("(and (and (quantifier forall) (int_i girl -1)) (closure (and chase (and (int alice) (ext (var -1))))))"));
		// some boy runs: no boys at all
		assertFalse(eval("(and (and (quantifier exists) (int_i boy -1)) (closure (and run (ext (var -1)))))"));
		// every boy runs: vacuously true
		assertTrue(eval("(and (and (quantifier forall) (int_i boy -1)) (closure (and run (ext (var -1)))))"));
		// quantification is restricted to entities, never to events
		assertFalse(eval("(and (and (quantifier exists) (int_i chase -1)) (closure (int (var -1))))"));
		assertTrue(ModelEvaluator.hasValue(BooleanValue.FALSE, model, F("(and (and (quantifier forall) (int_i girl -1)) (closure (and chase (and (int alice) (ext (var -1))))))")));
	}

	@Test
	public void bindingsDoNotLeak()
	{
		final Formula formula = F("(and (and (quantifier exists) (int_i girl -7)) (closure (and chase (and (int (var -7)) (ext alice)))))");
		assertTrue(ModelEvaluator.eval(model, formula));
		assertNull(model.assignment(-7));
		assertEquals(1, model.assignments.size());
		assertTrue(ModelEvaluator.eval(model, formula));
		// A quantifier reusing a pronoun index shadows it only inside its scope
		final Formula shadow = F("(and (and (and (quantifier exists) (int_i girl 1)) (closure (ext (var 1)))) (closure (int (var 1))))");
		assertTrue(ModelEvaluator.eval(model, shadow));
		assertEquals("bob", model.assignment(1));
	}

	@Test
	public void quantifierAloneHasNoValue()
	{
		assertFalse(eval("(quantifier exists)"));
		assertFalse(holds("carol", "(quantifier forall)"));
	}

	@Test(expectedExceptions = BadFormulaException.class)
	public void unboundVariable()
	{
		holds("bob", "(var 2)");
	}

	@Test(expectedExceptions = BadFormulaException.class)
	public void variableAsSentence()
	{
		eval("(var 1)");
	}

	@Test(expectedExceptions = BadFormulaException.class)
	public void indexedInternalOutsideQuantifier()
	{
		eval("(int_i girl -1)");
	}

	@Test(expectedExceptions = BadFormulaException.class)
	public void quantifierWithoutIndexedRestrictor()
	{
		eval("(and (and (quantifier exists) girl) (closure run))");
	}

	@Test(expectedExceptions = BadFormulaException.class)
	public void quantifierOfAnEntity()
	{
		holds("carol", "(and (and (quantifier exists) (int_i girl -1)) girl)");
	}

	@Test
	public void missingRelationIsEmpty()
	{
		final Model noRoles = new Model.Builder().entity("alice").event("running").predicate("run", "running").createModel();
		assertFalse(ModelEvaluator.eval(noRoles, F("(closure (and run (ext alice)))")));
		assertTrue(ModelEvaluator.eval(noRoles, F("(closure run)")));
	}
}
