package edu.stanford.nlp.mgsem.test;

import static org.testng.AssertJUnit.assertEquals;
import static org.testng.AssertJUnit.assertFalse;
import static org.testng.AssertJUnit.assertTrue;

import com.google.common.base.Joiner;
import edu.stanford.nlp.mgsem.ChartEntry;
import edu.stanford.nlp.mgsem.DerivationContext;
import edu.stanford.nlp.mgsem.Feature;
import edu.stanford.nlp.mgsem.Grammar;
import edu.stanford.nlp.mgsem.GrammarReader;
import edu.stanford.nlp.mgsem.MgsemError;
import edu.stanford.nlp.mgsem.Model;
import edu.stanford.nlp.mgsem.ModelEvaluator;
import edu.stanford.nlp.mgsem.ModelReader;
import edu.stanford.nlp.mgsem.Parser;
import java.io.StringReader;
import java.util.Arrays;
import org.testng.annotations.Test;

/**
 * Test reading grammars and models from JSON.
 */
public class ReaderTest
{
	@Test
	public void grammarResource()
	{
		final Grammar read = TestUtils.readGrammarResource("basic.grammar.json");
		final Grammar built = TestUtils.makeBasicGrammar();
		assertEquals(built.startSymbols, read.startSymbols);
		assertEquals(built.lexicon.size(), read.lexicon.size());
		for (int i = 0; i < built.lexicon.size(); i++)
		{
			assertEquals(built.lexicon.get(i).token, read.lexicon.get(i).token);
			assertEquals(built.lexicon.get(i).features, read.lexicon.get(i).features);
			assertEquals(built.lexicon.get(i).formula, read.lexicon.get(i).formula);
		}
		assertTrue(read.isStartSymbol("c"));
		assertFalse(read.isStartSymbol("t"));
		assertEquals(1, read.lookup("girl").size());
		assertTrue(read.lookup("").isEmpty());
	}

	@Test
	public void modelResource()
	{
		final Model read = TestUtils.readModelResource("basic.model.json");
		final Model built = TestUtils.makeBasicModel();
		assertEquals(built.entities, read.entities);
		assertEquals(built.events, read.events);
		assertEquals(built.assignments, read.assignments);
		assertEquals(built.predicates, read.predicates);
		assertEquals(built.relations, read.relations);
		assertEquals("bob", read.assignment(1));
		assertTrue(read.related(Model.INTERNAL, "alice chasing carol", "carol"));
	}

	@Test
	public void parseWithReadGrammarAndModel()
	{
		final Grammar grammar = TestUtils.readGrammarResource("basic.grammar.json");
		final Model model = TestUtils.readModelResource("basic.model.json");
		final ChartEntry entry = new Parser(grammar, new DerivationContext()).parse("ε.Q every.NOM girl chase -s bob");
		assertEquals("every & int_-1(girl) & <present & chase & int(bob) & ext(x_-1)>", entry.formula().toString());
		assertTrue(ModelEvaluator.eval(model, entry.formula()));
	}

	@Test
	public void nullElements()
	{
		final Grammar grammar = GrammarReader.read(new StringReader("{\"startSymbols\": [\"c\"], \"lexicon\": ["
				+ "{\"token\": \"\", \"features\": \"+t -c\", \"formula\": \"(const \\\"\\\")\"},"
				+ "{\"token\": \"alice.NOM\", \"features\": \"-d -k\", \"formula\": \"alice\"},"
				+ "{\"token\": \"run\", \"features\": \"+d -v\", \"formula\": \"run\"},"
				+ "{\"token\": \"-s\", \"features\": \"+v +k -t\", \"formula\": \"present\"}]}"));
		assertEquals(1, grammar.lookup("").size());
		final ChartEntry entry = new Parser(grammar, new DerivationContext()).parse("alice.NOM run -s");
		assertEquals("<present & run & ext(alice)>", entry.formula().toString());
		assertTrue(ModelEvaluator.eval(TestUtils.makeBasicModel(), entry.formula()));
	}

	@Test
	public void featureNotation()
	{
		assertEquals(Arrays.asList(Feature.licensor("n"), Feature.licensee("d"), Feature.licensee("q")), Feature.listFromString(" +n  -d -q "));
		assertEquals("+n -d -q", Joiner.on(' ').join(Feature.listFromString("+n -d -q")));
		assertEquals(Arrays.asList(Feature.adjunct("v")), Feature.listFromString("*v"));
		assertTrue(Feature.listFromString("").isEmpty());
	}

	@Test(expectedExceptions = MgsemError.class)
	public void grammarWithoutStartSymbols()
	{
		GrammarReader.read(new StringReader("{\"lexicon\": []}"));
	}

	@Test(expectedExceptions = MgsemError.class)
	public void incompleteLexicalEntry()
	{
		GrammarReader.read(new StringReader("{\"startSymbols\": [\"c\"], \"lexicon\": [{\"token\": \"bob\", \"features\": \"-d\"}]}"));
	}

	@Test(expectedExceptions = MgsemError.class)
	public void badFeature()
	{
		GrammarReader.read(new StringReader("{\"startSymbols\": [\"c\"], \"lexicon\": [{\"token\": \"bob\", \"features\": \"d\", \"formula\": \"bob\"}]}"));
	}

	@Test(expectedExceptions = MgsemError.class)
	public void unknownProperty()
	{
		GrammarReader.read(new StringReader("{\"startSymbols\": [\"c\"], \"rules\": []}"));
	}

	@Test(expectedExceptions = MgsemError.class)
	public void malformedJson()
	{
		ModelReader.read(new StringReader("{\"entities\": [\"alice\""));
	}

	@Test(expectedExceptions = MgsemError.class)
	public void badRelationPair()
	{
		ModelReader.read(new StringReader("{\"events\": [\"e\"], \"relations\": {\"int\": [[\"e\"]]}}"));
	}
}
