package edu.stanford.nlp.mgsem;

import com.google.common.collect.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Agenda-driven chart parser for a Minimalist Grammar with merge and insert. Parsing is greedy: for each agenda item
 * only the first operator application found (in the fixed order of {@link #operators}) is kept, and the parser keeps
 * rewriting that result depth-first. It is therefore not an exhaustive parser, and a sentence that needs a different
 * local choice is not recognized.
 */
public class Parser
{
	public static class Options
	{
		// 1: log results and chart sizes, 2: log every combination, 3: log every agenda item
		public int verbose = 0;
		// Spell out the accepted entry once more before returning it
		public boolean finalSpellout = true;
	}

	public static Options opts = new Options();

	private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

	public final Grammar grammar;
	public final DerivationContext context;

	final SpelloutFn spellout;
	// In order of priority.
	final ImmutableList<CombinationFn> operators;

	public Parser(final Grammar grammar)
	{
		this(grammar, DerivationContext.getGlobal());
	}

	public Parser(final Grammar grammar_, final DerivationContext context_)
	{
		grammar = grammar_;
		context = context_;
		spellout = new SpelloutFn(context);
		operators = ImmutableList.of(new InsertAdjunctFn(), spellout, new MergeCompFn(), new MergeSpecFn(), new MergeNonfinalFn(), new InsertFn());
	}

	// Return the accepted chart entry, or null if |input| is not recognized.
	public ChartEntry parse(final String input)
	{
		final ParserState state = new ParserState(this, Tokenizer.tokenize(input));
		if (!state.initialize())
		{
			if (opts.verbose >= 1)
				LOG.info("No lexical entry for some token of '{}'", input);
			return null;
		}
		state.infer();

		final ChartEntry accepted = state.getAccepted();
		if (opts.verbose >= 1)
			LOG.info("Parsed '{}': chart size {}, {}", input, state.chartSize(), accepted == null ? "no parse" : accepted.formula());
		if (accepted == null || !opts.finalSpellout)
			return accepted;
		final ChartEntry spelled = spellout.combine(accepted, context);
		return spelled != null ? spelled : accepted;
	}

	public boolean recognize(final String input)
	{
		return parse(input) != null;
	}

	public boolean verbose(final int level)
	{
		return opts.verbose >= level;
	}
}
