package gramlab.grammar;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class FirstFollowAnalyzerTest {

	private static final String CLASSIC = "start: E\n" +
			"E -> T E2\n" +
			"E2 -> '+' T E2 | ε\n" +
			"T -> 'id'";

	@Test
	public void testClassicGrammar(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build(CLASSIC));
		assertEquals(set(Symbol.nonTerminal("E2")), sets.getNullable());
		assertEquals(set(Symbol.terminal("'id'")), sets.first("E"));
		assertEquals(set(Symbol.terminal("'id'")), sets.first("T"));
		assertEquals(set(Symbol.EPSILON, Symbol.terminal("'+'")), sets.first("E2"));
		assertEquals(set(Symbol.END_OF_INPUT), sets.follow("E"));
		assertEquals(set(Symbol.END_OF_INPUT), sets.follow("E2"));
		assertEquals(set(Symbol.END_OF_INPUT, Symbol.terminal("'+'")), sets.follow("T"));
	}

	@Test
	public void testFormat(){
		String formatted = FirstFollowAnalyzer.analyze(GrammarBuilder.build(CLASSIC)).format();
		assertTrue(formatted.startsWith("Nullable: {E2}\n"), formatted);
		assertTrue(formatted.contains("  E2: {ε, '+'}\n"), formatted);
		assertTrue(formatted.contains("  T: {$, '+'}\n"), formatted);
	}

	@Test
	public void testNullableChain(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build("start: S\nS -> A B 'c'\nA -> ε\nB -> 'b' | ε"));
		assertTrue(sets.isNullable("A"));
		assertTrue(sets.isNullable("B"));
		assertFalse(sets.isNullable("S"));
		assertEquals(set(Symbol.terminal("'b'"), Symbol.terminal("'c'")), sets.first("S"));
		assertEquals(set(Symbol.terminal("'b'"), Symbol.terminal("'c'")), sets.follow("A"));
		assertEquals(set(Symbol.terminal("'c'")), sets.follow("B"));
	}

	@Test
	public void testLeftRecursionTerminates(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build("start: E\nE -> E '+' T | T\nT -> 'id'"));
		assertEquals(set(Symbol.terminal("'id'")), sets.first("E"));
		assertEquals(set(Symbol.END_OF_INPUT, Symbol.terminal("'+'")), sets.follow("E"));
	}

	@Test
	public void testUndefinedNonTerminalHasEmptyFirstSet(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build("start: S\nS -> A 'x'"));
		assertTrue(sets.getFirst().containsKey(Symbol.nonTerminal("A")));
		assertTrue(sets.first("A").isEmpty());
		assertEquals(set(Symbol.terminal("'x'")), sets.follow("A"));
		assertTrue(sets.first("S").isEmpty());
	}

	@Test
	public void testEmptyGrammar(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build(""));
		assertTrue(sets.getNullable().isEmpty());
		assertTrue(sets.getFirst().isEmpty());
		assertTrue(sets.getFollow().isEmpty());
		assertEquals("Nullable: ∅\nFIRST:\nFOLLOW:\n", sets.format());
	}

	@Test
	public void testStartWithoutProductions(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build("start: S"));
		assertTrue(sets.follow("S").isEmpty());
		assertEquals("Nullable: ∅\nFIRST:\n  S: ∅\nFOLLOW:\n  S: ∅\n", sets.format());
	}

	@Test
	public void testFirstOfSequence(){
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(GrammarBuilder.build(CLASSIC));
		assertEquals(set(Symbol.terminal("'+'"), Symbol.terminal("'id'")),
				sets.firstOf(Arrays.asList(Symbol.nonTerminal("E2"), Symbol.nonTerminal("T"))));
		assertEquals(set(Symbol.EPSILON), sets.firstOf(Collections.emptyList()));
	}

	@ParameterizedTest
	@ValueSource(strings = {
			CLASSIC,
			"start: S\nS -> A B 'c'\nA -> ε\nB -> 'b' | ε",
			"start: E\nE -> E '+' T | T\nT -> 'id' | '(' E ')'",
			"A -> B\nB -> A | 'x'",
			""
	})
	public void testIdempotence(String text){
		Grammar grammar = GrammarBuilder.build(text);
		FirstFollowSets sets = FirstFollowAnalyzer.analyze(grammar);
		assertEquals(sets, FirstFollowAnalyzer.analyze(grammar));
		assertEquals(sets, FirstFollowAnalyzer.analyze(GrammarBuilder.build(print(grammar))));
	}

	/**
	 * Text of the passed grammar that builds an equivalent grammar
	 */
	private static String print(Grammar grammar){
		StringBuilder builder = new StringBuilder();
		if (grammar.hasStart()){
			builder.append("start: ").append(grammar.getStart()).append("\n");
		}
		for (Production production : grammar.getProductions()) {
			builder.append(production.left).append(" -> ").append(production.formatRightSide()).append("\n");
		}
		return builder.toString();
	}

	private static Set<Symbol> set(Symbol... symbols){
		return Arrays.stream(symbols).collect(Collectors.toCollection(LinkedHashSet::new));
	}
}
