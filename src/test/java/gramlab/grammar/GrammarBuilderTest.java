package gramlab.grammar;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class GrammarBuilderTest {

	private static final String EXPRESSIONS = String.join("\n",
			"// simple expressions",
			"start: E;",
			"",
			"E -> T E2",
			"E2 -> '+' T E2 | ε",
			"T -> 'id' | '(' E ')'");

	@Test
	public void testBuild(){
		Grammar grammar = GrammarBuilder.build(EXPRESSIONS);
		assertEquals(Symbol.nonTerminal("E"), grammar.getStart());
		assertEquals(5, grammar.getProductions().size());
		assertEquals(Arrays.asList(Symbol.nonTerminal("E"), Symbol.nonTerminal("E2"), Symbol.nonTerminal("T")),
				new ArrayList<>(grammar.getDefinedNonTerminals()));
		assertTrue(grammar.getUndefinedNonTerminals().isEmpty());
	}

	@Test
	public void testProductionsKeepTheirLine(){
		Grammar grammar = GrammarBuilder.build(EXPRESSIONS);
		List<Production> e2 = grammar.getProductionsOf("E2");
		assertEquals(2, e2.size());
		assertEquals(4, e2.get(0).line);
		assertEquals(4, e2.get(1).line);
		assertTrue(e2.get(1).isEpsilonProduction());
		assertEquals("ε", e2.get(1).formatRightSide());
	}

	@Test
	public void testEmptyAlternativeIsEpsilon(){
		Grammar grammar = GrammarBuilder.build("A -> 'a' |");
		assertEquals(2, grammar.getProductions().size());
		assertTrue(grammar.getProductions().get(1).isEpsilonProduction());
	}

	@Test
	public void testEpsilonIsRemovedFromSequences(){
		Grammar grammar = GrammarBuilder.build("A -> 'a' ε 'b'");
		assertEquals(Arrays.asList(Symbol.terminal("'a'"), Symbol.terminal("'b'")), grammar.getProductions().get(0).right);
	}

	@Test
	public void testQuotedBarStaysOneToken(){
		Grammar grammar = GrammarBuilder.build("A -> 'a|b' c");
		assertEquals(1, grammar.getProductions().size());
		assertEquals(Arrays.asList(Symbol.terminal("'a|b'"), Symbol.terminal("c")), grammar.getProductions().get(0).right);
	}

	@Test
	public void testNonTerminalBetweenQuotedLiterals(){
		Grammar grammar = GrammarBuilder.build("start: T\nT -> '('E')'");
		assertEquals(Arrays.asList(Symbol.terminal("'('"), Symbol.nonTerminal("E"), Symbol.terminal("')'")),
				grammar.getProductions().get(0).right);
		assertTrue(grammar.getUndefinedNonTerminals().contains(Symbol.nonTerminal("E")));
	}

	@Test
	public void testWithoutStartDeclaration(){
		Grammar grammar = GrammarBuilder.build("B -> 'b'\nA -> B");
		assertEquals(Symbol.nonTerminal("B"), grammar.getStart());
	}

	@Test
	public void testEmptyText(){
		Grammar grammar = GrammarBuilder.build("");
		assertTrue(grammar.isEmpty());
		assertFalse(grammar.hasStart());
		assertTrue(grammar.getNonTerminals().isEmpty());
	}

	@Test
	public void testUnknownLinesAreSkipped(){
		Grammar grammar = GrammarBuilder.build("A ->\nsomething else\nA -> 'a'");
		assertEquals(1, grammar.getProductions().size());
	}

	@Test
	public void testProgrammaticBuilder(){
		Grammar grammar = new GrammarBuilder().start("S").add("S", "A", "'x'").add("A", "").toGrammar();
		assertEquals(2, grammar.getProductions().size());
		assertTrue(grammar.getProductionsOf("A").get(0).isEpsilonProduction());
		assertEquals(-1, grammar.getProductions().get(0).line);
		assertTrue(grammar.getProductions().get(0).nonTerminals.contains(Symbol.nonTerminal("A")));
		assertTrue(grammar.getProductions().get(0).terminals.contains(Symbol.terminal("'x'")));
	}

	@Nested
	class LooksLikeGrammar {

		@Test
		public void testGrammar(){
			assertTrue(GrammarBuilder.looksLikeGrammar(EXPRESSIONS));
			assertTrue(GrammarBuilder.looksLikeGrammar("Start : S\nS -> 'a'"));
		}

		@Test
		public void testMissingStart(){
			assertFalse(GrammarBuilder.looksLikeGrammar("S -> 'a'"));
		}

		@Test
		public void testMissingRule(){
			assertFalse(GrammarBuilder.looksLikeGrammar("start: S"));
			assertFalse(GrammarBuilder.looksLikeGrammar("start: s\ns -> 'a'"));
		}

		@Test
		public void testOtherText(){
			assertFalse(GrammarBuilder.looksLikeGrammar("int main() { return 0; }"));
			assertFalse(GrammarBuilder.looksLikeGrammar(null));
		}
	}
}
