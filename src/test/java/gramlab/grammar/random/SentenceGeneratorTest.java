package gramlab.grammar.random;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class SentenceGeneratorTest {

	private static final String EXPRESSIONS = "start: Expr\n" +
			"Expr -> AddExpr\n" +
			"AddExpr -> Factor AddExprTail\n" +
			"AddExprTail -> '+' Factor AddExprTail | ε\n" +
			"Factor -> ID | NUM | '(' Expr ')'";

	private static final String PROGRAM = "start: StmtList\n" +
			"StmtList -> Stmt StmtList | ε\n" +
			"Stmt -> ID '=' NUM";

	private static SentenceGenerator generator(long seed){
		return new SentenceGenerator(new Random(seed));
	}

	@ParameterizedTest
	@ValueSource(ints = {0, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10})
	public void testTerminationForAllDepths(int maxDepth){
		String[] grammars = {
				"",
				EXPRESSIONS,
				PROGRAM,
				"A -> A",
				"A -> B\nB -> A",
				"E -> E '+' T | E '*' T | T\nT -> 'id'",
				"S -> S S | S | ε"
		};
		assertTimeoutPreemptively(Duration.ofSeconds(10), () -> {
			for (String grammar : grammars) {
				for (int seed = 0; seed < 20; seed++) {
					assertNotNull(generator(seed).generate(grammar, "start", maxDepth));
				}
			}
		});
	}

	@Test
	public void testSameSeedSameSentence(){
		for (int seed = 0; seed < 10; seed++) {
			assertEquals(generator(seed).generate(EXPRESSIONS), generator(seed).generate(EXPRESSIONS));
		}
	}

	@Test
	public void testEmptyGrammar(){
		assertTrue(generator(1).generate("").matches("x\\d{1,2}"));
	}

	@Test
	public void testQuotedLiteralsAreUnquoted(){
		assertEquals("a b", generator(1).generate("S -> 'a' 'b'"));
	}

	@Test
	public void testBareTerminalsAreVerbatim(){
		assertEquals("a b c", generator(1).generate("S -> a B c\nB -> 'b'"));
	}

	@Test
	public void testNonEpsilonAlternativesArePreferred(){
		for (int seed = 0; seed < 10; seed++) {
			assertEquals("x y", generator(seed).generate("S -> 'x' T\nT -> 'y' | ε"));
		}
	}

	@Test
	public void testPatternLiteral(){
		assertTrue(generator(1).generate("S -> /[a-z]+/").matches("\"s\\d\""));
	}

	@Test
	public void testLowerCaseStartRule(){
		assertEquals("a", generator(1).generate("start -> 'a' AddExprTail\nAddExprTail -> '+' 'b' AddExprTail | ε",
				"start", 0));
	}

	@Test
	public void testStartIsMatchedIgnoringCase(){
		assertEquals("b", generator(1).generate("A -> 'a'\nB -> 'b'", "b", 6));
	}

	@Test
	public void testFirstRuleIsTheFallbackStart(){
		assertEquals("a", generator(1).generate("start: Foo\nA -> 'a'", "start", 6));
		assertEquals("a", generator(1).generate("start: B\nA -> 'a'\nB -> 'b'", "start", 6));
	}

	@Test
	public void testLeftRecursionIsLeftBehind(){
		for (int seed = 0; seed < 50; seed++) {
			String sentence = generator(seed).generate("E -> E '+' T | T\nT -> 'id'", "E", 6);
			assertTrue(sentence.matches("id( \\+ id)*"), sentence);
		}
	}

	@Test
	public void testMaxDepthZeroUsesMinimalSamples(){
		String sentence = generator(3).generate("start: S\nS -> Inner\nInner -> 'deep'", "S", 0);
		assertTrue(sentence.matches("x\\d{1,2}"), sentence);
	}

	@Nested
	class ExpressionGrammars {

		@Test
		public void testTerminalKinds(){
			for (int seed = 0; seed < 20; seed++) {
				String sentence = generator(seed).generate("S -> ID '=' NUM ';' STR", "S", 6);
				assertTrue(sentence.matches("x\\d{1,2} = [1-9]; \"s\\d\""), sentence);
			}
		}

		@Test
		public void testFactorIsAnAtom(){
			for (int seed = 0; seed < 50; seed++) {
				String sentence = generator(seed).generate("Expr -> Factor", "Expr", 6);
				assertTrue(sentence.matches("x\\d{1,2}|[1-9]|\"s\\d\""), sentence);
			}
		}

		@Test
		public void testExpressions(){
			for (int seed = 0; seed < 50; seed++) {
				String sentence = generator(seed).generate(EXPRESSIONS);
				assertFalse(sentence.isEmpty());
				assertFalse(sentence.matches(".*\\(\\s*(x\\d+|\\d+)\\s*\\).*"), sentence);
				assertEquals(sentence.trim(), sentence);
			}
		}

		@Test
		public void testProgram(){
			for (int seed = 0; seed < 20; seed++) {
				String[] statements = generator(seed).generate(PROGRAM).split("\n");
				assertTrue(statements.length >= SentenceGenerator.MIN_STATEMENTS);
				assertTrue(statements.length <= SentenceGenerator.MAX_STATEMENTS);
				for (String statement : statements) {
					assertTrue(statement.matches("x\\d{1,2} = [1-9];"), statement);
				}
			}
		}

		@ParameterizedTest
		@CsvSource({"0, a", "1, a b", "6, a b b b b b b"})
		public void testTailsVanishBeyondTheDepth(int maxDepth, String expected){
			assertEquals(expected, generator(2).generate("S -> 'a' XTail\nXTail -> 'b' XTail", "S", maxDepth));
		}
	}

	@Test
	public void testGenericPolicy(){
		SentenceGenerator generator = new SentenceGenerator(new Random(2), GenerationPolicy.generic());
		String sentence = generator.generate("S -> 'a' XTail\nXTail -> 'b' XTail", "S", 0);
		assertTrue(sentence.matches("a x\\d{1,2}"), sentence);
		assertTrue(generator.generate("S -> ID", "S", 6).matches("x\\d{1,2}"));
	}

	@Test
	public void testSamples(){
		List<String> samples = generator(4).generateSamples(EXPRESSIONS, 5, "start", 6);
		assertEquals(5, samples.size());
		String formatted = SentenceGenerator.formatSamples(samples);
		assertTrue(formatted.startsWith("// Generated examples (5)\n\n"));
		assertEquals(7, formatted.split("\n", -1).length);
	}
}
