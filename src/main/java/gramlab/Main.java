package gramlab;

import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Logger;

import gramlab.coverage.CoverageChecker;
import gramlab.coverage.CoverageReport;
import gramlab.diagnostics.DependencyGraph;
import gramlab.diagnostics.DiagnosticPipe;
import gramlab.diagnostics.GrammarChecker;
import gramlab.grammar.FirstFollowAnalyzer;
import gramlab.grammar.Grammar;
import gramlab.grammar.GrammarBuilder;
import gramlab.grammar.random.SentenceGenerator;
import gramlab.util.Utils;

/**
 * Command line interface.
 *
 * <pre>
 *   analyze FILE              nullable, FIRST and FOLLOW sets
 *   check FILE                diagnostics, exit status 1 if there are errors
 *   generate FILE [COUNT]     random example sentences
 *   graph FILE                dependencies between the non terminals
 *   coverage GRAMMAR SOURCE   lines of SOURCE with tokens GRAMMAR doesn't know
 * </pre>
 */
public class Main {

	private static final Logger LOG = Logger.getLogger(Main.class.getName());

	private static final List<String> COMMANDS = Arrays.asList("analyze", "check", "generate", "graph", "coverage");

	private static final String USAGE = "Usage: gramlab analyze FILE | check FILE | generate FILE [COUNT] | graph FILE | coverage GRAMMAR SOURCE";

	public static void main(String[] args) {
		int status;
		try {
			status = run(args, Config.load(), System.out);
		} catch (GramLabException ex){
			LOG.severe(ex.getMessage());
			status = 1;
		}
		System.exit(status);
	}

	/**
	 * Run a command
	 *
	 * @return exit status
	 * @throws GramLabException if a file can't be read or the arguments are invalid
	 */
	public static int run(String[] args, Config config, PrintStream out){
		if (args.length < 2){
			out.println(USAGE);
			return 1;
		}
		String command = args[0];
		if (!COMMANDS.contains(command)){
			throw new GramLabException(String.format("Unknown command \"%s\"\n%s", command, USAGE));
		}
		String text = readGrammar(args[1]);
		switch (command){
			case "analyze": {
				Grammar grammar = GrammarBuilder.build(text);
				out.println(grammar.longDescription());
				out.print(FirstFollowAnalyzer.analyze(grammar).format());
				return 0;
			}
			case "check": {
				DiagnosticPipe diagnostics = GrammarChecker.diagnose(text);
				if (!diagnostics.isEmpty()){
					out.println(diagnostics.toLongString());
				}
				out.println(diagnostics.isEmpty() ? "No problems found" : diagnostics.toString());
				return diagnostics.hasErrors() ? 1 : 0;
			}
			case "generate": {
				int count = args.length > 2 ? parseCount(args[2]) : config.getSamples();
				SentenceGenerator generator = new SentenceGenerator(config.createRandom());
				List<String> samples = generator.generateSamples(text, count, config.getStartSymbol(), config.getMaxDepth());
				out.println(SentenceGenerator.formatSamples(samples));
				return 0;
			}
			case "graph": {
				for (String edge : DependencyGraph.of(GrammarBuilder.build(text)).edges()) {
					out.println(edge);
				}
				return 0;
			}
			case "coverage": {
				if (args.length < 3){
					throw new GramLabException("coverage needs a grammar file and a source file");
				}
				CoverageReport report = CoverageChecker.check(text, Utils.readFile(Paths.get(args[2])));
				for (CoverageReport.UncoveredLine line : report.getUncoveredLines()) {
					out.println(line);
				}
				out.println(report);
				return 0;
			}
			default:
				throw new GramLabException(String.format("Unknown command \"%s\"", command));
		}
	}

	private static String readGrammar(String file){
		String text = Utils.readFile(Paths.get(file));
		if (!GrammarBuilder.looksLikeGrammar(text)){
			LOG.warning(String.format("\"%s\" doesn't look like a grammar (no start declaration or no rule)", file));
		}
		return text;
	}

	private static int parseCount(String count){
		try {
			int ret = Integer.parseInt(count);
			if (ret < 1){
				throw new GramLabException("COUNT has to be at least 1");
			}
			return ret;
		} catch (NumberFormatException e) {
			throw new GramLabException(String.format("Invalid COUNT \"%s\"", count), e);
		}
	}
}
