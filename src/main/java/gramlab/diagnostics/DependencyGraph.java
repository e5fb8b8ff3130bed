package gramlab.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.jgrapht.Graph;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.traverse.DepthFirstIterator;

import gramlab.grammar.Grammar;
import gramlab.grammar.Production;
import gramlab.grammar.Symbol;

/**
 * Directed graph of the non terminals of a grammar, with an edge A → B if some production of A
 * mentions B on its right hand side.
 */
public class DependencyGraph {

	private final Graph<String, DefaultEdge> graph;

	private DependencyGraph(Graph<String, DefaultEdge> graph) {
		this.graph = graph;
	}

	public static DependencyGraph of(Grammar grammar){
		Graph<String, DefaultEdge> graph = new DefaultDirectedGraph<>(DefaultEdge.class);
		for (Symbol nonTerminal : grammar.getNonTerminals()) {
			graph.addVertex(nonTerminal.name);
		}
		for (Production production : grammar.getProductions()) {
			for (Symbol nonTerminal : production.nonTerminals) {
				if (!graph.containsEdge(production.left.name, nonTerminal.name)){
					graph.addEdge(production.left.name, nonTerminal.name);
				}
			}
		}
		return new DependencyGraph(graph);
	}

	/**
	 * Non terminals reachable from the passed one (including itself), in depth first order.
	 *
	 * @return empty set if the graph doesn't contain the non terminal
	 */
	public Set<String> reachableFrom(String nonTerminal){
		Set<String> reached = new LinkedHashSet<>();
		if (!graph.containsVertex(nonTerminal)){
			return reached;
		}
		DepthFirstIterator<String, DefaultEdge> iterator = new DepthFirstIterator<>(graph, nonTerminal);
		while (iterator.hasNext()){
			reached.add(iterator.next());
		}
		return reached;
	}

	public Set<String> successors(String nonTerminal){
		Set<String> ret = new LinkedHashSet<>();
		if (graph.containsVertex(nonTerminal)){
			for (DefaultEdge edge : graph.outgoingEdgesOf(nonTerminal)) {
				ret.add(graph.getEdgeTarget(edge));
			}
		}
		return ret;
	}

	/**
	 * Sorted edges of the form <code>A -> B</code>
	 */
	public List<String> edges(){
		List<String> edges = new ArrayList<>();
		for (DefaultEdge edge : graph.edgeSet()) {
			edges.add(graph.getEdgeSource(edge) + " -> " + graph.getEdgeTarget(edge));
		}
		Collections.sort(edges);
		return edges;
	}

	public Set<String> vertices(){
		return Collections.unmodifiableSet(graph.vertexSet());
	}
}
