package gramlab.grammar.random;

import java.util.List;
import java.util.Random;

import gramlab.util.Pair;

/**
 * Synthesizes sample values for terminal kinds and makes all random choices of the generator.
 *
 * All randomness comes from the passed {@link Random}, seed it for reproducible samples.
 */
public class SampleValues {

	private final Random random;

	public SampleValues(Random random) {
		this.random = random;
	}

	/**
	 * Identifier <code>x0</code> to <code>x99</code>
	 */
	public String identifier(){
		return "x" + random.nextInt(100);
	}

	/**
	 * Number 1 to 9
	 */
	public String number(){
		return String.valueOf(1 + random.nextInt(9));
	}

	/**
	 * Double quoted string <code>"s0"</code> to <code>"s9"</code>
	 */
	public String string(){
		return "\"s" + random.nextInt(10) + "\"";
	}

	/**
	 * Uniform random number in [0, bound)
	 */
	public int nextInt(int bound){
		return random.nextInt(bound);
	}

	public boolean chance(double probability){
		return random.nextDouble() < probability;
	}

	public <T> T pick(List<T> elements){
		return elements.get(random.nextInt(elements.size()));
	}

	/**
	 * Pick an element with a probability proportional to its (positive) weight
	 */
	public <T> T pickWeighted(List<Pair<T, Integer>> weighted){
		int total = 0;
		for (Pair<T, Integer> pair : weighted) {
			total += pair.second;
		}
		int randomNum = random.nextInt(total);
		int sum = 0;
		for (Pair<T, Integer> pair : weighted) {
			sum += pair.second;
			if (randomNum < sum){
				return pair.first;
			}
		}
		return weighted.get(weighted.size() - 1).first;
	}
}
