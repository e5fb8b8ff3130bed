package gramlab;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.logging.Logger;

/**
 * Settings of the command line tool, read from <code>key = value</code> lines.
 *
 * Known keys: <code>maxDepth</code>, <code>samples</code>, <code>startSymbol</code> and <code>seed</code>
 * (a number or <code>random</code>).
 */
public class Config {

	private static final Logger LOG = Logger.getLogger(Config.class.getName());

	public static final String CONFIG_FILE = "gramlab.ini";

	private static final Map<String, String> DEFAULTS = new HashMap<String, String>(){{
		put("maxDepth", "6");
		put("samples", "10");
		put("startSymbol", "start");
		put("seed", "random");
	}};

	private final Map<String, String> config = new HashMap<>(DEFAULTS);

	private Config(){
	}

	public static Config defaults(){
		return new Config();
	}

	/**
	 * Load the config file from the working directory, use the defaults if it doesn't exist.
	 */
	public static Config load(){
		return load(Paths.get(CONFIG_FILE));
	}

	public static Config load(Path file){
		if (!Files.exists(file)){
			return defaults();
		}
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
			return parse(reader);
		} catch (IOException e) {
			throw new GramLabException(String.format("Can't read config file \"%s\": %s", file, e.getMessage()), e);
		}
	}

	public static Config parse(String content){
		try {
			return parse(new StringReader(content));
		} catch (IOException e) {
			throw new GramLabException("Can't read config", e);
		}
	}

	/**
	 * Parse <code>key = value</code> lines, other lines are ignored and unknown keys are logged.
	 *
	 * @throws GramLabException if a numeric setting has an invalid value
	 */
	public static Config parse(Reader input) throws IOException {
		Config config = new Config();
		BufferedReader reader = input instanceof BufferedReader ? (BufferedReader)input : new BufferedReader(input);
		String line;
		while ((line = reader.readLine()) != null){
			int index = line.indexOf('=');
			if (line.trim().startsWith("#") || index == -1){
				continue;
			}
			String key = line.substring(0, index).trim();
			String value = line.substring(index + 1).trim();
			if (DEFAULTS.containsKey(key)){
				config.config.put(key, value);
			} else {
				LOG.warning(String.format("Unknown config key \"%s\"", key));
			}
		}
		config.validate();
		return config;
	}

	private void validate(){
		if (getMaxDepth() < 0){
			throw new GramLabException("maxDepth has to be at least 0");
		}
		if (getSamples() < 1){
			throw new GramLabException("samples has to be at least 1");
		}
		getSeed();
	}

	public int getMaxDepth(){
		return intValue("maxDepth");
	}

	public int getSamples(){
		return intValue("samples");
	}

	public String getStartSymbol(){
		return config.get("startSymbol");
	}

	/**
	 * @return seed or null if the seed should be random
	 */
	public Long getSeed(){
		String seed = config.get("seed");
		if (seed.equalsIgnoreCase("random") || seed.isEmpty()){
			return null;
		}
		try {
			return Long.parseLong(seed);
		} catch (NumberFormatException e) {
			throw new GramLabException(String.format("Invalid seed \"%s\", expected a number or \"random\"", seed), e);
		}
	}

	/**
	 * Random source for the generator, seeded if a seed is configured
	 */
	public Random createRandom(){
		Long seed = getSeed();
		return seed == null ? new Random() : new Random(seed);
	}

	private int intValue(String key){
		String value = config.get(key);
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new GramLabException(String.format("Invalid value \"%s\" for %s, expected a number", value, key), e);
		}
	}

	@Override
	public String toString() {
		return config.toString();
	}
}
