package gramlab;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class ConfigTest {

	@Test
	public void testDefaults(){
		Config config = Config.defaults();
		assertEquals(6, config.getMaxDepth());
		assertEquals(10, config.getSamples());
		assertEquals("start", config.getStartSymbol());
		assertNull(config.getSeed());
	}

	@Test
	public void testParse(){
		Config config = Config.parse("# settings\nmaxDepth = 3\nseed=42\nunknown = value\nno assignment");
		assertEquals(3, config.getMaxDepth());
		assertEquals(10, config.getSamples());
		assertEquals(Long.valueOf(42), config.getSeed());
		assertEquals(config.createRandom().nextInt(), Config.parse("seed = 42").createRandom().nextInt());
	}

	@ParameterizedTest
	@ValueSource(strings = {"maxDepth = abc", "maxDepth = -1", "samples = 0", "seed = often"})
	public void testInvalidValues(String content){
		assertThrows(GramLabException.class, () -> Config.parse(content));
	}

	@Test
	public void testLoad(@TempDir Path dir) throws IOException {
		Path file = dir.resolve(Config.CONFIG_FILE);
		assertEquals(10, Config.load(file).getSamples());
		Files.write(file, "samples = 3\nstartSymbol = Program".getBytes(StandardCharsets.UTF_8));
		Config config = Config.load(file);
		assertEquals(3, config.getSamples());
		assertEquals("Program", config.getStartSymbol());
	}
}
