package gramlab.util;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import gramlab.GramLabException;

/**
 * Class with utility methods...
 */
public class Utils {

	/**
	 * Joins the string representations of several objects passed via a list.
	 *
	 * @param strs passed list of objects
	 * @param separator separator between those representations
	 * @param <T> type of the passed objects
	 * @return joined string
	 */
	public static <T> String join(Collection<T> strs, String separator){
		return strs.stream().map(Object::toString).collect(Collectors.joining(separator));
	}

	/**
	 * Sorted copy of the passed collection
	 */
	public static <T extends Comparable<? super T>> List<T> sorted(Collection<T> collection){
		List<T> list = new ArrayList<>(collection);
		Collections.sort(list);
		return list;
	}

	/**
	 * Read the passed UTF-8 file
	 *
	 * @throws GramLabException if the file can't be read
	 */
	public static String readFile(Path path){
		try {
			return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new GramLabException(String.format("Can't read file \"%s\": %s", path, e.getMessage()), e);
		}
	}
}
