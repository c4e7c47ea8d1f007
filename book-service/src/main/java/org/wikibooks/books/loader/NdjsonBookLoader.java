package org.wikibooks.books.loader;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.google.gson.Strictness;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.wikibooks.core.model.BookField;
import org.wikibooks.core.model.BookRecord;
import org.wikibooks.core.model.BookRecordBuilder;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads book records from a newline-delimited JSON file.
 *
 * <p>Each non-blank line is parsed on its own. A line is either a JSON object with the book fields, or a
 * {@code [key, object]} pair as produced by the Wikipedia extraction dump. Lines that cannot be parsed are
 * logged and skipped; they never abort the load.</p>
 */
public class NdjsonBookLoader {
	private static final Logger logger = LoggerFactory.getLogger(NdjsonBookLoader.class);
	private static final char BYTE_ORDER_MARK = '\uFEFF';

	private final Path source;

	public NdjsonBookLoader(Path source) {
		this.source = source;
	}

	/**
	 * Loads all parseable records in file order.
	 *
	 * @return the records plus the count of skipped lines; empty when the file does not exist
	 * @throws IOException if the file exists but cannot be read
	 */
	public LoadResult load() throws IOException {
		if (!Files.exists(source)) {
			logger.warn("Data file not found: {}. Serving an empty collection.", source);
			return LoadResult.empty(source);
		}
		if (!Files.isRegularFile(source)) {
			throw new IOException("Data source is not a regular file: " + source);
		}

		List<BookRecord> records = new ArrayList<>();
		int skipped = 0;
		int lineNumber = 0;

		// InputStreamReader replaces undecodable bytes instead of failing the whole read
		try (BufferedReader reader = new BufferedReader(
				new InputStreamReader(Files.newInputStream(source), StandardCharsets.UTF_8))) {
			String line;
			while ((line = reader.readLine()) != null) {
				lineNumber++;
				if (lineNumber == 1 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
					line = line.substring(1);
				}
				if (line.isBlank()) {
					continue;
				}
				try {
					records.add(parseLine(line));
				} catch (BookFormatException e) {
					skipped++;
					logger.warn("Skipping line {} of {}: {}", lineNumber, source, e.getMessage());
				}
			}
		}

		logger.info("Loaded {} books from {} ({} malformed lines skipped)", records.size(), source, skipped);
		return new LoadResult(source, records, skipped);
	}

	/**
	 * Parses a single data source line into a record.
	 *
	 * @throws BookFormatException if the line is not valid JSON or not in an accepted shape
	 */
	public static BookRecord parseLine(String line) throws BookFormatException {
		JsonElement root;
		boolean consumed;
		// strict: unquoted keys, single quotes and trailing commas are malformed lines, not records
		try (JsonReader reader = new JsonReader(new StringReader(line))) {
			reader.setStrictness(Strictness.STRICT);
			root = JsonParser.parseReader(reader);
			consumed = reader.peek() == JsonToken.END_DOCUMENT;
		} catch (JsonParseException | IOException e) {
			throw new BookFormatException("Invalid JSON: " + e.getMessage(), e);
		}
		if (!consumed) {
			throw new BookFormatException("Unexpected content after JSON value");
		}
		return toRecord(unwrap(root));
	}

	private static JsonObject unwrap(JsonElement root) throws BookFormatException {
		if (root.isJsonObject()) {
			return root.getAsJsonObject();
		}
		if (root.isJsonArray()) {
			JsonArray pair = root.getAsJsonArray();
			if (pair.size() >= 2 && pair.get(1).isJsonObject()) {
				return pair.get(1).getAsJsonObject();
			}
			throw new BookFormatException("Expected [key, object] pair, got array of " + pair.size() + " elements");
		}
		throw new BookFormatException("Expected a JSON object or [key, object] pair");
	}

	private static BookRecord toRecord(JsonObject object) {
		BookRecordBuilder builder = new BookRecordBuilder();
		for (BookField field : BookField.values()) {
			builder.set(field, asText(object.get(field.key())));
		}
		return builder.build();
	}

	private static String asText(JsonElement element) {
		if (element == null || element.isJsonNull()) {
			return null;
		}
		if (element.isJsonPrimitive()) {
			return element.getAsString();
		}
		return element.toString();
	}
}
