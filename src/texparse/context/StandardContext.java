package texparse.context;

import org.apache.commons.io.IOUtils;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import texparse.parser.DelimitedVerbatimParser;
import texparse.state.EnterMathMode;
import texparse.state.LeaveMathMode;
import texparse.state.ParsingStateDelta;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * The bundled context database, read from the {@code texparse/standard-context.json} resource.
 *
 * <p>The resource holds a {@code categories} array. Each category has a {@code name} and
 * optional {@code macros}, {@code environments} and {@code specials} arrays. Every entry has a
 * {@code name} (or {@code chars} for specials) and optional {@code args}: either a shorthand
 * string such as {@code "[{"} or an array whose elements are descriptors or objects with
 * {@code spec}, {@code name} and {@code mode} ({@code "text"} or {@code "math"}). Environments
 * may set {@code math} to true and {@code body} to {@code "verbatim"}. A macro with
 * {@code "parser": "verbatim"} reads a delimited verbatim argument, like {@code \verb|x|}.</p>
 */
public final class StandardContext {

	private static final Logger logger = Logger.getLogger("TeXParse Context");

	public static final String RESOURCE = "/texparse/standard-context.json";

	private static LatexContextDb defaultDb;

	private StandardContext() {
	}

	/**
	 * @return the shared, frozen standard context database
	 */
	public static synchronized LatexContextDb getDefault() {
		if (defaultDb == null) {
			LatexContextDb db = load();
			db.freeze();
			defaultDb = db;
		}
		return defaultDb;
	}

	/**
	 * @return a fresh, not yet frozen copy of the standard context database, for callers that
	 * want to add categories of their own
	 */
	public static LatexContextDb load() {
		JSONObject json;
		try (InputStream stream = StandardContext.class.getResourceAsStream(RESOURCE)) {
			if (stream == null) {
				throw new IllegalStateException("missing resource " + RESOURCE);
			}
			json = new JSONObject(IOUtils.toString(stream, StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException("could not read " + RESOURCE, e);
		}
		LatexContextDb db = new LatexContextDb();
		readCategories(db, json);
		db.setUnknownMacroSpec(new MacroSpec(""));
		db.setUnknownEnvironmentSpec(new EnvironmentSpec(""));
		logger.fine("loaded standard context with categories " + db.categories());
		return db;
	}

	/**
	 * Adds every category described by {@code json} to {@code db}, in order.
	 */
	public static void readCategories(LatexContextDb db, JSONObject json) throws JSONException {
		JSONArray categories = json.getJSONArray("categories");
		for (int i = 0; i < categories.length(); ++i) {
			readCategory(db, categories.getJSONObject(i));
		}
	}

	public static void readCategory(LatexContextDb db, JSONObject category) throws JSONException {
		List<MacroSpec> macros = new ArrayList<>();
		List<EnvironmentSpec> environments = new ArrayList<>();
		List<SpecialsSpec> specials = new ArrayList<>();

		JSONArray macroEntries = category.optJSONArray("macros");
		if (macroEntries != null) {
			for (int i = 0; i < macroEntries.length(); ++i) {
				macros.add(readMacro(macroEntries.getJSONObject(i)));
			}
		}
		JSONArray environmentEntries = category.optJSONArray("environments");
		if (environmentEntries != null) {
			for (int i = 0; i < environmentEntries.length(); ++i) {
				environments.add(readEnvironment(environmentEntries.getJSONObject(i)));
			}
		}
		JSONArray specialsEntries = category.optJSONArray("specials");
		if (specialsEntries != null) {
			for (int i = 0; i < specialsEntries.length(); ++i) {
				JSONObject entry = specialsEntries.getJSONObject(i);
				specials.add(new SpecialsSpec(entry.getString("chars"), readArguments(entry)));
			}
		}
		db.addContextCategory(category.getString("name"), macros, environments, specials);
	}

	private static MacroSpec readMacro(JSONObject entry) throws JSONException {
		String name = entry.getString("name");
		if ("verbatim".equals(entry.optString("parser"))) {
			return new MacroSpec(name, Collections.singletonList(
					new ArgumentSpec(new DelimitedVerbatimParser(), "verbatim_text", null)));
		}
		return new MacroSpec(name, readArguments(entry));
	}

	private static EnvironmentSpec readEnvironment(JSONObject entry) throws JSONException {
		String name = entry.getString("name");
		List<ArgumentSpec> arguments = readArguments(entry);
		String body = entry.optString("body", "latex");
		switch (body) {
			case "latex":
				return new EnvironmentSpec(name, arguments, entry.optBoolean("math", false));
			case "verbatim":
				return EnvironmentSpec.verbatim(name, arguments);
			default:
				throw new JSONException("unknown body kind ‘" + body + "’ for environment ‘" + name + "’");
		}
	}

	private static List<ArgumentSpec> readArguments(JSONObject entry) throws JSONException {
		Object args = entry.opt("args");
		if (args == null) {
			return Collections.emptyList();
		}
		if (args instanceof String) {
			return ArgumentSpec.parseShorthand((String) args);
		}
		JSONArray array = entry.getJSONArray("args");
		List<ArgumentSpec> specs = new ArrayList<>();
		for (int i = 0; i < array.length(); ++i) {
			Object arg = array.get(i);
			if (arg instanceof String) {
				specs.add(new ArgumentSpec((String) arg));
			} else {
				JSONObject obj = array.getJSONObject(i);
				specs.add(new ArgumentSpec(obj.getString("spec"), obj.optString("name", null),
						readMode(obj.optString("mode", null))));
			}
		}
		return specs;
	}

	private static ParsingStateDelta readMode(String mode) throws JSONException {
		if (mode == null) {
			return null;
		}
		switch (mode) {
			case "text":
				return new LeaveMathMode();
			case "math":
				return new EnterMathMode(null, null);
			default:
				throw new JSONException("unknown argument mode ‘" + mode + "’");
		}
	}
}
